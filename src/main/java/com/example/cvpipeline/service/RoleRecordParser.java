package com.example.cvpipeline.service;

import com.example.cvpipeline.exception.LoadException;
import com.example.cvpipeline.model.RawRoleRecord;
import com.example.cvpipeline.model.RoleRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the corpus text format into a {@link RoleRecord}.
 * <pre>
 * Employer: Acme Corp
 * Title: Staff Engineer
 * Period: 2021 - present
 * Location: Berlin
 * Skills: Java, Kafka, Kubernetes
 *
 * - Led migration to new platform, cut costs 30%
 * - Mentored 3 engineers
 * </pre>
 * Achievement lines may be prefixed with {@code -}, {@code *}, {@code •} or {@code 1.}; markdown
 * headings and horizontal rules are ignored, emphasis is stripped.
 */
@Component
public class RoleRecordParser {

    private static final Pattern HEADER = Pattern.compile(
            "^\\s*(employer|company|title|position|period|dates|location|skills)\\s*:\\s*(.*)$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern BULLET_PREFIX = Pattern.compile("^\\s*(?:[-*•]|\\d+[.)])\\s+");
    private static final Pattern RULE = Pattern.compile("^\\s*([-*_=])\\1{2,}\\s*$");
    private static final Pattern ROLE_ID_PREFIX = Pattern.compile("^\\d+[_\\-. ]+");

    public RoleRecord parse(RawRoleRecord raw) {
        String employer = null;
        String title = null;
        String period = "";
        String location = "";
        List<String> skills = new ArrayList<>();
        List<String> achievements = new ArrayList<>();

        String content = raw.content() != null ? raw.content() : "";
        for (String line : content.split("\\R")) {
            if (line.isBlank() || line.stripLeading().startsWith("#") || RULE.matcher(line).matches()) {
                continue;
            }
            Matcher bullet = BULLET_PREFIX.matcher(line);
            boolean bulleted = bullet.find();
            String body = bulleted ? line.substring(bullet.end()) : line;
            String clean = MarkupSanitizer.strip(body);
            if (clean.isEmpty()) continue;

            Matcher header = HEADER.matcher(clean);
            if (!bulleted && header.matches()) {
                String value = header.group(2).strip();
                switch (header.group(1).toLowerCase(Locale.ROOT)) {
                    case "employer", "company" -> employer = value;
                    case "title", "position" -> title = value;
                    case "period", "dates" -> period = value;
                    case "location" -> location = value;
                    case "skills" -> Arrays.stream(value.split("[,;|]"))
                            .map(String::strip)
                            .filter(s -> !s.isEmpty())
                            .forEach(skills::add);
                    default -> { }
                }
                continue;
            }
            achievements.add(clean);
        }

        if (employer == null || employer.isBlank() || title == null || title.isBlank()) {
            throw new LoadException(LoadException.Kind.MALFORMED_RECORD,
                    "Role record '" + raw.sourceName() + "' lacks an Employer or Title line");
        }
        if (achievements.isEmpty()) {
            throw new LoadException(LoadException.Kind.EMPTY_ROLE,
                    "Role record '" + raw.sourceName() + "' has no achievements");
        }
        return new RoleRecord(roleIdFor(raw.sourceName(), employer), employer, title, period, location,
                raw.recencyRank(), achievements, skills);
    }

    /**
     * Derives a stable id from the source name ({@code 01_acme-corp.md} becomes {@code acme-corp}),
     * falling back to the employer.
     */
    static String roleIdFor(String sourceName, String employer) {
        String base = sourceName != null ? sourceName : "";
        int dot = base.lastIndexOf('.');
        if (dot > 0) base = base.substring(0, dot);
        base = ROLE_ID_PREFIX.matcher(base).replaceFirst("");
        String id = slug(base);
        return id.isEmpty() ? slug(employer) : id;
    }

    private static String slug(String text) {
        return text.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-+|-+$)", "");
    }
}
