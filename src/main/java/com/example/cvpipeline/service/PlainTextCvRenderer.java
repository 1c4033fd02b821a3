package com.example.cvpipeline.service;

import com.example.cvpipeline.model.CandidateBullet;
import com.example.cvpipeline.model.CvDraft;
import com.example.cvpipeline.model.GroundedSkill;
import com.example.cvpipeline.model.HeaderSection;
import com.example.cvpipeline.model.RoleRecord;
import com.example.cvpipeline.model.SkillCategory;
import com.example.cvpipeline.model.StitchedDocument;
import com.example.cvpipeline.model.StitchedRole;
import com.example.cvpipeline.model.SummarySentence;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a draft as plain text. No markup survives: every piece of text passes through
 * {@link MarkupSanitizer} on the way out.
 * <pre>
 * PROFILE
 * ...
 *
 * CORE COMPETENCIES
 * Leadership: Mentorship, Hiring
 *
 * PROFESSIONAL EXPERIENCE
 *
 * Acme Corp | Staff Engineer | 2021 - present
 * • Led migration to new platform, cutting costs 30%
 * </pre>
 */
@Component
public class PlainTextCvRenderer {

    static final String PROFILE = "PROFILE";
    static final String COMPETENCIES = "CORE COMPETENCIES";
    static final String EXPERIENCE = "PROFESSIONAL EXPERIENCE";
    static final String BULLET = "• ";

    public CvDraft draft(StitchedDocument document, HeaderSection header) {
        String text = render(document, header);
        return new CvDraft(document, header, text, WordCounter.count(text));
    }

    public String render(StitchedDocument document, HeaderSection header) {
        StringBuilder sb = new StringBuilder();
        String headerBlock = renderHeader(header);
        if (!headerBlock.isEmpty()) {
            sb.append(headerBlock).append("\n\n");
        }
        sb.append(EXPERIENCE).append('\n');
        for (StitchedRole role : document.roles()) {
            sb.append('\n').append(roleHeading(role.role())).append('\n');
            for (CandidateBullet bullet : role.bullets()) {
                sb.append(BULLET).append(MarkupSanitizer.strip(bullet.text())).append('\n');
            }
        }
        return sb.toString().strip() + "\n";
    }

    public String renderHeader(HeaderSection header) {
        if (header == null) return "";
        List<String> blocks = new ArrayList<>();
        if (!header.summary().isEmpty()) {
            blocks.add(PROFILE + "\n" + header.summary().stream()
                    .map(SummarySentence::text)
                    .map(MarkupSanitizer::strip)
                    .collect(Collectors.joining(" ")));
        }
        if (!header.skills().isEmpty()) {
            StringBuilder skills = new StringBuilder(COMPETENCIES);
            for (SkillCategory category : header.skills()) {
                skills.append('\n').append(category.name()).append(": ")
                        .append(category.skills().stream()
                                .map(GroundedSkill::name)
                                .map(MarkupSanitizer::strip)
                                .collect(Collectors.joining(", ")));
            }
            blocks.add(skills.toString());
        }
        return String.join("\n\n", blocks);
    }

    public String roleHeading(RoleRecord role) {
        StringBuilder sb = new StringBuilder(MarkupSanitizer.strip(role.employer()))
                .append(" | ").append(MarkupSanitizer.strip(role.title()));
        if (!role.period().isBlank()) sb.append(" | ").append(MarkupSanitizer.strip(role.period()));
        if (!role.location().isBlank()) sb.append(" | ").append(MarkupSanitizer.strip(role.location()));
        return sb.toString();
    }

    /** Words the header block and section titles add on top of the experience body. */
    public int reservedWords(HeaderSection header) {
        return WordCounter.count(renderHeader(header)) + WordCounter.count(EXPERIENCE);
    }
}
