package com.example.cvpipeline.service;

import com.example.cvpipeline.model.AtsReport;
import com.example.cvpipeline.model.CandidateBullet;
import com.example.cvpipeline.model.CvDraft;
import com.example.cvpipeline.model.JobContext;
import com.example.cvpipeline.model.KeywordPlacement;
import com.example.cvpipeline.model.SummarySentence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Checks the final CV text the way an applicant tracking system reads it (no LLM).
 * <p>
 * Keywords match as whole phrases, case-insensitively, the same way the bullet validator matches them.
 * A keyword seen more than {@value #MAX_OCCURRENCES} times counts as stuffing.
 */
@Component
public class AtsKeywordChecker {

    private static final Logger log = LoggerFactory.getLogger(AtsKeywordChecker.class);

    static final int MAX_OCCURRENCES = 4;

    public AtsReport check(CvDraft draft, JobContext context) {
        List<String> keywords = context.targetKeywords().stream()
                .filter(k -> k != null && !k.isBlank())
                .toList();
        if (keywords.isEmpty()) return AtsReport.empty();

        String summary = draft.header().summary().stream()
                .map(SummarySentence::text)
                .collect(Collectors.joining(" "));
        String competencies = String.join(", ", draft.header().skillNames());
        String firstRole = draft.document().roles().isEmpty() ? "" : draft.document().roles().get(0).bullets()
                .stream()
                .map(CandidateBullet::text)
                .collect(Collectors.joining("\n"));

        List<KeywordPlacement> placements = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        boolean stuffed = false;
        boolean buried = false;
        for (String keyword : keywords) {
            Pattern pattern = TextSimilarity.phrasePattern(keyword);
            int occurrences = count(pattern, draft.text());
            KeywordPlacement placement = KeywordPlacement.of(keyword, occurrences,
                    pattern.matcher(summary).find(),
                    pattern.matcher(competencies).find(),
                    pattern.matcher(firstRole).find());
            placements.add(placement);

            if (occurrences == 0) {
                missing.add(keyword);
                warnings.add("'" + keyword + "' does not appear in the CV");
            } else if (occurrences > MAX_OCCURRENCES) {
                stuffed = true;
                warnings.add("'" + keyword + "' appears " + occurrences + " times, more than " + MAX_OCCURRENCES);
            }
            if (occurrences > 0 && !placement.inTopThird()) {
                buried = true;
                warnings.add("'" + keyword + "' only appears in the experience section");
            }
        }

        double coverage = Math.round(100.0 * (keywords.size() - missing.size()) / keywords.size()) / 100.0;
        int placementScore = (int) Math.round(placements.stream()
                .mapToInt(KeywordPlacement::score)
                .average()
                .orElse(0));
        boolean passed = missing.isEmpty() && !stuffed && !buried;

        log.info("ATS check: coverage={} placement={} passed={}", coverage, placementScore, passed);
        warnings.forEach(w -> log.warn("ATS: {}", w));
        return new AtsReport(coverage, missing, placements, placementScore, warnings, passed);
    }

    private static int count(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) count++;
        return count;
    }
}
