package com.example.cvpipeline.service;

import com.example.cvpipeline.model.AchievementAnnotation;
import com.example.cvpipeline.model.JobContext;
import com.example.cvpipeline.model.RoleRecord;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Deterministic relevance of a bullet to the job context. The model's own opinion of relevance is
 * never used, so selection is reproducible.
 */
@Component
public class RelevanceScorer {

    static final double BASE = 1.0;
    static final double KEYWORD_MATCH = 1.0;
    static final double PAIN_POINT_MATCH = 0.75;
    static final double METRIC_PRESENT = 0.25;
    static final double CORE_STRENGTH = 0.5;

    public double score(RoleRecord role, int sourceIndex, String text, String matchedPainPoint, JobContext context) {
        double score = BASE;

        long keywordHits = context.targetKeywords().stream()
                .filter(k -> TextSimilarity.containsPhrase(text, k))
                .count();
        if (keywordHits > 0) {
            score += KEYWORD_MATCH + 0.25 * (keywordHits - 1);
        }

        if (matchedPainPoint != null && context.painPoints().stream()
                .anyMatch(p -> p.equalsIgnoreCase(matchedPainPoint.strip()))) {
            score += PAIN_POINT_MATCH;
        }

        for (Map.Entry<String, Double> competency : context.competencyWeights().entrySet()) {
            if (TextSimilarity.containsPhrase(text, competency.getKey()) && competency.getValue() != null) {
                score += competency.getValue();
            }
        }

        if (!MetricExtractor.extract(text).isEmpty()) {
            score += METRIC_PRESENT;
        }

        for (AchievementAnnotation annotation : context.annotations()) {
            if (annotation.matches(role.roleId(), sourceIndex)) {
                score += annotation.boost();
                if (annotation.coreStrength()) {
                    score += CORE_STRENGTH;
                }
            }
        }
        return Math.round(score * 10_000.0) / 10_000.0;
    }

    /** First target keyword the text actually contains, or null. */
    public String matchedKeyword(String text, String claimedKeyword, JobContext context) {
        if (claimedKeyword != null && TextSimilarity.containsPhrase(text, claimedKeyword)) {
            return context.targetKeywords().stream()
                    .filter(k -> k.equalsIgnoreCase(claimedKeyword.strip()))
                    .findFirst()
                    .orElse(claimedKeyword.strip());
        }
        return context.targetKeywords().stream()
                .filter(k -> TextSimilarity.containsPhrase(text, k))
                .findFirst()
                .orElse(null);
    }
}
