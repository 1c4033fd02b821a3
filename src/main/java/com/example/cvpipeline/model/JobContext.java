package com.example.cvpipeline.model;

import java.util.List;
import java.util.Map;

/**
 * Target job description digest the CV is tailored to. Read-only input.
 *
 * @param title             target job title
 * @param targetKeywords    ATS keywords, most important first
 * @param painPoints        problems the employer wants solved
 * @param competencyWeights competency name to weight
 * @param annotations       per-achievement boosts
 * @param roleOrder         optional explicit role order (role ids); empty means recency order
 */
public record JobContext(
        String title,
        List<String> targetKeywords,
        List<String> painPoints,
        Map<String, Double> competencyWeights,
        List<AchievementAnnotation> annotations,
        List<String> roleOrder
) {
    public JobContext {
        title = title != null ? title : "";
        targetKeywords = targetKeywords != null ? List.copyOf(targetKeywords) : List.of();
        painPoints = painPoints != null ? List.copyOf(painPoints) : List.of();
        competencyWeights = competencyWeights != null ? Map.copyOf(competencyWeights) : Map.of();
        annotations = annotations != null ? List.copyOf(annotations) : List.of();
        roleOrder = roleOrder != null ? List.copyOf(roleOrder) : List.of();
    }

    public static JobContext of(String title, List<String> targetKeywords) {
        return new JobContext(title, targetKeywords, List.of(), Map.of(), List.of(), List.of());
    }
}
