package com.example.cvpipeline.model;

import java.util.Comparator;
import java.util.List;

/**
 * Rubric evaluation of one draft.
 *
 * @param rubricVersion    version of the rubric used
 * @param dimensions       per-dimension scores
 * @param overallScore     weighted mean of the dimension scores, computed in code
 * @param passingThreshold score a draft needs to be accepted
 * @param flaggedSections  sections the grader wants revised
 * @param method           model grading or the rule-based fallback
 */
public record GradeResult(
        String rubricVersion,
        List<DimensionScore> dimensions,
        double overallScore,
        double passingThreshold,
        List<FlaggedSection> flaggedSections,
        GradingMethod method
) {
    public GradeResult {
        dimensions = List.copyOf(dimensions);
        flaggedSections = List.copyOf(flaggedSections);
    }

    public boolean accepted() {
        return overallScore >= passingThreshold && flaggedSections.isEmpty();
    }

    public DimensionScore lowestDimension() {
        return dimensions.stream()
                .min(Comparator.comparingDouble(DimensionScore::score).thenComparing(DimensionScore::dimension))
                .orElse(null);
    }
}
