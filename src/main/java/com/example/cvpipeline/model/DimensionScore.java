package com.example.cvpipeline.model;

import java.util.List;

/**
 * Score of one rubric dimension on a 0-10 scale.
 */
public record DimensionScore(String dimension, double score, double weight, List<String> issues) {

    public DimensionScore {
        issues = issues != null ? List.copyOf(issues) : List.of();
    }
}
