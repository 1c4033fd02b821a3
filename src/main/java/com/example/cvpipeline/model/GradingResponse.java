package com.example.cvpipeline.model;

import com.fasterxml.jackson.annotation.JsonPropertyDescription;

import java.util.List;

/**
 * Structured model output of the grader. The overall score is not requested; it is computed in code.
 */
public record GradingResponse(List<DimensionDraft> dimensions, List<FlaggedSection> flaggedSections) {

    public record DimensionDraft(
            String dimension,
            @JsonPropertyDescription("Score from 0 to 10")
            Double score,
            List<String> issues
    ) {}
}
