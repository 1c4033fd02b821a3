package com.example.cvpipeline.model;

import com.fasterxml.jackson.annotation.JsonPropertyDescription;

import java.util.List;

/**
 * Structured model output of the role bullet generator.
 */
public record GeneratedBulletsResponse(List<GeneratedBullet> bullets) {

    public record GeneratedBullet(
            @JsonPropertyDescription("Plain-text bullet, at most 35 words, no markdown")
            String text,
            @JsonPropertyDescription("1-based index of the achievement the bullet is written from")
            Integer sourceIndex,
            @JsonPropertyDescription("Metric copied from the source achievement, or null")
            String metric,
            @JsonPropertyDescription("Target keyword the bullet covers, or null")
            String keyword,
            @JsonPropertyDescription("Pain point the bullet addresses, or null")
            String painPoint
    ) {}
}
