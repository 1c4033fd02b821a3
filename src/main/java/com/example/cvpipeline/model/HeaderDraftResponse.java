package com.example.cvpipeline.model;

import com.fasterxml.jackson.annotation.JsonPropertyDescription;

import java.util.List;

/**
 * Structured model output of the header composer.
 */
public record HeaderDraftResponse(List<DraftSentence> sentences, List<String> skills) {

    public record DraftSentence(
            String text,
            @JsonPropertyDescription("Ids of the bullets or achievements (roleId#index) this sentence rests on")
            List<String> citations
    ) {}
}
