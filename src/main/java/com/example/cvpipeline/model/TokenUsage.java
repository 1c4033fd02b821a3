package com.example.cvpipeline.model;

/**
 * Tokens consumed by a run, split by the model used for generation and for grading.
 */
public record TokenUsage(long generationTokens, long gradingTokens) {

    public long totalTokens() {
        return generationTokens + gradingTokens;
    }
}
