package com.example.cvpipeline.service;

import com.example.cvpipeline.config.CvPipelineProperties;

import java.time.Duration;

/**
 * Retry and timeout policy for model calls.
 *
 * @param maxAttempts    total attempts, first call included
 * @param initialBackoff pause before the second attempt
 * @param multiplier     growth factor of the pause between attempts
 * @param maxBackoff     ceiling for a single pause
 * @param callTimeout    bound on a single model call
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier,
                          Duration maxBackoff, Duration callTimeout) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
    }

    public static RetryPolicy from(CvPipelineProperties.Llm llm) {
        return new RetryPolicy(llm.maxAttempts(), llm.initialBackoff(), llm.backoffMultiplier(),
                llm.maxBackoff(), llm.callTimeout());
    }

    /** Pause to take after the given failed attempt (1-based). */
    public Duration backoffAfter(int failedAttempt) {
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, failedAttempt - 1);
        return Duration.ofMillis((long) Math.min(millis, maxBackoff.toMillis()));
    }
}
