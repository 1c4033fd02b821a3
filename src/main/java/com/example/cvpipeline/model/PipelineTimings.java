package com.example.cvpipeline.model;

/**
 * Per-phase timing for one run (in seconds).
 *
 * @param loadingSeconds       corpus loading and parsing
 * @param generationSeconds    parallel per-role generation and validation
 * @param stitchingSeconds     stitching, budget top-up and header composition
 * @param gradingSeconds       grade/improve loop
 */
public record PipelineTimings(
        double loadingSeconds,
        double generationSeconds,
        double stitchingSeconds,
        double gradingSeconds
) {
    public double totalSeconds() {
        return loadingSeconds + generationSeconds + stitchingSeconds + gradingSeconds;
    }
}
