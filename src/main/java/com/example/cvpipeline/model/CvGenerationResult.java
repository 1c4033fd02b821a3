package com.example.cvpipeline.model;

import java.util.List;

/**
 * Outcome of one pipeline run.
 *
 * @param status       COMPLETED when every guarantee held, DEGRADED otherwise
 * @param text         plain-text CV
 * @param wordCount    words in {@code text}
 * @param grade        grade of exactly this text, null only if nothing could be graded
 * @param loopState    terminal state of the grade/improve loop
 * @param iterations   revisions performed
 * @param degradations relaxed guarantees, in the order they occurred
 * @param citations    bullet to source achievement map
 * @param ats          keyword coverage and placement of {@code text}
 * @param timings      per-phase timings
 * @param tokenUsage   model tokens consumed
 */
public record CvGenerationResult(
        RunStatus status,
        String text,
        int wordCount,
        GradeResult grade,
        LoopState loopState,
        int iterations,
        List<Degradation> degradations,
        List<CitationEntry> citations,
        AtsReport ats,
        PipelineTimings timings,
        TokenUsage tokenUsage
) {
    public CvGenerationResult {
        degradations = List.copyOf(degradations);
        citations = List.copyOf(citations);
    }

    public boolean hasDegradation(DegradationKind kind) {
        return degradations.stream().anyMatch(d -> d.kind() == kind);
    }
}
