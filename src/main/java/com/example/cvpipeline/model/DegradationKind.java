package com.example.cvpipeline.model;

/**
 * Guarantees a run may relax instead of failing.
 */
public enum DegradationKind {
    ROLE_SKIPPED,
    BUDGET_UNATTAINABLE,
    HEADER_FALLBACK,
    GRADING_FALLBACK,
    ITERATION_CAP_REACHED,
    DEADLINE_EXCEEDED
}
