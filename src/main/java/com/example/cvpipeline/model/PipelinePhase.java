package com.example.cvpipeline.model;

/**
 * Pipeline phases in execution order. A run only ever moves forward through them.
 */
public enum PipelinePhase {
    CREATED,
    LOADING,
    GENERATING,
    STITCHING,
    COMPOSING_HEADER,
    GRADING,
    COMPLETED
}
