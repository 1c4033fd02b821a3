package com.example.cvpipeline.model;

/**
 * States of the grade/improve loop.
 */
public enum LoopState {
    DRAFTED,
    GRADED,
    REVISING,
    ACCEPTED,
    ITERATION_CAP_REACHED;

    public boolean isTerminal() {
        return this == ACCEPTED || this == ITERATION_CAP_REACHED;
    }
}
