package com.example.cvpipeline.exception;

/**
 * Fatal pipeline failure: no CV can be produced.
 */
public class PipelineException extends RuntimeException {

    public enum Kind {
        /** The corpus yielded no role records. */
        NO_ROLE_RECORDS,
        /** Every role failed generation or validation. */
        ALL_ROLES_FAILED,
        /** The run deadline passed before any role produced usable bullets. */
        DEADLINE_EXCEEDED
    }

    private final Kind kind;

    public PipelineException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PipelineException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
