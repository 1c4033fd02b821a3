package com.example.cvpipeline.exception;

/**
 * Raised when the corpus cannot be turned into role records.
 */
public class LoadException extends RuntimeException {

    public enum Kind {
        NO_ROLE_RECORDS,
        EMPTY_ROLE,
        MALFORMED_RECORD,
        SOURCE_UNAVAILABLE
    }

    private final Kind kind;

    public LoadException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public LoadException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
