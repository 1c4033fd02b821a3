package com.example.cvpipeline.exception;

/**
 * Model call failure that may succeed if retried.
 */
public class TransientModelException extends RuntimeException {

    public TransientModelException(String message) {
        super(message);
    }

    public TransientModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
