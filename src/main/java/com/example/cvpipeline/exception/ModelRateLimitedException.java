package com.example.cvpipeline.exception;

public class ModelRateLimitedException extends TransientModelException {

    public ModelRateLimitedException(String message, Throwable cause) {
        super(message, cause);
    }
}
