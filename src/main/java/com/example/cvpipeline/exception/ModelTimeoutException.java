package com.example.cvpipeline.exception;

public class ModelTimeoutException extends TransientModelException {

    public ModelTimeoutException(String message) {
        super(message);
    }
}
