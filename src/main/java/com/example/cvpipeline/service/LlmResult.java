package com.example.cvpipeline.service;

/**
 * Outcome of a model call after retries.
 *
 * @param status   how the call ended
 * @param payload  parsed response when {@code status} is OK
 * @param error    last error message otherwise
 * @param attempts attempts made
 */
public record LlmResult<T>(Status status, T payload, String error, int attempts) {

    public enum Status {
        OK,
        VALIDATION_ERROR,
        TRANSIENT_ERROR,
        /** A failure retrying cannot fix, such as a client bug or a rejected request. */
        FAILED
    }

    public static <T> LlmResult<T> ok(T payload, int attempts) {
        return new LlmResult<>(Status.OK, payload, null, attempts);
    }

    public static <T> LlmResult<T> validationError(String error, int attempts) {
        return new LlmResult<>(Status.VALIDATION_ERROR, null, error, attempts);
    }

    public static <T> LlmResult<T> transientError(String error, int attempts) {
        return new LlmResult<>(Status.TRANSIENT_ERROR, null, error, attempts);
    }

    public static <T> LlmResult<T> failed(String error, int attempts) {
        return new LlmResult<>(Status.FAILED, null, error, attempts);
    }

    public boolean isOk() {
        return status == Status.OK;
    }
}
