package com.example.cvpipeline.controller;

import com.example.cvpipeline.exception.LoadException;
import com.example.cvpipeline.exception.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps fatal pipeline failures to structured JSON errors.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<Map<String, String>> pipelineFailed(PipelineException e) {
        log.error("Pipeline failed ({}): {}", e.getKind(), e.getMessage());
        return unprocessable(e.getKind().name(), e.getMessage());
    }

    @ExceptionHandler(LoadException.class)
    public ResponseEntity<Map<String, String>> loadFailed(LoadException e) {
        log.error("Corpus could not be loaded ({}): {}", e.getKind(), e.getMessage());
        return unprocessable(e.getKind().name(), e.getMessage());
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<Map<String, String>> unexpected(RuntimeException e) {
        log.error("Unexpected error during CV generation", e);
        return ResponseEntity.internalServerError().body(Map.of(
                "error", "Error during CV generation",
                "message", e.getMessage() != null ? e.getMessage() : "Unknown error"));
    }

    private static ResponseEntity<Map<String, String>> unprocessable(String kind, String message) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(Map.of(
                "error", kind,
                "message", message != null ? message : ""));
    }
}
