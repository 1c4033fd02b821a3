package com.example.cvpipeline.exception;

import java.util.List;

/**
 * Model output that could not be parsed or broke the expected schema.
 */
public class SchemaValidationException extends RuntimeException {

    private final List<String> violations;

    public SchemaValidationException(List<String> violations) {
        super("Schema violations: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public SchemaValidationException(String violation, Throwable cause) {
        super("Schema violations: " + violation, cause);
        this.violations = List.of(violation);
    }

    public List<String> getViolations() {
        return violations;
    }
}
