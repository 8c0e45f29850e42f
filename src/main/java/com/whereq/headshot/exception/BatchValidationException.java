package com.whereq.headshot.exception;

import java.util.List;

/**
 * Malformed batch submission. Returned to the caller synchronously, never retried.
 */
public class BatchValidationException extends RuntimeException {

    private final List<String> errors;

    public BatchValidationException(List<String> errors) {
        super("Batch job validation failed: " + String.join(", ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
