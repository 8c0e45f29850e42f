package com.whereq.headshot.exception;

/**
 * Failure outside the per-variant isolation boundary, e.g. the job store is unreachable or the
 * source image cannot be validated. Terminates the job as FAILED.
 */
public class InfrastructureException extends RuntimeException {
    public InfrastructureException(String message) {
        super(message);
    }

    public InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
