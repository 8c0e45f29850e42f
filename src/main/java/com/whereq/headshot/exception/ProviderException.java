package com.whereq.headshot.exception;

/**
 * A single generation call failed or timed out. Recorded against the variant, never fails the job.
 */
public class ProviderException extends RuntimeException {
    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
