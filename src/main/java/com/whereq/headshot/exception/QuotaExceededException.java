package com.whereq.headshot.exception;

/**
 * Exception thrown when the job queue is full
 */
public class QuotaExceededException extends RuntimeException {
    public QuotaExceededException(String message) {
        super(message);
    }
}
