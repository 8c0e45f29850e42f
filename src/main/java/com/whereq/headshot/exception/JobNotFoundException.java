package com.whereq.headshot.exception;

/**
 * Unknown job id, or a job the caller does not own
 */
public class JobNotFoundException extends RuntimeException {
    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
    }
}
