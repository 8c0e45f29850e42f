package com.whereq.headshot.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Incremental change flushed to the job store by the executor, cancellation and recovery paths.
 * Null fields are left untouched.
 */
@Value
@Builder
public class JobProgressUpdate {
    JobStatus status;
    Integer progress;
    String currentStep;
    VariantOutcome appendVariant;
    Instant startedAt;
    Instant completedAt;
    Instant estimatedCompletion;
    Long processingTimeSeconds;
    BatchResults results;
    String errorDetails;
    Boolean cancelRequested;

    public static JobProgressUpdate terminal(JobStatus status, Instant completedAt, String errorDetails) {
        return JobProgressUpdate.builder()
            .status(status)
            .completedAt(completedAt)
            .errorDetails(errorDetails)
            .build();
    }
}
