package com.whereq.headshot.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.headshot.model.BatchResults;
import com.whereq.headshot.model.JobEstimates;
import com.whereq.headshot.model.JobPriority;
import com.whereq.headshot.model.JobStatus;
import com.whereq.headshot.model.VariantOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Response for job status query
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchJobStatusResponse {
    private String jobId;
    private String batchType;
    private JobStatus status;
    private JobPriority priority;

    /**
     * 0-100, reaches 100 only once completed
     */
    private int progress;

    private String currentStep;
    private List<String> requestedVariants;
    private List<VariantOutcome> completedVariants;

    /**
     * Only while queued
     */
    private Integer queuePosition;
    private Instant estimatedStartTime;

    /**
     * Only while processing
     */
    private Instant estimatedCompletion;

    private JobEstimates estimates;

    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
    private Long processingTimeSeconds;

    /**
     * Batch summary, once completed
     */
    private BatchResults results;

    private String errorDetails;
    private boolean cancelRequested;
}
