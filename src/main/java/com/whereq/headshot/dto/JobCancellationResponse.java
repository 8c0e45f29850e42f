package com.whereq.headshot.dto;

import com.whereq.headshot.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for job cancellation
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobCancellationResponse {
    /**
     * Job identifier
     */
    private String jobId;

    /**
     * False when the job had already reached a terminal state
     */
    private boolean success;

    /**
     * Status after the request. An active job stays in its current status until the worker
     * reaches the next variant boundary.
     */
    private JobStatus status;

    /**
     * When the cancellation was requested
     */
    private Instant cancelledAt;

    /**
     * Cancellation message
     */
    private String message;
}
