package com.whereq.headshot.dto;

import com.whereq.headshot.model.JobEstimates;
import com.whereq.headshot.model.JobPriority;
import com.whereq.headshot.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Response for batch job submission
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchJobSubmitResponse {
    /**
     * Unique job identifier
     */
    private String jobId;

    /**
     * Current job status
     */
    private JobStatus status;

    private String batchType;
    private List<String> styles;
    private int outputsPerVariant;
    private JobPriority priority;

    private JobEstimates estimates;

    /**
     * 1-based position in the queue at submission
     */
    private int queuePosition;

    /**
     * Estimated start time (if queued)
     */
    private Instant estimatedStartTime;

    /**
     * When the job was submitted
     */
    private Instant submittedAt;

    /**
     * Error message (if submission failed)
     */
    private String errorMessage;

    private List<String> errors;

    /**
     * Create error response
     */
    public static BatchJobSubmitResponse error(String message, List<String> errors) {
        return BatchJobSubmitResponse.builder()
            .errorMessage(message)
            .errors(errors)
            .submittedAt(Instant.now())
            .build();
    }
}
