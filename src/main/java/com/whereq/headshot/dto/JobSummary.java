package com.whereq.headshot.dto;

import com.whereq.headshot.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One line of a caller's job history
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobSummary {
    private String jobId;
    private String batchType;
    private JobStatus status;
    private int progress;
    private int variantCount;
    private int totalImagesGenerated;
    private Instant createdAt;
    private Instant completedAt;
}
