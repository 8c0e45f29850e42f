package com.whereq.headshot.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Comparator;

/**
 * Queue entry for a job waiting for a worker slot. Exists only while the job is QUEUED.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueuedJob {

    /**
     * Priority first, then submission time, then insertion sequence as a tie-breaker
     */
    public static final Comparator<QueuedJob> ADMISSION_ORDER = Comparator
        .comparingInt((QueuedJob q) -> q.getPriority().getRank())
        .thenComparing(QueuedJob::getSubmittedAt)
        .thenComparingLong(QueuedJob::getSequence);

    private String jobId;
    private JobPriority priority;
    private Instant submittedAt;

    /**
     * Assigned by the queue on insertion
     */
    private long sequence;

    public static QueuedJob of(BatchJob job) {
        return QueuedJob.builder()
            .jobId(job.getId())
            .priority(job.getPriority())
            .submittedAt(job.getCreatedAt())
            .build();
    }
}
