package com.whereq.headshot.queue;

import com.whereq.headshot.model.QueuedJob;

import java.util.List;
import java.util.Optional;

/**
 * Jobs waiting for a worker slot, ordered by priority then submission time
 */
public interface JobQueue {
    /**
     * Enqueue a job. A job id may be queued at most once.
     *
     * @param job the queue entry
     * @return false if the job id was already queued
     */
    boolean enqueue(QueuedJob job);

    /**
     * Next job to admit, without removing it
     */
    Optional<QueuedJob> peekNext();

    /**
     * Remove a job, on admission or cancellation
     *
     * @param jobId the job identifier
     * @return true if the job was queued and is now removed
     */
    boolean remove(String jobId);

    /**
     * 1-based position in admission order, or 0 if not queued
     */
    int positionOf(String jobId);

    int size();

    /**
     * Largest size the queue has reached
     */
    int highWaterMark();

    /**
     * Entries in admission order
     */
    List<QueuedJob> snapshot();
}
