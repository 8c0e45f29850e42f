package com.whereq.headshot.store;

import com.whereq.headshot.model.BatchJob;
import com.whereq.headshot.model.JobProgressUpdate;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Durable record of batch jobs. Implementations hand out detached copies; callers change a
 * record only through {@link #updateProgress(String, JobProgressUpdate)}.
 */
public interface JobStore {
    /**
     * Persist a new job
     *
     * @param job the job, with id and createdAt set
     * @return Mono with the stored job
     */
    Mono<BatchJob> create(BatchJob job);

    /**
     * Apply an incremental update. Updates to a terminal job leave it unchanged.
     *
     * @param jobId the job identifier
     * @param update the change to apply
     * @return Mono with the job after the update, or an error if the job does not exist
     */
    Mono<BatchJob> updateProgress(String jobId, JobProgressUpdate update);

    /**
     * @return Mono with the job, or empty if unknown
     */
    Mono<BatchJob> get(String jobId);

    /**
     * Jobs whose status is not terminal, oldest first
     */
    Flux<BatchJob> listNonTerminal();

    /**
     * Jobs submitted by an owner, newest first
     */
    Flux<BatchJob> listByOwner(String ownerId, int limit);
}
