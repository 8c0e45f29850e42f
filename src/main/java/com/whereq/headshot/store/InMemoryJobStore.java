package com.whereq.headshot.store;

import com.whereq.headshot.exception.JobNotFoundException;
import com.whereq.headshot.model.BatchJob;
import com.whereq.headshot.model.JobProgressUpdate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local job store for development and tests. Does not survive a restart.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "headshot.store.type", havingValue = "memory")
public class InMemoryJobStore implements JobStore {

    private final ConcurrentHashMap<String, BatchJob> jobs = new ConcurrentHashMap<>();

    @Override
    public Mono<BatchJob> create(BatchJob job) {
        return Mono.fromCallable(() -> {
            BatchJob stored = job.copy();
            if (jobs.putIfAbsent(stored.getId(), stored) != null) {
                throw new IllegalStateException("Job already exists: " + stored.getId());
            }
            return stored.copy();
        });
    }

    @Override
    public Mono<BatchJob> updateProgress(String jobId, JobProgressUpdate update) {
        return Mono.fromCallable(() -> {
            BatchJob updated = jobs.computeIfPresent(jobId, (id, current) -> {
                synchronized (current) {
                    if (!current.apply(update)) {
                        log.debug("Ignored update to terminal job {}", id);
                    }
                }
                return current;
            });
            if (updated == null) {
                throw new JobNotFoundException(jobId);
            }
            synchronized (updated) {
                return updated.copy();
            }
        });
    }

    @Override
    public Mono<BatchJob> get(String jobId) {
        return Mono.fromSupplier(() -> {
            BatchJob job = jobs.get(jobId);
            if (job == null) {
                return null;
            }
            synchronized (job) {
                return job.copy();
            }
        });
    }

    @Override
    public Flux<BatchJob> listNonTerminal() {
        return Flux.defer(() -> Flux.fromIterable(jobs.values()))
            .filter(job -> !job.getStatus().isTerminal())
            .map(this::snapshot)
            .sort(Comparator.comparing(BatchJob::getCreatedAt));
    }

    @Override
    public Flux<BatchJob> listByOwner(String ownerId, int limit) {
        return Flux.defer(() -> Flux.fromIterable(jobs.values()))
            .filter(job -> ownerId.equals(job.getOwnerId()))
            .map(this::snapshot)
            .sort(Comparator.comparing(BatchJob::getCreatedAt).reversed())
            .take(limit);
    }

    private BatchJob snapshot(BatchJob job) {
        synchronized (job) {
            return job.copy();
        }
    }
}
