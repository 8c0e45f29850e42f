package com.whereq.headshot.scheduler;

import com.whereq.headshot.config.HeadshotProperties;
import com.whereq.headshot.model.ActiveJob;
import com.whereq.headshot.model.BatchJob;
import com.whereq.headshot.model.JobProgressUpdate;
import com.whereq.headshot.model.JobStatus;
import com.whereq.headshot.model.QueuedJob;
import com.whereq.headshot.provider.GenerationProvider;
import com.whereq.headshot.queue.JobQueue;
import com.whereq.headshot.store.JobStore;
import jakarta.annotation.PreDestroy;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Admission loop. Wakes on a fixed tick, or early when a job is submitted, and moves jobs from
 * the priority queue to workers while a slot is free.
 *
 * Every admission decision, queue removal and cancellation of a queued job happens under one
 * lock, so a job is never both queued and active. Executors run on the worker scheduler and never
 * block the loop.
 */
@Slf4j
@Component
public class BatchJobScheduler {

    static final String SHUTDOWN_DETAILS = "Server shutdown interrupted processing";

    private static final Duration PROVIDER_CANCEL_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration SHUTDOWN_POLL = Duration.ofMillis(200);

    private final JobQueue jobQueue;
    private final ActiveJobRegistry activeJobRegistry;
    private final BatchJobExecutor jobExecutor;
    private final GenerationProvider generationProvider;
    private final JobStore jobStore;
    private final Scheduler workerScheduler;
    private final Scheduler admissionScheduler;
    private final HeadshotProperties.BatchConfig config;
    private final Clock clock;

    private final Object admissionLock = new Object();
    private final Sinks.Many<Boolean> wakeups = Sinks.many().multicast().directBestEffort();
    private int reservedQueueSlots;
    private volatile Disposable loop;
    private volatile boolean accepting = true;

    public BatchJobScheduler(JobQueue jobQueue,
                             ActiveJobRegistry activeJobRegistry,
                             BatchJobExecutor jobExecutor,
                             GenerationProvider generationProvider,
                             JobStore jobStore,
                             @Qualifier("batchWorkerScheduler") Scheduler workerScheduler,
                             @Qualifier("batchAdmissionScheduler") Scheduler admissionScheduler,
                             HeadshotProperties properties,
                             Clock clock) {
        this.jobQueue = jobQueue;
        this.activeJobRegistry = activeJobRegistry;
        this.jobExecutor = jobExecutor;
        this.generationProvider = generationProvider;
        this.jobStore = jobStore;
        this.workerScheduler = workerScheduler;
        this.admissionScheduler = admissionScheduler;
        this.config = properties.getBatch();
        this.clock = clock;
    }

    /**
     * Start ticking. Called once recovery has rebuilt the queue.
     */
    public synchronized void start() {
        if (loop != null && !loop.isDisposed()) {
            return;
        }
        log.info("Starting batch scheduler: tick={}, max concurrent jobs={}",
            config.getTickInterval(), activeJobRegistry.getMaxConcurrentJobs());

        Flux<Boolean> ticks = Flux.interval(Duration.ZERO, config.getTickInterval(), admissionScheduler)
            .map(tick -> Boolean.TRUE);

        loop = Flux.merge(ticks, wakeups.asFlux())
            .onBackpressureDrop()
            .publishOn(admissionScheduler, 1)
            .doOnNext(signal -> safeTick())
            .doOnError(e -> log.error("Fatal error in scheduler loop", e))
            .retry() // Restart loop on fatal error
            .subscribe();
    }

    public boolean isRunning() {
        return loop != null && !loop.isDisposed();
    }

    /**
     * Hold a queue slot for a submission that is about to be persisted. Queued jobs and held
     * slots together never exceed the capacity.
     *
     * @return false if the queue is full
     */
    public boolean reserveQueueSlot(int maxQueueSize) {
        synchronized (admissionLock) {
            if (jobQueue.size() + reservedQueueSlots >= maxQueueSize) {
                return false;
            }
            reservedQueueSlots++;
            return true;
        }
    }

    /**
     * Give back a held slot whose submission was not persisted
     */
    public void releaseQueueSlot() {
        synchronized (admissionLock) {
            if (reservedQueueSlots > 0) {
                reservedQueueSlots--;
            }
        }
    }

    /**
     * Queue a newly submitted job in the slot held for it and wake the loop
     */
    public Enqueued enqueueReserved(BatchJob job) {
        Enqueued enqueued;
        synchronized (admissionLock) {
            if (reservedQueueSlots > 0) {
                reservedQueueSlots--;
            }
            jobQueue.enqueue(QueuedJob.of(job));
            int position = jobQueue.positionOf(job.getId());
            enqueued = new Enqueued(position, accepting && position <= activeJobRegistry.freeSlots());
        }
        wakeup();
        return enqueued;
    }

    /**
     * Queue a persisted QUEUED job and wake the loop
     *
     * @return the job's 1-based queue position
     */
    public int enqueue(BatchJob job) {
        int position;
        synchronized (admissionLock) {
            jobQueue.enqueue(QueuedJob.of(job));
            position = jobQueue.positionOf(job.getId());
        }
        wakeup();
        return position;
    }

    /**
     * Admit queued jobs while a worker slot is free
     *
     * @return number of jobs admitted
     */
    public int tick() {
        if (!accepting) {
            return 0;
        }

        List<ActiveJob> admitted = new ArrayList<>();
        synchronized (admissionLock) {
            while (activeJobRegistry.hasFreeSlot()) {
                Optional<QueuedJob> next = jobQueue.peekNext();
                if (next.isEmpty()) {
                    break;
                }
                QueuedJob entry = next.get();
                ActiveJob active = new ActiveJob(entry.getJobId(), clock.instant());
                if (!activeJobRegistry.tryRegister(active)) {
                    break;
                }
                jobQueue.remove(entry.getJobId());
                active.setCurrentStep(JobStatus.PREPROCESSING.getDescription());
                admitted.add(active);
            }
        }

        for (ActiveJob active : admitted) {
            dispatch(active);
        }
        if (!admitted.isEmpty()) {
            log.info("Admitted {} job(s), active {}/{}, queued {}", admitted.size(),
                activeJobRegistry.activeCount(), activeJobRegistry.getMaxConcurrentJobs(), jobQueue.size());
        }
        return admitted.size();
    }

    /**
     * Cancel a job that is queued or active
     *
     * @param jobId job identifier
     * @return what the scheduler did with the job
     */
    public CancelOutcome cancel(String jobId) {
        ActiveJob active;
        synchronized (admissionLock) {
            if (jobQueue.remove(jobId)) {
                log.info("Job {} removed from queue", jobId);
                return CancelOutcome.REMOVED_FROM_QUEUE;
            }
            active = activeJobRegistry.get(jobId).orElse(null);
            if (active == null) {
                return CancelOutcome.NOT_SCHEDULED;
            }
            active.requestCancel();
        }

        log.info("Active job {} marked for cancellation", jobId);
        String handle = active.getInFlightHandle().get();
        if (handle != null) {
            generationProvider.cancel(handle)
                .timeout(PROVIDER_CANCEL_TIMEOUT)
                .subscribe(
                    v -> { },
                    e -> log.warn("Failed to cancel provider call {} for job {}: {}", handle, jobId, e.getMessage()));
        }
        return CancelOutcome.SIGNALLED;
    }

    public int queuePosition(String jobId) {
        return jobQueue.positionOf(jobId);
    }

    public Optional<ActiveJob> activeJob(String jobId) {
        return activeJobRegistry.get(jobId);
    }

    /**
     * Stop admitting, give active jobs time to finish, then fail whatever is still running
     */
    @PreDestroy
    public void shutdown() {
        log.info("Shutting down batch scheduler");
        accepting = false;
        if (loop != null) {
            loop.dispose();
        }

        long deadline = clock.millis() + config.getShutdownTimeout().toMillis();
        while (activeJobRegistry.activeCount() > 0 && clock.millis() < deadline) {
            log.info("Waiting for {} active jobs to complete...", activeJobRegistry.activeCount());
            try {
                Thread.sleep(SHUTDOWN_POLL.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }

        List<ActiveJob> remaining = activeJobRegistry.snapshot();
        if (remaining.isEmpty()) {
            log.info("Batch scheduler shutdown completed");
            return;
        }

        log.warn("Forcing shutdown with {} active jobs", remaining.size());
        for (ActiveJob active : remaining) {
            active.requestCancel();
            try {
                jobStore.updateProgress(active.getJobId(),
                        JobProgressUpdate.terminal(JobStatus.FAILED, clock.instant(), SHUTDOWN_DETAILS))
                    .timeout(config.getStoreTimeout())
                    .block();
            } catch (RuntimeException e) {
                log.error("Could not mark job {} as failed during shutdown", active.getJobId(), e);
            }
        }
    }

    private void dispatch(ActiveJob active) {
        Mono.fromRunnable(() -> jobExecutor.execute(active))
            .subscribeOn(workerScheduler)
            .subscribe(
                v -> { },
                e -> log.error("Worker crashed while executing job {}", active.getJobId(), e));
    }

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            log.error("Scheduler tick failed", e);
        }
    }

    private void wakeup() {
        // Best effort: a dropped wakeup is covered by the next tick
        wakeups.tryEmitNext(Boolean.TRUE);
    }

    /**
     * Where a submission landed. {@code startsImmediately} is set when a free worker slot is
     * waiting for it at the next tick.
     */
    @Value
    public static class Enqueued {
        int position;
        boolean startsImmediately;
    }

    public enum CancelOutcome {
        /**
         * Job was waiting in the queue and has been removed
         */
        REMOVED_FROM_QUEUE,

        /**
         * Job is on a worker; it stops at the next variant boundary
         */
        SIGNALLED,

        /**
         * Job is neither queued nor active in this process
         */
        NOT_SCHEDULED
    }
}
