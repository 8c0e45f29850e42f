package com.whereq.headshot.scheduler;

import com.whereq.headshot.config.HeadshotProperties;
import com.whereq.headshot.model.BatchJob;
import com.whereq.headshot.model.JobProgressUpdate;
import com.whereq.headshot.model.JobStatus;
import com.whereq.headshot.store.JobStore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;

/**
 * Reconciles persisted non-terminal jobs at startup, then starts the scheduler loop.
 *
 * QUEUED jobs go back into the queue with their original priority and submission time. Jobs that
 * were on a worker when the process stopped are failed: which provider calls completed is unknown.
 */
@Slf4j
@Component
public class RecoveryLoader {

    static final String RESTART_DETAILS = "Server restart interrupted processing";

    private static final Duration RECOVERY_TIMEOUT = Duration.ofMinutes(2);

    private final JobStore jobStore;
    private final BatchJobScheduler scheduler;
    private final HeadshotProperties.BatchConfig config;
    private final Clock clock;

    public RecoveryLoader(JobStore jobStore, BatchJobScheduler scheduler, HeadshotProperties properties, Clock clock) {
        this.jobStore = jobStore;
        this.scheduler = scheduler;
        this.config = properties.getBatch();
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        try {
            RecoveryReport report = recover().block(RECOVERY_TIMEOUT);
            if (report != null) {
                log.info("Recovery finished: {} re-queued, {} failed, {} errors",
                    report.getRequeued(), report.getFailed(), report.getErrors());
            }
        } catch (RuntimeException e) {
            log.error("Recovery could not read non-terminal jobs; starting with an empty queue", e);
        }
        scheduler.start();
    }

    /**
     * Re-queue QUEUED jobs and fail interrupted ones. Errors on individual jobs are logged and
     * skipped.
     */
    public Mono<RecoveryReport> recover() {
        RecoveryReport report = new RecoveryReport();

        return jobStore.listNonTerminal()
            .concatMap(job -> recoverJob(job, report)
                .onErrorResume(e -> {
                    log.error("Failed to recover job {}", job.getId(), e);
                    report.errors++;
                    return Mono.empty();
                }))
            .then(Mono.fromSupplier(() -> report));
    }

    private Mono<Void> recoverJob(BatchJob job, RecoveryReport report) {
        if (job.getStatus() == JobStatus.QUEUED) {
            return Mono.fromRunnable(() -> {
                int position = scheduler.enqueue(job);
                report.requeued++;
                log.info("Re-queued job {} ({} priority) at position {}", job.getId(), job.getPriority(), position);
            });
        }

        log.warn("Job {} was {} when the service stopped; marking it failed", job.getId(), job.getStatus());
        return jobStore.updateProgress(job.getId(),
                JobProgressUpdate.terminal(JobStatus.FAILED, clock.instant(), RESTART_DETAILS))
            .timeout(config.getStoreTimeout())
            .doOnNext(updated -> report.failed++)
            .then();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RecoveryReport {
        private int requeued;
        private int failed;
        private int errors;
    }
}
