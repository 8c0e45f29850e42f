package com.whereq.headshot.service;

import com.whereq.headshot.config.HeadshotProperties;
import com.whereq.headshot.queue.JobQueue;
import com.whereq.headshot.scheduler.ActiveJobRegistry;
import com.whereq.headshot.scheduler.BatchJobScheduler;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import jakarta.annotation.PostConstruct;

/**
 * Admission control for batch submissions
 * Decides whether a submission can start right away, has to wait in the queue, or is rejected
 * because the queue is full
 */
@Slf4j
@Service
public class AdmissionController {

    @Autowired
    private HeadshotProperties properties;

    @Autowired
    private ActiveJobRegistry activeJobRegistry;

    @Autowired
    private JobQueue jobQueue;

    @Autowired
    private BatchJobScheduler scheduler;

    @Autowired
    private MeterRegistry meterRegistry;

    private Counter admittedCounter;
    private Counter queuedCounter;
    private Counter rejectedCounter;

    @PostConstruct
    public void initialize() {
        admittedCounter = Counter.builder("headshot.admission.admitted")
            .description("Number of submissions that found a free worker slot")
            .register(meterRegistry);

        queuedCounter = Counter.builder("headshot.admission.queued")
            .description("Number of submissions queued behind other jobs")
            .register(meterRegistry);

        rejectedCounter = Counter.builder("headshot.admission.rejected")
            .description("Number of submissions rejected due to full queue")
            .register(meterRegistry);
    }

    /**
     * Decide how a new submission is handled
     *
     * @param ownerId submitting user
     * @param styleCount number of variants requested
     * @return Mono with admission decision. ADMIT and QUEUE hold a queue slot that the caller
     *         must either fill with {@link BatchJobScheduler#enqueueReserved} or give back with
     *         {@link BatchJobScheduler#releaseQueueSlot}
     */
    public Mono<AdmissionDecision> admitJob(String ownerId, int styleCount) {
        return Mono.fromSupplier(() -> {
            int maxQueueSize = properties.getBatch().getMaxQueueSize();
            if (!scheduler.reserveQueueSlot(maxQueueSize)) {
                // Queue is full, reject
                rejectedCounter.increment();
                log.warn("Submission from {} rejected: queue is full (size >= {})", ownerId, maxQueueSize);
                return AdmissionDecision.REJECT;
            }

            if (activeJobRegistry.hasFreeSlot() && jobQueue.size() == 0) {
                admittedCounter.increment();
                log.info("Submission from {} ({} styles) can start immediately: {}/{} workers busy",
                    ownerId, styleCount, activeJobRegistry.activeCount(), activeJobRegistry.getMaxConcurrentJobs());
                return AdmissionDecision.ADMIT;
            }

            queuedCounter.increment();
            log.info("Submission from {} ({} styles) queued behind {} jobs", ownerId, styleCount, jobQueue.size());
            return AdmissionDecision.QUEUE;
        });
    }

    /**
     * Admission decision
     */
    public enum AdmissionDecision {
        /**
         * A worker slot is free and nothing is waiting
         */
        ADMIT,

        /**
         * Wait in the queue for a worker slot
         */
        QUEUE,

        /**
         * Reject submission (queue full)
         */
        REJECT
    }
}
