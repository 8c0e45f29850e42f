package com.whereq.headshot.scheduler;

import com.whereq.headshot.config.HeadshotProperties;
import com.whereq.headshot.model.ActiveJob;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Jobs currently owned by a worker. Membership changes only through {@link #tryRegister} and
 * {@link #release}, both under this registry's monitor, so the active count can never exceed the
 * concurrency limit.
 */
@Slf4j
@Component
public class ActiveJobRegistry {

    private final int maxConcurrentJobs;
    private final Map<String, ActiveJob> activeJobs = new LinkedHashMap<>();
    private int peakActive;

    public ActiveJobRegistry(HeadshotProperties properties, MeterRegistry meterRegistry) {
        this.maxConcurrentJobs = properties.getBatch().getMaxConcurrentJobs();

        Gauge.builder("headshot.batch.jobs.active", this::activeCount)
            .description("Number of jobs owned by a worker")
            .register(meterRegistry);

        Gauge.builder("headshot.batch.jobs.capacity", () -> maxConcurrentJobs)
            .description("Concurrency limit")
            .register(meterRegistry);

        log.info("ActiveJobRegistry initialized: max concurrent jobs={}", maxConcurrentJobs);
    }

    /**
     * Claim a worker slot
     *
     * @param job runtime state for the admitted job
     * @return false if no slot is free or the job is already active
     */
    public synchronized boolean tryRegister(ActiveJob job) {
        if (activeJobs.size() >= maxConcurrentJobs || activeJobs.containsKey(job.getJobId())) {
            return false;
        }
        activeJobs.put(job.getJobId(), job);
        peakActive = Math.max(peakActive, activeJobs.size());
        log.debug("Registered active job {}, active {}/{}", job.getJobId(), activeJobs.size(), maxConcurrentJobs);
        return true;
    }

    /**
     * Free the slot of a job that reached a terminal state
     */
    public synchronized void release(String jobId) {
        if (activeJobs.remove(jobId) != null) {
            log.debug("Released job {}, active {}/{}", jobId, activeJobs.size(), maxConcurrentJobs);
        } else {
            log.warn("Attempted to release unknown job: {}", jobId);
        }
    }

    public synchronized Optional<ActiveJob> get(String jobId) {
        return Optional.ofNullable(activeJobs.get(jobId));
    }

    public synchronized boolean hasFreeSlot() {
        return activeJobs.size() < maxConcurrentJobs;
    }

    public synchronized int freeSlots() {
        return Math.max(0, maxConcurrentJobs - activeJobs.size());
    }

    public synchronized int activeCount() {
        return activeJobs.size();
    }

    public synchronized int peakActive() {
        return peakActive;
    }

    public synchronized List<ActiveJob> snapshot() {
        return new ArrayList<>(activeJobs.values());
    }

    public int getMaxConcurrentJobs() {
        return maxConcurrentJobs;
    }
}
