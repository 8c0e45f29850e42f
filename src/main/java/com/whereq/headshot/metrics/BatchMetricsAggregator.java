package com.whereq.headshot.metrics;

import com.whereq.headshot.model.BatchJob;
import com.whereq.headshot.model.VariantOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Throughput and success metrics over jobs that finished on a worker. Written only from the
 * executor's completion path; every write and read holds the aggregator's monitor.
 */
@Slf4j
@Component
public class BatchMetricsAggregator {

    private final MeterRegistry meterRegistry;
    private final Timer processingTimer;

    private long totalJobsProcessed;
    private long successfulJobs;
    private double averageProcessingTimeMs;
    private double averageQueueWaitMs;
    private long totalImagesGenerated;
    private final Map<String, long[]> styleCounters = new LinkedHashMap<>();

    public BatchMetricsAggregator(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.processingTimer = Timer.builder("headshot.batch.jobs.processing.time")
            .description("Time from admission to terminal state")
            .register(meterRegistry);
    }

    /**
     * Record a job that reached a terminal state on a worker
     *
     * @param job the terminal job record
     * @param processingTime time from admission to terminal state
     */
    public synchronized void recordTerminal(BatchJob job, Duration processingTime) {
        totalJobsProcessed++;

        long processingMs = processingTime.toMillis();
        averageProcessingTimeMs += (processingMs - averageProcessingTimeMs) / totalJobsProcessed;

        if (job.getStartedAt() != null && job.getCreatedAt() != null) {
            long waitMs = Duration.between(job.getCreatedAt(), job.getStartedAt()).toMillis();
            averageQueueWaitMs += (waitMs - averageQueueWaitMs) / totalJobsProcessed;
        }

        boolean anySuccess = false;
        for (VariantOutcome outcome : job.getCompletedVariants()) {
            long[] counters = styleCounters.computeIfAbsent(outcome.getStyle(), s -> new long[2]);
            counters[0]++;
            if (outcome.isSuccess()) {
                counters[1]++;
                anySuccess = true;
                totalImagesGenerated += outcome.getImagesCount();
            }
            Counter.builder("headshot.batch.variants")
                .tag("style", outcome.getStyle())
                .tag("outcome", outcome.isSuccess() ? "success" : "failure")
                .register(meterRegistry)
                .increment();
        }
        if (anySuccess) {
            successfulJobs++;
        }

        processingTimer.record(processingTime);
        Counter.builder("headshot.batch.jobs")
            .tag("status", job.getStatus().name().toLowerCase())
            .description("Jobs that reached a terminal state on a worker")
            .register(meterRegistry)
            .increment();

        log.debug("Metrics updated for job {}: processed={}, avg={}ms, successRate={}",
            job.getId(), totalJobsProcessed, Math.round(averageProcessingTimeMs),
            (double) successfulJobs / totalJobsProcessed);
    }

    /**
     * Running mean processing time in minutes, empty until a job has been recorded
     */
    public synchronized OptionalDouble averageProcessingMinutes() {
        if (totalJobsProcessed == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(averageProcessingTimeMs / 60_000.0);
    }

    public synchronized MetricsSnapshot snapshot() {
        Map<String, MetricsSnapshot.StylePerformance> styles = new LinkedHashMap<>();
        styleCounters.forEach((style, counters) ->
            styles.put(style, new MetricsSnapshot.StylePerformance(counters[0], counters[1])));

        return MetricsSnapshot.builder()
            .totalJobsProcessed(totalJobsProcessed)
            .averageProcessingTimeMs(averageProcessingTimeMs)
            .successRate(totalJobsProcessed == 0 ? 0.0 : (double) successfulJobs / totalJobsProcessed)
            .averageQueueWaitMs(averageQueueWaitMs)
            .totalImagesGenerated(totalImagesGenerated)
            .stylePerformance(styles)
            .build();
    }
}
