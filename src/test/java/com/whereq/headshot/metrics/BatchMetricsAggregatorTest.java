package com.whereq.headshot.metrics;

import com.whereq.headshot.BatchTestFixtures;
import com.whereq.headshot.model.BatchJob;
import com.whereq.headshot.model.JobPriority;
import com.whereq.headshot.model.JobProgressUpdate;
import com.whereq.headshot.model.JobStatus;
import com.whereq.headshot.model.VariantOutcome;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class BatchMetricsAggregatorTest {

    private static final Instant CREATED = Instant.parse("2024-05-01T10:00:00Z");

    private SimpleMeterRegistry meterRegistry;
    private BatchMetricsAggregator aggregator;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        aggregator = new BatchMetricsAggregator(meterRegistry);
    }

    @Test
    void testEmptyBeforeAnyJob() {
        MetricsSnapshot snapshot = aggregator.snapshot();

        assertEquals(0, snapshot.getTotalJobsProcessed());
        assertEquals(0.0, snapshot.getSuccessRate());
        assertTrue(aggregator.averageProcessingMinutes().isEmpty());
    }

    @Test
    void testIncrementalAverageAndSuccessRate() {
        aggregator.recordTerminal(completed("a", VariantOutcome.succeeded("corporate", List.of("x", "y"), 10)),
            Duration.ofMinutes(2));
        aggregator.recordTerminal(completed("b", VariantOutcome.failed("corporate", "provider down", 10)),
            Duration.ofMinutes(4));

        MetricsSnapshot snapshot = aggregator.snapshot();
        assertEquals(2, snapshot.getTotalJobsProcessed());
        assertEquals(Duration.ofMinutes(3).toMillis(), snapshot.getAverageProcessingTimeMs(), 0.001);
        assertEquals(0.5, snapshot.getSuccessRate(), 0.0001);
        assertEquals(2, snapshot.getTotalImagesGenerated());
        assertEquals(3.0, aggregator.averageProcessingMinutes().getAsDouble(), 0.0001);
    }

    @Test
    void testPerStyleCounters() {
        aggregator.recordTerminal(completed("a",
                VariantOutcome.succeeded("corporate", List.of("x"), 10),
                VariantOutcome.failed("creative", "timeout", 10)),
            Duration.ofSeconds(30));
        aggregator.recordTerminal(completed("b", VariantOutcome.succeeded("creative", List.of("x"), 10)),
            Duration.ofSeconds(30));

        MetricsSnapshot.StylePerformance creative = aggregator.snapshot().getStylePerformance().get("creative");
        assertEquals(2, creative.getAttempts());
        assertEquals(1, creative.getSuccesses());
        assertEquals(0.5, creative.getSuccessRate(), 0.0001);

        assertEquals(1.0, meterRegistry.get("headshot.batch.variants")
            .tag("style", "creative").tag("outcome", "failure").counter().count());
        assertEquals(2.0, meterRegistry.get("headshot.batch.jobs").tag("status", "completed").counter().count());
    }

    @Test
    void testQueueWaitFromCreatedToStarted() {
        BatchJob job = completed("a", VariantOutcome.succeeded("corporate", List.of("x"), 10));
        job.setStartedAt(CREATED.plusSeconds(90));

        aggregator.recordTerminal(job, Duration.ofSeconds(30));

        assertEquals(90_000.0, aggregator.snapshot().getAverageQueueWaitMs(), 0.001);
    }

    @Test
    void testConcurrentCompletionsAllCounted() throws Exception {
        int threads = 8;
        int perThread = 250;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Runnable> tasks = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            tasks.add(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < perThread; i++) {
                    aggregator.recordTerminal(completed("job", VariantOutcome.succeeded("corporate", List.of("x"), 1)),
                        Duration.ofSeconds(60));
                }
            });
        }
        tasks.forEach(pool::submit);
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));

        MetricsSnapshot snapshot = aggregator.snapshot();
        assertEquals(threads * perThread, snapshot.getTotalJobsProcessed());
        assertEquals(60_000.0, snapshot.getAverageProcessingTimeMs(), 0.001);
        assertEquals(threads * perThread, snapshot.getStylePerformance().get("corporate").getAttempts());
    }

    private BatchJob completed(String id, VariantOutcome... outcomes) {
        String[] styles = new String[outcomes.length];
        for (int i = 0; i < outcomes.length; i++) {
            styles[i] = outcomes[i].getStyle();
        }
        BatchJob job = BatchTestFixtures.queuedJob(id, JobPriority.MEDIUM, CREATED, styles);
        for (VariantOutcome outcome : outcomes) {
            job.apply(JobProgressUpdate.builder().appendVariant(outcome).build());
        }
        job.apply(JobProgressUpdate.builder().status(JobStatus.COMPLETED).progress(100).build());
        return job;
    }
}
