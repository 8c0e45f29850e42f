package com.whereq.headshot.service;

import com.whereq.headshot.BatchTestFixtures;
import com.whereq.headshot.config.HeadshotProperties;
import com.whereq.headshot.model.ActiveJob;
import com.whereq.headshot.model.JobPriority;
import com.whereq.headshot.model.QueuedJob;
import com.whereq.headshot.provider.GenerationProvider;
import com.whereq.headshot.queue.PriorityJobQueue;
import com.whereq.headshot.scheduler.ActiveJobRegistry;
import com.whereq.headshot.scheduler.BatchJobExecutor;
import com.whereq.headshot.scheduler.BatchJobScheduler;
import com.whereq.headshot.service.AdmissionController.AdmissionDecision;
import com.whereq.headshot.store.JobStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;

class AdmissionControllerTest {

    private SimpleMeterRegistry meterRegistry;
    private PriorityJobQueue jobQueue;
    private ActiveJobRegistry activeJobRegistry;
    private BatchJobScheduler scheduler;
    private AdmissionController admissionController;

    @BeforeEach
    void setUp() {
        HeadshotProperties properties = BatchTestFixtures.properties(1);
        properties.getBatch().setMaxQueueSize(2);
        meterRegistry = new SimpleMeterRegistry();
        jobQueue = new PriorityJobQueue(meterRegistry);
        activeJobRegistry = new ActiveJobRegistry(properties, meterRegistry);
        scheduler = new BatchJobScheduler(jobQueue, activeJobRegistry, mock(BatchJobExecutor.class),
            mock(GenerationProvider.class), mock(JobStore.class), Schedulers.immediate(), Schedulers.immediate(),
            properties, Clock.systemUTC());

        admissionController = new AdmissionController();
        ReflectionTestUtils.setField(admissionController, "properties", properties);
        ReflectionTestUtils.setField(admissionController, "activeJobRegistry", activeJobRegistry);
        ReflectionTestUtils.setField(admissionController, "jobQueue", jobQueue);
        ReflectionTestUtils.setField(admissionController, "scheduler", scheduler);
        ReflectionTestUtils.setField(admissionController, "meterRegistry", meterRegistry);
        admissionController.initialize();
    }

    @Test
    void testAdmitWhenIdle() {
        StepVerifier.create(admissionController.admitJob("user-1", 2))
            .expectNext(AdmissionDecision.ADMIT)
            .verifyComplete();
        assertEquals(1.0, meterRegistry.counter("headshot.admission.admitted").count());
    }

    @Test
    void testQueueWhenAllSlotsBusy() {
        activeJobRegistry.tryRegister(new ActiveJob("batch-running", Instant.now()));

        StepVerifier.create(admissionController.admitJob("user-1", 2))
            .expectNext(AdmissionDecision.QUEUE)
            .verifyComplete();
    }

    @Test
    void testQueueBehindWaitingJobsEvenWithFreeSlot() {
        enqueue("batch-waiting");

        StepVerifier.create(admissionController.admitJob("user-1", 1))
            .expectNext(AdmissionDecision.QUEUE)
            .verifyComplete();
    }

    @Test
    void testRejectWhenQueueFull() {
        enqueue("batch-a");
        enqueue("batch-b");

        StepVerifier.create(admissionController.admitJob("user-1", 1))
            .expectNext(AdmissionDecision.REJECT)
            .verifyComplete();
        assertEquals(1.0, meterRegistry.counter("headshot.admission.rejected").count());
    }

    @Test
    void testRejectWhenHeldSlotsFillQueue() {
        StepVerifier.create(admissionController.admitJob("user-1", 1))
            .expectNext(AdmissionDecision.ADMIT)
            .verifyComplete();
        StepVerifier.create(admissionController.admitJob("user-2", 1))
            .expectNext(AdmissionDecision.ADMIT)
            .verifyComplete();

        StepVerifier.create(admissionController.admitJob("user-3", 1))
            .expectNext(AdmissionDecision.REJECT)
            .verifyComplete();
    }

    @Test
    void testReleasedSlotCanBeReused() {
        enqueue("batch-a");
        StepVerifier.create(admissionController.admitJob("user-1", 1))
            .expectNext(AdmissionDecision.QUEUE)
            .verifyComplete();
        scheduler.releaseQueueSlot();

        StepVerifier.create(admissionController.admitJob("user-2", 1))
            .expectNext(AdmissionDecision.QUEUE)
            .verifyComplete();
    }

    private void enqueue(String jobId) {
        jobQueue.enqueue(QueuedJob.of(BatchTestFixtures.queuedJob(jobId, JobPriority.MEDIUM, Instant.now(), "corporate")));
    }
}
