package com.whereq.headshot.store;

import com.whereq.headshot.BatchTestFixtures;
import com.whereq.headshot.exception.JobNotFoundException;
import com.whereq.headshot.model.BatchJob;
import com.whereq.headshot.model.JobPriority;
import com.whereq.headshot.model.JobProgressUpdate;
import com.whereq.headshot.model.JobStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryJobStoreTest {

    private static final Instant T1 = Instant.parse("2024-05-01T10:00:00Z");

    private InMemoryJobStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryJobStore();
    }

    @Test
    void testCreateAndGet() {
        BatchJob job = BatchTestFixtures.queuedJob("job-1", JobPriority.HIGH, T1, "corporate");

        StepVerifier.create(store.create(job).then(store.get("job-1")))
            .assertNext(stored -> {
                assertEquals("job-1", stored.getId());
                assertEquals(JobStatus.QUEUED, stored.getStatus());
                assertNotSame(job, stored);
            })
            .verifyComplete();
    }

    @Test
    void testCreateDuplicateFails() {
        BatchJob job = BatchTestFixtures.queuedJob("job-1", JobPriority.HIGH, T1, "corporate");

        StepVerifier.create(store.create(job).then(store.create(job)))
            .expectError(IllegalStateException.class)
            .verify();
    }

    @Test
    void testGetUnknownIsEmpty() {
        StepVerifier.create(store.get("missing"))
            .verifyComplete();
    }

    @Test
    void testUpdateUnknownFailsWithNotFound() {
        StepVerifier.create(store.updateProgress("missing", JobProgressUpdate.builder().progress(10).build()))
            .expectError(JobNotFoundException.class)
            .verify();
    }

    @Test
    void testReturnedRecordsDoNotShareState() {
        store.create(BatchTestFixtures.queuedJob("job-1", JobPriority.HIGH, T1, "corporate")).block();

        BatchJob read = store.get("job-1").block();
        read.setStatus(JobStatus.COMPLETED);

        assertEquals(JobStatus.QUEUED, store.get("job-1").block().getStatus());
    }

    @Test
    void testListNonTerminalOldestFirst() {
        store.create(BatchTestFixtures.queuedJob("newer", JobPriority.HIGH, T1.plusSeconds(10), "corporate")).block();
        store.create(BatchTestFixtures.queuedJob("older", JobPriority.LOW, T1, "corporate")).block();
        store.create(BatchTestFixtures.queuedJob("done", JobPriority.LOW, T1.plusSeconds(5), "corporate")).block();
        store.updateProgress("done", JobProgressUpdate.terminal(JobStatus.COMPLETED, T1.plusSeconds(60), null)).block();

        StepVerifier.create(store.listNonTerminal().map(BatchJob::getId))
            .expectNext("older", "newer")
            .verifyComplete();
    }

    @Test
    void testListByOwnerNewestFirstWithLimit() {
        for (int i = 0; i < 5; i++) {
            store.create(BatchTestFixtures.queuedJob("job-" + i, JobPriority.MEDIUM, T1.plusSeconds(i), "corporate")).block();
        }
        BatchJob otherOwner = BatchTestFixtures.queuedJob("other", JobPriority.MEDIUM, T1.plusSeconds(100), "corporate");
        otherOwner.setOwnerId("user-2");
        store.create(otherOwner).block();

        StepVerifier.create(store.listByOwner("user-1", 3).map(BatchJob::getId))
            .expectNext("job-4", "job-3", "job-2")
            .verifyComplete();
    }
}
