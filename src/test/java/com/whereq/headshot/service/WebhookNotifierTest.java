package com.whereq.headshot.service;

import com.whereq.headshot.model.BatchJob;
import com.whereq.headshot.model.BatchOptions;
import com.whereq.headshot.model.BatchResults;
import com.whereq.headshot.model.JobStatus;
import com.whereq.headshot.model.Notifications;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WebhookNotifierTest {

    private final List<ClientRequest> requests = new ArrayList<>();
    private HttpStatus responseStatus;
    private WebhookNotifier notifier;

    @BeforeEach
    void setUp() {
        responseStatus = HttpStatus.OK;
        WebClient.Builder builder = WebClient.builder()
            .exchangeFunction(request -> {
                requests.add(request);
                return Mono.just(ClientResponse.create(responseStatus).build());
            });
        notifier = new WebhookNotifier(builder);
    }

    @Test
    void testNotifiesSubscribedStatus() {
        BatchJob job = job(JobStatus.COMPLETED, List.of(JobStatus.COMPLETED, JobStatus.FAILED));

        StepVerifier.create(notifier.notifyTerminal(job)).verifyComplete();

        assertEquals(1, requests.size());
        assertEquals(HttpMethod.POST, requests.get(0).method());
        assertEquals("http://hooks.example.com/batch", requests.get(0).url().toString());
    }

    @Test
    void testSkipsUnsubscribedStatus() {
        BatchJob job = job(JobStatus.CANCELLED, List.of(JobStatus.COMPLETED));

        StepVerifier.create(notifier.notifyTerminal(job)).verifyComplete();

        assertTrue(requests.isEmpty());
    }

    @Test
    void testEmptyEventListSubscribesToEveryTerminalStatus() {
        StepVerifier.create(notifier.notifyTerminal(job(JobStatus.CANCELLED, null))).verifyComplete();
        StepVerifier.create(notifier.notifyTerminal(job(JobStatus.FAILED, List.of()))).verifyComplete();

        assertEquals(2, requests.size());
    }

    @Test
    void testNonTerminalStatusNeverNotifies() {
        StepVerifier.create(notifier.notifyTerminal(job(JobStatus.PROCESSING, List.of(JobStatus.PROCESSING))))
            .verifyComplete();

        assertTrue(requests.isEmpty());
    }

    @Test
    void testSkipsJobWithoutNotifications() {
        BatchJob job = BatchJob.builder().id("batch-1").status(JobStatus.COMPLETED).options(BatchOptions.empty()).build();

        StepVerifier.create(notifier.notifyTerminal(job)).verifyComplete();

        assertTrue(requests.isEmpty());
    }

    @Test
    void testWebhookFailureDoesNotPropagate() {
        responseStatus = HttpStatus.SERVICE_UNAVAILABLE;
        BatchJob job = job(JobStatus.FAILED, List.of(JobStatus.FAILED));

        StepVerifier.create(notifier.notifyTerminal(job)).verifyComplete();

        assertEquals(1, requests.size());
    }

    @Test
    void testPayloadCarriesResultsOrError() {
        BatchJob completed = job(JobStatus.COMPLETED, List.of(JobStatus.COMPLETED));
        completed.setResults(BatchResults.builder().jobId("batch-1").totalImagesGenerated(4).build());
        BatchJob failed = job(JobStatus.FAILED, List.of(JobStatus.FAILED));
        failed.setErrorDetails("Provider unavailable");

        Map<String, Object> completedPayload = notifier.buildPayload(completed);
        Map<String, Object> failedPayload = notifier.buildPayload(failed);

        assertEquals("COMPLETED", completedPayload.get("status"));
        assertNotNull(completedPayload.get("result"));
        assertFalse(completedPayload.containsKey("error"));
        assertEquals("Provider unavailable", failedPayload.get("error"));
        assertFalse(failedPayload.containsKey("result"));
    }

    private BatchJob job(JobStatus status, List<JobStatus> events) {
        return BatchJob.builder()
            .id("batch-1")
            .status(status)
            .options(BatchOptions.builder()
                .notifications(new Notifications("http://hooks.example.com/batch", events))
                .build())
            .build();
    }
}
