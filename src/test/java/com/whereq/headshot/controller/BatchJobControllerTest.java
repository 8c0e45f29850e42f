package com.whereq.headshot.controller;

import com.whereq.headshot.dto.BatchJobRequest;
import com.whereq.headshot.dto.BatchJobStatusResponse;
import com.whereq.headshot.dto.BatchJobSubmitResponse;
import com.whereq.headshot.dto.JobCancellationResponse;
import com.whereq.headshot.exception.BatchValidationException;
import com.whereq.headshot.exception.JobNotFoundException;
import com.whereq.headshot.exception.QuotaExceededException;
import com.whereq.headshot.model.JobPriority;
import com.whereq.headshot.model.JobStatus;
import com.whereq.headshot.service.BatchJobService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(BatchJobController.class)
@Import(ApiExceptionHandler.class)
class BatchJobControllerTest {

    @MockBean
    private BatchJobService batchJobService;

    @Autowired
    private WebTestClient client;

    @Test
    void testSubmitJob_Accepted() {
        when(batchJobService.submitJob(any(BatchJobRequest.class), eq("user-1")))
            .thenReturn(Mono.just(BatchJobSubmitResponse.builder()
                .jobId("batch-1")
                .status(JobStatus.QUEUED)
                .batchType("style_comparison")
                .priority(JobPriority.HIGH)
                .queuePosition(1)
                .build()));

        client.post().uri("/api/v1/batch/jobs")
            .header(BatchJobController.USER_HEADER, "user-1")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("imageBase64", "aGVsbG8=", "batchType", "style_comparison"))
            .exchange()
            .expectStatus().isAccepted()
            .expectHeader().location("/api/v1/batch/jobs/batch-1")
            .expectBody()
            .jsonPath("$.jobId").isEqualTo("batch-1")
            .jsonPath("$.status").isEqualTo("QUEUED")
            .jsonPath("$.queuePosition").isEqualTo(1);
    }

    @Test
    void testSubmitJob_MissingImageRejectedBeforeService() {
        client.post().uri("/api/v1/batch/jobs")
            .header(BatchJobController.USER_HEADER, "user-1")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("batchType", "style_comparison"))
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.errorMessage").isEqualTo("Batch job validation failed");

        verify(batchJobService, never()).submitJob(any(), any());
    }

    @Test
    void testSubmitJob_ValidationErrors() {
        when(batchJobService.submitJob(any(BatchJobRequest.class), eq("user-1")))
            .thenReturn(Mono.error(new BatchValidationException(List.of("At least one style is required"))));

        client.post().uri("/api/v1/batch/jobs")
            .header(BatchJobController.USER_HEADER, "user-1")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("imageBase64", "aGVsbG8=", "styles", List.of()))
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.errorMessage").isEqualTo("Batch job validation failed")
            .jsonPath("$.errors[0]").isEqualTo("At least one style is required");
    }

    @Test
    void testSubmitJob_QueueFull() {
        when(batchJobService.submitJob(any(BatchJobRequest.class), eq("user-1")))
            .thenReturn(Mono.error(new QuotaExceededException("Queue is full, cannot accept more jobs")));

        client.post().uri("/api/v1/batch/jobs")
            .header(BatchJobController.USER_HEADER, "user-1")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("imageBase64", "aGVsbG8="))
            .exchange()
            .expectStatus().isEqualTo(429)
            .expectBody()
            .jsonPath("$.errorMessage").isEqualTo("Queue is full, cannot accept more jobs");
    }

    @Test
    void testSubmitJob_UnexpectedErrorHidesDetails() {
        when(batchJobService.submitJob(any(BatchJobRequest.class), eq("user-1")))
            .thenReturn(Mono.error(new IllegalStateException("redis connection refused")));

        client.post().uri("/api/v1/batch/jobs")
            .header(BatchJobController.USER_HEADER, "user-1")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("imageBase64", "aGVsbG8="))
            .exchange()
            .expectStatus().is5xxServerError()
            .expectBody()
            .jsonPath("$.errorMessage").isEqualTo("Internal server error");
    }

    @Test
    void testGetJobStatus() {
        when(batchJobService.getJobStatus("batch-1", "user-1"))
            .thenReturn(Mono.just(BatchJobStatusResponse.builder()
                .jobId("batch-1")
                .status(JobStatus.PROCESSING)
                .progress(38)
                .currentStep("Generating creative headshots")
                .build()));

        client.get().uri("/api/v1/batch/jobs/batch-1")
            .header(BatchJobController.USER_HEADER, "user-1")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("PROCESSING")
            .jsonPath("$.progress").isEqualTo(38);
    }

    @Test
    void testGetJobStatus_NotFound() {
        when(batchJobService.getJobStatus("batch-x", "user-1"))
            .thenReturn(Mono.error(new JobNotFoundException("batch-x")));

        client.get().uri("/api/v1/batch/jobs/batch-x")
            .header(BatchJobController.USER_HEADER, "user-1")
            .exchange()
            .expectStatus().isNotFound()
            .expectBody()
            .jsonPath("$.errorMessage").isEqualTo("Job not found: batch-x");
    }

    @Test
    void testCancelJob() {
        when(batchJobService.cancelJob("batch-1", "user-1"))
            .thenReturn(Mono.just(JobCancellationResponse.builder()
                .jobId("batch-1")
                .success(true)
                .status(JobStatus.CANCELLED)
                .message("Job cancelled")
                .build()));

        client.delete().uri("/api/v1/batch/jobs/batch-1")
            .header(BatchJobController.USER_HEADER, "user-1")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.success").isEqualTo(true)
            .jsonPath("$.status").isEqualTo("CANCELLED");
    }
}
