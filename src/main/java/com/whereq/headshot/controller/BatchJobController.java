package com.whereq.headshot.controller;

import com.whereq.headshot.dto.BatchJobRequest;
import com.whereq.headshot.dto.BatchJobStatusResponse;
import com.whereq.headshot.dto.BatchJobSubmitResponse;
import com.whereq.headshot.dto.JobCancellationResponse;
import com.whereq.headshot.dto.JobSummary;
import com.whereq.headshot.dto.PresetInfo;
import com.whereq.headshot.dto.ServiceMetricsResponse;
import com.whereq.headshot.exception.BatchValidationException;
import com.whereq.headshot.exception.QuotaExceededException;
import com.whereq.headshot.service.BatchJobService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.List;

/**
 * Controller for batch headshot job submission and management
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/batch")
@Tag(name = "Batch jobs", description = "Batch headshot generation jobs")
public class BatchJobController {

    static final String USER_HEADER = "X-User-Id";

    @Autowired
    private BatchJobService batchJobService;

    /**
     * Submit a batch job for async execution
     *
     * @param request job request
     * @param userId caller identity
     * @return Mono with 202 Accepted response
     */
    @PostMapping("/jobs")
    @Operation(summary = "Submit a batch job", description = "Queue a photo for generation in several styles")
    public Mono<ResponseEntity<BatchJobSubmitResponse>> submitJob(
            @Valid @RequestBody BatchJobRequest request,
            @RequestHeader(value = USER_HEADER, required = false) String userId) {

        log.info("Received batch submission from user {}: batchType={}, styles={}",
            userId, request.getBatchType(), request.getStyles());

        return batchJobService.submitJob(request, userId)
            .map(response -> ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .location(URI.create("/api/v1/batch/jobs/" + response.getJobId()))
                .body(response))
            .onErrorResume(BatchValidationException.class, e -> {
                log.warn("Validation error: {}", e.getErrors());
                return Mono.just(ResponseEntity
                    .badRequest()
                    .body(BatchJobSubmitResponse.error("Batch job validation failed", e.getErrors())));
            })
            .onErrorResume(QuotaExceededException.class, e -> {
                log.warn("Quota exceeded: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .status(HttpStatus.TOO_MANY_REQUESTS)
                    .body(BatchJobSubmitResponse.error(e.getMessage(), List.of())));
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Unexpected error during batch submission", e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(BatchJobSubmitResponse.error("Internal server error", List.of())));
            });
    }

    /**
     * Get job status
     *
     * @param jobId job identifier
     * @param userId caller identity
     * @return Mono with job status
     */
    @GetMapping("/jobs/{jobId}")
    @Operation(summary = "Job status", description = "Progress, current step and per-style results of a job")
    public Mono<ResponseEntity<BatchJobStatusResponse>> getJobStatus(
            @PathVariable String jobId,
            @RequestHeader(value = USER_HEADER, required = false) String userId) {

        log.debug("Job status request for {} from user {}", jobId, userId);

        return batchJobService.getJobStatus(jobId, userId)
            .map(ResponseEntity::ok);
    }

    /**
     * Cancel a job
     *
     * @param jobId job identifier
     * @param userId caller identity
     * @return Mono with cancellation response
     */
    @DeleteMapping("/jobs/{jobId}")
    @Operation(summary = "Cancel a job", description = "Queued jobs are cancelled at once, running jobs after the current style")
    public Mono<ResponseEntity<JobCancellationResponse>> cancelJob(
            @PathVariable String jobId,
            @RequestHeader(value = USER_HEADER, required = false) String userId) {

        log.info("Job cancellation request for {} from user {}", jobId, userId);

        return batchJobService.cancelJob(jobId, userId)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/jobs")
    @Operation(summary = "Job history", description = "The caller's jobs, newest first")
    public Flux<JobSummary> listJobs(
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestHeader(value = USER_HEADER, required = false) String userId) {
        return batchJobService.listJobs(userId, limit);
    }

    @GetMapping("/metrics")
    @Operation(summary = "Service metrics", description = "Queue depth, active jobs and aggregated processing metrics")
    public Mono<ServiceMetricsResponse> metrics() {
        return Mono.fromSupplier(batchJobService::getServiceMetrics);
    }

    @GetMapping("/presets")
    @Operation(summary = "Batch presets", description = "Available batch presets and their styles")
    public Mono<List<PresetInfo>> presets() {
        return Mono.fromSupplier(batchJobService::getPresets);
    }
}
