package com.whereq.headshot.service;

import com.whereq.headshot.config.HeadshotProperties;
import com.whereq.headshot.dto.BatchJobRequest;
import com.whereq.headshot.dto.BatchJobStatusResponse;
import com.whereq.headshot.dto.BatchJobSubmitResponse;
import com.whereq.headshot.dto.JobCancellationResponse;
import com.whereq.headshot.dto.JobSummary;
import com.whereq.headshot.dto.PresetInfo;
import com.whereq.headshot.dto.ServiceMetricsResponse;
import com.whereq.headshot.exception.BatchValidationException;
import com.whereq.headshot.exception.JobNotFoundException;
import com.whereq.headshot.exception.QuotaExceededException;
import com.whereq.headshot.metrics.BatchMetricsAggregator;
import com.whereq.headshot.metrics.MetricsSnapshot;
import com.whereq.headshot.model.ActiveJob;
import com.whereq.headshot.model.BatchJob;
import com.whereq.headshot.model.BatchOptions;
import com.whereq.headshot.model.JobProgressUpdate;
import com.whereq.headshot.model.JobStatus;
import com.whereq.headshot.queue.JobQueue;
import com.whereq.headshot.scheduler.ActiveJobRegistry;
import com.whereq.headshot.scheduler.BatchJobScheduler;
import com.whereq.headshot.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for batch job submission, status, cancellation and history
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchJobService {

    static final int DEFAULT_LIST_LIMIT = 10;
    static final int MAX_LIST_LIMIT = 100;

    private final BatchJobValidator validator;
    private final AdmissionController admissionController;
    private final JobEstimator estimator;
    private final JobStore jobStore;
    private final BatchJobScheduler scheduler;
    private final JobQueue jobQueue;
    private final ActiveJobRegistry activeJobRegistry;
    private final BatchMetricsAggregator metricsAggregator;
    private final WebhookNotifier webhookNotifier;
    private final HeadshotProperties properties;
    private final Clock clock;

    /**
     * Submit a batch job
     *
     * @param request job request
     * @param ownerId user identifier
     * @return Mono with submission response
     */
    public Mono<BatchJobSubmitResponse> submitJob(BatchJobRequest request, String ownerId) {
        return Mono.fromCallable(() -> validator.validate(request, ownerId))

            // 1. Admission control; holds a queue slot unless rejected
            .flatMap(batch -> admissionController.admitJob(ownerId, batch.getStyles().size())
                .flatMap(decision -> {
                    if (decision == AdmissionController.AdmissionDecision.REJECT) {
                        return Mono.error(new QuotaExceededException("Queue is full, cannot accept more jobs"));
                    }
                    return Mono.just(batch);
                }))

            // 2. Persist as QUEUED
            .flatMap(batch -> Mono.defer(() -> jobStore.create(buildJob(request, ownerId, batch)))
                .doOnError(e -> scheduler.releaseQueueSlot())
                .doOnCancel(scheduler::releaseQueueSlot)
                .map(job -> {
                    // 3. Queue in the held slot and wake the scheduler
                    BatchJobScheduler.Enqueued enqueued = scheduler.enqueueReserved(job);
                    Instant estimatedStart = enqueued.isStartsImmediately()
                        ? clock.instant()
                        : estimator.estimateStartTime(enqueued.getPosition());

                    return BatchJobSubmitResponse.builder()
                        .jobId(job.getId())
                        .status(JobStatus.QUEUED)
                        .batchType(job.getBatchType())
                        .styles(job.getRequestedVariants())
                        .outputsPerVariant(job.getOutputsPerVariant())
                        .priority(job.getPriority())
                        .estimates(job.getEstimates())
                        .queuePosition(enqueued.getPosition())
                        .estimatedStartTime(estimatedStart)
                        .submittedAt(job.getCreatedAt())
                        .build();
                }))

            .doOnSuccess(response -> log.info("Batch job {} submitted by user {}: {} styles, position {}",
                response.getJobId(), ownerId, response.getStyles().size(), response.getQueuePosition()))
            .doOnError(e -> log.warn("Batch submission failed for user {}: {}", ownerId, e.getMessage()));
    }

    /**
     * Current status of a job, merged with the live state of its worker
     *
     * @param jobId job identifier
     * @param ownerId caller; when given, jobs of other owners are reported as not found
     * @return Mono with job status, or JobNotFoundException
     */
    public Mono<BatchJobStatusResponse> getJobStatus(String jobId, String ownerId) {
        return findOwned(jobId, ownerId).map(this::toStatusResponse);
    }

    /**
     * Cancel a queued or running job
     *
     * @param jobId job identifier
     * @param ownerId user identifier
     * @return Mono with cancellation response
     */
    public Mono<JobCancellationResponse> cancelJob(String jobId, String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            return Mono.error(new JobNotFoundException(jobId));
        }

        return findOwned(jobId, ownerId)
            .flatMap(job -> {
                if (job.getStatus().isTerminal()) {
                    return Mono.just(JobCancellationResponse.builder()
                        .jobId(jobId)
                        .success(false)
                        .status(job.getStatus())
                        .message("Job already " + job.getStatus().name().toLowerCase())
                        .build());
                }

                BatchJobScheduler.CancelOutcome outcome = scheduler.cancel(jobId);
                if (outcome == BatchJobScheduler.CancelOutcome.SIGNALLED) {
                    return Mono.just(JobCancellationResponse.builder()
                        .jobId(jobId)
                        .success(true)
                        .status(job.getStatus())
                        .cancelledAt(clock.instant())
                        .message("Cancellation requested, processing stops after the current style")
                        .build());
                }

                // Not on a worker. A submission still in flight may queue the job after this
                // write, so the scheduler is asked again once the record is terminal.
                return jobStore.updateProgress(jobId, JobProgressUpdate.builder()
                        .status(JobStatus.CANCELLED)
                        .currentStep(JobStatus.CANCELLED.getDescription())
                        .cancelRequested(true)
                        .completedAt(clock.instant())
                        .errorDetails("Cancelled by user")
                        .build())
                    .doOnNext(updated -> {
                        if (updated.getStatus() == JobStatus.CANCELLED) {
                            scheduler.cancel(jobId);
                            webhookNotifier.notifyTerminal(updated).subscribe();
                        }
                    })
                    .map(updated -> JobCancellationResponse.builder()
                        .jobId(jobId)
                        .success(updated.getStatus() == JobStatus.CANCELLED)
                        .status(updated.getStatus())
                        .cancelledAt(updated.getCompletedAt())
                        .message(updated.getStatus() == JobStatus.CANCELLED
                            ? "Job cancelled successfully"
                            : "Job already " + updated.getStatus().name().toLowerCase())
                        .build());
            })
            .doOnSuccess(response -> log.info("Cancel of job {} by user {}: {}", jobId, ownerId, response.getMessage()))
            .doOnError(e -> log.warn("Failed to cancel job {}: {}", jobId, e.getMessage()));
    }

    /**
     * Caller's jobs, newest first
     *
     * @param ownerId user identifier
     * @param limit max results; defaults to 10, capped at 100
     */
    public Flux<JobSummary> listJobs(String ownerId, Integer limit) {
        if (ownerId == null || ownerId.isBlank()) {
            return Flux.error(new BatchValidationException(List.of("ownerId is required")));
        }
        int effectiveLimit = limit == null || limit <= 0 ? DEFAULT_LIST_LIMIT : Math.min(limit, MAX_LIST_LIMIT);

        return jobStore.listByOwner(ownerId, effectiveLimit)
            .map(job -> JobSummary.builder()
                .jobId(job.getId())
                .batchType(job.getBatchType())
                .status(job.getStatus())
                .progress(job.getProgress())
                .variantCount(job.getRequestedVariants().size())
                .totalImagesGenerated(job.totalOutputsProduced())
                .createdAt(job.getCreatedAt())
                .completedAt(job.getCompletedAt())
                .build());
    }

    public ServiceMetricsResponse getServiceMetrics() {
        MetricsSnapshot snapshot = metricsAggregator.snapshot();

        return ServiceMetricsResponse.builder()
            .activeJobs(activeJobRegistry.activeCount())
            .queuedJobs(jobQueue.size())
            .maxConcurrentJobs(activeJobRegistry.getMaxConcurrentJobs())
            .peakActiveJobs(activeJobRegistry.peakActive())
            .peakQueueDepth(jobQueue.highWaterMark())
            .totalJobsProcessed(snapshot.getTotalJobsProcessed())
            .averageProcessingTimeMs(snapshot.getAverageProcessingTimeMs())
            .successRate(snapshot.getSuccessRate())
            .averageQueueWaitMs(snapshot.getAverageQueueWaitMs())
            .totalImagesGenerated(snapshot.getTotalImagesGenerated())
            .stylePerformance(snapshot.getStylePerformance())
            .availablePresets(new ArrayList<>(properties.getBatch().getPresets().keySet()))
            .build();
    }

    public List<PresetInfo> getPresets() {
        List<PresetInfo> presets = new ArrayList<>();
        properties.getBatch().getPresets().forEach((name, preset) -> {
            List<String> styles = preset.getStyles() != null ? preset.getStyles() : List.of();
            presets.add(PresetInfo.builder()
                .name(name)
                .styles(styles)
                .outputsPerStyle(preset.getOutputsPerStyle())
                .totalOutputs(styles.size() * preset.getOutputsPerStyle())
                .estimatedTimeMinutes(preset.getEstimatedTimeMinutes())
                .priority(preset.getPriority())
                .build());
        });
        return presets;
    }

    private Mono<BatchJob> findOwned(String jobId, String ownerId) {
        return jobStore.get(jobId)
            .filter(job -> ownerId == null || ownerId.equals(job.getOwnerId()))
            .switchIfEmpty(Mono.error(() -> new JobNotFoundException(jobId)));
    }

    private BatchJobStatusResponse toStatusResponse(BatchJob job) {
        Optional<ActiveJob> active = scheduler.activeJob(job.getId());

        JobStatus status = job.getStatus();
        if (status == JobStatus.QUEUED && active.isPresent()) {
            // Admitted, first progress write not flushed yet
            status = JobStatus.PREPROCESSING;
        }

        String currentStep;
        if (status.isTerminal()) {
            currentStep = status.getDescription();
        } else if (active.isPresent() && active.get().getCurrentStep() != null) {
            currentStep = active.get().getCurrentStep();
        } else {
            currentStep = job.getCurrentStep() != null ? job.getCurrentStep() : status.getDescription();
        }

        BatchJobStatusResponse.BatchJobStatusResponseBuilder response = BatchJobStatusResponse.builder()
            .jobId(job.getId())
            .batchType(job.getBatchType())
            .status(status)
            .priority(job.getPriority())
            .progress(job.getProgress())
            .currentStep(currentStep)
            .requestedVariants(job.getRequestedVariants())
            .completedVariants(job.getCompletedVariants())
            .estimates(job.getEstimates())
            .createdAt(job.getCreatedAt())
            .startedAt(job.getStartedAt())
            .completedAt(job.getCompletedAt())
            .processingTimeSeconds(job.getProcessingTimeSeconds())
            .results(job.getResults())
            .errorDetails(job.getErrorDetails())
            .cancelRequested(job.isCancelRequested() || active.map(ActiveJob::isCancelRequested).orElse(false));

        if (status == JobStatus.QUEUED) {
            int position = scheduler.queuePosition(job.getId());
            if (position > 0) {
                response.queuePosition(position)
                    .estimatedStartTime(estimator.estimateStartTime(position));
            }
        } else if (!status.isTerminal()) {
            response.estimatedCompletion(job.getEstimatedCompletion());
        }
        return response.build();
    }

    private BatchJob buildJob(BatchJobRequest request, String ownerId, ResolvedBatch batch) {
        BatchOptions options = BatchOptions.builder()
            .providerParameters(request.getProviderParameters() != null ? request.getProviderParameters() : Map.of())
            .notifications(request.getNotifications())
            .metadata(request.getMetadata() != null ? request.getMetadata() : Map.of())
            .build();

        return BatchJob.builder()
            .id(generateJobId())
            .ownerId(ownerId)
            .batchType(batch.getBatchType())
            .requestedVariants(batch.getStyles())
            .outputsPerVariant(batch.getOutputsPerVariant())
            .priority(batch.getPriority())
            .status(JobStatus.QUEUED)
            .currentStep(JobStatus.QUEUED.getDescription())
            .estimates(estimator.estimate(batch.getStyles(), batch.getOutputsPerVariant()))
            .sourceImage(request.getImageBase64())
            .options(options)
            .createdAt(clock.instant())
            .build();
    }

    /**
     * Generate unique job ID
     */
    private String generateJobId() {
        return "batch-" + UUID.randomUUID();
    }
}
