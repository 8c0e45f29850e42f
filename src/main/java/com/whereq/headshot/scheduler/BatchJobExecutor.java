package com.whereq.headshot.scheduler;

import com.whereq.headshot.config.HeadshotProperties;
import com.whereq.headshot.exception.InfrastructureException;
import com.whereq.headshot.exception.ProviderException;
import com.whereq.headshot.metrics.BatchMetricsAggregator;
import com.whereq.headshot.model.ActiveJob;
import com.whereq.headshot.model.BatchJob;
import com.whereq.headshot.model.BatchResults;
import com.whereq.headshot.model.JobProgressUpdate;
import com.whereq.headshot.model.JobStatus;
import com.whereq.headshot.model.QualityAssessment;
import com.whereq.headshot.model.VariantOutcome;
import com.whereq.headshot.provider.GenerationProvider;
import com.whereq.headshot.provider.GenerationRequest;
import com.whereq.headshot.provider.GenerationResult;
import com.whereq.headshot.provider.PhotoQualityAssessor;
import com.whereq.headshot.service.WebhookNotifier;
import com.whereq.headshot.store.JobStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Runs one admitted job to a terminal state on a worker thread:
 * PREPROCESSING (image assessment) → PROCESSING (one provider call per variant, in order) →
 * POSTPROCESSING (summary) → COMPLETED, or CANCELLED at a variant boundary, or FAILED on an
 * infrastructure error.
 *
 * A failed variant is recorded and processing moves on to the next style; only errors outside
 * the per-variant boundary fail the job.
 */
@Slf4j
@Service
public class BatchJobExecutor {

    static final int PROGRESS_PREPROCESSING = 5;
    static final int PROGRESS_ASSESSED = 10;
    static final int PROGRESS_PROCESSING = 15;
    static final int PROGRESS_VARIANT_SPAN = 70;
    static final int PROGRESS_POSTPROCESSING = 90;

    static final String CANCELLED_DETAILS = "Cancelled by user";

    private static final Duration PROVIDER_CANCEL_TIMEOUT = Duration.ofSeconds(10);

    private final JobStore jobStore;
    private final GenerationProvider generationProvider;
    private final PhotoQualityAssessor photoQualityAssessor;
    private final ActiveJobRegistry activeJobRegistry;
    private final BatchMetricsAggregator metricsAggregator;
    private final WebhookNotifier webhookNotifier;
    private final HeadshotProperties.BatchConfig config;
    private final Clock clock;

    public BatchJobExecutor(JobStore jobStore,
                            GenerationProvider generationProvider,
                            PhotoQualityAssessor photoQualityAssessor,
                            ActiveJobRegistry activeJobRegistry,
                            BatchMetricsAggregator metricsAggregator,
                            WebhookNotifier webhookNotifier,
                            HeadshotProperties properties,
                            Clock clock) {
        this.jobStore = jobStore;
        this.generationProvider = generationProvider;
        this.photoQualityAssessor = photoQualityAssessor;
        this.activeJobRegistry = activeJobRegistry;
        this.metricsAggregator = metricsAggregator;
        this.webhookNotifier = webhookNotifier;
        this.config = properties.getBatch();
        this.clock = clock;
    }

    /**
     * Execute an admitted job (blocking). Always releases the job's worker slot.
     *
     * @param active runtime state registered by the scheduler
     */
    public void execute(ActiveJob active) {
        String jobId = active.getJobId();
        Execution execution = new Execution(active);
        BatchJob terminal = null;

        try {
            terminal = run(execution);
        } catch (RuntimeException e) {
            log.error("Batch job {} failed during '{}': {}", jobId, execution.step, e.getMessage(), e);
            terminal = markFailed(jobId, failureDetails(e));
        } finally {
            activeJobRegistry.release(jobId);
            if (terminal != null) {
                metricsAggregator.recordTerminal(terminal, Duration.between(active.getAdmittedAt(), clock.instant()));
                webhookNotifier.notifyTerminal(terminal).subscribe();
            }
        }
    }

    private BatchJob run(Execution execution) {
        ActiveJob active = execution.active;
        String jobId = active.getJobId();

        execution.step = "loading job";
        BatchJob job = await(jobStore.get(jobId), config.getStoreTimeout(), "Loading job");
        if (job == null) {
            throw new InfrastructureException("Job record " + jobId + " disappeared from the store");
        }
        if (job.getStatus().isTerminal()) {
            log.info("Skipping batch job {}: already {}", jobId, job.getStatus());
            return null;
        }

        if (active.isCancelRequested()) {
            return markCancelled(execution);
        }

        // Preprocessing
        execution.step = "preprocessing";
        active.markProcessingStarted(active.getAdmittedAt());
        active.setCurrentStep("Validating image quality");
        BatchJob stored = flush(jobId, JobProgressUpdate.builder()
            .status(JobStatus.PREPROCESSING)
            .progress(PROGRESS_PREPROCESSING)
            .currentStep(active.getCurrentStep())
            .startedAt(active.getAdmittedAt())
            .build());
        if (endedElsewhere(stored)) {
            return null;
        }

        log.info("Starting batch job {}: batchType={}, styles={}, outputsPerVariant={}",
            jobId, job.getBatchType(), job.getRequestedVariants(), job.getOutputsPerVariant());

        QualityAssessment assessment = assess(job);
        active.setCurrentStep("Analyzing photo quality");
        stored = flush(jobId, JobProgressUpdate.builder()
            .progress(PROGRESS_ASSESSED)
            .currentStep(active.getCurrentStep())
            .build());
        if (endedElsewhere(stored)) {
            return null;
        }

        // Processing
        execution.step = "processing";
        active.setCurrentStep(JobStatus.PROCESSING.getDescription());
        stored = flush(jobId, JobProgressUpdate.builder()
            .status(JobStatus.PROCESSING)
            .progress(PROGRESS_PROCESSING)
            .currentStep(active.getCurrentStep())
            .build());
        if (endedElsewhere(stored)) {
            return null;
        }

        List<String> styles = job.getRequestedVariants();
        for (int i = 0; i < styles.size(); i++) {
            if (active.isCancelRequested()) {
                log.info("Batch job {} cancelled after {}/{} variants", jobId, i, styles.size());
                return markCancelled(execution);
            }

            String style = styles.get(i);
            active.getCurrentVariantIndex().set(i);
            active.setCurrentStep("Processing " + style + " style");
            execution.step = "processing " + style;

            VariantOutcome outcome = generateVariant(job, style, i, active);

            int progress = variantProgress(i + 1, styles.size());
            stored = flush(jobId, JobProgressUpdate.builder()
                .appendVariant(outcome)
                .progress(progress)
                .estimatedCompletion(estimateCompletion(active.getProcessingStartedAt(), progress))
                .build());
            if (endedElsewhere(stored)) {
                return null;
            }
        }

        // Postprocessing
        execution.step = "postprocessing";
        active.setCurrentStep(JobStatus.POSTPROCESSING.getDescription());
        BatchJob processed = flush(jobId, JobProgressUpdate.builder()
            .status(JobStatus.POSTPROCESSING)
            .progress(PROGRESS_POSTPROCESSING)
            .currentStep(active.getCurrentStep())
            .build());
        if (endedElsewhere(processed)) {
            return null;
        }

        Instant completedAt = clock.instant();
        BatchResults results = buildResults(processed, assessment, completedAt);
        long processingSeconds = Duration.between(active.getAdmittedAt(), completedAt).getSeconds();

        BatchJob completed = flush(jobId, JobProgressUpdate.builder()
            .status(JobStatus.COMPLETED)
            .progress(100)
            .currentStep(JobStatus.COMPLETED.getDescription())
            .completedAt(completedAt)
            .processingTimeSeconds(processingSeconds)
            .results(results)
            .build());
        if (completed.getStatus() != JobStatus.COMPLETED) {
            log.info("Batch job {} ended as {} before completion was recorded", jobId, completed.getStatus());
            return null;
        }

        log.info("Batch job {} completed in {}s: {} images, {} successful / {} failed styles",
            jobId, processingSeconds, results.getTotalImagesGenerated(),
            results.getSuccessfulVariants(), results.getFailedVariants());

        return completed;
    }

    /**
     * A terminal record here was written by someone else (user cancel, shutdown); that writer owns
     * the terminal side effects, so this worker stops without calling the provider again
     */
    private boolean endedElsewhere(BatchJob stored) {
        if (!stored.getStatus().isTerminal()) {
            return false;
        }
        log.info("Batch job {} is already {}; stopping worker", stored.getId(), stored.getStatus());
        return true;
    }

    private QualityAssessment assess(BatchJob job) {
        if (job.getSourceImage() == null || job.getSourceImage().isEmpty()) {
            throw new InfrastructureException("Image validation failed: source image is missing");
        }

        QualityAssessment assessment;
        try {
            assessment = photoQualityAssessor.assess(job.getSourceImage())
                .timeout(config.getAssessmentTimeout())
                .block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            String reason = cause instanceof TimeoutException
                ? "timed out after " + formatDuration(config.getAssessmentTimeout())
                : String.valueOf(cause.getMessage());
            log.warn("Photo quality check for batch job {} did not complete ({}); continuing without a score",
                job.getId(), reason);
            return QualityAssessment.unavailable();
        }

        if (assessment == null) {
            log.warn("Photo quality check for batch job {} returned nothing; continuing without a score", job.getId());
            return QualityAssessment.unavailable();
        }
        if (!assessment.isUsable()) {
            List<String> errors = assessment.getErrors() != null && !assessment.getErrors().isEmpty()
                ? assessment.getErrors() : List.of("image could not be decoded");
            throw new InfrastructureException("Image validation failed: " + String.join(", ", errors));
        }

        if (assessment.getSuitabilityScore() < config.getLowQualityThreshold()) {
            log.warn("Low quality photo detected for batch job {}: score {}",
                job.getId(), assessment.getSuitabilityScore());
        }
        return assessment;
    }

    /**
     * One provider call, isolated: any failure or timeout becomes a failed variant
     */
    private VariantOutcome generateVariant(BatchJob job, String style, int index, ActiveJob active) {
        long started = clock.millis();
        log.info("Processing style {} for job {} ({}/{})",
            style, job.getId(), index + 1, job.getRequestedVariants().size());

        GenerationRequest request = GenerationRequest.builder()
            .jobId(job.getId())
            .imageBase64(job.getSourceImage())
            .style(style)
            .outputCount(job.getOutputsPerVariant())
            .parameters(providerParameters(job))
            .build();

        try {
            GenerationResult result = generationProvider
                .generate(request, active.getInFlightHandle()::set)
                .timeout(config.getProviderTimeout())
                .block();

            if (result == null || !result.isSuccess() || result.getOutputs() == null) {
                String reason = result != null && result.getError() != null ? result.getError() : "Unknown error";
                throw new ProviderException("Style generation failed: " + reason);
            }
            return VariantOutcome.succeeded(style, result.getOutputs(), clock.millis() - started);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            String message;
            if (cause instanceof TimeoutException) {
                message = "Generation timed out after " + formatDuration(config.getProviderTimeout());
                cancelAbandonedCall(job.getId(), style, active.getInFlightHandle().get());
            } else {
                message = String.valueOf(cause.getMessage());
            }
            log.error("Style processing failed for job {}: style={}, error={}", job.getId(), style, message);
            return VariantOutcome.failed(style, message, clock.millis() - started);
        } finally {
            active.getInFlightHandle().set(null);
        }
    }

    /**
     * The provider keeps running a call we stopped waiting for; ask it to stop
     */
    private void cancelAbandonedCall(String jobId, String style, String handle) {
        if (handle == null) {
            return;
        }
        generationProvider.cancel(handle)
            .timeout(PROVIDER_CANCEL_TIMEOUT)
            .subscribe(
                v -> { },
                e -> log.warn("Failed to cancel timed out provider call {} for job {} style {}: {}",
                    handle, jobId, style, e.getMessage()));
    }

    private BatchJob markCancelled(Execution execution) {
        String jobId = execution.active.getJobId();
        BatchJob cancelled = flush(jobId, JobProgressUpdate.builder()
            .status(JobStatus.CANCELLED)
            .currentStep(JobStatus.CANCELLED.getDescription())
            .cancelRequested(true)
            .completedAt(clock.instant())
            .errorDetails(CANCELLED_DETAILS)
            .build());
        log.info("Batch job {} cancelled with {} variants recorded", jobId, cancelled.getCompletedVariants().size());
        return cancelled;
    }

    /**
     * Best-effort FAILED transition; returns null if the store cannot be reached, in which case
     * recovery fails the job on the next start
     */
    private BatchJob markFailed(String jobId, String details) {
        try {
            return flush(jobId, JobProgressUpdate.builder()
                .status(JobStatus.FAILED)
                .currentStep(JobStatus.FAILED.getDescription())
                .completedAt(clock.instant())
                .errorDetails(details)
                .build());
        } catch (RuntimeException e) {
            log.error("Could not persist FAILED status for job {}", jobId, e);
            return null;
        }
    }

    private BatchJob flush(String jobId, JobProgressUpdate update) {
        return await(jobStore.updateProgress(jobId, update), config.getStoreTimeout(), "Persisting progress");
    }

    private <T> T await(Mono<T> mono, Duration timeout, String operation) {
        try {
            return mono.timeout(timeout).block();
        } catch (InfrastructureException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof InfrastructureException infrastructure) {
                throw infrastructure;
            }
            String reason = cause instanceof TimeoutException
                ? "timed out after " + formatDuration(timeout)
                : String.valueOf(cause.getMessage());
            throw new InfrastructureException(operation + " failed: " + reason, cause);
        }
    }

    private String failureDetails(RuntimeException e) {
        if (e instanceof InfrastructureException) {
            return e.getMessage();
        }
        return "Unexpected processing error";
    }

    /**
     * Whole seconds as "30s", anything finer as milliseconds ("300ms")
     */
    static String formatDuration(Duration duration) {
        long millis = duration.toMillis();
        return millis % 1000 == 0 ? (millis / 1000) + "s" : millis + "ms";
    }

    static int variantProgress(int variantsDone, int totalVariants) {
        return PROGRESS_PROCESSING + (int) Math.round((double) variantsDone / totalVariants * PROGRESS_VARIANT_SPAN);
    }

    private Instant estimateCompletion(Instant startedAt, int progress) {
        if (startedAt == null || progress <= 0) {
            return null;
        }
        Instant now = clock.instant();
        long elapsedMs = Duration.between(startedAt, now).toMillis();
        long remainingMs = Math.round(elapsedMs * (100.0 - progress) / progress);
        return now.plusMillis(remainingMs);
    }

    private Map<String, Object> providerParameters(BatchJob job) {
        if (job.getOptions() == null || job.getOptions().getProviderParameters() == null) {
            return Map.of();
        }
        return job.getOptions().getProviderParameters();
    }

    private BatchResults buildResults(BatchJob job, QualityAssessment assessment, Instant completedAt) {
        List<VariantOutcome> outcomes = job.getCompletedVariants();
        int successful = (int) outcomes.stream().filter(VariantOutcome::isSuccess).count();

        return BatchResults.builder()
            .jobId(job.getId())
            .batchType(job.getBatchType())
            .successfulVariants(successful)
            .failedVariants(outcomes.size() - successful)
            .totalImagesGenerated(job.totalOutputsProduced())
            .totalProcessingTimeMs(outcomes.stream().mapToLong(VariantOutcome::getProcessingTimeMs).sum())
            .inputQualityScore(assessment.getSuitabilityScore())
            .inputQualityTier(assessment.getQualityTier())
            .styleBreakdown(List.copyOf(outcomes))
            .recommendations(assessment.getRecommendations() != null ? assessment.getRecommendations() : List.of())
            .processingStarted(job.getStartedAt())
            .processingCompleted(completedAt)
            .build();
    }

    private static class Execution {
        private final ActiveJob active;
        private String step = "admission";

        Execution(ActiveJob active) {
            this.active = active;
        }
    }
}
