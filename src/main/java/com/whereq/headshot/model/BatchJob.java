package com.whereq.headshot.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Persisted batch generation job. The job store is the system of record; every change goes
 * through {@link #apply(JobProgressUpdate)} so that terminal records stay frozen.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BatchJob {
    private String id;
    private String ownerId;

    /**
     * Preset name, or custom_batch for an explicit style list
     */
    private String batchType;

    /**
     * Styles in processing order
     */
    private List<String> requestedVariants;

    private int outputsPerVariant;
    private JobPriority priority;

    @Builder.Default
    private JobStatus status = JobStatus.QUEUED;

    private int progress;
    private String currentStep;

    @Builder.Default
    private List<VariantOutcome> completedVariants = new ArrayList<>();

    private JobEstimates estimates;

    /**
     * Base64 source image, dropped once the job is terminal
     */
    private String sourceImage;

    private BatchOptions options;

    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
    private Instant estimatedCompletion;
    private Long processingTimeSeconds;

    private BatchResults results;
    private String errorDetails;
    private boolean cancelRequested;

    /**
     * Apply an incremental update in place.
     *
     * @param update the change to apply
     * @return true if the record changed
     * @throws IllegalStateException if the update would record more variants than were requested
     */
    public boolean apply(JobProgressUpdate update) {
        if (status.isTerminal()) {
            if (completedAt == null && update.getCompletedAt() != null) {
                completedAt = update.getCompletedAt();
                return true;
            }
            return false;
        }

        if (update.getStatus() != null) {
            status = update.getStatus();
        }
        if (update.getProgress() != null) {
            progress = Math.max(progress, update.getProgress());
        }
        if (!status.isTerminal()) {
            progress = Math.min(progress, 99);
        }
        if (update.getCurrentStep() != null) {
            currentStep = update.getCurrentStep();
        }
        if (update.getAppendVariant() != null) {
            if (completedVariants.size() >= requestedVariants.size()) {
                throw new IllegalStateException("Job " + id + " already recorded all "
                    + requestedVariants.size() + " variants");
            }
            completedVariants.add(update.getAppendVariant());
        }
        if (startedAt == null && update.getStartedAt() != null) {
            startedAt = update.getStartedAt();
        }
        if (completedAt == null && update.getCompletedAt() != null) {
            completedAt = update.getCompletedAt();
        }
        if (update.getEstimatedCompletion() != null) {
            estimatedCompletion = update.getEstimatedCompletion();
        }
        if (update.getProcessingTimeSeconds() != null) {
            processingTimeSeconds = update.getProcessingTimeSeconds();
        }
        if (update.getResults() != null) {
            results = update.getResults();
        }
        if (update.getErrorDetails() != null) {
            errorDetails = update.getErrorDetails();
        }
        if (Boolean.TRUE.equals(update.getCancelRequested())) {
            cancelRequested = true;
        }
        if (status.isTerminal()) {
            sourceImage = null;
            estimatedCompletion = null;
        }
        return true;
    }

    /**
     * Detached copy, so callers never share mutable state with a store
     */
    public BatchJob copy() {
        return toBuilder()
            .requestedVariants(requestedVariants == null ? null : List.copyOf(requestedVariants))
            .completedVariants(new ArrayList<>(completedVariants))
            .build();
    }

    public int totalOutputsProduced() {
        return completedVariants.stream().mapToInt(VariantOutcome::getImagesCount).sum();
    }
}
