package com.whereq.headshot.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Summary persisted with a completed batch job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchResults {
    private String jobId;
    private String batchType;
    private int successfulVariants;
    private int failedVariants;
    private int totalImagesGenerated;

    /**
     * Sum of per-variant processing time in milliseconds
     */
    private long totalProcessingTimeMs;

    /**
     * Input photo quality echoed from preprocessing
     */
    private Integer inputQualityScore;
    private String inputQualityTier;

    private List<VariantOutcome> styleBreakdown;
    private List<String> recommendations;

    private Instant processingStarted;
    private Instant processingCompleted;
}
