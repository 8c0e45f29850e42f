package com.whereq.headshot.service;

import com.whereq.headshot.config.HeadshotProperties;
import com.whereq.headshot.metrics.BatchMetricsAggregator;
import com.whereq.headshot.model.JobEstimates;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Submission-time cost and duration estimates, and queue start-time estimates driven by the
 * observed average processing time.
 */
@Component
public class JobEstimator {

    private final HeadshotProperties.EstimationConfig estimation;
    private final int maxConcurrentJobs;
    private final BatchMetricsAggregator metricsAggregator;
    private final Clock clock;

    public JobEstimator(HeadshotProperties properties, BatchMetricsAggregator metricsAggregator, Clock clock) {
        this.estimation = properties.getEstimation();
        this.maxConcurrentJobs = properties.getBatch().getMaxConcurrentJobs();
        this.metricsAggregator = metricsAggregator;
        this.clock = clock;
    }

    public JobEstimates estimate(List<String> styles, int outputsPerVariant) {
        BigDecimal perStyleBase = estimation.getBaseCostPerImage().multiply(BigDecimal.valueOf(outputsPerVariant));
        BigDecimal cost = BigDecimal.ZERO;
        for (String style : styles) {
            BigDecimal multiplier = estimation.getStyleCostMultipliers().getOrDefault(style, BigDecimal.ONE);
            cost = cost.add(perStyleBase.multiply(multiplier));
        }

        return JobEstimates.builder()
            .estimatedTimeMinutes(estimation.getSetupMinutes() + styles.size() * estimation.getMinutesPerStyle())
            .estimatedCostUsd(cost.setScale(4, RoundingMode.HALF_UP))
            .totalOutputs(styles.size() * outputsPerVariant)
            .build();
    }

    /**
     * @param queuePosition 1-based queue position, 0 if not queued
     * @return estimated start, or null if the job is not queued
     */
    public Instant estimateStartTime(int queuePosition) {
        if (queuePosition <= 0) {
            return null;
        }
        double averageMinutes = metricsAggregator.averageProcessingMinutes()
            .orElse(estimation.getDefaultProcessingMinutes());
        long waitMinutes = (long) Math.ceil(queuePosition * averageMinutes / maxConcurrentJobs);
        return clock.instant().plus(Duration.ofMinutes(waitMinutes));
    }
}
