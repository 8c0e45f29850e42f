package com.whereq.headshot.metrics;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Point-in-time copy of the aggregated batch metrics
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricsSnapshot {
    private long totalJobsProcessed;
    private double averageProcessingTimeMs;

    /**
     * Fraction of processed jobs with at least one successful variant
     */
    private double successRate;

    private double averageQueueWaitMs;
    private long totalImagesGenerated;
    private Map<String, StylePerformance> stylePerformance;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StylePerformance {
        private long attempts;
        private long successes;

        public double getSuccessRate() {
            return attempts == 0 ? 0.0 : (double) successes / attempts;
        }
    }
}
