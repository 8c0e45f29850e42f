package com.whereq.headshot.dto;

import com.whereq.headshot.metrics.MetricsSnapshot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Scheduler state and aggregated processing metrics
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceMetricsResponse {
    private int activeJobs;
    private int queuedJobs;
    private int maxConcurrentJobs;
    private int peakActiveJobs;
    private int peakQueueDepth;

    private long totalJobsProcessed;
    private double averageProcessingTimeMs;
    private double successRate;
    private double averageQueueWaitMs;
    private long totalImagesGenerated;
    private Map<String, MetricsSnapshot.StylePerformance> stylePerformance;

    private List<String> availablePresets;
}
