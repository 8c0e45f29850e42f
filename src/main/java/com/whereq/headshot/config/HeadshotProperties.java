package com.whereq.headshot.config;

import com.whereq.headshot.model.JobPriority;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the headshot batch service.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "headshot")
@Data
public class HeadshotProperties {

    public static final String CUSTOM_BATCH = "custom_batch";

    private BatchConfig batch = new BatchConfig();
    private EstimationConfig estimation = new EstimationConfig();
    private ProviderConfig provider = new ProviderConfig();
    private StoreConfig store = new StoreConfig();

    @Data
    public static class BatchConfig {
        /**
         * Maximum number of jobs processed at the same time.
         */
        private int maxConcurrentJobs = 3;

        /**
         * Submissions are rejected once this many jobs are queued.
         */
        private int maxQueueSize = 50;

        /**
         * Scheduler admission tick.
         */
        private Duration tickInterval = Duration.ofSeconds(5);

        private Duration providerTimeout = Duration.ofSeconds(120);
        private Duration assessmentTimeout = Duration.ofSeconds(30);
        private Duration storeTimeout = Duration.ofSeconds(10);

        /**
         * How long shutdown waits for active jobs before failing them.
         */
        private Duration shutdownTimeout = Duration.ofSeconds(60);

        /**
         * Suitability scores below this are logged as low quality.
         */
        private int lowQualityThreshold = 40;

        private int maxVariantsPerJob = 10;
        private int maxOutputsPerVariant = 8;
        private int defaultOutputsPerVariant = 3;

        private Map<String, PresetConfig> presets = defaultPresets();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PresetConfig {
        /**
         * Styles in processing order. Empty for custom_batch.
         */
        private List<String> styles;
        private int outputsPerStyle;
        private int estimatedTimeMinutes;
        private JobPriority priority;
    }

    @Data
    public static class EstimationConfig {
        private int setupMinutes = 1;
        private int minutesPerStyle = 2;

        /**
         * Used for start-time estimates until a job has completed.
         */
        private double defaultProcessingMinutes = 8;

        private BigDecimal baseCostPerImage = new BigDecimal("0.0023");
        private Map<String, BigDecimal> styleCostMultipliers = defaultMultipliers();
    }

    @Data
    public static class ProviderConfig {
        private String baseUrl = "https://api.replicate.com/v1";
        private String apiToken;
        private String modelVersion;

        /**
         * Interval between prediction status polls.
         */
        private Duration pollInterval = Duration.ofSeconds(2);
    }

    @Data
    public static class StoreConfig {
        /**
         * redis (default) or memory
         */
        private String type = "redis";

        /**
         * TTL applied to job records once terminal.
         */
        private Duration terminalRetention = Duration.ofDays(30);
    }

    private static Map<String, PresetConfig> defaultPresets() {
        Map<String, PresetConfig> presets = new LinkedHashMap<>();
        presets.put("professional_package", new PresetConfig(
            List.of("corporate", "creative", "executive"), 4, 8, JobPriority.HIGH));
        presets.put("complete_package", new PresetConfig(
            List.of("corporate", "creative", "executive", "startup", "healthcare"), 3, 12, JobPriority.MEDIUM));
        presets.put("style_comparison", new PresetConfig(
            List.of("corporate", "creative"), 2, 4, JobPriority.HIGH));
        presets.put(CUSTOM_BATCH, new PresetConfig(List.of(), 3, 0, JobPriority.MEDIUM));
        return presets;
    }

    private static Map<String, BigDecimal> defaultMultipliers() {
        Map<String, BigDecimal> multipliers = new LinkedHashMap<>();
        multipliers.put("corporate", new BigDecimal("1.0"));
        multipliers.put("creative", new BigDecimal("0.9"));
        multipliers.put("executive", new BigDecimal("1.2"));
        multipliers.put("startup", new BigDecimal("0.8"));
        multipliers.put("healthcare", new BigDecimal("1.0"));
        return multipliers;
    }
}
