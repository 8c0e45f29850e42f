package com.whereq.headshot.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Result of assessing a source photo for headshot generation
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QualityAssessment {
    /**
     * Whether the image could be decoded and used at all
     */
    private boolean usable;

    /**
     * Overall suitability score, 0-100
     */
    private int suitabilityScore;

    /**
     * Readiness tier: ready, good, needs_improvement, not_recommended
     */
    private String qualityTier;

    /**
     * Suggestions for a better source photo
     */
    private List<String> recommendations;

    /**
     * Reasons the image is not usable
     */
    private List<String> errors;

    public static final String TIER_UNASSESSED = "unassessed";

    /**
     * Neutral result used when the check itself could not run; processing continues
     */
    public static QualityAssessment unavailable() {
        return QualityAssessment.builder()
            .usable(true)
            .suitabilityScore(0)
            .qualityTier(TIER_UNASSESSED)
            .recommendations(List.of("Photo quality check did not complete; retry the check to get a quality score"))
            .errors(List.of())
            .build();
    }

    public static String tierFor(int score) {
        if (score >= 85) {
            return "ready";
        } else if (score >= 70) {
            return "good";
        } else if (score >= 55) {
            return "needs_improvement";
        }
        return "not_recommended";
    }
}
