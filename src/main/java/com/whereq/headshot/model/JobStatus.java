package com.whereq.headshot.model;

/**
 * Batch job lifecycle states
 *
 * State transitions:
 * QUEUED → PREPROCESSING → PROCESSING → POSTPROCESSING → {COMPLETED, FAILED, CANCELLED}
 * QUEUED → CANCELLED (cancelled before admission)
 */
public enum JobStatus {
    /**
     * Waiting in the priority queue for a worker slot
     */
    QUEUED("Waiting in queue"),

    /**
     * Admitted, validating and assessing the source image
     */
    PREPROCESSING("Preparing image"),

    /**
     * Iterating the requested style variants
     */
    PROCESSING("Generating headshots"),

    /**
     * All variants attempted, building the batch summary
     */
    POSTPROCESSING("Finalizing results"),

    /**
     * Ran to completion, possibly with failed variants
     */
    COMPLETED("Completed successfully"),

    /**
     * Infrastructure-level failure
     */
    FAILED("Generation failed"),

    /**
     * User-initiated cancellation
     */
    CANCELLED("Cancelled by user");

    private final String description;

    JobStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Check if this is a terminal state
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Check if a worker currently owns the job
     */
    public boolean isInFlight() {
        return this == PREPROCESSING || this == PROCESSING || this == POSTPROCESSING;
    }
}
