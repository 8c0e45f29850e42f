package com.whereq.headshot.model;

/**
 * Admission priority of a batch job. Lower rank is admitted first.
 */
public enum JobPriority {
    HIGH(0),
    MEDIUM(1),
    LOW(2);

    private final int rank;

    JobPriority(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }
}
