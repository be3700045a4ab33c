/* (C)2026 */
package com.ammann.conversion.enumeration;

import java.util.Locale;

/**
 * Current conversion job status.
 * <p>
 * Expected transition sequence is QUEUED to RUNNING and then to either COMPLETED or FAILED.
 * Statuses are ordered by {@link #rank()}; a job never moves to a lower rank.
 */
public enum JobStatus {
    /** Job accepted but not yet picked up by a worker */
    QUEUED(0),
    /** Job is executing its conversion hops */
    RUNNING(1),
    /** Job completed successfully */
    COMPLETED(2),
    /** Job failed with an error */
    FAILED(2);

    private final int rank;

    JobStatus(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Whether a job in this status may move to {@code next}.
     * <p>
     * QUEUED may also fail directly when the worker pool refuses the job.
     */
    public boolean canTransitionTo(JobStatus next) {
        return switch (this) {
            case QUEUED -> next == RUNNING || next == FAILED;
            case RUNNING -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
