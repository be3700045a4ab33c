package com.ammann.conversion.exception;

import com.ammann.conversion.enumeration.JobStatus;
import java.util.UUID;

/**
 * Attempt to move a job along an edge the status machine does not allow.
 *
 * <p>Internal invariant violation: the job store rejects the request without mutating
 * the job. Callers log it; it never reaches a client as such.
 */
public class InvalidTransitionException extends IllegalStateException {

    private final UUID jobId;
    private final JobStatus from;
    private final JobStatus to;

    public InvalidTransitionException(UUID jobId, JobStatus from, JobStatus to) {
        super(String.format("Invalid transition for job %s: %s -> %s", jobId, from, to));
        this.jobId = jobId;
        this.from = from;
        this.to = to;
    }

    public UUID getJobId() {
        return jobId;
    }

    public JobStatus getFrom() {
        return from;
    }

    public JobStatus getTo() {
        return to;
    }
}
