package com.ammann.conversion.exception;

import com.ammann.conversion.enumeration.JobStatus;
import java.util.UUID;

/**
 * Operation that needs a job in a different status than the one it is in
 * (e.g. downloading the result of a running job, deleting an active one).

 */
public class JobConflictException extends ApiException {

    public JobConflictException(UUID jobId, JobStatus status, String operation) {
        super("CONFLICT", 409, String.format("Cannot %s job %s while it is %s", operation, jobId, status));
    }
}
