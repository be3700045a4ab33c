package com.ammann.conversion.exception;

import java.util.UUID;

/**
 * Lookup of a job id that is unknown or already evicted.

 */
public class JobNotFoundException extends ApiException {

    public static final String CODE = "NOT_FOUND";

    public JobNotFoundException(UUID jobId) {
        this(String.valueOf(jobId));
    }

    public JobNotFoundException(String jobId) {
        super(CODE, 404, "Conversion job not found: " + jobId);
    }
}
