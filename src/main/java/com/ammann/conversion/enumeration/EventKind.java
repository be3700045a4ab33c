package com.ammann.conversion.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Kinds of lifecycle events fanned out to event stream subscribers.
 */
public enum EventKind {
    JOB_QUEUED,
    JOB_RUNNING,
    JOB_COMPLETED,
    JOB_FAILED,
    HEARTBEAT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Event announcing that a job entered the given status.
     */
    public static EventKind forStatus(JobStatus status) {
        return switch (status) {
            case QUEUED -> JOB_QUEUED;
            case RUNNING -> JOB_RUNNING;
            case COMPLETED -> JOB_COMPLETED;
            case FAILED -> JOB_FAILED;
        };
    }
}
