/* (C)2026 */
package com.ammann.conversion.model;

import com.ammann.conversion.enumeration.EventKind;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable event describing a job status change, or a broadcaster heartbeat.
 *
 * @param kind event kind
 * @param jobId associated job, {@code null} for heartbeats
 * @param timestamp when the event was created
 * @param payload kind-specific details; never null, unmodifiable
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LifecycleEvent(EventKind kind, UUID jobId, Instant timestamp, Map<String, Object> payload) {

    public LifecycleEvent {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(timestamp, "timestamp");
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    /**
     * Event announcing the status the snapshot is in. A RUNNING job announces itself once
     * when it starts and again after each intermediate hop, with its progress.
     */
    public static LifecycleEvent forJob(JobSnapshot job) {
        Map<String, Object> payload = new LinkedHashMap<>();
        switch (job.status()) {
            case QUEUED -> {
                payload.put("sourceFormat", job.sourceFormat().wireName());
                payload.put("targetFormat", job.targetFormat().wireName());
            }
            case RUNNING -> {
                payload.put("path", job.path().describe());
                payload.put("hops", job.path().hopCount());
                payload.put("completedHops", job.completedHops());
                payload.put("progress", job.progress());
            }
            case COMPLETED -> {
                payload.put("contentType", job.result().contentType());
                payload.put("resultSize", job.result().size());
            }
            case FAILED -> {
                payload.put("errorKind", job.error().kind().wireName());
                payload.put("message", job.error().message());
            }
        }
        return new LifecycleEvent(EventKind.forStatus(job.status()), job.id(), job.updatedAt(), payload);
    }

    public static LifecycleEvent heartbeat(Instant now, int subscribers) {
        return new LifecycleEvent(EventKind.HEARTBEAT, null, now, Map.of("subscribers", subscribers));
    }
}
