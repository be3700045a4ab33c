/* (C)2026 */
package com.ammann.conversion.model;

import com.ammann.conversion.enumeration.Format;
import com.ammann.conversion.enumeration.JobStatus;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable, point-in-time view of a conversion job.
 * <p>
 * {@code result} is non-null only when COMPLETED, {@code error} only when FAILED.
 * {@code completedHops} counts the hops of {@code path} already converted.
 */
public record JobSnapshot(
        UUID id,
        Format sourceFormat,
        Format targetFormat,
        JobStatus status,
        ConversionPath path,
        int completedHops,
        int payloadSize,
        ConversionResult result,
        ConversionError error,
        Instant createdAt,
        Instant updatedAt,
        Instant startedAt,
        Instant completedAt) {

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Fraction of the path already converted, between 0 and 1. An identity path jumps
     * from 0 to 1 when it completes.
     */
    public double progress() {
        if (path.isIdentity()) {
            return status == JobStatus.COMPLETED ? 1.0 : 0.0;
        }
        return (double) completedHops / path.hopCount();
    }
}
