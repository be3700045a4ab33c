/* (C)2026 */
package com.ammann.conversion.service;

import com.ammann.conversion.enumeration.Format;
import com.ammann.conversion.enumeration.JobStatus;
import com.ammann.conversion.model.ConversionError;
import com.ammann.conversion.model.ConversionPath;
import com.ammann.conversion.model.ConversionResult;
import com.ammann.conversion.model.JobSnapshot;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Mutable job record owned by {@link JobStore}. Every read or write of the mutable fields
 * happens while holding the instance monitor.
 */
final class ConversionJob {

    final UUID id;
    final Format sourceFormat;
    final Format targetFormat;
    final ConversionPath path;
    final int payloadSize;
    final Instant createdAt;
    final CompletableFuture<JobSnapshot> terminal = new CompletableFuture<>();

    JobStatus status = JobStatus.QUEUED;
    int completedHops;
    ConversionResult result;
    ConversionError error;
    Instant updatedAt;
    Instant startedAt;
    Instant completedAt;

    ConversionJob(
            UUID id,
            Format sourceFormat,
            Format targetFormat,
            ConversionPath path,
            int payloadSize,
            Instant createdAt) {
        this.id = id;
        this.sourceFormat = sourceFormat;
        this.targetFormat = targetFormat;
        this.path = path;
        this.payloadSize = payloadSize;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    JobSnapshot snapshot() {
        return new JobSnapshot(
                id,
                sourceFormat,
                targetFormat,
                status,
                path,
                completedHops,
                payloadSize,
                result,
                error,
                createdAt,
                updatedAt,
                startedAt,
                completedAt);
    }
}
