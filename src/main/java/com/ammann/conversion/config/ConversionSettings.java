/* (C)2026 */
package com.ammann.conversion.config;

import com.ammann.conversion.model.FormatPair;
import java.time.Duration;
import java.util.Set;

/**
 * Immutable runtime limits of the conversion service, read once at startup by
 * {@link ConversionSettingsProducer}.
 *
 * @param maxPayloadBytes largest accepted input document
 * @param maxConcurrent conversions executing at the same time; further jobs wait queued
 * @param maxDuration longest a job may stay RUNNING before the watchdog fails it
 * @param retention how long terminal jobs stay queryable
 * @param bufferCapacity events buffered per event-stream subscriber
 * @param maxConsecutiveDrops dropped events in a row after which a subscriber is disconnected
 * @param inactivityTimeout idle time after which a subscriber is disconnected
 * @param maxSubscribers concurrent event-stream subscribers
 * @param excludedEdges direct conversions removed from the format graph
 */
public record ConversionSettings(
        long maxPayloadBytes,
        int maxConcurrent,
        Duration maxDuration,
        Duration retention,
        int bufferCapacity,
        int maxConsecutiveDrops,
        Duration inactivityTimeout,
        int maxSubscribers,
        Set<FormatPair> excludedEdges) {

    public static final long DEFAULT_MAX_PAYLOAD_BYTES = 50L * 1024 * 1024;

    public ConversionSettings {
        if (maxPayloadBytes <= 0) {
            throw new IllegalArgumentException("maxPayloadBytes must be positive");
        }
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException("maxConcurrent must be positive");
        }
        if (bufferCapacity <= 0) {
            throw new IllegalArgumentException("bufferCapacity must be positive");
        }
        if (maxSubscribers <= 0) {
            throw new IllegalArgumentException("maxSubscribers must be positive");
        }
        excludedEdges = excludedEdges == null ? Set.of() : Set.copyOf(excludedEdges);
    }

    /** Values used when nothing is configured. */
    public static ConversionSettings defaults() {
        return new ConversionSettings(
                DEFAULT_MAX_PAYLOAD_BYTES,
                10,
                Duration.ofMinutes(5),
                Duration.ofHours(1),
                256,
                1024,
                Duration.ofHours(1),
                100,
                Set.of());
    }
}
