/* (C)2026 */
package com.ammann.conversion.dto;

import com.ammann.conversion.properties.ApiProperties;
import java.util.UUID;

/**
 * Returned immediately after a conversion job was accepted.
 */
public record ConversionStartResponseDTO(UUID jobId, String status, String message) {

    public static ConversionStartResponseDTO queued(UUID jobId) {
        return new ConversionStartResponseDTO(
                jobId,
                "queued",
                String.format(
                        "Conversion job queued. Use GET %s%s/%s to check progress.",
                        ApiProperties.BASE_URL_V1, ApiProperties.Conversions.BASE, jobId));
    }
}
