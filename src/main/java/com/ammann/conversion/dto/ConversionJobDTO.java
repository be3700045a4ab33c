/* (C)2026 */
package com.ammann.conversion.dto;

import com.ammann.conversion.model.ConversionError;
import com.ammann.conversion.model.ConversionResult;
import com.ammann.conversion.model.JobSnapshot;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Base64;
import java.util.UUID;

/**
 * Conversion job status as reported by the REST and MCP front-ends.
 * <p>
 * {@code result} is present once the job completed, {@code error} once it failed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConversionJobDTO(
        UUID jobId,
        String sourceFormat,
        String targetFormat,
        String status,
        String path,
        double progress,
        int payloadSize,
        Instant createdAt,
        Instant updatedAt,
        Instant startedAt,
        Instant completedAt,
        ResultDTO result,
        ErrorDTO error) {

    public static ConversionJobDTO from(JobSnapshot job) {
        return new ConversionJobDTO(
                job.id(),
                job.sourceFormat().wireName(),
                job.targetFormat().wireName(),
                job.status().wireName(),
                job.path().describe(),
                job.progress(),
                job.payloadSize(),
                job.createdAt(),
                job.updatedAt(),
                job.startedAt(),
                job.completedAt(),
                job.result() == null ? null : ResultDTO.from(job.result()),
                job.error() == null ? null : ErrorDTO.from(job.error()));
    }

    /**
     * @return true if job is queued or running
     */
    @JsonIgnore
    public boolean isActive() {
        return "queued".equals(status) || "running".equals(status);
    }

    /**
     * Conversion output; text formats inline, binary formats Base64-encoded.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ResultDTO(String format, String contentType, int size, String content, String contentBase64) {

        public static ResultDTO from(ConversionResult result) {
            boolean binary = result.format().isBinary();
            return new ResultDTO(
                    result.format().wireName(),
                    result.contentType(),
                    result.size(),
                    binary ? null : result.text(),
                    binary ? Base64.getEncoder().encodeToString(result.content()) : null);
        }
    }

    public record ErrorDTO(String kind, String message) {

        public static ErrorDTO from(ConversionError error) {
            return new ErrorDTO(error.kind().wireName(), error.message());
        }
    }
}
