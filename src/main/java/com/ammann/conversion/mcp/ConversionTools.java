package com.ammann.conversion.mcp;

import com.ammann.conversion.dto.ConversionJobDTO;
import com.ammann.conversion.enumeration.Format;
import com.ammann.conversion.exception.ApiException;
import com.ammann.conversion.exception.ConversionRejectedException;
import com.ammann.conversion.exception.JobNotFoundException;
import com.ammann.conversion.exception.ValidationException;
import com.ammann.conversion.service.ConversionEngine;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkiverse.mcp.server.Tool;
import io.quarkiverse.mcp.server.ToolArg;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.UUID;
import java.util.stream.Collectors;
import org.jboss.logging.Logger;

/**
 * MCP tools exposing the conversion engine to model clients.
 * <p>
 * Failures are returned as text starting with {@code "Error:"} rather than thrown, so the
 * client always gets a readable answer.
 */
@ApplicationScoped
public class ConversionTools {

    private static final Logger LOG = Logger.getLogger(ConversionTools.class);

    private final ConversionEngine engine;
    private final ObjectMapper objectMapper;

    @Inject
    public ConversionTools(ConversionEngine engine, ObjectMapper objectMapper) {
        this.engine = engine;
        this.objectMapper = objectMapper;
    }

    @Tool(
            name = "convert_document",
            description =
                    "Convert a document between formats (text, markdown, html, pdf, docx). Binary"
                            + " source formats (pdf, docx) take Base64 content. Returns the job id.")
    public String convertDocument(
            @ToolArg(name = "source_format", description = "Source document format") String sourceFormat,
            @ToolArg(name = "target_format", description = "Target document format") String targetFormat,
            @ToolArg(name = "content", description = "Document content; Base64 for pdf and docx") String content) {
        if (sourceFormat == null || sourceFormat.isBlank() || targetFormat == null || targetFormat.isBlank()) {
            return "Error: source_format and target_format are required";
        }
        if (content == null) {
            return "Error: content is required";
        }
        try {
            UUID jobId = engine.submit(sourceFormat, targetFormat, decode(sourceFormat, content));
            return "Document conversion started. Job ID: " + jobId;
        } catch (ApiException e) {
            LOG.debugf("convert_document refused: %s", e.getMessage());
            return "Error: " + e.getMessage();
        }
    }

    @Tool(name = "list_supported_formats", description = "List all supported document formats for conversion")
    public String listSupportedFormats() {
        String formats = engine.listFormats().stream().map(Format::wireName).collect(Collectors.joining(", "));
        String conversions = engine.supportedConversions().stream()
                .map(Object::toString)
                .collect(Collectors.joining(", "));
        return "Supported formats: " + formats + "\nDirect conversions: " + conversions;
    }

    @Tool(name = "get_conversion_status", description = "Get the status of a document conversion job")
    public String getConversionStatus(
            @ToolArg(name = "job_id", description = "Conversion job ID") String jobId) {
        if (jobId == null || jobId.isBlank()) {
            return "Error: job_id is required";
        }
        UUID id;
        try {
            id = UUID.fromString(jobId.trim());
        } catch (IllegalArgumentException e) {
            return "Error: " + new JobNotFoundException(jobId).getMessage();
        }
        return engine.status(id)
                .map(job -> toJson(ConversionJobDTO.from(job)))
                .orElseGet(() -> "Error: " + new JobNotFoundException(id).getMessage());
    }

    /** Unknown source formats are left to the engine, which rejects them. */
    private static byte[] decode(String sourceFormat, String content) {
        boolean binary;
        try {
            binary = Format.fromName(sourceFormat).isBinary();
        } catch (ConversionRejectedException e) {
            binary = false;
        }
        if (!binary) {
            return content.getBytes(StandardCharsets.UTF_8);
        }
        try {
            return Base64.getMimeDecoder().decode(content);
        } catch (IllegalArgumentException e) {
            throw ValidationException.invalidBase64("content", e);
        }
    }

    private String toJson(ConversionJobDTO job) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(job);
        } catch (JsonProcessingException e) {
            LOG.errorf(e, "Failed to serialize status of job %s", job.jobId());
            return "Error: failed to serialize job status";
        }
    }
}
