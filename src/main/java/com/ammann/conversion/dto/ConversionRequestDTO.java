/* (C)2026 */
package com.ammann.conversion.dto;

import com.ammann.conversion.exception.ValidationException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Body of {@code POST /api/v1/conversions}.
 * <p>
 * Text documents are sent in {@code content}; binary documents (PDF, DOCX) in
 * {@code contentBase64}. Exactly one of the two must be present.
 */
@Schema(description = "Document conversion request")
public record ConversionRequestDTO(
        @Schema(description = "Source format name or extension", example = "markdown") String sourceFormat,
        @Schema(description = "Target format name or extension", example = "html") String targetFormat,
        @Schema(description = "UTF-8 document content") String content,
        @Schema(description = "Base64-encoded document content") String contentBase64) {

    /**
     * Decoded document bytes.
     *
     * @throws ValidationException when neither or both contents are given, or the Base64
     *     content cannot be decoded
     */
    public byte[] payload() {
        if (content != null && contentBase64 != null) {
            throw ValidationException.conflictingDocuments("content", "contentBase64");
        }
        if (content != null) {
            return content.getBytes(StandardCharsets.UTF_8);
        }
        if (contentBase64 == null) {
            throw ValidationException.missingDocument("content", "contentBase64");
        }
        try {
            return Base64.getMimeDecoder().decode(contentBase64);
        } catch (IllegalArgumentException e) {
            throw ValidationException.invalidBase64("contentBase64", e);
        }
    }
}
