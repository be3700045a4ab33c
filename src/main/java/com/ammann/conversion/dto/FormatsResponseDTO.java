/* (C)2026 */
package com.ammann.conversion.dto;

import com.ammann.conversion.enumeration.Format;
import com.ammann.conversion.model.FormatPair;
import java.util.Collection;
import java.util.List;

/**
 * Supported formats and the direct conversions between them.
 */
public record FormatsResponseDTO(List<FormatDTO> formats, List<String> conversions) {

    public static FormatsResponseDTO of(List<Format> formats, Collection<FormatPair> conversions) {
        return new FormatsResponseDTO(
                formats.stream().map(FormatDTO::from).toList(),
                conversions.stream().map(FormatPair::toString).toList());
    }

    public record FormatDTO(String name, String contentType, String extension, boolean binary) {

        public static FormatDTO from(Format format) {
            return new FormatDTO(format.wireName(), format.contentType(), format.extension(), format.isBinary());
        }
    }
}
