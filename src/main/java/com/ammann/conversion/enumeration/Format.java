/* (C)2026 */
package com.ammann.conversion.enumeration;

import com.ammann.conversion.exception.ConversionRejectedException;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Document formats understood by the conversion engine.
 * <p>
 * Declaration order is the order reported to clients by {@code list_formats}.
 */
public enum Format {
    TEXT("text", "text/plain", "txt", false, Set.of("txt", "plain")),
    MARKDOWN("markdown", "text/markdown", "md", false, Set.of("md")),
    HTML("html", "text/html", "html", false, Set.of("htm")),
    PDF("pdf", "application/pdf", "pdf", true, Set.of()),
    DOCX(
            "docx",
            "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
            "docx",
            true,
            Set.of("word"));

    private static final List<Format> ORDERED = List.of(values());

    private final String wireName;
    private final String contentType;
    private final String extension;
    private final boolean binary;
    private final Set<String> aliases;

    Format(String wireName, String contentType, String extension, boolean binary, Set<String> aliases) {
        this.wireName = wireName;
        this.contentType = contentType;
        this.extension = extension;
        this.binary = binary;
        this.aliases = aliases;
    }

    public String wireName() {
        return wireName;
    }

    public String contentType() {
        return contentType;
    }

    public String extension() {
        return extension;
    }

    /** Binary formats are carried as opaque bytes; the others are UTF-8 text. */
    public boolean isBinary() {
        return binary;
    }

    public static List<Format> ordered() {
        return ORDERED;
    }

    /**
     * Resolves a client-supplied format name (wire name, alias or enum constant, case-insensitive).
     *
     * @throws ConversionRejectedException with reason INVALID_FORMAT for unknown or blank names
     */
    public static Format fromName(String name) {
        if (name == null || name.isBlank()) {
            throw ConversionRejectedException.invalidFormat(name);
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        for (Format format : ORDERED) {
            if (format.wireName.equals(normalized)
                    || format.extension.equals(normalized)
                    || format.aliases.contains(normalized)
                    || format.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return format;
            }
        }
        throw ConversionRejectedException.invalidFormat(name);
    }
}
