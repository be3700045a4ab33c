/* (C)2026 */
package com.ammann.conversion.model;

import com.ammann.conversion.enumeration.Format;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Output of a completed conversion job.
 * <p>
 * The byte array is defensively copied on the way in and out so a caller can never
 * mutate the copy retained by the job store.
 */
public final class ConversionResult {

    private final Format format;
    private final byte[] content;

    public ConversionResult(Format format, byte[] content) {
        this.format = Objects.requireNonNull(format, "format");
        this.content = content.clone();
    }

    public Format format() {
        return format;
    }

    public byte[] content() {
        return content.clone();
    }

    public int size() {
        return content.length;
    }

    public String contentType() {
        return format.contentType();
    }

    /**
     * UTF-8 text of the result, or {@code null} for binary formats.
     */
    public String text() {
        return format.isBinary() ? null : new String(content, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConversionResult that)) return false;
        return format == that.format && Arrays.equals(content, that.content);
    }

    @Override
    public int hashCode() {
        return 31 * format.hashCode() + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "ConversionResult[format=" + format + ", size=" + content.length + "]";
    }
}
