package com.ammann.conversion.model;

import com.ammann.conversion.enumeration.Format;
import com.ammann.conversion.exception.ValidationException;
import java.util.Objects;

/**
 * Ordered (source, target) pair of formats; a direct edge of the format graph and the
 * key under which a converter is registered.
 */
public record FormatPair(Format source, Format target) {

    public FormatPair {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
    }

    public static FormatPair of(Format source, Format target) {
        return new FormatPair(source, target);
    }

    public boolean isIdentity() {
        return source == target;
    }

    /**
     * Parses {@code "html->pdf"} or {@code "html:pdf"}.
     */
    public static FormatPair parse(String value) {
        if (value == null) {
            throw ValidationException.invalidParameter("formatPair", null, "'source->target'");
        }
        String[] parts = value.contains("->") ? value.split("->", 2) : value.split(":", 2);
        if (parts.length != 2) {
            throw ValidationException.invalidParameter("formatPair", value, "'source->target'");
        }
        return new FormatPair(Format.fromName(parts[0]), Format.fromName(parts[1]));
    }

    @Override
    public String toString() {
        return source.wireName() + "->" + target.wireName();
    }
}
