/* (C)2026 */
package com.ammann.conversion.model;

import com.ammann.conversion.enumeration.Format;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered sequence of direct conversions leading from {@code source} to {@code target}.
 * <p>
 * An identity path has no hops; its conversion is a copy of the payload.
 */
public record ConversionPath(Format source, Format target, List<FormatPair> hops) {

    public ConversionPath {
        hops = List.copyOf(hops);
        Format cursor = source;
        for (FormatPair hop : hops) {
            if (hop.source() != cursor) {
                throw new IllegalArgumentException("Hop " + hop + " does not continue from " + cursor);
            }
            cursor = hop.target();
        }
        if (cursor != target) {
            throw new IllegalArgumentException("Path ends at " + cursor + ", expected " + target);
        }
    }

    public static ConversionPath identity(Format format) {
        return new ConversionPath(format, format, List.of());
    }

    public boolean isIdentity() {
        return hops.isEmpty();
    }

    public int hopCount() {
        return hops.size();
    }

    /** Intermediate formats visited between source and target. */
    public List<Format> pivots() {
        return hops.stream().skip(1).map(FormatPair::source).toList();
    }

    public String describe() {
        if (hops.isEmpty()) {
            return source.wireName();
        }
        return source.wireName()
                + hops.stream().map(h -> "->" + h.target().wireName()).collect(Collectors.joining());
    }
}
