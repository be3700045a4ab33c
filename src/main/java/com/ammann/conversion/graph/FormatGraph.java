package com.ammann.conversion.graph;

import com.ammann.conversion.converter.ConverterRegistry;
import com.ammann.conversion.enumeration.Format;
import com.ammann.conversion.model.ConversionPath;
import com.ammann.conversion.model.FormatPair;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Directed graph of direct conversions between formats.
 * <p>
 * {@link #resolve(Format, Format)} finds the path with the fewest hops using breadth-first
 * search. Neighbours are expanded in a fixed priority order so that, among equally short
 * paths, the one through the higher-priority pivot wins and the result never depends on
 * registration order.
 */
public final class FormatGraph {

    /** Expansion order used to break ties between equally short paths. */
    public static final List<Format> PRIORITY =
            List.of(Format.HTML, Format.MARKDOWN, Format.TEXT, Format.DOCX, Format.PDF);

    private final Set<FormatPair> edges;
    private final Map<Format, List<Format>> adjacency;

    public FormatGraph(Collection<FormatPair> edges) {
        Set<FormatPair> copy = new LinkedHashSet<>();
        for (FormatPair edge : edges) {
            if (!edge.isIdentity()) {
                copy.add(edge);
            }
        }
        this.edges = Collections.unmodifiableSet(copy);

        Map<Format, List<Format>> adj = new EnumMap<>(Format.class);
        for (Format from : Format.values()) {
            List<Format> targets = new ArrayList<>();
            for (Format to : PRIORITY) {
                if (copy.contains(FormatPair.of(from, to))) {
                    targets.add(to);
                }
            }
            adj.put(from, List.copyOf(targets));
        }
        this.adjacency = Collections.unmodifiableMap(adj);
    }

    /**
     * Graph over the registry's converters, minus the excluded edges.
     */
    public static FormatGraph from(ConverterRegistry registry, Collection<FormatPair> excluded) {
        Set<FormatPair> edges = new LinkedHashSet<>(registry.pairs());
        edges.removeAll(excluded);
        return new FormatGraph(edges);
    }

    /**
     * Shortest conversion path from {@code source} to {@code target}.
     *
     * @return the zero-hop identity path when both formats are equal, or empty when the
     *     target cannot be reached
     */
    public Optional<ConversionPath> resolve(Format source, Format target) {
        if (source == target) {
            return Optional.of(ConversionPath.identity(source));
        }

        Map<Format, Format> parent = new EnumMap<>(Format.class);
        Set<Format> visited = EnumSet.of(source);
        Deque<Format> queue = new ArrayDeque<>();
        queue.add(source);

        while (!queue.isEmpty()) {
            Format current = queue.poll();
            for (Format next : adjacency.get(current)) {
                if (!visited.add(next)) {
                    continue;
                }
                parent.put(next, current);
                if (next == target) {
                    return Optional.of(buildPath(source, target, parent));
                }
                queue.add(next);
            }
        }
        return Optional.empty();
    }

    public boolean hasEdge(FormatPair pair) {
        return edges.contains(pair);
    }

    public Set<FormatPair> edges() {
        return edges;
    }

    /** Formats that take part in at least one edge, in declaration order. */
    public Set<Format> formats() {
        Set<Format> formats = EnumSet.noneOf(Format.class);
        for (FormatPair edge : edges) {
            formats.add(edge.source());
            formats.add(edge.target());
        }
        return Collections.unmodifiableSet(formats);
    }

    private static ConversionPath buildPath(Format source, Format target, Map<Format, Format> parent) {
        List<FormatPair> hops = new ArrayList<>();
        Format cursor = target;
        while (cursor != source) {
            Format previous = parent.get(cursor);
            hops.add(FormatPair.of(previous, cursor));
            cursor = previous;
        }
        Collections.reverse(hops);
        return new ConversionPath(source, target, hops);
    }
}
