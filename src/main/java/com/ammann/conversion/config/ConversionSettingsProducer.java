/* (C)2026 */
package com.ammann.conversion.config;

import com.ammann.conversion.converter.ConverterRegistry;
import com.ammann.conversion.graph.FormatGraph;
import com.ammann.conversion.model.FormatPair;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * CDI producer for the conversion settings and the immutable conversion catalogue.
 *
 * <p>Configuration properties (see application.properties for the environment overrides):
 * <ul>
 *   <li>conversion.max-payload-bytes</li>
 *   <li>conversion.jobs.max-concurrent, max-duration, retention</li>
 *   <li>conversion.events.buffer-capacity, max-consecutive-drops, inactivity-timeout,
 *       max-subscribers</li>
 *   <li>conversion.graph.excluded-edges ({@code source->target}, comma separated)</li>
 * </ul>
 */
@ApplicationScoped
public class ConversionSettingsProducer {

    private static final Logger LOG = Logger.getLogger(ConversionSettingsProducer.class);

    @ConfigProperty(name = "conversion.max-payload-bytes", defaultValue = "52428800")
    long maxPayloadBytes;

    @ConfigProperty(name = "conversion.jobs.max-concurrent", defaultValue = "10")
    int maxConcurrent;

    @ConfigProperty(name = "conversion.jobs.max-duration", defaultValue = "300s")
    Duration maxDuration;

    @ConfigProperty(name = "conversion.jobs.retention", defaultValue = "1h")
    Duration retention;

    @ConfigProperty(name = "conversion.events.buffer-capacity", defaultValue = "256")
    int bufferCapacity;

    @ConfigProperty(name = "conversion.events.max-consecutive-drops", defaultValue = "1024")
    int maxConsecutiveDrops;

    @ConfigProperty(name = "conversion.events.inactivity-timeout", defaultValue = "1h")
    Duration inactivityTimeout;

    @ConfigProperty(name = "conversion.events.max-subscribers", defaultValue = "100")
    int maxSubscribers;

    @ConfigProperty(name = "conversion.graph.excluded-edges")
    Optional<List<String>> excludedEdges;

    @Produces
    @Singleton
    public ConversionSettings settings() {
        Set<FormatPair> excluded = new LinkedHashSet<>();
        excludedEdges.ifPresent(values -> values.stream()
                .filter(value -> !value.isBlank())
                .map(FormatPair::parse)
                .forEach(excluded::add));

        ConversionSettings settings =
                new ConversionSettings(
                        maxPayloadBytes,
                        maxConcurrent,
                        maxDuration,
                        retention,
                        bufferCapacity,
                        maxConsecutiveDrops,
                        inactivityTimeout,
                        maxSubscribers,
                        excluded);
        LOG.infof(
                "Conversion settings: maxPayloadBytes=%d maxConcurrent=%d maxDuration=%s retention=%s"
                        + " bufferCapacity=%d maxSubscribers=%d excludedEdges=%s",
                maxPayloadBytes, maxConcurrent, maxDuration, retention, bufferCapacity, maxSubscribers, excluded);
        return settings;
    }

    @Produces
    @Singleton
    public ConverterRegistry converterRegistry() {
        return ConverterRegistry.defaults();
    }

    @Produces
    @Singleton
    public FormatGraph formatGraph(ConverterRegistry registry, ConversionSettings settings) {
        return FormatGraph.from(registry, settings.excludedEdges());
    }
}
