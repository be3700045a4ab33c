/* (C)2026 */
package com.ammann.conversion.startup;

import com.ammann.conversion.graph.FormatGraph;
import com.ammann.conversion.service.EventBroadcaster;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Reports the conversion catalogue on startup and ends open event streams on shutdown.
 * <p>
 * Jobs live in memory only, so a restart starts with an empty job store and no
 * subscribers; there is nothing to recover.
 */
@ApplicationScoped
public class ConversionLifecycleService {

    private static final Logger LOG = Logger.getLogger(ConversionLifecycleService.class);

    @Inject FormatGraph graph;

    @Inject EventBroadcaster broadcaster;

    void onStart(@Observes StartupEvent event) {
        LOG.infof(
                "Conversion service ready: %d formats, %d direct conversions %s",
                graph.formats().size(), graph.edges().size(), graph.edges());
    }

    void onStop(@Observes ShutdownEvent event) {
        LOG.info("Conversion service stopping: closing event streams");
        broadcaster.shutdown();
    }
}
