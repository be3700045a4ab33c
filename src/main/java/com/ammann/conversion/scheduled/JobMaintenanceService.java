/* (C)2026 */
package com.ammann.conversion.scheduled;

import com.ammann.conversion.service.ConversionEngine;
import com.ammann.conversion.service.EventBroadcaster;
import com.ammann.conversion.service.JobStore;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Scheduled maintenance for conversion jobs and event stream subscribers.
 * <p>
 * Provides three functions:
 * <ol>
 *   <li><b>Watchdog:</b> fails RUNNING jobs that exceed the maximum conversion duration</li>
 *   <li><b>Eviction:</b> removes finished jobs older than the retention period</li>
 *   <li><b>Heartbeat:</b> keeps idle event streams alive and disconnects inactive subscribers</li>
 * </ol>
 */
@ApplicationScoped
public class JobMaintenanceService {

    private static final Logger LOG = Logger.getLogger(JobMaintenanceService.class);

    private final ConversionEngine engine;
    private final JobStore store;
    private final EventBroadcaster broadcaster;

    @Inject
    public JobMaintenanceService(ConversionEngine engine, JobStore store, EventBroadcaster broadcaster) {
        this.engine = engine;
        this.store = store;
        this.broadcaster = broadcaster;
    }

    /**
     * Watchdog: a converter that hangs keeps its worker thread, but its job is failed with
     * TIMEOUT so clients and subscribers get a terminal outcome.
     */
    @Scheduled(every = "${conversion.jobs.watchdog-interval:10s}", identity = "conversion-job-watchdog")
    public void detectStuckJobs() {
        int failed = engine.failOverdueJobs(store.clock().instant());
        if (failed > 0) {
            LOG.warnf("Watchdog: marked %d overdue conversion jobs as FAILED", failed);
        }
    }

    @Scheduled(every = "${conversion.jobs.eviction-interval:1m}", identity = "conversion-job-eviction")
    public void evictExpiredJobs() {
        int evicted = store.evictExpired(store.clock().instant());
        if (evicted > 0) {
            LOG.infof("Eviction: removed %d expired conversion jobs (%d remaining)", evicted, store.size());
        } else {
            LOG.debug("Eviction: no expired conversion jobs");
        }
    }

    @Scheduled(every = "${conversion.events.heartbeat-interval:30s}", identity = "conversion-event-heartbeat")
    public void heartbeat() {
        int pruned = broadcaster.heartbeat();
        if (pruned > 0) {
            LOG.infof("Heartbeat: disconnected %d inactive subscribers", pruned);
        }
    }
}
