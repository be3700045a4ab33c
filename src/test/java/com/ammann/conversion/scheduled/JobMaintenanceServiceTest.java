/* (C)2026 */
package com.ammann.conversion.scheduled;

import static com.ammann.conversion.support.TestSettings.settings;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.ammann.conversion.config.ConversionSettings;
import com.ammann.conversion.converter.ConverterRegistry;
import com.ammann.conversion.enumeration.EventKind;
import com.ammann.conversion.enumeration.FailureKind;
import com.ammann.conversion.enumeration.Format;
import com.ammann.conversion.enumeration.JobStatus;
import com.ammann.conversion.graph.FormatGraph;
import com.ammann.conversion.model.ConversionError;
import com.ammann.conversion.model.ConversionPath;
import com.ammann.conversion.model.JobSnapshot;
import com.ammann.conversion.model.LifecycleEvent;
import com.ammann.conversion.service.ConversionEngine;
import com.ammann.conversion.service.EventBroadcaster;
import com.ammann.conversion.service.JobStore;
import com.ammann.conversion.service.Subscriber;
import com.ammann.conversion.support.MutableClock;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("JobMaintenanceService")
class JobMaintenanceServiceTest {

    private MutableClock clock;
    private JobStore store;
    private EventBroadcaster broadcaster;
    private ExecutorService executor;
    private JobMaintenanceService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        ConversionSettings settings = settings()
                .maxDuration(Duration.ofMinutes(5))
                .retention(Duration.ofHours(1))
                .inactivityTimeout(Duration.ofMinutes(10))
                .build();
        ConverterRegistry registry = ConverterRegistry.defaults();
        store = new JobStore(settings.retention(), clock);
        broadcaster = new EventBroadcaster(settings, clock);
        executor = Executors.newSingleThreadExecutor();
        ConversionEngine engine = new ConversionEngine(
                registry, FormatGraph.from(registry, settings.excludedEdges()), store, broadcaster, executor,
                settings, null);
        service = new JobMaintenanceService(engine, store, broadcaster);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private UUID job() {
        return store.create(Format.TEXT, Format.TEXT, ConversionPath.identity(Format.TEXT), 1).id();
    }

    @Test
    @DisplayName("detectStuckJobs should fail running and queued jobs past the maximum duration")
    void detectStuckJobsFailsOverdueJobs() {
        UUID stuck = job();
        store.markRunning(stuck, null);
        UUID starved = job();
        clock.advance(Duration.ofMinutes(4));
        UUID fresh = job();
        store.markRunning(fresh, null);
        UUID queued = job();
        Subscriber events = broadcaster.subscribe();

        clock.advance(Duration.ofMinutes(2));
        service.detectStuckJobs();

        JobSnapshot stuckJob = store.get(stuck).orElseThrow();
        assertThat(stuckJob.status()).isEqualTo(JobStatus.FAILED);
        assertThat(stuckJob.error().kind()).isEqualTo(FailureKind.TIMEOUT);
        assertThat(stuckJob.error().message()).contains("maximum duration");
        JobSnapshot starvedJob = store.get(starved).orElseThrow();
        assertThat(starvedJob.status()).isEqualTo(JobStatus.FAILED);
        assertThat(starvedJob.error().kind()).isEqualTo(FailureKind.TIMEOUT);
        assertThat(starvedJob.error().message()).contains("did not start");
        assertThat(store.get(fresh).orElseThrow().status()).isEqualTo(JobStatus.RUNNING);
        assertThat(store.get(queued).orElseThrow().status()).isEqualTo(JobStatus.QUEUED);
        assertThat(events.drain())
                .extracting(LifecycleEvent::kind, LifecycleEvent::jobId)
                .containsExactlyInAnyOrder(tuple(EventKind.JOB_FAILED, stuck), tuple(EventKind.JOB_FAILED, starved));
    }

    @Test
    @DisplayName("evictExpiredJobs should drop finished jobs after the retention period")
    void evictExpiredJobsRemovesOldTerminalJobs() {
        UUID done = job();
        store.fail(done, new ConversionError(FailureKind.MALFORMED_INPUT, "bad"), null);
        UUID active = job();

        clock.advance(Duration.ofMinutes(61));
        service.evictExpiredJobs();

        assertThat(store.get(done)).isEmpty();
        assertThat(store.get(active)).isPresent();
    }

    @Test
    @DisplayName("heartbeat should disconnect idle subscribers and ping the others")
    void heartbeatPrunesIdleSubscribers() {
        Subscriber idle = broadcaster.subscribe();
        clock.advance(Duration.ofMinutes(11));
        Subscriber active = broadcaster.subscribe();

        service.heartbeat();

        assertThat(idle.isClosed()).isTrue();
        assertThat(active.drain()).extracting(LifecycleEvent::kind).containsExactly(EventKind.HEARTBEAT);
        assertThat(broadcaster.subscriberCount()).isEqualTo(1);
    }
}
