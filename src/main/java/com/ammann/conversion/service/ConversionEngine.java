package com.ammann.conversion.service;

import com.ammann.conversion.config.ConversionSettings;
import com.ammann.conversion.converter.ConversionException;
import com.ammann.conversion.converter.ConverterRegistry;
import com.ammann.conversion.enumeration.FailureKind;
import com.ammann.conversion.enumeration.Format;
import com.ammann.conversion.enumeration.JobStatus;
import com.ammann.conversion.exception.ConversionRejectedException;
import com.ammann.conversion.exception.InvalidTransitionException;
import com.ammann.conversion.exception.JobNotFoundException;
import com.ammann.conversion.exception.ValidationException;
import com.ammann.conversion.graph.FormatGraph;
import com.ammann.conversion.model.ConversionError;
import com.ammann.conversion.model.ConversionPath;
import com.ammann.conversion.model.ConversionResult;
import com.ammann.conversion.model.FormatPair;
import com.ammann.conversion.model.JobSnapshot;
import com.ammann.conversion.model.LifecycleEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import org.jboss.logging.Logger;

/**
 * Accepts conversion requests, runs them asynchronously and reports their lifecycle.
 * <p>
 * A request is validated and planned synchronously: an unknown format, an oversized
 * payload or an unreachable target is rejected before any job exists. Accepted jobs are
 * executed on the conversion executor, whose size bounds the number of RUNNING jobs;
 * further jobs wait in its queue as QUEUED.
 * <p>
 * Every status change is published to the {@link EventBroadcaster} while the job store
 * still holds the job's lock, so each job's events arrive in the order of its transitions.
 * <p>
 * Jobs stuck longer than the maximum duration, queued or running, are failed with TIMEOUT
 * and their worker task is cancelled. A converter that ignores the interrupt keeps its
 * thread until it returns; its result is discarded.
 */
@ApplicationScoped
public class ConversionEngine {

    private static final Logger LOG = Logger.getLogger(ConversionEngine.class);

    private final ConverterRegistry registry;
    private final FormatGraph graph;
    private final JobStore store;
    private final EventBroadcaster broadcaster;
    private final ExecutorService executor;
    private final ConversionSettings settings;
    private final MeterRegistry meterRegistry;
    private final Map<UUID, Future<?>> inFlight = new ConcurrentHashMap<>();

    private Counter submittedCounter;
    private Counter completedCounter;
    private Counter failedCounter;
    private Counter rejectedCounter;

    @Inject
    public ConversionEngine(
            ConverterRegistry registry,
            FormatGraph graph,
            JobStore store,
            EventBroadcaster broadcaster,
            @Named("conversion-executor") ExecutorService executor,
            ConversionSettings settings,
            MeterRegistry meterRegistry) {
        this.registry = registry;
        this.graph = graph;
        this.store = store;
        this.broadcaster = broadcaster;
        this.executor = executor;
        this.settings = settings;
        this.meterRegistry = meterRegistry;
        initMetrics();
    }

    void initMetrics() {
        if (meterRegistry == null) {
            LOG.warn("MeterRegistry not available - metrics disabled");
            return;
        }

        submittedCounter =
                Counter.builder("conversion_jobs_submitted_total")
                        .description("Conversion jobs accepted for execution")
                        .register(meterRegistry);

        completedCounter =
                Counter.builder("conversion_jobs_completed_total")
                        .description("Conversion jobs that completed successfully")
                        .register(meterRegistry);

        failedCounter =
                Counter.builder("conversion_jobs_failed_total")
                        .description("Conversion jobs that failed, including timeouts")
                        .register(meterRegistry);

        rejectedCounter =
                Counter.builder("conversion_requests_rejected_total")
                        .description("Conversion requests rejected before a job was created")
                        .register(meterRegistry);
    }

    /**
     * Submits a conversion using client-supplied format names.
     *
     * @throws ConversionRejectedException INVALID_FORMAT for unknown names, or any
     *     rejection of {@link #submit(Format, Format, byte[])}
     */
    public UUID submit(String sourceFormat, String targetFormat, byte[] payload) {
        Format source;
        Format target;
        try {
            source = Format.fromName(sourceFormat);
            target = Format.fromName(targetFormat);
        } catch (ConversionRejectedException e) {
            reject(e);
            throw e;
        }
        return submit(source, target, payload);
    }

    /**
     * Validates and plans the conversion, creates a QUEUED job and schedules it.
     *
     * @return id of the new job
     * @throws ConversionRejectedException PAYLOAD_TOO_LARGE or UNSUPPORTED_CONVERSION; no
     *     job is created and no event is published
     */
    public UUID submit(Format source, Format target, byte[] payload) {
        if (source == null || target == null) {
            throw ValidationException.invalidParameter("format", null, "a source and a target format");
        }
        if (payload == null) {
            throw ValidationException.invalidParameter("payload", null, "document content");
        }
        if (payload.length > settings.maxPayloadBytes()) {
            throw reject(ConversionRejectedException.payloadTooLarge(payload.length, settings.maxPayloadBytes()));
        }
        ConversionPath path =
                graph.resolve(source, target)
                        .orElseThrow(() -> reject(ConversionRejectedException.unsupportedConversion(source, target)));

        JobSnapshot job = store.create(source, target, path, payload.length);
        broadcaster.publish(LifecycleEvent.forJob(job));
        if (submittedCounter != null) {
            submittedCounter.increment();
        }
        LOG.infof(
                "Job %s queued: %s (%d bytes, %d hops)",
                job.id(), path.describe(), payload.length, path.hopCount());

        byte[] input = payload.clone();
        FutureTask<Void> task = new FutureTask<>(() -> execute(job.id(), path, input), null);
        inFlight.put(job.id(), task);
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            inFlight.remove(job.id());
            LOG.errorf(e, "Executor refused job %s", job.id());
            finishFailed(job.id(), new ConversionError(FailureKind.INTERNAL_ERROR, "Conversion executor unavailable"));
        }
        return job.id();
    }

    void execute(UUID id, ConversionPath path, byte[] payload) {
        try {
            runHops(id, path, payload);
        } finally {
            inFlight.remove(id);
        }
    }

    /**
     * Runs the hops of one job in order, feeding each output to the next converter and
     * recording progress after every intermediate hop.
     */
    private void runHops(UUID id, ConversionPath path, byte[] payload) {
        try {
            store.markRunning(id, this::publish);
        } catch (InvalidTransitionException | JobNotFoundException e) {
            LOG.debugf("Job %s not started: %s", id, e.getMessage());
            return;
        }

        long started = System.nanoTime();
        byte[] current = payload;
        List<FormatPair> hops = path.hops();
        try {
            for (int i = 0; i < hops.size(); i++) {
                FormatPair hop = hops.get(i);
                LOG.debugf("Job %s converting %s (%d bytes)", id, hop, current.length);
                current = registry.convert(hop, current);
                if (i + 1 < hops.size()) {
                    store.recordProgress(id, i + 1, this::publish);
                }
            }
        } catch (ConversionException e) {
            LOG.warnf("Job %s failed with %s: %s", id, e.getKind(), e.getMessage());
            finishFailed(id, new ConversionError(e.getKind(), e.getMessage()));
            return;
        } catch (InvalidTransitionException | JobNotFoundException e) {
            LOG.debugf("Job %s abandoned between hops: %s", id, e.getMessage());
            return;
        } catch (RuntimeException e) {
            LOG.errorf(e, "Job %s failed unexpectedly", id);
            finishFailed(id, new ConversionError(FailureKind.INTERNAL_ERROR, "Unexpected conversion error"));
            return;
        }

        ConversionResult result = new ConversionResult(path.target(), current);
        try {
            store.complete(id, result, this::publish);
            if (completedCounter != null) {
                completedCounter.increment();
            }
            LOG.infof(
                    "Job %s completed: %s -> %d bytes in %dms",
                    id, path.describe(), result.size(), Duration.ofNanos(System.nanoTime() - started).toMillis());
        } catch (InvalidTransitionException | JobNotFoundException e) {
            // the watchdog already failed the job
            LOG.debugf("Job %s finished after losing its transition: %s", id, e.getMessage());
        }
    }

    private void finishFailed(UUID id, ConversionError error) {
        try {
            store.fail(id, error, this::publish);
            if (failedCounter != null) {
                failedCounter.increment();
            }
        } catch (InvalidTransitionException | JobNotFoundException e) {
            LOG.debugf("Job %s failure not recorded: %s", id, e.getMessage());
        }
    }

    /**
     * Fails with TIMEOUT every job RUNNING, or still QUEUED, for longer than the configured
     * maximum duration, and cancels its worker task.
     *
     * @return number of jobs failed by this call
     */
    public int failOverdueJobs(Instant now) {
        int failed = 0;
        for (JobSnapshot job : store.findOverdue(now, settings.maxDuration())) {
            boolean queued = job.status() == JobStatus.QUEUED;
            String message = queued
                    ? "Conversion did not start within the maximum duration of " + settings.maxDuration()
                    : "Conversion exceeded maximum duration of " + settings.maxDuration();
            try {
                store.fail(job.id(), new ConversionError(FailureKind.TIMEOUT, message), this::publish);
            } catch (InvalidTransitionException | JobNotFoundException e) {
                LOG.debugf("Job %s finished before the watchdog: %s", job.id(), e.getMessage());
                continue;
            }
            failed++;
            if (failedCounter != null) {
                failedCounter.increment();
            }
            if (queued) {
                LOG.warnf("Job %s timed out waiting in the queue since %s", job.id(), job.createdAt());
            } else {
                LOG.warnf("Job %s timed out after running since %s", job.id(), job.startedAt());
            }
            cancelWorker(job.id());
        }
        return failed;
    }

    private void cancelWorker(UUID id) {
        Future<?> task = inFlight.remove(id);
        if (task != null && task.cancel(true)) {
            LOG.debugf("Job %s worker cancelled", id);
        }
    }

    /** Jobs whose worker task is queued or running. */
    int inFlightCount() {
        return inFlight.size();
    }

    public Optional<JobSnapshot> status(UUID id) {
        return store.get(id);
    }

    /**
     * Emits the job once it is terminal, or its current snapshot when {@code timeout}
     * elapses first.
     */
    public Uni<JobSnapshot> await(UUID id, Duration timeout) {
        return Uni.createFrom()
                .completionStage(() -> store.awaitTerminal(id))
                .ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> store.get(id).orElseThrow(() -> new JobNotFoundException(id)));
    }

    public List<JobSnapshot> recentJobs(int limit) {
        return store.list(limit);
    }

    /**
     * Deletes a terminal job.
     *
     * @throws JobNotFoundException when unknown
     * @throws com.ammann.conversion.exception.JobConflictException when still active
     */
    public JobSnapshot delete(UUID id) {
        JobSnapshot removed = store.remove(id);
        LOG.infof("Job %s deleted", id);
        return removed;
    }

    public List<Format> listFormats() {
        return Format.ordered();
    }

    /** Direct conversions available in the format graph. */
    public Set<FormatPair> supportedConversions() {
        return graph.edges();
    }

    public int jobCount() {
        return store.size();
    }

    public boolean isAcceptingWork() {
        return !executor.isShutdown();
    }

    private void publish(JobSnapshot snapshot) {
        broadcaster.publish(LifecycleEvent.forJob(snapshot));
    }

    private ConversionRejectedException reject(ConversionRejectedException e) {
        if (rejectedCounter != null) {
            rejectedCounter.increment();
        }
        LOG.infof("Conversion rejected (%s): %s", e.getReason(), e.getMessage());
        return e;
    }
}
