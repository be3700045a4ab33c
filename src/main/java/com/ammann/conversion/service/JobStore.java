/* (C)2026 */
package com.ammann.conversion.service;

import com.ammann.conversion.config.ConversionSettings;
import com.ammann.conversion.enumeration.Format;
import com.ammann.conversion.enumeration.JobStatus;
import com.ammann.conversion.exception.InvalidTransitionException;
import com.ammann.conversion.exception.JobConflictException;
import com.ammann.conversion.exception.JobNotFoundException;
import com.ammann.conversion.model.ConversionError;
import com.ammann.conversion.model.ConversionPath;
import com.ammann.conversion.model.ConversionResult;
import com.ammann.conversion.model.JobSnapshot;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import org.jboss.logging.Logger;

/**
 * In-memory registry of conversion jobs.
 * <p>
 * Status changes are atomic per job: each transition runs under the job's own monitor, so
 * concurrent transitions on different jobs never contend and two transitions on the same
 * job are strictly ordered. Only forward moves of the status machine are accepted:
 * <pre>
 *   QUEUED -> RUNNING -> COMPLETED
 *      |         \
 *      +----------+--> FAILED
 * </pre>
 * Terminal jobs are kept for the configured retention after they finish and then evicted.
 */
@ApplicationScoped
public class JobStore {

    private static final Logger LOG = Logger.getLogger(JobStore.class);

    private final Map<UUID, ConversionJob> jobs = new ConcurrentHashMap<>();
    private final Duration retention;
    private final Clock clock;

    @Inject
    public JobStore(ConversionSettings settings) {
        this(settings.retention(), Clock.systemUTC());
    }

    public JobStore(Duration retention, Clock clock) {
        this.retention = retention;
        this.clock = clock;
    }

    /**
     * Registers a new job in status QUEUED.
     */
    public JobSnapshot create(Format source, Format target, ConversionPath path, int payloadSize) {
        ConversionJob job = new ConversionJob(UUID.randomUUID(), source, target, path, payloadSize, clock.instant());
        jobs.put(job.id, job);
        synchronized (job) {
            return job.snapshot();
        }
    }

    public Optional<JobSnapshot> get(UUID id) {
        ConversionJob job = jobs.get(id);
        if (job == null) {
            return Optional.empty();
        }
        synchronized (job) {
            return Optional.of(job.snapshot());
        }
    }

    public int size() {
        return jobs.size();
    }

    /**
     * Most recently created jobs first.
     */
    public List<JobSnapshot> list(int limit) {
        List<JobSnapshot> snapshots = new ArrayList<>();
        for (ConversionJob job : jobs.values()) {
            synchronized (job) {
                snapshots.add(job.snapshot());
            }
        }
        snapshots.sort(Comparator.comparing(JobSnapshot::createdAt).reversed());
        return snapshots.size() > limit ? List.copyOf(snapshots.subList(0, limit)) : snapshots;
    }

    public JobSnapshot markRunning(UUID id, Consumer<JobSnapshot> listener) {
        return transition(id, JobStatus.RUNNING, null, null, listener);
    }

    public JobSnapshot complete(UUID id, ConversionResult result, Consumer<JobSnapshot> listener) {
        return transition(id, JobStatus.COMPLETED, result, null, listener);
    }

    public JobSnapshot fail(UUID id, ConversionError error, Consumer<JobSnapshot> listener) {
        return transition(id, JobStatus.FAILED, null, error, listener);
    }

    /**
     * Moves a job to {@code next} atomically.
     * <p>
     * {@code listener} is invoked with the new snapshot while the job's monitor is still
     * held, so anything it publishes is ordered exactly like the store's transitions.
     *
     * @throws JobNotFoundException when the job does not exist (or was evicted)
     * @throws InvalidTransitionException when the status machine forbids the move; the job
     *     is left untouched
     */
    public JobSnapshot transition(
            UUID id,
            JobStatus next,
            ConversionResult result,
            ConversionError error,
            Consumer<JobSnapshot> listener) {
        ConversionJob job = jobs.get(id);
        if (job == null) {
            throw new JobNotFoundException(id);
        }

        JobSnapshot snapshot;
        synchronized (job) {
            if (!job.status.canTransitionTo(next)) {
                throw new InvalidTransitionException(id, job.status, next);
            }
            Instant now = clock.instant();
            job.status = next;
            job.updatedAt = now;
            switch (next) {
                case RUNNING -> job.startedAt = now;
                case COMPLETED -> {
                    job.result = result;
                    job.completedHops = job.path.hopCount();
                    job.completedAt = now;
                }
                case FAILED -> {
                    job.error = error;
                    job.completedAt = now;
                }
                case QUEUED -> throw new IllegalStateException("QUEUED is never a transition target");
            }
            snapshot = job.snapshot();
            if (listener != null) {
                listener.accept(snapshot);
            }
        }

        // completed outside the monitor so dependent stages never run while holding it
        if (snapshot.isTerminal()) {
            job.terminal.complete(snapshot);
        }
        LOG.debugf("Job %s -> %s", id, next);
        return snapshot;
    }

    /**
     * Records that the first {@code completedHops} hops of a RUNNING job are done.
     * <p>
     * The status stays RUNNING; {@code listener} sees the updated snapshot under the job's
     * monitor, like a transition.
     *
     * @throws JobNotFoundException when the job does not exist
     * @throws InvalidTransitionException when the job is no longer RUNNING
     * @throws IllegalArgumentException when the count moves backwards or exceeds the path
     */
    public JobSnapshot recordProgress(UUID id, int completedHops, Consumer<JobSnapshot> listener) {
        ConversionJob job = jobs.get(id);
        if (job == null) {
            throw new JobNotFoundException(id);
        }
        synchronized (job) {
            if (job.status != JobStatus.RUNNING) {
                throw new InvalidTransitionException(id, job.status, JobStatus.RUNNING);
            }
            if (completedHops < job.completedHops || completedHops > job.path.hopCount()) {
                throw new IllegalArgumentException(String.format(
                        "Job %s cannot report %d of %d hops after %d",
                        id, completedHops, job.path.hopCount(), job.completedHops));
            }
            job.completedHops = completedHops;
            job.updatedAt = clock.instant();
            JobSnapshot snapshot = job.snapshot();
            if (listener != null) {
                listener.accept(snapshot);
            }
            return snapshot;
        }
    }

    /**
     * Completes once the job reaches COMPLETED or FAILED.
     *
     * @throws JobNotFoundException when the job does not exist
     */
    public CompletionStage<JobSnapshot> awaitTerminal(UUID id) {
        ConversionJob job = jobs.get(id);
        if (job == null) {
            throw new JobNotFoundException(id);
        }
        return job.terminal.minimalCompletionStage();
    }

    /**
     * Removes jobs that finished more than the retention period before {@code now}.
     * QUEUED and RUNNING jobs are never evicted.
     *
     * @return number of evicted jobs
     */
    public int evictExpired(Instant now) {
        Instant cutoff = now.minus(retention);
        int evicted = 0;
        for (ConversionJob job : jobs.values()) {
            synchronized (job) {
                if (job.status.isTerminal() && job.completedAt.isBefore(cutoff)) {
                    jobs.remove(job.id, job);
                    evicted++;
                }
            }
        }
        return evicted;
    }

    /**
     * Deletes a finished job ahead of its eviction.
     *
     * @throws JobNotFoundException when the job does not exist
     * @throws JobConflictException when the job is still QUEUED or RUNNING
     */
    public JobSnapshot remove(UUID id) {
        ConversionJob job = jobs.get(id);
        if (job == null) {
            throw new JobNotFoundException(id);
        }
        synchronized (job) {
            if (!job.status.isTerminal()) {
                throw new JobConflictException(id, job.status, "delete");
            }
            jobs.remove(id, job);
            return job.snapshot();
        }
    }

    /**
     * Jobs stuck for more than {@code maxDuration} before {@code now}: RUNNING jobs counted
     * from their start, QUEUED jobs from their creation.
     */
    public List<JobSnapshot> findOverdue(Instant now, Duration maxDuration) {
        Instant threshold = now.minus(maxDuration);
        List<JobSnapshot> overdue = new ArrayList<>();
        for (ConversionJob job : jobs.values()) {
            synchronized (job) {
                Instant since = switch (job.status) {
                    case RUNNING -> job.startedAt;
                    case QUEUED -> job.createdAt;
                    default -> null;
                };
                if (since != null && since.isBefore(threshold)) {
                    overdue.add(job.snapshot());
                }
            }
        }
        return overdue;
    }

    public Clock clock() {
        return clock;
    }
}
