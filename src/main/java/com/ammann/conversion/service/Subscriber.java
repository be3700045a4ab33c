/* (C)2026 */
package com.ammann.conversion.service;

import com.ammann.conversion.enumeration.EventKind;
import com.ammann.conversion.model.LifecycleEvent;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * One observer of the lifecycle event stream.
 * <p>
 * Events are buffered in a bounded queue. When the queue is full the oldest event is
 * discarded to admit the new one, so a slow reader never blocks the publisher; the
 * discarded events are counted as missed. The stream adds no buffering of its own: an event
 * leaves the queue only when the reader has requested it.
 */
public final class Subscriber {

    /** Marks the end of the stream; never handed to consumers. */
    private static final LifecycleEvent END =
            new LifecycleEvent(EventKind.HEARTBEAT, null, Instant.EPOCH, Map.of("end", true));

    private final String id;
    private final int capacity;
    private final Clock clock;
    private final Instant connectedAt;
    private final Deque<LifecycleEvent> buffer;

    private Instant lastActivity;
    private long delivered;
    private long missed;
    private int consecutiveDrops;
    private boolean closed;
    private CompletableFuture<LifecycleEvent> waiter;
    private Runnable onCancel = () -> {};

    Subscriber(String id, int capacity, Clock clock) {
        this.id = id;
        this.capacity = capacity;
        this.clock = clock;
        this.connectedAt = clock.instant();
        this.lastActivity = connectedAt;
        this.buffer = new ArrayDeque<>(capacity);
    }

    public static String newId() {
        return UUID.randomUUID().toString();
    }

    public String id() {
        return id;
    }

    /**
     * Offers an event without blocking.
     *
     * @return {@code false} when the oldest buffered event had to be dropped
     */
    boolean offer(LifecycleEvent event) {
        CompletableFuture<LifecycleEvent> pending;
        boolean dropped = false;
        synchronized (this) {
            if (closed) {
                return true;
            }
            pending = waiter;
            waiter = null;
            if (pending == null) {
                if (buffer.size() >= capacity) {
                    buffer.pollFirst();
                    missed++;
                    consecutiveDrops++;
                    dropped = true;
                }
                buffer.addLast(event);
            } else {
                delivered++;
                consecutiveDrops = 0;
            }
        }
        if (pending != null) {
            handOff(pending, event);
        }
        return !dropped;
    }

    /**
     * Next buffered event, or {@code null} when the buffer is empty.
     */
    public synchronized LifecycleEvent poll() {
        LifecycleEvent event = buffer.pollFirst();
        if (event != null) {
            read();
        }
        return event;
    }

    /** Removes and returns every buffered event, oldest first. */
    public synchronized List<LifecycleEvent> drain() {
        List<LifecycleEvent> events = new ArrayList<>(buffer);
        buffer.clear();
        if (!events.isEmpty()) {
            delivered += events.size();
            consecutiveDrops = 0;
            lastActivity = clock.instant();
        }
        return events;
    }

    /**
     * Buffered events as a lazy stream that pulls one event per downstream request and
     * completes once this subscriber is closed. Cancelling the stream runs the handler
     * registered by the broadcaster.
     */
    public Multi<LifecycleEvent> stream() {
        return Multi.createBy()
                .repeating()
                .completionStage(this::next)
                .until(event -> event == END)
                .onCancellation()
                .invoke(() -> onCancel.run());
    }

    private synchronized CompletionStage<LifecycleEvent> next() {
        LifecycleEvent event = buffer.pollFirst();
        if (event != null) {
            read();
            return CompletableFuture.completedFuture(event);
        }
        if (closed) {
            return CompletableFuture.completedFuture(END);
        }
        lastActivity = clock.instant();
        waiter = new CompletableFuture<>();
        return waiter;
    }

    /**
     * Completes a parked reader on a worker thread; the publisher may be holding a job lock.
     */
    private static void handOff(CompletableFuture<LifecycleEvent> pending, LifecycleEvent event) {
        Infrastructure.getDefaultWorkerPool().execute(() -> pending.complete(event));
    }

    private void read() {
        delivered++;
        consecutiveDrops = 0;
        lastActivity = clock.instant();
    }

    /**
     * Releases the buffer and ends the stream. Idempotent.
     */
    void close() {
        CompletableFuture<LifecycleEvent> pending;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            buffer.clear();
            pending = waiter;
            waiter = null;
        }
        if (pending != null) {
            handOff(pending, END);
        }
    }

    synchronized void onCancel(Runnable handler) {
        this.onCancel = handler;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public synchronized boolean hasMissedEvents() {
        return missed > 0;
    }

    public synchronized long missedEvents() {
        return missed;
    }

    public synchronized int consecutiveDrops() {
        return consecutiveDrops;
    }

    public synchronized int buffered() {
        return buffer.size();
    }

    public synchronized Instant lastActivity() {
        return lastActivity;
    }

    /**
     * A consumer parked on the stream is waiting for the next event and counts as active.
     */
    synchronized boolean isIdleSince(Instant threshold) {
        return waiter == null && lastActivity.isBefore(threshold);
    }

    public synchronized SubscriberInfo info() {
        return new SubscriberInfo(id, connectedAt, lastActivity, buffer.size(), capacity, delivered, missed);
    }

    /**
     * Point-in-time view of a subscriber for the admin endpoint.
     */
    public record SubscriberInfo(
            String id,
            Instant connectedAt,
            Instant lastActivity,
            int buffered,
            int capacity,
            long delivered,
            long missed) {}
}
