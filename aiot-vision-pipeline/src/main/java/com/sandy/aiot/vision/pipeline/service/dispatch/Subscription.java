package com.sandy.aiot.vision.pipeline.service.dispatch;

import com.sandy.aiot.vision.pipeline.model.EventFilter;
import com.sandy.aiot.vision.pipeline.model.PipelineEvent;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Bounded per-subscriber channel with at-least-once delivery.
 * <p>
 * {@link #poll(int)} hands out the oldest unacknowledged events without removing them;
 * {@link #acknowledge(long)} removes everything up to and including the given sequence number.
 * When the channel is full the oldest event is dropped; events older than the retention window
 * expire. Both count as lost and are reported once, on the next poll.
 */
public class Subscription {

    private final long id;
    private final String name;
    private final EventFilter filter;
    private final int capacity;
    private final Duration retention;
    private final Clock clock;

    private final ArrayDeque<Envelope> pending = new ArrayDeque<>();
    private long nextSeq;
    private long unreportedLost;
    private long delivered;
    private long acknowledged;
    private long dropped;
    private long expired;
    private long handlerFailures;
    private boolean lagging;
    private volatile boolean closed;

    Subscription(long id, String name, EventFilter filter, int capacity, Duration retention, Clock clock) {
        this.id = id;
        this.name = name;
        this.filter = filter == null ? EventFilter.all() : filter;
        this.capacity = Math.max(1, capacity);
        this.retention = retention;
        this.clock = clock;
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public boolean isClosed() {
        return closed;
    }

    boolean accepts(PipelineEvent event) {
        return !closed && filter.matches(event);
    }

    /**
     * @return true when an older event had to be dropped to make room and the channel was not lagging before
     */
    synchronized boolean offer(PipelineEvent event) {
        Instant now = clock.instant();
        expire(now);
        boolean startedLagging = false;
        if (pending.size() >= capacity) {
            pending.pollFirst();
            dropped++;
            unreportedLost++;
            startedLagging = !lagging;
            lagging = true;
        }
        pending.addLast(new Envelope(++nextSeq, event, now));
        notifyAll();
        return startedLagging;
    }

    public synchronized PollResult poll(int max) {
        expire(clock.instant());
        List<Envelope> out = new ArrayList<>(Math.min(max, pending.size()));
        Iterator<Envelope> it = pending.iterator();
        while (it.hasNext() && out.size() < max) {
            out.add(it.next());
        }
        long lost = unreportedLost;
        unreportedLost = 0;
        if (lost > 0 || pending.size() < capacity / 2) lagging = false;
        delivered += out.size();
        return new PollResult(out, lost);
    }

    /** Acknowledges every event up to and including {@code seq}; returns how many were removed. */
    public synchronized int acknowledge(long seq) {
        int removed = 0;
        while (!pending.isEmpty() && pending.peekFirst().seq() <= seq) {
            pending.pollFirst();
            removed++;
        }
        acknowledged += removed;
        return removed;
    }

    /** Waits up to {@code timeout} for at least one pending event. */
    synchronized boolean awaitPending(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (pending.isEmpty() && !closed) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) return false;
            wait(Math.max(1, remaining / 1_000_000));
        }
        return !pending.isEmpty();
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    synchronized void recordHandlerFailure() {
        handlerFailures++;
    }

    synchronized void close() {
        closed = true;
        notifyAll();
    }

    synchronized SubscriptionStats stats(boolean listener) {
        return SubscriptionStats.builder()
                .id(id)
                .name(name)
                .listener(listener)
                .pending(pending.size())
                .capacity(capacity)
                .delivered(delivered)
                .acknowledged(acknowledged)
                .dropped(dropped)
                .expired(expired)
                .handlerFailures(handlerFailures)
                .lagging(lagging)
                .build();
    }

    private void expire(Instant now) {
        if (retention == null || retention.isZero() || retention.isNegative()) return;
        Instant cutoff = now.minus(retention);
        while (!pending.isEmpty() && pending.peekFirst().enqueuedAt().isBefore(cutoff)) {
            pending.pollFirst();
            expired++;
            unreportedLost++;
        }
    }
}
