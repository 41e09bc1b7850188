package com.sandy.aiot.vision.pipeline.service.dispatch;

import com.sandy.aiot.vision.pipeline.config.PipelineProperties;
import com.sandy.aiot.vision.pipeline.model.DiagnosticEvent;
import com.sandy.aiot.vision.pipeline.model.DiagnosticType;
import com.sandy.aiot.vision.pipeline.model.EventFilter;
import com.sandy.aiot.vision.pipeline.model.PipelineEvent;
import com.sandy.aiot.vision.pipeline.service.PipelineCounters;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fan-out of pipeline events to independent subscribers.
 * <p>
 * Stages publish into a bounded outbox and wait at most {@code send-timeout} per attempt; a
 * timed-out attempt is counted, reported once per congestion episode and retried. One dispatch
 * thread moves events from the outbox into the subscriber channels, so a slow subscriber only
 * fills its own channel. Listener subscriptions get a delivery thread each.
 */
@Service
@Slf4j
public class ResultDispatcher implements PipelineEventPublisher {

    private static final int LISTENER_BATCH = 64;
    private static final Duration MAX_RETRY_BACKOFF = Duration.ofSeconds(1);

    private final PipelineCounters counters;
    private final Clock clock;
    private final BlockingQueue<PipelineEvent> outbox;
    private final Duration sendTimeout;
    private final int channelCapacity;
    private final Duration retention;

    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final Map<Long, Thread> listenerThreads = new ConcurrentHashMap<>();
    private final AtomicLong subscriptionIds = new AtomicLong();
    private final AtomicBoolean congested = new AtomicBoolean();
    private final ThreadFactory listenerThreadFactory = new CustomizableThreadFactory("pipeline-listener-");
    private volatile boolean running;
    private volatile Thread dispatchThread;

    public ResultDispatcher(PipelineProperties properties, PipelineCounters counters, Clock clock) {
        PipelineProperties.Dispatch dispatch = properties.getDispatch();
        this.counters = counters;
        this.clock = clock;
        this.outbox = new ArrayBlockingQueue<>(Math.max(1, dispatch.getOutboxCapacity()));
        this.sendTimeout = dispatch.getSendTimeout();
        this.channelCapacity = dispatch.getChannelCapacity();
        this.retention = dispatch.getRetention();
    }

    @PostConstruct
    public synchronized void start() {
        if (running) return;
        running = true;
        Thread thread = new CustomizableThreadFactory("pipeline-dispatch-").newThread(this::dispatchLoop);
        thread.setDaemon(true);
        dispatchThread = thread;
        thread.start();
        log.info("Result dispatcher started outboxCapacity={} sendTimeoutMs={}", outbox.remainingCapacity(),
                sendTimeout.toMillis());
    }

    /**
     * Queues the event behind everything published before it. The publisher that first finds the
     * outbox full queues a {@link DiagnosticType#DISPATCH_CONGESTED} diagnostic ahead of its own
     * event, so the diagnostic is ordered like any other event.
     */
    @Override
    public void publish(PipelineEvent event) {
        counters.increment(PipelineCounters.Counter.EVENTS_PUBLISHED);
        PipelineEvent announcement = null;
        while (running) {
            try {
                if (announcement != null
                        && outbox.offer(announcement, sendTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    counters.increment(PipelineCounters.Counter.EVENTS_PUBLISHED);
                    announcement = null;
                }
                if (announcement == null && outbox.offer(event, sendTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    if (congested.compareAndSet(true, false)) {
                        log.info("Dispatcher outbox congestion cleared");
                    }
                    return;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            counters.increment(PipelineCounters.Counter.DISPATCH_CONGESTED);
            if (congested.compareAndSet(false, true)) {
                log.warn("Dispatcher outbox full, publishers are waiting capacity={} sendTimeoutMs={}",
                        outbox.size(), sendTimeout.toMillis());
                announcement = PipelineEvent.diagnostic(DiagnosticEvent.builder()
                        .type(DiagnosticType.DISPATCH_CONGESTED)
                        .message("dispatcher outbox full")
                        .detail("outboxSize", outbox.size())
                        .at(clock.instant())
                        .build());
            }
        }
        if (announcement != null) fanOut(announcement);
        fanOut(event);
    }

    /** Polling subscription; the caller drives {@link Subscription#poll(int)} and acknowledgements. */
    public Subscription subscribe(String name, EventFilter filter) {
        Subscription subscription = new Subscription(subscriptionIds.incrementAndGet(), name, filter, channelCapacity,
                retention, clock);
        subscriptions.add(subscription);
        log.info("Subscriber registered id={} name={} filter={}", subscription.getId(), name, filter);
        return subscription;
    }

    /** Push subscription with its own delivery thread; failed deliveries are retried with backoff. */
    public Subscription subscribe(String name, EventFilter filter, PipelineEventListener listener) {
        Subscription subscription = subscribe(name, filter);
        Thread thread = listenerThreadFactory.newThread(() -> deliverLoop(subscription, listener));
        thread.setDaemon(true);
        listenerThreads.put(subscription.getId(), thread);
        thread.start();
        return subscription;
    }

    public void unsubscribe(Subscription subscription) {
        subscription.close();
        subscriptions.remove(subscription);
        Thread thread = listenerThreads.remove(subscription.getId());
        if (thread != null && thread != Thread.currentThread()) thread.interrupt();
        log.info("Subscriber removed id={} name={}", subscription.getId(), subscription.getName());
    }

    public List<SubscriptionStats> stats() {
        List<SubscriptionStats> list = new ArrayList<>(subscriptions.size());
        for (Subscription s : subscriptions) {
            list.add(s.stats(listenerThreads.containsKey(s.getId())));
        }
        return list;
    }

    public int outboxSize() {
        return outbox.size();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Waits for the outbox to empty, then stops the dispatch thread. Later publishes go straight
     * to the subscriber channels.
     *
     * @return false when the outbox did not drain in time
     */
    public boolean drain(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!outbox.isEmpty() && System.nanoTime() < deadline) {
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        boolean drained = outbox.isEmpty();
        stopDispatchThread();
        List<PipelineEvent> rest = new ArrayList<>();
        outbox.drainTo(rest);
        rest.forEach(this::fanOut);
        return drained;
    }

    /** Waits until listener subscriptions have nothing pending, bounded by {@code timeout}. */
    public boolean awaitListenersIdle(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            boolean idle = subscriptions.stream()
                    .filter(s -> listenerThreads.containsKey(s.getId()))
                    .allMatch(s -> s.pendingCount() == 0);
            if (idle && outbox.isEmpty()) return true;
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return false;
    }

    @PreDestroy
    public void stop() {
        drain(Duration.ofSeconds(2));
        awaitListenersIdle(Duration.ofSeconds(2));
        for (Subscription s : subscriptions) {
            unsubscribe(s);
        }
    }

    private void dispatchLoop() {
        while (running || !outbox.isEmpty()) {
            try {
                PipelineEvent event = outbox.poll(50, TimeUnit.MILLISECONDS);
                if (event != null) fanOut(event);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                log.error("Dispatch failed err={}", e.getMessage(), e);
            }
        }
    }

    private void fanOut(PipelineEvent event) {
        for (Subscription s : subscriptions) {
            if (!s.accepts(event)) continue;
            if (s.offer(event)) {
                log.warn("Subscriber lagging, oldest events dropped id={} name={}", s.getId(), s.getName());
                PipelineEvent lagging = PipelineEvent.diagnostic(DiagnosticEvent.builder()
                        .type(DiagnosticType.SUBSCRIBER_LAGGING)
                        .message("subscriber " + s.getName() + " is dropping events")
                        .detail("subscriptionId", s.getId())
                        .at(clock.instant())
                        .build());
                for (Subscription other : subscriptions) {
                    if (other != s && other.accepts(lagging)) other.offer(lagging);
                }
            }
        }
    }

    private void deliverLoop(Subscription subscription, PipelineEventListener listener) {
        int failures = 0;
        while (!subscription.isClosed()) {
            try {
                if (!subscription.awaitPending(Duration.ofMillis(200))) continue;
                PollResult batch = subscription.poll(LISTENER_BATCH);
                if (batch.lost() > 0) {
                    log.warn("Subscriber lost events id={} name={} lost={}", subscription.getId(),
                            subscription.getName(), batch.lost());
                }
                for (Envelope envelope : batch.events()) {
                    listener.onEvent(envelope.event());
                    subscription.acknowledge(envelope.seq());
                    failures = 0;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (Exception e) {
                subscription.recordHandlerFailure();
                failures++;
                long backoff = Math.min(MAX_RETRY_BACKOFF.toMillis(), 10L << Math.min(failures, 10));
                log.warn("Subscriber handler failed id={} name={} attempt={} retryInMs={} err={}",
                        subscription.getId(), subscription.getName(), failures, backoff, e.getMessage());
                try {
                    Thread.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }

    private synchronized void stopDispatchThread() {
        running = false;
        Thread thread = dispatchThread;
        if (thread == null) return;
        try {
            thread.join(1000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        dispatchThread = null;
    }
}
