package com.sandy.aiot.vision.pipeline.service.runtime;

import com.sandy.aiot.vision.pipeline.config.PipelineProperties;
import com.sandy.aiot.vision.pipeline.model.DiagnosticEvent;
import com.sandy.aiot.vision.pipeline.model.DiagnosticType;
import com.sandy.aiot.vision.pipeline.service.PipelineCounters;
import com.sandy.aiot.vision.pipeline.service.dispatch.ResultDispatcher;
import com.sandy.aiot.vision.pipeline.service.dispatch.SubscriptionStats;
import com.sandy.aiot.vision.pipeline.service.ingest.IngestionBuffer;
import com.sandy.aiot.vision.pipeline.service.ingest.IngestionService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.locks.LockSupport;

/**
 * Owns the partition workers. One worker per partition; a sensor's readings are only ever
 * processed by the worker of its partition.
 * <p>
 * Shutdown closes ingestion, lets every worker drain its lanes and flush its open windows as
 * partial, then drains the dispatcher. Whatever is still buffered once the workers are gone is
 * discarded and counted; if draining did not finish within the timeout {@link PipelineShutdownException}
 * is raised.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PipelineRuntime {

    private final PipelineProperties properties;
    private final IngestionService ingestionService;
    private final IngestionBuffer buffer;
    private final PipelineProcessor processor;
    private final ResultDispatcher dispatcher;
    private final PipelineCounters counters;
    private final Clock clock;

    @Value("${pipeline.shutdown-timeout:30s}")
    private Duration shutdownTimeout;

    private final List<PartitionWorker> workers = new ArrayList<>();
    private final List<Thread> threads = new ArrayList<>();
    private volatile boolean running;

    @PostConstruct
    public synchronized void start() {
        if (running) return;
        PipelineProperties.Ingest ingest = properties.getIngest();
        ThreadFactory factory = new CustomizableThreadFactory("pipeline-worker-");
        for (int p = 0; p < buffer.partitions(); p++) {
            PartitionWorker worker = new PartitionWorker(p, buffer, processor, ingest.getMaxBatch(),
                    ingest.getIdleBackoffMin(), ingest.getIdleBackoffMax(), properties.getWindow().getReapInterval());
            Thread thread = factory.newThread(worker);
            buffer.registerWorker(p, thread);
            workers.add(worker);
            threads.add(thread);
            thread.start();
        }
        running = true;
        log.info("Pipeline started workers={} overflowPolicy={} bufferCapacity={}", workers.size(),
                ingest.getOverflowPolicy(), ingest.getBufferCapacity());
    }

    @PreDestroy
    public void stop() {
        shutdown(shutdownTimeout);
    }

    /**
     * @throws PipelineShutdownException when workers or the dispatcher did not drain in time
     */
    public synchronized void shutdown(Duration timeout) {
        if (!running) return;
        running = false;
        long deadline = System.nanoTime() + timeout.toNanos();
        ingestionService.stopAccepting();
        log.info("Pipeline shutting down buffered={} timeoutMs={}", buffer.totalDepth(), timeout.toMillis());
        for (int i = 0; i < workers.size(); i++) {
            workers.get(i).drain();
            LockSupport.unpark(threads.get(i));
        }
        List<Integer> stuck = new ArrayList<>();
        for (int i = 0; i < threads.size(); i++) {
            Thread thread = threads.get(i);
            try {
                thread.join(Math.max(1, (deadline - System.nanoTime()) / 1_000_000));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (thread.isAlive()) stuck.add(workers.get(i).partition());
        }
        for (Integer partition : stuck) {
            threads.get(partition).interrupt();
        }
        int discarded = 0;
        for (int p = 0; p < buffer.partitions(); p++) {
            discarded += buffer.discard(p);
        }
        if (discarded > 0) {
            counters.add(PipelineCounters.Counter.READINGS_DISCARDED_SHUTDOWN, discarded);
            dispatcher.diagnostic(DiagnosticEvent.builder()
                    .type(DiagnosticType.READINGS_DROPPED)
                    .message("readings discarded at shutdown")
                    .detail("discarded", discarded)
                    .at(clock.instant())
                    .build());
        }
        boolean dispatched = dispatcher.drain(Duration.ofNanos(Math.max(0, deadline - System.nanoTime())));
        dispatcher.awaitListenersIdle(Duration.ofNanos(Math.max(0, deadline - System.nanoTime())));
        workers.clear();
        threads.clear();
        if (!stuck.isEmpty() || !dispatched) {
            log.error("Pipeline shutdown incomplete stuckPartitions={} discarded={} dispatcherDrained={}", stuck,
                    discarded, dispatched);
            throw new PipelineShutdownException("pipeline did not drain within " + timeout + ": stuckPartitions="
                    + stuck + " discarded=" + discarded + " dispatcherDrained=" + dispatched);
        }
        log.info("Pipeline stopped counters={}", counters.snapshot());
    }

    /**
     * Waits until no buffered reading is left, every worker is idle and the dispatcher has
     * delivered everything to its listeners.
     */
    public boolean awaitQuiescence(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        int stableRounds = 0;
        while (System.nanoTime() < deadline) {
            if (isQuiet()) {
                if (++stableRounds >= 3) return true;
            } else {
                stableRounds = 0;
            }
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return false;
    }

    private boolean isQuiet() {
        if (buffer.totalDepth() > 0 || dispatcher.outboxSize() > 0) return false;
        for (PartitionWorker worker : workers) {
            if (worker.isBusy()) return false;
        }
        return dispatcher.stats().stream()
                .filter(SubscriptionStats::isListener)
                .allMatch(s -> s.getPending() == 0);
    }

    public boolean isRunning() {
        return running;
    }

    public int workerCount() {
        return buffer.partitions();
    }
}
