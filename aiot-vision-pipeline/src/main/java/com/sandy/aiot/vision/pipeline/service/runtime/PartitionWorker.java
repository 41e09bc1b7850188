package com.sandy.aiot.vision.pipeline.service.runtime;

import com.sandy.aiot.vision.pipeline.model.Reading;
import com.sandy.aiot.vision.pipeline.service.ingest.IngestionBuffer;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.locks.LockSupport;
import java.util.function.Predicate;

/**
 * Drains the lanes of one partition round-robin, one batch per lane per pass, and reaps the
 * partition's stale windows. Idle passes back off exponentially up to the configured maximum;
 * an enqueue into the partition unparks the worker early.
 */
@Slf4j
class PartitionWorker implements Runnable {

    private final int partition;
    private final IngestionBuffer buffer;
    private final PipelineProcessor processor;
    private final int maxBatch;
    private final long minBackoffNanos;
    private final long maxBackoffNanos;
    private final long reapIntervalNanos;
    private final Predicate<String> owns;

    private volatile boolean draining;
    private volatile boolean busy;

    PartitionWorker(int partition, IngestionBuffer buffer, PipelineProcessor processor, int maxBatch,
                    Duration minBackoff, Duration maxBackoff, Duration reapInterval) {
        this.partition = partition;
        this.buffer = buffer;
        this.processor = processor;
        this.maxBatch = Math.max(1, maxBatch);
        this.minBackoffNanos = Math.max(1, minBackoff.toNanos());
        this.maxBackoffNanos = Math.max(minBackoffNanos, maxBackoff.toNanos());
        this.reapIntervalNanos = reapInterval.toNanos();
        this.owns = sensorId -> buffer.partitionOf(sensorId) == partition;
    }

    @Override
    public void run() {
        long backoff = minBackoffNanos;
        long nextReap = System.nanoTime() + reapIntervalNanos;
        log.debug("Partition worker started partition={}", partition);
        while (true) {
            busy = true;
            boolean worked = false;
            for (IngestionBuffer.Lane lane : buffer.lanesOf(partition)) {
                List<Reading> batch = buffer.dequeueBatch(lane, maxBatch);
                for (Reading reading : batch) {
                    processor.process(reading);
                }
                worked |= !batch.isEmpty();
            }
            if (System.nanoTime() - nextReap >= 0) {
                processor.reap(owns);
                nextReap = System.nanoTime() + reapIntervalNanos;
            }
            if (worked) {
                backoff = minBackoffNanos;
                continue;
            }
            if (draining && buffer.depth(partition) == 0) {
                processor.flush(owns);
                busy = false;
                log.debug("Partition worker drained partition={}", partition);
                return;
            }
            busy = false;
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Partition worker interrupted partition={} remaining={}", partition, buffer.depth(partition));
                return;
            }
            LockSupport.parkNanos(this, backoff);
            backoff = Math.min(backoff * 2, maxBackoffNanos);
        }
    }

    int partition() {
        return partition;
    }

    boolean isBusy() {
        return busy;
    }

    void drain() {
        draining = true;
    }
}
