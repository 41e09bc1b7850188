package com.sandy.aiot.vision.pipeline.service.ingest;

import com.sandy.aiot.vision.pipeline.config.PipelineProperties;
import com.sandy.aiot.vision.pipeline.model.DiagnosticEvent;
import com.sandy.aiot.vision.pipeline.model.DiagnosticType;
import com.sandy.aiot.vision.pipeline.model.OverflowPolicy;
import com.sandy.aiot.vision.pipeline.model.Reading;
import com.sandy.aiot.vision.pipeline.service.PipelineCounters;
import com.sandy.aiot.vision.pipeline.service.dispatch.PipelineEventPublisher;
import com.sandy.aiot.vision.pipeline.service.registry.SensorRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.concurrent.locks.LockSupport;

/**
 * Bounded FIFO lane per sensor between producers and the partition workers.
 * <p>
 * A sensor always maps to the same partition, so one worker sees its readings in arrival order.
 * Lane capacity is fixed when the lane is created.
 */
@Component
@Slf4j
public class IngestionBuffer {

    public enum Outcome {
        ACCEPTED,
        /** Accepted after evicting the oldest buffered reading. */
        ACCEPTED_EVICTED_OLDEST,
        REJECTED_FULL
    }

    private final SensorRegistry sensorRegistry;
    private final PipelineCounters counters;
    private final PipelineEventPublisher publisher;
    private final Clock clock;
    private final OverflowPolicy overflowPolicy;
    private final double highWaterRatio;
    private final int partitions;

    private final Map<String, Lane> lanes = new ConcurrentHashMap<>();
    private final List<List<Lane>> lanesByPartition;
    private final AtomicReferenceArray<Thread> workers;

    public IngestionBuffer(SensorRegistry sensorRegistry, PipelineProperties properties, PipelineCounters counters,
                           PipelineEventPublisher publisher, Clock clock) {
        this.sensorRegistry = sensorRegistry;
        this.counters = counters;
        this.publisher = publisher;
        this.clock = clock;
        this.overflowPolicy = properties.getIngest().getOverflowPolicy();
        this.highWaterRatio = properties.getIngest().getHighWaterRatio();
        this.partitions = Math.max(1, properties.getWorkers());
        List<List<Lane>> byPartition = new ArrayList<>(partitions);
        for (int i = 0; i < partitions; i++) {
            byPartition.add(new CopyOnWriteArrayList<>());
        }
        this.lanesByPartition = Collections.unmodifiableList(byPartition);
        this.workers = new AtomicReferenceArray<>(partitions);
    }

    public int partitions() {
        return partitions;
    }

    public int partitionOf(String sensorId) {
        return Math.floorMod(sensorId.hashCode(), partitions);
    }

    /** Registers the thread to wake when a lane of the partition receives a reading. */
    public void registerWorker(int partition, Thread thread) {
        workers.set(partition, thread);
    }

    public Outcome enqueue(Reading reading) {
        Lane lane = lanes.computeIfAbsent(reading.getSensorId(), this::newLane);
        Outcome outcome;
        boolean becameCongested;
        boolean firstEviction = false;
        int depth;
        synchronized (lane) {
            if (lane.readings.size() >= lane.capacity) {
                if (overflowPolicy == OverflowPolicy.REJECT_NEWEST) {
                    outcome = Outcome.REJECTED_FULL;
                } else {
                    lane.readings.pollFirst();
                    lane.readings.addLast(reading);
                    firstEviction = !lane.evictedThisEpisode;
                    lane.evictedThisEpisode = true;
                    outcome = Outcome.ACCEPTED_EVICTED_OLDEST;
                }
            } else {
                lane.readings.addLast(reading);
                outcome = Outcome.ACCEPTED;
            }
            depth = lane.readings.size();
            becameCongested = !lane.congested && depth >= lane.highWater;
            if (becameCongested) lane.congested = true;
        }
        if (outcome == Outcome.ACCEPTED_EVICTED_OLDEST) {
            counters.increment(PipelineCounters.Counter.READINGS_DROPPED_OLDEST);
        }
        if (becameCongested) {
            log.warn("Ingestion lane congested sensorId={} depth={} capacity={}", lane.sensorId, depth, lane.capacity);
            publisher.diagnostic(laneDiagnostic(DiagnosticType.CONGESTED, lane, depth, "lane above high-water mark"));
        }
        if (firstEviction) {
            publisher.diagnostic(laneDiagnostic(DiagnosticType.READINGS_DROPPED, lane, depth,
                    "lane full, oldest readings evicted"));
        }
        if (outcome != Outcome.REJECTED_FULL) {
            Thread worker = workers.get(lane.partition);
            if (worker != null) LockSupport.unpark(worker);
        }
        return outcome;
    }

    public boolean isCongested(String sensorId) {
        Lane lane = lanes.get(sensorId);
        if (lane == null) return false;
        synchronized (lane) {
            return lane.congested;
        }
    }

    public List<Lane> lanesOf(int partition) {
        return lanesByPartition.get(partition);
    }

    /** Removes up to {@code max} readings from the head of the lane, oldest first. */
    public List<Reading> dequeueBatch(Lane lane, int max) {
        List<Reading> batch;
        boolean cleared = false;
        int depth;
        synchronized (lane) {
            int n = Math.min(max, lane.readings.size());
            if (n == 0) return List.of();
            batch = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                batch.add(lane.readings.pollFirst());
            }
            depth = lane.readings.size();
            if (lane.congested && depth < lane.highWater) {
                lane.congested = false;
                lane.evictedThisEpisode = false;
                cleared = true;
            }
        }
        if (cleared) {
            log.info("Ingestion lane congestion cleared sensorId={} depth={}", lane.sensorId, depth);
            publisher.diagnostic(laneDiagnostic(DiagnosticType.CONGESTION_CLEARED, lane, depth, "lane below high-water mark"));
        }
        return batch;
    }

    /** Empties every lane of the partition and returns the number of readings thrown away. */
    public int discard(int partition) {
        int discarded = 0;
        for (Lane lane : lanesOf(partition)) {
            synchronized (lane) {
                discarded += lane.readings.size();
                lane.readings.clear();
                lane.congested = false;
            }
        }
        return discarded;
    }

    public int depth(int partition) {
        int total = 0;
        for (Lane lane : lanesOf(partition)) {
            total += lane.depth();
        }
        return total;
    }

    public int totalDepth() {
        int total = 0;
        for (int p = 0; p < partitions; p++) {
            total += depth(p);
        }
        return total;
    }

    public Map<String, Integer> laneDepths() {
        Map<String, Integer> map = new LinkedHashMap<>();
        lanes.values().stream()
                .sorted((a, b) -> a.sensorId.compareTo(b.sensorId))
                .forEach(l -> map.put(l.sensorId, l.depth()));
        return map;
    }

    public long congestedLanes() {
        return lanes.values().stream().filter(l -> isCongested(l.sensorId)).count();
    }

    private Lane newLane(String sensorId) {
        int capacity = Math.max(1, sensorRegistry.bufferCapacityFor(sensorId));
        Lane lane = new Lane(sensorId, partitionOf(sensorId), capacity,
                Math.max(1, (int) Math.ceil(capacity * highWaterRatio)));
        lanesByPartition.get(lane.partition).add(lane);
        log.debug("Ingestion lane created sensorId={} partition={} capacity={}", sensorId, lane.partition, capacity);
        return lane;
    }

    private DiagnosticEvent laneDiagnostic(DiagnosticType type, Lane lane, int depth, String message) {
        return DiagnosticEvent.builder()
                .type(type)
                .sensorId(lane.sensorId)
                .message(message)
                .detail("depth", depth)
                .detail("capacity", lane.capacity)
                .detail("policy", overflowPolicy.name())
                .at(clock.instant())
                .build();
    }

    public static final class Lane {
        private final String sensorId;
        private final int partition;
        private final int capacity;
        private final int highWater;
        private final ArrayDeque<Reading> readings;
        private boolean congested;
        private boolean evictedThisEpisode;

        Lane(String sensorId, int partition, int capacity, int highWater) {
            this.sensorId = sensorId;
            this.partition = partition;
            this.capacity = capacity;
            this.highWater = highWater;
            this.readings = new ArrayDeque<>(Math.min(capacity, 1024));
        }

        public String getSensorId() {
            return sensorId;
        }

        public synchronized int depth() {
            return readings.size();
        }
    }
}
