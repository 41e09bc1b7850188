package com.sandy.aiot.vision.pipeline.service.ingest;

import com.sandy.aiot.vision.pipeline.model.RawReading;
import com.sandy.aiot.vision.pipeline.model.Reading;
import com.sandy.aiot.vision.pipeline.service.PipelineCounters;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Entry point for protocol adapters and the REST surface. Validation and enqueue of one sensor
 * run under the same stripe lock, so the accepted order of a sensor is the order in its lane.
 * Submissions hold the read side of the gate; {@link #stopAccepting()} takes the write side, so once
 * it returns no accepted reading is still on its way into a lane.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IngestionService {

    private static final int STRIPES = 64;

    private final ReadingValidator validator;
    private final IngestionBuffer buffer;
    private final PipelineCounters counters;

    private final Object[] stripes = initStripes();
    private final ReentrantReadWriteLock gate = new ReentrantReadWriteLock();
    private volatile boolean accepting = true;

    public SubmitResult submit(RawReading raw) {
        gate.readLock().lock();
        try {
            if (!accepting) {
                counters.increment(PipelineCounters.Counter.READINGS_REJECTED_SHUTTING_DOWN);
                return SubmitResult.rejected(RejectReason.SHUTTING_DOWN, "pipeline is shutting down", false);
            }
            return validateAndEnqueue(raw);
        } finally {
            gate.readLock().unlock();
        }
    }

    private SubmitResult validateAndEnqueue(RawReading raw) {
        String key = raw == null || raw.getSensorId() == null ? "" : raw.getSensorId().trim();
        synchronized (stripes[Math.floorMod(key.hashCode(), STRIPES)]) {
            ValidationResult validation = validator.validate(raw);
            if (!validation.isValid()) {
                return SubmitResult.rejected(validation.getReason(), validation.getDetail(), false);
            }
            Reading reading = validation.getReading();
            IngestionBuffer.Outcome outcome = buffer.enqueue(reading);
            boolean congested = buffer.isCongested(reading.getSensorId());
            if (outcome == IngestionBuffer.Outcome.REJECTED_FULL) {
                counters.increment(PipelineCounters.Counter.READINGS_REJECTED_BUFFER_FULL);
                return SubmitResult.rejected(RejectReason.BUFFER_FULL,
                        "buffer full for sensorId=" + reading.getSensorId(), congested);
            }
            validator.markAccepted(reading);
            counters.increment(PipelineCounters.Counter.READINGS_ACCEPTED);
            return SubmitResult.accepted(congested);
        }
    }

    /** Submits each reading in order; one rejection never affects the others. */
    public BatchResult submitBatch(List<RawReading> raws) {
        List<SubmitResult> results = new ArrayList<>(raws.size());
        for (RawReading raw : raws) {
            results.add(submit(raw));
        }
        BatchResult result = new BatchResult(results);
        if (result.getRejected() > 0) {
            log.debug("Batch submitted size={} accepted={} rejected={}", raws.size(), result.getAccepted(),
                    result.getRejected());
        }
        return result;
    }

    /** Closes ingestion; waits for submissions already past the gate to land in their lanes. */
    public void stopAccepting() {
        gate.writeLock().lock();
        try {
            accepting = false;
        } finally {
            gate.writeLock().unlock();
        }
        log.info("Ingestion closed, new readings are rejected");
    }

    public boolean isAccepting() {
        return accepting;
    }

    private static Object[] initStripes() {
        Object[] locks = new Object[STRIPES];
        for (int i = 0; i < STRIPES; i++) {
            locks[i] = new Object();
        }
        return locks;
    }
}
