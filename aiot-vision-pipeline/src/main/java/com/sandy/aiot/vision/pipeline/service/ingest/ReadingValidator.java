package com.sandy.aiot.vision.pipeline.service.ingest;

import com.sandy.aiot.vision.pipeline.model.Quality;
import com.sandy.aiot.vision.pipeline.model.RawReading;
import com.sandy.aiot.vision.pipeline.model.Reading;
import com.sandy.aiot.vision.pipeline.model.SensorDefinition;
import com.sandy.aiot.vision.pipeline.service.registry.SensorRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Normalizes adapter input and rejects what cannot enter the pipeline.
 * <p>
 * Timestamp regression is reported, never corrected. The last accepted timestamp per sensor
 * only moves in {@link #markAccepted(Reading)}, so callers must validate and mark under the
 * same per-sensor lock to keep the check meaningful.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ReadingValidator {

    private final SensorRegistry sensorRegistry;
    private final Clock clock;

    private final Map<String, Instant> lastAccepted = new ConcurrentHashMap<>();
    private final Map<RejectReason, LongAdder> rejections = initCounters();

    public ValidationResult validate(RawReading raw) {
        if (raw == null || raw.getSensorId() == null || raw.getSensorId().isBlank()) {
            return reject(RejectReason.EMPTY_IDENTIFIER, "sensorId is empty");
        }
        String sensorId = raw.getSensorId().trim();
        Double value = raw.getValue();
        if (value == null || !Double.isFinite(value)) {
            return reject(RejectReason.NON_FINITE_VALUE, "sensorId=" + sensorId + " value=" + value);
        }
        Optional<SensorDefinition> sensorOpt = sensorRegistry.findSensor(sensorId);
        if (sensorOpt.isEmpty()) {
            return reject(RejectReason.UNKNOWN_SENSOR, "sensorId=" + sensorId + " is not registered");
        }
        SensorDefinition sensor = sensorOpt.get();
        String equipmentId = raw.getEquipmentId() == null || raw.getEquipmentId().isBlank()
                ? sensor.getEquipmentId() : raw.getEquipmentId().trim();
        if (!equipmentId.equals(sensor.getEquipmentId())) {
            return reject(RejectReason.UNKNOWN_SENSOR, "sensorId=" + sensorId + " is not registered under equipmentId="
                    + equipmentId);
        }
        Instant timestamp = raw.getTimestamp() != null ? raw.getTimestamp() : clock.instant();
        Instant last = lastAccepted.get(sensorId);
        if (last != null && timestamp.isBefore(last)) {
            return reject(RejectReason.TIMESTAMP_REGRESSION, "sensorId=" + sensorId + " timestamp=" + timestamp
                    + " lastAccepted=" + last);
        }
        String unit = raw.getUnit() == null || raw.getUnit().isBlank() ? sensor.getUnit() : raw.getUnit().trim();
        return ValidationResult.accepted(Reading.builder()
                .sensorId(sensorId)
                .equipmentId(equipmentId)
                .timestamp(timestamp)
                .value(value)
                .quality(Quality.parse(raw.getQuality()))
                .unit(unit)
                .build());
    }

    /** Records the reading as the newest one the pipeline has taken for its sensor. */
    public void markAccepted(Reading reading) {
        lastAccepted.merge(reading.getSensorId(), reading.getTimestamp(), (a, b) -> b.isAfter(a) ? b : a);
    }

    public long rejectionCount(RejectReason reason) {
        LongAdder adder = rejections.get(reason);
        return adder == null ? 0 : adder.sum();
    }

    public Map<String, Long> rejectionCounts() {
        Map<String, Long> map = new LinkedHashMap<>();
        rejections.forEach((k, v) -> map.put(k.name(), v.sum()));
        return map;
    }

    private ValidationResult reject(RejectReason reason, String detail) {
        rejections.get(reason).increment();
        log.debug("Reading rejected reason={} {}", reason, detail);
        return ValidationResult.rejected(reason, detail);
    }

    private static Map<RejectReason, LongAdder> initCounters() {
        Map<RejectReason, LongAdder> map = new EnumMap<>(RejectReason.class);
        map.put(RejectReason.NON_FINITE_VALUE, new LongAdder());
        map.put(RejectReason.EMPTY_IDENTIFIER, new LongAdder());
        map.put(RejectReason.TIMESTAMP_REGRESSION, new LongAdder());
        map.put(RejectReason.UNKNOWN_SENSOR, new LongAdder());
        return map;
    }
}
