package com.sandy.aiot.vision.pipeline.service.registry;

import com.sandy.aiot.vision.pipeline.config.PipelineProperties;
import com.sandy.aiot.vision.pipeline.model.EquipmentDefinition;
import com.sandy.aiot.vision.pipeline.model.EquipmentStatus;
import com.sandy.aiot.vision.pipeline.model.SensorDefinition;
import com.sandy.aiot.vision.pipeline.model.WindowMode;
import com.sandy.aiot.vision.pipeline.model.WindowSpec;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Catalogue of known sensors and equipment. Replaced wholesale on reload; readers
 * always see one consistent snapshot.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SensorRegistry {

    private final PipelineProperties properties;
    private final AtomicReference<Catalog> catalog = new AtomicReference<>(new Catalog(Map.of(), Map.of()));

    @PostConstruct
    public void init() {
        replace(properties.getSensors(), properties.getEquipment());
    }

    public Optional<SensorDefinition> findSensor(String sensorId) {
        if (sensorId == null) return Optional.empty();
        return Optional.ofNullable(catalog.get().sensors().get(sensorId));
    }

    public Optional<EquipmentDefinition> findEquipment(String equipmentId) {
        if (equipmentId == null) return Optional.empty();
        return Optional.ofNullable(catalog.get().equipment().get(equipmentId));
    }

    public Collection<SensorDefinition> allSensors() {
        return catalog.get().sensors().values();
    }

    public Collection<EquipmentDefinition> allEquipment() {
        return catalog.get().equipment().values();
    }

    public Optional<String> equipmentTypeOf(String equipmentId) {
        return findEquipment(equipmentId).map(EquipmentDefinition::getType);
    }

    public boolean isUnderMaintenance(String equipmentId) {
        return findEquipment(equipmentId).map(e -> e.getStatus() == EquipmentStatus.MAINTENANCE).orElse(false);
    }

    /**
     * Replaces the whole catalogue. Definitions are copied so later edits by the caller have no effect.
     *
     * @throws IllegalArgumentException on duplicate or incomplete definitions
     */
    public void replace(List<SensorDefinition> sensors, List<EquipmentDefinition> equipment) {
        Map<String, EquipmentDefinition> eq = new LinkedHashMap<>();
        for (EquipmentDefinition e : equipment) {
            if (e.getId() == null || e.getId().isBlank()) throw new IllegalArgumentException("equipment id is required");
            if (eq.putIfAbsent(e.getId(), copy(e)) != null) {
                throw new IllegalArgumentException("duplicate equipment id: " + e.getId());
            }
        }
        Map<String, SensorDefinition> ss = new LinkedHashMap<>();
        for (SensorDefinition s : sensors) {
            if (s.getId() == null || s.getId().isBlank()) throw new IllegalArgumentException("sensor id is required");
            if (s.getEquipmentId() == null || s.getEquipmentId().isBlank()) {
                throw new IllegalArgumentException("sensor " + s.getId() + " has no equipment id");
            }
            SensorDefinition copy = s.toBuilder().build();
            windowSpecOf(copy);
            if (ss.putIfAbsent(s.getId(), copy) != null) {
                throw new IllegalArgumentException("duplicate sensor id: " + s.getId());
            }
        }
        catalog.set(new Catalog(Collections.unmodifiableMap(ss), Collections.unmodifiableMap(eq)));
        log.info("Sensor registry loaded: sensors={} equipment={}", ss.size(), eq.size());
    }

    public boolean updateEquipmentStatus(String equipmentId, EquipmentStatus status) {
        while (true) {
            Catalog current = catalog.get();
            EquipmentDefinition existing = current.equipment().get(equipmentId);
            if (existing == null) return false;
            Map<String, EquipmentDefinition> eq = new LinkedHashMap<>(current.equipment());
            EquipmentDefinition updated = copy(existing);
            updated.setStatus(status);
            eq.put(equipmentId, updated);
            if (catalog.compareAndSet(current, new Catalog(current.sensors(), Collections.unmodifiableMap(eq)))) {
                log.info("Equipment status changed equipmentId={} status={}", equipmentId, status);
                return true;
            }
        }
    }

    public int bufferCapacityFor(String sensorId) {
        return findSensor(sensorId)
                .map(SensorDefinition::getBufferCapacity)
                .orElse(properties.getIngest().getBufferCapacity());
    }

    public WindowSpec windowSpecFor(String sensorId) {
        SensorDefinition sensor = findSensor(sensorId)
                .orElseThrow(() -> new IllegalArgumentException("Sensor[sensorId=" + sensorId + "] not registered"));
        return windowSpecOf(sensor);
    }

    /** Window spec of a definition, sensor overrides merged over the pipeline defaults. */
    public WindowSpec windowSpecOf(SensorDefinition s) {
        PipelineProperties.Window d = properties.getWindow();
        WindowMode mode = s.getWindowMode() != null ? s.getWindowMode() : d.getMode();
        return WindowSpec.builder()
                .mode(mode)
                .size(s.getWindowSize() != null ? s.getWindowSize() : d.getSize())
                .stride(s.getWindowStride() != null ? s.getWindowStride()
                        : s.getWindowSize() != null ? Math.min(s.getWindowSize(), d.getStride()) : d.getStride())
                .duration(s.getWindowDuration() != null ? s.getWindowDuration() : d.getDuration())
                .strideDuration(s.getWindowStrideDuration() != null ? s.getWindowStrideDuration()
                        : s.getWindowDuration() != null && s.getWindowDuration().compareTo(d.getStrideDuration()) < 0
                        ? s.getWindowDuration() : d.getStrideDuration())
                .minReadings(s.getMinReadings() != null ? s.getMinReadings() : d.getMinReadings())
                .build();
    }

    private static EquipmentDefinition copy(EquipmentDefinition e) {
        return EquipmentDefinition.builder()
                .id(e.getId())
                .name(e.getName())
                .type(e.getType())
                .location(e.getLocation())
                .status(e.getStatus() == null ? EquipmentStatus.ONLINE : e.getStatus())
                .build();
    }

    private record Catalog(Map<String, SensorDefinition> sensors, Map<String, EquipmentDefinition> equipment) {
    }
}
