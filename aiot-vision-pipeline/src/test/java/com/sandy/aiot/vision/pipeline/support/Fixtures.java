package com.sandy.aiot.vision.pipeline.support;

import com.sandy.aiot.vision.pipeline.config.PipelineProperties;
import com.sandy.aiot.vision.pipeline.model.EquipmentDefinition;
import com.sandy.aiot.vision.pipeline.model.Quality;
import com.sandy.aiot.vision.pipeline.model.Reading;
import com.sandy.aiot.vision.pipeline.model.SensorDefinition;
import com.sandy.aiot.vision.pipeline.service.registry.SensorRegistry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Small catalogue shared by the unit tests: equipment "press-1" (type PRESS) with sensors "temp" and "load". */
public final class Fixtures {

    public static final Instant T0 = Instant.parse("2024-05-01T08:00:00Z");

    private Fixtures() {
    }

    public static PipelineProperties properties() {
        PipelineProperties p = new PipelineProperties();
        p.setWorkers(2);
        p.setEquipment(new ArrayList<>(List.of(EquipmentDefinition.builder().id("press-1").name("Press").type("PRESS").build())));
        p.setSensors(new ArrayList<>(List.of(
                SensorDefinition.builder().id("temp").equipmentId("press-1").unit("degC").build(),
                SensorDefinition.builder().id("load").equipmentId("press-1").unit("kN").build())));
        return p;
    }

    public static SensorRegistry registry(PipelineProperties properties) {
        SensorRegistry registry = new SensorRegistry(properties);
        registry.init();
        return registry;
    }

    public static Reading reading(String sensorId, Instant at, double value) {
        return Reading.builder()
                .sensorId(sensorId)
                .equipmentId("press-1")
                .timestamp(at)
                .value(value)
                .quality(Quality.GOOD)
                .build();
    }
}
