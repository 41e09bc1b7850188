package com.sandy.aiot.vision.pipeline.service.ingest;

import com.sandy.aiot.vision.pipeline.model.Quality;
import com.sandy.aiot.vision.pipeline.model.RawReading;
import com.sandy.aiot.vision.pipeline.model.Reading;
import com.sandy.aiot.vision.pipeline.support.Fixtures;
import com.sandy.aiot.vision.pipeline.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.sandy.aiot.vision.pipeline.support.Fixtures.T0;
import static org.junit.jupiter.api.Assertions.*;

class ReadingValidatorTest {

    private MutableClock clock;
    private ReadingValidator validator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        validator = new ReadingValidator(Fixtures.registry(Fixtures.properties()), clock);
    }

    private static RawReading raw(String sensorId, Instant ts, Double value) {
        return RawReading.builder().sensorId(sensorId).timestamp(ts).value(value).build();
    }

    @Test
    void fillsDefaultsFromRegistryAndClock() {
        ValidationResult result = validator.validate(RawReading.builder().sensorId(" temp ").value(21.5).build());
        assertTrue(result.isValid());
        Reading r = result.getReading();
        assertEquals("temp", r.getSensorId());
        assertEquals("press-1", r.getEquipmentId());
        assertEquals(T0, r.getTimestamp());
        assertEquals("degC", r.getUnit());
        assertEquals(Quality.GOOD, r.getQuality());
    }

    @Test
    void rejectsMalformedInput() {
        assertEquals(RejectReason.EMPTY_IDENTIFIER, validator.validate(raw("  ", T0, 1.0)).getReason());
        assertEquals(RejectReason.EMPTY_IDENTIFIER, validator.validate(null).getReason());
        assertEquals(RejectReason.NON_FINITE_VALUE, validator.validate(raw("temp", T0, Double.NaN)).getReason());
        assertEquals(RejectReason.NON_FINITE_VALUE, validator.validate(raw("temp", T0, Double.POSITIVE_INFINITY)).getReason());
        assertEquals(RejectReason.NON_FINITE_VALUE, validator.validate(raw("temp", T0, null)).getReason());
        assertEquals(RejectReason.UNKNOWN_SENSOR, validator.validate(raw("nope", T0, 1.0)).getReason());
        assertEquals(2, validator.rejectionCount(RejectReason.EMPTY_IDENTIFIER));
        assertEquals(3, validator.rejectionCount(RejectReason.NON_FINITE_VALUE));
    }

    @Test
    void rejectsSensorReportedUnderWrongEquipment() {
        RawReading r = RawReading.builder().sensorId("temp").equipmentId("other").value(1.0).build();
        assertEquals(RejectReason.UNKNOWN_SENSOR, validator.validate(r).getReason());
    }

    @Test
    void timestampRegressionIsRejectedButEqualTimestampIsNot() {
        Reading first = validator.validate(raw("temp", T0.plusSeconds(10), 1.0)).getReading();
        validator.markAccepted(first);

        ValidationResult older = validator.validate(raw("temp", T0.plusSeconds(9), 1.0));
        assertEquals(RejectReason.TIMESTAMP_REGRESSION, older.getReason());
        assertTrue(validator.validate(raw("temp", T0.plusSeconds(10), 2.0)).isValid());
        // other sensors are tracked separately
        assertTrue(validator.validate(raw("load", T0, 1.0)).isValid());
    }

    @Test
    void unknownQualityIsUncertain() {
        RawReading r = RawReading.builder().sensorId("temp").value(1.0).quality("flaky").build();
        assertEquals(Quality.UNCERTAIN, validator.validate(r).getReading().getQuality());
        r.setQuality("bad");
        assertEquals(Quality.BAD, validator.validate(r).getReading().getQuality());
    }
}
