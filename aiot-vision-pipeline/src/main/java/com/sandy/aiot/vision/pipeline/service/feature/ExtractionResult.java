package com.sandy.aiot.vision.pipeline.service.feature;

import com.sandy.aiot.vision.pipeline.model.FeatureVector;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ExtractionResult {

    public enum Status {
        OK,
        INSUFFICIENT_DATA
    }

    Status status;
    FeatureVector vector;
    int readingCount;
    int minReadings;

    public static ExtractionResult of(FeatureVector vector) {
        return new ExtractionResult(Status.OK, vector, vector.getSourceReadingCount(), 0);
    }

    public static ExtractionResult insufficientData(int readingCount, int minReadings) {
        return new ExtractionResult(Status.INSUFFICIENT_DATA, null, readingCount, minReadings);
    }

    public boolean isOk() {
        return status == Status.OK;
    }
}
