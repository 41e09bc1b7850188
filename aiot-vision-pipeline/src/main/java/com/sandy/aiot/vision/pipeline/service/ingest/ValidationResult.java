package com.sandy.aiot.vision.pipeline.service.ingest;

import com.sandy.aiot.vision.pipeline.model.Reading;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ValidationResult {
    Reading reading;
    RejectReason reason;
    String detail;

    public static ValidationResult accepted(Reading reading) {
        return new ValidationResult(reading, null, null);
    }

    public static ValidationResult rejected(RejectReason reason, String detail) {
        return new ValidationResult(null, reason, detail);
    }

    public boolean isValid() {
        return reason == null;
    }
}
