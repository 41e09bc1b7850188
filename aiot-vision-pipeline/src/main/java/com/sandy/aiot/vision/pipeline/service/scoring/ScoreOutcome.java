package com.sandy.aiot.vision.pipeline.service.scoring;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ScoreOutcome {

    public enum Status {
        SCORED,
        /** Not enough history yet; no prediction is produced. */
        WARMING_UP
    }

    Status status;
    double score;
    double confidence;
    boolean anomaly;

    public static ScoreOutcome scored(double score, double confidence, boolean anomaly) {
        return new ScoreOutcome(Status.SCORED, score, confidence, anomaly);
    }

    public static ScoreOutcome warmingUp() {
        return new ScoreOutcome(Status.WARMING_UP, Double.NaN, Double.NaN, false);
    }

    public boolean isScored() {
        return status == Status.SCORED;
    }
}
