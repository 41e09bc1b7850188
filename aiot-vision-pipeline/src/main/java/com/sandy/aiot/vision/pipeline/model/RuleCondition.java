package com.sandy.aiot.vision.pipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * parameter + operator + threshold(s) + minimum sustained duration.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RuleCondition {
    @Builder.Default
    private ConditionSource source = ConditionSource.VALUE;
    /** Feature name, only for {@link ConditionSource#FEATURE}. */
    private String feature;
    private ComparisonOperator operator;
    private Double threshold;
    private Double upperThreshold;
    @Builder.Default
    private Duration minDuration = Duration.ZERO;

    public boolean test(double observed) {
        return operator.test(observed, threshold, upperThreshold);
    }

    @JsonIgnore
    public Duration getEffectiveMinDuration() {
        return minDuration == null ? Duration.ZERO : minDuration;
    }

    public String describe() {
        String subject = source == ConditionSource.FEATURE ? "feature:" + feature : source.name().toLowerCase();
        String bound = operator.needsUpperThreshold()
                ? "[" + threshold + ", " + upperThreshold + "]"
                : String.valueOf(threshold);
        return subject + " " + operator.symbol() + " " + bound + " for " + getEffectiveMinDuration();
    }
}
