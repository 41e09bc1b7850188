package com.sandy.aiot.vision.pipeline.service.scoring;

/** Closed interval a scorer promises its scores fall in. */
public record ScoreDomain(double min, double max) {

    public static final ScoreDomain UNIT = new ScoreDomain(0.0, 1.0);
    public static final ScoreDomain NON_NEGATIVE = new ScoreDomain(0.0, Double.MAX_VALUE);

    public boolean contains(double score) {
        return Double.isFinite(score) && score >= min && score <= max;
    }
}
