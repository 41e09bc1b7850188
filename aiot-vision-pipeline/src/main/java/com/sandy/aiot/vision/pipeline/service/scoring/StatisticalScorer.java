package com.sandy.aiot.vision.pipeline.service.scoring;

import com.sandy.aiot.vision.pipeline.config.PipelineProperties;
import com.sandy.aiot.vision.pipeline.model.FeatureVector;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Absolute z-score of the window mean against the means of the previous windows of the same sensor.
 * Confidence grows with the baseline until it is full.
 */
public class StatisticalScorer implements AnomalyScorer {

    /** Relative floor applied to the baseline deviation so a flat baseline still yields a finite score. */
    private static final double MIN_RELATIVE_STD = 1e-9;

    private final String modelId;
    private final int baselineSize;
    private final int minBaseline;
    private final double threshold;
    private final Map<String, Ring> baselines = new ConcurrentHashMap<>();

    public StatisticalScorer(String modelId, PipelineProperties.Statistical config) {
        this.modelId = modelId;
        this.baselineSize = Math.max(2, config.getBaselineSize());
        this.minBaseline = Math.max(2, Math.min(config.getMinBaseline(), baselineSize));
        this.threshold = config.getThreshold();
    }

    @Override
    public String modelId() {
        return modelId;
    }

    @Override
    public ScorerType type() {
        return ScorerType.STATISTICAL;
    }

    @Override
    public ScoreDomain domain() {
        return ScoreDomain.NON_NEGATIVE;
    }

    @Override
    public ScoreOutcome score(FeatureVector vector) {
        Double mean = vector.feature(FeatureVector.MEAN);
        if (mean == null) throw new IllegalArgumentException("feature vector has no mean");
        Ring baseline = baselines.computeIfAbsent(vector.getSensorId(), k -> new Ring(baselineSize));
        if (baseline.size() < minBaseline) {
            baseline.add(mean);
            return ScoreOutcome.warmingUp();
        }
        double bMean = baseline.mean();
        double bStd = Math.max(baseline.std(), MIN_RELATIVE_STD * Math.max(1.0, Math.abs(bMean)));
        double z = Math.abs(mean - bMean) / bStd;
        double confidence = Math.min(1.0, (double) baseline.size() / baselineSize);
        baseline.add(mean);
        return ScoreOutcome.scored(z, confidence, z >= threshold);
    }

    @Override
    public void forget(String sensorId) {
        baselines.remove(sensorId);
    }

    private static final class Ring {
        private final double[] values;
        private int next;
        private int size;

        Ring(int capacity) {
            this.values = new double[capacity];
        }

        void add(double v) {
            values[next] = v;
            next = (next + 1) % values.length;
            if (size < values.length) size++;
        }

        int size() {
            return size;
        }

        double mean() {
            double sum = 0;
            for (int i = 0; i < size; i++) sum += values[i];
            return sum / size;
        }

        double std() {
            double m = mean();
            double ss = 0;
            for (int i = 0; i < size; i++) ss += (values[i] - m) * (values[i] - m);
            return Math.sqrt(ss / size);
        }
    }
}
