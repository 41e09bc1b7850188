package com.sandy.aiot.vision.pipeline.service.scoring;

import com.sandy.aiot.vision.pipeline.config.PipelineProperties;
import com.sandy.aiot.vision.pipeline.model.FeatureVector;

import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Scores the last K feature vectors of a sensor by the mean squared reconstruction error of a
 * {@link SequenceModel}. Confidence is {@code 1 / (1 + error / errorThreshold)}, so a model that
 * keeps failing to reconstruct its input reports falling confidence.
 */
public class SequenceScorer implements AnomalyScorer {

    private final SequenceModel model;
    private final int length;
    private final double errorThreshold;
    private final List<String> features;
    private final Map<String, ArrayDeque<float[]>> sequences = new ConcurrentHashMap<>();

    public SequenceScorer(SequenceModel model, PipelineProperties.Sequence config) {
        if (config.getFeatures() == null || config.getFeatures().isEmpty()) {
            throw new IllegalArgumentException("sequence scorer " + model.id() + " needs at least one feature");
        }
        if (config.getErrorThreshold() <= 0) {
            throw new IllegalArgumentException("sequence scorer error threshold must be positive");
        }
        this.model = model;
        this.length = Math.max(1, config.getLength());
        this.errorThreshold = config.getErrorThreshold();
        this.features = List.copyOf(config.getFeatures());
    }

    @Override
    public String modelId() {
        return model.id();
    }

    @Override
    public ScorerType type() {
        return ScorerType.SEQUENCE;
    }

    @Override
    public ScoreDomain domain() {
        return ScoreDomain.NON_NEGATIVE;
    }

    @Override
    public ScoreOutcome score(FeatureVector vector) {
        float[] step = new float[features.size()];
        for (int i = 0; i < step.length; i++) {
            Double v = vector.feature(features.get(i));
            step[i] = v == null ? 0f : v.floatValue();
        }
        ArrayDeque<float[]> sequence = sequences.computeIfAbsent(vector.getSensorId(), k -> new ArrayDeque<>());
        if (sequence.size() >= length) sequence.pollFirst();
        sequence.addLast(step);
        if (sequence.size() < length) {
            return ScoreOutcome.warmingUp();
        }
        float[][] input = new float[length][];
        Iterator<float[]> it = sequence.iterator();
        for (int i = 0; i < length; i++) {
            input[i] = it.next();
        }
        float[][] output = model.reconstruct(input);
        double sum = 0;
        int count = 0;
        for (int i = 0; i < length; i++) {
            for (int j = 0; j < step.length; j++) {
                double d = input[i][j] - output[i][j];
                sum += d * d;
                count++;
            }
        }
        double error = sum / count;
        return ScoreOutcome.scored(error, 1.0 / (1.0 + error / errorThreshold), error >= errorThreshold);
    }

    @Override
    public void forget(String sensorId) {
        sequences.remove(sensorId);
    }
}
