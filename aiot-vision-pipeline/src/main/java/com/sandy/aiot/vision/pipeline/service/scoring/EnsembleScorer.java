package com.sandy.aiot.vision.pipeline.service.scoring;

import com.sandy.aiot.vision.pipeline.config.PipelineProperties;
import com.sandy.aiot.vision.pipeline.model.FeatureVector;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Isolation-forest scorer. Each sensor gets its own forest, trained on a rolling history of its
 * feature vectors and retrained every {@code retrain-every} windows. Seeding depends only on the
 * configured seed, the sensor id and the training round, so runs are reproducible.
 */
@Slf4j
public class EnsembleScorer implements AnomalyScorer {

    private final String modelId;
    private final PipelineProperties.Ensemble config;
    private final List<String> features;
    private final Map<String, SensorModel> models = new ConcurrentHashMap<>();

    public EnsembleScorer(String modelId, PipelineProperties.Ensemble config) {
        if (config.getFeatures() == null || config.getFeatures().isEmpty()) {
            throw new IllegalArgumentException("ensemble scorer " + modelId + " needs at least one feature");
        }
        this.modelId = modelId;
        this.config = config;
        this.features = List.copyOf(config.getFeatures());
    }

    @Override
    public String modelId() {
        return modelId;
    }

    @Override
    public ScorerType type() {
        return ScorerType.ENSEMBLE;
    }

    @Override
    public ScoreDomain domain() {
        return ScoreDomain.UNIT;
    }

    @Override
    public ScoreOutcome score(FeatureVector vector) {
        double[] point = new double[features.size()];
        for (int i = 0; i < point.length; i++) {
            Double v = vector.feature(features.get(i));
            point[i] = v == null ? 0.0 : v;
        }
        SensorModel model = models.computeIfAbsent(vector.getSensorId(), k -> new SensorModel());
        if (model.history.size() < Math.max(2, config.getMinTraining())) {
            model.add(point, config.getHistorySize());
            return ScoreOutcome.warmingUp();
        }
        if (model.forest == null || model.sinceTraining >= config.getRetrainEvery()) {
            long seed = config.getSeed() * 31 + vector.getSensorId().hashCode() * 17L + model.rounds;
            model.forest = IsolationForest.train(new ArrayList<>(model.history), config.getTrees(),
                    config.getSampleSize(), new Random(seed));
            model.rounds++;
            model.sinceTraining = 0;
            log.debug("Isolation forest trained modelId={} sensorId={} history={} round={}", modelId,
                    vector.getSensorId(), model.history.size(), model.rounds);
        }
        double score = model.forest.score(point);
        double confidence = Math.min(1.0, (double) model.history.size() / Math.max(1, config.getHistorySize()));
        model.add(point, config.getHistorySize());
        model.sinceTraining++;
        return ScoreOutcome.scored(score, confidence, score >= config.getAnomalyThreshold());
    }

    @Override
    public void forget(String sensorId) {
        models.remove(sensorId);
    }

    private static final class SensorModel {
        private final ArrayDeque<double[]> history = new ArrayDeque<>();
        private IsolationForest forest;
        private int sinceTraining;
        private int rounds;

        void add(double[] point, int capacity) {
            if (history.size() >= Math.max(1, capacity)) history.pollFirst();
            history.addLast(point);
        }
    }
}
