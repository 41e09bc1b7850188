package com.sandy.aiot.vision.pipeline.service.scoring;

import com.sandy.aiot.vision.pipeline.model.DiagnosticEvent;
import com.sandy.aiot.vision.pipeline.model.DiagnosticType;
import com.sandy.aiot.vision.pipeline.model.FeatureVector;
import com.sandy.aiot.vision.pipeline.model.PredictionResult;
import com.sandy.aiot.vision.pipeline.service.PipelineCounters;
import com.sandy.aiot.vision.pipeline.service.dispatch.PipelineEventPublisher;
import com.sandy.aiot.vision.pipeline.service.registry.SensorRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Scores feature vectors with the scorer bound to the equipment type and never lets a scorer
 * failure stop the pipeline.
 * <p>
 * When the binding is missing, its model is not loaded, or the scorer throws, the sensor's last
 * known good prediction is re-issued with {@code stale = true}. An unavailability episode belongs to
 * the equipment type: it reports {@link DiagnosticType#SCORER_UNAVAILABLE} once when scoring for the
 * type first degrades and {@link DiagnosticType#SCORER_RECOVERED} when the type scores again, whatever
 * binding it is served by at that point.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScoringService {

    private final ModelRegistry modelRegistry;
    private final SensorRegistry sensorRegistry;
    private final ConfidenceDriftMonitor driftMonitor;
    private final PipelineCounters counters;
    private final PipelineEventPublisher publisher;
    private final Clock clock;

    private final Map<String, PredictionResult> lastKnownGood = new ConcurrentHashMap<>();
    /** Equipment type of each open episode, mapped to the binding key that failed. */
    private final Map<String, String> unavailable = new ConcurrentHashMap<>();

    public Optional<PredictionResult> score(FeatureVector vector) {
        String equipmentType = sensorRegistry.equipmentTypeOf(vector.getEquipmentId()).orElse(null);
        String episodeKey = String.valueOf(equipmentType);
        Optional<ScorerBinding> binding = modelRegistry.resolveBinding(equipmentType);
        if (binding.isEmpty()) {
            return degraded(vector, episodeKey, "unbound:" + equipmentType, null,
                    "no scorer bound for equipment type " + equipmentType);
        }
        String bindingKey = binding.get().getType() + ":" + binding.get().getModelId();
        Optional<AnomalyScorer> scorer = modelRegistry.scorerFor(binding.get());
        if (scorer.isEmpty()) {
            return degraded(vector, episodeKey, bindingKey, binding.get().getModelId(), "model not loaded");
        }
        ScoreOutcome outcome;
        try {
            outcome = scorer.get().score(vector);
        } catch (RuntimeException e) {
            log.warn("Scorer failed modelId={} sensorId={} err={}", binding.get().getModelId(), vector.getSensorId(),
                    e.getMessage());
            return degraded(vector, episodeKey, bindingKey, binding.get().getModelId(),
                    "scorer failed: " + e.getMessage());
        }
        recovered(episodeKey, bindingKey, binding.get().getModelId());
        if (!outcome.isScored()) {
            counters.increment(PipelineCounters.Counter.PREDICTIONS_SKIPPED_WARMUP);
            return Optional.empty();
        }
        ScoreDomain domain = scorer.get().domain();
        if (!domain.contains(outcome.getScore()) || !Double.isFinite(outcome.getConfidence())
                || outcome.getConfidence() < 0 || outcome.getConfidence() > 1) {
            invariantViolation(vector, binding.get().getModelId(), outcome, domain);
            return Optional.empty();
        }
        PredictionResult result = PredictionResult.builder()
                .modelId(binding.get().getModelId())
                .equipmentId(vector.getEquipmentId())
                .sensorId(vector.getSensorId())
                .score(outcome.getScore())
                .confidence(outcome.getConfidence())
                .anomaly(outcome.isAnomaly())
                .stale(false)
                .timestamp(vector.getWindowEndTime())
                .inputFeatureSnapshot(vector.getFeatures())
                .build();
        lastKnownGood.put(vector.getSensorId(), result);
        driftMonitor.observe(result.getModelId(), result.getConfidence(), clock.instant());
        counters.increment(PipelineCounters.Counter.PREDICTIONS);
        return Optional.of(result);
    }

    public boolean isUnavailable(String bindingKey) {
        return unavailable.containsValue(bindingKey);
    }

    public Set<String> unavailableBindings() {
        return new TreeSet<>(unavailable.values());
    }

    /** Forgets the last known good prediction and scorer history of a removed sensor. */
    public void forget(String sensorId) {
        lastKnownGood.remove(sensorId);
    }

    private Optional<PredictionResult> degraded(FeatureVector vector, String episodeKey, String bindingKey,
                                                String modelId, String cause) {
        if (unavailable.put(episodeKey, bindingKey) == null) {
            log.warn("Scorer unavailable equipmentType={} binding={} cause={}", episodeKey, bindingKey, cause);
            publisher.diagnostic(DiagnosticEvent.builder()
                    .type(DiagnosticType.SCORER_UNAVAILABLE)
                    .sensorId(vector.getSensorId())
                    .equipmentId(vector.getEquipmentId())
                    .modelId(modelId)
                    .message(cause)
                    .detail("binding", bindingKey)
                    .detail("equipmentType", episodeKey)
                    .at(clock.instant())
                    .build());
        }
        PredictionResult last = lastKnownGood.get(vector.getSensorId());
        if (last == null) {
            counters.increment(PipelineCounters.Counter.PREDICTIONS_SKIPPED_NO_BASELINE);
            log.debug("Degraded prediction skipped, no last known good sensorId={}", vector.getSensorId());
            return Optional.empty();
        }
        counters.increment(PipelineCounters.Counter.PREDICTIONS_DEGRADED);
        return Optional.of(last.toBuilder()
                .stale(true)
                .timestamp(vector.getWindowEndTime())
                .inputFeatureSnapshot(vector.getFeatures())
                .build());
    }

    private void recovered(String episodeKey, String bindingKey, String modelId) {
        String failed = unavailable.remove(episodeKey);
        if (failed != null) {
            log.info("Scorer recovered equipmentType={} failed={} now={}", episodeKey, failed, bindingKey);
            publisher.diagnostic(DiagnosticEvent.builder()
                    .type(DiagnosticType.SCORER_RECOVERED)
                    .modelId(modelId)
                    .message("scorer available again")
                    .detail("binding", bindingKey)
                    .detail("equipmentType", episodeKey)
                    .at(clock.instant())
                    .build());
        }
    }

    private void invariantViolation(FeatureVector vector, String modelId, ScoreOutcome outcome, ScoreDomain domain) {
        counters.increment(PipelineCounters.Counter.INVARIANT_VIOLATIONS);
        log.error("Prediction dropped, out of domain modelId={} sensorId={} score={} confidence={} domain={} window={}",
                modelId, vector.getSensorId(), outcome.getScore(), outcome.getConfidence(), domain,
                vector.getWindowEndTime());
        publisher.diagnostic(DiagnosticEvent.builder()
                .type(DiagnosticType.INVARIANT_VIOLATION)
                .sensorId(vector.getSensorId())
                .equipmentId(vector.getEquipmentId())
                .modelId(modelId)
                .message("score or confidence outside the declared domain")
                .detail("score", outcome.getScore())
                .detail("confidence", outcome.getConfidence())
                .detail("domainMin", domain.min())
                .detail("domainMax", domain.max())
                .at(clock.instant())
                .build());
    }
}
