package com.sandy.aiot.vision.pipeline.service.scoring;

import com.sandy.aiot.vision.pipeline.config.PipelineProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Scorer bindings per equipment type and the scorer instances behind them.
 * <p>
 * Statistical and ensemble scorers are created on first use. Sequence scorers need a loaded
 * {@link SequenceModel}; a binding to a model that failed to load or was never configured
 * resolves to no scorer, which the scoring service treats as unavailable.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ModelRegistry {

    private final PipelineProperties properties;

    private final AtomicReference<Bindings> bindings = new AtomicReference<>(new Bindings(Map.of(), null));
    private final Map<String, SequenceModel> sequenceModels = new ConcurrentHashMap<>();
    private final Map<String, AnomalyScorer> scorers = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        PipelineProperties.Scoring scoring = properties.getScoring();
        replaceBindings(scoring.getBindings(), scoring.getDefaultBinding());
        for (PipelineProperties.ModelLocation location : scoring.getModels()) {
            try {
                registerSequenceModel(new OnnxSequenceModel(location.getId(), location.getPath(),
                        location.getInputName()));
            } catch (Exception e) {
                log.error("Failed to load sequence model modelId={} path={} err={}", location.getId(),
                        location.getPath(), e.getMessage());
            }
        }
    }

    @PreDestroy
    public void close() {
        sequenceModels.values().forEach(SequenceModel::close);
        sequenceModels.clear();
    }

    public Optional<ScorerBinding> resolveBinding(String equipmentType) {
        Bindings current = bindings.get();
        ScorerBinding binding = equipmentType == null ? null : current.byType().get(equipmentType);
        return Optional.ofNullable(binding != null ? binding : current.defaultBinding());
    }

    /** Scorer serving the binding, or empty when its model is not loaded. */
    public Optional<AnomalyScorer> scorerFor(ScorerBinding binding) {
        String key = binding.getType() + ":" + binding.getModelId();
        AnomalyScorer existing = scorers.get(key);
        if (existing != null) return Optional.of(existing);
        AnomalyScorer created = create(binding);
        if (created == null) return Optional.empty();
        AnomalyScorer raced = scorers.putIfAbsent(key, created);
        return Optional.of(raced != null ? raced : created);
    }

    public void bind(String equipmentType, ScorerBinding binding) {
        binding.validate();
        ScorerBinding copy = ScorerBinding.builder().modelId(binding.getModelId()).type(binding.getType()).build();
        bindings.updateAndGet(current -> {
            Map<String, ScorerBinding> map = new LinkedHashMap<>(current.byType());
            map.put(equipmentType, copy);
            return new Bindings(Collections.unmodifiableMap(map), current.defaultBinding());
        });
        log.info("Scorer bound equipmentType={} modelId={} type={}", equipmentType, copy.getModelId(), copy.getType());
    }

    public boolean unbind(String equipmentType) {
        Bindings before = bindings.getAndUpdate(current -> {
            if (!current.byType().containsKey(equipmentType)) return current;
            Map<String, ScorerBinding> map = new LinkedHashMap<>(current.byType());
            map.remove(equipmentType);
            return new Bindings(Collections.unmodifiableMap(map), current.defaultBinding());
        });
        boolean removed = before.byType().containsKey(equipmentType);
        if (removed) log.info("Scorer unbound equipmentType={}", equipmentType);
        return removed;
    }

    public void replaceBindings(Map<String, ScorerBinding> byType, ScorerBinding defaultBinding) {
        Map<String, ScorerBinding> map = new LinkedHashMap<>();
        if (byType != null) {
            byType.forEach((type, b) -> {
                b.validate();
                map.put(type, ScorerBinding.builder().modelId(b.getModelId()).type(b.getType()).build());
            });
        }
        if (defaultBinding != null) defaultBinding.validate();
        bindings.set(new Bindings(Collections.unmodifiableMap(map), defaultBinding));
        log.info("Scorer bindings replaced bindings={} default={}", map.size(),
                defaultBinding == null ? null : defaultBinding.getModelId());
    }

    public Map<String, ScorerBinding> bindings() {
        return bindings.get().byType();
    }

    public Optional<ScorerBinding> defaultBinding() {
        return Optional.ofNullable(bindings.get().defaultBinding());
    }

    public void registerSequenceModel(SequenceModel model) {
        SequenceModel previous = sequenceModels.put(model.id(), model);
        scorers.remove(ScorerType.SEQUENCE + ":" + model.id());
        if (previous != null && previous != model) previous.close();
    }

    public boolean isLoaded(String modelId) {
        return sequenceModels.containsKey(modelId);
    }

    private AnomalyScorer create(ScorerBinding binding) {
        PipelineProperties.Scoring scoring = properties.getScoring();
        switch (binding.getType()) {
            case STATISTICAL:
                return new StatisticalScorer(binding.getModelId(), scoring.getStatistical());
            case ENSEMBLE:
                return new EnsembleScorer(binding.getModelId(), scoring.getEnsemble());
            case SEQUENCE:
                SequenceModel model = sequenceModels.get(binding.getModelId());
                return model == null ? null : new SequenceScorer(model, scoring.getSequence());
            default:
                throw new IllegalStateException("Unexpected value: " + binding.getType());
        }
    }

    private record Bindings(Map<String, ScorerBinding> byType, ScorerBinding defaultBinding) {
    }
}
