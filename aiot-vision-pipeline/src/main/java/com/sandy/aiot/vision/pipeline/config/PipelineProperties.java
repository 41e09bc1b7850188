package com.sandy.aiot.vision.pipeline.config;

import com.sandy.aiot.vision.pipeline.model.AlertRule;
import com.sandy.aiot.vision.pipeline.model.EquipmentDefinition;
import com.sandy.aiot.vision.pipeline.model.OverflowPolicy;
import com.sandy.aiot.vision.pipeline.model.SensorDefinition;
import com.sandy.aiot.vision.pipeline.model.WindowMode;
import com.sandy.aiot.vision.pipeline.service.scoring.ScorerBinding;
import com.sandy.aiot.vision.pipeline.service.scoring.ScorerType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Startup configuration of the pipeline, bound from the {@code pipeline.*} namespace.
 * Sensors, equipment, rules and scorer bindings can later be replaced at runtime,
 * the remaining knobs are fixed for the life of the process.
 */
@Data
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    /** Number of partition workers draining the ingestion buffers. */
    private int workers = Math.max(2, Runtime.getRuntime().availableProcessors());

    private Ingest ingest = new Ingest();
    private Window window = new Window();
    private Features features = new Features();
    private Scoring scoring = new Scoring();
    private Alerts alerts = new Alerts();
    private Dispatch dispatch = new Dispatch();
    private Reload reload = new Reload();

    private List<EquipmentDefinition> equipment = new ArrayList<>();
    private List<SensorDefinition> sensors = new ArrayList<>();
    private List<AlertRule> rules = new ArrayList<>();

    @Data
    public static class Ingest {
        private int bufferCapacity = 1000;
        private OverflowPolicy overflowPolicy = OverflowPolicy.REJECT_NEWEST;
        /** Fraction of a lane's capacity above which the lane reports congestion. */
        private double highWaterRatio = 0.8;
        private int maxBatch = 256;
        private Duration idleBackoffMin = Duration.ofMillis(1);
        private Duration idleBackoffMax = Duration.ofMillis(50);
    }

    @Data
    public static class Window {
        private WindowMode mode = WindowMode.COUNT;
        private int size = 60;
        private int stride = 60;
        private Duration duration = Duration.ofSeconds(60);
        private Duration strideDuration = Duration.ofSeconds(60);
        private int minReadings = 10;
        private Duration stalenessTimeout = Duration.ofMinutes(5);
        private Duration reapInterval = Duration.ofSeconds(5);
    }

    @Data
    public static class Features {
        private List<Double> percentiles = new ArrayList<>(List.of(5.0, 25.0, 50.0, 75.0, 95.0));
        private boolean spectralEnabled = true;
        private int spectralMinReadings = 16;
        /** Max coefficient of variation of sampling intervals for the spectral summary. */
        private double samplingJitterTolerance = 0.1;
    }

    @Data
    public static class Scoring {
        /** Binding used for equipment types without an explicit entry; null disables scoring for them. */
        private ScorerBinding defaultBinding = ScorerBinding.builder()
                .modelId("zscore-default")
                .type(ScorerType.STATISTICAL)
                .build();
        private Map<String, ScorerBinding> bindings = new LinkedHashMap<>();
        private List<ModelLocation> models = new ArrayList<>();
        private Statistical statistical = new Statistical();
        private Ensemble ensemble = new Ensemble();
        private Sequence sequence = new Sequence();
        private Drift drift = new Drift();
    }

    @Data
    public static class ModelLocation {
        private String id;
        private String path;
        private String inputName = "input";
    }

    @Data
    public static class Statistical {
        private int baselineSize = 30;
        private int minBaseline = 5;
        /** Absolute z-score at or above which a window is anomalous. */
        private double threshold = 3.0;
    }

    @Data
    public static class Ensemble {
        private int trees = 50;
        private int sampleSize = 64;
        private int historySize = 256;
        private int minTraining = 32;
        private int retrainEvery = 64;
        private double anomalyThreshold = 0.62;
        private long seed = 42L;
        private List<String> features = new ArrayList<>(List.of("mean", "std", "rms", "range", "skewness", "kurtosis"));
    }

    @Data
    public static class Sequence {
        private int length = 8;
        private double errorThreshold = 1.0;
        private List<String> features = new ArrayList<>(List.of("mean", "std", "rms", "range"));
    }

    @Data
    public static class Drift {
        private int window = 50;
        private double confidenceFloor = 0.5;
        private int consecutiveWindows = 20;
    }

    @Data
    public static class Alerts {
        private int resolvedRetention = 500;
        private boolean suppressBroaderScope = false;
        private boolean deriveLimitRules = true;
        private Duration limitRuleDuration = Duration.ZERO;
    }

    @Data
    public static class Dispatch {
        private int outboxCapacity = 10_000;
        private Duration sendTimeout = Duration.ofMillis(200);
        private int channelCapacity = 1_000;
        private Duration retention = Duration.ofMinutes(5);
        private boolean publishReadings = true;
        private boolean storeEnabled = true;
    }

    @Data
    public static class Reload {
        /** Optional JSON file watched for sensors/equipment/rules/bindings changes. */
        private String file;
        private long intervalMs = 10_000L;
    }
}
