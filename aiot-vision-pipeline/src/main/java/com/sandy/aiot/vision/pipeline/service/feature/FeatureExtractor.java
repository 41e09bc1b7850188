package com.sandy.aiot.vision.pipeline.service.feature;

import com.sandy.aiot.vision.pipeline.config.PipelineProperties;
import com.sandy.aiot.vision.pipeline.model.FeatureVector;
import com.sandy.aiot.vision.pipeline.model.Reading;
import com.sandy.aiot.vision.pipeline.model.Window;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a closed window into a {@link FeatureVector}.
 * <p>
 * Pure: no state is kept between calls and the same window always yields the same vector,
 * bit for bit. Moments are accumulated in a single pass (Welford, extended by Terriberry to
 * third and fourth order); variance is the population variance. When the standard deviation
 * is zero, skewness and excess kurtosis are reported as 0.0.
 * <p>
 * The spectral summary is only added when the window has at least
 * {@code spectral-min-readings} readings and its sampling intervals vary by no more than
 * {@code sampling-jitter-tolerance} (coefficient of variation).
 */
@Component
public class FeatureExtractor {

    private final List<Double> percentiles;
    private final boolean spectralEnabled;
    private final int spectralMinReadings;
    private final double jitterTolerance;
    private final int defaultMinReadings;

    public FeatureExtractor(PipelineProperties properties) {
        PipelineProperties.Features f = properties.getFeatures();
        for (Double p : f.getPercentiles()) {
            if (p == null || p < 0 || p > 100) throw new IllegalArgumentException("percentile out of [0,100]: " + p);
        }
        this.percentiles = List.copyOf(f.getPercentiles());
        this.spectralEnabled = f.isSpectralEnabled();
        this.spectralMinReadings = Math.max(4, f.getSpectralMinReadings());
        this.jitterTolerance = f.getSamplingJitterTolerance();
        this.defaultMinReadings = properties.getWindow().getMinReadings();
    }

    public ExtractionResult extract(Window window) {
        return extract(window, defaultMinReadings);
    }

    public ExtractionResult extract(Window window, int minReadings) {
        List<Reading> readings = window.getReadings();
        int n = readings.size();
        if (n == 0 || n < minReadings) {
            return ExtractionResult.insufficientData(n, minReadings);
        }
        double[] values = new double[n];
        double mean = 0, m2 = 0, m3 = 0, m4 = 0;
        double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY, sumSq = 0;
        for (int i = 0; i < n; i++) {
            double x = readings.get(i).getValue();
            values[i] = x;
            long n1 = i;
            long k = i + 1;
            double delta = x - mean;
            double deltaN = delta / k;
            double deltaN2 = deltaN * deltaN;
            double term1 = delta * deltaN * n1;
            mean += deltaN;
            m4 += term1 * deltaN2 * (k * k - 3 * k + 3) + 6 * deltaN2 * m2 - 4 * deltaN * m3;
            m3 += term1 * deltaN * (k - 2) - 3 * deltaN * m2;
            m2 += term1;
            min = Math.min(min, x);
            max = Math.max(max, x);
            sumSq += x * x;
        }
        double variance = m2 / n;
        double std = Math.sqrt(variance);
        double skewness = 0.0;
        double kurtosis = 0.0;
        if (std > 0 && m2 > 0) {
            skewness = Math.sqrt(n) * m3 / Math.pow(m2, 1.5);
            kurtosis = n * m4 / (m2 * m2) - 3.0;
        }

        Map<String, Double> features = new LinkedHashMap<>();
        features.put(FeatureVector.MEAN, mean);
        features.put(FeatureVector.VARIANCE, variance);
        features.put(FeatureVector.STD, std);
        features.put(FeatureVector.MIN, min);
        features.put(FeatureVector.MAX, max);
        features.put(FeatureVector.RANGE, max - min);
        features.put(FeatureVector.RMS, Math.sqrt(sumSq / n));
        features.put(FeatureVector.SKEWNESS, skewness);
        features.put(FeatureVector.KURTOSIS, kurtosis);

        double[] sorted = values.clone();
        Arrays.sort(sorted);
        for (Double p : percentiles) {
            features.put(FeatureVector.percentileName(p), percentile(sorted, p));
        }
        if (spectralEnabled && n >= spectralMinReadings) {
            double interval = uniformInterval(readings);
            if (interval > 0) {
                spectralSummary(values, mean, 1.0 / interval, features);
            }
        }
        return ExtractionResult.of(FeatureVector.builder()
                .sensorId(window.getSensorId())
                .equipmentId(window.getEquipmentId())
                .windowStart(window.getStart())
                .windowEndTime(window.getEnd())
                .features(Collections.unmodifiableMap(features))
                .sourceReadingCount(n)
                .partial(window.isPartial())
                .build());
    }

    /** Linear interpolation between closest ranks over {@code sorted}. */
    static double percentile(double[] sorted, double p) {
        if (sorted.length == 1) return sorted[0];
        double rank = p / 100.0 * (sorted.length - 1);
        int lo = (int) Math.floor(rank);
        int hi = (int) Math.ceil(rank);
        if (lo == hi) return sorted[lo];
        return sorted[lo] + (rank - lo) * (sorted[hi] - sorted[lo]);
    }

    /**
     * @return mean sampling interval in seconds, or -1 when sampling is too irregular
     */
    private double uniformInterval(List<Reading> readings) {
        int m = readings.size() - 1;
        double[] intervals = new double[m];
        double sum = 0;
        for (int i = 0; i < m; i++) {
            Duration d = Duration.between(readings.get(i).getTimestamp(), readings.get(i + 1).getTimestamp());
            intervals[i] = d.toNanos() / 1e9;
            sum += intervals[i];
        }
        double meanInterval = sum / m;
        if (meanInterval <= 0) return -1;
        double ss = 0;
        for (double v : intervals) {
            ss += (v - meanInterval) * (v - meanInterval);
        }
        double cv = Math.sqrt(ss / m) / meanInterval;
        return cv <= jitterTolerance ? meanInterval : -1;
    }

    private static void spectralSummary(double[] values, double mean, double sampleRate, Map<String, Double> out) {
        int n = values.length;
        int bins = n / 2;
        double bestPower = 0;
        int bestBin = 0;
        double weighted = 0;
        double total = 0;
        for (int k = 1; k <= bins; k++) {
            double re = 0, im = 0;
            for (int t = 0; t < n; t++) {
                double angle = 2 * Math.PI * k * t / n;
                double x = values[t] - mean;
                re += x * Math.cos(angle);
                im -= x * Math.sin(angle);
            }
            double power = re * re + im * im;
            double freq = k * sampleRate / n;
            if (power > bestPower) {
                bestPower = power;
                bestBin = k;
            }
            weighted += freq * power;
            total += power;
        }
        out.put(FeatureVector.DOMINANT_FREQUENCY, bestBin * sampleRate / n);
        out.put(FeatureVector.SPECTRAL_CENTROID, total > 0 ? weighted / total : 0.0);
    }
}
