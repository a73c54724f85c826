package com.metricsentinel.core.detection;

import com.metricsentinel.core.config.DetectorConfig;
import com.metricsentinel.core.model.Anomaly;
import com.metricsentinel.core.model.Baseline;
import com.metricsentinel.core.model.DetectionMethod;
import com.metricsentinel.core.model.Evidence;
import com.metricsentinel.core.model.EvidenceType;
import com.metricsentinel.core.model.MetricCategory;
import com.metricsentinel.core.model.MetricDataPoint;
import com.metricsentinel.core.model.MetricSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Spike detector.
 *
 * <p>
 * Fires when the most recent value exceeds {@code mean + k × σ} of the
 * baseline, where {@code k} is the category's spike multiplier. Latency and
 * error-rate metrics are the most sensitive, resource metrics less so, and
 * everything else uses the {@code default} multiplier.
 * </p>
 *
 * <h3>Scoring</h3>
 * <ul>
 * <li>deviation: {@code (current - mean) / mean}</li>
 * <li>confidence: {@code deviation × 0.5}, clamped to [0.6, 0.95]</li>
 * <li>severity: see {@link SeverityClassifier#spikeSeverity}</li>
 * </ul>
 *
 * <p>
 * Series whose baseline mean is zero or not finite are skipped.
 * </p>
 *
 * @since 1.0.0
 */
public class SpikeDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(SpikeDetector.class);

    static final double CONFIDENCE_FACTOR = 0.5;
    static final double MIN_CONFIDENCE = 0.6;
    static final double MAX_CONFIDENCE = 0.95;

    private final Map<MetricCategory, Double> multipliers = new EnumMap<>(MetricCategory.class);

    /**
     * @param config detector configuration; must not be {@code null}
     */
    public SpikeDetector(DetectorConfig config) {
        Objects.requireNonNull(config, "DetectorConfig must not be null");
        for (MetricCategory category : MetricCategory.values()) {
            multipliers.put(category, config.spikeMultiplier(category));
        }
    }

    @Override
    public Optional<Anomaly> detect(MetricSeries series, Baseline baseline, MetricCategory category) {
        Objects.requireNonNull(series, "MetricSeries must not be null");
        Objects.requireNonNull(baseline, "Baseline must not be null");

        double mean = baseline.getMean();
        if (mean == 0 || !Double.isFinite(mean) || !Double.isFinite(baseline.getStdDev())) {
            LOG.trace("Spike check skipped for '{}': baseline mean={} stdDev={}",
                    series.getName(), mean, baseline.getStdDev());
            return Optional.empty();
        }

        MetricDataPoint latest = series.latest();
        double current = latest.getValue();
        double multiplier = multipliers.get(category);
        double threshold = mean + baseline.getStdDev() * multiplier;

        if (!(current > threshold)) {
            return Optional.empty();
        }

        double deviation = (current - mean) / mean;
        double confidence = SeverityClassifier.clamp(
                deviation * CONFIDENCE_FACTOR, MIN_CONFIDENCE, MAX_CONFIDENCE);

        LOG.debug("Spike on '{}': current={} threshold={} (mean={} stdDev={} k={})",
                series.getName(), current, threshold, mean, baseline.getStdDev(), multiplier);

        return Optional.of(Anomaly.builder()
                .id(AnomalyIds.of(DetectionMethod.SPIKE, series))
                .type(category.pointAnomalyType())
                .severity(SeverityClassifier.spikeSeverity(deviation, category))
                .method(DetectionMethod.SPIKE)
                .metric(series.getName())
                .startTime(latest.getTimestamp())
                .current(current)
                .baseline(mean)
                .deviation(deviation)
                .confidence(confidence)
                .description(String.format(Locale.ROOT,
                        "%s spiked to %.2f (%.1f%% above baseline)",
                        series.getName(), current, deviation * 100))
                .evidence(new Evidence(
                        EvidenceType.METRIC_SPIKE,
                        String.format(Locale.ROOT, "Current value: %.2f, Baseline: %.2f (±%.2f)",
                                current, mean, baseline.getStdDev()),
                        series.getMetadata().getSource().name(),
                        latest.getTimestamp(),
                        1.0))
                .build());
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.SPIKE;
    }
}
