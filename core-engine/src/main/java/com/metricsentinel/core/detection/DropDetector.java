package com.metricsentinel.core.detection;

import com.metricsentinel.core.config.DetectorConfig;
import com.metricsentinel.core.model.Anomaly;
import com.metricsentinel.core.model.AnomalyType;
import com.metricsentinel.core.model.Baseline;
import com.metricsentinel.core.model.DetectionMethod;
import com.metricsentinel.core.model.Evidence;
import com.metricsentinel.core.model.EvidenceType;
import com.metricsentinel.core.model.MetricCategory;
import com.metricsentinel.core.model.MetricDataPoint;
import com.metricsentinel.core.model.MetricSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Throughput-drop detector.
 *
 * <p>
 * Applies to {@link MetricCategory#THROUGHPUT} metrics only. Fires when the
 * most recent value falls below {@code mean × dropThresholdRatio}. The
 * anomaly type is always {@link AnomalyType#THROUGHPUT_DROP}.
 * </p>
 *
 * @since 1.0.0
 */
public class DropDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(DropDetector.class);

    static final double MIN_CONFIDENCE = 0.7;
    static final double MAX_CONFIDENCE = 0.9;

    private final double dropThresholdRatio;

    /**
     * @param config detector configuration; must not be {@code null}
     */
    public DropDetector(DetectorConfig config) {
        Objects.requireNonNull(config, "DetectorConfig must not be null");
        this.dropThresholdRatio = config.getDropThresholdRatio();
    }

    @Override
    public Optional<Anomaly> detect(MetricSeries series, Baseline baseline, MetricCategory category) {
        Objects.requireNonNull(series, "MetricSeries must not be null");
        Objects.requireNonNull(baseline, "Baseline must not be null");

        if (category != MetricCategory.THROUGHPUT) {
            return Optional.empty();
        }
        double mean = baseline.getMean();
        if (mean == 0 || !Double.isFinite(mean) || !Double.isFinite(baseline.getStdDev())) {
            LOG.trace("Drop check skipped for '{}': baseline mean={} stdDev={}",
                    series.getName(), mean, baseline.getStdDev());
            return Optional.empty();
        }

        MetricDataPoint latest = series.latest();
        double current = latest.getValue();
        double threshold = mean * dropThresholdRatio;

        if (!(current < threshold)) {
            return Optional.empty();
        }

        double deviation = (mean - current) / mean;

        LOG.debug("Drop on '{}': current={} < threshold={} (mean={})",
                series.getName(), current, threshold, mean);

        return Optional.of(Anomaly.builder()
                .id(AnomalyIds.of(DetectionMethod.DROP, series))
                .type(AnomalyType.THROUGHPUT_DROP)
                .severity(SeverityClassifier.dropSeverity(deviation))
                .method(DetectionMethod.DROP)
                .metric(series.getName())
                .startTime(latest.getTimestamp())
                .current(current)
                .baseline(mean)
                .deviation(deviation)
                .confidence(SeverityClassifier.clamp(deviation, MIN_CONFIDENCE, MAX_CONFIDENCE))
                .description(String.format(Locale.ROOT,
                        "%s dropped to %.2f (%.1f%% below baseline)",
                        series.getName(), current, deviation * 100))
                .evidence(new Evidence(
                        EvidenceType.METRIC_SPIKE,
                        String.format(Locale.ROOT, "Current value: %.2f, Baseline: %.2f", current, mean),
                        series.getMetadata().getSource().name(),
                        latest.getTimestamp(),
                        1.0))
                .build());
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.DROP;
    }
}
