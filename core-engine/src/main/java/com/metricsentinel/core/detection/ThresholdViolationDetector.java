package com.metricsentinel.core.detection;

import com.metricsentinel.core.config.DetectorConfig;
import com.metricsentinel.core.config.ThresholdRule;
import com.metricsentinel.core.model.Anomaly;
import com.metricsentinel.core.model.Baseline;
import com.metricsentinel.core.model.DetectionMethod;
import com.metricsentinel.core.model.Evidence;
import com.metricsentinel.core.model.EvidenceType;
import com.metricsentinel.core.model.MetricCategory;
import com.metricsentinel.core.model.MetricDataPoint;
import com.metricsentinel.core.model.MetricSeries;
import com.metricsentinel.core.model.SeverityLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Absolute threshold detector.
 *
 * <p>
 * Looks up the first {@link ThresholdRule} whose patterns all occur in the
 * metric name and compares the most recent value against its critical, high
 * and medium levels, in that order. The highest level strictly exceeded
 * decides the severity. Metrics without a matching rule produce nothing.
 * </p>
 *
 * <p>
 * Confidence is fixed at {@value #CONFIDENCE}. The anomaly's baseline is the
 * violated threshold, not the statistical mean, so this detector also runs
 * for series whose mean is zero.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdViolationDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ThresholdViolationDetector.class);

    static final double CONFIDENCE = 0.95;

    private final List<ThresholdRule> rules;

    /**
     * @param config detector configuration; must not be {@code null}
     */
    public ThresholdViolationDetector(DetectorConfig config) {
        Objects.requireNonNull(config, "DetectorConfig must not be null");
        this.rules = List.copyOf(config.getThresholds());
    }

    @Override
    public Optional<Anomaly> detect(MetricSeries series, Baseline baseline, MetricCategory category) {
        Objects.requireNonNull(series, "MetricSeries must not be null");

        Optional<ThresholdRule> match = rules.stream()
                .filter(rule -> rule.matches(series.getName()))
                .findFirst();
        if (match.isEmpty()) {
            return Optional.empty();
        }
        ThresholdRule rule = match.get();

        MetricDataPoint latest = series.latest();
        double current = latest.getValue();

        SeverityLevel severity;
        String level;
        double threshold;
        if (current > rule.getCritical()) {
            severity = SeverityLevel.CRITICAL;
            level = "critical";
            threshold = rule.getCritical();
        } else if (current > rule.getHigh()) {
            severity = SeverityLevel.HIGH;
            level = "high";
            threshold = rule.getHigh();
        } else if (current > rule.getMedium()) {
            severity = SeverityLevel.MEDIUM;
            level = "medium";
            threshold = rule.getMedium();
        } else {
            return Optional.empty();
        }

        double deviation = (current - threshold) / threshold;

        LOG.debug("Threshold rule [{}] fired on '{}': {} > {} ({})",
                rule.getName(), series.getName(), current, threshold, level);

        return Optional.of(Anomaly.builder()
                .id(AnomalyIds.of(DetectionMethod.THRESHOLD, series))
                .type(category.pointAnomalyType())
                .severity(severity)
                .method(DetectionMethod.THRESHOLD)
                .metric(series.getName())
                .startTime(latest.getTimestamp())
                .current(current)
                .baseline(threshold)
                .deviation(deviation)
                .confidence(CONFIDENCE)
                .description(String.format(Locale.ROOT,
                        "%s exceeded %s threshold (%.2f > %s)",
                        series.getName(), level, current, format(threshold)))
                .evidence(new Evidence(
                        EvidenceType.METRIC_SPIKE,
                        String.format(Locale.ROOT, "Threshold violation: %.2f > %s (%s, rule %s)",
                                current, format(threshold), level, rule.getName()),
                        series.getMetadata().getSource().name(),
                        latest.getTimestamp(),
                        1.0))
                .build());
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.THRESHOLD;
    }

    /** Whole thresholds print without a fraction, e.g. {@code 95} rather than {@code 95.0}. */
    private static String format(double threshold) {
        if (threshold == Math.rint(threshold)) {
            return String.valueOf((long) threshold);
        }
        return String.valueOf(threshold);
    }
}
