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

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Linear trend detector.
 *
 * <p>
 * Fits an ordinary least-squares line through the whole window, using the
 * point index {@code 0..n-1} as x, and normalizes the slope by the average
 * value. A relative slope below {@code trendSignificanceCutoff} is not
 * reported. Unlike the point detectors, the anomaly spans the window from the
 * first to the last timestamp.
 * </p>
 *
 * <h3>Classification</h3>
 * <ul>
 * <li>increasing latency metric: {@link AnomalyType#LATENCY_SPIKE}</li>
 * <li>increasing anything else: {@link AnomalyType#ERROR_RATE_INCREASE}</li>
 * <li>decreasing: {@link AnomalyType#THROUGHPUT_DROP}</li>
 * </ul>
 *
 * <p>
 * Sustained drift tops out at {@code HIGH}; only point detectors report
 * {@code CRITICAL}.
 * </p>
 *
 * @since 1.0.0
 */
public class TrendDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(TrendDetector.class);

    static final double MAX_CONFIDENCE = 0.8;
    static final double EVIDENCE_RELEVANCE = 0.8;

    private final int minPoints;
    private final double significanceCutoff;

    /**
     * @param config detector configuration; must not be {@code null}
     */
    public TrendDetector(DetectorConfig config) {
        Objects.requireNonNull(config, "DetectorConfig must not be null");
        this.minPoints = config.getMinTrendPoints();
        this.significanceCutoff = config.getTrendSignificanceCutoff();
    }

    @Override
    public Optional<Anomaly> detect(MetricSeries series, Baseline baseline, MetricCategory category) {
        Objects.requireNonNull(series, "MetricSeries must not be null");

        List<MetricDataPoint> points = series.getDataPoints();
        int n = points.size();
        if (n < minPoints) {
            LOG.trace("Trend check skipped for '{}': {} point(s) < {}", series.getName(), n, minPoints);
            return Optional.empty();
        }

        double sumX = 0;
        double sumY = 0;
        double sumXY = 0;
        double sumXX = 0;
        for (int i = 0; i < n; i++) {
            double y = points.get(i).getValue();
            sumX += i;
            sumY += y;
            sumXY += i * y;
            sumXX += (double) i * i;
        }
        double slope = (n * sumXY - sumX * sumY) / (n * sumXX - sumX * sumX);

        double avgValue = sumY / n;
        if (!(avgValue > 0)) {
            LOG.trace("Trend check skipped for '{}': average value {} is not positive",
                    series.getName(), avgValue);
            return Optional.empty();
        }
        double relativeSlope = Math.abs(slope) / avgValue;
        if (!(relativeSlope >= significanceCutoff)) {
            return Optional.empty();
        }

        boolean increasing = slope > 0;
        AnomalyType type;
        if (!increasing) {
            type = AnomalyType.THROUGHPUT_DROP;
        } else if (category == MetricCategory.LATENCY) {
            type = AnomalyType.LATENCY_SPIKE;
        } else {
            type = AnomalyType.ERROR_RATE_INCREASE;
        }

        MetricDataPoint first = points.get(0);
        MetricDataPoint last = points.get(n - 1);

        LOG.debug("Trend on '{}': slope={} relativeSlope={} over {} point(s)",
                series.getName(), slope, relativeSlope, n);

        return Optional.of(Anomaly.builder()
                .id(AnomalyIds.of(DetectionMethod.TREND, series))
                .type(type)
                .severity(SeverityClassifier.trendSeverity(relativeSlope))
                .method(DetectionMethod.TREND)
                .metric(series.getName())
                .startTime(first.getTimestamp())
                .endTime(last.getTimestamp())
                .current(last.getValue())
                .baseline(first.getValue())
                .deviation(relativeSlope)
                .confidence(Math.min(MAX_CONFIDENCE, relativeSlope * 2))
                .description(String.format(Locale.ROOT,
                        "%s shows %s trend (%.1f%% change)",
                        series.getName(), increasing ? "increasing" : "decreasing", relativeSlope * 100))
                .evidence(new Evidence(
                        EvidenceType.PATTERN_MATCH,
                        String.format(Locale.ROOT, "Trend analysis: slope=%.4f, relative change=%.1f%%",
                                slope, relativeSlope * 100),
                        series.getMetadata().getSource().name(),
                        null,
                        EVIDENCE_RELEVANCE))
                .build());
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.TREND;
    }
}
