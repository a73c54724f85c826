package com.metricsentinel.core.detection;

import com.metricsentinel.core.config.DetectorConfig;
import com.metricsentinel.core.config.ThresholdRule;
import com.metricsentinel.core.model.Anomaly;
import com.metricsentinel.core.model.AnomalyType;
import com.metricsentinel.core.model.DetectionMethod;
import com.metricsentinel.core.model.MetricSeries;
import com.metricsentinel.core.model.SeverityLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.metricsentinel.core.testutil.SeriesFixtures.series;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ThresholdViolationDetector}.
 */
class ThresholdViolationDetectorTest {

    private final DetectorConfig config = DetectorConfig.defaults();

    @Test
    @DisplayName("Should report CRITICAL above the critical level")
    void critical() {
        Anomaly a = detect(config, series("memory_usage_percent", 50, 52, 48, 96)).orElseThrow();

        assertThat(a.getMethod()).isEqualTo(DetectionMethod.THRESHOLD);
        assertThat(a.getSeverity()).isEqualTo(SeverityLevel.CRITICAL);
        assertThat(a.getType()).isEqualTo(AnomalyType.RESOURCE_SATURATION);
        assertThat(a.getBaseline()).isEqualTo(95.0);
        assertThat(a.getDeviation()).isCloseTo(1.0 / 95.0, within(1e-9));
        assertThat(a.getConfidence()).isEqualTo(0.95);
        assertThat(a.getDescription()).isEqualTo("memory_usage_percent exceeded critical threshold (96.00 > 95)");
        assertThat(a.getEvidence()).singleElement()
                .satisfies(e -> assertThat(e.getContent())
                        .isEqualTo("Threshold violation: 96.00 > 95 (critical, rule memory_percent)"));
    }

    @Test
    @DisplayName("Should pick the highest level strictly exceeded")
    void levels() {
        assertThat(detect(config, series("memory_usage_percent", 50, 52, 48, 91)))
                .get().extracting(Anomaly::getSeverity).isEqualTo(SeverityLevel.HIGH);
        assertThat(detect(config, series("memory_usage_percent", 50, 52, 48, 85)))
                .get().extracting(Anomaly::getSeverity).isEqualTo(SeverityLevel.MEDIUM);
        assertThat(detect(config, series("memory_usage_percent", 50, 52, 48, 80))).isEmpty();
    }

    @Test
    @DisplayName("Error-rate thresholds should print fractional levels as-is")
    void fractionalThreshold() {
        Anomaly a = detect(config, series("error_rate", 0.01, 0.01, 0.01, 0.07)).orElseThrow();

        assertThat(a.getSeverity()).isEqualTo(SeverityLevel.HIGH);
        assertThat(a.getType()).isEqualTo(AnomalyType.ERROR_RATE_INCREASE);
        assertThat(a.getDescription()).isEqualTo("error_rate exceeded high threshold (0.07 > 0.05)");
    }

    @Test
    @DisplayName("Latency p95 above 2000 should be CRITICAL")
    void latencyP95() {
        Anomaly a = detect(config, series("api_latency_p95", 300, 320, 310, 2500)).orElseThrow();

        assertThat(a.getSeverity()).isEqualTo(SeverityLevel.CRITICAL);
        assertThat(a.getType()).isEqualTo(AnomalyType.LATENCY_SPIKE);
    }

    @Test
    @DisplayName("Should run even when the baseline mean is zero")
    void zeroMeanBaseline() {
        Anomaly a = detect(config, series("error_rate", 0, 0, 0, 0, 0.2)).orElseThrow();

        assertThat(a.getSeverity()).isEqualTo(SeverityLevel.CRITICAL);
    }

    @Test
    @DisplayName("Should produce nothing for metrics without a matching rule")
    void noRule() {
        assertThat(detect(config, series("queue_depth", 1, 1, 1, 1_000_000))).isEmpty();
    }

    @Test
    @DisplayName("Should use the first matching rule in declaration order")
    void firstRuleWins() {
        DetectorConfig custom = new DetectorConfig();
        custom.setThresholds(List.of(
                new ThresholdRule("strict", List.of("queue"), 10, 20, 30),
                new ThresholdRule("lenient", List.of("queue", "depth"), 100, 200, 300)));

        Anomaly a = detect(custom, series("queue_depth", 5, 5, 5, 25)).orElseThrow();

        assertThat(a.getSeverity()).isEqualTo(SeverityLevel.HIGH);
        assertThat(a.getBaseline()).isEqualTo(20.0);
    }

    private Optional<Anomaly> detect(DetectorConfig cfg, MetricSeries s) {
        return new ThresholdViolationDetector(cfg).detect(s,
                BaselineCalculator.calculate(s).orElseThrow(),
                new CategoryClassifier(cfg).classify(s.getName()));
    }
}
