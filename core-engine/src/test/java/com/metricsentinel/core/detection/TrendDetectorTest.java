package com.metricsentinel.core.detection;

import com.metricsentinel.core.config.DetectorConfig;
import com.metricsentinel.core.model.Anomaly;
import com.metricsentinel.core.model.AnomalyType;
import com.metricsentinel.core.model.DetectionMethod;
import com.metricsentinel.core.model.EvidenceType;
import com.metricsentinel.core.model.MetricSeries;
import com.metricsentinel.core.model.SeverityLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static com.metricsentinel.core.testutil.SeriesFixtures.T0;
import static com.metricsentinel.core.testutil.SeriesFixtures.series;
import static com.metricsentinel.core.testutil.SeriesFixtures.timestampOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link TrendDetector}.
 */
class TrendDetectorTest {

    private final DetectorConfig config = DetectorConfig.defaults();

    @Test
    @DisplayName("Rising latency should be reported as a LOW latency trend")
    void risingLatency() {
        // slope 20 over an average of 140
        Anomaly a = detect(config, series("api_latency", 100, 120, 140, 160, 180)).orElseThrow();

        assertThat(a.getMethod()).isEqualTo(DetectionMethod.TREND);
        assertThat(a.getType()).isEqualTo(AnomalyType.LATENCY_SPIKE);
        assertThat(a.getSeverity()).isEqualTo(SeverityLevel.LOW);
        assertThat(a.getDeviation()).isCloseTo(20.0 / 140.0, within(1e-9));
        assertThat(a.getConfidence()).isCloseTo(40.0 / 140.0, within(1e-9));
        assertThat(a.getStartTime()).isEqualTo(T0);
        assertThat(a.getEndTime()).isEqualTo(timestampOf(4));
        assertThat(a.getCurrent()).isEqualTo(180.0);
        assertThat(a.getBaseline()).isEqualTo(100.0);
        assertThat(a.getDescription()).isEqualTo("api_latency shows increasing trend (14.3% change)");
        assertThat(a.getEvidence()).singleElement().satisfies(e -> {
            assertThat(e.getType()).isEqualTo(EvidenceType.PATTERN_MATCH);
            assertThat(e.getContent()).isEqualTo("Trend analysis: slope=20.0000, relative change=14.3%");
            assertThat(e.getTimestamp()).isNull();
            assertThat(e.getRelevance()).isEqualTo(0.8);
        });
    }

    @Test
    @DisplayName("Rising non-latency metric should be an ERROR_RATE_INCREASE")
    void risingOther() {
        Anomaly a = detect(config, series("queue_depth", 10, 20, 30, 40, 50)).orElseThrow();

        assertThat(a.getType()).isEqualTo(AnomalyType.ERROR_RATE_INCREASE);
        assertThat(a.getSeverity()).isEqualTo(SeverityLevel.HIGH);
        assertThat(a.getConfidence()).isCloseTo(2.0 / 3.0, within(1e-9));
    }

    @Test
    @DisplayName("Falling series should be a THROUGHPUT_DROP")
    void falling() {
        Anomaly a = detect(config, series("http_requests_total", 50, 40, 30, 20, 10)).orElseThrow();

        assertThat(a.getType()).isEqualTo(AnomalyType.THROUGHPUT_DROP);
        assertThat(a.getDescription()).contains("decreasing trend");
    }

    @Test
    @DisplayName("Relative slope between 0.2 and 0.3 should be MEDIUM")
    void medium() {
        Anomaly a = detect(config, series("api_latency", 100, 140, 180, 220, 260)).orElseThrow();

        assertThat(a.getSeverity()).isEqualTo(SeverityLevel.MEDIUM);
    }

    @Test
    @DisplayName("Confidence should be capped at 0.8")
    void confidenceCap() {
        Anomaly a = detect(config, series("queue_depth", 0, 0, 0, 0, 100)).orElseThrow();

        assertThat(a.getDeviation()).isCloseTo(1.0, within(1e-9));
        assertThat(a.getConfidence()).isEqualTo(0.8);
    }

    @Test
    @DisplayName("Should produce nothing for flat, short, non-positive or insignificant series")
    void noTrend() {
        assertThat(detect(config, series("queue_depth", 7, 7, 7, 7, 7))).isEmpty();
        assertThat(detect(config, series("queue_depth", 10, 20, 30, 40))).isEmpty();
        assertThat(detect(config, series("queue_depth", -10, -20, -30, -40, -50))).isEmpty();

        DetectorConfig strict = new DetectorConfig();
        strict.setTrendSignificanceCutoff(0.5);
        assertThat(detect(strict, series("queue_depth", 10, 20, 30, 40, 50))).isEmpty();
    }

    @Test
    @DisplayName("Should produce nothing when the window contains a non-numeric value")
    void nanInWindow() {
        assertThat(detect(config, series("queue_depth", 10, 20, Double.NaN, 40, 50))).isEmpty();
    }

    private Optional<Anomaly> detect(DetectorConfig cfg, MetricSeries s) {
        return new TrendDetector(cfg).detect(s,
                BaselineCalculator.calculate(s).orElseThrow(),
                new CategoryClassifier(cfg).classify(s.getName()));
    }
}
