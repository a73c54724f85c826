package com.metricsentinel.core.detection;

import com.metricsentinel.core.model.MetricCategory;
import com.metricsentinel.core.model.SeverityLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SeverityClassifier}.
 */
class SeverityClassifierTest {

    @ParameterizedTest(name = "{1} deviation {0} -> {2}")
    @CsvSource({
            "2.01, LATENCY, CRITICAL",
            "2.0, LATENCY, HIGH",
            "1.0, LATENCY, MEDIUM",
            "0.5, LATENCY, LOW",
            "5.5, ERROR_RATE, CRITICAL",
            "5.0, ERROR_RATE, HIGH",
            "1.5, ERROR_RATE, MEDIUM",
            "1.0, ERROR_RATE, LOW",
            "3.5, RESOURCE, CRITICAL",
            "2.5, THROUGHPUT, HIGH",
            "1.1, DEFAULT, MEDIUM",
            "0.35, DEFAULT, LOW"
    })
    @DisplayName("Spike severity buckets should be category specific with exclusive boundaries")
    void spikeSeverity(double deviation, MetricCategory category, SeverityLevel expected) {
        assertThat(SeverityClassifier.spikeSeverity(deviation, category)).isEqualTo(expected);
    }

    @ParameterizedTest(name = "drop {0} -> {1}")
    @CsvSource({
            "0.9, CRITICAL",
            "0.8, HIGH",
            "0.61, HIGH",
            "0.6, MEDIUM",
            "0.4, LOW"
    })
    @DisplayName("Drop severity buckets")
    void dropSeverity(double deviation, SeverityLevel expected) {
        assertThat(SeverityClassifier.dropSeverity(deviation)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Trends should never be CRITICAL")
    void trendSeverity() {
        assertThat(SeverityClassifier.trendSeverity(10.0)).isEqualTo(SeverityLevel.HIGH);
        assertThat(SeverityClassifier.trendSeverity(0.3)).isEqualTo(SeverityLevel.MEDIUM);
        assertThat(SeverityClassifier.trendSeverity(0.2)).isEqualTo(SeverityLevel.LOW);
    }

    @Test
    @DisplayName("Clamp should bound values on both sides")
    void clamp() {
        assertThat(SeverityClassifier.clamp(0.1, 0.6, 0.95)).isEqualTo(0.6);
        assertThat(SeverityClassifier.clamp(0.7, 0.6, 0.95)).isEqualTo(0.7);
        assertThat(SeverityClassifier.clamp(3.0, 0.6, 0.95)).isEqualTo(0.95);
    }
}
