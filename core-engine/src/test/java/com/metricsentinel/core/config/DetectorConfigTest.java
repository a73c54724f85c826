package com.metricsentinel.core.config;

import com.metricsentinel.core.model.MetricCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectorConfig} and {@link ThresholdRule}.
 */
class DetectorConfigTest {

    @Test
    @DisplayName("Defaults should be valid")
    void defaultsAreValid() {
        assertThatCode(() -> DetectorConfig.defaults().validate()).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Categories without a multiplier should use the default entry")
    void spikeMultiplierFallsBackToDefault() {
        DetectorConfig config = DetectorConfig.defaults();

        assertThat(config.spikeMultiplier(MetricCategory.LATENCY)).isEqualTo(2.0);
        assertThat(config.spikeMultiplier(MetricCategory.ERROR_RATE)).isEqualTo(2.0);
        assertThat(config.spikeMultiplier(MetricCategory.RESOURCE)).isEqualTo(2.5);
        assertThat(config.spikeMultiplier(MetricCategory.THROUGHPUT)).isEqualTo(3.0);
        assertThat(config.spikeMultiplier(MetricCategory.AVAILABILITY)).isEqualTo(3.0);
        assertThat(config.spikeMultiplier(MetricCategory.DEFAULT)).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Should require a default spike multiplier")
    void shouldRequireDefaultMultiplier() {
        DetectorConfig config = new DetectorConfig();
        config.setSpikeMultipliers(Map.of("latency", 2.0));

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("'default'");
    }

    @Test
    @DisplayName("Should reject unknown category keys")
    void shouldRejectUnknownCategory() {
        DetectorConfig config = new DetectorConfig();
        config.setCategoryPatterns(Map.of("saturation", List.of("queue")));

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("unknown category 'saturation'");
    }

    @Test
    @DisplayName("Should reject out-of-range scalar settings")
    void shouldRejectBadScalars() {
        DetectorConfig config = new DetectorConfig();
        config.setTrendSignificanceCutoff(0);
        config.setMinSeriesPoints(2);
        config.setMinTrendPoints(1);

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("trendSignificanceCutoff")
                .hasMessageContaining("minSeriesPoints")
                .hasMessageContaining("minTrendPoints");
    }

    @Test
    @DisplayName("Threshold rule should match only when every pattern occurs")
    void thresholdRuleRequiresAllPatterns() {
        ThresholdRule rule = new ThresholdRule("cpu", List.of("CPU", "percent"), 70, 85, 95);

        assertThat(rule.matches("node_cpu_usage_percent")).isTrue();
        assertThat(rule.matches("NODE_CPU_USAGE_PERCENT")).isTrue();
        assertThat(rule.matches("node_cpu_seconds_total")).isFalse();
    }

    @Test
    @DisplayName("Threshold rule should require ordered positive levels")
    void thresholdRuleValidation() {
        ThresholdRule rule = new ThresholdRule("bad", List.of("x"), 0, 10, 5);

        assertThatThrownBy(rule::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("'medium' > 0")
                .hasMessageContaining("medium <= high <= critical");
    }
}
