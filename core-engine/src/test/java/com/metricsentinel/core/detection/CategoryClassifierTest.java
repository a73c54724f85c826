package com.metricsentinel.core.detection;

import com.metricsentinel.core.config.DetectorConfig;
import com.metricsentinel.core.model.AnomalyType;
import com.metricsentinel.core.model.MetricCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CategoryClassifier}.
 */
class CategoryClassifierTest {

    private final CategoryClassifier classifier = new CategoryClassifier(DetectorConfig.defaults());

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "http_request_duration_p95, LATENCY",
            "API_LATENCY_MS,            LATENCY",
            "checkout_response_time,    LATENCY",
            "http_5xx_total,            ERROR_RATE",
            "error_rate,                ERROR_RATE",
            "unhandled_exception_count, ERROR_RATE",
            "http_requests_per_second,  THROUGHPUT",
            "ingest_qps,                THROUGHPUT",
            "cpu_usage_percent,         RESOURCE",
            "disk_free_bytes,           RESOURCE",
            "service_uptime,            AVAILABILITY",
            "queue_depth,               DEFAULT"
    })
    @DisplayName("Should classify by the first matching substring")
    void shouldClassify(String name, MetricCategory expected) {
        assertThat(classifier.classify(name)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Table order should decide between overlapping patterns")
    void tableOrderWins() {
        Map<String, List<String>> patterns = new LinkedHashMap<>();
        patterns.put("throughput", List.of("rate"));
        patterns.put("error-rate", List.of("error"));
        DetectorConfig config = new DetectorConfig();
        config.setCategoryPatterns(patterns);

        assertThat(new CategoryClassifier(config).classify("error_rate")).isEqualTo(MetricCategory.THROUGHPUT);
    }

    @Test
    @DisplayName("Should reject unknown category keys")
    void shouldRejectUnknownKey() {
        DetectorConfig config = new DetectorConfig();
        config.setCategoryPatterns(Map.of("saturation", List.of("queue")));

        assertThatThrownBy(() -> new CategoryClassifier(config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("saturation");
    }

    @Test
    @DisplayName("Point anomaly type should fall back to LATENCY_SPIKE")
    void pointAnomalyTypes() {
        assertThat(MetricCategory.LATENCY.pointAnomalyType()).isEqualTo(AnomalyType.LATENCY_SPIKE);
        assertThat(MetricCategory.ERROR_RATE.pointAnomalyType()).isEqualTo(AnomalyType.ERROR_RATE_INCREASE);
        assertThat(MetricCategory.RESOURCE.pointAnomalyType()).isEqualTo(AnomalyType.RESOURCE_SATURATION);
        assertThat(MetricCategory.AVAILABILITY.pointAnomalyType()).isEqualTo(AnomalyType.AVAILABILITY_DEGRADATION);
        assertThat(MetricCategory.THROUGHPUT.pointAnomalyType()).isEqualTo(AnomalyType.LATENCY_SPIKE);
        assertThat(MetricCategory.DEFAULT.pointAnomalyType()).isEqualTo(AnomalyType.LATENCY_SPIKE);
    }
}
