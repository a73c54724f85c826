package com.metricsentinel.job;

import com.metricsentinel.core.model.MetricAggregation;
import com.metricsentinel.core.model.MetricSeries;
import com.metricsentinel.core.model.MetricSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link MetricSeriesReader}.
 */
class MetricSeriesReaderTest {

    private final MetricSeriesReader reader = new MetricSeriesReader();

    @Test
    @DisplayName("Should read series, points, labels and metadata")
    void shouldReadSample() throws IOException {
        List<MetricSeries> series;
        try (InputStream in = resource("sample-metrics.json")) {
            series = reader.read(in, "sample-metrics.json");
        }

        assertThat(series).extracting(MetricSeries::getName)
                .containsExactly("http_request_duration_p95", "memory_usage_percent", "queue_depth");

        MetricSeries latency = series.get(0);
        assertThat(latency.getUnit()).isEqualTo("ms");
        assertThat(latency.size()).isEqualTo(6);
        assertThat(latency.latest().getValue()).isEqualTo(400.0);
        assertThat(latency.latest().getLabels()).containsEntry("host", "web-1");
        assertThat(latency.getDataPoints().get(0).getLabels()).isEmpty();
        assertThat(latency.getMetadata().getAggregation()).isEqualTo(MetricAggregation.P95);

        assertThat(series.get(1).getMetadata().getSource()).isEqualTo(MetricSource.CLOUDWATCH);
        // no metadata block
        assertThat(series.get(2).getMetadata().getSource()).isEqualTo(MetricSource.CUSTOM);
    }

    @Test
    @DisplayName("A document without a series array should yield no series")
    void emptyDocument() {
        assertThat(reader.read(stream("{}"), "test")).isEmpty();
        assertThat(reader.read(stream("{\"series\": []}"), "test")).isEmpty();
    }

    @Test
    @DisplayName("Malformed input should fail the whole batch")
    void malformed() {
        assertThatThrownBy(() -> {
            try (InputStream in = resource("malformed-metrics.json")) {
                reader.read(in, "malformed-metrics.json");
            }
        })
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed metrics input in malformed-metrics.json");

        assertThatThrownBy(() -> reader.read(stream("{\"series\": [ {"), "test"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("A series without a name should be rejected")
    void missingName() {
        assertThatThrownBy(() -> reader.read(stream("{\"series\": [ {\"unit\": \"ms\"} ]}"), "test"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Metric name must not be null");
    }

    @Test
    @DisplayName("Should report a missing file as IllegalArgumentException")
    void missingFile(@TempDir Path dir) {
        Path missing = dir.resolve("nope.json");

        assertThatThrownBy(() -> reader.read(missing))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Metrics input file not found");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static InputStream resource(String name) {
        InputStream in = MetricSeriesReaderTest.class.getClassLoader().getResourceAsStream(name);
        assertThat(in).as("test resource %s", name).isNotNull();
        return in;
    }

    private static InputStream stream(String json) {
        return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
    }
}
