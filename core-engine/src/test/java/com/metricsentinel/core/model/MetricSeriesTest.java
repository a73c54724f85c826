package com.metricsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link MetricSeries} and {@link MetricDataPoint}.
 */
class MetricSeriesTest {

    @Test
    @DisplayName("sortedByTimestamp should return an ordered copy")
    void shouldSortCopy() {
        MetricSeries series = MetricSeries.of("cpu_usage_percent", "%", List.of(
                new MetricDataPoint(3_000, 30),
                new MetricDataPoint(1_000, 10),
                new MetricDataPoint(2_000, 20)));

        MetricSeries sorted = series.sortedByTimestamp();

        assertThat(sorted.getDataPoints()).extracting(MetricDataPoint::getTimestamp)
                .containsExactly(1_000L, 2_000L, 3_000L);
        assertThat(series.getDataPoints()).extracting(MetricDataPoint::getTimestamp)
                .containsExactly(3_000L, 1_000L, 2_000L);
        assertThat(sorted.latest().getValue()).isEqualTo(30.0);
    }

    @Test
    @DisplayName("Should defensively copy data points")
    void shouldCopyPoints() {
        List<MetricDataPoint> points = new ArrayList<>(List.of(new MetricDataPoint(1_000, 1)));
        MetricSeries series = MetricSeries.of("cpu_usage_percent", "%", points);

        points.add(new MetricDataPoint(2_000, 2));

        assertThat(series.size()).isEqualTo(1);
        assertThatThrownBy(() -> series.getDataPoints().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Missing metadata should default to unknown provenance")
    void unknownMetadata() {
        MetricSeries series = new MetricSeries("x", null, null, null);

        assertThat(series.getDataPoints()).isEmpty();
        assertThat(series.getMetadata().getSource()).isEqualTo(MetricSource.CUSTOM);
        assertThat(series.getMetadata().getAggregation()).isEqualTo(MetricAggregation.AVERAGE);
    }

    @Test
    @DisplayName("latest() on an empty series should fail")
    void latestOnEmpty() {
        MetricSeries series = MetricSeries.of("x", null, List.of());

        assertThatThrownBy(series::latest)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("no data points");
    }

    @Test
    @DisplayName("Points without labels should expose an empty map")
    void labels() {
        assertThat(new MetricDataPoint(1, 1).getLabels()).isEmpty();
        assertThat(new MetricDataPoint(1, 1, Map.of("host", "a")).getLabels()).containsEntry("host", "a");
    }

    @Test
    @DisplayName("Should reject a null name")
    void nullName() {
        assertThatThrownBy(() -> MetricSeries.of(null, null, List.of()))
                .isInstanceOf(NullPointerException.class);
    }
}
