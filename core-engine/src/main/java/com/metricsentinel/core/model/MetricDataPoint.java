package com.metricsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Map;
import java.util.Objects;

/**
 * A single observation of a metric.
 *
 * <p>
 * Immutable once produced by the data source. Labels are optional; a missing
 * label map is stored as an empty map.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class MetricDataPoint implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Epoch millis. */
    private final long timestamp;

    private final double value;

    private final Map<String, String> labels;

    /**
     * @param timestamp observation time in milliseconds since epoch
     * @param value     observed value
     * @param labels    optional labels; may be {@code null}
     */
    @JsonCreator
    public MetricDataPoint(@JsonProperty("timestamp") long timestamp,
            @JsonProperty("value") double value,
            @JsonProperty("labels") Map<String, String> labels) {
        this.timestamp = timestamp;
        this.value = value;
        this.labels = labels != null ? Map.copyOf(labels) : Map.of();
    }

    public MetricDataPoint(long timestamp, double value) {
        this(timestamp, value, null);
    }

    public long getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    /**
     * @return unmodifiable label map, never {@code null}
     */
    public Map<String, String> getLabels() {
        return labels;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricDataPoint that))
            return false;
        return timestamp == that.timestamp
                && Double.compare(value, that.value) == 0
                && labels.equals(that.labels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value, labels);
    }

    @Override
    public String toString() {
        return "MetricDataPoint{timestamp=" + timestamp + ", value=" + value + '}';
    }
}
