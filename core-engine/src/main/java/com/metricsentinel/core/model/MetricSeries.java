package com.metricsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A named metric with its window of data points.
 *
 * <p>
 * Instances are immutable: the point list is copied on construction, so the
 * caller's list is never reordered by analysis. Points may arrive in any
 * order; {@link #sortedByTimestamp()} returns an ordered copy.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class MetricSeries implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final String unit;
    private final List<MetricDataPoint> dataPoints;
    private final SeriesMetadata metadata;

    /**
     * @param name       metric name; must not be {@code null}
     * @param unit       unit of measure; may be {@code null}
     * @param dataPoints observations; {@code null} is treated as empty
     * @param metadata   provenance; {@code null} means unknown
     * @throws NullPointerException if {@code name} or any data point is
     *                              {@code null}
     */
    @JsonCreator
    public MetricSeries(@JsonProperty("name") String name,
            @JsonProperty("unit") String unit,
            @JsonProperty("dataPoints") List<MetricDataPoint> dataPoints,
            @JsonProperty("metadata") SeriesMetadata metadata) {
        this.name = Objects.requireNonNull(name, "Metric name must not be null");
        this.unit = unit;
        this.dataPoints = dataPoints != null ? List.copyOf(dataPoints) : List.of();
        this.metadata = metadata != null ? metadata : SeriesMetadata.unknown();
    }

    /**
     * Convenience factory for series of unknown provenance.
     *
     * @param name       metric name
     * @param unit       unit of measure
     * @param dataPoints observations
     * @return a new series
     */
    public static MetricSeries of(String name, String unit, List<MetricDataPoint> dataPoints) {
        return new MetricSeries(name, unit, dataPoints, null);
    }

    /**
     * Return a copy of this series whose points are in ascending timestamp
     * order. This instance is left untouched.
     *
     * @return ordered copy
     */
    public MetricSeries sortedByTimestamp() {
        List<MetricDataPoint> sorted = new ArrayList<>(dataPoints);
        sorted.sort(Comparator.comparingLong(MetricDataPoint::getTimestamp));
        return new MetricSeries(name, unit, sorted, metadata);
    }

    /**
     * @return the last point in list order
     * @throws IllegalStateException if the series is empty
     */
    @JsonIgnore
    public MetricDataPoint latest() {
        if (dataPoints.isEmpty()) {
            throw new IllegalStateException("Series '" + name + "' has no data points");
        }
        return dataPoints.get(dataPoints.size() - 1);
    }

    public int size() {
        return dataPoints.size();
    }

    public String getName() {
        return name;
    }

    public String getUnit() {
        return unit;
    }

    /**
     * @return unmodifiable list of points
     */
    public List<MetricDataPoint> getDataPoints() {
        return dataPoints;
    }

    public SeriesMetadata getMetadata() {
        return metadata;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricSeries that))
            return false;
        return name.equals(that.name)
                && Objects.equals(unit, that.unit)
                && dataPoints.equals(that.dataPoints)
                && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, unit, dataPoints, metadata);
    }

    @Override
    public String toString() {
        return "MetricSeries{name='" + name + '\''
                + ", unit='" + unit + '\''
                + ", points=" + dataPoints.size()
                + ", metadata=" + metadata + '}';
    }
}
