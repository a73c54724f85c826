package com.metricsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * Provenance of a {@link MetricSeries}: where it came from, its sampling
 * interval and how points were aggregated.
 *
 * <p>
 * A missing source defaults to {@link MetricSource#CUSTOM} and a missing
 * aggregation to {@link MetricAggregation#AVERAGE}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SeriesMetadata implements Serializable {

    private static final long serialVersionUID = 1L;

    private final MetricSource source;
    private final String interval;
    private final MetricAggregation aggregation;

    @JsonCreator
    public SeriesMetadata(@JsonProperty("source") MetricSource source,
            @JsonProperty("interval") String interval,
            @JsonProperty("aggregation") MetricAggregation aggregation) {
        this.source = source != null ? source : MetricSource.CUSTOM;
        this.interval = interval;
        this.aggregation = aggregation != null ? aggregation : MetricAggregation.AVERAGE;
    }

    /**
     * @return metadata for a series of unknown provenance
     */
    public static SeriesMetadata unknown() {
        return new SeriesMetadata(MetricSource.CUSTOM, null, MetricAggregation.AVERAGE);
    }

    public MetricSource getSource() {
        return source;
    }

    public String getInterval() {
        return interval;
    }

    public MetricAggregation getAggregation() {
        return aggregation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeriesMetadata that))
            return false;
        return source == that.source
                && Objects.equals(interval, that.interval)
                && aggregation == that.aggregation;
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, interval, aggregation);
    }

    @Override
    public String toString() {
        return "SeriesMetadata{source=" + source
                + ", interval='" + interval + '\''
                + ", aggregation=" + aggregation + '}';
    }
}
