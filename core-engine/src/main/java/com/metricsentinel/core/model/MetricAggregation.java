package com.metricsentinel.core.model;

/**
 * Aggregation the data source applied to each interval of a series.
 *
 * @since 1.0.0
 */
public enum MetricAggregation {
    AVERAGE,
    SUM,
    MAX,
    MIN,
    P50,
    P95,
    P99
}
