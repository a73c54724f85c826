package com.metricsentinel.core.model;

/**
 * Monitoring backend a series was fetched from.
 *
 * @since 1.0.0
 */
public enum MetricSource {
    PROMETHEUS,
    DATADOG,
    CLOUDWATCH,
    GRAFANA,
    NEW_RELIC,
    CUSTOM
}
