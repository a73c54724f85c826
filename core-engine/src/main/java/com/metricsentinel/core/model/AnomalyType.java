package com.metricsentinel.core.model;

/**
 * Operational meaning of a detected anomaly.
 *
 * @since 1.0.0
 */
public enum AnomalyType {
    LATENCY_SPIKE,
    ERROR_RATE_INCREASE,
    THROUGHPUT_DROP,
    RESOURCE_SATURATION,
    AVAILABILITY_DEGRADATION
}
