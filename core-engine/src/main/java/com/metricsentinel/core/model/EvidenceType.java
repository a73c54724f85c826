package com.metricsentinel.core.model;

/**
 * Kind of signal an {@link Evidence} entry was derived from.
 *
 * @since 1.0.0
 */
public enum EvidenceType {
    METRIC_SPIKE,
    LOG_ERROR,
    TRACE_ANOMALY,
    CORRELATION,
    PATTERN_MATCH
}
