package com.metricsentinel.core.model;

import java.util.Locale;

/**
 * Which detector produced an anomaly.
 *
 * @since 1.0.0
 */
public enum DetectionMethod {
    SPIKE,
    DROP,
    THRESHOLD,
    TREND;

    /**
     * @return lower-case identifier used as the anomaly id prefix
     */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
