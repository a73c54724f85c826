package com.metricsentinel.core.detection;

import com.metricsentinel.core.model.DetectionMethod;
import com.metricsentinel.core.model.MetricSeries;

/**
 * Deterministic anomaly identifiers of the form
 * {@code <method>_<metric>_<windowStart>}, where {@code windowStart} is the
 * timestamp of the earliest point in the analyzed series.
 */
final class AnomalyIds {

    private AnomalyIds() {
    }

    static String of(DetectionMethod method, MetricSeries sortedSeries) {
        long windowStart = sortedSeries.getDataPoints().get(0).getTimestamp();
        return method.id() + "_" + sortedSeries.getName() + "_" + windowStart;
    }
}
