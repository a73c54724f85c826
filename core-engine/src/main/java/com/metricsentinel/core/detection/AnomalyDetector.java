package com.metricsentinel.core.detection;

import com.metricsentinel.core.model.Anomaly;
import com.metricsentinel.core.model.Baseline;
import com.metricsentinel.core.model.DetectionMethod;
import com.metricsentinel.core.model.MetricCategory;
import com.metricsentinel.core.model.MetricSeries;

import java.util.Optional;

/**
 * Contract for all anomaly detectors.
 * <p>
 * Implementations are <strong>stateless</strong>: their tunables are fixed at
 * construction from a {@link com.metricsentinel.core.config.DetectorConfig},
 * and every call is a pure function of its arguments. A single instance may
 * be shared by concurrent analyses.
 * </p>
 * <p>
 * Detectors never throw for data they cannot judge (zero mean, too few
 * points, unknown metric); they return {@link Optional#empty()}.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * Examine one series and decide whether it contains an anomaly.
     *
     * @param series   the series, sorted by ascending timestamp, with at least
     *                 one point
     * @param baseline statistics of every point except the most recent
     * @param category category inferred from the series name
     * @return an {@link Anomaly} if the detector fires, empty otherwise
     */
    Optional<Anomaly> detect(MetricSeries series, Baseline baseline, MetricCategory category);

    /**
     * @return the detection method this detector implements
     */
    DetectionMethod getMethod();
}
