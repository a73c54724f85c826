package com.metricsentinel.core.detection;

import com.metricsentinel.core.config.DetectorConfig;
import com.metricsentinel.core.model.DetectionMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Factory that creates {@link AnomalyDetector} instances from a
 * {@link DetectorConfig}.
 *
 * <p>
 * This is the single point of extension when adding new detection methods:
 * add the constant to {@link DetectionMethod} and create the corresponding
 * detector here.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class
    }

    /**
     * Create the detector for a detection method.
     *
     * @param method detection method; must not be {@code null}
     * @param config detector configuration; must not be {@code null}
     * @return a new detector
     */
    public static AnomalyDetector create(DetectionMethod method, DetectorConfig config) {
        Objects.requireNonNull(method, "DetectionMethod must not be null");
        Objects.requireNonNull(config, "DetectorConfig must not be null");

        return switch (method) {
            case SPIKE -> new SpikeDetector(config);
            case DROP -> new DropDetector(config);
            case THRESHOLD -> new ThresholdViolationDetector(config);
            case TREND -> new TrendDetector(config);
        };
    }

    /**
     * Create one detector per {@link DetectionMethod}, in declaration order
     * (spike, drop, threshold, trend).
     *
     * @param config detector configuration; must not be {@code null}
     * @return unmodifiable list of detectors
     */
    public static List<AnomalyDetector> createAll(DetectorConfig config) {
        Objects.requireNonNull(config, "DetectorConfig must not be null");
        List<AnomalyDetector> detectors = Arrays.stream(DetectionMethod.values())
                .map(method -> create(method, config))
                .toList();
        LOG.debug("Created {} detector(s)", detectors.size());
        return detectors;
    }
}
