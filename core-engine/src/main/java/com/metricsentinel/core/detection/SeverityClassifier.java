package com.metricsentinel.core.detection;

import com.metricsentinel.core.model.MetricCategory;
import com.metricsentinel.core.model.SeverityLevel;

/**
 * Severity and confidence scoring shared by the detectors.
 *
 * <p>
 * All bucket boundaries are exclusive: a deviation must be strictly greater
 * than a boundary to reach that tier.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeverityClassifier {

    private SeverityClassifier() {
        // utility class
    }

    /**
     * Severity of a spike, by relative deviation above the baseline mean.
     *
     * <ul>
     * <li>latency: &gt;2.0 critical, &gt;1.0 high, &gt;0.5 medium</li>
     * <li>error rate: &gt;5.0 critical, &gt;2.0 high, &gt;1.0 medium</li>
     * <li>anything else: &gt;3.0 critical, &gt;2.0 high, &gt;1.0 medium</li>
     * </ul>
     *
     * @param deviation {@code (current - mean) / mean}
     * @param category  metric category
     * @return severity, {@link SeverityLevel#LOW} at minimum
     */
    public static SeverityLevel spikeSeverity(double deviation, MetricCategory category) {
        return switch (category) {
            case LATENCY -> bucket(deviation, 2.0, 1.0, 0.5);
            case ERROR_RATE -> bucket(deviation, 5.0, 2.0, 1.0);
            default -> bucket(deviation, 3.0, 2.0, 1.0);
        };
    }

    /**
     * @param deviation {@code (mean - current) / mean}
     * @return &gt;0.8 critical, &gt;0.6 high, &gt;0.4 medium, else low
     */
    public static SeverityLevel dropSeverity(double deviation) {
        return bucket(deviation, 0.8, 0.6, 0.4);
    }

    /**
     * Trends have no critical tier.
     *
     * @param relativeSlope absolute slope divided by the series average
     * @return &gt;0.3 high, &gt;0.2 medium, else low
     */
    public static SeverityLevel trendSeverity(double relativeSlope) {
        if (relativeSlope > 0.3) {
            return SeverityLevel.HIGH;
        }
        if (relativeSlope > 0.2) {
            return SeverityLevel.MEDIUM;
        }
        return SeverityLevel.LOW;
    }

    /**
     * Clamp a raw confidence score into {@code [min, max]}.
     */
    public static double clamp(double value, double min, double max) {
        return Math.min(max, Math.max(min, value));
    }

    private static SeverityLevel bucket(double deviation, double critical, double high, double medium) {
        if (deviation > critical) {
            return SeverityLevel.CRITICAL;
        }
        if (deviation > high) {
            return SeverityLevel.HIGH;
        }
        if (deviation > medium) {
            return SeverityLevel.MEDIUM;
        }
        return SeverityLevel.LOW;
    }
}
