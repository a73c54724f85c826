package com.metricsentinel.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Semantic class of a metric, inferred from its name.
 *
 * <p>
 * Each category has a stable configuration key used in the YAML detector
 * configuration (e.g. {@code error-rate}).
 * </p>
 *
 * @since 1.0.0
 */
public enum MetricCategory {
    LATENCY("latency"),
    ERROR_RATE("error-rate"),
    THROUGHPUT("throughput"),
    RESOURCE("resource"),
    AVAILABILITY("availability"),
    DEFAULT("default");

    private final String key;

    MetricCategory(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * Anomaly type reported by point-in-time detectors (spike, threshold) for
     * this category. Throughput and unclassified metrics report
     * {@link AnomalyType#LATENCY_SPIKE}.
     *
     * @return anomaly type
     */
    public AnomalyType pointAnomalyType() {
        return switch (this) {
            case LATENCY, THROUGHPUT, DEFAULT -> AnomalyType.LATENCY_SPIKE;
            case ERROR_RATE -> AnomalyType.ERROR_RATE_INCREASE;
            case RESOURCE -> AnomalyType.RESOURCE_SATURATION;
            case AVAILABILITY -> AnomalyType.AVAILABILITY_DEGRADATION;
        };
    }

    /**
     * Resolve a category from its configuration key (case-insensitive).
     *
     * @param key configuration key
     * @return the category, or empty if the key is unknown
     */
    public static Optional<MetricCategory> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(c -> c.key.equals(normalized))
                .findFirst();
    }
}
