package com.metricsentinel.core.model;

/**
 * Ordinal urgency of an anomaly, from {@link #INFO} to {@link #CRITICAL}.
 *
 * @since 1.0.0
 */
public enum SeverityLevel {
    INFO(0),
    LOW(1),
    MEDIUM(2),
    HIGH(3),
    CRITICAL(4);

    private final int rank;

    SeverityLevel(int rank) {
        this.rank = rank;
    }

    /**
     * @return numeric rank, higher is more urgent
     */
    public int rank() {
        return rank;
    }
}
