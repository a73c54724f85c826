package com.metricsentinel.core.model;

import java.io.Serializable;
import java.util.Locale;

/**
 * Statistical summary of a metric's historical window, excluding the most
 * recent point.
 *
 * <p>
 * Computed fresh for every analysis call and never persisted.
 * </p>
 *
 * @since 1.0.0
 */
public final class Baseline implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double mean;
    private final double stdDev;
    private final double min;
    private final double max;
    private final double p50;
    private final double p95;
    private final double p99;
    private final int sampleSize;

    public Baseline(double mean, double stdDev, double min, double max,
            double p50, double p95, double p99, int sampleSize) {
        this.mean = mean;
        this.stdDev = stdDev;
        this.min = min;
        this.max = max;
        this.p50 = p50;
        this.p95 = p95;
        this.p99 = p99;
        this.sampleSize = sampleSize;
    }

    public double getMean() {
        return mean;
    }

    /**
     * @return population standard deviation
     */
    public double getStdDev() {
        return stdDev;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double getP50() {
        return p50;
    }

    public double getP95() {
        return p95;
    }

    public double getP99() {
        return p99;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
                "Baseline{mean=%.4f, stdDev=%.4f, min=%.4f, max=%.4f, p50=%.4f, p95=%.4f, p99=%.4f, n=%d}",
                mean, stdDev, min, max, p50, p95, p99, sampleSize);
    }
}
