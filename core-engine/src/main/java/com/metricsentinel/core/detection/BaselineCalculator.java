package com.metricsentinel.core.detection;

import com.metricsentinel.core.model.Baseline;
import com.metricsentinel.core.model.MetricDataPoint;
import com.metricsentinel.core.model.MetricSeries;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Computes the {@link Baseline} of a series from every point except the most
 * recent one.
 *
 * <h3>Statistics</h3>
 * <ul>
 * <li>standard deviation uses the population variance (divide by n)</li>
 * <li>percentiles use nearest rank on the sorted values,
 * {@code sorted[floor(n * q)]}, without interpolation</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class BaselineCalculator {

    /** Minimum number of historical points a baseline is computed from. */
    public static final int MIN_BASELINE_POINTS = 2;

    private BaselineCalculator() {
        // utility class
    }

    /**
     * Compute the baseline of a series sorted by ascending timestamp.
     *
     * @param series the sorted series; must not be {@code null}
     * @return the baseline, or empty if fewer than {@value #MIN_BASELINE_POINTS}
     *         points precede the most recent one
     */
    public static Optional<Baseline> calculate(MetricSeries series) {
        Objects.requireNonNull(series, "MetricSeries must not be null");
        List<MetricDataPoint> points = series.getDataPoints();
        int n = points.size() - 1;
        if (n < MIN_BASELINE_POINTS) {
            return Optional.empty();
        }

        double[] values = new double[n];
        double sum = 0;
        for (int i = 0; i < n; i++) {
            values[i] = points.get(i).getValue();
            sum += values[i];
        }
        double mean = sum / n;

        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        double stdDev = Math.sqrt(sumSquaredDiff / n);

        double[] sorted = values.clone();
        Arrays.sort(sorted);

        return Optional.of(new Baseline(
                mean,
                stdDev,
                sorted[0],
                sorted[n - 1],
                percentile(sorted, 0.5),
                percentile(sorted, 0.95),
                percentile(sorted, 0.99),
                n));
    }

    static double percentile(double[] sorted, double quantile) {
        int index = (int) Math.floor(sorted.length * quantile);
        return sorted[Math.min(index, sorted.length - 1)];
    }
}
