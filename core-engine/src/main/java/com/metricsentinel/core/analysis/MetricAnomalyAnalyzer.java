package com.metricsentinel.core.analysis;

import com.metricsentinel.core.config.DetectorConfig;
import com.metricsentinel.core.detection.AnomalyDetector;
import com.metricsentinel.core.detection.BaselineCalculator;
import com.metricsentinel.core.detection.CategoryClassifier;
import com.metricsentinel.core.detection.DetectorFactory;
import com.metricsentinel.core.model.Anomaly;
import com.metricsentinel.core.model.Baseline;
import com.metricsentinel.core.model.MetricCategory;
import com.metricsentinel.core.model.MetricSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Entry point of the detection core: runs every detector against every series
 * and returns the combined anomalies in ranked order.
 *
 * <h3>Per-series pipeline</h3>
 * <ol>
 * <li>skip series with fewer than {@code minSeriesPoints} points</li>
 * <li>sort a copy of the points by timestamp (the input is never
 * modified)</li>
 * <li>compute the {@link Baseline} from all but the latest point</li>
 * <li>classify the metric name once, then run each detector in order</li>
 * </ol>
 *
 * <p>
 * A series may legitimately yield anomalies from several detectors; no
 * deduplication is performed. A detector that throws is logged and the
 * remaining detectors still run.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Instances hold no mutable state and may be shared across threads. Series
 * are independent, so {@link #analyze(List, ExecutorService, Duration)} can
 * fan them out onto an executor; each task accumulates its own list and the
 * results are merged once before ranking.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricAnomalyAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(MetricAnomalyAnalyzer.class);

    private final int minSeriesPoints;
    private final CategoryClassifier classifier;
    private final List<AnomalyDetector> detectors;

    /**
     * Analyzer with the built-in defaults.
     */
    public MetricAnomalyAnalyzer() {
        this(DetectorConfig.defaults());
    }

    /**
     * @param config detector configuration; must not be {@code null}
     * @throws IllegalStateException if the configuration is invalid
     */
    public MetricAnomalyAnalyzer(DetectorConfig config) {
        this(validated(config), DetectorFactory.createAll(config));
    }

    /**
     * Analyzer with a custom detector list, e.g. to add a detector to the
     * built-in ones.
     *
     * @param config    configuration used for classification and the minimum
     *                  series size; must not be {@code null}
     * @param detectors detectors to run, in order; must not be {@code null}
     * @throws IllegalStateException if the configuration is invalid
     */
    public MetricAnomalyAnalyzer(DetectorConfig config, List<AnomalyDetector> detectors) {
        validated(config);
        Objects.requireNonNull(detectors, "Detectors list must not be null");
        this.minSeriesPoints = config.getMinSeriesPoints();
        this.classifier = new CategoryClassifier(config);
        this.detectors = Collections.unmodifiableList(new ArrayList<>(detectors));
    }

    // ---------------------------------------------------------------
    // Sequential analysis
    // ---------------------------------------------------------------

    /**
     * Analyze a batch of series on the calling thread.
     *
     * @param series series to analyze; must not be {@code null}
     * @return ranked anomalies across all series
     */
    public List<Anomaly> analyze(List<MetricSeries> series) {
        Objects.requireNonNull(series, "Series list must not be null");
        LOG.info("Analyzing {} metric series for anomalies", series.size());

        List<Anomaly> anomalies = new ArrayList<>();
        for (MetricSeries s : series) {
            anomalies.addAll(analyzeSeries(s));
        }
        return finish(anomalies);
    }

    /**
     * Analyze a single series. The result is in detector order, not ranked.
     *
     * @param series the series; must not be {@code null}
     * @return anomalies found in the series, possibly empty
     */
    public List<Anomaly> analyzeSeries(MetricSeries series) {
        Objects.requireNonNull(series, "MetricSeries must not be null");

        if (series.size() < minSeriesPoints) {
            LOG.debug("Skipping '{}': {} point(s) < {}", series.getName(), series.size(), minSeriesPoints);
            return List.of();
        }

        MetricSeries sorted = series.sortedByTimestamp();
        Optional<Baseline> baseline = BaselineCalculator.calculate(sorted);
        if (baseline.isEmpty()) {
            LOG.debug("Skipping '{}': not enough points for a baseline", series.getName());
            return List.of();
        }
        MetricCategory category = classifier.classify(series.getName());

        List<Anomaly> found = new ArrayList<>();
        for (AnomalyDetector detector : detectors) {
            try {
                detector.detect(sorted, baseline.get(), category).ifPresent(found::add);
            } catch (RuntimeException e) {
                LOG.error("Detector [{}] failed on '{}', continuing with next detector",
                        detector.getMethod(), series.getName(), e);
            }
        }
        return found;
    }

    // ---------------------------------------------------------------
    // Concurrent analysis
    // ---------------------------------------------------------------

    /**
     * Analyze a batch of series on the given executor without a deadline.
     *
     * @see #analyze(List, ExecutorService, Duration)
     */
    public List<Anomaly> analyze(List<MetricSeries> series, ExecutorService executor) {
        return analyze(series, executor, null);
    }

    /**
     * Analyze a batch of series on the given executor, one task per series.
     *
     * <p>
     * With a deadline, series whose analysis has not completed when it
     * expires are dropped from the result as a whole; a series is never
     * partially reported. The output for the series that did complete is
     * identical to {@link #analyze(List)}.
     * </p>
     *
     * @param series   series to analyze; must not be {@code null}
     * @param executor executor to run on; must not be {@code null}. It is not
     *                 shut down.
     * @param deadline overall time budget; {@code null} or non-positive means
     *                 none
     * @return ranked anomalies across all completed series
     * @throws IllegalStateException if the calling thread is interrupted
     */
    public List<Anomaly> analyze(List<MetricSeries> series, ExecutorService executor, Duration deadline) {
        Objects.requireNonNull(series, "Series list must not be null");
        Objects.requireNonNull(executor, "ExecutorService must not be null");
        LOG.info("Analyzing {} metric series for anomalies (concurrent, deadline={})",
                series.size(), deadline);

        List<Callable<List<Anomaly>>> tasks = new ArrayList<>(series.size());
        for (MetricSeries s : series) {
            Objects.requireNonNull(s, "MetricSeries must not be null");
            tasks.add(() -> analyzeSeries(s));
        }

        List<Future<List<Anomaly>>> futures;
        try {
            if (deadline == null || deadline.isZero() || deadline.isNegative()) {
                futures = executor.invokeAll(tasks);
            } else {
                futures = executor.invokeAll(tasks, deadline.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while analyzing metric series", e);
        }

        List<Anomaly> merged = new ArrayList<>();
        int dropped = 0;
        for (int i = 0; i < futures.size(); i++) {
            Future<List<Anomaly>> future = futures.get(i);
            String name = series.get(i).getName();
            if (future.isCancelled()) {
                dropped++;
                continue;
            }
            try {
                merged.addAll(future.get());
            } catch (ExecutionException e) {
                dropped++;
                LOG.error("Analysis of '{}' failed, dropping series", name, e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while collecting analysis results", e);
            }
        }
        if (dropped > 0) {
            LOG.warn("Dropped {} of {} series that did not complete analysis", dropped, series.size());
        }
        return finish(merged);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static List<Anomaly> finish(List<Anomaly> anomalies) {
        List<Anomaly> ranked = AnomalyRanking.rank(anomalies);
        LOG.info("Detected {} anomal(ies)", ranked.size());
        return ranked;
    }

    private static DetectorConfig validated(DetectorConfig config) {
        Objects.requireNonNull(config, "DetectorConfig must not be null");
        config.validate();
        return config;
    }
}
