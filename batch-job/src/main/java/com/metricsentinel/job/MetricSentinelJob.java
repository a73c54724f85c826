package com.metricsentinel.job;

import com.metricsentinel.core.analysis.MetricAnomalyAnalyzer;
import com.metricsentinel.core.config.DetectorConfig;
import com.metricsentinel.core.config.DetectorConfigLoader;
import com.metricsentinel.core.model.Anomaly;
import com.metricsentinel.core.model.MetricSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Main entry point for the Metric Sentinel batch job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   JSON file or stdin ({"series": [...]})
 *     → MetricSeriesReader → List&lt;MetricSeries&gt;
 *     → MetricAnomalyAnalyzer (sequential, or one task per series on a pool)
 *     → AnomalyReport (ranked)
 *     → AnomalyReportWriter → JSON file or stdout
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * All configuration is resolved from environment variables via
 * {@link JobConfig}. The process exits with status 1 on any failure.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricSentinelJob {

    private static final Logger LOG = LoggerFactory.getLogger(MetricSentinelJob.class);

    private MetricSentinelJob() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) {
        try {
            // 1. Load configuration
            JobConfig config = JobConfig.fromEnvironment();
            LOG.info("Starting Metric Sentinel with config: {}", config);

            // 2. Analyze and report
            run(config, System.in, System.out);
        } catch (RuntimeException e) {
            LOG.error("Metric Sentinel batch failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    /**
     * Run one batch: read, analyze, write.
     *
     * @param config job configuration; must not be {@code null}
     * @param stdin  stream used when the input path is {@code -}
     * @param stdout stream used when the output path is {@code -}
     * @return the report that was written
     * @throws IllegalArgumentException if the input file is missing
     * @throws IllegalStateException    if input, config or output handling
     *                                  fails
     */
    static AnomalyReport run(JobConfig config, InputStream stdin, OutputStream stdout) {
        Objects.requireNonNull(config, "JobConfig must not be null");

        DetectorConfig detectorConfig = loadDetectorConfig(config);
        MetricAnomalyAnalyzer analyzer = new MetricAnomalyAnalyzer(detectorConfig);

        MetricSeriesReader reader = new MetricSeriesReader();
        List<MetricSeries> series = config.readsStdin()
                ? reader.read(stdin, "stdin")
                : reader.read(Path.of(config.getInputPath()));

        List<Anomaly> anomalies = analyze(analyzer, series, config);
        AnomalyReport report = new AnomalyReport(series.size(), anomalies);

        AnomalyReportWriter writer = new AnomalyReportWriter();
        if (config.writesStdout()) {
            writer.write(report, stdout);
        } else {
            writer.write(report, Path.of(config.getOutputPath()));
        }
        LOG.info("Batch complete: {} series, {} anomal(ies)", series.size(), report.getAnomalyCount());
        return report;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static List<Anomaly> analyze(MetricAnomalyAnalyzer analyzer, List<MetricSeries> series,
            JobConfig config) {
        if (!config.isConcurrent()) {
            return analyzer.analyze(series);
        }
        ExecutorService executor = Executors.newFixedThreadPool(config.getParallelism());
        try {
            return analyzer.analyze(series, executor, config.getDeadline());
        } finally {
            executor.shutdownNow();
        }
    }

    private static DetectorConfig loadDetectorConfig(JobConfig config) {
        return DetectorConfigLoader.load(config.getDetectorConfigPath());
    }
}
