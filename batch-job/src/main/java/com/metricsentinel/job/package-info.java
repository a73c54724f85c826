/**
 * Batch host for the Metric Sentinel detection core.
 *
 * <p>
 * This package reads a batch of already-materialized metric series as JSON,
 * runs {@link com.metricsentinel.core.analysis.MetricAnomalyAnalyzer} over
 * them, and writes the ranked anomalies back out as JSON.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.metricsentinel.job.MetricSentinelJob}: main entry
 * point</li>
 * <li>{@link com.metricsentinel.job.MetricSeriesReader}: JSON input</li>
 * <li>{@link com.metricsentinel.job.AnomalyReportWriter}: JSON output</li>
 * <li>{@link com.metricsentinel.job.JobConfig}: environment-driven
 * configuration</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.metricsentinel.job;
