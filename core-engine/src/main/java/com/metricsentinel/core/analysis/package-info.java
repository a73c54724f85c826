/**
 * Batch analysis and ranking.
 *
 * <p>
 * {@link com.metricsentinel.core.analysis.MetricAnomalyAnalyzer} runs the
 * detectors over each series independently and
 * {@link com.metricsentinel.core.analysis.AnomalyRanking} orders the combined
 * result by severity, then confidence.
 * </p>
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.analysis;
