/**
 * Pluggable anomaly detection engine.
 *
 * <p>
 * All detectors implement the
 * {@link com.metricsentinel.core.detection.AnomalyDetector} interface and are
 * instantiated via {@link com.metricsentinel.core.detection.DetectorFactory}.
 * Built-in detectors:
 * </p>
 * <ul>
 * <li>{@link com.metricsentinel.core.detection.SpikeDetector}: value above
 * mean + k × σ</li>
 * <li>{@link com.metricsentinel.core.detection.DropDetector}: throughput
 * below a fraction of the mean</li>
 * <li>{@link com.metricsentinel.core.detection.ThresholdViolationDetector}:
 * absolute per-metric thresholds</li>
 * <li>{@link com.metricsentinel.core.detection.TrendDetector}: significant
 * linear slope over the window</li>
 * </ul>
 *
 * <p>
 * Detectors share one
 * {@link com.metricsentinel.core.detection.CategoryClassifier}, one
 * {@link com.metricsentinel.core.detection.BaselineCalculator} result per
 * series and the scoring rules in
 * {@link com.metricsentinel.core.detection.SeverityClassifier}.
 * </p>
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.detection;
