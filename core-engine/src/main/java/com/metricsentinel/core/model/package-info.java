/**
 * Domain model for Metric Sentinel.
 *
 * <p>
 * Input types are {@link com.metricsentinel.core.model.MetricSeries} and
 * {@link com.metricsentinel.core.model.MetricDataPoint}; the output type is
 * {@link com.metricsentinel.core.model.Anomaly} with its
 * {@link com.metricsentinel.core.model.Evidence}. All of them are immutable.
 * </p>
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.model;
