/**
 * Tunable detector configuration.
 *
 * <p>
 * Spike multipliers, the category table, the threshold table and the drop and
 * trend cutoffs live in {@link com.metricsentinel.core.config.DetectorConfig},
 * loaded from YAML by
 * {@link com.metricsentinel.core.config.DetectorConfigLoader}. Validation runs
 * on every load.
 * </p>
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.config;
