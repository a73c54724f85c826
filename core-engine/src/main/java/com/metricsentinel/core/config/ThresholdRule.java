package com.metricsentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Absolute severity thresholds for metrics whose name contains every one of
 * the configured substrings.
 *
 * <p>
 * Example YAML entry:
 * </p>
 *
 * <pre>
 * - name: cpu_percent
 *   patterns: [cpu, percent]
 *   medium: 70.0
 *   high: 85.0
 *   critical: 95.0
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdRule implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Rule name used in anomaly descriptions and logs. */
    private String name;

    /** Lower-case substrings that must all occur in the metric name. */
    private List<String> patterns = new ArrayList<>();

    private double medium;
    private double high;
    private double critical;

    /** No-arg constructor required by SnakeYAML. */
    public ThresholdRule() {
    }

    public ThresholdRule(String name, List<String> patterns, double medium, double high, double critical) {
        this.name = name;
        setPatterns(patterns);
        this.medium = medium;
        this.high = high;
        this.critical = critical;
    }

    /**
     * Check whether this rule applies to a metric.
     *
     * @param metricName metric name; must not be {@code null}
     * @return {@code true} if every pattern is a substring of the lower-cased
     *         name
     */
    public boolean matches(String metricName) {
        Objects.requireNonNull(metricName, "Metric name must not be null");
        if (patterns.isEmpty()) {
            return false;
        }
        String lowerName = metricName.toLowerCase(Locale.ROOT);
        return patterns.stream().allMatch(lowerName::contains);
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that the rule has a name, at least one pattern and ordered
     * positive thresholds ({@code 0 < medium <= high <= critical}).
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("Threshold rule 'name' is required");
        }
        if (patterns.isEmpty()) {
            errors.add("Threshold rule '" + name + "' requires at least one pattern");
        } else if (patterns.stream().anyMatch(p -> p == null || p.isBlank())) {
            errors.add("Threshold rule '" + name + "' has a blank pattern");
        }
        if (medium <= 0) {
            errors.add("Threshold rule '" + name + "' requires 'medium' > 0");
        }
        if (medium > high || high > critical) {
            errors.add("Threshold rule '" + name + "' requires medium <= high <= critical, got: "
                    + medium + ", " + high + ", " + critical);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid ThresholdRule: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /**
     * @return unmodifiable list of lower-case patterns
     */
    public List<String> getPatterns() {
        return Collections.unmodifiableList(patterns);
    }

    /**
     * Set the patterns, normalised to lowercase.
     *
     * @param patterns metric-name substrings
     */
    public void setPatterns(List<String> patterns) {
        List<String> normalized = new ArrayList<>();
        if (patterns != null) {
            for (String p : patterns) {
                normalized.add(p != null ? p.toLowerCase(Locale.ROOT) : null);
            }
        }
        this.patterns = normalized;
    }

    public double getMedium() {
        return medium;
    }

    public void setMedium(double medium) {
        this.medium = medium;
    }

    public double getHigh() {
        return high;
    }

    public void setHigh(double high) {
        this.high = high;
    }

    public double getCritical() {
        return critical;
    }

    public void setCritical(double critical) {
        this.critical = critical;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ThresholdRule that))
            return false;
        return Objects.equals(name, that.name)
                && patterns.equals(that.patterns)
                && Double.compare(medium, that.medium) == 0
                && Double.compare(high, that.high) == 0
                && Double.compare(critical, that.critical) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, patterns, medium, high, critical);
    }

    @Override
    public String toString() {
        return "ThresholdRule{" +
                "name='" + name + '\'' +
                ", patterns=" + patterns +
                ", medium=" + medium +
                ", high=" + high +
                ", critical=" + critical +
                '}';
    }
}
