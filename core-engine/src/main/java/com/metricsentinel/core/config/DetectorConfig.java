package com.metricsentinel.core.config;

import com.metricsentinel.core.model.MetricCategory;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Top-level POJO for the detector YAML configuration.
 *
 * <p>
 * A freshly constructed instance carries the built-in defaults; a YAML
 * document only needs to list the sections it overrides. Setting a map or
 * list replaces that section entirely.
 * </p>
 *
 * <pre>
 * spikeMultipliers:
 *   latency: 2.0
 *   default: 3.0
 * categoryPatterns:
 *   latency: [latency, duration, response_time]
 * thresholds:
 *   - name: cpu_percent
 *     patterns: [cpu, percent]
 *     medium: 70.0
 *     high: 85.0
 *     critical: 95.0
 * dropThresholdRatio: 0.5
 * trendSignificanceCutoff: 0.1
 * minSeriesPoints: 3
 * minTrendPoints: 5
 * </pre>
 *
 * <p>
 * Category keys are those of {@link MetricCategory#key()}. The order of
 * {@code categoryPatterns} is significant: the first category with a matching
 * substring wins. Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private Map<String, Double> spikeMultipliers = defaultSpikeMultipliers();
    private Map<String, List<String>> categoryPatterns = defaultCategoryPatterns();
    private List<ThresholdRule> thresholds = defaultThresholds();

    /** Current value below {@code mean * ratio} counts as a throughput drop. */
    private double dropThresholdRatio = 0.5;

    /** Minimum relative slope for a trend to be reported. */
    private double trendSignificanceCutoff = 0.1;

    /** Series with fewer points are not analyzed at all. */
    private int minSeriesPoints = 3;

    /** Series with fewer points skip trend detection only. */
    private int minTrendPoints = 5;

    /**
     * @return a new configuration holding the built-in defaults
     */
    public static DetectorConfig defaults() {
        return new DetectorConfig();
    }

    /**
     * Spike multiplier for a category, falling back to the {@code default}
     * entry when the category has none.
     *
     * @param category metric category; must not be {@code null}
     * @return number of standard deviations above the mean that counts as a
     *         spike
     */
    public double spikeMultiplier(MetricCategory category) {
        Objects.requireNonNull(category, "Category must not be null");
        Double multiplier = spikeMultipliers.get(category.key());
        if (multiplier == null) {
            multiplier = spikeMultipliers.get(MetricCategory.DEFAULT.key());
        }
        return multiplier;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate the whole configuration. Collects all errors and throws a single
     * exception if anything is invalid.
     *
     * @throws IllegalStateException if the configuration is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (!spikeMultipliers.containsKey(MetricCategory.DEFAULT.key())) {
            errors.add("spikeMultipliers requires a '" + MetricCategory.DEFAULT.key() + "' entry");
        }
        spikeMultipliers.forEach((key, value) -> {
            if (MetricCategory.fromKey(key).isEmpty()) {
                errors.add("spikeMultipliers has unknown category '" + key + "'");
            }
            if (value == null || value <= 0) {
                errors.add("spikeMultipliers['" + key + "'] must be > 0, got: " + value);
            }
        });

        categoryPatterns.forEach((key, patterns) -> {
            MetricCategory category = MetricCategory.fromKey(key).orElse(null);
            if (category == null || category == MetricCategory.DEFAULT) {
                errors.add("categoryPatterns has unknown category '" + key + "'");
            }
            if (patterns == null || patterns.isEmpty()) {
                errors.add("categoryPatterns['" + key + "'] requires at least one pattern");
            } else if (patterns.stream().anyMatch(p -> p == null || p.isBlank())) {
                errors.add("categoryPatterns['" + key + "'] has a blank pattern");
            }
        });

        for (int i = 0; i < thresholds.size(); i++) {
            ThresholdRule rule = Objects.requireNonNull(thresholds.get(i),
                    "Threshold rule at index " + i + " is null");
            try {
                rule.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
        }

        if (dropThresholdRatio <= 0 || dropThresholdRatio >= 1) {
            errors.add("dropThresholdRatio must be in (0, 1), got: " + dropThresholdRatio);
        }
        if (trendSignificanceCutoff <= 0) {
            errors.add("trendSignificanceCutoff must be > 0, got: " + trendSignificanceCutoff);
        }
        if (minSeriesPoints < 3) {
            errors.add("minSeriesPoints must be >= 3, got: " + minSeriesPoints);
        }
        if (minTrendPoints < 2) {
            errors.add("minTrendPoints must be >= 2, got: " + minTrendPoints);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Detector configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    /**
     * @return unmodifiable map of category key to multiplier
     */
    public Map<String, Double> getSpikeMultipliers() {
        return Collections.unmodifiableMap(spikeMultipliers);
    }

    public void setSpikeMultipliers(Map<String, Double> spikeMultipliers) {
        this.spikeMultipliers = new LinkedHashMap<>();
        if (spikeMultipliers != null) {
            spikeMultipliers.forEach((k, v) -> this.spikeMultipliers.put(normalize(k), v));
        }
    }

    /**
     * @return unmodifiable, insertion-ordered map of category key to name
     *         substrings
     */
    public Map<String, List<String>> getCategoryPatterns() {
        return Collections.unmodifiableMap(categoryPatterns);
    }

    public void setCategoryPatterns(Map<String, List<String>> categoryPatterns) {
        this.categoryPatterns = new LinkedHashMap<>();
        if (categoryPatterns != null) {
            categoryPatterns.forEach((k, v) -> {
                List<String> normalized = new ArrayList<>();
                if (v != null) {
                    v.forEach(p -> normalized.add(p != null ? p.toLowerCase(Locale.ROOT) : null));
                }
                this.categoryPatterns.put(normalize(k), normalized);
            });
        }
    }

    /**
     * @return unmodifiable list of threshold rules in evaluation order
     */
    public List<ThresholdRule> getThresholds() {
        return Collections.unmodifiableList(thresholds);
    }

    public void setThresholds(List<ThresholdRule> thresholds) {
        this.thresholds = thresholds != null ? new ArrayList<>(thresholds) : new ArrayList<>();
    }

    public double getDropThresholdRatio() {
        return dropThresholdRatio;
    }

    public void setDropThresholdRatio(double dropThresholdRatio) {
        this.dropThresholdRatio = dropThresholdRatio;
    }

    public double getTrendSignificanceCutoff() {
        return trendSignificanceCutoff;
    }

    public void setTrendSignificanceCutoff(double trendSignificanceCutoff) {
        this.trendSignificanceCutoff = trendSignificanceCutoff;
    }

    public int getMinSeriesPoints() {
        return minSeriesPoints;
    }

    public void setMinSeriesPoints(int minSeriesPoints) {
        this.minSeriesPoints = minSeriesPoints;
    }

    public int getMinTrendPoints() {
        return minTrendPoints;
    }

    public void setMinTrendPoints(int minTrendPoints) {
        this.minTrendPoints = minTrendPoints;
    }

    // ---------------------------------------------------------------
    // Defaults
    // ---------------------------------------------------------------

    private static Map<String, Double> defaultSpikeMultipliers() {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put(MetricCategory.LATENCY.key(), 2.0);
        m.put(MetricCategory.ERROR_RATE.key(), 2.0);
        m.put(MetricCategory.RESOURCE.key(), 2.5);
        m.put(MetricCategory.DEFAULT.key(), 3.0);
        return m;
    }

    private static Map<String, List<String>> defaultCategoryPatterns() {
        Map<String, List<String>> m = new LinkedHashMap<>();
        m.put(MetricCategory.LATENCY.key(), new ArrayList<>(List.of("latency", "duration", "response_time")));
        m.put(MetricCategory.ERROR_RATE.key(), new ArrayList<>(List.of("error", "failure", "5xx", "exception")));
        m.put(MetricCategory.THROUGHPUT.key(), new ArrayList<>(List.of("throughput", "requests", "rps", "qps", "rate")));
        m.put(MetricCategory.RESOURCE.key(), new ArrayList<>(List.of("cpu", "memory", "disk")));
        m.put(MetricCategory.AVAILABILITY.key(), new ArrayList<>(List.of("availability", "uptime")));
        return m;
    }

    private static List<ThresholdRule> defaultThresholds() {
        List<ThresholdRule> rules = new ArrayList<>();
        rules.add(new ThresholdRule("cpu_percent", List.of("cpu", "percent"), 70, 85, 95));
        rules.add(new ThresholdRule("memory_percent", List.of("memory", "percent"), 80, 90, 95));
        rules.add(new ThresholdRule("disk_percent", List.of("disk", "percent"), 80, 90, 95));
        rules.add(new ThresholdRule("error_rate", List.of("error", "rate"), 0.01, 0.05, 0.1));
        rules.add(new ThresholdRule("latency_p95", List.of("latency", "p95"), 500, 1000, 2000));
        return rules;
    }

    private static String normalize(String key) {
        return key != null ? key.trim().toLowerCase(Locale.ROOT) : null;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectorConfig that))
            return false;
        return spikeMultipliers.equals(that.spikeMultipliers)
                && categoryPatterns.equals(that.categoryPatterns)
                && thresholds.equals(that.thresholds)
                && Double.compare(dropThresholdRatio, that.dropThresholdRatio) == 0
                && Double.compare(trendSignificanceCutoff, that.trendSignificanceCutoff) == 0
                && minSeriesPoints == that.minSeriesPoints
                && minTrendPoints == that.minTrendPoints;
    }

    @Override
    public int hashCode() {
        return Objects.hash(spikeMultipliers, categoryPatterns, thresholds,
                dropThresholdRatio, trendSignificanceCutoff, minSeriesPoints, minTrendPoints);
    }

    @Override
    public String toString() {
        return "DetectorConfig{" +
                "spikeMultipliers=" + spikeMultipliers +
                ", categoryPatterns=" + categoryPatterns +
                ", thresholds=" + thresholds +
                ", dropThresholdRatio=" + dropThresholdRatio +
                ", trendSignificanceCutoff=" + trendSignificanceCutoff +
                ", minSeriesPoints=" + minSeriesPoints +
                ", minTrendPoints=" + minTrendPoints +
                '}';
    }
}
