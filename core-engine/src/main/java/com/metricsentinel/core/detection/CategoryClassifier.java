package com.metricsentinel.core.detection;

import com.metricsentinel.core.config.DetectorConfig;
import com.metricsentinel.core.model.MetricCategory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Maps a metric name to its {@link MetricCategory}.
 *
 * <p>
 * Backed by one ordered table of {@code (category, substrings)} taken from
 * {@link DetectorConfig#getCategoryPatterns()}. The name is lower-cased and
 * the first category with a matching substring wins; names matching nothing
 * are {@link MetricCategory#DEFAULT}. Every detector classifies through the
 * same instance, so they can never disagree about a metric.
 * </p>
 *
 * @since 1.0.0
 */
public final class CategoryClassifier {

    private final List<Entry> table;

    /**
     * @param config detector configuration; must not be {@code null}
     * @throws IllegalArgumentException if a category key is unknown
     */
    public CategoryClassifier(DetectorConfig config) {
        Objects.requireNonNull(config, "DetectorConfig must not be null");
        List<Entry> entries = new ArrayList<>();
        for (Map.Entry<String, List<String>> e : config.getCategoryPatterns().entrySet()) {
            MetricCategory category = MetricCategory.fromKey(e.getKey())
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Unknown metric category: '" + e.getKey() + "'"));
            entries.add(new Entry(category, List.copyOf(e.getValue())));
        }
        this.table = Collections.unmodifiableList(entries);
    }

    /**
     * Classify a metric by name.
     *
     * @param metricName metric name; must not be {@code null}
     * @return the first matching category, or {@link MetricCategory#DEFAULT}
     */
    public MetricCategory classify(String metricName) {
        Objects.requireNonNull(metricName, "Metric name must not be null");
        String lowerName = metricName.toLowerCase(Locale.ROOT);
        for (Entry entry : table) {
            for (String pattern : entry.patterns) {
                if (lowerName.contains(pattern)) {
                    return entry.category;
                }
            }
        }
        return MetricCategory.DEFAULT;
    }

    private static final class Entry {
        private final MetricCategory category;
        private final List<String> patterns;

        private Entry(MetricCategory category, List<String> patterns) {
            this.category = category;
            this.patterns = patterns;
        }
    }
}
