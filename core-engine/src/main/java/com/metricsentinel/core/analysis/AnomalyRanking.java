package com.metricsentinel.core.analysis;

import com.metricsentinel.core.model.Anomaly;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Orders anomalies for reporting: highest severity first, higher confidence
 * first within a severity.
 *
 * @since 1.0.0
 */
public final class AnomalyRanking {

    /** Severity rank descending, then confidence descending. */
    public static final Comparator<Anomaly> COMPARATOR = Comparator
            .comparingInt((Anomaly a) -> a.getSeverity().rank()).reversed()
            .thenComparing(Comparator.comparingDouble(Anomaly::getConfidence).reversed());

    private AnomalyRanking() {
        // utility class
    }

    /**
     * Return a ranked copy. The sort is stable, so anomalies with equal
     * severity and confidence keep their input order.
     *
     * @param anomalies anomalies to rank; must not be {@code null}
     * @return new mutable list in ranked order
     */
    public static List<Anomaly> rank(Collection<Anomaly> anomalies) {
        Objects.requireNonNull(anomalies, "Anomalies must not be null");
        List<Anomaly> ranked = new ArrayList<>(anomalies);
        ranked.sort(COMPARATOR);
        return ranked;
    }
}
