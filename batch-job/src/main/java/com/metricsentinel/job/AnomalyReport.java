package com.metricsentinel.job;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.metricsentinel.core.model.Anomaly;

import java.util.List;
import java.util.Objects;

/**
 * Output document of one batch run: the ranked anomalies plus counts.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "generatedFrom", "anomalyCount", "anomalies" })
public final class AnomalyReport {

    private final int generatedFrom;
    private final List<Anomaly> anomalies;

    /**
     * @param generatedFrom number of series that were submitted for analysis
     * @param anomalies     ranked anomalies; must not be {@code null}
     */
    public AnomalyReport(int generatedFrom, List<Anomaly> anomalies) {
        this.generatedFrom = generatedFrom;
        this.anomalies = List.copyOf(Objects.requireNonNull(anomalies, "Anomalies must not be null"));
    }

    public int getGeneratedFrom() {
        return generatedFrom;
    }

    public int getAnomalyCount() {
        return anomalies.size();
    }

    public List<Anomaly> getAnomalies() {
        return anomalies;
    }

    @Override
    public String toString() {
        return "AnomalyReport{generatedFrom=" + generatedFrom + ", anomalyCount=" + anomalies.size() + '}';
    }
}
