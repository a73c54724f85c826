package com.metricsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Anomaly emitted when a detector fires on a metric series.
 *
 * <p>
 * Instances are immutable and ready for JSON serialization by a reporting or
 * alerting consumer. {@code endTime} is only set by detectors that describe a
 * span (trend); point-in-time detectors leave it {@code null}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code id}, {@code type}, {@code severity},
 * {@code method} and {@code metric} are required; {@code confidence} must be
 * within [0, 1].
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Anomaly implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final AnomalyType type;
    private final SeverityLevel severity;
    private final DetectionMethod method;

    /** Name of the metric the anomaly was found in. */
    private final String metric;

    private final long startTime;
    private final Long endTime;

    /** Observed value that triggered the anomaly. */
    private final double current;

    /** Reference value the observation was compared against. */
    private final double baseline;

    private final double deviation;
    private final double confidence;
    private final String description;
    private final List<Evidence> evidence;

    private Anomaly(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.method = Objects.requireNonNull(builder.method, "method must not be null");
        this.metric = Objects.requireNonNull(builder.metric, "metric must not be null");
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
        this.current = builder.current;
        this.baseline = builder.baseline;
        this.deviation = builder.deviation;
        if (!(builder.confidence >= 0 && builder.confidence <= 1)) {
            throw new IllegalArgumentException(
                    "confidence must be in [0, 1], got: " + builder.confidence);
        }
        this.confidence = builder.confidence;
        this.description = builder.description;
        this.evidence = List.copyOf(builder.evidence);
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Anomaly} instances.
     */
    public static class Builder {
        private String id;
        private AnomalyType type;
        private SeverityLevel severity;
        private DetectionMethod method;
        private String metric;
        private long startTime;
        private Long endTime;
        private double current;
        private double baseline;
        private double deviation;
        private double confidence;
        private String description;
        private final List<Evidence> evidence = new ArrayList<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(AnomalyType type) {
            this.type = type;
            return this;
        }

        public Builder severity(SeverityLevel severity) {
            this.severity = severity;
            return this;
        }

        public Builder method(DetectionMethod method) {
            this.method = method;
            return this;
        }

        public Builder metric(String metric) {
            this.metric = metric;
            return this;
        }

        public Builder startTime(long startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Long endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder current(double current) {
            this.current = current;
            return this;
        }

        public Builder baseline(double baseline) {
            this.baseline = baseline;
            return this;
        }

        public Builder deviation(double deviation) {
            this.deviation = deviation;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder evidence(Evidence evidence) {
            this.evidence.add(Objects.requireNonNull(evidence, "evidence must not be null"));
            return this;
        }

        /**
         * Build the anomaly.
         *
         * @return a new {@link Anomaly}
         * @throws NullPointerException     if a required field is missing
         * @throws IllegalArgumentException if confidence is outside [0, 1]
         */
        public Anomaly build() {
            return new Anomaly(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public AnomalyType getType() {
        return type;
    }

    public SeverityLevel getSeverity() {
        return severity;
    }

    public DetectionMethod getMethod() {
        return method;
    }

    public String getMetric() {
        return metric;
    }

    public long getStartTime() {
        return startTime;
    }

    public Long getEndTime() {
        return endTime;
    }

    public double getCurrent() {
        return current;
    }

    public double getBaseline() {
        return baseline;
    }

    public double getDeviation() {
        return deviation;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return unmodifiable evidence list
     */
    public List<Evidence> getEvidence() {
        return evidence;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Anomaly that))
            return false;
        return id.equals(that.id)
                && type == that.type
                && severity == that.severity
                && method == that.method
                && metric.equals(that.metric)
                && startTime == that.startTime
                && Objects.equals(endTime, that.endTime)
                && Double.compare(current, that.current) == 0
                && Double.compare(baseline, that.baseline) == 0
                && Double.compare(deviation, that.deviation) == 0
                && Double.compare(confidence, that.confidence) == 0
                && Objects.equals(description, that.description)
                && evidence.equals(that.evidence);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, severity, method, metric, startTime, endTime,
                current, baseline, deviation, confidence, description, evidence);
    }

    @Override
    public String toString() {
        return "Anomaly{" +
                "id='" + id + '\'' +
                ", type=" + type +
                ", severity=" + severity +
                ", confidence=" + confidence +
                ", description='" + description + '\'' +
                '}';
    }
}
