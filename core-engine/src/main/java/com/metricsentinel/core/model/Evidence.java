package com.metricsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.util.Objects;

/**
 * Human-readable justification attached to an {@link Anomaly}, so consumers
 * do not need to re-derive the statistics.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Evidence implements Serializable {

    private static final long serialVersionUID = 1L;

    private final EvidenceType type;
    private final String content;
    private final String source;
    private final Long timestamp;
    private final double relevance;

    /**
     * @param type      evidence kind; must not be {@code null}
     * @param content   description; must not be {@code null}
     * @param source    where the underlying data came from
     * @param timestamp optional epoch millis the evidence refers to
     * @param relevance weight in [0, 1]
     * @throws IllegalArgumentException if {@code relevance} is outside [0, 1]
     */
    public Evidence(EvidenceType type, String content, String source, Long timestamp, double relevance) {
        this.type = Objects.requireNonNull(type, "Evidence type must not be null");
        this.content = Objects.requireNonNull(content, "Evidence content must not be null");
        this.source = source;
        this.timestamp = timestamp;
        if (!(relevance >= 0 && relevance <= 1)) {
            throw new IllegalArgumentException("relevance must be in [0, 1], got: " + relevance);
        }
        this.relevance = relevance;
    }

    public EvidenceType getType() {
        return type;
    }

    public String getContent() {
        return content;
    }

    public String getSource() {
        return source;
    }

    public Long getTimestamp() {
        return timestamp;
    }

    public double getRelevance() {
        return relevance;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Evidence that))
            return false;
        return type == that.type
                && content.equals(that.content)
                && Objects.equals(source, that.source)
                && Objects.equals(timestamp, that.timestamp)
                && Double.compare(relevance, that.relevance) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, content, source, timestamp, relevance);
    }

    @Override
    public String toString() {
        return "Evidence{type=" + type + ", content='" + content + "', relevance=" + relevance + '}';
    }
}
