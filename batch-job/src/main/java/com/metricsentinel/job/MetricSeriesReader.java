package com.metricsentinel.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.metricsentinel.core.model.MetricSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Reads a batch of already-materialized metric series from JSON.
 *
 * <p>
 * Expected document shape:
 * </p>
 *
 * <pre>
 * {"series": [
 *   {"name": "api_latency_p95", "unit": "ms",
 *    "dataPoints": [{"timestamp": 1700000000000, "value": 120.5, "labels": {"host": "a"}}],
 *    "metadata": {"source": "PROMETHEUS", "interval": "1m", "aggregation": "P95"}}
 * ]}
 * </pre>
 *
 * <p>
 * Unknown properties are ignored. Unlike a streaming source, a batch either
 * parses as a whole or fails: malformed input raises an
 * {@link IllegalStateException} rather than being skipped.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricSeriesReader {

    private static final Logger LOG = LoggerFactory.getLogger(MetricSeriesReader.class);

    private final ObjectMapper mapper;

    public MetricSeriesReader() {
        this.mapper = new ObjectMapper();
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Read series from a file.
     *
     * @param path file path; must not be {@code null}
     * @return series in document order
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if the file cannot be read or parsed
     */
    public List<MetricSeries> read(Path path) {
        Objects.requireNonNull(path, "Input path must not be null");
        try (InputStream in = Files.newInputStream(path)) {
            return read(in, path.toString());
        } catch (NoSuchFileException | FileNotFoundException e) {
            throw new IllegalArgumentException("Metrics input file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read metrics input: " + path, e);
        }
    }

    /**
     * Read series from a stream. The stream is not closed.
     *
     * @param in     JSON input; must not be {@code null}
     * @param origin description of the input for messages
     * @return series in document order
     * @throws IllegalStateException if the input cannot be parsed
     */
    public List<MetricSeries> read(InputStream in, String origin) {
        Objects.requireNonNull(in, "Input stream must not be null");
        MetricBatch batch;
        try {
            batch = mapper.readValue(in, MetricBatch.class);
        } catch (IOException | RuntimeException e) {
            throw new IllegalStateException("Malformed metrics input in " + origin + ": " + e.getMessage(), e);
        }
        if (batch == null) {
            throw new IllegalStateException("Empty metrics input in " + origin);
        }
        LOG.info("Read {} metric series from {}", batch.series.size(), origin);
        return batch.series;
    }

    /**
     * Top-level input document.
     */
    static final class MetricBatch {

        private final List<MetricSeries> series;

        @JsonCreator
        MetricBatch(@JsonProperty("series") List<MetricSeries> series) {
            if (series == null) {
                this.series = List.of();
            } else {
                this.series = List.copyOf(series);
            }
        }
    }
}
