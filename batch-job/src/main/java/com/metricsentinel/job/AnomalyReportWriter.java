package com.metricsentinel.job;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes an {@link AnomalyReport} as indented JSON. Null fields, such as the
 * end time of a point anomaly, are omitted.
 *
 * @since 1.0.0
 */
public class AnomalyReportWriter {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyReportWriter.class);

    private final ObjectMapper mapper;

    public AnomalyReportWriter() {
        this.mapper = new ObjectMapper();
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.mapper.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        this.mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * Write the report to a file, replacing any existing content.
     *
     * @throws IllegalStateException if the file cannot be written
     */
    public void write(AnomalyReport report, Path path) {
        Objects.requireNonNull(path, "Output path must not be null");
        try (OutputStream out = Files.newOutputStream(path)) {
            write(report, out);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write anomaly report: " + path, e);
        }
        LOG.info("Wrote {} anomal(ies) to {}", report.getAnomalyCount(), path);
    }

    /**
     * Write the report to a stream. The stream is flushed but not closed.
     *
     * @throws IllegalStateException if serialization or writing fails
     */
    public void write(AnomalyReport report, OutputStream out) {
        Objects.requireNonNull(report, "AnomalyReport must not be null");
        Objects.requireNonNull(out, "Output stream must not be null");
        try {
            mapper.writeValue(out, report);
            out.write(System.lineSeparator().getBytes(StandardCharsets.UTF_8));
            out.flush();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize anomaly report: " + e.getMessage(), e);
        }
    }

    /**
     * @return the report as an indented JSON string
     */
    public String toJson(AnomalyReport report) {
        Objects.requireNonNull(report, "AnomalyReport must not be null");
        try {
            return mapper.writeValueAsString(report);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize anomaly report: " + e.getMessage(), e);
        }
    }
}
