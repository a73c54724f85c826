package com.metricsentinel.job;

import java.time.Duration;
import java.util.Objects;

/**
 * Typed, immutable configuration object for the Metric Sentinel batch job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the job is configurable from a shell, a Docker {@code -e} flag or a
 * scheduler's job definition.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig {

    /** Path value meaning stdin for input and stdout for output. */
    public static final String STANDARD_STREAM = "-";

    // ---------------------------------------------------------------
    // I/O
    // ---------------------------------------------------------------
    private final String inputPath;
    private final String outputPath;

    // ---------------------------------------------------------------
    // Analyzer
    // ---------------------------------------------------------------
    private final int parallelism;
    private final long deadlineMs;

    // ---------------------------------------------------------------
    // Detector configuration
    // ---------------------------------------------------------------
    private final String detectorConfigPath;

    private JobConfig(Builder b) {
        this.inputPath = b.inputPath;
        this.outputPath = b.outputPath;
        this.parallelism = b.parallelism;
        this.deadlineMs = b.deadlineMs;
        this.detectorConfigPath = b.detectorConfigPath;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return new Builder()
                    .inputPath(env("METRICS_INPUT_PATH", STANDARD_STREAM))
                    .outputPath(env("ANOMALY_OUTPUT_PATH", STANDARD_STREAM))
                    .parallelism(parseIntEnv("ANALYZER_PARALLELISM", "1"))
                    .deadlineMs(parseLongEnv("ANALYZER_DEADLINE_MS", "0"))
                    .detectorConfigPath(env("DETECTOR_CONFIG_PATH", ""))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Derived values
    // ---------------------------------------------------------------

    public boolean readsStdin() {
        return STANDARD_STREAM.equals(inputPath);
    }

    public boolean writesStdout() {
        return STANDARD_STREAM.equals(outputPath);
    }

    /**
     * @return {@code true} when series should be fanned out onto a thread
     *         pool
     */
    public boolean isConcurrent() {
        return parallelism > 1;
    }

    /**
     * @return the analysis deadline, or {@link Duration#ZERO} for none
     */
    public Duration getDeadline() {
        return Duration.ofMillis(deadlineMs);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getInputPath() {
        return inputPath;
    }

    public String getOutputPath() {
        return outputPath;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getDeadlineMs() {
        return deadlineMs;
    }

    public String getDetectorConfigPath() {
        return detectorConfigPath;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (parallelism &gt;= 1, deadline &gt;= 0, non-blank paths).
     * </p>
     */
    public static class Builder {
        private String inputPath = STANDARD_STREAM;
        private String outputPath = STANDARD_STREAM;
        private int parallelism = 1;
        private long deadlineMs = 0;
        private String detectorConfigPath = "";

        public Builder inputPath(String v) {
            this.inputPath = v;
            return this;
        }

        public Builder outputPath(String v) {
            this.outputPath = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder deadlineMs(long v) {
            this.deadlineMs = v;
            return this;
        }

        public Builder detectorConfigPath(String v) {
            this.detectorConfigPath = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            requireNonBlank(inputPath, "inputPath");
            requireNonBlank(outputPath, "outputPath");
            Objects.requireNonNull(detectorConfigPath, "detectorConfigPath required");

            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (deadlineMs < 0) {
                throw new IllegalArgumentException("deadlineMs must be >= 0, got: " + deadlineMs);
            }

            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    private static long parseLongEnv(String name, String defaultValue) {
        return Long.parseLong(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "inputPath='" + inputPath + '\'' +
                ", outputPath='" + outputPath + '\'' +
                ", parallelism=" + parallelism +
                ", deadlineMs=" + deadlineMs +
                ", detectorConfigPath='" + detectorConfigPath + '\'' +
                '}';
    }
}
