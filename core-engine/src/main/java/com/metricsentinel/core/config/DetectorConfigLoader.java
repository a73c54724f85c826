package com.metricsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link DetectorConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * All {@code load*} methods call {@link DetectorConfig#validate()} after
 * parsing, so a misconfigured deployment fails at startup instead of
 * silently mis-classifying metrics.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "DETECTOR_CONFIG_PATH";

    /** Classpath resource shipped with the core engine. */
    public static final String DEFAULT_RESOURCE = "detector-config.yml";

    private DetectorConfigLoader() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load configuration using automatic resolution.
     *
     * <ol>
     * <li>If {@code DETECTOR_CONFIG_PATH} is set and the file exists, load from
     * there.</li>
     * <li>Otherwise, fall back to {@value #DEFAULT_RESOURCE} on the
     * classpath.</li>
     * </ol>
     *
     * @return parsed and validated configuration
     * @throws IllegalStateException if validation fails
     */
    public static DetectorConfig load() {
        return load(System.getenv(ENV_CONFIG_PATH));
    }

    /**
     * Load from {@code path} when it names an existing file, otherwise from the
     * default classpath resource.
     *
     * @param path optional file system path; may be {@code null} or blank
     * @return parsed and validated configuration
     * @throws IllegalStateException if validation fails
     */
    public static DetectorConfig load(String path) {
        if (path != null && !path.isBlank() && Files.exists(Path.of(path))) {
            LOG.info("Loading detector configuration from path: {}", path);
            return fromFile(path);
        }
        if (path != null && !path.isBlank()) {
            LOG.warn("Detector configuration path '{}' does not exist, using classpath {}",
                    path, DEFAULT_RESOURCE);
        }
        LOG.info("Loading detector configuration from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load configuration from a file system path.
     *
     * @param path absolute or relative path to the YAML file; must not be
     *             {@code null}
     * @return parsed and validated configuration
     * @throws NullPointerException     if {@code path} is {@code null}
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static DetectorConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Detector config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read detector config file: " + path, e);
        }
    }

    /**
     * Load configuration from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws NullPointerException     if {@code resource} is {@code null}
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static DetectorConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = DetectorConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static DetectorConfig parseAndValidate(InputStream is, String origin) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(DetectorConfig.class, options));

        DetectorConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed detector configuration in " + origin, e);
        }

        if (config == null) {
            LOG.warn("Detector configuration {} is empty, using built-in defaults", origin);
            config = DetectorConfig.defaults();
        }
        config.validate();

        LOG.info("Loaded detector configuration: {} threshold rule(s), {} categor(ies)",
                config.getThresholds().size(), config.getCategoryPatterns().size());
        return config;
    }
}
