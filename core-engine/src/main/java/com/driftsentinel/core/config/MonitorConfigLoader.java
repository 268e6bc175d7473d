package com.driftsentinel.core.config;

import com.driftsentinel.core.model.ValidationException;
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
 * Loads and validates a {@link MonitorConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <p>
 * Every {@code from*} method validates after parsing, so a bad file fails at
 * start-up instead of producing a monitor with undefined thresholds.
 * </p>
 *
 * @since 1.0.0
 */
public final class MonitorConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(MonitorConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "MONITOR_CONFIG_PATH";

    /** Classpath resource used when no path is configured. */
    public static final String DEFAULT_RESOURCE = "monitor.yml";

    private MonitorConfigLoader() {
        // utility class
    }

    /**
     * Load using automatic resolution: {@code MONITOR_CONFIG_PATH} if set and
     * the file exists, otherwise {@value #DEFAULT_RESOURCE} on the classpath,
     * otherwise built-in defaults.
     *
     * @return validated configuration
     * @throws ValidationException if the configuration is invalid
     */
    public static MonitorConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading monitor configuration from environment path: {}", envPath);
            return fromFile(envPath);
        }
        if (MonitorConfigLoader.class.getClassLoader().getResource(DEFAULT_RESOURCE) != null) {
            LOG.info("Loading monitor configuration from classpath: {}", DEFAULT_RESOURCE);
            return fromClasspath(DEFAULT_RESOURCE);
        }
        LOG.warn("No monitor configuration found, using defaults");
        return MonitorConfig.defaults();
    }

    /**
     * Load from a file system path.
     *
     * @param path path to the YAML file; must not be {@code null}
     * @return validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading fails
     * @throws ValidationException      if the configuration is invalid
     */
    public static MonitorConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Monitor config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read monitor config file: " + path, e);
        }
    }

    /**
     * Load from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading fails
     * @throws ValidationException      if the configuration is invalid
     */
    public static MonitorConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = MonitorConfigLoader.class.getClassLoader().getResourceAsStream(resource);
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

    private static MonitorConfig parseAndValidate(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(MonitorConfigFile.class, options));

        MonitorConfigFile file;
        try {
            file = yaml.load(is);
        } catch (YAMLException e) {
            throw new ValidationException("Malformed monitor configuration in " + source + ": " + e.getMessage());
        }

        if (file == null) {
            LOG.warn("Monitor configuration {} is empty, using defaults", source);
            return MonitorConfig.defaults();
        }

        MonitorConfig config = file.toConfig();
        LOG.info("Loaded monitor configuration from {}: {}", source, config);
        return config;
    }
}
