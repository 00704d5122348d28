package com.alertsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads the alerting YAML into an {@link AlertingConfig}. Duplicate keys are
 * a parse error and the result is always validated, so a pipeline is never
 * built from a half-valid file.
 *
 * @since 1.0.0
 */
public final class AlertingConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(AlertingConfigLoader.class);

    /** Path of the YAML file to use instead of the classpath default. */
    public static final String ENV_CONFIG_PATH = "ALERTING_CONFIG_PATH";

    /** Resource looked up when the environment names no file. */
    public static final String DEFAULT_RESOURCE = "alerting.yml";

    private AlertingConfigLoader() {
        // utility class, not instantiable
    }

    /**
     * File named by {@value #ENV_CONFIG_PATH} when it exists, otherwise
     * {@value #DEFAULT_RESOURCE} from the classpath, otherwise no rules and
     * default settings.
     *
     * @throws IllegalStateException if the chosen source is invalid
     */
    public static AlertingConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading alerting config from environment path: {}", envPath);
            return fromFile(envPath);
        }
        if (AlertingConfigLoader.class.getClassLoader().getResource(DEFAULT_RESOURCE) != null) {
            LOG.info("Loading alerting config from classpath: {}", DEFAULT_RESOURCE);
            return fromClasspath(DEFAULT_RESOURCE);
        }
        LOG.warn("No alerting config found – using defaults with no rules");
        return new AlertingConfig();
    }

    /**
     * @throws IllegalArgumentException if there is no file at {@code path}
     * @throws IllegalStateException    if it cannot be read or is invalid
     */
    public static AlertingConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Alerting config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read alerting config file: " + path, e);
        }
    }

    /**
     * @throws IllegalArgumentException if {@code resource} is not on the
     *                                  classpath
     * @throws IllegalStateException    if it cannot be read or is invalid
     */
    public static AlertingConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = AlertingConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static AlertingConfig parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(AlertingConfig.class, options));
        AlertingConfig config = yaml.load(is);

        if (config == null) {
            LOG.warn("Alerting configuration is empty – using defaults");
            config = new AlertingConfig();
        }
        config.validate();

        LOG.info("Loaded {} alert rule(s) and {} maintenance window(s)",
                config.getRules().size(), config.getMaintenanceWindows().size());
        return config;
    }
}
