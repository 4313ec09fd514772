package com.fuzzysentinel.core.config;

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
 * Reads the detector's {@code ruleBase}, {@code coveragePolicy} and
 * {@code resolution} from YAML.
 *
 * <p>
 * A path named by {@value #ENV_SETTINGS_PATH} wins when that file exists;
 * otherwise the bundled {@value #DEFAULT_RESOURCE} is used. Callers with
 * their own location go through {@link #fromFile(String)} or
 * {@link #fromClasspath(String)} directly.
 * </p>
 *
 * <p>
 * Parse failures and out-of-range values surface as
 * {@link IllegalStateException} before any detector is built. A document
 * with no keys at all yields {@link DetectorSettings} defaults.
 * </p>
 *
 * @since 1.0.0
 */
public final class SettingsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SettingsLoader.class);

    /** Environment variable that can override the default settings location. */
    public static final String ENV_SETTINGS_PATH = "FUZZY_SETTINGS_PATH";

    /** Classpath resource used when nothing else is configured. */
    public static final String DEFAULT_RESOURCE = "detector.yml";

    private SettingsLoader() {
        // utility class
    }

    /**
     * Settings for a detector started without an explicit location: the
     * {@value #ENV_SETTINGS_PATH} file if present, else the bundled defaults.
     *
     * @return validated settings
     * @throws IllegalStateException if the chosen document is invalid
     */
    public static DetectorSettings load() {
        String envPath = System.getenv(ENV_SETTINGS_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading detector settings from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading detector settings from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path YAML file, absolute or relative to the working directory
     * @return validated settings
     * @throws NullPointerException     if {@code path} is {@code null}
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static DetectorSettings fromFile(String path) {
        Objects.requireNonNull(path, "Settings file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Settings file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings file: " + path, e);
        }
    }

    /**
     * @param resource name of a YAML resource visible to this class loader
     * @return validated settings
     * @throws NullPointerException     if {@code resource} is {@code null}
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static DetectorSettings fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = SettingsLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static DetectorSettings parseAndValidate(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(DetectorSettings.class, options));

        DetectorSettings settings;
        try {
            // null for an empty document
            settings = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed detector settings in " + source + ": " + e.getMessage(), e);
        }

        if (settings == null) {
            LOG.warn("Detector settings in {} are empty; using defaults", source);
            settings = new DetectorSettings();
        }
        settings.validate();

        LOG.info("Loaded {}", settings);
        return settings;
    }
}
