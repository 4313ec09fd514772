package com.fuzzysentinel.core.detection;

import com.fuzzysentinel.core.config.DetectorSettings;
import com.fuzzysentinel.core.config.SettingsLoader;
import com.fuzzysentinel.core.config.StandardFuzzySystem;
import com.fuzzysentinel.core.inference.InferenceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Factory that creates {@link AnomalyDetector} instances from
 * {@link DetectorSettings}.
 *
 * <p>
 * The settings pick a built-in rule base and a coverage policy; the
 * vocabulary is always the standard one from {@link StandardFuzzySystem}.
 * Any configuration error surfaces here, at startup.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class
    }

    /**
     * Create a detector for the given settings.
     *
     * @param settings detector settings; must not be {@code null}
     * @return a ready-to-use detector
     * @throws NullPointerException  if {@code settings} is {@code null}
     * @throws IllegalStateException if the settings are invalid
     */
    public static AnomalyDetector create(DetectorSettings settings) {
        Objects.requireNonNull(settings, "DetectorSettings must not be null");
        settings.validate();

        InferenceConfig config = StandardFuzzySystem.config(
                settings.rulePreset(), settings.getResolution(), settings.policy());
        LOG.info("Creating fuzzy anomaly detector: {}", config);
        return new FuzzyAnomalyDetector(config);
    }

    /**
     * Create a detector from settings resolved by {@link SettingsLoader#load()}.
     *
     * @return a ready-to-use detector
     * @throws IllegalStateException if the settings are invalid
     */
    public static AnomalyDetector createDefault() {
        return create(SettingsLoader.load());
    }
}
