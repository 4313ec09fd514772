/**
 * Detector configuration.
 *
 * <p>
 * {@link com.fuzzysentinel.core.config.StandardFuzzySystem} defines the
 * anomaly vocabulary and its built-in rule bases. Runtime choices (rule base,
 * coverage policy, resolution) are read from YAML by
 * {@link com.fuzzysentinel.core.config.SettingsLoader} into
 * {@link com.fuzzysentinel.core.config.DetectorSettings}, validated right
 * after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.fuzzysentinel.core.config;
