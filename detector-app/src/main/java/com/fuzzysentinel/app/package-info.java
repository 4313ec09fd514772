/**
 * Command-line runner for the fuzzy anomaly detector.
 *
 * <p>
 * Generates a synthetic baseline with a normal and an anomalous window,
 * scores both with the detector configured by
 * {@link com.fuzzysentinel.core.config.SettingsLoader} and prints one report
 * per window.
 * </p>
 *
 * <h3>Key classes</h3>
 * <ul>
 * <li>{@link com.fuzzysentinel.app.FuzzySentinelApp}: entry point</li>
 * <li>{@link com.fuzzysentinel.app.AppConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.fuzzysentinel.app.WindowScorer}: indicators and verdict per
 * window</li>
 * <li>{@link com.fuzzysentinel.app.ReportSerializer}: JSON and text
 * output</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.fuzzysentinel.app;
