package com.fuzzysentinel.app;

import java.util.Map;
import java.util.Objects;

/**
 * Typed, immutable configuration of the Fuzzy Sentinel runner.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the runner is configurable from a shell, Docker {@code -e} flags or a
 * scheduler's job definition.
 * </p>
 *
 * <table>
 * <caption>Environment variables</caption>
 * <tr><th>Variable</th><th>Default</th></tr>
 * <tr><td>{@code SYNTHETIC_SEED}</td><td>{@code 42}</td></tr>
 * <tr><td>{@code BASELINE_LENGTH}</td><td>{@code 500}</td></tr>
 * <tr><td>{@code WINDOW_LENGTH}</td><td>{@code 100}</td></tr>
 * <tr><td>{@code DETECTOR_SETTINGS_PATH}</td><td>empty: resolve via
 * {@link com.fuzzysentinel.core.config.SettingsLoader#load()}</td></tr>
 * <tr><td>{@code REPORT_FORMAT}</td><td>{@code text}</td></tr>
 * </table>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic and test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class AppConfig {

    /** Rows needed to compute a variance or a correlation. */
    static final int MIN_LENGTH = 2;

    // ---------------------------------------------------------------
    // Synthetic data
    // ---------------------------------------------------------------
    private final long seed;
    private final int baselineLength;
    private final int windowLength;

    // ---------------------------------------------------------------
    // Detector
    // ---------------------------------------------------------------
    private final String detectorSettingsPath;

    // ---------------------------------------------------------------
    // Output
    // ---------------------------------------------------------------
    private final ReportFormat reportFormat;

    private AppConfig(Builder b) {
        this.seed = b.seed;
        this.baselineLength = b.baselineLength;
        this.windowLength = b.windowLength;
        this.detectorSettingsPath = b.detectorSettingsPath;
        this.reportFormat = b.reportFormat;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build an {@link AppConfig} from the process environment.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static AppConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Build an {@link AppConfig} from the given variables.
     */
    static AppConfig fromEnvironment(Map<String, String> environment) {
        Objects.requireNonNull(environment, "Environment must not be null");
        try {
            return new Builder()
                    .seed(Long.parseLong(env(environment, "SYNTHETIC_SEED", "42")))
                    .baselineLength(Integer.parseInt(env(environment, "BASELINE_LENGTH", "500")))
                    .windowLength(Integer.parseInt(env(environment, "WINDOW_LENGTH", "100")))
                    .detectorSettingsPath(env(environment, "DETECTOR_SETTINGS_PATH", ""))
                    .reportFormat(ReportFormat.fromName(env(environment, "REPORT_FORMAT", "text")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public long getSeed() {
        return seed;
    }

    public int getBaselineLength() {
        return baselineLength;
    }

    public int getWindowLength() {
        return windowLength;
    }

    /**
     * @return explicit settings file, or an empty string to use the default
     *         resolution
     */
    public String getDetectorSettingsPath() {
        return detectorSettingsPath;
    }

    public ReportFormat getReportFormat() {
        return reportFormat;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link AppConfig}.
     *
     * <p>
     * The {@link #build()} method validates that both lengths are at least
     * {@value AppConfig#MIN_LENGTH} and that a report format is set.
     * </p>
     */
    public static class Builder {
        private long seed = 42L;
        private int baselineLength = 500;
        private int windowLength = 100;
        private String detectorSettingsPath = "";
        private ReportFormat reportFormat = ReportFormat.TEXT;

        public Builder seed(long v) {
            this.seed = v;
            return this;
        }

        public Builder baselineLength(int v) {
            this.baselineLength = v;
            return this;
        }

        public Builder windowLength(int v) {
            this.windowLength = v;
            return this;
        }

        public Builder detectorSettingsPath(String v) {
            this.detectorSettingsPath = v;
            return this;
        }

        public Builder reportFormat(ReportFormat v) {
            this.reportFormat = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link AppConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public AppConfig build() {
            Objects.requireNonNull(detectorSettingsPath, "detectorSettingsPath required");
            Objects.requireNonNull(reportFormat, "reportFormat required");

            if (baselineLength < MIN_LENGTH) {
                throw new IllegalArgumentException(
                        "baselineLength must be >= " + MIN_LENGTH + ", got: " + baselineLength);
            }
            if (windowLength < MIN_LENGTH) {
                throw new IllegalArgumentException(
                        "windowLength must be >= " + MIN_LENGTH + ", got: " + windowLength);
            }

            return new AppConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(Map<String, String> environment, String name, String defaultValue) {
        String value = environment.get(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "AppConfig{" +
                "seed=" + seed +
                ", baselineLength=" + baselineLength +
                ", windowLength=" + windowLength +
                ", detectorSettingsPath='" + detectorSettingsPath + '\'' +
                ", reportFormat=" + reportFormat +
                '}';
    }
}
