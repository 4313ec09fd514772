package com.fuzzysentinel.app;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AppConfig}.
 */
class AppConfigTest {

    @Test
    @DisplayName("Should use defaults when no variable is set")
    void shouldUseDefaults() {
        AppConfig config = AppConfig.fromEnvironment(Collections.emptyMap());

        assertThat(config.getSeed()).isEqualTo(42L);
        assertThat(config.getBaselineLength()).isEqualTo(500);
        assertThat(config.getWindowLength()).isEqualTo(100);
        assertThat(config.getDetectorSettingsPath()).isEmpty();
        assertThat(config.getReportFormat()).isEqualTo(ReportFormat.TEXT);
    }

    @Test
    @DisplayName("Should read every variable from the environment")
    void shouldReadEnvironment() {
        AppConfig config = AppConfig.fromEnvironment(Map.of(
                "SYNTHETIC_SEED", "7",
                "BASELINE_LENGTH", "200",
                "WINDOW_LENGTH", " 50 ",
                "DETECTOR_SETTINGS_PATH", "/etc/fuzzy/detector.yml",
                "REPORT_FORMAT", "JSON"));

        assertThat(config.getSeed()).isEqualTo(7L);
        assertThat(config.getBaselineLength()).isEqualTo(200);
        assertThat(config.getWindowLength()).isEqualTo(50);
        assertThat(config.getDetectorSettingsPath()).isEqualTo("/etc/fuzzy/detector.yml");
        assertThat(config.getReportFormat()).isEqualTo(ReportFormat.JSON);
    }

    @Test
    @DisplayName("Should ignore blank variables")
    void shouldIgnoreBlankValues() {
        AppConfig config = AppConfig.fromEnvironment(Map.of("WINDOW_LENGTH", "  "));

        assertThat(config.getWindowLength()).isEqualTo(100);
    }

    @Test
    @DisplayName("Should throw when a numeric variable cannot be parsed")
    void shouldRejectNonNumericValue() {
        assertThatThrownBy(() -> AppConfig.fromEnvironment(Map.of("BASELINE_LENGTH", "many")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("numeric");
    }

    @Test
    @DisplayName("Should reject windows too short for a variance")
    void shouldRejectShortWindow() {
        assertThatThrownBy(() -> new AppConfig.Builder().windowLength(1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("windowLength");
        assertThatThrownBy(() -> new AppConfig.Builder().baselineLength(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("baselineLength");
    }

    @Test
    @DisplayName("Should reject an unknown report format")
    void shouldRejectUnknownFormat() {
        assertThatThrownBy(() -> AppConfig.fromEnvironment(Map.of("REPORT_FORMAT", "xml")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("xml");
    }
}
