package com.fuzzysentinel.core.detection;

import com.fuzzysentinel.core.config.DetectorSettings;
import com.fuzzysentinel.core.config.SettingsLoader;
import com.fuzzysentinel.core.inference.CoveragePolicy;
import com.fuzzysentinel.core.model.Outcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectorFactory}.
 */
class DetectorFactoryTest {

    @Test
    @DisplayName("Should create a canonical detector from default settings")
    void shouldCreateFromDefaultSettings() {
        AnomalyDetector detector = DetectorFactory.create(new DetectorSettings());

        assertThat(detector).isInstanceOf(FuzzyAnomalyDetector.class);
        FuzzyAnomalyDetector fuzzy = (FuzzyAnomalyDetector) detector;
        assertThat(fuzzy.getConfig().getRuleBase().size()).isEqualTo(9);
        assertThat(fuzzy.getConfig().getCoveragePolicy()).isEqualTo(CoveragePolicy.UNDETERMINED);
    }

    @Test
    @DisplayName("Should apply preset, policy and resolution from settings")
    void shouldApplyLoadedSettings() {
        FuzzyAnomalyDetector detector = (FuzzyAnomalyDetector) DetectorFactory.create(
                SettingsLoader.fromClasspath("test-detector.yml"));

        assertThat(detector.getConfig().getRuleBase().size()).isEqualTo(14);
        assertThat(detector.getConfig().getCoveragePolicy()).isEqualTo(CoveragePolicy.NEAREST_RULE);
        assertThat(detector.getConfig().getResolution()).isEqualTo(0.05);
        assertThat(detector.evaluate(1.0, 0.0, 0.0).getOutcome()).isEqualTo(Outcome.INTERPOLATED);
    }

    @Test
    @DisplayName("Should throw for invalid settings")
    void shouldThrowForInvalidSettings() {
        DetectorSettings settings = new DetectorSettings();
        settings.setRuleBase("unknown");

        assertThatThrownBy(() -> DetectorFactory.create(settings))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("unknown");
    }

    @Test
    @DisplayName("Should create a detector from the bundled settings")
    void shouldCreateDefault() {
        AnomalyDetector detector = DetectorFactory.createDefault();

        assertThat(detector.evaluate(0.0, 0.0, 0.0).getLabel()).isEqualTo("normal");
    }
}
