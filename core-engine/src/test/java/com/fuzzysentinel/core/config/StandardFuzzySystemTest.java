package com.fuzzysentinel.core.config;

import com.fuzzysentinel.core.inference.CoveragePolicy;
import com.fuzzysentinel.core.inference.InferenceConfig;
import com.fuzzysentinel.core.model.LinguisticVariable;
import com.fuzzysentinel.core.model.UnknownTermException;
import com.fuzzysentinel.core.rules.Rule;
import com.fuzzysentinel.core.rules.RuleBase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.fuzzysentinel.core.rules.Antecedent.term;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link StandardFuzzySystem}, {@link DetectorSettings} and
 * {@link RuleBasePreset}.
 */
class StandardFuzzySystemTest {

    @Test
    @DisplayName("Should declare low, medium and high on every indicator")
    void shouldDeclareIndicatorVocabulary() {
        LinguisticVariable ep = StandardFuzzySystem.forecastError();

        assertThat(ep.getName()).isEqualTo(StandardFuzzySystem.FORECAST_ERROR);
        assertThat(ep.getMin()).isZero();
        assertThat(ep.getMax()).isEqualTo(1.0);
        assertThat(ep.getSetNames()).containsExactly("low", "medium", "high");
        assertThat(StandardFuzzySystem.varianceChange().getSetNames()).containsExactly("low", "medium", "high");
        assertThat(StandardFuzzySystem.correlationChange().getSetNames()).containsExactly("low", "medium", "high");
    }

    @Test
    @DisplayName("Should declare four anomaly levels over [0, 10]")
    void shouldDeclareOutputVocabulary() {
        LinguisticVariable level = StandardFuzzySystem.anomalyLevel();

        assertThat(level.getMin()).isZero();
        assertThat(level.getMax()).isEqualTo(10.0);
        assertThat(level.getSetNames()).containsExactly(
                "normal", "slightly_anomalous", "moderately_anomalous", "strongly_anomalous");
    }

    @Test
    @DisplayName("Should provide nine canonical and fourteen pairwise rules")
    void shouldProvidePresets() {
        RuleBase canonical = StandardFuzzySystem.ruleBase(RuleBasePreset.CANONICAL);
        RuleBase pairwise = StandardFuzzySystem.ruleBase(RuleBasePreset.PAIRWISE);

        assertThat(canonical.size()).isEqualTo(9);
        assertThat(pairwise.size()).isEqualTo(14);
        assertThat(canonical.getRules()).extracting(Rule::getWeight).containsOnly(Rule.DEFAULT_WEIGHT);
        assertThat(canonical.getRules().get(0).getName()).isEqualTo("normal_all_low");
    }

    @Test
    @DisplayName("Should build the default configuration")
    void shouldBuildDefaultConfig() {
        InferenceConfig config = StandardFuzzySystem.defaultConfig();

        assertThat(config.getInputs()).hasSize(3);
        assertThat(config.getOutput().getName()).isEqualTo(StandardFuzzySystem.ANOMALY_LEVEL);
        assertThat(config.getRuleBase().size()).isEqualTo(9);
        assertThat(config.getCoveragePolicy()).isEqualTo(CoveragePolicy.UNDETERMINED);
    }

    @Test
    @DisplayName("Should reject a custom rule outside the vocabulary")
    void shouldRejectCustomRuleWithUnknownTerm() {
        RuleBase rules = RuleBase.builder()
                .addRule("extreme", term(StandardFuzzySystem.FORECAST_ERROR, "extreme"), "strongly_anomalous")
                .build();

        assertThatThrownBy(() -> StandardFuzzySystem.config(rules, 0.01, CoveragePolicy.UNDETERMINED))
                .isInstanceOf(UnknownTermException.class)
                .hasMessageContaining("extreme");
    }

    @Test
    @DisplayName("Should parse preset names case-insensitively")
    void shouldParsePresetNames() {
        assertThat(RuleBasePreset.fromName("Canonical")).isEqualTo(RuleBasePreset.CANONICAL);
        assertThat(RuleBasePreset.fromName(" pairwise ")).isEqualTo(RuleBasePreset.PAIRWISE);
        assertThatThrownBy(() -> RuleBasePreset.fromName("sugeno"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Supported");
    }

    @Test
    @DisplayName("Should validate settings and collect every error")
    void shouldValidateSettings() {
        DetectorSettings settings = new DetectorSettings();
        settings.setRuleBase("mystery");
        settings.setCoveragePolicy(null);
        settings.setResolution(-1);

        assertThatThrownBy(settings::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("mystery")
                .hasMessageContaining("Coverage policy")
                .hasMessageContaining("resolution");
    }

    @Test
    @DisplayName("Should stop startup on a resolution too fine to sample")
    void shouldRejectTooFineResolution() {
        DetectorSettings settings = new DetectorSettings();
        settings.setResolution(1e-10);

        assertThatThrownBy(settings::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("resolution");
        assertThatThrownBy(() -> StandardFuzzySystem.config(RuleBasePreset.CANONICAL, 1e-10, CoveragePolicy.UNDETERMINED))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("intervals");

        settings.setResolution(DetectorSettings.MIN_RESOLUTION);
        settings.validate();
        assertThat(StandardFuzzySystem.config(RuleBasePreset.CANONICAL, DetectorSettings.MIN_RESOLUTION,
                CoveragePolicy.UNDETERMINED).getResolution()).isEqualTo(DetectorSettings.MIN_RESOLUTION);
    }

    @Test
    @DisplayName("Should normalise settings names to lowercase")
    void shouldNormaliseSettingNames() {
        DetectorSettings settings = new DetectorSettings();
        settings.setRuleBase("PAIRWISE");
        settings.setCoveragePolicy("Nearest_Rule");

        assertThat(settings.getRuleBase()).isEqualTo("pairwise");
        assertThat(settings.policy()).isEqualTo(CoveragePolicy.NEAREST_RULE);
    }
}
