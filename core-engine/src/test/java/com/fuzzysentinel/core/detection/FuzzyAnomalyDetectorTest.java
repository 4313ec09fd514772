package com.fuzzysentinel.core.detection;

import com.fuzzysentinel.core.config.RuleBasePreset;
import com.fuzzysentinel.core.config.StandardFuzzySystem;
import com.fuzzysentinel.core.inference.CoveragePolicy;
import com.fuzzysentinel.core.inference.InferenceConfig;
import com.fuzzysentinel.core.inference.InputOutOfRangeException;
import com.fuzzysentinel.core.model.EvaluationResult;
import com.fuzzysentinel.core.model.Indicators;
import com.fuzzysentinel.core.model.InvalidShapeException;
import com.fuzzysentinel.core.model.LinguisticVariable;
import com.fuzzysentinel.core.model.Outcome;
import com.fuzzysentinel.core.rules.RuleBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link FuzzyAnomalyDetector}.
 */
class FuzzyAnomalyDetectorTest {

    private static final Set<String> LABELS = Set.of(
            "normal", "slightly_anomalous", "moderately_anomalous", "strongly_anomalous",
            EvaluationResult.UNDETERMINED_LABEL);

    private FuzzyAnomalyDetector detector;

    @BeforeEach
    void setUp() {
        detector = new FuzzyAnomalyDetector(StandardFuzzySystem.defaultConfig());
    }

    @Test
    @DisplayName("Should score a quiet window as normal")
    void shouldScoreQuietWindowAsNormal() {
        EvaluationResult result = detector.evaluate(0.0, 0.0, 0.0);

        assertThat(result.getScore()).isCloseTo(1.0, within(0.01));
        assertThat(result.getLabel()).isEqualTo("normal");
    }

    @Test
    @DisplayName("Should score a window with every indicator high as strongly anomalous")
    void shouldScoreLoudWindowAsStrong() {
        EvaluationResult result = detector.evaluate(new Indicators(1.0, 1.0, 1.0));

        assertThat(result.getScore()).isCloseTo(8.67, within(0.01));
        assertThat(result.getLabel()).isEqualTo("strongly_anomalous");
    }

    @Test
    @DisplayName("Should score all-medium indicators as moderately anomalous")
    void shouldScoreMediumWindowAsModerate() {
        EvaluationResult result = detector.evaluate(0.5, 0.5, 0.5);

        assertThat(result.getScore()).isCloseTo(5.0, within(0.01));
        assertThat(result.getLabel()).isEqualTo("moderately_anomalous");
    }

    @Test
    @DisplayName("Should return undetermined for a combination no rule covers")
    void shouldReturnUndeterminedForUncoveredInputs() {
        EvaluationResult result = detector.evaluate(0.0, 0.0, 1.0);

        assertThat(result.getScore()).isEqualTo(5.0);
        assertThat(result.getLabel()).isEqualTo(EvaluationResult.UNDETERMINED_LABEL);
        assertThat(result.getOutcome()).isEqualTo(Outcome.UNDETERMINED);
    }

    @Test
    @DisplayName("Should never decrease as the forecast error rises alone")
    void shouldBeMonotonicInForecastError() {
        double previous = detector.evaluate(0.0, 0.0, 0.0).getScore();
        for (int i = 1; i <= 20; i++) {
            double score = detector.evaluate(i / 20.0, 0.0, 0.0).getScore();
            assertThat(score).as("score at ep=%s", i / 20.0).isGreaterThanOrEqualTo(previous - 1e-6);
            previous = score;
        }
        assertThat(previous).isCloseTo(5.0, within(0.01));
    }

    @Test
    @DisplayName("Should keep every score in [0, 10] with a known label")
    void shouldStayInOutputDomain() {
        for (RuleBasePreset preset : RuleBasePreset.values()) {
            FuzzyAnomalyDetector presetDetector = new FuzzyAnomalyDetector(
                    StandardFuzzySystem.config(preset, 0.05, CoveragePolicy.UNDETERMINED));
            for (int ep = 0; ep <= 4; ep++) {
                for (int mv = 0; mv <= 4; mv++) {
                    for (int mc = 0; mc <= 4; mc++) {
                        EvaluationResult result = presetDetector.evaluate(ep / 4.0, mv / 4.0, mc / 4.0);
                        assertThat(result.getScore()).isBetween(0.0, 10.0);
                        assertThat(LABELS).contains(result.getLabel());
                    }
                }
            }
        }
    }

    @Test
    @DisplayName("Should disagree with the canonical rules where the pairwise rules have a gap")
    void shouldReflectRulePreset() {
        FuzzyAnomalyDetector pairwise = new FuzzyAnomalyDetector(StandardFuzzySystem.config(
                RuleBasePreset.PAIRWISE, InferenceConfig.DEFAULT_RESOLUTION, CoveragePolicy.UNDETERMINED));

        assertThat(detector.evaluate(1.0, 0.0, 0.0).getLabel()).isEqualTo("moderately_anomalous");
        assertThat(pairwise.evaluate(1.0, 0.0, 0.0).isUndetermined()).isTrue();
        assertThat(pairwise.evaluate(0.0, 1.0, 1.0).getLabel()).isEqualTo("strongly_anomalous");
    }

    @Test
    @DisplayName("Should reject indicators outside [0, 1]")
    void shouldRejectOutOfRangeIndicators() {
        assertThatThrownBy(() -> detector.evaluate(1.5, 0.0, 0.0))
                .isInstanceOf(InputOutOfRangeException.class)
                .hasMessageContaining("forecast_error");
    }

    @Test
    @DisplayName("Should reject a malformed membership function")
    void shouldRejectMalformedShape() {
        assertThatThrownBy(() -> LinguisticVariable.builder("forecast_error", 0, 1)
                .triangular("medium", 0.5, 0.2, 0.8))
                .isInstanceOf(InvalidShapeException.class);
    }

    @Test
    @DisplayName("Should require exactly the three indicator inputs")
    void shouldRequireIndicatorInputs() {
        InferenceConfig config = InferenceConfig.builder()
                .input(StandardFuzzySystem.forecastError())
                .output(StandardFuzzySystem.anomalyLevel())
                .ruleBase(RuleBase.builder().build())
                .build();

        assertThatThrownBy(() -> new FuzzyAnomalyDetector(config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("variance_change");
    }
}
