package com.fuzzysentinel.core.config;

import com.fuzzysentinel.core.inference.CoveragePolicy;
import com.fuzzysentinel.core.inference.InferenceConfig;
import com.fuzzysentinel.core.model.LinguisticVariable;
import com.fuzzysentinel.core.rules.Antecedent;
import com.fuzzysentinel.core.rules.RuleBase;

import java.util.Objects;

import static com.fuzzysentinel.core.rules.Antecedent.allOf;
import static com.fuzzysentinel.core.rules.Antecedent.term;

/**
 * The anomaly vocabulary and its built-in rule bases.
 *
 * <h3>Inputs</h3>
 * <p>
 * {@value #FORECAST_ERROR}, {@value #VARIANCE_CHANGE} and
 * {@value #CORRELATION_CHANGE}, each over {@code [0, 1]} with sets
 * {@code low = tri(0, 0, 0.4)}, {@code medium = tri(0.2, 0.5, 0.8)} and
 * {@code high = tri(0.6, 1, 1)}.
 * </p>
 *
 * <h3>Output</h3>
 * <p>
 * {@value #ANOMALY_LEVEL} over {@code [0, 10]} with sets
 * {@code normal = tri(0, 0, 3)}, {@code slightly_anomalous = tri(1, 3, 5)},
 * {@code moderately_anomalous = tri(3, 5, 7)} and
 * {@code strongly_anomalous = tri(6, 10, 10)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class StandardFuzzySystem {

    public static final String FORECAST_ERROR = "forecast_error";
    public static final String VARIANCE_CHANGE = "variance_change";
    public static final String CORRELATION_CHANGE = "correlation_change";
    public static final String ANOMALY_LEVEL = "anomaly_level";

    public static final String LOW = "low";
    public static final String MEDIUM = "medium";
    public static final String HIGH = "high";

    public static final String NORMAL = "normal";
    public static final String SLIGHTLY_ANOMALOUS = "slightly_anomalous";
    public static final String MODERATELY_ANOMALOUS = "moderately_anomalous";
    public static final String STRONGLY_ANOMALOUS = "strongly_anomalous";

    private StandardFuzzySystem() {
        // constants and factories only
    }

    // ---------------------------------------------------------------
    // Variables
    // ---------------------------------------------------------------

    public static LinguisticVariable forecastError() {
        return indicator(FORECAST_ERROR);
    }

    public static LinguisticVariable varianceChange() {
        return indicator(VARIANCE_CHANGE);
    }

    public static LinguisticVariable correlationChange() {
        return indicator(CORRELATION_CHANGE);
    }

    public static LinguisticVariable anomalyLevel() {
        return LinguisticVariable.builder(ANOMALY_LEVEL, 0.0, 10.0)
                .triangular(NORMAL, 0, 0, 3)
                .triangular(SLIGHTLY_ANOMALOUS, 1, 3, 5)
                .triangular(MODERATELY_ANOMALOUS, 3, 5, 7)
                .triangular(STRONGLY_ANOMALOUS, 6, 10, 10)
                .build();
    }

    private static LinguisticVariable indicator(String name) {
        return LinguisticVariable.builder(name, 0.0, 1.0)
                .triangular(LOW, 0.0, 0.0, 0.4)
                .triangular(MEDIUM, 0.2, 0.5, 0.8)
                .triangular(HIGH, 0.6, 1.0, 1.0)
                .build();
    }

    // ---------------------------------------------------------------
    // Rule bases
    // ---------------------------------------------------------------

    public static RuleBase ruleBase(RuleBasePreset preset) {
        Objects.requireNonNull(preset, "Rule base preset must not be null");
        return switch (preset) {
            case CANONICAL -> canonicalRules();
            case PAIRWISE -> pairwiseRules();
        };
    }

    /**
     * Nine representative (EP, MV, MC) combinations, all AND-only with weight 1.
     */
    public static RuleBase canonicalRules() {
        return RuleBase.builder()
                .addRule("normal_all_low", all(LOW, LOW, LOW), NORMAL)
                .addRule("slight_medium_mv", all(LOW, MEDIUM, LOW), SLIGHTLY_ANOMALOUS)
                .addRule("slight_medium_ep", all(MEDIUM, LOW, LOW), SLIGHTLY_ANOMALOUS)
                .addRule("moderate_all_medium", all(MEDIUM, MEDIUM, MEDIUM), MODERATELY_ANOMALOUS)
                .addRule("moderate_high_ep", all(HIGH, LOW, LOW), MODERATELY_ANOMALOUS)
                .addRule("moderate_high_mv_mc", all(LOW, HIGH, HIGH), MODERATELY_ANOMALOUS)
                .addRule("strong_high_ep_medium_mv_mc", all(HIGH, MEDIUM, MEDIUM), STRONGLY_ANOMALOUS)
                .addRule("strong_high_ep_mv", all(HIGH, HIGH, LOW), STRONGLY_ANOMALOUS)
                .addRule("strong_all_high", all(HIGH, HIGH, HIGH), STRONGLY_ANOMALOUS)
                .build();
    }

    /**
     * Fourteen rules: all-low is normal, a single medium indicator is slight,
     * two medium indicators are moderate, and any high pair (or high with
     * medium) is strong.
     */
    public static RuleBase pairwiseRules() {
        return RuleBase.builder()
                .addRule("normal_all_low", all(LOW, LOW, LOW), NORMAL)
                .addRule("slight_medium_ep", all(MEDIUM, LOW, LOW), SLIGHTLY_ANOMALOUS)
                .addRule("slight_medium_mv", all(LOW, MEDIUM, LOW), SLIGHTLY_ANOMALOUS)
                .addRule("slight_medium_mc", all(LOW, LOW, MEDIUM), SLIGHTLY_ANOMALOUS)
                .addRule("moderate_ep_mv", allOf(term(FORECAST_ERROR, MEDIUM), term(VARIANCE_CHANGE, MEDIUM)),
                        MODERATELY_ANOMALOUS)
                .addRule("moderate_ep_mc", allOf(term(FORECAST_ERROR, MEDIUM), term(CORRELATION_CHANGE, MEDIUM)),
                        MODERATELY_ANOMALOUS)
                .addRule("moderate_mv_mc", allOf(term(VARIANCE_CHANGE, MEDIUM), term(CORRELATION_CHANGE, MEDIUM)),
                        MODERATELY_ANOMALOUS)
                .addRule("strong_ep_mv", allOf(term(FORECAST_ERROR, HIGH), term(VARIANCE_CHANGE, HIGH)),
                        STRONGLY_ANOMALOUS)
                .addRule("strong_ep_mc", allOf(term(FORECAST_ERROR, HIGH), term(CORRELATION_CHANGE, HIGH)),
                        STRONGLY_ANOMALOUS)
                .addRule("strong_mv_mc", allOf(term(VARIANCE_CHANGE, HIGH), term(CORRELATION_CHANGE, HIGH)),
                        STRONGLY_ANOMALOUS)
                .addRule("strong_high_ep_medium_mv", allOf(term(FORECAST_ERROR, HIGH), term(VARIANCE_CHANGE, MEDIUM)),
                        STRONGLY_ANOMALOUS)
                .addRule("strong_medium_ep_high_mv", allOf(term(FORECAST_ERROR, MEDIUM), term(VARIANCE_CHANGE, HIGH)),
                        STRONGLY_ANOMALOUS)
                .addRule("strong_high_ep_medium_mc",
                        allOf(term(FORECAST_ERROR, HIGH), term(CORRELATION_CHANGE, MEDIUM)),
                        STRONGLY_ANOMALOUS)
                .addRule("strong_high_mv_medium_mc",
                        allOf(term(VARIANCE_CHANGE, HIGH), term(CORRELATION_CHANGE, MEDIUM)),
                        STRONGLY_ANOMALOUS)
                .build();
    }

    // ---------------------------------------------------------------
    // Complete configurations
    // ---------------------------------------------------------------

    /**
     * Standard vocabulary with the canonical rules and default settings.
     */
    public static InferenceConfig defaultConfig() {
        return config(RuleBasePreset.CANONICAL, InferenceConfig.DEFAULT_RESOLUTION, CoveragePolicy.UNDETERMINED);
    }

    public static InferenceConfig config(RuleBasePreset preset, double resolution, CoveragePolicy policy) {
        return config(ruleBase(preset), resolution, policy);
    }

    /**
     * Standard vocabulary with a custom rule base.
     *
     * @throws com.fuzzysentinel.core.model.UnknownTermException if a rule
     *                                                           references a
     *                                                           term outside the
     *                                                           vocabulary
     */
    public static InferenceConfig config(RuleBase rules, double resolution, CoveragePolicy policy) {
        return InferenceConfig.builder()
                .input(forecastError())
                .input(varianceChange())
                .input(correlationChange())
                .output(anomalyLevel())
                .ruleBase(rules)
                .resolution(resolution)
                .coveragePolicy(policy)
                .build();
    }

    private static Antecedent all(String ep, String mv, String mc) {
        return allOf(term(FORECAST_ERROR, ep), term(VARIANCE_CHANGE, mv), term(CORRELATION_CHANGE, mc));
    }
}
