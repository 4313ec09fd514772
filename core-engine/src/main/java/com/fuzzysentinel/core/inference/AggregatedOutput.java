package com.fuzzysentinel.core.inference;

import com.fuzzysentinel.core.model.FuzzySet;
import com.fuzzysentinel.core.model.LinguisticVariable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Output fuzzy set of one evaluation: for every output set, the maximum
 * firing strength of the rules concluding it.
 *
 * <p>
 * Rebuilt on every call and discarded afterwards.
 * </p>
 */
final class AggregatedOutput {

    private final LinguisticVariable output;
    private final Map<String, Double> strengths = new LinkedHashMap<>();

    AggregatedOutput(LinguisticVariable output) {
        this.output = Objects.requireNonNull(output, "Output variable must not be null");
        for (String name : output.getSetNames()) {
            strengths.put(name, 0.0);
        }
    }

    /**
     * OR-fold a rule's strength into its consequent set.
     */
    void accumulate(String consequent, double strength) {
        strengths.merge(consequent, strength, Math::max);
    }

    /**
     * Mamdani implication and aggregation at one point of the output domain:
     * {@code max over sets of min(strength[set], set.degree(x))}.
     */
    double membership(double x) {
        double mu = 0.0;
        for (FuzzySet set : output.getSets()) {
            double strength = strengths.get(set.getName());
            if (strength > 0) {
                mu = Math.max(mu, Math.min(strength, set.degree(x)));
            }
        }
        return mu;
    }

    /**
     * @return {@code true} if no output set received any strength
     */
    boolean isSilent() {
        for (double strength : strengths.values()) {
            if (strength > 0) {
                return false;
            }
        }
        return true;
    }

    LinguisticVariable getOutput() {
        return output;
    }

    /**
     * @return set name to strength in output declaration order (unmodifiable)
     */
    Map<String, Double> asMap() {
        return Collections.unmodifiableMap(strengths);
    }
}
