package com.fuzzysentinel.core.inference;

import com.fuzzysentinel.core.model.FuzzySet;
import com.fuzzysentinel.core.model.LinguisticVariable;
import com.fuzzysentinel.core.rules.RuleBase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Typed, immutable configuration of one fuzzy inference system: input
 * variables, output variable, rule base, centroid resolution and coverage
 * policy.
 *
 * <p>
 * Built once at startup and then shared read-only, so several independent
 * configurations can live in the same process.
 * </p>
 *
 * <h3>Validation</h3>
 * <p>
 * {@link Builder#build()} fails fast on structural problems (duplicate
 * variable names, a bad resolution) and calls
 * {@link RuleBase#validate(List, LinguisticVariable)}, which throws
 * {@link com.fuzzysentinel.core.model.UnknownTermException} for rules that
 * reference undefined terms. Gaps in the output variable's coverage are
 * accepted but logged, since they make the score drift.
 * </p>
 *
 * @since 1.0.0
 */
public final class InferenceConfig implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(InferenceConfig.class);

    /** Default sampling step of the centroid integration. */
    public static final double DEFAULT_RESOLUTION = 0.01;

    /** Upper bound on the number of centroid sampling intervals. */
    public static final int MAX_SAMPLES = 1_000_000;

    private final List<LinguisticVariable> inputs;
    private final LinguisticVariable output;
    private final RuleBase ruleBase;
    private final double resolution;
    private final CoveragePolicy coveragePolicy;

    private InferenceConfig(Builder b) {
        this.inputs = Collections.unmodifiableList(new ArrayList<>(b.inputs));
        this.output = b.output;
        this.ruleBase = b.ruleBase;
        this.resolution = b.resolution;
        this.coveragePolicy = b.coveragePolicy;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /**
     * @return input variables in declaration order (unmodifiable)
     */
    public List<LinguisticVariable> getInputs() {
        return inputs;
    }

    public LinguisticVariable getOutput() {
        return output;
    }

    public RuleBase getRuleBase() {
        return ruleBase;
    }

    public double getResolution() {
        return resolution;
    }

    public CoveragePolicy getCoveragePolicy() {
        return coveragePolicy;
    }

    /**
     * Return a copy of this configuration with another coverage policy.
     */
    public InferenceConfig withCoveragePolicy(CoveragePolicy policy) {
        Builder b = toBuilder();
        b.coveragePolicy(policy);
        return b.build();
    }

    /**
     * Return a copy of this configuration with another rule base.
     *
     * @throws com.fuzzysentinel.core.model.UnknownTermException if the rule
     *                                                           base does not
     *                                                           fit the
     *                                                           variables
     */
    public InferenceConfig withRuleBase(RuleBase rules) {
        Builder b = toBuilder();
        b.ruleBase(rules);
        return b.build();
    }

    private Builder toBuilder() {
        Builder b = new Builder();
        inputs.forEach(b::input);
        return b.output(output)
                .ruleBase(ruleBase)
                .resolution(resolution)
                .coveragePolicy(coveragePolicy);
    }

    @Override
    public String toString() {
        return "InferenceConfig{" +
                "inputs=" + inputs.stream().map(LinguisticVariable::getName).toList() +
                ", output=" + output.getName() +
                ", rules=" + ruleBase.size() +
                ", resolution=" + resolution +
                ", coveragePolicy=" + coveragePolicy +
                '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link InferenceConfig}.
     */
    public static class Builder {
        private final List<LinguisticVariable> inputs = new ArrayList<>();
        private LinguisticVariable output;
        private RuleBase ruleBase;
        private double resolution = DEFAULT_RESOLUTION;
        private CoveragePolicy coveragePolicy = CoveragePolicy.UNDETERMINED;

        public Builder input(LinguisticVariable v) {
            this.inputs.add(Objects.requireNonNull(v, "Input variable must not be null"));
            return this;
        }

        public Builder output(LinguisticVariable v) {
            this.output = v;
            return this;
        }

        public Builder ruleBase(RuleBase v) {
            this.ruleBase = v;
            return this;
        }

        public Builder resolution(double v) {
            this.resolution = v;
            return this;
        }

        public Builder coveragePolicy(CoveragePolicy v) {
            this.coveragePolicy = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link InferenceConfig}
         * @throws NullPointerException     if the output, rule base or policy is
         *                                  missing
         * @throws IllegalArgumentException if no input is declared, names
         *                                  collide or the resolution is invalid
         * @throws com.fuzzysentinel.core.model.UnknownTermException if a rule
         *                                  references an undefined term
         */
        public InferenceConfig build() {
            Objects.requireNonNull(output, "Output variable required");
            Objects.requireNonNull(ruleBase, "Rule base required");
            Objects.requireNonNull(coveragePolicy, "Coverage policy required");

            if (inputs.isEmpty()) {
                throw new IllegalArgumentException("At least one input variable is required");
            }
            Set<String> names = new HashSet<>();
            for (LinguisticVariable input : inputs) {
                if (!names.add(input.getName())) {
                    throw new IllegalArgumentException("Duplicate input variable: '" + input.getName() + "'");
                }
            }
            if (names.contains(output.getName())) {
                throw new IllegalArgumentException(
                        "Output variable '" + output.getName() + "' clashes with an input variable");
            }

            double span = output.getMax() - output.getMin();
            if (!(resolution > 0) || resolution > span) {
                throw new IllegalArgumentException(
                        "resolution must be in (0, " + span + "], got: " + resolution);
            }
            CentroidDefuzzifier.sampleCount(output, resolution);

            ruleBase.validate(inputs, output);

            if (ruleBase.isEmpty()) {
                LOG.warn("Rule base is empty; every evaluation will be undetermined");
            }
            warnOnCoverageGap(output, resolution);

            return new InferenceConfig(this);
        }

        private static void warnOnCoverageGap(LinguisticVariable output, double resolution) {
            int samples = CentroidDefuzzifier.sampleCount(output, resolution);
            double step = (output.getMax() - output.getMin()) / samples;
            for (int i = 0; i <= samples; i++) {
                double x = output.getMin() + i * step;
                boolean covered = false;
                for (FuzzySet set : output.getSets()) {
                    if (set.degree(x) > 0) {
                        covered = true;
                        break;
                    }
                }
                if (!covered) {
                    LOG.warn("Output variable '{}' has no set covering {}; scores near it will drift",
                            output.getName(), x);
                    return;
                }
            }
        }
    }
}
