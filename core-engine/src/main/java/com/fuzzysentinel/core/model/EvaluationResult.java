package com.fuzzysentinel.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of one fuzzy evaluation: a crisp anomaly score plus its linguistic
 * label.
 *
 * <p>
 * Besides score and label the result carries diagnostics: the aggregated
 * strength of every output set (declaration order) and the activation of
 * every rule (rule-base order).
 * </p>
 *
 * <h3>Undetermined results</h3>
 * <p>
 * When no rule produces any output mass the score is the output domain
 * midpoint, the label is {@value #UNDETERMINED_LABEL} and
 * {@link #getOutcome()} is {@link Outcome#UNDETERMINED}, so callers can tell
 * "computed normal" apart from "nothing fired".
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code label} and {@code outcome} are required;
 * omitting either throws {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class EvaluationResult implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Label reported when the aggregated output has zero mass. */
    public static final String UNDETERMINED_LABEL = "undetermined";

    private final double score;
    private final String label;
    private final Outcome outcome;
    private final Map<String, Double> aggregatedStrengths;
    private final List<RuleActivation> activations;

    private EvaluationResult(Builder builder) {
        this.score = builder.score;
        this.label = Objects.requireNonNull(builder.label, "label must not be null");
        this.outcome = Objects.requireNonNull(builder.outcome, "outcome must not be null");
        this.aggregatedStrengths = Collections.unmodifiableMap(new LinkedHashMap<>(builder.aggregatedStrengths));
        this.activations = Collections.unmodifiableList(new ArrayList<>(builder.activations));
    }

    /**
     * Create a new {@link Builder}.
     *
     * @return builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    /**
     * @return crisp anomaly score inside the output domain
     */
    public double getScore() {
        return score;
    }

    /**
     * @return name of the output set with the highest degree at the score, or
     *         {@value #UNDETERMINED_LABEL}
     */
    public String getLabel() {
        return label;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isUndetermined() {
        return outcome == Outcome.UNDETERMINED;
    }

    /**
     * @return output set name to aggregated (max) firing strength
     */
    public Map<String, Double> getAggregatedStrengths() {
        return aggregatedStrengths;
    }

    public List<RuleActivation> getActivations() {
        return activations;
    }

    /**
     * The rule with the highest firing strength. Ties go to the rule declared
     * first.
     *
     * @return the dominant rule name, or empty when no rule fired
     */
    public Optional<String> getDominantRule() {
        RuleActivation best = null;
        for (RuleActivation activation : activations) {
            if (activation.fired() && (best == null || activation.getStrength() > best.getStrength())) {
                best = activation;
            }
        }
        return best == null ? Optional.empty() : Optional.of(best.getRuleName());
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link EvaluationResult} instances.
     */
    public static class Builder {
        private double score;
        private String label;
        private Outcome outcome;
        private Map<String, Double> aggregatedStrengths = Collections.emptyMap();
        private List<RuleActivation> activations = Collections.emptyList();

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder outcome(Outcome outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder aggregatedStrengths(Map<String, Double> aggregatedStrengths) {
            this.aggregatedStrengths = Objects.requireNonNull(aggregatedStrengths);
            return this;
        }

        public Builder activations(List<RuleActivation> activations) {
            this.activations = Objects.requireNonNull(activations);
            return this;
        }

        /**
         * Build the result.
         *
         * @return a new {@link EvaluationResult}
         * @throws NullPointerException if {@code label} or {@code outcome} is
         *                              {@code null}
         */
        public EvaluationResult build() {
            return new EvaluationResult(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EvaluationResult that))
            return false;
        return Double.compare(score, that.score) == 0
                && label.equals(that.label)
                && outcome == that.outcome
                && aggregatedStrengths.equals(that.aggregatedStrengths)
                && activations.equals(that.activations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(score, label, outcome, aggregatedStrengths, activations);
    }

    @Override
    public String toString() {
        return "EvaluationResult{" +
                "score=" + score +
                ", label='" + label + '\'' +
                ", outcome=" + outcome +
                ", aggregatedStrengths=" + aggregatedStrengths +
                '}';
    }
}
