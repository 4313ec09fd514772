package com.fuzzysentinel.core.rules;

import com.fuzzysentinel.core.model.FuzzifiedInputs;

import java.io.Serializable;
import java.util.Objects;

/**
 * A Mamdani rule: IF {@code antecedent} THEN output IS {@code consequent}.
 *
 * <p>
 * The firing strength is {@code weight * antecedent.evaluate(inputs)}. The
 * weight defaults to {@value #DEFAULT_WEIGHT} and must lie in {@code [0, 1]}
 * so that strengths stay valid membership degrees.
 * </p>
 *
 * @since 1.0.0
 */
public final class Rule implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final double DEFAULT_WEIGHT = 1.0;

    /** Unique name within a rule base; used in diagnostics. */
    private final String name;

    private final Antecedent antecedent;

    /** Name of the output set this rule concludes. */
    private final String consequent;

    private final double weight;

    public Rule(String name, Antecedent antecedent, String consequent) {
        this(name, antecedent, consequent, DEFAULT_WEIGHT);
    }

    /**
     * @throws NullPointerException     if any reference argument is {@code null}
     * @throws IllegalArgumentException if the name or consequent is blank, or
     *                                  the weight is outside {@code [0, 1]}
     */
    public Rule(String name, Antecedent antecedent, String consequent, double weight) {
        this.name = Objects.requireNonNull(name, "Rule name must not be null");
        this.antecedent = Objects.requireNonNull(antecedent, "Antecedent of rule '" + name + "' must not be null");
        this.consequent = Objects.requireNonNull(consequent, "Consequent of rule '" + name + "' must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Rule name must not be blank");
        }
        if (consequent.isBlank()) {
            throw new IllegalArgumentException("Consequent of rule '" + name + "' must not be blank");
        }
        if (!(weight >= 0.0 && weight <= 1.0)) {
            throw new IllegalArgumentException(
                    "Weight of rule '" + name + "' must be in [0, 1], got: " + weight);
        }
        this.weight = weight;
    }

    /**
     * @param inputs fuzzified inputs of the current evaluation
     * @return {@code weight * antecedent.evaluate(inputs)}
     */
    public double firingStrength(FuzzifiedInputs inputs) {
        return weight * antecedent.evaluate(inputs);
    }

    /**
     * Strength under the compensatory AND, see
     * {@link Antecedent#evaluateCompensated(FuzzifiedInputs)}.
     */
    public double compensatedStrength(FuzzifiedInputs inputs) {
        return weight * antecedent.evaluateCompensated(inputs);
    }

    public String getName() {
        return name;
    }

    public Antecedent getAntecedent() {
        return antecedent;
    }

    public String getConsequent() {
        return consequent;
    }

    public double getWeight() {
        return weight;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Rule that))
            return false;
        return Double.compare(weight, that.weight) == 0
                && name.equals(that.name)
                && antecedent.equals(that.antecedent)
                && consequent.equals(that.consequent);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, antecedent, consequent, weight);
    }

    @Override
    public String toString() {
        String text = name + ": IF " + antecedent + " THEN " + consequent;
        return weight == DEFAULT_WEIGHT ? text : text + " [" + weight + "]";
    }
}
