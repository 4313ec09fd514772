package com.fuzzysentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Firing strength reached by one rule during one evaluation.
 *
 * @since 1.0.0
 */
public final class RuleActivation implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String ruleName;
    private final String consequent;
    private final double strength;

    public RuleActivation(String ruleName, String consequent, double strength) {
        this.ruleName = Objects.requireNonNull(ruleName, "ruleName must not be null");
        this.consequent = Objects.requireNonNull(consequent, "consequent must not be null");
        this.strength = strength;
    }

    public String getRuleName() {
        return ruleName;
    }

    public String getConsequent() {
        return consequent;
    }

    public double getStrength() {
        return strength;
    }

    public boolean fired() {
        return strength > 0.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RuleActivation that))
            return false;
        return Double.compare(strength, that.strength) == 0
                && ruleName.equals(that.ruleName)
                && consequent.equals(that.consequent);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ruleName, consequent, strength);
    }

    @Override
    public String toString() {
        return ruleName + " -> " + consequent + " @ " + strength;
    }
}
