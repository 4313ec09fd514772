package com.fuzzysentinel.core.rules;

import com.fuzzysentinel.core.model.FuzzifiedInputs;

import java.util.List;
import java.util.Objects;

/**
 * Leaf of an antecedent tree: "{@code variable} IS {@code set}".
 *
 * @since 1.0.0
 */
public final class Term implements Antecedent {

    private static final long serialVersionUID = 1L;

    private final String variable;
    private final String set;

    public Term(String variable, String set) {
        this.variable = Objects.requireNonNull(variable, "Term variable must not be null");
        this.set = Objects.requireNonNull(set, "Term set must not be null");
    }

    @Override
    public double evaluate(FuzzifiedInputs inputs) {
        return inputs.degree(variable, set);
    }

    @Override
    public double evaluateCompensated(FuzzifiedInputs inputs) {
        return inputs.degree(variable, set);
    }

    @Override
    public List<Term> terms() {
        return List.of(this);
    }

    public String getVariable() {
        return variable;
    }

    public String getSet() {
        return set;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Term that))
            return false;
        return variable.equals(that.variable) && set.equals(that.set);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, set);
    }

    @Override
    public String toString() {
        return variable + " IS " + set;
    }
}
