package com.fuzzysentinel.core.rules;

import com.fuzzysentinel.core.model.FuzzifiedInputs;

import java.io.Serializable;
import java.util.List;

/**
 * The IF part of a rule: a tree of {@link Term} leaves joined by
 * {@link AllOf} (AND) and {@link AnyOf} (OR) nodes.
 *
 * <p>
 * Trees are immutable. Use the static factories to assemble them:
 * </p>
 *
 * <pre>
 * Antecedent.allOf(
 *         Antecedent.term("forecast_error", "high"),
 *         Antecedent.anyOf(
 *                 Antecedent.term("variance_change", "high"),
 *                 Antecedent.term("correlation_change", "high")));
 * </pre>
 *
 * @since 1.0.0
 */
public interface Antecedent extends Serializable {

    /**
     * Degree to which this antecedent holds: AND is the minimum of the
     * children, OR the maximum, a leaf its fuzzified degree.
     *
     * @param inputs fuzzified inputs of the current evaluation
     * @return degree in {@code [0, 1]}
     * @throws com.fuzzysentinel.core.model.UnknownTermException if a leaf was
     *                                                           never fuzzified
     */
    double evaluate(FuzzifiedInputs inputs);

    /**
     * Like {@link #evaluate(FuzzifiedInputs)}, but AND nodes average their
     * children instead of taking the minimum. Used to rank rules by how close
     * they come to firing when none of them fires.
     *
     * @param inputs fuzzified inputs of the current evaluation
     * @return degree in {@code [0, 1]}
     */
    double evaluateCompensated(FuzzifiedInputs inputs);

    /**
     * @return every leaf of this tree, left to right
     */
    List<Term> terms();

    // ---------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------

    static Term term(String variable, String set) {
        return new Term(variable, set);
    }

    static AllOf allOf(Antecedent... children) {
        return new AllOf(List.of(children));
    }

    static AnyOf anyOf(Antecedent... children) {
        return new AnyOf(List.of(children));
    }
}
