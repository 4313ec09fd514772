package com.fuzzysentinel.core.rules;

import com.fuzzysentinel.core.model.FuzzifiedInputs;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Disjunction node: holds as strongly as its strongest child (maximum
 * s-norm).
 *
 * @since 1.0.0
 */
public final class AnyOf implements Antecedent {

    private static final long serialVersionUID = 1L;

    private final List<Antecedent> children;

    /**
     * @param children at least one child
     * @throws IllegalArgumentException if {@code children} is empty
     */
    public AnyOf(List<Antecedent> children) {
        Objects.requireNonNull(children, "OR children must not be null");
        if (children.isEmpty()) {
            throw new IllegalArgumentException("OR node requires at least one child");
        }
        this.children = List.copyOf(children);
    }

    @Override
    public double evaluate(FuzzifiedInputs inputs) {
        double degree = 0.0;
        for (Antecedent child : children) {
            degree = Math.max(degree, child.evaluate(inputs));
        }
        return degree;
    }

    @Override
    public double evaluateCompensated(FuzzifiedInputs inputs) {
        double degree = 0.0;
        for (Antecedent child : children) {
            degree = Math.max(degree, child.evaluateCompensated(inputs));
        }
        return degree;
    }

    @Override
    public List<Term> terms() {
        List<Term> terms = new ArrayList<>();
        for (Antecedent child : children) {
            terms.addAll(child.terms());
        }
        return terms;
    }

    public List<Antecedent> getChildren() {
        return children;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnyOf that))
            return false;
        return children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash("OR", children);
    }

    @Override
    public String toString() {
        return children.stream()
                .map(child -> child instanceof Term ? child.toString() : "(" + child + ")")
                .collect(Collectors.joining(" OR "));
    }
}
