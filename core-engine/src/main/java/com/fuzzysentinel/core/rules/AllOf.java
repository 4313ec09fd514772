package com.fuzzysentinel.core.rules;

import com.fuzzysentinel.core.model.FuzzifiedInputs;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Conjunction node: holds when all children hold (minimum t-norm).
 *
 * @since 1.0.0
 */
public final class AllOf implements Antecedent {

    private static final long serialVersionUID = 1L;

    private final List<Antecedent> children;

    /**
     * @param children at least one child
     * @throws IllegalArgumentException if {@code children} is empty
     */
    public AllOf(List<Antecedent> children) {
        Objects.requireNonNull(children, "AND children must not be null");
        if (children.isEmpty()) {
            throw new IllegalArgumentException("AND node requires at least one child");
        }
        this.children = List.copyOf(children);
    }

    @Override
    public double evaluate(FuzzifiedInputs inputs) {
        double degree = 1.0;
        for (Antecedent child : children) {
            degree = Math.min(degree, child.evaluate(inputs));
        }
        return degree;
    }

    @Override
    public double evaluateCompensated(FuzzifiedInputs inputs) {
        double sum = 0;
        for (Antecedent child : children) {
            sum += child.evaluateCompensated(inputs);
        }
        return sum / children.size();
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
        if (!(o instanceof AllOf that))
            return false;
        return children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash("AND", children);
    }

    @Override
    public String toString() {
        return children.stream()
                .map(child -> child instanceof Term ? child.toString() : "(" + child + ")")
                .collect(Collectors.joining(" AND "));
    }
}
