package com.fuzzysentinel.core.rules;

import com.fuzzysentinel.core.model.FuzzifiedInputs;
import com.fuzzysentinel.core.model.LinguisticVariable;
import com.fuzzysentinel.core.model.UnknownTermException;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered, immutable collection of {@link Rule}s.
 *
 * <p>
 * Rules evaluate independently; their order has no effect on the crisp
 * result and only decides ties in diagnostics (dominant rule).
 * </p>
 *
 * <h3>Validation</h3>
 * <p>
 * {@link #validate(List, LinguisticVariable)} checks every term and every
 * consequent against the declared variables. It collects all problems and
 * throws a single {@link UnknownTermException}, so a broken configuration
 * fails at startup instead of on the first evaluation.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleBase implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<Rule> rules;

    private RuleBase(List<Rule> rules) {
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Evaluation
    // ---------------------------------------------------------------

    /**
     * Reduce an antecedent tree against the fuzzified inputs: AND nodes by
     * minimum, OR nodes by maximum, leaves by direct lookup.
     *
     * @throws UnknownTermException if a leaf pair was never fuzzified
     */
    public double evaluate(Antecedent antecedent, FuzzifiedInputs inputs) {
        Objects.requireNonNull(antecedent, "Antecedent must not be null");
        Objects.requireNonNull(inputs, "Inputs must not be null");
        return antecedent.evaluate(inputs);
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Check that every rule only references defined terms.
     *
     * @param inputs input variables the antecedents may reference
     * @param output output variable whose sets the consequents must name
     * @throws UnknownTermException listing every undefined reference
     */
    public void validate(List<LinguisticVariable> inputs, LinguisticVariable output) {
        Objects.requireNonNull(inputs, "Input variables must not be null");
        Objects.requireNonNull(output, "Output variable must not be null");

        Map<String, LinguisticVariable> byName = new LinkedHashMap<>();
        for (LinguisticVariable input : inputs) {
            byName.put(input.getName(), input);
        }

        List<String> errors = new ArrayList<>();
        for (Rule rule : rules) {
            for (Term term : rule.getAntecedent().terms()) {
                LinguisticVariable variable = byName.get(term.getVariable());
                if (variable == null) {
                    errors.add("Rule '" + rule.getName() + "' references unknown input variable '"
                            + term.getVariable() + "'");
                } else if (!variable.hasSet(term.getSet())) {
                    errors.add("Rule '" + rule.getName() + "' references unknown set '"
                            + term.getSet() + "' of variable '" + term.getVariable() + "'");
                }
            }
            if (!output.hasSet(rule.getConsequent())) {
                errors.add("Rule '" + rule.getName() + "' concludes unknown set '"
                        + rule.getConsequent() + "' of output '" + output.getName() + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new UnknownTermException(
                    "Rule base validation failed:\n  - " + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    /**
     * @return rules in declaration order (unmodifiable)
     */
    public List<Rule> getRules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RuleBase that))
            return false;
        return rules.equals(that.rules);
    }

    @Override
    public int hashCode() {
        return rules.hashCode();
    }

    @Override
    public String toString() {
        return "RuleBase{rules=" + rules + '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Collects rules in order. The built {@link RuleBase} is a snapshot;
     * adding to the builder afterwards does not affect it.
     */
    public static class Builder {
        private final List<Rule> rules = new ArrayList<>();
        private final Set<String> names = new HashSet<>();

        /**
         * Append a rule.
         *
         * @throws IllegalArgumentException if a rule with the same name was
         *                                  already added
         */
        public Builder addRule(Rule rule) {
            Objects.requireNonNull(rule, "Rule must not be null");
            if (!names.add(rule.getName())) {
                throw new IllegalArgumentException("Duplicate rule name: '" + rule.getName() + "'");
            }
            rules.add(rule);
            return this;
        }

        public Builder addRule(String name, Antecedent antecedent, String consequent) {
            return addRule(new Rule(name, antecedent, consequent));
        }

        public RuleBase build() {
            return new RuleBase(rules);
        }
    }
}
