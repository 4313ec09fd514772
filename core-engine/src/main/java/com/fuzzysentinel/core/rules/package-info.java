/**
 * Fuzzy IF-THEN rules.
 *
 * <p>
 * An {@link com.fuzzysentinel.core.rules.Antecedent} is a tree of
 * {@link com.fuzzysentinel.core.rules.Term},
 * {@link com.fuzzysentinel.core.rules.AllOf} and
 * {@link com.fuzzysentinel.core.rules.AnyOf} nodes. A
 * {@link com.fuzzysentinel.core.rules.Rule} pairs it with one output set and
 * a weight; a {@link com.fuzzysentinel.core.rules.RuleBase} keeps rules in
 * order and validates their terms.
 * </p>
 *
 * @since 1.0.0
 */
package com.fuzzysentinel.core.rules;
