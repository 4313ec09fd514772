package com.fuzzysentinel.core.inference;

/**
 * Thrown when an evaluation input is {@code NaN} or lies outside its
 * variable's domain.
 *
 * <p>
 * Inputs are never clamped: a value outside the domain usually points at a
 * bug in the upstream indicator computation. The engine keeps no state
 * between calls, so later evaluations are unaffected.
 * </p>
 *
 * @since 1.0.0
 */
public class InputOutOfRangeException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String variable;
    private final double value;

    public InputOutOfRangeException(String variable, double value, double min, double max) {
        super("Input '" + variable + "' must be in [" + min + ", " + max + "], got: " + value);
        this.variable = variable;
        this.value = value;
    }

    public String getVariable() {
        return variable;
    }

    public double getValue() {
        return value;
    }
}
