package com.fuzzysentinel.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Degrees produced by fuzzifying every input of one evaluation:
 * variable name to (set name to degree).
 *
 * <p>
 * Lives for a single evaluation call and is never shared.
 * </p>
 *
 * @since 1.0.0
 */
public final class FuzzifiedInputs {

    private final Map<String, Map<String, Double>> degrees = new LinkedHashMap<>();

    /**
     * Record the degrees of one variable.
     *
     * @param variable variable name
     * @param setDegrees set name to degree, as returned by
     *                   {@link LinguisticVariable#fuzzify(double)}
     */
    public void put(String variable, Map<String, Double> setDegrees) {
        Objects.requireNonNull(variable, "Variable name must not be null");
        Objects.requireNonNull(setDegrees, "Set degrees must not be null");
        degrees.put(variable, setDegrees);
    }

    /**
     * Look up the degree of {@code set} for {@code variable}.
     *
     * @throws UnknownTermException if the pair was never fuzzified
     */
    public double degree(String variable, String set) {
        Map<String, Double> setDegrees = degrees.get(variable);
        if (setDegrees == null) {
            throw new UnknownTermException("Variable '" + variable + "' was not fuzzified");
        }
        Double degree = setDegrees.get(set);
        if (degree == null) {
            throw new UnknownTermException(
                    "Set '" + set + "' is not defined on variable '" + variable + "'");
        }
        return degree;
    }

    /**
     * @return unmodifiable view of all recorded degrees
     */
    public Map<String, Map<String, Double>> asMap() {
        return Collections.unmodifiableMap(degrees);
    }

    @Override
    public String toString() {
        return "FuzzifiedInputs" + degrees;
    }
}
