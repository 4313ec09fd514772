package com.fuzzysentinel.core.model;

import java.io.Serializable;

/**
 * Shape of a fuzzy set: maps a crisp value to a membership degree.
 * <p>
 * Implementations are immutable and validate their parameters at
 * construction time, throwing {@link InvalidShapeException} when the
 * breakpoints are not finite or not non-decreasing.
 * </p>
 * <p>
 * A zero-width edge (two equal consecutive breakpoints) is an instantaneous
 * jump. Implementations never divide by the width of such an edge.
 * </p>
 */
public interface MembershipFunction extends Serializable {

    /**
     * Evaluate the membership degree of {@code value}.
     *
     * @param value crisp value; {@code NaN} yields {@code 0}
     * @return degree in {@code [0, 1]}
     */
    double degree(double value);

    /**
     * @return lower bound of the support (first breakpoint)
     */
    double supportStart();

    /**
     * @return upper bound of the support (last breakpoint)
     */
    double supportEnd();
}
