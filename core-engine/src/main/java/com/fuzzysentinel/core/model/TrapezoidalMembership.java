package com.fuzzysentinel.core.model;

import java.util.Objects;

/**
 * Trapezoidal membership function with breakpoints {@code a <= b <= c <= d}.
 *
 * <p>
 * The degree is {@code 0} outside {@code [a, d]}, rises over {@code [a, b]},
 * stays at {@code 1} on the plateau {@code [b, c]} and falls over
 * {@code [c, d]}. Zero-width edges are steps.
 * </p>
 *
 * @since 1.0.0
 */
public final class TrapezoidalMembership implements MembershipFunction {

    private static final long serialVersionUID = 1L;

    private final double a;
    private final double b;
    private final double c;
    private final double d;

    /**
     * @throws InvalidShapeException if a parameter is not finite or
     *                               {@code a <= b <= c <= d} does not hold
     */
    public TrapezoidalMembership(double a, double b, double c, double d) {
        Shapes.requireFinite("trapezoidal", a, b, c, d);
        Shapes.requireNonDecreasing("trapezoidal", a, b, c, d);
        this.a = a;
        this.b = b;
        this.c = c;
        this.d = d;
    }

    @Override
    public double degree(double x) {
        if (Double.isNaN(x) || x < a || x > d) {
            return 0.0;
        }
        if (x >= b && x <= c) {
            return 1.0;
        }
        if (x < b) {
            return (x - a) / (b - a);
        }
        return (d - x) / (d - c);
    }

    @Override
    public double supportStart() {
        return a;
    }

    @Override
    public double supportEnd() {
        return d;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TrapezoidalMembership that))
            return false;
        return Double.compare(a, that.a) == 0
                && Double.compare(b, that.b) == 0
                && Double.compare(c, that.c) == 0
                && Double.compare(d, that.d) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(a, b, c, d);
    }

    @Override
    public String toString() {
        return "trap(" + a + ", " + b + ", " + c + ", " + d + ")";
    }
}
