package com.fuzzysentinel.core.model;

import java.util.Objects;

/**
 * Triangular membership function with breakpoints {@code a <= b <= c}.
 *
 * <p>
 * The degree is {@code 0} outside {@code [a, c]}, rises linearly over
 * {@code [a, b]}, equals {@code 1} at {@code b} and falls linearly over
 * {@code [b, c]}. With {@code a == b} (or {@code b == c}) the corresponding
 * edge is a step, so {@code tri(0, 0, 0.4)} has degree {@code 1} at
 * {@code 0}.
 * </p>
 *
 * @since 1.0.0
 */
public final class TriangularMembership implements MembershipFunction {

    private static final long serialVersionUID = 1L;

    private final double a;
    private final double b;
    private final double c;

    /**
     * @throws InvalidShapeException if a parameter is not finite or
     *                               {@code a <= b <= c} does not hold
     */
    public TriangularMembership(double a, double b, double c) {
        Shapes.requireFinite("triangular", a, b, c);
        Shapes.requireNonDecreasing("triangular", a, b, c);
        this.a = a;
        this.b = b;
        this.c = c;
    }

    @Override
    public double degree(double x) {
        if (Double.isNaN(x) || x < a || x > c) {
            return 0.0;
        }
        if (x == b) {
            return 1.0;
        }
        // a <= x < b implies b - a > 0; b < x <= c implies c - b > 0
        if (x < b) {
            return (x - a) / (b - a);
        }
        return (c - x) / (c - b);
    }

    @Override
    public double supportStart() {
        return a;
    }

    @Override
    public double supportEnd() {
        return c;
    }

    public double getPeak() {
        return b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TriangularMembership that))
            return false;
        return Double.compare(a, that.a) == 0
                && Double.compare(b, that.b) == 0
                && Double.compare(c, that.c) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(a, b, c);
    }

    @Override
    public String toString() {
        return "tri(" + a + ", " + b + ", " + c + ")";
    }
}
