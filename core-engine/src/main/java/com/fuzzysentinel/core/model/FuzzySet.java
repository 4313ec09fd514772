package com.fuzzysentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * A named fuzzy set, e.g. {@code low} or {@code strongly_anomalous}.
 *
 * <p>
 * Identity is the name; the shape is a {@link MembershipFunction}. Instances
 * are immutable and safe to share across threads.
 * </p>
 *
 * @since 1.0.0
 */
public final class FuzzySet implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final MembershipFunction shape;

    /**
     * @param name  set name; must not be {@code null} or blank
     * @param shape membership function; must not be {@code null}
     */
    public FuzzySet(String name, MembershipFunction shape) {
        Objects.requireNonNull(name, "Fuzzy set name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Fuzzy set name must not be blank");
        }
        this.name = name;
        this.shape = Objects.requireNonNull(shape, "Shape of fuzzy set '" + name + "' must not be null");
    }

    // ---------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------

    /**
     * @throws InvalidShapeException if {@code a <= b <= c} does not hold
     */
    public static FuzzySet triangular(String name, double a, double b, double c) {
        return new FuzzySet(name, new TriangularMembership(a, b, c));
    }

    /**
     * @throws InvalidShapeException if {@code a <= b <= c <= d} does not hold
     */
    public static FuzzySet trapezoidal(String name, double a, double b, double c, double d) {
        return new FuzzySet(name, new TrapezoidalMembership(a, b, c, d));
    }

    // ---------------------------------------------------------------
    // Evaluation
    // ---------------------------------------------------------------

    /**
     * @param value crisp value
     * @return membership degree of {@code value} in this set, in {@code [0, 1]}
     */
    public double degree(double value) {
        return shape.degree(value);
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FuzzySet that))
            return false;
        return name.equals(that.name) && shape.equals(that.shape);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, shape);
    }

    @Override
    public String toString() {
        return name + "=" + shape;
    }
}
