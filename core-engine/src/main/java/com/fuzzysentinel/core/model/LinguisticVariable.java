package com.fuzzysentinel.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Named group of fuzzy sets over a numeric domain {@code [min, max]}.
 *
 * <p>
 * Sets keep their declaration order. That order is significant: it breaks
 * ties when the inference engine picks the label of an output value.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #builder(String, double, double)}. The builder rejects an empty
 * set list, duplicate set names and a domain with {@code min >= max}.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Immutable once built; {@link #fuzzify(double)} is a pure function.
 * </p>
 *
 * @since 1.0.0
 */
public final class LinguisticVariable implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final double min;
    private final double max;
    private final Map<String, FuzzySet> sets;
    private final List<FuzzySet> setList;
    private final List<String> setNames;

    private LinguisticVariable(Builder builder) {
        this.name = builder.name;
        this.min = builder.min;
        this.max = builder.max;
        this.sets = Collections.unmodifiableMap(new LinkedHashMap<>(builder.sets));
        this.setList = Collections.unmodifiableList(new ArrayList<>(sets.values()));
        this.setNames = Collections.unmodifiableList(new ArrayList<>(sets.keySet()));
    }

    /**
     * Create a new {@link Builder}.
     *
     * @param name variable name, e.g. {@code forecast_error}
     * @param min  lower domain bound
     * @param max  upper domain bound
     * @return builder instance
     */
    public static Builder builder(String name, double min, double max) {
        return new Builder(name, min, max);
    }

    // ---------------------------------------------------------------
    // Fuzzification
    // ---------------------------------------------------------------

    /**
     * Evaluate every owned set at {@code value}.
     *
     * <p>
     * Zero degrees are included so callers can select what they need. The
     * returned map is unmodifiable and iterates in declaration order.
     * </p>
     *
     * @param value crisp value
     * @return set name to membership degree
     */
    public Map<String, Double> fuzzify(double value) {
        Map<String, Double> degrees = new LinkedHashMap<>();
        for (FuzzySet set : sets.values()) {
            degrees.put(set.getName(), set.degree(value));
        }
        return Collections.unmodifiableMap(degrees);
    }

    /**
     * @param value crisp value
     * @return {@code true} if {@code value} lies inside {@code [min, max]};
     *         {@code false} for {@code NaN}
     */
    public boolean inDomain(double value) {
        return value >= min && value <= max;
    }

    /**
     * @return centre of the domain
     */
    public double midpoint() {
        return (min + max) / 2.0;
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public boolean hasSet(String setName) {
        return sets.containsKey(setName);
    }

    public Optional<FuzzySet> getSet(String setName) {
        return Optional.ofNullable(sets.get(setName));
    }

    /**
     * @return sets in declaration order (unmodifiable)
     */
    public List<FuzzySet> getSets() {
        return setList;
    }

    /**
     * @return set names in declaration order (unmodifiable)
     */
    public List<String> getSetNames() {
        return setNames;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof LinguisticVariable that))
            return false;
        return Double.compare(min, that.min) == 0
                && Double.compare(max, that.max) == 0
                && name.equals(that.name)
                && sets.equals(that.sets);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, min, max, sets);
    }

    @Override
    public String toString() {
        return "LinguisticVariable{" +
                "name='" + name + '\'' +
                ", domain=[" + min + ", " + max + ']' +
                ", sets=" + sets.values() +
                '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link LinguisticVariable}.
     */
    public static class Builder {
        private final String name;
        private final double min;
        private final double max;
        private final Map<String, FuzzySet> sets = new LinkedHashMap<>();

        private Builder(String name, double min, double max) {
            this.name = name;
            this.min = min;
            this.max = max;
        }

        /**
         * Append a set.
         *
         * @throws IllegalArgumentException if a set with the same name was
         *                                  already added
         */
        public Builder set(FuzzySet set) {
            Objects.requireNonNull(set, "Fuzzy set must not be null");
            if (sets.putIfAbsent(set.getName(), set) != null) {
                throw new IllegalArgumentException(
                        "Duplicate set '" + set.getName() + "' in variable '" + name + "'");
            }
            return this;
        }

        public Builder triangular(String setName, double a, double b, double c) {
            return set(FuzzySet.triangular(setName, a, b, c));
        }

        public Builder trapezoidal(String setName, double a, double b, double c, double d) {
            return set(FuzzySet.trapezoidal(setName, a, b, c, d));
        }

        /**
         * Build and validate the variable.
         *
         * @return a new immutable {@link LinguisticVariable}
         * @throws NullPointerException     if the name is {@code null}
         * @throws IllegalArgumentException if the name is blank, the domain is
         *                                  empty or not finite, or no set was
         *                                  added
         */
        public LinguisticVariable build() {
            Objects.requireNonNull(name, "Variable name must not be null");
            if (name.isBlank()) {
                throw new IllegalArgumentException("Variable name must not be blank");
            }
            if (!Double.isFinite(min) || !Double.isFinite(max) || min >= max) {
                throw new IllegalArgumentException(
                        "Variable '" + name + "' requires a finite domain with min < max, got: ["
                                + min + ", " + max + "]");
            }
            if (sets.isEmpty()) {
                throw new IllegalArgumentException("Variable '" + name + "' requires at least one set");
            }
            return new LinguisticVariable(this);
        }
    }
}
