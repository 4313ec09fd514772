package com.fuzzysentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * The three normalized indicators describing one time-series window.
 *
 * <p>
 * Values are expected in {@code [0, 1]} but are not checked here; the
 * detector rejects out-of-range values when it evaluates them.
 * </p>
 *
 * @since 1.0.0
 */
public final class Indicators implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Normalized forecast error (EP). */
    private final double forecastError;

    /** Normalized variance change (MV). */
    private final double varianceChange;

    /** Normalized correlation change (MC). */
    private final double correlationChange;

    public Indicators(double forecastError, double varianceChange, double correlationChange) {
        this.forecastError = forecastError;
        this.varianceChange = varianceChange;
        this.correlationChange = correlationChange;
    }

    public double getForecastError() {
        return forecastError;
    }

    public double getVarianceChange() {
        return varianceChange;
    }

    public double getCorrelationChange() {
        return correlationChange;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Indicators that))
            return false;
        return Double.compare(forecastError, that.forecastError) == 0
                && Double.compare(varianceChange, that.varianceChange) == 0
                && Double.compare(correlationChange, that.correlationChange) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(forecastError, varianceChange, correlationChange);
    }

    @Override
    public String toString() {
        return String.format("Indicators{ep=%.3f, mv=%.3f, mc=%.3f}",
                forecastError, varianceChange, correlationChange);
    }
}
