package com.fuzzysentinel.core.detection;

import com.fuzzysentinel.core.model.EvaluationResult;
import com.fuzzysentinel.core.model.Indicators;

import java.util.Objects;

/**
 * Contract for anomaly detectors scoring one time-series window from its
 * three normalized indicators.
 * <p>
 * Implementations are expected to be <strong>stateless</strong> across
 * calls: the same indicators always produce the same result, and one
 * instance may be shared by concurrent callers.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * Score one window.
     *
     * @param forecastError     normalized forecast error, in {@code [0, 1]}
     * @param varianceChange    normalized variance change, in {@code [0, 1]}
     * @param correlationChange normalized correlation change, in {@code [0, 1]}
     * @return score in {@code [0, 10]} with its label
     * @throws com.fuzzysentinel.core.inference.InputOutOfRangeException
     *         if an indicator is outside {@code [0, 1]}
     */
    EvaluationResult evaluate(double forecastError, double varianceChange, double correlationChange);

    /**
     * Score one window from an {@link Indicators} value.
     */
    default EvaluationResult evaluate(Indicators indicators) {
        Objects.requireNonNull(indicators, "Indicators must not be null");
        return evaluate(indicators.getForecastError(),
                indicators.getVarianceChange(),
                indicators.getCorrelationChange());
    }
}
