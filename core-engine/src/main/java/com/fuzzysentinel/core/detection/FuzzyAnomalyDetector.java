package com.fuzzysentinel.core.detection;

import com.fuzzysentinel.core.inference.InferenceConfig;
import com.fuzzysentinel.core.inference.InferenceEngine;
import com.fuzzysentinel.core.model.EvaluationResult;
import com.fuzzysentinel.core.model.LinguisticVariable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.fuzzysentinel.core.config.StandardFuzzySystem.CORRELATION_CHANGE;
import static com.fuzzysentinel.core.config.StandardFuzzySystem.FORECAST_ERROR;
import static com.fuzzysentinel.core.config.StandardFuzzySystem.VARIANCE_CHANGE;

/**
 * Fuzzy anomaly detector: the single entry point over the Mamdani engine.
 *
 * <p>
 * Callers pass the three indicators and get a score with its label; they
 * never touch membership functions or rules. The detector owns an immutable
 * {@link InferenceConfig}, built once at startup, whose inputs must include
 * {@code forecast_error}, {@code variance_change} and
 * {@code correlation_change}.
 * </p>
 *
 * <p>
 * This detector is <strong>stateless</strong>: any number of threads may
 * call {@link #evaluate(double, double, double)} on one instance.
 * </p>
 *
 * @since 1.0.0
 */
public class FuzzyAnomalyDetector implements AnomalyDetector {

    private final InferenceEngine engine;

    /**
     * @param config validated inference configuration
     * @throws NullPointerException     if {@code config} is {@code null}
     * @throws IllegalArgumentException if the configuration does not declare
     *                                  exactly the three indicator inputs
     */
    public FuzzyAnomalyDetector(InferenceConfig config) {
        Objects.requireNonNull(config, "InferenceConfig must not be null");
        requireIndicatorInputs(config);
        this.engine = new InferenceEngine(config);
    }

    @Override
    public EvaluationResult evaluate(double forecastError, double varianceChange, double correlationChange) {
        Map<String, Double> inputs = new LinkedHashMap<>();
        inputs.put(FORECAST_ERROR, forecastError);
        inputs.put(VARIANCE_CHANGE, varianceChange);
        inputs.put(CORRELATION_CHANGE, correlationChange);
        return engine.evaluate(inputs);
    }

    public InferenceConfig getConfig() {
        return engine.getConfig();
    }

    private static void requireIndicatorInputs(InferenceConfig config) {
        List<String> names = config.getInputs().stream().map(LinguisticVariable::getName).toList();
        if (names.size() != 3
                || !names.contains(FORECAST_ERROR)
                || !names.contains(VARIANCE_CHANGE)
                || !names.contains(CORRELATION_CHANGE)) {
            throw new IllegalArgumentException(
                    "Detector requires inputs [" + FORECAST_ERROR + ", " + VARIANCE_CHANGE + ", "
                            + CORRELATION_CHANGE + "], got: " + names);
        }
    }

    @Override
    public String toString() {
        return "FuzzyAnomalyDetector{" + engine.getConfig() + '}';
    }
}
