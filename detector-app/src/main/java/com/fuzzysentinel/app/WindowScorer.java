package com.fuzzysentinel.app;

import com.fuzzysentinel.core.detection.AnomalyDetector;
import com.fuzzysentinel.core.indicators.IndicatorExtractor;
import com.fuzzysentinel.core.model.EvaluationResult;
import com.fuzzysentinel.core.model.Indicators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Scores windows against a baseline: extracts the indicators, runs the
 * detector and wraps the verdict in a {@link WindowReport}.
 */
public class WindowScorer {

    private static final Logger LOG = LoggerFactory.getLogger(WindowScorer.class);

    private final AnomalyDetector detector;
    private final Clock clock;

    public WindowScorer(AnomalyDetector detector) {
        this(detector, Clock.systemUTC());
    }

    WindowScorer(AnomalyDetector detector, Clock clock) {
        this.detector = Objects.requireNonNull(detector, "AnomalyDetector must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    /**
     * @param name     window name carried into the report
     * @param window   observed window
     * @param baseline reference regime
     * @throws IllegalArgumentException if the window shapes are invalid
     */
    public WindowReport score(String name, double[][] window, double[][] baseline) {
        Objects.requireNonNull(name, "Window name must not be null");

        Indicators indicators = IndicatorExtractor.extract(window, baseline);
        EvaluationResult result = detector.evaluate(indicators);

        if (result.isUndetermined()) {
            LOG.warn("Window '{}' is not covered by any rule: {}", name, indicators);
        }
        LOG.info("Window '{}' scored {} ({})", name, result.getScore(), result.getLabel());

        return WindowReport.builder()
                .window(name)
                .timestamp(clock.instant())
                .forecastError(indicators.getForecastError())
                .varianceChange(indicators.getVarianceChange())
                .correlationChange(indicators.getCorrelationChange())
                .score(result.getScore())
                .label(result.getLabel())
                .outcome(result.getOutcome())
                .dominantRule(result.getDominantRule().orElse(null))
                .build();
    }
}
