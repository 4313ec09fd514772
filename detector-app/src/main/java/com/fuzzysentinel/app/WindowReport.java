package com.fuzzysentinel.app;

import com.fuzzysentinel.core.model.Outcome;

import java.time.Instant;
import java.util.Objects;

/**
 * Scored window: its indicators and the detector's verdict.
 *
 * <p>
 * Serialized to JSON or text by {@link ReportSerializer}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code window}, {@code timestamp}, {@code label}
 * and {@code outcome} are required; omitting any of them throws a
 * {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public class WindowReport {

    /** Name of the scored window, e.g. {@code normal}. */
    private String window;

    /** When the window was scored. */
    private Instant timestamp;

    private double forecastError;
    private double varianceChange;
    private double correlationChange;

    /** Crisp anomaly level in {@code [0, 10]}. */
    private double score;

    private String label;
    private Outcome outcome;

    /** Strongest rule, or {@code null} when no rule fired. */
    private String dominantRule;

    // ---------------------------------------------------------------
    // Constructors
    // ---------------------------------------------------------------

    /** No-arg constructor required by Jackson. */
    public WindowReport() {
    }

    private WindowReport(Builder builder) {
        this.window = Objects.requireNonNull(builder.window, "window must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.forecastError = builder.forecastError;
        this.varianceChange = builder.varianceChange;
        this.correlationChange = builder.correlationChange;
        this.score = builder.score;
        this.label = Objects.requireNonNull(builder.label, "label must not be null");
        this.outcome = Objects.requireNonNull(builder.outcome, "outcome must not be null");
        this.dominantRule = builder.dominantRule;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link WindowReport} instances.
     */
    public static class Builder {
        private String window;
        private Instant timestamp;
        private double forecastError;
        private double varianceChange;
        private double correlationChange;
        private double score;
        private String label;
        private Outcome outcome;
        private String dominantRule;

        public Builder window(String window) {
            this.window = window;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder forecastError(double forecastError) {
            this.forecastError = forecastError;
            return this;
        }

        public Builder varianceChange(double varianceChange) {
            this.varianceChange = varianceChange;
            return this;
        }

        public Builder correlationChange(double correlationChange) {
            this.correlationChange = correlationChange;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder outcome(Outcome outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder dominantRule(String dominantRule) {
            this.dominantRule = dominantRule;
            return this;
        }

        public WindowReport build() {
            return new WindowReport(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public String getWindow() {
        return window;
    }

    public void setWindow(String window) {
        this.window = window;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public double getForecastError() {
        return forecastError;
    }

    public void setForecastError(double forecastError) {
        this.forecastError = forecastError;
    }

    public double getVarianceChange() {
        return varianceChange;
    }

    public void setVarianceChange(double varianceChange) {
        this.varianceChange = varianceChange;
    }

    public double getCorrelationChange() {
        return correlationChange;
    }

    public void setCorrelationChange(double correlationChange) {
        this.correlationChange = correlationChange;
    }

    public double getScore() {
        return score;
    }

    public void setScore(double score) {
        this.score = score;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public void setOutcome(Outcome outcome) {
        this.outcome = outcome;
    }

    public String getDominantRule() {
        return dominantRule;
    }

    public void setDominantRule(String dominantRule) {
        this.dominantRule = dominantRule;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof WindowReport that))
            return false;
        return Double.compare(that.score, score) == 0
                && Objects.equals(window, that.window)
                && Objects.equals(timestamp, that.timestamp)
                && Objects.equals(label, that.label)
                && outcome == that.outcome;
    }

    @Override
    public int hashCode() {
        return Objects.hash(window, timestamp, score, label, outcome);
    }

    @Override
    public String toString() {
        return "WindowReport{" +
                "window='" + window + '\'' +
                ", timestamp=" + timestamp +
                ", score=" + score +
                ", label='" + label + '\'' +
                ", outcome=" + outcome +
                '}';
    }
}
