package com.fuzzysentinel.core.indicators;

import com.fuzzysentinel.core.model.Indicators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * Computes the three normalized indicators of a window against a baseline.
 *
 * <p>
 * Windows are {@code double[rows][columns]}: one row per time step, one
 * column per series. Window and baseline must be rectangular, have at least
 * {@value #MIN_ROWS} rows and the same number of columns.
 * </p>
 *
 * <h3>Indicators</h3>
 * <ul>
 * <li>Forecast error (EP): mean absolute error divided by the range of the
 * actual values</li>
 * <li>Variance change (MV): mean increase of the per-series variance ratio,
 * ratio capped at {@value #MAX_VARIANCE_RATIO}</li>
 * <li>Correlation change (MC): Frobenius norm of the difference between the
 * correlation matrices, relative to {@code 2 × columns}</li>
 * </ul>
 * <p>
 * Every indicator is clipped to {@code [0, 1]}.
 * </p>
 *
 * @since 1.0.0
 */
public final class IndicatorExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(IndicatorExtractor.class);

    /** Guards every division against a zero denominator. */
    static final double EPSILON = 1e-6;

    static final int MIN_ROWS = 2;

    static final double MAX_VARIANCE_RATIO = 5.0;

    private IndicatorExtractor() {
        // utility class
    }

    /**
     * Compute all three indicators.
     *
     * <p>
     * The forecast error compares the window's first series with a constant
     * forecast: the mean of the baseline's first series.
     * </p>
     *
     * @param window   observed window
     * @param baseline reference regime
     * @return the indicators, each in {@code [0, 1]}
     * @throws IllegalArgumentException if the shapes are invalid
     */
    public static Indicators extract(double[][] window, double[][] baseline) {
        requireCompatible(window, baseline);

        double[] actual = column(window, 0);
        double[] predicted = new double[actual.length];
        Arrays.fill(predicted, mean(column(baseline, 0)));

        Indicators indicators = new Indicators(
                forecastError(actual, predicted),
                varianceChange(window, baseline),
                correlationChange(window, baseline));
        LOG.debug("Extracted {}", indicators);
        return indicators;
    }

    /**
     * @param actual    observed values
     * @param predicted forecast values, same length as {@code actual}
     * @return normalized mean absolute error in {@code [0, 1]}
     */
    public static double forecastError(double[] actual, double[] predicted) {
        Objects.requireNonNull(actual, "Actual values must not be null");
        Objects.requireNonNull(predicted, "Predicted values must not be null");
        if (actual.length == 0 || actual.length != predicted.length) {
            throw new IllegalArgumentException("Actual and predicted values must be non-empty and of equal length, got: "
                    + actual.length + " and " + predicted.length);
        }

        double absErrorSum = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < actual.length; i++) {
            absErrorSum += Math.abs(actual[i] - predicted[i]);
            min = Math.min(min, actual[i]);
            max = Math.max(max, actual[i]);
        }
        double mae = absErrorSum / actual.length;
        double range = max - min;
        return clip01(mae / (range + 2 * EPSILON));
    }

    /**
     * @return normalized variance increase in {@code [0, 1]}
     */
    public static double varianceChange(double[][] window, double[][] baseline) {
        requireCompatible(window, baseline);

        int columns = window[0].length;
        double excessSum = 0;
        for (int j = 0; j < columns; j++) {
            double ratio = variance(column(window, j)) / (variance(column(baseline, j)) + EPSILON);
            ratio = Math.min(Math.max(ratio, 0.0), MAX_VARIANCE_RATIO);
            excessSum += ratio - 1.0;
        }
        double score = excessSum / columns;
        return clip01(score / (MAX_VARIANCE_RATIO - 1.0));
    }

    /**
     * @return normalized correlation structure change in {@code [0, 1]}
     */
    public static double correlationChange(double[][] window, double[][] baseline) {
        requireCompatible(window, baseline);

        double[][] corrWindow = correlationMatrix(window);
        double[][] corrBaseline = correlationMatrix(baseline);

        int d = corrWindow.length;
        double sumSquares = 0;
        for (int i = 0; i < d; i++) {
            for (int j = 0; j < d; j++) {
                double diff = corrWindow[i][j] - corrBaseline[i][j];
                sumSquares += diff * diff;
            }
        }
        double frobenius = Math.sqrt(sumSquares);
        return clip01(frobenius / (2.0 * d + EPSILON));
    }

    // ---------------------------------------------------------------
    // Statistics helpers
    // ---------------------------------------------------------------

    /**
     * Pearson correlation matrix of the columns. A column with zero variance
     * correlates {@code 0} with every other column and {@code 1} with itself.
     */
    static double[][] correlationMatrix(double[][] data) {
        int columns = data[0].length;
        double[][] centered = new double[columns][];
        double[] norms = new double[columns];
        for (int j = 0; j < columns; j++) {
            double[] col = column(data, j);
            double mean = mean(col);
            double sumSquares = 0;
            for (int i = 0; i < col.length; i++) {
                col[i] -= mean;
                sumSquares += col[i] * col[i];
            }
            centered[j] = col;
            norms[j] = Math.sqrt(sumSquares);
        }

        double[][] corr = new double[columns][columns];
        for (int a = 0; a < columns; a++) {
            corr[a][a] = 1.0;
            for (int b = a + 1; b < columns; b++) {
                double value = 0.0;
                if (norms[a] > 0 && norms[b] > 0) {
                    double dot = 0;
                    for (int i = 0; i < centered[a].length; i++) {
                        dot += centered[a][i] * centered[b][i];
                    }
                    value = dot / (norms[a] * norms[b]);
                }
                corr[a][b] = value;
                corr[b][a] = value;
            }
        }
        return corr;
    }

    /** Population variance. */
    static double variance(double[] values) {
        double mean = mean(values);
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return sumSquaredDiff / values.length;
    }

    static double mean(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    private static double[] column(double[][] data, int j) {
        double[] col = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            col[i] = data[i][j];
        }
        return col;
    }

    private static double clip01(double value) {
        return Math.min(Math.max(value, 0.0), 1.0);
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    private static void requireCompatible(double[][] window, double[][] baseline) {
        int windowColumns = requireRectangular(window, "window");
        int baselineColumns = requireRectangular(baseline, "baseline");
        if (windowColumns != baselineColumns) {
            throw new IllegalArgumentException("Window has " + windowColumns
                    + " series but baseline has " + baselineColumns);
        }
    }

    private static int requireRectangular(double[][] data, String name) {
        Objects.requireNonNull(data, name + " must not be null");
        if (data.length < MIN_ROWS) {
            throw new IllegalArgumentException(
                    name + " requires at least " + MIN_ROWS + " rows, got: " + data.length);
        }
        int columns = Objects.requireNonNull(data[0], name + " row 0 must not be null").length;
        if (columns == 0) {
            throw new IllegalArgumentException(name + " requires at least one series");
        }
        for (int i = 1; i < data.length; i++) {
            if (data[i] == null || data[i].length != columns) {
                throw new IllegalArgumentException(name + " row " + i + " does not have " + columns + " values");
            }
        }
        return columns;
    }
}
