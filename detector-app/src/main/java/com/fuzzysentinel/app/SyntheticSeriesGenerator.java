package com.fuzzysentinel.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;

/**
 * Generates a reproducible three-series dataset for the runner.
 *
 * <ul>
 * <li>Baseline and normal window: independent standard normal series.</li>
 * <li>Anomalous window: multivariate normal with mean
 * {@link #ANOMALY_MEAN} and covariance {@link #ANOMALY_COVARIANCE}, drawn
 * through the Cholesky factor of the covariance.</li>
 * </ul>
 *
 * <p>
 * The same seed always yields the same dataset. Instances are not
 * thread-safe.
 * </p>
 */
public class SyntheticSeriesGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(SyntheticSeriesGenerator.class);

    static final int SERIES = 3;

    static final double[] ANOMALY_MEAN = {4.0, -4.0, 3.0};

    static final double[][] ANOMALY_COVARIANCE = {
            {4.0, 3.0, 2.0},
            {3.0, 5.0, 2.5},
            {2.0, 2.5, 3.5},
    };

    private final long seed;
    private final Random random;

    public SyntheticSeriesGenerator(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    /**
     * Draw baseline, normal window and anomalous window, in that order.
     *
     * @param baselineLength rows of the baseline, at least 2
     * @param windowLength   rows of each window, at least 2
     */
    public SyntheticDataset generate(int baselineLength, int windowLength) {
        if (baselineLength < 2 || windowLength < 2) {
            throw new IllegalArgumentException("Lengths must be >= 2, got baseline="
                    + baselineLength + ", window=" + windowLength);
        }
        double[][] baseline = standardNormal(baselineLength);
        double[][] normal = standardNormal(windowLength);
        double[][] anomalous = multivariateNormal(windowLength, ANOMALY_MEAN, cholesky(ANOMALY_COVARIANCE));

        LOG.info("Generated synthetic dataset: seed={}, baseline={}x{}, windows={}x{}",
                seed, baselineLength, SERIES, windowLength, SERIES);
        return new SyntheticDataset(baseline, normal, anomalous);
    }

    private double[][] standardNormal(int rows) {
        double[][] data = new double[rows][SERIES];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < SERIES; j++) {
                data[i][j] = random.nextGaussian();
            }
        }
        return data;
    }

    /**
     * {@code x = mean + L z} with {@code z} standard normal.
     */
    private double[][] multivariateNormal(int rows, double[] mean, double[][] lower) {
        int d = mean.length;
        double[][] data = new double[rows][d];
        double[] z = new double[d];
        for (int i = 0; i < rows; i++) {
            for (int k = 0; k < d; k++) {
                z[k] = random.nextGaussian();
            }
            for (int j = 0; j < d; j++) {
                double value = mean[j];
                for (int k = 0; k <= j; k++) {
                    value += lower[j][k] * z[k];
                }
                data[i][j] = value;
            }
        }
        return data;
    }

    /**
     * Lower-triangular {@code L} with {@code L * transpose(L) == matrix}.
     *
     * @throws IllegalArgumentException if the matrix is not positive definite
     */
    static double[][] cholesky(double[][] matrix) {
        int n = matrix.length;
        double[][] lower = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j <= i; j++) {
                double sum = matrix[i][j];
                for (int k = 0; k < j; k++) {
                    sum -= lower[i][k] * lower[j][k];
                }
                if (i == j) {
                    if (sum <= 0) {
                        throw new IllegalArgumentException("Covariance matrix is not positive definite");
                    }
                    lower[i][i] = Math.sqrt(sum);
                } else {
                    lower[i][j] = sum / lower[j][j];
                }
            }
        }
        return lower;
    }
}
