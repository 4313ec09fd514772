package com.fuzzysentinel.core.inference;

import com.fuzzysentinel.core.model.LinguisticVariable;

import java.util.OptionalDouble;

/**
 * Centre-of-mass defuzzification over a sampled output domain.
 *
 * <p>
 * The domain {@code [min, max]} is split into equal steps no wider than the
 * configured resolution. The centroid is
 * {@code sum(x * mu(x)) / sum(mu(x))} over the sample points.
 * </p>
 *
 * <p>
 * When the aggregated membership is zero at every sample the centroid is
 * undefined and {@link #defuzzify(AggregatedOutput)} returns an empty
 * result. The caller owns the fallback.
 * </p>
 *
 * @since 1.0.0
 */
final class CentroidDefuzzifier {

    private final double resolution;

    CentroidDefuzzifier(double resolution) {
        if (!(resolution > 0)) {
            throw new IllegalArgumentException("resolution must be > 0, got: " + resolution);
        }
        this.resolution = resolution;
    }

    OptionalDouble defuzzify(AggregatedOutput aggregated) {
        LinguisticVariable output = aggregated.getOutput();
        int samples = sampleCount(output, resolution);
        double min = output.getMin();
        double step = (output.getMax() - min) / samples;

        double weightedSum = 0.0;
        double mass = 0.0;
        for (int i = 0; i <= samples; i++) {
            double x = min + i * step;
            double mu = aggregated.membership(x);
            weightedSum += x * mu;
            mass += mu;
        }

        if (mass == 0.0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(weightedSum / mass);
    }

    /**
     * Number of intervals used to sample {@code output}'s domain; the sample
     * count is one more.
     *
     * @throws IllegalArgumentException if the domain would need more than
     *                                  {@link InferenceConfig#MAX_SAMPLES}
     *                                  intervals
     */
    static int sampleCount(LinguisticVariable output, double resolution) {
        double span = output.getMax() - output.getMin();
        long intervals = Math.max(1L, (long) Math.ceil(span / resolution - 1e-9));
        if (intervals > InferenceConfig.MAX_SAMPLES) {
            throw new IllegalArgumentException("resolution " + resolution + " splits '" + output.getName()
                    + "' into " + intervals + " intervals; at most " + InferenceConfig.MAX_SAMPLES + " allowed");
        }
        return (int) intervals;
    }
}
