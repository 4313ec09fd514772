package com.fuzzysentinel.core.model;

import java.util.Arrays;

/**
 * Parameter checks shared by the membership function shapes.
 */
final class Shapes {

    private Shapes() {
        // utility class
    }

    static void requireFinite(String shape, double... params) {
        for (double p : params) {
            if (!Double.isFinite(p)) {
                throw new InvalidShapeException(
                        "Invalid " + shape + " shape " + Arrays.toString(params)
                                + ": parameters must be finite");
            }
        }
    }

    static void requireNonDecreasing(String shape, double... params) {
        for (int i = 1; i < params.length; i++) {
            if (params[i] < params[i - 1]) {
                throw new InvalidShapeException(
                        "Invalid " + shape + " shape " + Arrays.toString(params)
                                + ": parameters must be non-decreasing");
            }
        }
    }
}
