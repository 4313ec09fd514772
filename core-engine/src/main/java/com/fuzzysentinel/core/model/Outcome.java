package com.fuzzysentinel.core.model;

/**
 * How an {@link EvaluationResult} was obtained.
 */
public enum Outcome {

    /** At least one rule fired and the centroid was computed normally. */
    FIRED,

    /**
     * No rule fired; the nearest rules were fired with a compensatory
     * strength instead.
     */
    INTERPOLATED,

    /**
     * The aggregated output had zero mass. The score is the output domain
     * midpoint and the label is {@link EvaluationResult#UNDETERMINED_LABEL}.
     */
    UNDETERMINED
}
