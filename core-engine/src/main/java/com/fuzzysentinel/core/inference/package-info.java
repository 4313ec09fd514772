/**
 * Mamdani inference: fuzzification, rule firing, max aggregation and
 * centroid defuzzification.
 *
 * <p>
 * {@link com.fuzzysentinel.core.inference.InferenceEngine} evaluates an
 * immutable {@link com.fuzzysentinel.core.inference.InferenceConfig}.
 * {@link com.fuzzysentinel.core.inference.CoveragePolicy} decides what
 * happens when no rule fires.
 * </p>
 *
 * @since 1.0.0
 */
package com.fuzzysentinel.core.inference;
