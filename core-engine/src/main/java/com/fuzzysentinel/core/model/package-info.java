/**
 * Fuzzy building blocks and value types for Fuzzy Sentinel.
 *
 * <ul>
 * <li>{@link com.fuzzysentinel.core.model.MembershipFunction} with the
 * triangular and trapezoidal shapes</li>
 * <li>{@link com.fuzzysentinel.core.model.FuzzySet} and
 * {@link com.fuzzysentinel.core.model.LinguisticVariable}</li>
 * <li>{@link com.fuzzysentinel.core.model.Indicators}, the detector input</li>
 * <li>{@link com.fuzzysentinel.core.model.EvaluationResult}, the detector
 * output</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.fuzzysentinel.core.model;
