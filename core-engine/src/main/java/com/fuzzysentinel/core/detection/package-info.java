/**
 * Detector facade.
 *
 * <p>
 * {@link com.fuzzysentinel.core.detection.AnomalyDetector} is the only API
 * callers need: three indicators in, an
 * {@link com.fuzzysentinel.core.model.EvaluationResult} out.
 * {@link com.fuzzysentinel.core.detection.FuzzyAnomalyDetector} implements it
 * on top of the Mamdani engine and is created from settings by
 * {@link com.fuzzysentinel.core.detection.DetectorFactory}.
 * </p>
 *
 * @since 1.0.0
 */
package com.fuzzysentinel.core.detection;
