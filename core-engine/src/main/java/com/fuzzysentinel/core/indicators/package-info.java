/**
 * Indicator extraction: turns a multivariate window and its baseline into
 * the three normalized inputs of the detector.
 *
 * @since 1.0.0
 */
package com.fuzzysentinel.core.indicators;
