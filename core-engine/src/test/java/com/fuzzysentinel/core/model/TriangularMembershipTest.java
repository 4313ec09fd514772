package com.fuzzysentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link TriangularMembership}.
 */
class TriangularMembershipTest {

    @Test
    @DisplayName("Should rise linearly, peak at b and fall linearly")
    void shouldInterpolateBetweenFeet() {
        TriangularMembership medium = new TriangularMembership(0.2, 0.5, 0.8);

        assertThat(medium.degree(0.2)).isZero();
        assertThat(medium.degree(0.35)).isCloseTo(0.5, within(1e-9));
        assertThat(medium.degree(0.5)).isEqualTo(1.0);
        assertThat(medium.degree(0.65)).isCloseTo(0.5, within(1e-9));
        assertThat(medium.degree(0.8)).isZero();
    }

    @Test
    @DisplayName("Should return zero outside the support")
    void shouldBeZeroOutsideSupport() {
        TriangularMembership medium = new TriangularMembership(0.2, 0.5, 0.8);

        assertThat(medium.degree(-1.0)).isZero();
        assertThat(medium.degree(0.1)).isZero();
        assertThat(medium.degree(0.9)).isZero();
        assertThat(medium.degree(Double.NaN)).isZero();
    }

    @Test
    @DisplayName("Should treat a zero-width left edge as a step")
    void shouldHandleLeftShoulder() {
        TriangularMembership low = new TriangularMembership(0.0, 0.0, 0.4);

        assertThat(low.degree(0.0)).isEqualTo(1.0);
        assertThat(low.degree(0.2)).isCloseTo(0.5, within(1e-9));
        assertThat(low.degree(0.4)).isZero();
    }

    @Test
    @DisplayName("Should treat a zero-width right edge as a step")
    void shouldHandleRightShoulder() {
        TriangularMembership high = new TriangularMembership(0.6, 1.0, 1.0);

        assertThat(high.degree(1.0)).isEqualTo(1.0);
        assertThat(high.degree(0.8)).isCloseTo(0.5, within(1e-9));
        assertThat(high.degree(0.6)).isZero();
    }

    @Test
    @DisplayName("Should collapse to a spike when all three points coincide")
    void shouldHandleSpike() {
        TriangularMembership spike = new TriangularMembership(3.0, 3.0, 3.0);

        assertThat(spike.degree(3.0)).isEqualTo(1.0);
        assertThat(spike.degree(2.999)).isZero();
        assertThat(spike.degree(3.001)).isZero();
    }

    @Test
    @DisplayName("Should reject decreasing parameters")
    void shouldRejectDecreasingParameters() {
        assertThatThrownBy(() -> new TriangularMembership(0.5, 0.2, 0.8))
                .isInstanceOf(InvalidShapeException.class)
                .hasMessageContaining("non-decreasing");
    }

    @Test
    @DisplayName("Should reject non-finite parameters")
    void shouldRejectNonFiniteParameters() {
        assertThatThrownBy(() -> new TriangularMembership(0.0, Double.NaN, 1.0))
                .isInstanceOf(InvalidShapeException.class);
        assertThatThrownBy(() -> new TriangularMembership(0.0, 0.5, Double.POSITIVE_INFINITY))
                .isInstanceOf(InvalidShapeException.class);
    }

    @Test
    @DisplayName("Should expose its support and peak")
    void shouldExposeSupport() {
        TriangularMembership shape = new TriangularMembership(1, 3, 5);

        assertThat(shape.supportStart()).isEqualTo(1.0);
        assertThat(shape.getPeak()).isEqualTo(3.0);
        assertThat(shape.supportEnd()).isEqualTo(5.0);
        assertThat(shape).isEqualTo(new TriangularMembership(1, 3, 5));
    }
}
