package com.driftsentinel.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DistanceFactory}.
 */
class DistanceFactoryTest {

    @Test
    @DisplayName("Should create PopulationStabilityIndex for 'psi'")
    void shouldCreatePsi() {
        assertThat(DistanceFactory.create("psi")).isInstanceOf(PopulationStabilityIndex.class);
    }

    @Test
    @DisplayName("Should create ChiSquareDistance for 'chi-square'")
    void shouldCreateChiSquare() {
        assertThat(DistanceFactory.create("chi-square")).isInstanceOf(ChiSquareDistance.class);
    }

    @Test
    @DisplayName("Should create MaxAbsoluteDistance for 'max-abs'")
    void shouldCreateMaxAbs() {
        assertThat(DistanceFactory.create("max-abs")).isInstanceOf(MaxAbsoluteDistance.class);
    }

    @Test
    @DisplayName("Should be case-insensitive and ignore surrounding whitespace")
    void shouldBeCaseInsensitive() {
        assertThat(DistanceFactory.create(" PSI ")).isInstanceOf(PopulationStabilityIndex.class);
        assertThat(DistanceFactory.isSupported("Max-Abs")).isTrue();
    }

    @Test
    @DisplayName("Should throw for unknown metric name")
    void shouldThrowForUnknownMetric() {
        assertThatThrownBy(() -> DistanceFactory.create("kl-divergence"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown distance metric");
        assertThat(DistanceFactory.isSupported(null)).isFalse();
    }

    @Test
    @DisplayName("Should report each distance under the name it was created with")
    void shouldRoundTripNames() {
        for (String name : DistanceFactory.supportedNames()) {
            assertThat(DistanceFactory.create(name).getName()).isEqualTo(name);
        }
    }
}
