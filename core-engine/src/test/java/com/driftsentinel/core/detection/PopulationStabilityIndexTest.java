package com.driftsentinel.core.detection;

import com.driftsentinel.core.config.BaselineDistribution;
import com.driftsentinel.core.model.SentimentLabel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link PopulationStabilityIndex} and the other
 * {@link DistributionDistance} implementations.
 */
class PopulationStabilityIndexTest {

    private final Map<SentimentLabel, Double> baseline = BaselineDistribution.defaults().getProportions();

    @Test
    @DisplayName("Should be zero when current matches baseline")
    void shouldBeZeroForIdenticalDistributions() {
        assertThat(new PopulationStabilityIndex().distance(baseline, baseline)).isZero();
        assertThat(new ChiSquareDistance().distance(baseline, baseline)).isZero();
        assertThat(new MaxAbsoluteDistance().distance(baseline, baseline)).isZero();
    }

    @Test
    @DisplayName("Should grow as the distribution moves away from baseline")
    void shouldIncreaseMonotonically() {
        PopulationStabilityIndex psi = new PopulationStabilityIndex();

        double slight = psi.distance(distribution(0.30, 0.30, 0.40), baseline);
        double moderate = psi.distance(distribution(0.20, 0.20, 0.60), baseline);
        double total = psi.distance(distribution(0.0, 0.0, 1.0), baseline);

        assertThat(slight).isPositive().isLessThan(moderate);
        assertThat(moderate).isLessThan(total);
    }

    @Test
    @DisplayName("Should stay finite when a label disappears from the window")
    void shouldStayFiniteForZeroProportion() {
        double value = new PopulationStabilityIndex().distance(distribution(0.0, 0.0, 1.0), baseline);

        assertThat(value).isFinite().isGreaterThan(5.0);
    }

    @Test
    @DisplayName("Should compute chi-square and max-abs distances")
    void shouldComputeAlternativeDistances() {
        Map<SentimentLabel, Double> current = distribution(0.2, 0.2, 0.6);

        double expectedChi = sq(0.2 - 0.33) / 0.33 + sq(0.2 - 0.34) / 0.34 + sq(0.6 - 0.33) / 0.33;
        assertThat(new ChiSquareDistance().distance(current, baseline)).isCloseTo(expectedChi, within(1e-9));
        assertThat(new MaxAbsoluteDistance().distance(current, baseline)).isCloseTo(0.27, within(1e-9));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Map<SentimentLabel, Double> distribution(double negative, double neutral, double positive) {
        Map<SentimentLabel, Double> d = new EnumMap<>(SentimentLabel.class);
        d.put(SentimentLabel.NEGATIVE, negative);
        d.put(SentimentLabel.NEUTRAL, neutral);
        d.put(SentimentLabel.POSITIVE, positive);
        return d;
    }

    private static double sq(double v) {
        return v * v;
    }
}
