package com.driftsentinel.core.detection;

import com.driftsentinel.core.model.SentimentLabel;

import java.util.Map;

/**
 * Population stability index over the three sentiment labels.
 *
 * <pre>
 *   PSI = Σ (cᵢ − bᵢ) · ln(cᵢ / bᵢ)
 * </pre>
 *
 * <p>
 * Each term is non-negative because {@code (c − b)} and {@code ln(c / b)}
 * always share a sign. Observed proportions of zero are floored at
 * {@value #MIN_PROPORTION} so that an empty class contributes a large but
 * finite term. Common reading: below 0.1 stable, 0.1 to 0.25 moderate shift,
 * above 0.25 significant shift.
 * </p>
 *
 * @since 1.0.0
 */
public class PopulationStabilityIndex implements DistributionDistance {

    static final double MIN_PROPORTION = 1e-4;

    @Override
    public double distance(Map<SentimentLabel, Double> current, Map<SentimentLabel, Double> baseline) {
        double psi = 0;
        for (SentimentLabel label : SentimentLabel.values()) {
            double b = baseline.get(label);
            double c = current.getOrDefault(label, 0.0);
            if (c == b) {
                continue;
            }
            double floored = Math.max(c, MIN_PROPORTION);
            psi += (floored - b) * Math.log(floored / b);
        }
        return psi;
    }

    @Override
    public String getName() {
        return DistanceFactory.PSI;
    }
}
