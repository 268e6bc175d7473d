package com.driftsentinel.core.detection;

import com.driftsentinel.core.model.SentimentLabel;

import java.util.Map;

/**
 * Pearson chi-square statistic computed on proportions rather than counts,
 * so the value does not scale with the window size.
 *
 * <pre>
 *   χ² = Σ (cᵢ − bᵢ)² / bᵢ
 * </pre>
 *
 * @since 1.0.0
 */
public class ChiSquareDistance implements DistributionDistance {

    @Override
    public double distance(Map<SentimentLabel, Double> current, Map<SentimentLabel, Double> baseline) {
        double chi = 0;
        for (SentimentLabel label : SentimentLabel.values()) {
            double b = baseline.get(label);
            double diff = current.getOrDefault(label, 0.0) - b;
            chi += diff * diff / b;
        }
        return chi;
    }

    @Override
    public String getName() {
        return DistanceFactory.CHI_SQUARE;
    }
}
