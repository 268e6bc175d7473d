package com.driftsentinel.core.detection;

import com.driftsentinel.core.model.SentimentLabel;

import java.util.Map;

/**
 * Largest absolute difference between an observed and an expected label
 * proportion. Simple to explain; typical critical threshold around 0.2.
 *
 * @since 1.0.0
 */
public class MaxAbsoluteDistance implements DistributionDistance {

    @Override
    public double distance(Map<SentimentLabel, Double> current, Map<SentimentLabel, Double> baseline) {
        double max = 0;
        for (SentimentLabel label : SentimentLabel.values()) {
            max = Math.max(max, Math.abs(current.getOrDefault(label, 0.0) - baseline.get(label)));
        }
        return max;
    }

    @Override
    public String getName() {
        return DistanceFactory.MAX_ABS;
    }
}
