package com.driftsentinel.core.detection;

import com.driftsentinel.core.model.SentimentLabel;

import java.util.Map;

/**
 * Contract for the statistical distance between the current label
 * distribution and the baseline.
 * <p>
 * Implementations must be stateless, return a non-negative value, return
 * exactly {@code 0} when both distributions are identical, and grow as the
 * current distribution moves away from the baseline.
 * </p>
 */
public interface DistributionDistance {

    /**
     * @param current  observed proportion per label; sums to 1
     * @param baseline expected proportion per label; every value {@code > 0}
     * @return the distance, {@code >= 0}
     */
    double distance(Map<SentimentLabel, Double> current, Map<SentimentLabel, Double> baseline);

    /**
     * @return the name used to select this distance in configuration
     */
    String getName();
}
