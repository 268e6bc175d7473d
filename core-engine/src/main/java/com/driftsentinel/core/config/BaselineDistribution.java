package com.driftsentinel.core.config;

import com.driftsentinel.core.model.SentimentLabel;
import com.driftsentinel.core.model.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reference label distribution and mean confidence the deployed model is
 * expected to produce, established at validation time.
 *
 * <p>
 * Fixed for the lifetime of a monitor. Every label must have a strictly
 * positive proportion so that ratio-based distances stay finite.
 * </p>
 *
 * @since 1.0.0
 */
public final class BaselineDistribution {

    /** Allowed deviation of the proportion sum from 1. */
    public static final double SUM_TOLERANCE = 1e-3;

    private final Map<SentimentLabel, Double> proportions;
    private final double meanConfidence;

    /**
     * @param proportions    label to expected proportion; all three labels
     *                       required
     * @param meanConfidence expected mean confidence in [0, 1]
     * @throws ValidationException if the distribution is malformed
     */
    public BaselineDistribution(Map<SentimentLabel, Double> proportions, double meanConfidence) {
        Objects.requireNonNull(proportions, "Baseline proportions must not be null");
        List<String> errors = new ArrayList<>();

        double sum = 0;
        for (SentimentLabel label : SentimentLabel.values()) {
            Double p = proportions.get(label);
            if (p == null) {
                errors.add("Baseline proportion for " + label + " is required");
            } else if (!(p > 0 && p <= 1)) {
                errors.add("Baseline proportion for " + label + " must be in (0, 1], got: " + p);
            } else {
                sum += p;
            }
        }
        if (errors.isEmpty() && Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            errors.add("Baseline proportions must sum to 1, got: " + sum);
        }
        if (!(meanConfidence >= 0 && meanConfidence <= 1)) {
            errors.add("Baseline mean confidence must be in [0, 1], got: " + meanConfidence);
        }
        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid baseline distribution", errors);
        }

        this.proportions = Collections.unmodifiableMap(new EnumMap<>(proportions));
        this.meanConfidence = meanConfidence;
    }

    /**
     * The near-uniform baseline used when no calibration data is configured.
     *
     * @return Negative 0.33, Neutral 0.34, Positive 0.33, mean confidence 0.8
     */
    public static BaselineDistribution defaults() {
        Map<SentimentLabel, Double> p = new EnumMap<>(SentimentLabel.class);
        p.put(SentimentLabel.NEGATIVE, 0.33);
        p.put(SentimentLabel.NEUTRAL, 0.34);
        p.put(SentimentLabel.POSITIVE, 0.33);
        return new BaselineDistribution(p, 0.8);
    }

    public double getProportion(SentimentLabel label) {
        return proportions.get(label);
    }

    /**
     * @return unmodifiable label proportions
     */
    public Map<SentimentLabel, Double> getProportions() {
        return proportions;
    }

    public double getMeanConfidence() {
        return meanConfidence;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BaselineDistribution that))
            return false;
        return Double.compare(meanConfidence, that.meanConfidence) == 0
                && proportions.equals(that.proportions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(proportions, meanConfidence);
    }

    @Override
    public String toString() {
        return "BaselineDistribution{" + proportions + ", meanConfidence=" + meanConfidence + '}';
    }
}
