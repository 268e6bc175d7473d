package com.driftsentinel.core.detection;

import com.driftsentinel.core.config.BaselineDistribution;
import com.driftsentinel.core.config.MonitorConfig;
import com.driftsentinel.core.model.DriftMetric;
import com.driftsentinel.core.model.DriftStatus;
import com.driftsentinel.core.model.SentimentLabel;
import com.driftsentinel.core.window.WindowSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Compares the label distribution and mean confidence of a window snapshot
 * against the baseline.
 *
 * <p>
 * Stateless: every call recomputes from the snapshot it is given, so a
 * result can never be stale with respect to the window it was taken from.
 * </p>
 *
 * <h3>Warm-up</h3>
 * <p>
 * Below {@code minSamples} records the detector returns an
 * {@link DriftStatus#INSUFFICIENT_DATA} metric instead of a distance; a
 * handful of predictions says nothing about the distribution.
 * </p>
 *
 * @since 1.0.0
 */
public class DriftDetector {

    private static final Logger LOG = LoggerFactory.getLogger(DriftDetector.class);

    private final DistributionDistance distance;
    private final int minSamples;
    private final double warnThreshold;
    private final double criticalThreshold;

    /**
     * @param distance          distance strategy; must not be {@code null}
     * @param minSamples        records required before measuring; {@code >= 1}
     * @param warnThreshold     distance at which drift is a warning
     * @param criticalThreshold distance at which drift is critical; must be
     *                          greater than {@code warnThreshold}
     * @throws IllegalArgumentException if the thresholds or sample count are
     *                                  invalid
     */
    public DriftDetector(DistributionDistance distance, int minSamples,
            double warnThreshold, double criticalThreshold) {
        this.distance = Objects.requireNonNull(distance, "DistributionDistance must not be null");
        if (minSamples < 1) {
            throw new IllegalArgumentException("minSamples must be >= 1, got: " + minSamples);
        }
        if (!(criticalThreshold > warnThreshold)) {
            throw new IllegalArgumentException("criticalThreshold (" + criticalThreshold
                    + ") must be greater than warnThreshold (" + warnThreshold + ")");
        }
        this.minSamples = minSamples;
        this.warnThreshold = warnThreshold;
        this.criticalThreshold = criticalThreshold;
    }

    /**
     * @param config validated monitor configuration
     * @return a detector using the configured metric and thresholds
     */
    public static DriftDetector fromConfig(MonitorConfig config) {
        return new DriftDetector(DistanceFactory.create(config.getDistanceMetric()),
                config.getMinSamples(), config.getWarnThreshold(), config.getCriticalThreshold());
    }

    /**
     * Evaluate a snapshot against the baseline.
     *
     * @param snapshot the window contents
     * @param baseline the reference distribution
     * @return an insufficient-data metric, or a measured one classified as
     *         STABLE, WARNING or CRITICAL
     */
    public DriftMetric evaluate(WindowSnapshot snapshot, BaselineDistribution baseline) {
        Objects.requireNonNull(snapshot, "WindowSnapshot must not be null");
        Objects.requireNonNull(baseline, "BaselineDistribution must not be null");

        int n = snapshot.size();
        if (n < minSamples) {
            LOG.trace("Insufficient data for drift evaluation: {} < {}", n, minSamples);
            return DriftMetric.insufficient(distance.getName(), n, minSamples, snapshot.getTakenAt());
        }

        Map<SentimentLabel, Double> current = snapshot.labelDistribution();
        double d = distance.distance(current, baseline.getProportions());
        double meanConfidence = snapshot.meanConfidence();
        double confidenceDelta = baseline.getMeanConfidence() - meanConfidence;
        DriftStatus status = classify(d);

        LOG.debug("Drift evaluated: metric={} distance={} status={} meanConfidence={} delta={} n={}",
                distance.getName(), d, status, meanConfidence, confidenceDelta, n);

        return DriftMetric.measured(status, distance.getName(), d, confidenceDelta, meanConfidence,
                current, n, minSamples, snapshot.getTakenAt());
    }

    DriftStatus classify(double d) {
        if (d >= criticalThreshold) {
            return DriftStatus.CRITICAL;
        }
        if (d >= warnThreshold) {
            return DriftStatus.WARNING;
        }
        return DriftStatus.STABLE;
    }

    public DistributionDistance getDistance() {
        return distance;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public double getWarnThreshold() {
        return warnThreshold;
    }

    public double getCriticalThreshold() {
        return criticalThreshold;
    }
}
