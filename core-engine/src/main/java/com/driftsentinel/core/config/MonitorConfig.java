package com.driftsentinel.core.config;

import com.driftsentinel.core.detection.DistanceFactory;
import com.driftsentinel.core.model.ValidationException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Typed, immutable configuration of a {@code SentimentMonitor}.
 *
 * <p>
 * Built once through the {@link Builder}, which validates every value at
 * {@link Builder#build()} time, and never changed afterwards. Use
 * {@link MonitorConfigLoader} to read one from YAML.
 * </p>
 *
 * <h3>Defaults</h3>
 * <ul>
 * <li>window: 100 records, no age limit</li>
 * <li>drift: {@code psi}, 30 samples minimum, warn 0.1, critical 0.25</li>
 * <li>confidence drop: warn at 0.2 below baseline, critical at 0.3</li>
 * <li>alert cool-down: 15 minutes, 10 recent alerts in reports</li>
 * <li>retrain: more than 3 critical alerts in 7 days, or 30 days stale</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class MonitorConfig {

    // ---------------------------------------------------------------
    // Window
    // ---------------------------------------------------------------
    private final int windowCapacity;
    private final Duration maxAge;

    // ---------------------------------------------------------------
    // Drift
    // ---------------------------------------------------------------
    private final BaselineDistribution baseline;
    private final String distanceMetric;
    private final int minSamples;
    private final double warnThreshold;
    private final double criticalThreshold;

    // ---------------------------------------------------------------
    // Alerts
    // ---------------------------------------------------------------
    private final double confidenceDropThreshold;
    private final double criticalConfidenceDropThreshold;
    private final Duration alertCooldown;
    private final int recentAlertLimit;

    // ---------------------------------------------------------------
    // Retraining
    // ---------------------------------------------------------------
    private final int criticalAlertThreshold;
    private final Duration retrainEvaluationPeriod;
    private final Duration maxStaleness;

    private MonitorConfig(Builder b, double criticalConfidenceDropThreshold) {
        this.windowCapacity = b.windowCapacity;
        this.maxAge = b.maxAge;
        this.baseline = b.baseline;
        this.distanceMetric = b.distanceMetric;
        this.minSamples = b.minSamples;
        this.warnThreshold = b.warnThreshold;
        this.criticalThreshold = b.criticalThreshold;
        this.confidenceDropThreshold = b.confidenceDropThreshold;
        this.criticalConfidenceDropThreshold = criticalConfidenceDropThreshold;
        this.alertCooldown = b.alertCooldown;
        this.recentAlertLimit = b.recentAlertLimit;
        this.criticalAlertThreshold = b.criticalAlertThreshold;
        this.retrainEvaluationPeriod = b.retrainEvaluationPeriod;
        this.maxStaleness = b.maxStaleness;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a configuration with every default applied
     */
    public static MonitorConfig defaults() {
        return new Builder().build();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getWindowCapacity() {
        return windowCapacity;
    }

    /**
     * @return maximum record age; {@link Duration#ZERO} disables age eviction
     */
    public Duration getMaxAge() {
        return maxAge;
    }

    public BaselineDistribution getBaseline() {
        return baseline;
    }

    public String getDistanceMetric() {
        return distanceMetric;
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

    public double getConfidenceDropThreshold() {
        return confidenceDropThreshold;
    }

    public double getCriticalConfidenceDropThreshold() {
        return criticalConfidenceDropThreshold;
    }

    public Duration getAlertCooldown() {
        return alertCooldown;
    }

    public int getRecentAlertLimit() {
        return recentAlertLimit;
    }

    public int getCriticalAlertThreshold() {
        return criticalAlertThreshold;
    }

    public Duration getRetrainEvaluationPeriod() {
        return retrainEvaluationPeriod;
    }

    public Duration getMaxStaleness() {
        return maxStaleness;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link MonitorConfig}.
     *
     * <p>
     * {@link #build()} collects every violation and throws a single
     * {@link ValidationException}; in particular the critical drift threshold
     * must be strictly greater than the warn threshold.
     * </p>
     */
    public static class Builder {
        private int windowCapacity = 100;
        private Duration maxAge = Duration.ZERO;
        private BaselineDistribution baseline = BaselineDistribution.defaults();
        private String distanceMetric = DistanceFactory.PSI;
        private int minSamples = 30;
        private double warnThreshold = 0.1;
        private double criticalThreshold = 0.25;
        private double confidenceDropThreshold = 0.2;
        private Double criticalConfidenceDropThreshold;
        private Duration alertCooldown = Duration.ofMinutes(15);
        private int recentAlertLimit = 10;
        private int criticalAlertThreshold = 3;
        private Duration retrainEvaluationPeriod = Duration.ofDays(7);
        private Duration maxStaleness = Duration.ofDays(30);

        public Builder windowCapacity(int v) {
            this.windowCapacity = v;
            return this;
        }

        public Builder maxAge(Duration v) {
            this.maxAge = v;
            return this;
        }

        public Builder baseline(BaselineDistribution v) {
            this.baseline = v;
            return this;
        }

        public Builder distanceMetric(String v) {
            this.distanceMetric = v;
            return this;
        }

        public Builder minSamples(int v) {
            this.minSamples = v;
            return this;
        }

        public Builder warnThreshold(double v) {
            this.warnThreshold = v;
            return this;
        }

        public Builder criticalThreshold(double v) {
            this.criticalThreshold = v;
            return this;
        }

        public Builder confidenceDropThreshold(double v) {
            this.confidenceDropThreshold = v;
            return this;
        }

        /**
         * Defaults to 1.5 times the confidence-drop threshold when not set.
         */
        public Builder criticalConfidenceDropThreshold(double v) {
            this.criticalConfidenceDropThreshold = v;
            return this;
        }

        public Builder alertCooldown(Duration v) {
            this.alertCooldown = v;
            return this;
        }

        public Builder recentAlertLimit(int v) {
            this.recentAlertLimit = v;
            return this;
        }

        public Builder criticalAlertThreshold(int v) {
            this.criticalAlertThreshold = v;
            return this;
        }

        public Builder retrainEvaluationPeriod(Duration v) {
            this.retrainEvaluationPeriod = v;
            return this;
        }

        public Builder maxStaleness(Duration v) {
            this.maxStaleness = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link MonitorConfig}
         * @throws ValidationException if any value is invalid
         */
        public MonitorConfig build() {
            double criticalDrop = criticalConfidenceDropThreshold != null
                    ? criticalConfidenceDropThreshold
                    : confidenceDropThreshold * 1.5;

            List<String> errors = new ArrayList<>();

            if (windowCapacity < 1) {
                errors.add("windowCapacity must be >= 1, got: " + windowCapacity);
            }
            if (maxAge == null || maxAge.isNegative()) {
                errors.add("maxAge must be zero (disabled) or positive, got: " + maxAge);
            }
            if (baseline == null) {
                errors.add("baseline is required");
            }
            if (distanceMetric == null || !DistanceFactory.isSupported(distanceMetric)) {
                errors.add("Unknown distance metric: '" + distanceMetric + "'. Supported: "
                        + String.join(", ", DistanceFactory.supportedNames()));
            }
            if (minSamples < 1) {
                errors.add("minSamples must be >= 1, got: " + minSamples);
            } else if (minSamples > windowCapacity) {
                errors.add("minSamples (" + minSamples + ") must not exceed windowCapacity ("
                        + windowCapacity + ")");
            }
            if (!(warnThreshold > 0)) {
                errors.add("warnThreshold must be > 0, got: " + warnThreshold);
            }
            if (!(criticalThreshold > warnThreshold)) {
                errors.add("criticalThreshold (" + criticalThreshold
                        + ") must be greater than warnThreshold (" + warnThreshold + ")");
            }
            if (!(confidenceDropThreshold > 0 && confidenceDropThreshold <= 1)) {
                errors.add("confidenceDropThreshold must be in (0, 1], got: " + confidenceDropThreshold);
            }
            if (!(criticalDrop > confidenceDropThreshold)) {
                errors.add("criticalConfidenceDropThreshold (" + criticalDrop
                        + ") must be greater than confidenceDropThreshold (" + confidenceDropThreshold + ")");
            }
            if (alertCooldown == null || alertCooldown.isNegative()) {
                errors.add("alertCooldown must be zero or positive, got: " + alertCooldown);
            }
            if (recentAlertLimit < 0) {
                errors.add("recentAlertLimit must be >= 0, got: " + recentAlertLimit);
            }
            if (criticalAlertThreshold < 0) {
                errors.add("criticalAlertThreshold must be >= 0, got: " + criticalAlertThreshold);
            }
            requirePositive(retrainEvaluationPeriod, "retrainEvaluationPeriod", errors);
            requirePositive(maxStaleness, "maxStaleness", errors);

            if (!errors.isEmpty()) {
                throw new ValidationException("Invalid monitor configuration", errors);
            }
            return new MonitorConfig(this, criticalDrop);
        }

        private static void requirePositive(Duration value, String name, List<String> errors) {
            if (value == null || value.isZero() || value.isNegative()) {
                errors.add(name + " must be positive, got: " + value);
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MonitorConfig that))
            return false;
        return windowCapacity == that.windowCapacity
                && minSamples == that.minSamples
                && Double.compare(warnThreshold, that.warnThreshold) == 0
                && Double.compare(criticalThreshold, that.criticalThreshold) == 0
                && Double.compare(confidenceDropThreshold, that.confidenceDropThreshold) == 0
                && Double.compare(criticalConfidenceDropThreshold, that.criticalConfidenceDropThreshold) == 0
                && recentAlertLimit == that.recentAlertLimit
                && criticalAlertThreshold == that.criticalAlertThreshold
                && Objects.equals(maxAge, that.maxAge)
                && Objects.equals(baseline, that.baseline)
                && Objects.equals(distanceMetric, that.distanceMetric)
                && Objects.equals(alertCooldown, that.alertCooldown)
                && Objects.equals(retrainEvaluationPeriod, that.retrainEvaluationPeriod)
                && Objects.equals(maxStaleness, that.maxStaleness);
    }

    @Override
    public int hashCode() {
        return Objects.hash(windowCapacity, maxAge, baseline, distanceMetric, minSamples,
                warnThreshold, criticalThreshold, confidenceDropThreshold, criticalConfidenceDropThreshold,
                alertCooldown, recentAlertLimit, criticalAlertThreshold, retrainEvaluationPeriod, maxStaleness);
    }

    @Override
    public String toString() {
        return "MonitorConfig{" +
                "windowCapacity=" + windowCapacity +
                ", maxAge=" + maxAge +
                ", baseline=" + baseline +
                ", distanceMetric='" + distanceMetric + '\'' +
                ", minSamples=" + minSamples +
                ", warnThreshold=" + warnThreshold +
                ", criticalThreshold=" + criticalThreshold +
                ", confidenceDropThreshold=" + confidenceDropThreshold +
                ", criticalConfidenceDropThreshold=" + criticalConfidenceDropThreshold +
                ", alertCooldown=" + alertCooldown +
                ", recentAlertLimit=" + recentAlertLimit +
                ", criticalAlertThreshold=" + criticalAlertThreshold +
                ", retrainEvaluationPeriod=" + retrainEvaluationPeriod +
                ", maxStaleness=" + maxStaleness +
                '}';
    }
}
