package com.driftsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one drift evaluation over a window snapshot.
 *
 * <p>
 * Either <em>insufficient</em> (fewer samples than required; no distance and
 * no confidence delta) or <em>measured</em> (distance, delta and the current
 * distribution are all present). Use {@link #isInsufficientData()} before
 * reading the numeric fields.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class DriftMetric {

    private final DriftStatus status;
    private final String metricName;
    private final Double distance;
    private final Double confidenceDelta;
    private final Double meanConfidence;
    private final Map<SentimentLabel, Double> distribution;
    private final int sampleCount;
    private final int minSamples;
    private final Instant evaluatedAt;

    private DriftMetric(DriftStatus status, String metricName, Double distance, Double confidenceDelta,
            Double meanConfidence, Map<SentimentLabel, Double> distribution,
            int sampleCount, int minSamples, Instant evaluatedAt) {
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.metricName = metricName;
        this.distance = distance;
        this.confidenceDelta = confidenceDelta;
        this.meanConfidence = meanConfidence;
        this.distribution = distribution != null
                ? Collections.unmodifiableMap(new EnumMap<>(distribution))
                : null;
        this.sampleCount = sampleCount;
        this.minSamples = minSamples;
        this.evaluatedAt = Objects.requireNonNull(evaluatedAt, "evaluatedAt must not be null");
    }

    /**
     * Create an insufficient-data result.
     *
     * @param metricName  name of the distance metric that would have been used
     * @param sampleCount records available
     * @param minSamples  records required
     * @param evaluatedAt evaluation time
     * @return a metric with status {@link DriftStatus#INSUFFICIENT_DATA}
     */
    public static DriftMetric insufficient(String metricName, int sampleCount, int minSamples,
            Instant evaluatedAt) {
        return new DriftMetric(DriftStatus.INSUFFICIENT_DATA, metricName, null, null, null, null,
                sampleCount, minSamples, evaluatedAt);
    }

    /**
     * Create a measured result.
     *
     * @param status          one of STABLE, WARNING, CRITICAL
     * @param metricName      distance metric name
     * @param distance        distance to the baseline, {@code >= 0}
     * @param confidenceDelta baseline mean confidence minus current mean
     * @param meanConfidence  current mean confidence
     * @param distribution    current label proportions
     * @param sampleCount     records evaluated
     * @param minSamples      records required
     * @param evaluatedAt     evaluation time
     * @return a measured metric
     * @throws IllegalArgumentException if {@code status} is INSUFFICIENT_DATA
     */
    public static DriftMetric measured(DriftStatus status, String metricName, double distance,
            double confidenceDelta, double meanConfidence, Map<SentimentLabel, Double> distribution,
            int sampleCount, int minSamples, Instant evaluatedAt) {
        if (status == DriftStatus.INSUFFICIENT_DATA) {
            throw new IllegalArgumentException("A measured metric cannot have status INSUFFICIENT_DATA");
        }
        Objects.requireNonNull(distribution, "distribution must not be null");
        return new DriftMetric(status, metricName, distance, confidenceDelta, meanConfidence, distribution,
                sampleCount, minSamples, evaluatedAt);
    }

    public boolean isInsufficientData() {
        return status == DriftStatus.INSUFFICIENT_DATA;
    }

    public DriftStatus getStatus() {
        return status;
    }

    public String getMetricName() {
        return metricName;
    }

    /**
     * @return distance to the baseline, or {@code null} when insufficient
     */
    public Double getDistance() {
        return distance;
    }

    /**
     * @return baseline mean confidence minus current mean confidence, or
     *         {@code null} when insufficient; positive means confidence dropped
     */
    public Double getConfidenceDelta() {
        return confidenceDelta;
    }

    public Double getMeanConfidence() {
        return meanConfidence;
    }

    /**
     * @return unmodifiable label proportions, or {@code null} when insufficient
     */
    public Map<SentimentLabel, Double> getDistribution() {
        return distribution;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public Instant getEvaluatedAt() {
        return evaluatedAt;
    }

    @Override
    public String toString() {
        return "DriftMetric{" +
                "status=" + status +
                ", metric='" + metricName + '\'' +
                ", distance=" + distance +
                ", confidenceDelta=" + confidenceDelta +
                ", sampleCount=" + sampleCount +
                '}';
    }
}
