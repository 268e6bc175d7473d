package com.driftsentinel.core.report;

import com.driftsentinel.core.model.Alert;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Point-in-time summary of a monitor: window statistics plus recent alerts.
 *
 * <p>
 * Immutable and Jackson-serializable. The label distribution is keyed by
 * display name ({@code Negative}, {@code Neutral}, {@code Positive}) and
 * expressed in percent. Confidence statistics are {@code null} when the window
 * is empty.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SummaryReport {

    private final Instant generatedAt;
    private final int sampleCount;
    private final int minSamples;
    private final Map<String, Double> labelDistributionPercent;
    private final Double meanConfidence;
    private final Double minConfidence;
    private final Double maxConfidence;
    private final ConfidenceTrend confidenceTrend;
    private final List<Alert> recentAlerts;
    private final int totalAlerts;

    private SummaryReport(Builder b) {
        this.generatedAt = Objects.requireNonNull(b.generatedAt, "generatedAt must not be null");
        this.sampleCount = b.sampleCount;
        this.minSamples = b.minSamples;
        this.labelDistributionPercent = Collections.unmodifiableMap(new LinkedHashMap<>(b.labelDistributionPercent));
        this.meanConfidence = b.meanConfidence;
        this.minConfidence = b.minConfidence;
        this.maxConfidence = b.maxConfidence;
        this.confidenceTrend = Objects.requireNonNull(b.confidenceTrend, "confidenceTrend must not be null");
        this.recentAlerts = List.copyOf(b.recentAlerts);
        this.totalAlerts = b.totalAlerts;
    }

    static Builder builder() {
        return new Builder();
    }

    static class Builder {
        private Instant generatedAt;
        private int sampleCount;
        private int minSamples;
        private Map<String, Double> labelDistributionPercent = Map.of();
        private Double meanConfidence;
        private Double minConfidence;
        private Double maxConfidence;
        private ConfidenceTrend confidenceTrend = ConfidenceTrend.NEUTRAL;
        private List<Alert> recentAlerts = List.of();
        private int totalAlerts;

        Builder generatedAt(Instant v) {
            this.generatedAt = v;
            return this;
        }

        Builder sampleCount(int v) {
            this.sampleCount = v;
            return this;
        }

        Builder minSamples(int v) {
            this.minSamples = v;
            return this;
        }

        Builder labelDistributionPercent(Map<String, Double> v) {
            this.labelDistributionPercent = v;
            return this;
        }

        Builder confidence(Double mean, Double min, Double max) {
            this.meanConfidence = mean;
            this.minConfidence = min;
            this.maxConfidence = max;
            return this;
        }

        Builder confidenceTrend(ConfidenceTrend v) {
            this.confidenceTrend = v;
            return this;
        }

        Builder recentAlerts(List<Alert> v) {
            this.recentAlerts = v;
            return this;
        }

        Builder totalAlerts(int v) {
            this.totalAlerts = v;
            return this;
        }

        SummaryReport build() {
            return new SummaryReport(this);
        }
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    public int getMinSamples() {
        return minSamples;
    }

    /**
     * @return {@code true} when the window holds fewer records than drift
     *         evaluation needs
     */
    public boolean isInsufficientData() {
        return sampleCount < minSamples;
    }

    /**
     * @return unmodifiable label name to percentage (0 to 100), in label order
     */
    public Map<String, Double> getLabelDistributionPercent() {
        return labelDistributionPercent;
    }

    public Double getMeanConfidence() {
        return meanConfidence;
    }

    public Double getMinConfidence() {
        return minConfidence;
    }

    public Double getMaxConfidence() {
        return maxConfidence;
    }

    public ConfidenceTrend getConfidenceTrend() {
        return confidenceTrend;
    }

    /**
     * @return unmodifiable list of the most recent alerts, oldest first
     */
    public List<Alert> getRecentAlerts() {
        return recentAlerts;
    }

    public int getTotalAlerts() {
        return totalAlerts;
    }

    @Override
    public String toString() {
        return "SummaryReport{" +
                "generatedAt=" + generatedAt +
                ", sampleCount=" + sampleCount +
                ", distribution=" + labelDistributionPercent +
                ", meanConfidence=" + meanConfidence +
                ", trend=" + confidenceTrend +
                ", recentAlerts=" + recentAlerts.size() +
                '}';
    }
}
