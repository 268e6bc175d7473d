package com.driftsentinel.core.report;

import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.window.WindowSnapshot;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds {@link SummaryReport}s from a window snapshot and the alert history.
 *
 * <p>
 * A pure function of its inputs: no state, no side effects.
 * </p>
 *
 * <h3>Confidence trend</h3>
 * <p>
 * The sign of the least-squares slope of confidence against chronological
 * index. A slope within {@value #FLAT_SLOPE} of zero, or a window below the
 * minimum sample count, is reported as {@link ConfidenceTrend#NEUTRAL}.
 * </p>
 *
 * @since 1.0.0
 */
public class SummaryReporter {

    /** Slopes with a smaller magnitude than this count as flat. */
    static final double FLAT_SLOPE = 1e-6;

    private final int minSamples;
    private final int recentAlertLimit;

    /**
     * @param minSamples       records required before a trend is reported
     * @param recentAlertLimit number of recent alerts included in a report
     */
    public SummaryReporter(int minSamples, int recentAlertLimit) {
        if (minSamples < 1) {
            throw new IllegalArgumentException("minSamples must be >= 1, got: " + minSamples);
        }
        if (recentAlertLimit < 0) {
            throw new IllegalArgumentException("recentAlertLimit must be >= 0, got: " + recentAlertLimit);
        }
        this.minSamples = minSamples;
        this.recentAlertLimit = recentAlertLimit;
    }

    /**
     * @param snapshot window contents
     * @param alerts   full alert history, oldest first
     * @param now      report time
     * @return the summary
     */
    public SummaryReport report(WindowSnapshot snapshot, List<Alert> alerts, Instant now) {
        Objects.requireNonNull(snapshot, "WindowSnapshot must not be null");
        Objects.requireNonNull(alerts, "alerts must not be null");
        Objects.requireNonNull(now, "now must not be null");

        Map<String, Double> percent = new LinkedHashMap<>();
        snapshot.labelDistribution().forEach((label, p) -> percent.put(label.getDisplayName(), p * 100.0));

        SummaryReport.Builder builder = SummaryReport.builder()
                .generatedAt(now)
                .sampleCount(snapshot.size())
                .minSamples(minSamples)
                .labelDistributionPercent(percent)
                .confidenceTrend(trend(snapshot.confidences()))
                .recentAlerts(alerts.subList(Math.max(0, alerts.size() - recentAlertLimit), alerts.size()))
                .totalAlerts(alerts.size());

        if (!snapshot.isEmpty()) {
            double[] confidences = snapshot.confidences();
            double min = Double.MAX_VALUE;
            double max = -Double.MAX_VALUE;
            for (double c : confidences) {
                min = Math.min(min, c);
                max = Math.max(max, c);
            }
            builder.confidence(snapshot.meanConfidence(), min, max);
        }
        return builder.build();
    }

    /**
     * @param confidences values in chronological order
     * @return the trend of {@code confidences}
     */
    ConfidenceTrend trend(double[] confidences) {
        int n = confidences.length;
        if (n < minSamples || n < 2) {
            return ConfidenceTrend.NEUTRAL;
        }
        double slope = slope(confidences);
        if (Math.abs(slope) <= FLAT_SLOPE) {
            return ConfidenceTrend.NEUTRAL;
        }
        return slope > 0 ? ConfidenceTrend.IMPROVING : ConfidenceTrend.DECLINING;
    }

    static double slope(double[] y) {
        int n = y.length;
        double meanX = (n - 1) / 2.0;
        double meanY = 0;
        for (double v : y) {
            meanY += v;
        }
        meanY /= n;

        double num = 0;
        double den = 0;
        for (int i = 0; i < n; i++) {
            double dx = i - meanX;
            num += dx * (y[i] - meanY);
            den += dx * dx;
        }
        return den == 0 ? 0 : num / den;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public int getRecentAlertLimit() {
        return recentAlertLimit;
    }
}
