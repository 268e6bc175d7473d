package com.driftsentinel.core.report;

import com.driftsentinel.core.model.Alert;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Renders a {@link SummaryReport} as plain text for logs and terminals.
 *
 * @since 1.0.0
 */
public final class ReportFormatter {

    private static final String RULE = "=".repeat(60);

    private ReportFormatter() {
        // utility class
    }

    /**
     * @param report the report to render; must not be {@code null}
     * @return multi-line text, newline-terminated
     */
    public static String toText(SummaryReport report) {
        Objects.requireNonNull(report, "SummaryReport must not be null");
        StringBuilder sb = new StringBuilder();
        sb.append(RULE).append('\n');
        sb.append("MONITORING REPORT").append('\n');
        sb.append(RULE).append('\n');
        sb.append("Generated at: ").append(report.getGeneratedAt()).append('\n');
        sb.append("Predictions in window: ").append(report.getSampleCount());
        if (report.isInsufficientData()) {
            sb.append(" (insufficient data, ").append(report.getMinSamples()).append(" required)");
        }
        sb.append("\n\n");

        sb.append("CONFIDENCE").append('\n');
        if (report.getMeanConfidence() == null) {
            sb.append("  no data").append('\n');
        } else {
            sb.append("  mean: ").append(percent(report.getMeanConfidence())).append('\n');
            sb.append("  min/max: ").append(percent(report.getMinConfidence()))
                    .append(" / ").append(percent(report.getMaxConfidence())).append('\n');
        }
        sb.append("  trend: ").append(report.getConfidenceTrend()).append("\n\n");

        sb.append("SENTIMENT DISTRIBUTION").append('\n');
        for (Map.Entry<String, Double> entry : report.getLabelDistributionPercent().entrySet()) {
            sb.append("  ").append(entry.getKey()).append(": ")
                    .append(String.format(Locale.ROOT, "%.1f%%", entry.getValue())).append('\n');
        }
        sb.append('\n');

        sb.append("ALERTS: ").append(report.getTotalAlerts()).append(" total, ")
                .append(report.getRecentAlerts().size()).append(" shown").append('\n');
        for (Alert alert : report.getRecentAlerts()) {
            sb.append("  [").append(alert.getSeverity()).append("] ")
                    .append(alert.getTimestamp()).append(' ')
                    .append(alert.getMessage()).append('\n');
        }
        sb.append(RULE).append('\n');
        return sb.toString();
    }

    private static String percent(double value) {
        return String.format(Locale.ROOT, "%.2f%%", value * 100);
    }
}
