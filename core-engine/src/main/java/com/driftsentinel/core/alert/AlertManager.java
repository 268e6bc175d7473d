package com.driftsentinel.core.alert;

import com.driftsentinel.core.config.MonitorConfig;
import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.AlertKind;
import com.driftsentinel.core.model.DriftMetric;
import com.driftsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns drift metrics into severity-tiered alerts and rate-limits them.
 *
 * <h3>Policy</h3>
 * <ul>
 * <li>Critical drift status → {@code CRITICAL DISTRIBUTION_DRIFT}</li>
 * <li>Warning drift status → {@code WARNING DISTRIBUTION_DRIFT}</li>
 * <li>Confidence delta at or above the drop threshold →
 * {@code CONFIDENCE_DROP}, {@code CRITICAL} at or above the critical drop
 * threshold, {@code WARNING} otherwise</li>
 * <li>Insufficient data → {@code INFO INSUFFICIENT_DATA}</li>
 * </ul>
 *
 * <h3>De-duplication</h3>
 * <p>
 * An alert whose (kind, severity) pair was already emitted less than
 * {@code cooldown} ago is suppressed. Emitted alerts are appended to the
 * {@link AlertHistory}; suppressed ones leave no trace.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertManager {

    private static final Logger LOG = LoggerFactory.getLogger(AlertManager.class);

    private final AlertHistory history;
    private final double warnThreshold;
    private final double criticalThreshold;
    private final double confidenceDropThreshold;
    private final double criticalConfidenceDropThreshold;
    private final Duration cooldown;

    /** Last emission time per kind, then per severity. Guarded by {@code this}. */
    private final Map<AlertKind, Map<Severity, Instant>> lastEmitted = new EnumMap<>(AlertKind.class);

    /**
     * @param config  validated monitor configuration
     * @param history history that receives every emitted alert
     */
    public AlertManager(MonitorConfig config, AlertHistory history) {
        Objects.requireNonNull(config, "MonitorConfig must not be null");
        this.history = Objects.requireNonNull(history, "AlertHistory must not be null");
        this.warnThreshold = config.getWarnThreshold();
        this.criticalThreshold = config.getCriticalThreshold();
        this.confidenceDropThreshold = config.getConfidenceDropThreshold();
        this.criticalConfidenceDropThreshold = config.getCriticalConfidenceDropThreshold();
        this.cooldown = config.getAlertCooldown();
    }

    /**
     * Evaluate a metric and emit the alerts it warrants.
     *
     * @param metric the drift metric; must not be {@code null}
     * @param now    evaluation time, used for the alert timestamps and the
     *               cool-down check
     * @return unmodifiable list of newly emitted alerts, in emission order;
     *         empty when nothing fired or everything was suppressed
     */
    public synchronized List<Alert> evaluate(DriftMetric metric, Instant now) {
        Objects.requireNonNull(metric, "DriftMetric must not be null");
        Objects.requireNonNull(now, "now must not be null");

        List<Alert> candidates = new ArrayList<>(2);

        if (metric.isInsufficientData()) {
            candidates.add(Alert.builder()
                    .kind(AlertKind.INSUFFICIENT_DATA)
                    .severity(Severity.INFO)
                    .timestamp(now)
                    .metricValue(metric.getSampleCount())
                    .threshold(metric.getMinSamples())
                    .message(String.format("Insufficient data for drift evaluation: %d of %d samples",
                            metric.getSampleCount(), metric.getMinSamples()))
                    .build());
        } else {
            driftAlert(metric, now).ifPresent(candidates::add);
            confidenceAlert(metric, now).ifPresent(candidates::add);
        }

        List<Alert> emitted = new ArrayList<>(candidates.size());
        for (Alert alert : candidates) {
            if (isCoolingDown(alert, now)) {
                LOG.debug("Suppressed {} {} alert (cool-down {})", alert.getSeverity(), alert.getKind(), cooldown);
                continue;
            }
            lastEmitted.computeIfAbsent(alert.getKind(), k -> new EnumMap<>(Severity.class))
                    .put(alert.getSeverity(), now);
            history.append(alert);
            emitted.add(alert);
            LOG.info("Alert emitted: [{}] {} - {}", alert.getSeverity(), alert.getKind(), alert.getMessage());
        }
        return Collections.unmodifiableList(emitted);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Optional<Alert> driftAlert(DriftMetric metric, Instant now) {
        double distance = metric.getDistance();
        Severity severity;
        double threshold;
        switch (metric.getStatus()) {
            case CRITICAL -> {
                severity = Severity.CRITICAL;
                threshold = criticalThreshold;
            }
            case WARNING -> {
                severity = Severity.WARNING;
                threshold = warnThreshold;
            }
            default -> {
                return Optional.empty();
            }
        }
        return Optional.of(Alert.builder()
                .kind(AlertKind.DISTRIBUTION_DRIFT)
                .severity(severity)
                .timestamp(now)
                .metricValue(distance)
                .threshold(threshold)
                .message(String.format("Distribution drift detected: %s=%.4f (threshold %.4f), current %s",
                        metric.getMetricName(), distance, threshold, formatDistribution(metric)))
                .build());
    }

    private Optional<Alert> confidenceAlert(DriftMetric metric, Instant now) {
        double delta = metric.getConfidenceDelta();
        if (delta < confidenceDropThreshold) {
            return Optional.empty();
        }
        boolean critical = delta >= criticalConfidenceDropThreshold;
        double threshold = critical ? criticalConfidenceDropThreshold : confidenceDropThreshold;
        return Optional.of(Alert.builder()
                .kind(AlertKind.CONFIDENCE_DROP)
                .severity(critical ? Severity.CRITICAL : Severity.WARNING)
                .timestamp(now)
                .metricValue(delta)
                .threshold(threshold)
                .message(String.format("Mean confidence %.2f%% is %.2f points below baseline (threshold %.2f)",
                        metric.getMeanConfidence() * 100, delta * 100, threshold * 100))
                .build());
    }

    private boolean isCoolingDown(Alert alert, Instant now) {
        Map<Severity, Instant> bySeverity = lastEmitted.get(alert.getKind());
        if (bySeverity == null) {
            return false;
        }
        Instant last = bySeverity.get(alert.getSeverity());
        return last != null && Duration.between(last, now).compareTo(cooldown) < 0;
    }

    private static String formatDistribution(DriftMetric metric) {
        Map<String, String> formatted = new LinkedHashMap<>();
        metric.getDistribution().forEach((label, p) ->
                formatted.put(label.getDisplayName(), String.format("%.1f%%", p * 100)));
        return formatted.toString();
    }
}
