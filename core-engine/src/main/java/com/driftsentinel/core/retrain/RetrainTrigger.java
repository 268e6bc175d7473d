package com.driftsentinel.core.retrain;

import com.driftsentinel.core.config.MonitorConfig;
import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.RetrainDecision;
import com.driftsentinel.core.model.RetrainReason;
import com.driftsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Decides whether the model should be retrained.
 *
 * <h3>Policy</h3>
 * <ol>
 * <li><b>Critical alerts</b>: retrain when the number of {@code CRITICAL}
 * alerts raised inside {@code (now - evaluationPeriod, now]} and after the
 * last retrain exceeds {@code criticalAlertThreshold}.</li>
 * <li><b>Staleness</b>: retrain when more than {@code maxStaleness} has
 * elapsed since the last retrain, whatever the alerts say.</li>
 * </ol>
 *
 * <p>
 * The trigger keeps no state. The same history, time and last-retrain instant
 * always give the same decision; recording that a retrain happened is the
 * caller's job, fed back through {@code lastRetrainAt}.
 * </p>
 *
 * @since 1.0.0
 */
public class RetrainTrigger {

    private static final Logger LOG = LoggerFactory.getLogger(RetrainTrigger.class);

    private final int criticalAlertThreshold;
    private final Duration evaluationPeriod;
    private final Duration maxStaleness;

    public RetrainTrigger(int criticalAlertThreshold, Duration evaluationPeriod, Duration maxStaleness) {
        if (criticalAlertThreshold < 0) {
            throw new IllegalArgumentException(
                    "criticalAlertThreshold must be >= 0, got: " + criticalAlertThreshold);
        }
        this.criticalAlertThreshold = criticalAlertThreshold;
        this.evaluationPeriod = Objects.requireNonNull(evaluationPeriod, "evaluationPeriod must not be null");
        this.maxStaleness = Objects.requireNonNull(maxStaleness, "maxStaleness must not be null");
    }

    public static RetrainTrigger fromConfig(MonitorConfig config) {
        return new RetrainTrigger(config.getCriticalAlertThreshold(),
                config.getRetrainEvaluationPeriod(), config.getMaxStaleness());
    }

    /**
     * @param alerts        alert history, any order
     * @param now           decision time
     * @param lastRetrainAt when the model was last retrained (or deployed)
     * @return the decision
     */
    public RetrainDecision decide(List<Alert> alerts, Instant now, Instant lastRetrainAt) {
        Objects.requireNonNull(alerts, "alerts must not be null");
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(lastRetrainAt, "lastRetrainAt must not be null");

        int criticalCount = 0;
        for (Alert alert : alerts) {
            Instant ts = alert.getTimestamp();
            if (alert.getSeverity() == Severity.CRITICAL
                    && !ts.isAfter(now)
                    && Duration.between(ts, now).compareTo(evaluationPeriod) < 0
                    && ts.isAfter(lastRetrainAt)) {
                criticalCount++;
            }
        }

        if (criticalCount > criticalAlertThreshold) {
            String message = String.format("%d critical alert(s) in the last %s (threshold %d)",
                    criticalCount, evaluationPeriod, criticalAlertThreshold);
            LOG.debug("Retrain decision: {}", message);
            return new RetrainDecision(true, RetrainReason.CRITICAL_ALERTS, message, now, criticalCount);
        }

        Duration elapsed = Duration.between(lastRetrainAt, now);
        if (elapsed.compareTo(maxStaleness) > 0) {
            String message = String.format("%s since last retrain exceeds staleness interval %s",
                    elapsed, maxStaleness);
            LOG.debug("Retrain decision: {}", message);
            return new RetrainDecision(true, RetrainReason.STALENESS, message, now, criticalCount);
        }

        return new RetrainDecision(false, RetrainReason.NONE, "Performance within normal range", now,
                criticalCount);
    }

    public int getCriticalAlertThreshold() {
        return criticalAlertThreshold;
    }

    public Duration getEvaluationPeriod() {
        return evaluationPeriod;
    }

    public Duration getMaxStaleness() {
        return maxStaleness;
    }
}
