package com.driftsentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of a retrain check. Derived from the alert history and the clock on
 * every call and never stored by the core.
 *
 * @since 1.0.0
 */
public final class RetrainDecision {

    private final boolean shouldRetrain;
    private final RetrainReason reason;
    private final String message;
    private final Instant timestamp;
    private final int criticalAlertCount;

    public RetrainDecision(boolean shouldRetrain, RetrainReason reason, String message,
            Instant timestamp, int criticalAlertCount) {
        this.shouldRetrain = shouldRetrain;
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
        this.message = message;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.criticalAlertCount = criticalAlertCount;
    }

    public boolean isShouldRetrain() {
        return shouldRetrain;
    }

    public RetrainReason getReason() {
        return reason;
    }

    public String getMessage() {
        return message;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return critical alerts counted inside the evaluation period
     */
    public int getCriticalAlertCount() {
        return criticalAlertCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RetrainDecision that))
            return false;
        return shouldRetrain == that.shouldRetrain
                && criticalAlertCount == that.criticalAlertCount
                && reason == that.reason
                && Objects.equals(message, that.message)
                && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(shouldRetrain, reason, message, timestamp, criticalAlertCount);
    }

    @Override
    public String toString() {
        return "RetrainDecision{" +
                "shouldRetrain=" + shouldRetrain +
                ", reason=" + reason +
                ", message='" + message + '\'' +
                ", timestamp=" + timestamp +
                '}';
    }
}
