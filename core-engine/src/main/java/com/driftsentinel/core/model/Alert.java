package com.driftsentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Alert emitted by the alert manager when a drift or confidence condition is
 * met.
 *
 * <p>
 * Immutable. Once emitted an alert is appended to the monitor's alert history
 * and never changed or removed.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code kind}, {@code severity} and
 * {@code timestamp} are required; omitting any of them throws a
 * {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class Alert {

    private final AlertKind kind;
    private final Severity severity;
    private final Instant timestamp;
    private final String message;

    /** The observed value that tripped the alert (distance, delta or sample count). */
    private final double metricValue;

    /** The threshold {@link #metricValue} was compared against. */
    private final double threshold;

    private Alert(Builder builder) {
        this.kind = Objects.requireNonNull(builder.kind, "kind must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.message = builder.message;
        this.metricValue = builder.metricValue;
        this.threshold = builder.threshold;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Alert} instances.
     */
    public static class Builder {
        private AlertKind kind;
        private Severity severity;
        private Instant timestamp;
        private String message;
        private double metricValue;
        private double threshold;

        public Builder kind(AlertKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder metricValue(double metricValue) {
            this.metricValue = metricValue;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        /**
         * @return a new {@link Alert}
         * @throws NullPointerException if {@code kind}, {@code severity} or
         *                              {@code timestamp} is {@code null}
         */
        public Alert build() {
            return new Alert(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public AlertKind getKind() {
        return kind;
    }

    public Severity getSeverity() {
        return severity;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getMessage() {
        return message;
    }

    public double getMetricValue() {
        return metricValue;
    }

    public double getThreshold() {
        return threshold;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return kind == alert.kind
                && severity == alert.severity
                && Objects.equals(timestamp, alert.timestamp)
                && Double.compare(metricValue, alert.metricValue) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, severity, timestamp, metricValue);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "kind=" + kind +
                ", severity=" + severity +
                ", timestamp=" + timestamp +
                ", message='" + message + '\'' +
                ", metricValue=" + metricValue +
                '}';
    }
}
