package com.driftsentinel.core.alert;

import com.driftsentinel.core.model.Alert;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Append-only record of every alert a monitor has emitted, in emission order.
 *
 * <p>
 * Alerts are never removed or replaced. Reads return immutable copies, so a
 * caller iterating a copy is unaffected by later appends.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertHistory {

    private final List<Alert> alerts = new ArrayList<>();

    public synchronized void append(Alert alert) {
        alerts.add(Objects.requireNonNull(alert, "Alert must not be null"));
    }

    /**
     * @return immutable copy of all alerts, oldest first
     */
    public synchronized List<Alert> snapshot() {
        return List.copyOf(alerts);
    }

    /**
     * @param limit maximum number of alerts to return; {@code >= 0}
     * @return immutable copy of the {@code limit} most recent alerts, oldest
     *         first
     */
    public synchronized List<Alert> recent(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0, got: " + limit);
        }
        int from = Math.max(0, alerts.size() - limit);
        return List.copyOf(alerts.subList(from, alerts.size()));
    }

    public synchronized int size() {
        return alerts.size();
    }
}
