package com.driftsentinel.core.monitor;

import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.PredictionResult;

import java.util.List;
import java.util.Objects;

/**
 * A classifier result together with the alerts its ingestion produced.
 *
 * @since 1.0.0
 */
public final class MonitoredPrediction {

    private final PredictionResult result;
    private final List<Alert> alerts;

    public MonitoredPrediction(PredictionResult result, List<Alert> alerts) {
        this.result = Objects.requireNonNull(result, "result must not be null");
        this.alerts = List.copyOf(alerts);
    }

    public PredictionResult getResult() {
        return result;
    }

    public List<Alert> getAlerts() {
        return alerts;
    }

    @Override
    public String toString() {
        return "MonitoredPrediction{result=" + result + ", alerts=" + alerts + '}';
    }
}
