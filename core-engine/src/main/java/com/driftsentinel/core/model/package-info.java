/**
 * Domain model classes for Drift Sentinel.
 *
 * <p>
 * Value types shared by the window, detection, alerting, reporting and
 * retrain components:
 * </p>
 * <ul>
 * <li>{@link com.driftsentinel.core.model.PredictionResult} – raw classifier
 * output</li>
 * <li>{@link com.driftsentinel.core.model.PredictionRecord} – one observed
 * prediction</li>
 * <li>{@link com.driftsentinel.core.model.DriftMetric} – drift evaluation
 * result</li>
 * <li>{@link com.driftsentinel.core.model.Alert} – emitted alert</li>
 * <li>{@link com.driftsentinel.core.model.RetrainDecision} – retrain
 * check outcome</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.model;
