/**
 * Drift detection over window snapshots.
 *
 * <p>
 * {@link com.driftsentinel.core.detection.DriftDetector} delegates the
 * distributional distance to a
 * {@link com.driftsentinel.core.detection.DistributionDistance} created by
 * {@link com.driftsentinel.core.detection.DistanceFactory}. Built-in metrics:
 * </p>
 * <ul>
 * <li>{@code psi} – population stability index (default)</li>
 * <li>{@code chi-square} – chi-square statistic on proportions</li>
 * <li>{@code max-abs} – largest per-label absolute difference</li>
 * </ul>
 *
 * <h3>Extending</h3>
 * <p>
 * To add a metric, implement {@code DistributionDistance} and register its
 * name in {@code DistanceFactory}.
 * </p>
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.detection;
