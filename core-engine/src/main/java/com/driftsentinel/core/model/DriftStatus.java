package com.driftsentinel.core.model;

/**
 * Outcome class of a single drift evaluation.
 *
 * <p>
 * {@link #INSUFFICIENT_DATA} is a normal outcome, not an error: it tells the
 * caller that the window is too small to judge, which is different from
 * {@link #STABLE}.
 * </p>
 *
 * @since 1.0.0
 */
public enum DriftStatus {
    INSUFFICIENT_DATA,
    STABLE,
    WARNING,
    CRITICAL
}
