package com.driftsentinel.core.model;

/**
 * The condition an {@link Alert} reports.
 *
 * @since 1.0.0
 */
public enum AlertKind {

    /** The window's label distribution has moved away from the baseline. */
    DISTRIBUTION_DRIFT,

    /** Mean confidence has fallen below the baseline mean. */
    CONFIDENCE_DROP,

    /** The window holds fewer records than drift evaluation needs. */
    INSUFFICIENT_DATA
}
