package com.driftsentinel.core.report;

/**
 * Direction of the confidence values across the window, oldest to newest.
 *
 * @since 1.0.0
 */
public enum ConfidenceTrend {
    IMPROVING,
    DECLINING,

    /** Flat, or too few samples to tell. */
    NEUTRAL
}
