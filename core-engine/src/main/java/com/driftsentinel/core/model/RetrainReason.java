package com.driftsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a retrain decision came out the way it did.
 *
 * @since 1.0.0
 */
public enum RetrainReason {

    /** Too many critical alerts inside the evaluation period. */
    CRITICAL_ALERTS("critical_alerts"),

    /** The model has gone longer than the staleness interval without retraining. */
    STALENESS("staleness"),

    /** No trigger condition holds. */
    NONE("none");

    private final String code;

    RetrainReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @Override
    public String toString() {
        return code;
    }
}
