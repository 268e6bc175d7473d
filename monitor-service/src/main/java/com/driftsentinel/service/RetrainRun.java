package com.driftsentinel.service;

import com.driftsentinel.core.model.RetrainDecision;
import com.driftsentinel.core.model.RetrainReason;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of one {@link RetrainingManager#checkAndRetrain()} call.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RetrainRun {

    public enum Status {
        SKIPPED("skipped"),
        COMPLETED("completed"),
        FAILED("failed");

        private final String code;

        Status(String code) {
            this.code = code;
        }

        @JsonValue
        public String getCode() {
            return code;
        }
    }

    private final Status status;
    private final RetrainReason reason;
    private final String message;
    private final Instant timestamp;
    private final String modelVersion;
    private final String error;

    private RetrainRun(Status status, RetrainDecision decision, String modelVersion, String error) {
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.reason = decision.getReason();
        this.message = decision.getMessage();
        this.timestamp = decision.getTimestamp();
        this.modelVersion = modelVersion;
        this.error = error;
    }

    static RetrainRun skipped(RetrainDecision decision) {
        return new RetrainRun(Status.SKIPPED, decision, null, null);
    }

    static RetrainRun completed(RetrainDecision decision, String modelVersion) {
        return new RetrainRun(Status.COMPLETED, decision, modelVersion, null);
    }

    static RetrainRun failed(RetrainDecision decision, String error) {
        return new RetrainRun(Status.FAILED, decision, null, error);
    }

    public Status getStatus() {
        return status;
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

    public String getModelVersion() {
        return modelVersion;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return "RetrainRun{" +
                "status=" + status +
                ", reason=" + reason +
                ", timestamp=" + timestamp +
                ", modelVersion='" + modelVersion + '\'' +
                '}';
    }
}
