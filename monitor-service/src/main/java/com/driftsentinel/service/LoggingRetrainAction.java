package com.driftsentinel.service;

import com.driftsentinel.core.model.RetrainDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Default {@link RetrainAction} for deployments where retraining runs in an
 * external pipeline: logs the request and hands back a timestamped version.
 */
public class LoggingRetrainAction implements RetrainAction {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingRetrainAction.class);
    private static final DateTimeFormatter VERSION_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final Clock clock;

    public LoggingRetrainAction(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    @Override
    public String retrain(RetrainDecision decision) {
        String version = "v" + VERSION_FORMAT.format(clock.instant());
        LOG.info("Retrain requested (reason={}, {}); scheduling model version {}",
                decision.getReason(), decision.getMessage(), version);
        return version;
    }
}
