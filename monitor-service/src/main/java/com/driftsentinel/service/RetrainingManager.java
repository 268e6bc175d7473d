package com.driftsentinel.service;

import com.driftsentinel.core.model.RetrainDecision;
import com.driftsentinel.core.monitor.SentimentMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Acts on the monitor's retrain decision.
 *
 * <p>
 * Each {@link #checkAndRetrain()} asks the monitor whether to retrain,
 * measuring staleness and counting alerts from the last successful run.
 * Positive decisions run the {@link RetrainAction}; completed and failed
 * runs are kept in the history, skipped checks are not.
 * </p>
 *
 * @since 1.0.0
 */
public class RetrainingManager {

    private static final Logger LOG = LoggerFactory.getLogger(RetrainingManager.class);

    private final SentimentMonitor monitor;
    private final RetrainAction action;
    private final Clock clock;

    private final List<RetrainRun> history = new ArrayList<>();
    private Instant lastRetrainAt;

    public RetrainingManager(SentimentMonitor monitor, RetrainAction action) {
        this(monitor, action, monitor.getClock());
    }

    public RetrainingManager(SentimentMonitor monitor, RetrainAction action, Clock clock) {
        this.monitor = Objects.requireNonNull(monitor, "SentimentMonitor must not be null");
        this.action = Objects.requireNonNull(action, "RetrainAction must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    /**
     * @return the decision a check would act on right now; no side effects
     */
    public synchronized RetrainDecision currentDecision() {
        return monitor.shouldRetrain(clock.instant(), lastRetrainAt);
    }

    /**
     * Check the trigger and retrain when it fires.
     *
     * @return the run record; {@link RetrainRun.Status#SKIPPED} when no
     *         retrain was warranted
     */
    public synchronized RetrainRun checkAndRetrain() {
        Instant now = clock.instant();
        RetrainDecision decision = monitor.shouldRetrain(now, lastRetrainAt);
        if (!decision.isShouldRetrain()) {
            LOG.debug("Retrain skipped: {}", decision.getMessage());
            return RetrainRun.skipped(decision);
        }

        LOG.info("Starting retrain - reason: {} ({})", decision.getReason(), decision.getMessage());
        RetrainRun run;
        try {
            String version = action.retrain(decision);
            run = RetrainRun.completed(decision, version);
            lastRetrainAt = now;
            LOG.info("Retrain completed: model version {}", version);
        } catch (RuntimeException e) {
            LOG.error("Retrain failed: {}", e.getMessage(), e);
            run = RetrainRun.failed(decision, e.getMessage());
        }
        history.add(run);
        return run;
    }

    /**
     * @return completed and failed runs, oldest first
     */
    public synchronized List<RetrainRun> getHistory() {
        return List.copyOf(history);
    }

    /**
     * @return time of the last completed retrain, or {@code null} if none
     */
    public synchronized Instant getLastRetrainAt() {
        return lastRetrainAt;
    }
}
