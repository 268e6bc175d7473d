package com.driftsentinel.service;

import com.driftsentinel.core.config.MonitorConfig;
import com.driftsentinel.core.model.RetrainReason;
import com.driftsentinel.core.monitor.SentimentMonitor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RetrainingManager}.
 */
class RetrainingManagerTest {

    private static final Instant STARTED = Instant.parse("2024-03-01T12:00:00Z");
    private static final Instant STALE = STARTED.plus(Duration.ofDays(31));

    private SentimentMonitor monitor;

    @BeforeEach
    void setUp() {
        monitor = new SentimentMonitor(MonitorConfig.defaults(), null, Clock.fixed(STARTED, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should skip and not record a run when no retrain is warranted")
    void shouldSkipWhenFresh() {
        RetrainingManager manager = new RetrainingManager(monitor, decision -> "unused");

        RetrainRun run = manager.checkAndRetrain();

        assertThat(run.getStatus()).isEqualTo(RetrainRun.Status.SKIPPED);
        assertThat(run.getReason()).isEqualTo(RetrainReason.NONE);
        assertThat(manager.getHistory()).isEmpty();
        assertThat(manager.getLastRetrainAt()).isNull();
    }

    @Test
    @DisplayName("Should retrain when stale and reset the staleness clock")
    void shouldRetrainWhenStale() {
        RetrainingManager manager = new RetrainingManager(monitor,
                new LoggingRetrainAction(Clock.fixed(STALE, ZoneOffset.UTC)), Clock.fixed(STALE, ZoneOffset.UTC));

        RetrainRun first = manager.checkAndRetrain();
        RetrainRun second = manager.checkAndRetrain();

        assertThat(first.getStatus()).isEqualTo(RetrainRun.Status.COMPLETED);
        assertThat(first.getReason()).isEqualTo(RetrainReason.STALENESS);
        assertThat(first.getModelVersion()).isEqualTo("v20240401_120000");
        assertThat(manager.getLastRetrainAt()).isEqualTo(STALE);
        assertThat(second.getStatus()).isEqualTo(RetrainRun.Status.SKIPPED);
        assertThat(manager.getHistory()).containsExactly(first);
    }

    @Test
    @DisplayName("Should record a failed run without moving the last retrain time")
    void shouldRecordFailure() {
        RetrainingManager manager = new RetrainingManager(monitor, decision -> {
            throw new IllegalStateException("training cluster unavailable");
        }, Clock.fixed(STALE, ZoneOffset.UTC));

        RetrainRun run = manager.checkAndRetrain();

        assertThat(run.getStatus()).isEqualTo(RetrainRun.Status.FAILED);
        assertThat(run.getError()).isEqualTo("training cluster unavailable");
        assertThat(manager.getLastRetrainAt()).isNull();
        assertThat(manager.getHistory()).hasSize(1);
        assertThat(manager.currentDecision().isShouldRetrain()).isTrue();
    }
}
