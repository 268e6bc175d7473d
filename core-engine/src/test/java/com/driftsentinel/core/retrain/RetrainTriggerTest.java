package com.driftsentinel.core.retrain;

import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.AlertKind;
import com.driftsentinel.core.model.RetrainDecision;
import com.driftsentinel.core.model.RetrainReason;
import com.driftsentinel.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RetrainTrigger}.
 */
class RetrainTriggerTest {

    private static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");
    private static final Instant RECENT_RETRAIN = NOW.minus(Duration.ofDays(10));

    private RetrainTrigger trigger;

    @BeforeEach
    void setUp() {
        trigger = new RetrainTrigger(3, Duration.ofDays(7), Duration.ofDays(30));
    }

    @Test
    @DisplayName("Should trigger when critical alerts exceed the threshold")
    void shouldTriggerOnCriticalAlerts() {
        RetrainDecision decision = trigger.decide(criticalAlerts(4, NOW.minus(Duration.ofHours(4))), NOW, RECENT_RETRAIN);

        assertThat(decision.isShouldRetrain()).isTrue();
        assertThat(decision.getReason()).isEqualTo(RetrainReason.CRITICAL_ALERTS);
        assertThat(decision.getCriticalAlertCount()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should NOT trigger when critical alerts only reach the threshold")
    void shouldNotTriggerAtThreshold() {
        RetrainDecision decision = trigger.decide(criticalAlerts(3, NOW.minus(Duration.ofHours(4))), NOW, RECENT_RETRAIN);

        assertThat(decision.isShouldRetrain()).isFalse();
        assertThat(decision.getReason()).isEqualTo(RetrainReason.NONE);
        assertThat(decision.getMessage()).isEqualTo("Performance within normal range");
    }

    @Test
    @DisplayName("Should ignore warnings and alerts outside the evaluation period")
    void shouldCountOnlyRecentCriticalAlerts() {
        List<Alert> alerts = new ArrayList<>(criticalAlerts(3, NOW.minus(Duration.ofDays(8))));
        alerts.addAll(criticalAlerts(2, NOW.minus(Duration.ofHours(1))));
        for (int i = 0; i < 5; i++) {
            alerts.add(alert(Severity.WARNING, NOW.minusSeconds(i + 1)));
        }

        RetrainDecision decision = trigger.decide(alerts, NOW, NOW.minus(Duration.ofDays(20)));

        assertThat(decision.isShouldRetrain()).isFalse();
        assertThat(decision.getCriticalAlertCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should not count alerts raised before the last retrain")
    void shouldIgnoreAlertsBeforeLastRetrain() {
        List<Alert> alerts = criticalAlerts(5, NOW.minus(Duration.ofHours(3)));

        RetrainDecision decision = trigger.decide(alerts, NOW, NOW.minus(Duration.ofHours(1)));

        assertThat(decision.isShouldRetrain()).isFalse();
        assertThat(decision.getCriticalAlertCount()).isZero();
    }

    @Test
    @DisplayName("Should trigger on staleness with no alerts present")
    void shouldTriggerOnStaleness() {
        RetrainDecision decision = trigger.decide(List.of(), NOW, NOW.minus(Duration.ofDays(31)));

        assertThat(decision.isShouldRetrain()).isTrue();
        assertThat(decision.getReason()).isEqualTo(RetrainReason.STALENESS);
        assertThat(decision.getReason().getCode()).isEqualTo("staleness");
    }

    @Test
    @DisplayName("Should prefer the critical-alert reason when both conditions hold")
    void shouldPreferCriticalAlertsOverStaleness() {
        RetrainDecision decision = trigger.decide(criticalAlerts(4, NOW.minus(Duration.ofHours(2))), NOW,
                NOW.minus(Duration.ofDays(40)));

        assertThat(decision.getReason()).isEqualTo(RetrainReason.CRITICAL_ALERTS);
    }

    @Test
    @DisplayName("Should return the same decision for the same inputs")
    void shouldBeIdempotent() {
        List<Alert> alerts = criticalAlerts(4, NOW.minus(Duration.ofHours(4)));

        RetrainDecision first = trigger.decide(alerts, NOW, RECENT_RETRAIN);
        RetrainDecision second = trigger.decide(alerts, NOW, RECENT_RETRAIN);

        assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("Should decide when the evaluation period reaches past the earliest instant")
    void shouldHandleVeryLargeEvaluationPeriod() {
        RetrainTrigger wide = new RetrainTrigger(3, Duration.ofDays(1_000_000_000_000L),
                Duration.ofDays(1_000_000_000_000L));
        Instant longAgo = NOW.minus(Duration.ofDays(3650));

        RetrainDecision decision = wide.decide(criticalAlerts(4, longAgo), NOW, longAgo.minusSeconds(60));

        assertThat(decision.isShouldRetrain()).isTrue();
        assertThat(decision.getReason()).isEqualTo(RetrainReason.CRITICAL_ALERTS);
        assertThat(decision.getCriticalAlertCount()).isEqualTo(4);
        assertThat(wide.decide(List.of(), NOW, longAgo).getReason()).isEqualTo(RetrainReason.NONE);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static List<Alert> criticalAlerts(int count, Instant from) {
        List<Alert> alerts = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            alerts.add(alert(Severity.CRITICAL, from.plusSeconds(i)));
        }
        return alerts;
    }

    private static Alert alert(Severity severity, Instant ts) {
        return Alert.builder()
                .kind(AlertKind.DISTRIBUTION_DRIFT)
                .severity(severity)
                .timestamp(ts)
                .build();
    }
}
