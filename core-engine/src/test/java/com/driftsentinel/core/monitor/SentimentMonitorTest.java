package com.driftsentinel.core.monitor;

import com.driftsentinel.core.config.MonitorConfig;
import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.AlertKind;
import com.driftsentinel.core.model.DriftMetric;
import com.driftsentinel.core.model.DriftStatus;
import com.driftsentinel.core.model.PredictionResult;
import com.driftsentinel.core.model.RetrainDecision;
import com.driftsentinel.core.model.RetrainReason;
import com.driftsentinel.core.model.SentimentLabel;
import com.driftsentinel.core.model.Severity;
import com.driftsentinel.core.model.ValidationException;
import com.driftsentinel.core.report.ConfidenceTrend;
import com.driftsentinel.core.report.SummaryReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Behavioural tests for {@link SentimentMonitor} driven by synthetic
 * predictions and a controllable clock.
 */
class SentimentMonitorTest {

    private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
    }

    @Test
    @DisplayName("Should raise one critical drift alert once a small window fills with one label")
    void shouldRaiseCriticalDriftWhenWindowFills() {
        SentimentMonitor monitor = new SentimentMonitor(MonitorConfig.builder()
                .windowCapacity(5)
                .minSamples(5)
                .build(), null, clock);

        List<Alert> last = List.of();
        for (int i = 0; i < 5; i++) {
            clock.advance(Duration.ofSeconds(1));
            last = monitor.logPrediction("loved it " + i, positive(0.9));
        }

        assertThat(last).singleElement().satisfies(alert -> {
            assertThat(alert.getKind()).isEqualTo(AlertKind.DISTRIBUTION_DRIFT);
            assertThat(alert.getSeverity()).isEqualTo(Severity.CRITICAL);
        });
        assertThat(monitor.getWindowSize()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should report insufficient data and a neutral trend for a short window")
    void shouldReportInsufficientData() {
        SentimentMonitor monitor = new SentimentMonitor(MonitorConfig.defaults(), null, clock);

        monitor.logPrediction("a", positive(0.9));
        monitor.logPrediction("b", positive(0.8));
        monitor.logPrediction("c", positive(0.7));

        DriftMetric metric = monitor.evaluateDrift();
        SummaryReport report = monitor.getSummaryReport();

        assertThat(metric.getStatus()).isEqualTo(DriftStatus.INSUFFICIENT_DATA);
        assertThat(report.getSampleCount()).isEqualTo(3);
        assertThat(report.isInsufficientData()).isTrue();
        assertThat(report.getConfidenceTrend()).isEqualTo(ConfidenceTrend.NEUTRAL);
    }

    @Test
    @DisplayName("Should suppress a second drift alert inside the cool-down interval")
    void shouldSuppressRepeatedDriftAlert() {
        SentimentMonitor monitor = new SentimentMonitor(MonitorConfig.builder()
                .windowCapacity(5)
                .minSamples(5)
                .alertCooldown(Duration.ofMinutes(15))
                .build(), null, clock);

        feedPositive(monitor, 5);
        List<Alert> afterFirstBatch = monitor.getAlertHistory();
        assertThat(afterFirstBatch).filteredOn(a -> a.getKind() == AlertKind.DISTRIBUTION_DRIFT).hasSize(1);

        clock.advance(Duration.ofMinutes(5));
        List<Alert> secondBatch = feedPositive(monitor, 5);

        assertThat(secondBatch).isEmpty();
        assertThat(monitor.getAlertHistory()).hasSameSizeAs(afterFirstBatch);
    }

    @Test
    @DisplayName("Should recommend retraining once the staleness interval has passed")
    void shouldRecommendRetrainWhenStale() {
        SentimentMonitor monitor = new SentimentMonitor(MonitorConfig.builder()
                .maxStaleness(Duration.ofDays(30))
                .build(), null, clock);

        RetrainDecision fresh = monitor.shouldRetrain(T0.plus(Duration.ofDays(1)));
        RetrainDecision stale = monitor.shouldRetrain(T0.plus(Duration.ofDays(31)));

        assertThat(monitor.getAlertHistory()).isEmpty();
        assertThat(fresh.isShouldRetrain()).isFalse();
        assertThat(stale.isShouldRetrain()).isTrue();
        assertThat(stale.getReason()).isEqualTo(RetrainReason.STALENESS);
    }

    @Test
    @DisplayName("Should reject scores that do not sum to one and leave the window unchanged")
    void shouldRejectInvalidScores() {
        SentimentMonitor monitor = new SentimentMonitor(MonitorConfig.defaults(), null, clock);
        monitor.logPrediction("fine", positive(0.9));

        PredictionResult invalid = new PredictionResult("Negative", 0.5,
                Map.of("Negative", 0.5, "Neutral", 0.6, "Positive", 0.1));

        assertThatThrownBy(() -> monitor.logPrediction("broken", invalid))
                .isInstanceOf(ValidationException.class);
        assertThat(monitor.getWindowSize()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should classify through the injected classifier")
    void shouldAnalyzeWithClassifier() {
        SentimentClassifier classifier = text -> text.contains("bad")
                ? PredictionResult.of(SentimentLabel.NEGATIVE, 0.8, 0.8, 0.1, 0.1)
                : PredictionResult.of(SentimentLabel.POSITIVE, 0.8, 0.1, 0.1, 0.8);
        SentimentMonitor monitor = new SentimentMonitor(MonitorConfig.defaults(), classifier, clock);

        MonitoredPrediction prediction = monitor.analyze("bad service");

        assertThat(prediction.getResult().getSentiment()).isEqualTo("Negative");
        assertThat(prediction.getAlerts()).extracting(Alert::getKind).containsExactly(AlertKind.INSUFFICIENT_DATA);
        assertThat(monitor.getWindowSize()).isEqualTo(1);
        assertThat(classifier.predictBatch(List.of("bad", "good")))
                .extracting(PredictionResult::getSentiment)
                .containsExactly("Negative", "Positive");
    }

    @Test
    @DisplayName("Should fail analyze when no classifier was injected")
    void shouldFailAnalyzeWithoutClassifier() {
        SentimentMonitor monitor = new SentimentMonitor(MonitorConfig.defaults(), null, clock);

        assertThatThrownBy(() -> monitor.analyze("text")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should stop ingestion after close but keep reporting")
    void shouldRejectIngestionAfterClose() {
        SentimentMonitor monitor = new SentimentMonitor(MonitorConfig.defaults(), null, clock);
        monitor.logPrediction("before", positive(0.9));

        monitor.close();
        monitor.close();

        assertThat(monitor.isClosed()).isTrue();
        assertThatThrownBy(() -> monitor.logPrediction("after", positive(0.9)))
                .isInstanceOf(IllegalStateException.class);
        assertThat(monitor.getSummaryReport().getSampleCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should count only critical alerts after the given retrain time")
    void shouldUseLastRetrainTime() {
        SentimentMonitor monitor = new SentimentMonitor(MonitorConfig.builder()
                .windowCapacity(5)
                .minSamples(5)
                .alertCooldown(Duration.ZERO)
                .criticalAlertThreshold(1)
                .build(), null, clock);

        feedPositive(monitor, 7);
        Instant now = clock.instant();

        assertThat(monitor.shouldRetrain(now).getReason()).isEqualTo(RetrainReason.CRITICAL_ALERTS);
        assertThat(monitor.shouldRetrain(now, now).isShouldRetrain()).isFalse();
    }

    @Test
    @DisplayName("Should emit one insufficient-data alert per cool-down interval")
    void shouldNotRepeatInsufficientDataAlert() {
        SentimentMonitor monitor = new SentimentMonitor(MonitorConfig.builder()
                .minSamples(30)
                .alertCooldown(Duration.ofMinutes(15))
                .build(), null, clock);

        feedPositive(monitor, 3);

        assertThat(monitor.getAlertHistory()).singleElement().satisfies(alert -> {
            assertThat(alert.getKind()).isEqualTo(AlertKind.INSUFFICIENT_DATA);
            assertThat(alert.getSeverity()).isEqualTo(Severity.INFO);
        });

        clock.advance(Duration.ofMinutes(16));
        List<Alert> afterCooldown = feedPositive(monitor, 3);

        assertThat(afterCooldown).singleElement()
                .satisfies(alert -> assertThat(alert.getKind()).isEqualTo(AlertKind.INSUFFICIENT_DATA));
        assertThat(monitor.getAlertHistory())
                .filteredOn(a -> a.getKind() == AlertKind.INSUFFICIENT_DATA)
                .hasSize(2);
    }

    @Test
    @DisplayName("Should log predictions when the maximum age reaches past the earliest instant")
    void shouldLogWithVeryLargeMaxAge() {
        SentimentMonitor monitor = new SentimentMonitor(MonitorConfig.builder()
                .maxAge(Duration.ofDays(1_000_000_000_000L))
                .retrainEvaluationPeriod(Duration.ofDays(1_000_000_000_000L))
                .build(), null, clock);

        feedPositive(monitor, 2);

        assertThat(monitor.getWindowSize()).isEqualTo(2);
        assertThat(monitor.shouldRetrain(clock.instant()).isShouldRetrain()).isFalse();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private List<Alert> feedPositive(SentimentMonitor monitor, int count) {
        List<Alert> emitted = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            clock.advance(Duration.ofSeconds(1));
            emitted.addAll(monitor.logPrediction("text " + i, positive(0.9)));
        }
        return emitted;
    }

    private static PredictionResult positive(double confidence) {
        double rest = (1.0 - confidence) / 2;
        return PredictionResult.of(SentimentLabel.POSITIVE, confidence, rest, rest, confidence);
    }

    /** Clock whose instant only moves when a test advances it. */
    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public Instant instant() {
            return now;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }
    }
}
