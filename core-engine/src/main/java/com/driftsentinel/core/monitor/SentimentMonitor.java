package com.driftsentinel.core.monitor;

import com.driftsentinel.core.alert.AlertHistory;
import com.driftsentinel.core.alert.AlertManager;
import com.driftsentinel.core.config.MonitorConfig;
import com.driftsentinel.core.detection.DriftDetector;
import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.DriftMetric;
import com.driftsentinel.core.model.PredictionRecord;
import com.driftsentinel.core.model.PredictionResult;
import com.driftsentinel.core.model.RetrainDecision;
import com.driftsentinel.core.model.ValidationException;
import com.driftsentinel.core.report.SummaryReport;
import com.driftsentinel.core.report.SummaryReporter;
import com.driftsentinel.core.retrain.RetrainTrigger;
import com.driftsentinel.core.window.ObservationWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Continuous monitor for a deployed sentiment classifier.
 *
 * <p>
 * One instance owns one observation window and one alert history. Callers
 * feed it classifier results through {@link #logPrediction}; each call
 * appends to the window, re-evaluates drift on a fresh snapshot and returns
 * whatever alerts that evaluation raised.
 * </p>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * Create with a validated {@link MonitorConfig}; {@link #close()} stops
 * ingestion. Reports, drift evaluation and retrain checks stay available
 * after close so that a final summary can still be produced.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Safe for concurrent use. Window appends are serialized; reads work on
 * immutable snapshots.
 * </p>
 *
 * @since 1.0.0
 */
public class SentimentMonitor implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SentimentMonitor.class);

    private final MonitorConfig config;
    private final SentimentClassifier classifier;
    private final Clock clock;
    private final Instant startedAt;

    private final ObservationWindow window;
    private final AlertHistory alertHistory;
    private final DriftDetector detector;
    private final AlertManager alertManager;
    private final SummaryReporter reporter;
    private final RetrainTrigger retrainTrigger;

    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Monitor without a classifier, using the system clock.
     *
     * @param config validated configuration
     */
    public SentimentMonitor(MonitorConfig config) {
        this(config, null, Clock.systemUTC());
    }

    /**
     * @param config     validated configuration; must not be {@code null}
     * @param classifier classifier used by {@link #analyze(String)}; may be
     *                   {@code null} when the caller classifies on its own
     * @param clock      time source for records, alerts and reports
     */
    public SentimentMonitor(MonitorConfig config, SentimentClassifier classifier, Clock clock) {
        this.config = Objects.requireNonNull(config, "MonitorConfig must not be null");
        this.classifier = classifier;
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.startedAt = clock.instant();

        this.window = new ObservationWindow(config.getWindowCapacity(), config.getMaxAge(), clock);
        this.alertHistory = new AlertHistory();
        this.detector = DriftDetector.fromConfig(config);
        this.alertManager = new AlertManager(config, alertHistory);
        this.reporter = new SummaryReporter(config.getMinSamples(), config.getRecentAlertLimit());
        this.retrainTrigger = RetrainTrigger.fromConfig(config);

        LOG.info("SentimentMonitor started: {}", config);
    }

    // ---------------------------------------------------------------
    // Ingestion
    // ---------------------------------------------------------------

    /**
     * Record a classifier result and evaluate drift.
     *
     * @param text   the classified text
     * @param result the classifier output
     * @return unmodifiable list of alerts raised by this call, possibly empty
     * @throws ValidationException   if {@code result} is malformed; the window
     *                               is not modified
     * @throws IllegalStateException if the monitor is closed
     */
    public List<Alert> logPrediction(String text, PredictionResult result) {
        ensureOpen();
        Instant now = clock.instant();

        PredictionRecord record = PredictionRecord.fromResult(now, text, result);
        window.append(record);

        DriftMetric metric = detector.evaluate(window.snapshot(), config.getBaseline());
        return alertManager.evaluate(metric, now);
    }

    /**
     * Classify {@code text} with the injected classifier, then log the result.
     *
     * @param text the text to classify
     * @return the result and the alerts it raised
     * @throws IllegalStateException if no classifier was supplied or the
     *                               monitor is closed
     * @throws ValidationException   if the classifier returned a malformed
     *                               result
     */
    public MonitoredPrediction analyze(String text) {
        ensureOpen();
        if (classifier == null) {
            throw new IllegalStateException("No SentimentClassifier configured for this monitor");
        }
        PredictionResult result = classifier.predict(text);
        return new MonitoredPrediction(result, logPrediction(text, result));
    }

    // ---------------------------------------------------------------
    // Read side
    // ---------------------------------------------------------------

    /**
     * @return drift metric recomputed from the current window
     */
    public DriftMetric evaluateDrift() {
        return detector.evaluate(window.snapshot(), config.getBaseline());
    }

    /**
     * @return summary of the current window and alert history
     */
    public SummaryReport getSummaryReport() {
        return reporter.report(window.snapshot(), alertHistory.snapshot(), clock.instant());
    }

    /**
     * Retrain check measuring staleness from the monitor's start time.
     *
     * @param now decision time
     * @return the decision; calling again with the same {@code now} and no
     *         new alerts returns an equal decision
     */
    public RetrainDecision shouldRetrain(Instant now) {
        return shouldRetrain(now, startedAt);
    }

    /**
     * Retrain check using the scheduler's own bookkeeping.
     *
     * @param now           decision time
     * @param lastRetrainAt last retrain time; {@code null} means the monitor's
     *                      start time
     * @return the decision
     */
    public RetrainDecision shouldRetrain(Instant now, Instant lastRetrainAt) {
        Objects.requireNonNull(now, "now must not be null");
        return retrainTrigger.decide(alertHistory.snapshot(), now,
                lastRetrainAt != null ? lastRetrainAt : startedAt);
    }

    /**
     * @return immutable copy of every alert emitted so far, oldest first
     */
    public List<Alert> getAlertHistory() {
        return alertHistory.snapshot();
    }

    public int getWindowSize() {
        return window.size();
    }

    public MonitorConfig getConfig() {
        return config;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Clock getClock() {
        return clock;
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Stop accepting predictions. Idempotent.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            LOG.info("SentimentMonitor closed after {} prediction(s), {} alert(s)",
                    window.getTotalAppended(), alertHistory.size());
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("SentimentMonitor is closed");
        }
    }
}
