/**
 * The monitor facade and the classifier seam.
 *
 * <p>
 * {@link com.driftsentinel.core.monitor.SentimentMonitor} wires window,
 * detector, alert manager, reporter and retrain trigger around one
 * configuration. The classifier is injected through
 * {@link com.driftsentinel.core.monitor.SentimentClassifier}.
 * </p>
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.monitor;
