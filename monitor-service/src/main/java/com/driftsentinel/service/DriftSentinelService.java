package com.driftsentinel.service;

import com.driftsentinel.core.config.MonitorConfig;
import com.driftsentinel.core.config.MonitorConfigLoader;
import com.driftsentinel.core.monitor.SentimentMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Main entry point for the Drift Sentinel monitor service.
 *
 * <h3>Process</h3>
 * 
 * <pre>
 *   env (ServiceConfig) + monitor YAML (MonitorConfig)
 *     → SentimentMonitor (window, drift, alerts, reports)
 *     → RetrainingManager (LoggingRetrainAction)
 *     → MonitorHttpServer (health, predictions, report, retrain)
 * </pre>
 *
 * <p>
 * The classifier runs elsewhere and posts its results to
 * {@code /predictions}. A shutdown hook stops the HTTP server and closes the
 * monitor.
 * </p>
 *
 * @since 1.0.0
 */
public final class DriftSentinelService {

    private static final Logger LOG = LoggerFactory.getLogger(DriftSentinelService.class);

    private DriftSentinelService() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) {
        // 1. Load configuration
        ServiceConfig config = ServiceConfig.fromEnvironment();
        LOG.info("Starting Drift Sentinel with config: {}", config);
        MonitorConfig monitorConfig = loadMonitorConfig(config);

        // 2. Wire the monitor and retraining manager
        Clock clock = Clock.systemUTC();
        SentimentMonitor monitor = new SentimentMonitor(monitorConfig, null, clock);
        RetrainingManager retrainingManager = new RetrainingManager(monitor, new LoggingRetrainAction(clock));

        // 3. Start HTTP server with shutdown hook
        MonitorHttpServer server = new MonitorHttpServer(monitor, retrainingManager, new JsonCodec());
        server.start(config.getHttpPort(), config.getHttpThreads());
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop();
            monitor.close();
        }, "drift-sentinel-shutdown"));
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static MonitorConfig loadMonitorConfig(ServiceConfig config) {
        String path = config.getMonitorConfigPath();
        if (path != null && !path.isBlank()) {
            return MonitorConfigLoader.fromFile(path);
        }
        return MonitorConfigLoader.load();
    }
}
