package com.driftsentinel.service;

import com.driftsentinel.core.config.MonitorConfigLoader;

/**
 * Typed, immutable configuration of the Drift Sentinel service process.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the service is configurable through container env vars or a shell
 * environment. Monitor thresholds live in the YAML file named by
 * {@code MONITOR_CONFIG_PATH}, not here.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic and test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    public static final String ENV_HTTP_PORT = "HTTP_PORT";
    public static final String ENV_HTTP_THREADS = "HTTP_THREADS";

    private final int httpPort;
    private final int httpThreads;
    private final String monitorConfigPath;

    private ServiceConfig(Builder b) {
        this.httpPort = b.httpPort;
        this.httpThreads = b.httpThreads;
        this.monitorConfigPath = b.monitorConfigPath;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Build a {@link ServiceConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServiceConfig fromEnvironment() {
        try {
            return new Builder()
                    .httpPort(parseIntEnv(ENV_HTTP_PORT, "8080"))
                    .httpThreads(parseIntEnv(ENV_HTTP_THREADS, "4"))
                    .monitorConfigPath(env(MonitorConfigLoader.ENV_CONFIG_PATH, ""))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /**
     * @return TCP port; {@code 0} binds an ephemeral port
     */
    public int getHttpPort() {
        return httpPort;
    }

    public int getHttpThreads() {
        return httpThreads;
    }

    /**
     * @return monitor YAML path, or an empty string to use the loader's
     *         default resolution
     */
    public String getMonitorConfigPath() {
        return monitorConfigPath;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServiceConfig}.
     *
     * <p>
     * The {@link #build()} method validates that the port is in [0, 65535]
     * and that at least one HTTP worker thread is configured.
     * </p>
     */
    public static class Builder {
        private int httpPort = 8080;
        private int httpThreads = 4;
        private String monitorConfigPath = "";

        public Builder httpPort(int v) {
            this.httpPort = v;
            return this;
        }

        public Builder httpThreads(int v) {
            this.httpThreads = v;
            return this;
        }

        public Builder monitorConfigPath(String v) {
            this.monitorConfigPath = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link ServiceConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServiceConfig build() {
            if (httpPort < 0 || httpPort > 65_535) {
                throw new IllegalArgumentException("httpPort must be in [0, 65535], got: " + httpPort);
            }
            if (httpThreads < 1) {
                throw new IllegalArgumentException("httpThreads must be >= 1, got: " + httpThreads);
            }
            if (monitorConfigPath == null) {
                monitorConfigPath = "";
            }
            return new ServiceConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue).trim());
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "httpPort=" + httpPort +
                ", httpThreads=" + httpThreads +
                ", monitorConfigPath='" + monitorConfigPath + '\'' +
                '}';
    }
}
