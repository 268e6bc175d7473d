/**
 * Monitor configuration: the immutable
 * {@link com.driftsentinel.core.config.MonitorConfig}, the fixed
 * {@link com.driftsentinel.core.config.BaselineDistribution}, and YAML loading
 * through {@link com.driftsentinel.core.config.MonitorConfigLoader}.
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.config;
