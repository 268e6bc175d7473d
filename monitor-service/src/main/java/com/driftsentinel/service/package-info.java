/**
 * Process glue for running the monitor as a service.
 *
 * <p>
 * Environment-driven {@link com.driftsentinel.service.ServiceConfig}, the
 * JDK-based {@link com.driftsentinel.service.MonitorHttpServer}, JSON
 * encoding and the {@link com.driftsentinel.service.RetrainingManager}
 * that acts on retrain decisions.
 * </p>
 *
 * @since 1.0.0
 */
package com.driftsentinel.service;
