/**
 * The stateless retrain decision consumed by an external scheduler.
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.retrain;
