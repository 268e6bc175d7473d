/**
 * The bounded observation window and its read-only snapshots.
 *
 * <p>
 * {@link com.driftsentinel.core.window.ObservationWindow} is the only mutable
 * store of predictions; everything downstream works on a
 * {@link com.driftsentinel.core.window.WindowSnapshot}.
 * </p>
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.window;
