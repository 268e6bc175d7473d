/**
 * Alert generation, cool-down de-duplication and the append-only alert
 * history.
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.alert;
