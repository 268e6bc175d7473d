/**
 * Point-in-time summary reports and their plain-text rendering.
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.report;
