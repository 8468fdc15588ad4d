/* (C)2026 Macstab GmbH */

/**
 * Metrics backend SPI ({@link com.macstab.oss.http.metrics.backend.MetricsBackend}) and the
 * emitter that guards every call into it.
 *
 * <p>Implement the SPI to plug in a metrics library other than Micrometer.
 *
 * @since 1.0.0
 */
package com.macstab.oss.http.metrics.backend;
