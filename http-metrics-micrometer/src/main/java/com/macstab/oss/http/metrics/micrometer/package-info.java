/* (C)2026 Macstab GmbH */

/**
 * Micrometer implementation of {@link com.macstab.oss.http.metrics.backend.MetricsBackend}.
 *
 * <p>Timers, distribution summaries and gauges are created lazily per label set and cached up to a
 * configurable bound; see {@link com.macstab.oss.http.metrics.micrometer.MicrometerMetricsBackend}.
 *
 * @since 1.0.0
 */
package com.macstab.oss.http.metrics.micrometer;
