/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.http.metrics.backend;

/**
 * Framework-agnostic metrics backend SPI.
 *
 * <p>The backend owns storage, aggregation, quantile computation and exposition. The HTTP metrics
 * core only pushes gauge deltas and observations into it, with a name taken from configuration
 * and a label set resolved per request.
 *
 * <p><strong>Design Pattern:</strong> Interface with default no-op methods. Implementations
 * override only the methods they need.
 *
 * <p><strong>Implementations:</strong>
 *
 * <ul>
 *   <li>{@link #NOOP} - zero-overhead singleton (uses default methods)
 *   <li>{@code MicrometerMetricsBackend} - Micrometer {@code MeterRegistry} adapter
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> Implementations MUST be thread-safe. Every in-flight request
 * calls into the backend concurrently.
 *
 * <p><strong>Failure Contract:</strong> Implementations MAY throw. The caller ({@code
 * MetricsEmitter}) catches every {@link RuntimeException}, logs it and carries on; a failing
 * backend never changes the HTTP response.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
public interface MetricsBackend extends AutoCloseable {

  /** No-op singleton instance (uses default methods). */
  MetricsBackend NOOP = new MetricsBackend() {};

  /**
   * Adjusts a gauge by a delta.
   *
   * <p><strong>Metric Type:</strong> Gauge ({@link InstrumentType#GAUGE})
   *
   * <p><strong>Default:</strong> No-op (override to implement).
   *
   * @param instrument gauge descriptor
   * @param labels label set identifying the gauge series
   * @param delta {@code +1} on request start, {@code -1} on request completion
   */
  default void adjustGauge(final Instrument instrument, final Labels labels, final long delta) {
    // No-op by default
  }

  /**
   * Records one observation.
   *
   * <p><strong>Metric Type:</strong> Timer (value in seconds) or summary (value in bytes), see
   * {@link Instrument#getType()}.
   *
   * <p><strong>Default:</strong> No-op (override to implement).
   *
   * @param instrument timer or summary descriptor
   * @param labels label set identifying the series
   * @param value observed value ({@code >= 0})
   */
  default void record(final Instrument instrument, final Labels labels, final double value) {
    // No-op by default
  }

  /**
   * Releases backend resources (e.g. gauges registered in a shared registry).
   *
   * <p><strong>Idempotency:</strong> MUST be safe to call multiple times.
   *
   * <p><strong>Exception Handling:</strong> MUST NOT throw.
   */
  @Override
  default void close() {
    // No-op by default
  }
}
