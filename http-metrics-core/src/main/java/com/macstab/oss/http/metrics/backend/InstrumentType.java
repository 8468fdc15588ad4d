/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.http.metrics.backend;

/**
 * Kind of instrument a {@link MetricsBackend} maintains for an {@link Instrument}.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
public enum InstrumentType {

  /** Up/down value adjusted by deltas (active requests). */
  GAUGE,

  /** Latency distribution, observations in seconds. */
  TIMER,

  /** Value distribution (body sizes in bytes). */
  SUMMARY
}
