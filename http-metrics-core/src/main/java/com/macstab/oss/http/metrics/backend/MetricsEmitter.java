/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.http.metrics.backend;

import java.util.concurrent.atomic.AtomicLong;

import com.macstab.oss.http.metrics.config.HttpMetricsConfig;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Thin adapter between the request lifecycle and the {@link MetricsBackend}.
 *
 * <p>Instrument names come from {@link HttpMetricsConfig}, so renaming a metric never touches a
 * call site. Label keys come from the same config.
 *
 * <p><strong>Instruments:</strong>
 *
 * <table>
 *   <caption>Instrument Summary</caption>
 *   <thead>
 *     <tr><th>Default name</th><th>Type</th><th>Labels</th></tr>
 *   </thead>
 *   <tbody>
 *     <tr>
 *       <td>{@code http.server.active_requests}</td>
 *       <td>Gauge</td>
 *       <td>method, scheme</td>
 *     </tr>
 *     <tr>
 *       <td>{@code http.server.request.duration}</td>
 *       <td>Timer (seconds)</td>
 *       <td>route, method, status, protocol_name, protocol_version</td>
 *     </tr>
 *     <tr>
 *       <td>{@code http.server.request.body.size}</td>
 *       <td>Summary (bytes)</td>
 *       <td>route, method, status, protocol_name, protocol_version</td>
 *     </tr>
 *     <tr>
 *       <td>{@code http.server.response.body.size}</td>
 *       <td>Summary (bytes)</td>
 *       <td>route, method, status, protocol_name, protocol_version</td>
 *     </tr>
 *   </tbody>
 * </table>
 *
 * <p>Constant labels from the config are appended to all four.
 *
 * <p><strong>Failure Handling:</strong> Every backend call is guarded. A {@link RuntimeException}
 * is logged at WARN, counted in {@link #getEmissionFailures()} and swallowed.
 *
 * <p><strong>Thread Safety:</strong> Immutable apart from the failure counter (atomic).
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
public final class MetricsEmitter {

  private final HttpMetricsConfig config;
  private final MetricsBackend backend;

  private final Instrument activeRequests;
  private final Instrument requestDuration;
  private final Instrument requestBodySize;
  private final Instrument responseBodySize;

  private final AtomicLong emissionFailures = new AtomicLong();

  /**
   * Creates an emitter.
   *
   * @param config metrics configuration
   * @param backend metrics backend
   * @throws NullPointerException if config or backend is null
   */
  public MetricsEmitter(
      @NonNull final HttpMetricsConfig config, @NonNull final MetricsBackend backend) {
    this.config = config;
    this.backend = backend;

    this.activeRequests =
        new Instrument(
            config.getActiveRequestsName(),
            InstrumentType.GAUGE,
            "Number of HTTP server requests currently being processed",
            null);
    this.requestDuration =
        new Instrument(
            config.getRequestDurationName(),
            InstrumentType.TIMER,
            "HTTP request duration in seconds for all requests",
            "seconds");
    this.requestBodySize =
        new Instrument(
            config.getRequestBodySizeName(),
            InstrumentType.SUMMARY,
            "HTTP request body size in bytes for all requests",
            "bytes");
    this.responseBodySize =
        new Instrument(
            config.getResponseBodySizeName(),
            InstrumentType.SUMMARY,
            "HTTP response body size in bytes for all requests",
            "bytes");
  }

  public void incrementActiveRequests(final String method, final String scheme) {
    adjustActiveRequests(method, scheme, 1);
  }

  public void decrementActiveRequests(final String method, final String scheme) {
    adjustActiveRequests(method, scheme, -1);
  }

  public void observeDuration(final RequestLabels labels, final double elapsedSeconds) {
    record(requestDuration, labels, elapsedSeconds);
  }

  public void observeRequestBodySize(final RequestLabels labels, final long bytes) {
    record(requestBodySize, labels, bytes);
  }

  public void observeResponseBodySize(final RequestLabels labels, final long bytes) {
    record(responseBodySize, labels, bytes);
  }

  /**
   * Number of backend calls that failed since creation (side-channel diagnostic).
   *
   * @return failure count
   */
  public long getEmissionFailures() {
    return emissionFailures.get();
  }

  public HttpMetricsConfig getConfig() {
    return config;
  }

  private void adjustActiveRequests(final String method, final String scheme, final long delta) {
    Labels labels = null;
    try {
      labels =
          Labels.of(config.getMethodLabel(), method, config.getSchemeLabel(), scheme)
              .and(config.getConstLabels());
      backend.adjustGauge(activeRequests, labels, delta);
    } catch (final RuntimeException e) {
      onFailure(activeRequests, labels, e);
    }
  }

  private void record(
      final Instrument instrument, final RequestLabels request, final double value) {
    Labels labels = null;
    try {
      labels = toLabels(request);
      backend.record(instrument, labels, value);
    } catch (final RuntimeException e) {
      onFailure(instrument, labels, e);
    }
  }

  private Labels toLabels(final RequestLabels request) {
    return Labels.of(
            config.getRouteLabel(),
            request.getRoute(),
            config.getMethodLabel(),
            request.getMethod(),
            config.getStatusLabel(),
            String.valueOf(request.getStatus()),
            config.getProtocolNameLabel(),
            request.getProtocolName(),
            config.getProtocolVersionLabel(),
            request.getProtocolVersion())
        .and(config.getConstLabels());
  }

  private void onFailure(
      final Instrument instrument, final Labels labels, final RuntimeException e) {
    final long failures = emissionFailures.incrementAndGet();
    if (failures == 1 || log.isDebugEnabled()) {
      log.warn(
          "Metric emission failed for {} {} (failures so far: {})",
          instrument,
          labels,
          failures,
          e);
    } else {
      log.warn(
          "Metric emission failed for {} {}: {} (failures so far: {})",
          instrument,
          labels,
          e.toString(),
          failures);
    }
  }
}
