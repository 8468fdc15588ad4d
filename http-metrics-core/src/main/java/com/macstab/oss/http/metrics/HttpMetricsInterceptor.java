/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.http.metrics;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

import com.macstab.oss.http.metrics.backend.MetricsBackend;
import com.macstab.oss.http.metrics.backend.MetricsEmitter;
import com.macstab.oss.http.metrics.backend.RequestLabels;
import com.macstab.oss.http.metrics.config.HttpMetricsConfig;
import com.macstab.oss.http.metrics.config.UnmatchedRoutePolicy;
import com.macstab.oss.http.metrics.route.CardinalityOverride;
import com.macstab.oss.http.metrics.route.RouteLabelResolver;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Request lifecycle driver: opens the active-request scope, times the request and finalizes it
 * exactly once.
 *
 * <p><strong>Lifecycle:</strong>
 *
 * <pre>
 * Started → AwaitingBody → HandlerRunning → Finalizing → Done
 *    │                                          │
 *    └─ gauge +1 ({@link #begin})                └─ label resolve, 3 observations, gauge -1
 * </pre>
 *
 * <p><strong>Integration:</strong> server adapters call {@link #begin(RequestStart)} when a
 * request arrives and close the returned {@link RequestObservation} on every exit path. Code that
 * can express the handler as a callback uses {@link #intercept(RequestStart, InterceptedHandler)}
 * instead.
 *
 * <p><strong>Ordering:</strong> per request, increment happens before the observations, which
 * happen before the decrement. The decrement runs even if observation emission or label
 * resolution fails.
 *
 * <p><strong>Thread Safety:</strong> Thread-safe. One instance serves all requests; per-request
 * state lives in {@link RequestObservation}.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
public final class HttpMetricsInterceptor {

  private static final double NANOS_PER_SECOND = TimeUnit.SECONDS.toNanos(1);

  private final HttpMetricsConfig config;
  private final MetricsEmitter emitter;
  private final LongSupplier nanoClock;

  /**
   * Creates an interceptor emitting into the given backend.
   *
   * @param config metrics configuration
   * @param backend metrics backend
   */
  public HttpMetricsInterceptor(
      @NonNull final HttpMetricsConfig config, @NonNull final MetricsBackend backend) {
    this(new MetricsEmitter(config, backend), System::nanoTime);
  }

  HttpMetricsInterceptor(@NonNull final MetricsEmitter emitter, @NonNull final LongSupplier clock) {
    this.config = emitter.getConfig();
    this.emitter = emitter;
    this.nanoClock = clock;
  }

  /**
   * Opens the metrics scope of a request: captures the start time and increments the
   * active-requests gauge.
   *
   * @param start request descriptor
   * @return observation in phase {@link RequestPhase#AWAITING_BODY}, to be closed exactly once
   */
  public RequestObservation begin(@NonNull final RequestStart start) {
    final var observation = new RequestObservation(this, start, nanoClock.getAsLong());
    emitter.incrementActiveRequests(start.getMethod(), start.getScheme());
    observation.awaitBody();
    return observation;
  }

  /**
   * Runs a handler inside a metrics scope.
   *
   * <p>A normal return records the returned outcome. A thrown exception records an abnormal
   * outcome and is rethrown unchanged after the observation has been finalized.
   *
   * @param start request descriptor
   * @param handler handler chain
   * @param <E> checked exception type thrown by the handler
   * @return the handler's outcome
   * @throws E whatever the handler throws
   */
  public <E extends Exception> ResponseOutcome intercept(
      @NonNull final RequestStart start, @NonNull final InterceptedHandler<E> handler) throws E {
    try (RequestObservation observation = begin(start)) {
      observation.handlerStarted();
      final ResponseOutcome outcome;
      try {
        outcome = handler.handle(observation);
      } catch (final Exception | Error e) {
        observation.fail(e, 0);
        throw e;
      }
      Objects.requireNonNull(outcome, "handler returned null outcome");
      observation.complete(outcome);
      return outcome;
    }
  }

  public HttpMetricsConfig getConfig() {
    return config;
  }

  public MetricsEmitter getEmitter() {
    return emitter;
  }

  /** Called once per observation from {@link RequestObservation#close()}. Never throws. */
  void finish(final RequestObservation observation, final ResponseOutcome outcome) {
    final RequestStart start = observation.getStart();
    try {
      final double elapsedSeconds =
          Math.max(0L, nanoClock.getAsLong() - observation.getStartNanos()) / NANOS_PER_SECOND;
      final String route = resolveRoute(observation, outcome.getStatus());

      if (isExcluded(observation, route, outcome.getStatus())) {
        log.trace("Request {} {} excluded from observations", start.getMethod(), route);
        return;
      }

      final var labels =
          new RequestLabels(
              route,
              start.getMethod(),
              outcome.getStatus(),
              start.getProtocol().getName(),
              start.getProtocol().getVersion());
      emitter.observeDuration(labels, elapsedSeconds);
      emitter.observeRequestBodySize(labels, observation.getRequestBodyBytes());
      emitter.observeResponseBodySize(labels, outcome.getResponseBodyBytes());
    } catch (final RuntimeException e) {
      log.warn("Failed to finalize metrics for {}", start, e);
    } finally {
      emitter.decrementActiveRequests(start.getMethod(), start.getScheme());
    }
  }

  /**
   * Exclusions see the label before masking (the raw path of an unmatched request, the
   * substituted template otherwise) and, when it differs, the final route label.
   */
  private boolean isExcluded(
      final RequestObservation observation, final String route, final int status) {
    final String unmasked =
        RouteLabelResolver.resolve(
            observation.getRouteTemplate(),
            observation.getStart().getPath(),
            observation.getPathVariables(),
            observation.getCardinalityOverride(),
            UnmatchedRoutePolicy.disabled());
    return config.isExcluded(unmasked, status)
        || (!unmasked.equals(route) && config.isExcluded(route, status));
  }

  private String resolveRoute(final RequestObservation observation, final int status) {
    // 404/405: the server rejected the path or method, matched values must not become labels
    final CardinalityOverride override =
        status == 404 || status == 405 ? null : observation.getCardinalityOverride();
    return RouteLabelResolver.resolve(
        observation.getRouteTemplate(),
        observation.getStart().getPath(),
        observation.getPathVariables(),
        override,
        config.getUnmatchedRoutePolicy());
  }
}
