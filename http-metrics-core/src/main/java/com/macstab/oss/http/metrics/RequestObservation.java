/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.http.metrics;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import com.macstab.oss.http.metrics.route.CardinalityOverride;

import lombok.extern.slf4j.Slf4j;

/**
 * Metrics scope of one in-flight request.
 *
 * <p><strong>Scoped acquisition:</strong> {@link HttpMetricsInterceptor#begin(RequestStart)}
 * increments the active-requests gauge and returns this scope; {@link #close()} releases it. Use
 * try-with-resources (or {@code finally}) so the release happens on every exit path, including
 * exceptions and errors thrown by the handler chain:
 *
 * <pre>{@code
 * try (RequestObservation observation = interceptor.begin(start)) {
 *   observation.handlerStarted();
 *   chain.proceed();
 *   observation.complete(response.getStatus(), response.bytesWritten());
 * }
 * }</pre>
 *
 * <p><strong>Exactly-once finalization:</strong> the first {@link #close()} wins an atomic
 * compare-and-set and emits the gauge decrement plus one duration/request-size/response-size
 * triple. Later calls (from another thread, e.g. an async listener racing the container thread)
 * are no-ops.
 *
 * <p><strong>Missing outcome:</strong> if neither {@link #complete} nor {@link #fail} was called
 * before {@link #close()} (dropped connection, handler threw through try-with-resources), an
 * abnormal outcome is synthesized with the best-known status ({@link #statusHint(int)}) or the
 * configured abnormal termination status.
 *
 * <p><strong>Thread Safety:</strong> body byte counting and finalization are thread-safe; the
 * routing setters publish through volatile fields and are meant to be called by the thread
 * running the handler chain.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
public final class RequestObservation implements AutoCloseable {

  private final HttpMetricsInterceptor interceptor;
  private final RequestStart start;
  private final long startNanos;

  private final AtomicReference<RequestPhase> phase =
      new AtomicReference<>(RequestPhase.STARTED);
  private final AtomicReference<ResponseOutcome> outcome = new AtomicReference<>();
  private final AtomicLong requestBodyBytes = new AtomicLong();

  private volatile String routeTemplate;
  private volatile Map<String, String> pathVariables = Map.of();
  private volatile CardinalityOverride cardinalityOverride;
  private volatile int statusHint;

  RequestObservation(
      final HttpMetricsInterceptor interceptor, final RequestStart start, final long startNanos) {
    this.interceptor = interceptor;
    this.start = start;
    this.startNanos = startNanos;
  }

  /** STARTED → AWAITING_BODY, called by the interceptor once the gauge was incremented. */
  void awaitBody() {
    phase.compareAndSet(RequestPhase.STARTED, RequestPhase.AWAITING_BODY);
  }

  /**
   * Adds inbound body bytes (may be called concurrently with the handler).
   *
   * @param bytes bytes consumed, ignored when {@code <= 0}
   */
  public void addRequestBodyBytes(final long bytes) {
    if (bytes <= 0) {
      return;
    }
    if (!phase.get().isOpen()) {
      log.debug("Ignoring {} request body bytes after finalization of {}", bytes, start);
      return;
    }
    requestBodyBytes.addAndGet(bytes);
  }

  /** AWAITING_BODY → HANDLER_RUNNING. */
  public void handlerStarted() {
    phase.compareAndSet(RequestPhase.AWAITING_BODY, RequestPhase.HANDLER_RUNNING);
  }

  /**
   * Records the router's match result.
   *
   * @param template matched route template, {@code null} if no route matched
   * @param variables matched path variable values, {@code null} treated as empty
   */
  public void routeMatched(final String template, final Map<String, String> variables) {
    if (!isOpen("route match")) {
      return;
    }
    this.routeTemplate = template;
    this.pathVariables = variables == null ? Map.of() : Map.copyOf(variables);
  }

  /**
   * Attaches a per-request cardinality override (merged with any previously attached one).
   *
   * @param override override, {@code null} is ignored
   */
  public void keepCardinality(final CardinalityOverride override) {
    if (override == null || !isOpen("cardinality override")) {
      return;
    }
    final CardinalityOverride current = this.cardinalityOverride;
    this.cardinalityOverride = current == null ? override : current.and(override);
  }

  /**
   * Records the best-known status without finishing the request (used if the request later
   * terminates abnormally).
   *
   * @param status status already decided by the server or handler
   */
  public void statusHint(final int status) {
    this.statusHint = status;
  }

  /**
   * Records a normally produced response. The first recorded outcome wins.
   *
   * @param status response status
   * @param responseBodyBytes bytes written to the response body
   */
  public void complete(final int status, final long responseBodyBytes) {
    complete(ResponseOutcome.completed(status, responseBodyBytes));
  }

  /**
   * Records an outcome. The first recorded outcome wins.
   *
   * @param responseOutcome outcome
   */
  public void complete(final ResponseOutcome responseOutcome) {
    Objects.requireNonNull(responseOutcome, "responseOutcome must not be null");
    if (isOpen("outcome") && !outcome.compareAndSet(null, responseOutcome)) {
      log.debug("Outcome already recorded for {}, ignoring {}", start, responseOutcome);
    }
  }

  /**
   * Records an abnormal termination of the handler chain with no response body written.
   *
   * @param failure what terminated the chain, may be {@code null}
   * @param bestKnownStatus status known at the time of failure, {@code 0} if none
   */
  public void fail(final Throwable failure, final int bestKnownStatus) {
    fail(failure, bestKnownStatus, 0);
  }

  /**
   * Records an abnormal termination of the handler chain.
   *
   * <p>The recorded status is {@code bestKnownStatus} when it is an error status ({@code >= 400}),
   * otherwise the configured abnormal termination status. The failure itself is not rethrown here;
   * the caller rethrows it unchanged.
   *
   * @param failure what terminated the chain (for logging), may be {@code null}
   * @param bestKnownStatus status known at the time of failure, {@code 0} if none
   * @param responseBodyBytes bytes written before the failure
   */
  public void fail(
      final Throwable failure, final int bestKnownStatus, final long responseBodyBytes) {
    final int status =
        bestKnownStatus >= 400 && bestKnownStatus <= 999
            ? bestKnownStatus
            : interceptor.getConfig().getAbnormalTerminationStatus();
    if (log.isDebugEnabled()) {
      log.debug("Request {} terminated abnormally (status {})", start, status, failure);
    }
    complete(ResponseOutcome.abnormal(status, Math.max(0, responseBodyBytes)));
  }

  /**
   * Finalizes the request exactly once: resolves the route label, emits the observation triple and
   * decrements the active-requests gauge. Never throws.
   */
  @Override
  public void close() {
    RequestPhase current;
    do {
      current = phase.get();
      if (!current.isOpen()) {
        return;
      }
    } while (!phase.compareAndSet(current, RequestPhase.FINALIZING));

    try {
      interceptor.finish(this, outcomeOrSynthesized());
    } finally {
      phase.set(RequestPhase.DONE);
    }
  }

  private ResponseOutcome outcomeOrSynthesized() {
    final ResponseOutcome recorded = outcome.get();
    if (recorded != null) {
      return recorded;
    }
    final int hint = statusHint;
    final int status =
        hint >= 400 && hint <= 999 ? hint : interceptor.getConfig().getAbnormalTerminationStatus();
    log.debug("No outcome recorded for {}, synthesizing status {}", start, status);
    return ResponseOutcome.abnormal(status, 0);
  }

  private boolean isOpen(final String what) {
    if (phase.get().isOpen()) {
      return true;
    }
    log.debug("Ignoring {} after finalization of {}", what, start);
    return false;
  }

  public RequestStart getStart() {
    return start;
  }

  public RequestPhase getPhase() {
    return phase.get();
  }

  public long getStartNanos() {
    return startNanos;
  }

  public long getRequestBodyBytes() {
    return requestBodyBytes.get();
  }

  public String getRouteTemplate() {
    return routeTemplate;
  }

  public Map<String, String> getPathVariables() {
    return pathVariables;
  }

  public CardinalityOverride getCardinalityOverride() {
    return cardinalityOverride;
  }

  public boolean hasOutcome() {
    return outcome.get() != null;
  }
}
