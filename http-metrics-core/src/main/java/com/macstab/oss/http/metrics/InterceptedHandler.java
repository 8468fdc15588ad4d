/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.http.metrics;

/**
 * Handler chain executed inside {@link HttpMetricsInterceptor#intercept}.
 *
 * @param <E> checked exception the handler may throw
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@FunctionalInterface
public interface InterceptedHandler<E extends Exception> {

  /**
   * Handles the request.
   *
   * <p>May report routing results and body progress on the observation ({@link
   * RequestObservation#routeMatched}, {@link RequestObservation#addRequestBodyBytes}).
   *
   * @param observation observation of the current request
   * @return outcome of the produced response
   * @throws E if handling fails (recorded as abnormal termination, then rethrown unchanged)
   */
  ResponseOutcome handle(RequestObservation observation) throws E;
}
