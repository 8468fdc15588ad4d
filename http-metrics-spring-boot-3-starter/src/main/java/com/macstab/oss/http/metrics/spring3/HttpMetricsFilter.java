/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.http.metrics.spring3;

import java.io.IOException;
import java.util.Map;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.HandlerMapping;
import org.springframework.web.servlet.mvc.method.RequestMappingInfoHandlerMapping;

import com.macstab.oss.http.metrics.HttpMetricsInterceptor;
import com.macstab.oss.http.metrics.RequestObservation;
import com.macstab.oss.http.metrics.RequestStart;
import com.macstab.oss.http.metrics.route.CardinalityOverride;

import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Servlet filter that observes every request through an {@link HttpMetricsInterceptor}.
 *
 * <p><strong>Per request:</strong>
 *
 * <ol>
 *   <li>{@link HttpMetricsInterceptor#begin} increments the active-requests gauge
 *   <li>Request and response are wrapped so body bytes are counted as they stream
 *   <li>The chain runs; a thrown failure is recorded and rethrown unchanged
 *   <li>The matched route pattern and URI template variables that Spring MVC left on the request
 *       are handed to the observation, together with any {@link CardinalityOverride} a handler
 *       attached
 *   <li>The observation is closed, emitting the duration and body-size observations and
 *       decrementing the gauge
 * </ol>
 *
 * <p><strong>Async requests:</strong> when the handler started async processing, finalization is
 * deferred to the {@link AsyncListener#onComplete} callback so the duration covers the whole
 * exchange.
 *
 * <p><strong>Route matching:</strong> a {@code 404} whose best matching pattern is the static
 * resource catch-all {@code /**} is treated as unmatched, so probes for arbitrary paths fold into
 * the unmatched-route mask. A {@code 405} carries no pattern attribute; its pattern is looked up
 * in the registered request mappings when the filter was given access to them.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 * @see HttpMetricsRequests
 */
@Slf4j
public class HttpMetricsFilter extends OncePerRequestFilter {

  /** Request attribute under which the live {@link RequestObservation} is exposed. */
  public static final String OBSERVATION_ATTRIBUTE = RequestObservation.class.getName();

  private static final String CATCH_ALL_PATTERN = "/**";

  private final HttpMetricsInterceptor interceptor;
  private final HandlerMethodRouteLookup routeLookup;

  /**
   * Creates the filter without handler-mapping access; {@code 405} responses are labelled as
   * unmatched.
   *
   * @param interceptor interceptor that owns the metric instruments
   */
  public HttpMetricsFilter(@NonNull final HttpMetricsInterceptor interceptor) {
    this(interceptor, HandlerMethodRouteLookup.NONE);
  }

  /**
   * Creates the filter.
   *
   * @param interceptor interceptor that owns the metric instruments
   * @param handlerMappings handler mappings consulted for the pattern of a {@code 405} response
   */
  public HttpMetricsFilter(
      @NonNull final HttpMetricsInterceptor interceptor,
      @NonNull final ObjectProvider<RequestMappingInfoHandlerMapping> handlerMappings) {
    this(interceptor, new HandlerMethodRouteLookup(handlerMappings::orderedStream));
  }

  HttpMetricsFilter(
      final HttpMetricsInterceptor interceptor, final HandlerMethodRouteLookup routeLookup) {
    this.interceptor = interceptor;
    this.routeLookup = routeLookup;
  }

  @Override
  protected void doFilterInternal(
      final HttpServletRequest request,
      final HttpServletResponse response,
      final FilterChain filterChain)
      throws ServletException, IOException {
    final RequestObservation observation =
        interceptor.begin(
            RequestStart.of(
                request.getMethod(),
                request.getScheme(),
                request.getProtocol(),
                request.getRequestURI()));
    request.setAttribute(OBSERVATION_ATTRIBUTE, observation);

    final var countingRequest = new CountingRequestWrapper(request, observation);
    final var countingResponse = new CountingResponseWrapper(response);
    boolean async = false;
    try {
      observation.handlerStarted();
      filterChain.doFilter(countingRequest, countingResponse);
      if (request.isAsyncStarted()) {
        request
            .getAsyncContext()
            .addListener(new ObservationAsyncListener(observation, request, countingResponse));
        async = true;
      }
    } catch (final IOException | ServletException | RuntimeException | Error e) {
      observation.fail(e, countingResponse.getStatus(), countingResponse.getBodyBytes());
      throw e;
    } finally {
      if (!async) {
        finish(observation, request, countingResponse);
      }
    }
  }

  /**
   * Hands route and body information to the observation and closes it. Never throws.
   *
   * @param observation observation to close
   * @param request original request carrying Spring MVC's handler-mapping attributes
   * @param response counting response
   */
  void finish(
      final RequestObservation observation,
      final HttpServletRequest request,
      final CountingResponseWrapper response) {
    try {
      final int status = response.getStatus();
      applyRoute(observation, request, status);

      final Object override = request.getAttribute(CardinalityOverride.ATTRIBUTE);
      if (override instanceof CardinalityOverride) {
        observation.keepCardinality((CardinalityOverride) override);
      }

      if (observation.getRequestBodyBytes() == 0) {
        observation.addRequestBodyBytes(request.getContentLengthLong());
      }
      observation.complete(status, response.getBodyBytes());
    } catch (final RuntimeException e) {
      log.warn("Failed to collect response details for {}", observation.getStart(), e);
    } finally {
      observation.close();
    }
  }

  @SuppressWarnings("unchecked")
  private void applyRoute(
      final RequestObservation observation, final HttpServletRequest request, final int status) {
    final Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
    if (!(pattern instanceof String)) {
      if (status == HttpStatus.METHOD_NOT_ALLOWED.value()) {
        routeLookup
            .findPattern(request)
            .ifPresent(template -> observation.routeMatched(template, Map.of()));
      }
      return;
    }
    if (CATCH_ALL_PATTERN.equals(pattern) && status == HttpStatus.NOT_FOUND.value()) {
      return;
    }
    final Object variables = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
    observation.routeMatched(
        (String) pattern, variables instanceof Map ? (Map<String, String>) variables : Map.of());
  }

  /** Finalizes an async request once the container completes it. */
  private final class ObservationAsyncListener implements AsyncListener {

    private final RequestObservation observation;
    private final HttpServletRequest request;
    private final CountingResponseWrapper response;

    ObservationAsyncListener(
        final RequestObservation observation,
        final HttpServletRequest request,
        final CountingResponseWrapper response) {
      this.observation = observation;
      this.request = request;
      this.response = response;
    }

    @Override
    public void onComplete(final AsyncEvent event) {
      finish(observation, request, response);
    }

    @Override
    public void onTimeout(final AsyncEvent event) {
      log.debug("Async request {} timed out", observation.getStart());
    }

    @Override
    public void onError(final AsyncEvent event) {
      observation.fail(event.getThrowable(), response.getStatus(), response.getBodyBytes());
      finish(observation, request, response);
    }

    @Override
    public void onStartAsync(final AsyncEvent event) {
      event.getAsyncContext().addListener(this);
    }
  }
}
