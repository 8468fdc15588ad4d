/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.http.metrics.spring3;

import java.util.Optional;

import com.macstab.oss.http.metrics.RequestObservation;
import com.macstab.oss.http.metrics.route.CardinalityOverride;

import jakarta.servlet.http.HttpServletRequest;
import lombok.NonNull;
import lombok.experimental.UtilityClass;

/**
 * Handler-side helpers for requests observed by {@link HttpMetricsFilter}.
 *
 * <p><strong>Usage:</strong>
 *
 * <pre>{@code
 * @GetMapping("/posts/{lang}/{slug}")
 * String post(@PathVariable String lang, @PathVariable String slug, HttpServletRequest request) {
 *   HttpMetricsRequests.keepCardinality(request, "lang");
 *   return render(lang, slug);   // route label: /posts/en/{slug}
 * }
 * }</pre>
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@UtilityClass
public class HttpMetricsRequests {

  /**
   * Keeps the named path parameters verbatim in the route label of this request.
   *
   * <p>Repeated calls accumulate.
   *
   * @param request current request
   * @param paramNames path parameter names to keep
   */
  public void keepCardinality(
      @NonNull final HttpServletRequest request, final String... paramNames) {
    keepCardinality(request, CardinalityOverride.keep(paramNames));
  }

  /**
   * Merges a cardinality override into the one already attached to this request.
   *
   * @param request current request
   * @param override override to merge
   */
  public void keepCardinality(
      @NonNull final HttpServletRequest request, @NonNull final CardinalityOverride override) {
    final Object existing = request.getAttribute(CardinalityOverride.ATTRIBUTE);
    final CardinalityOverride merged =
        existing instanceof CardinalityOverride
            ? ((CardinalityOverride) existing).and(override)
            : override;
    request.setAttribute(CardinalityOverride.ATTRIBUTE, merged);
  }

  /**
   * Returns the observation of this request, if the request passed through {@link
   * HttpMetricsFilter}.
   *
   * @param request current request
   * @return live observation, or empty
   */
  public Optional<RequestObservation> currentObservation(
      @NonNull final HttpServletRequest request) {
    final Object observation = request.getAttribute(HttpMetricsFilter.OBSERVATION_ATTRIBUTE);
    return observation instanceof RequestObservation
        ? Optional.of((RequestObservation) observation)
        : Optional.empty();
  }
}
