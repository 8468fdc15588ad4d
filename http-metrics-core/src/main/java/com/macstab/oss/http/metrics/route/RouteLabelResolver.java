/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.http.metrics.route;

import java.util.Map;
import java.util.Objects;

import com.macstab.oss.http.metrics.config.UnmatchedRoutePolicy;

import lombok.experimental.UtilityClass;

/**
 * Turns the router's match result into the {@code route} label value.
 *
 * <p><strong>Algorithm:</strong>
 *
 * <ol>
 *   <li>No matched template: apply the {@link UnmatchedRoutePolicy} ({@code Mask(label)} →
 *       label, {@code Disabled} → raw path).
 *   <li>Matched template, no override: template verbatim. Label cardinality is bounded by the
 *       number of registered routes, whatever the parameter values are.
 *   <li>Matched template with override: placeholders named in {@link
 *       CardinalityOverride#getKeepParams()} are replaced by their matched values, the others stay
 *       literal. Substitution is by name, repeated names resolve to the same value.
 * </ol>
 *
 * <p>A kept name the route does not declare is silently ignored. Values are inserted as-is,
 * escaping is the backend's concern.
 *
 * <p><strong>Thread Safety:</strong> stateless, pure.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@UtilityClass
public class RouteLabelResolver {

  /**
   * Resolves the route label.
   *
   * @param matchedRouteTemplate template of the matched route, {@code null} if no route matched
   * @param rawPath request path as received
   * @param pathVariables matched path parameter values by name (may be empty)
   * @param override per-request override, {@code null} if none attached
   * @param policy unmatched route policy
   * @return route label
   * @throws NullPointerException if rawPath, pathVariables or policy is null
   */
  public static String resolve(
      final String matchedRouteTemplate,
      final String rawPath,
      final Map<String, String> pathVariables,
      final CardinalityOverride override,
      final UnmatchedRoutePolicy policy) {

    Objects.requireNonNull(rawPath, "rawPath must not be null");
    Objects.requireNonNull(pathVariables, "pathVariables must not be null");
    Objects.requireNonNull(policy, "policy must not be null");

    if (matchedRouteTemplate == null) {
      return policy.labelFor(rawPath);
    }

    if (override == null || override.isEmpty() || matchedRouteTemplate.indexOf('{') < 0) {
      return matchedRouteTemplate;
    }

    return RouteTemplate.parse(matchedRouteTemplate).render(override, pathVariables);
  }

  /**
   * Resolves the route label without override.
   *
   * @param matchedRouteTemplate template of the matched route, {@code null} if no route matched
   * @param rawPath request path as received
   * @param policy unmatched route policy
   * @return route label
   */
  public static String resolve(
      final String matchedRouteTemplate, final String rawPath, final UnmatchedRoutePolicy policy) {
    return resolve(matchedRouteTemplate, rawPath, Map.of(), null, policy);
  }
}
