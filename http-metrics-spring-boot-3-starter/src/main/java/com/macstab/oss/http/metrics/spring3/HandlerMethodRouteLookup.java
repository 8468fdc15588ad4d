/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.http.metrics.spring3;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Stream;

import org.springframework.http.server.PathContainer;
import org.springframework.web.servlet.mvc.method.RequestMappingInfoHandlerMapping;
import org.springframework.web.util.pattern.PathPattern;
import org.springframework.web.util.pattern.PathPatternParser;
import org.springframework.web.util.pattern.PatternParseException;

import jakarta.servlet.http.HttpServletRequest;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Finds the mapping pattern of a request that Spring MVC rejected before a handler was chosen.
 *
 * <p><strong>Problem:</strong> for a path that is mapped, but not for the request's method, Spring
 * MVC answers {@code 405} without setting {@code BEST_MATCHING_PATTERN_ATTRIBUTE}. Without a
 * pattern the request would fold into the unmatched-route mask although its resource exists.
 *
 * <p><strong>Solution:</strong> match the request path against the patterns of all registered
 * {@link RequestMappingInfoHandlerMapping}s, ignoring method, and take the most specific one. Only
 * used for {@code 405} responses, so the cost stays off the normal request path.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
final class HandlerMethodRouteLookup {

  /** Lookup that never finds a pattern. */
  static final HandlerMethodRouteLookup NONE = new HandlerMethodRouteLookup(Stream::empty);

  private final Supplier<Stream<RequestMappingInfoHandlerMapping>> handlerMappings;

  /**
   * Creates the lookup.
   *
   * @param handlerMappings supplies the handler mappings, queried on every lookup
   */
  HandlerMethodRouteLookup(
      @NonNull final Supplier<Stream<RequestMappingInfoHandlerMapping>> handlerMappings) {
    this.handlerMappings = handlerMappings;
  }

  /**
   * Returns the most specific mapping pattern matching the request path, whatever the method.
   *
   * @param request request rejected by Spring MVC
   * @return mapping pattern, or empty if no mapping covers the path
   */
  Optional<String> findPattern(final HttpServletRequest request) {
    final PathContainer path = PathContainer.parsePath(lookupPath(request));
    return handlerMappings
        .get()
        .flatMap(mapping -> mapping.getHandlerMethods().keySet().stream())
        .flatMap(info -> info.getPatternValues().stream())
        .map(HandlerMethodRouteLookup::parse)
        .filter(Objects::nonNull)
        .filter(pattern -> pattern.matches(path))
        .min(PathPattern.SPECIFICITY_COMPARATOR)
        .map(PathPattern::getPatternString);
  }

  private static String lookupPath(final HttpServletRequest request) {
    final String uri = request.getRequestURI();
    final String contextPath = request.getContextPath();
    return contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)
        ? uri.substring(contextPath.length())
        : uri;
  }

  private static PathPattern parse(final String pattern) {
    try {
      return PathPatternParser.defaultInstance.parse(pattern);
    } catch (final PatternParseException e) {
      // AntPathMatcher-only syntax
      log.debug("Skipping mapping pattern {}: {}", pattern, e.getMessage());
      return null;
    }
  }
}
