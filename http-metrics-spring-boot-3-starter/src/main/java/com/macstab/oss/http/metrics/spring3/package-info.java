/* (C)2026 Macstab GmbH */

/**
 * Spring Boot 3.x servlet integration for HTTP server metrics.
 *
 * <h2>Purpose</h2>
 *
 * <p>Zero-code instrumentation of Spring MVC applications: every request passing the servlet
 * container is observed by {@link com.macstab.oss.http.metrics.HttpMetricsInterceptor} through a
 * registered {@link com.macstab.oss.http.metrics.spring3.HttpMetricsFilter}.
 *
 * <h2>Quick Start</h2>
 *
 * <p><strong>1. Add dependency (Maven):</strong>
 *
 * <pre>{@code
 * <dependency>
 *   <groupId>com.macstab.oss.http</groupId>
 *   <artifactId>http-metrics-spring-boot-3-starter</artifactId>
 *   <version>1.0.0</version>
 * </dependency>
 * }</pre>
 *
 * <p><strong>2. Configure (application.yml, all optional):</strong>
 *
 * <pre>{@code
 * management:
 *   metrics:
 *     http-server:
 *       namespace: shop
 *       const-labels:
 *         region: eu-west-1
 *       exclude: /actuator/health
 *       exclude-statuses: 404
 *       unmatched-routes:
 *         mask: UNKNOWN
 * }</pre>
 *
 * <p><strong>3. Keep a low-cardinality path parameter (optional):</strong>
 *
 * <pre>{@code
 * @GetMapping("/posts/{lang}/{slug}")
 * String post(@PathVariable String lang, @PathVariable String slug, HttpServletRequest request) {
 *   HttpMetricsRequests.keepCardinality(request, "lang");
 *   ...
 * }
 * }</pre>
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * ┌────────────────────────────────────────────────────────────┐
 * │ Servlet container (Tomcat, Jetty, Undertow)                │
 * └────────────────┬───────────────────────────────────────────┘
 *                  ↓
 * ┌────────────────────────────────────────────────────────────┐
 * │ HttpMetricsFilter                                          │
 * │   ├─→ begin()            active_requests +1                │
 * │   ├─→ CountingRequestWrapper / CountingResponseWrapper     │
 * │   └─→ close()            duration, body sizes, gauge -1    │
 * └────────────────┬───────────────────────────────────────────┘
 *                  ↓
 * ┌────────────────────────────────────────────────────────────┐
 * │ DispatcherServlet                                          │
 * │   └─→ sets BEST_MATCHING_PATTERN / URI_TEMPLATE_VARIABLES  │
 * └────────────────────────────────────────────────────────────┘
 * </pre>
 *
 * <h2>Route Labels</h2>
 *
 * <ul>
 *   <li>Matched handler: the mapping pattern, e.g. {@code /users/{id}}
 *   <li>No handler, or a {@code 404} from the static resource catch-all {@code /**}: the
 *       configured unmatched-route mask ({@code UNKNOWN} by default)
 *   <li>{@code 404} and {@code 405}: cardinality overrides are ignored
 * </ul>
 *
 * <h2>Async Requests</h2>
 *
 * <p>Requests that start async processing ({@code Callable}, {@code DeferredResult}, {@code
 * StreamingResponseBody}) are finalized from an {@link jakarta.servlet.AsyncListener} when the
 * container completes them.
 *
 * @since 1.0.0
 * @see com.macstab.oss.http.metrics.spring3.HttpMetricsWebAutoConfiguration
 * @see com.macstab.oss.http.metrics.autoconfigure.HttpMetricsProperties
 */
package com.macstab.oss.http.metrics.spring3;
