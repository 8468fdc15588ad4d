/* (C)2026 Macstab GmbH */

/**
 * Spring Boot auto-configuration for HTTP server metrics.
 *
 * <h2>Quick Start</h2>
 *
 * <p><strong>1. Add dependency (Maven):</strong>
 *
 * <pre>{@code
 * <dependency>
 *   <groupId>com.macstab.oss.http</groupId>
 *   <artifactId>http-metrics-micrometer</artifactId>
 *   <version>1.0.0</version>
 * </dependency>
 * }</pre>
 *
 * <p><strong>2. Metrics auto-activate (if a {@code MeterRegistry} bean is present):</strong>
 *
 * <pre>{@code
 * # application.yml
 * management:
 *   metrics:
 *     http-server:
 *       enabled: true               # default
 *       namespace: shop             # shop.http.server.request.duration
 *       max-cache-size: 1000
 *       metric-names:
 *         active-requests: http.server.active_requests
 * }</pre>
 *
 * <h2>Exposed Metrics</h2>
 *
 * <table border="1">
 *   <caption>HTTP server metrics</caption>
 *   <tr><th>Name</th><th>Type</th><th>Labels</th></tr>
 *   <tr><td>http.server.request.duration</td><td>Timer (seconds)</td>
 *       <td>route, method, status, protocol_name, protocol_version</td></tr>
 *   <tr><td>http.server.request.body.size</td><td>Summary (bytes)</td>
 *       <td>route, method, status, protocol_name, protocol_version</td></tr>
 *   <tr><td>http.server.response.body.size</td><td>Summary (bytes)</td>
 *       <td>route, method, status, protocol_name, protocol_version</td></tr>
 *   <tr><td>http.server.active_requests</td><td>Gauge</td><td>method, scheme</td></tr>
 * </table>
 *
 * <p>Constant labels configured under {@code const-labels} are added to all four.
 *
 * <p>Without a {@code MeterRegistry}, or with {@code enabled: false}, the interceptor is wired to
 * {@link com.macstab.oss.http.metrics.backend.MetricsBackend#NOOP}.
 *
 * @since 1.0.0
 * @see com.macstab.oss.http.metrics.autoconfigure.HttpMetricsProperties
 */
package com.macstab.oss.http.metrics.autoconfigure;
