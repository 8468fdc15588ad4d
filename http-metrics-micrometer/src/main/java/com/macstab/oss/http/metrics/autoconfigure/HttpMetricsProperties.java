/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.http.metrics.autoconfigure;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.core.Ordered;

import com.macstab.oss.http.metrics.config.HttpMetricNames;
import com.macstab.oss.http.metrics.config.HttpMetricsConfig;

import lombok.Data;

/**
 * Configuration properties for HTTP server metrics.
 *
 * <p><strong>Configuration Example:</strong>
 *
 * <pre>{@code
 * management:
 *   metrics:
 *     http-server:
 *       enabled: true
 *       namespace: shop
 *       const-labels:
 *         region: eu-central-1
 *       max-cache-size: 1000
 *       metric-names:
 *         active-requests: my_active
 *       labels:
 *         route: endpoint
 *       unmatched-routes:
 *         masking: true
 *         mask: UNKNOWN
 *       exclude: /actuator/health
 *       exclude-patterns: /internal/.*
 *       exclude-statuses: 404
 * }</pre>
 *
 * <p><strong>Defaults:</strong>
 *
 * <ul>
 *   <li>{@code enabled}: {@code true} (metrics enabled by default if Micrometer on classpath)
 *   <li>{@code max-cache-size}: {@code 1000} (bounded memory, graceful degradation)
 *   <li>{@code unmatched-routes.mask}: {@code UNKNOWN}
 *   <li>metric names: {@code http.server.*}
 *   <li>label keys: {@code route}, {@code method}, {@code status}, {@code protocol_name}, {@code
 *       protocol_version}, {@code scheme}
 * </ul>
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@Data
@ConfigurationProperties(prefix = HttpMetricsProperties.PREFIX)
public class HttpMetricsProperties {

  public static final String PREFIX = "management.metrics.http-server";

  /**
   * Enable HTTP server metrics collection.
   *
   * <p><strong>When disabled:</strong> {@code MetricsBackend.NOOP} used (gauge pairing and label
   * resolution still run, nothing is recorded).
   */
  private boolean enabled = true;

  /** Prefix joined to every metric name with a dot. */
  private String namespace;

  /** Labels appended to every instrument (e.g. region, instance group). */
  private Map<String, String> constLabels = new LinkedHashMap<>();

  /**
   * Maximum cached meter instances (bounded memory).
   *
   * <p><strong>Graceful Degradation:</strong> When cache full, metrics still work (direct
   * Micrometer registry, slower but functional). Warning logged.
   */
  private int maxCacheSize = 1000;

  /** Exact route labels whose requests are not observed (gauge still counts them). */
  private List<String> exclude = new ArrayList<>();

  /** Regular expressions matched against route labels; matching requests are not observed. */
  private List<String> excludePatterns = new ArrayList<>();

  /** Response statuses that are not observed. */
  private List<Integer> excludeStatuses = new ArrayList<>();

  /** Status recorded when a handler terminates abnormally without an error status. */
  private int abnormalTerminationStatus = 500;

  /**
   * Order of the servlet filter that drives the metrics (used by web integrations).
   *
   * <p><strong>Default:</strong> {@code Ordered.HIGHEST_PRECEDENCE + 1}, so the filter wraps every
   * other filter and observes their latency and error statuses as well.
   */
  private int filterOrder = Ordered.HIGHEST_PRECEDENCE + 1;

  private MetricNames metricNames = new MetricNames();

  private Labels labels = new Labels();

  private UnmatchedRoutes unmatchedRoutes = new UnmatchedRoutes();

  /**
   * Configurable metric names.
   *
   * <p>Unset names keep their defaults; each name is overridable on its own.
   */
  @Data
  public static class MetricNames {

    /** Default: {@code http.server.request.duration}. */
    private String requestDuration = HttpMetricNames.REQUEST_DURATION;

    /** Default: {@code http.server.request.body.size}. */
    private String requestBodySize = HttpMetricNames.REQUEST_BODY_SIZE;

    /** Default: {@code http.server.response.body.size}. */
    private String responseBodySize = HttpMetricNames.RESPONSE_BODY_SIZE;

    /** Default: {@code http.server.active_requests}. */
    private String activeRequests = HttpMetricNames.ACTIVE_REQUESTS;
  }

  /** Configurable label keys of the built-in labels. */
  @Data
  public static class Labels {

    private String route = HttpMetricNames.LABEL_ROUTE;

    private String method = HttpMetricNames.LABEL_METHOD;

    private String status = HttpMetricNames.LABEL_STATUS;

    private String protocolName = HttpMetricNames.LABEL_PROTOCOL_NAME;

    private String protocolVersion = HttpMetricNames.LABEL_PROTOCOL_VERSION;

    private String scheme = HttpMetricNames.LABEL_SCHEME;
  }

  /** Route label of requests that matched no route. */
  @Data
  public static class UnmatchedRoutes {

    /**
     * Collapse unmatched requests into {@link #mask}.
     *
     * <p><strong>WARNING:</strong> {@code false} records the raw path, unbounded cardinality.
     */
    private boolean masking = true;

    private String mask = HttpMetricNames.UNKNOWN_ROUTE;
  }

  /**
   * Builds the validated core configuration.
   *
   * @return configuration
   * @throws IllegalArgumentException if any property is invalid
   */
  public HttpMetricsConfig toConfig() {
    final var builder =
        HttpMetricsConfig.builder()
            .namespace(namespace)
            .requestDurationName(metricNames.getRequestDuration())
            .requestBodySizeName(metricNames.getRequestBodySize())
            .responseBodySizeName(metricNames.getResponseBodySize())
            .activeRequestsName(metricNames.getActiveRequests())
            .routeLabel(labels.getRoute())
            .methodLabel(labels.getMethod())
            .statusLabel(labels.getStatus())
            .protocolNameLabel(labels.getProtocolName())
            .protocolVersionLabel(labels.getProtocolVersion())
            .schemeLabel(labels.getScheme())
            .constLabels(constLabels)
            .abnormalTerminationStatus(abnormalTerminationStatus);

    if (unmatchedRoutes.isMasking()) {
      builder.maskUnmatchedRoutes(unmatchedRoutes.getMask());
    } else {
      builder.disableUnmatchedRouteMasking();
    }

    exclude.forEach(builder::excludeRoute);
    excludePatterns.forEach(builder::excludeRoutePattern);
    excludeStatuses.forEach(builder::excludeStatus);

    return builder.build();
  }
}
