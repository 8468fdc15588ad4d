/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.http.metrics.config;

import lombok.experimental.UtilityClass;

/**
 * Default metric names and label keys.
 *
 * <p><strong>Naming Convention:</strong> OpenTelemetry HTTP server semantic conventions ({@code
 * http.server.*}). Micrometer's {@code PrometheusNamingConvention} converts dots to underscores:
 *
 * <pre>
 * http.server.request.duration    → http_server_request_duration_seconds
 * http.server.request.body.size   → http_server_request_body_size_bytes
 * http.server.response.body.size  → http_server_response_body_size_bytes
 * http.server.active_requests     → http_server_active_requests
 * </pre>
 *
 * <p>All names can be overridden through {@link HttpMetricsConfig.Builder}; call sites never use
 * these constants directly, they read the effective names from {@link HttpMetricsConfig}.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@UtilityClass
public class HttpMetricNames {

  /** Request duration (timer, seconds). */
  public static final String REQUEST_DURATION = "http.server.request.duration";

  /** Request body size (distribution summary, bytes). */
  public static final String REQUEST_BODY_SIZE = "http.server.request.body.size";

  /** Response body size (distribution summary, bytes). */
  public static final String RESPONSE_BODY_SIZE = "http.server.response.body.size";

  /** Requests currently being processed (gauge). */
  public static final String ACTIVE_REQUESTS = "http.server.active_requests";

  /** Mask used for requests no registered route matched. */
  public static final String UNKNOWN_ROUTE = "UNKNOWN";

  // Label keys
  public static final String LABEL_ROUTE = "route";
  public static final String LABEL_METHOD = "method";
  public static final String LABEL_STATUS = "status";
  public static final String LABEL_PROTOCOL_NAME = "protocol_name";
  public static final String LABEL_PROTOCOL_VERSION = "protocol_version";
  public static final String LABEL_SCHEME = "scheme";
}
