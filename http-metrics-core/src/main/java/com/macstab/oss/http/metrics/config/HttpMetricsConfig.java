/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.http.metrics.config;

import static lombok.AccessLevel.PRIVATE;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.FieldDefaults;

/**
 * Immutable, process-wide HTTP metrics configuration.
 *
 * <p>Built once at startup via {@link #builder()}, then shared read-only by every in-flight request
 * (no locking required). All validation happens in {@link Builder#build()}: a configuration that
 * was built successfully never fails mid-traffic.
 *
 * <p><strong>Usage:</strong>
 *
 * <pre>{@code
 * HttpMetricsConfig config =
 *     HttpMetricsConfig.builder()
 *         .namespace("shop")
 *         .activeRequestsName("my_active")
 *         .unmatchedRoutePolicy(UnmatchedRoutePolicy.mask("UNMATCHED"))
 *         .constLabel("region", "eu-central-1")
 *         .build();
 * }</pre>
 *
 * <p><strong>Defaults:</strong>
 *
 * <ul>
 *   <li>metric names - see {@link HttpMetricNames}
 *   <li>unmatched routes - masked as {@code UNKNOWN}
 *   <li>no namespace, no constant labels, no exclusions
 *   <li>abnormal termination status - {@code 500}
 * </ul>
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@Getter
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class HttpMetricsConfig {

  /** Allowed metric name characters (Micrometer dotted names, Prometheus names). */
  static final Pattern METRIC_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_.:-]*");

  private static final HttpMetricsConfig DEFAULTS = builder().build();

  /** Effective (namespaced) request duration metric name. */
  String requestDurationName;

  /** Effective (namespaced) request body size metric name. */
  String requestBodySizeName;

  /** Effective (namespaced) response body size metric name. */
  String responseBodySizeName;

  /** Effective (namespaced) active requests gauge name. */
  String activeRequestsName;

  /** Namespace prefix, {@code null} when not configured. */
  String namespace;

  UnmatchedRoutePolicy unmatchedRoutePolicy;

  String routeLabel;
  String methodLabel;
  String statusLabel;
  String protocolNameLabel;
  String protocolVersionLabel;
  String schemeLabel;

  /** Labels appended to every instrument, sorted by key. */
  SortedMap<String, String> constLabels;

  Set<String> excludedRoutes;
  List<Pattern> excludedRoutePatterns;
  Set<Integer> excludedStatuses;

  int abnormalTerminationStatus;

  private HttpMetricsConfig(final Builder builder) {
    this.namespace = builder.namespace;
    this.requestDurationName = qualify(builder.namespace, builder.requestDurationName);
    this.requestBodySizeName = qualify(builder.namespace, builder.requestBodySizeName);
    this.responseBodySizeName = qualify(builder.namespace, builder.responseBodySizeName);
    this.activeRequestsName = qualify(builder.namespace, builder.activeRequestsName);
    this.unmatchedRoutePolicy = builder.unmatchedRoutePolicy;
    this.routeLabel = builder.routeLabel;
    this.methodLabel = builder.methodLabel;
    this.statusLabel = builder.statusLabel;
    this.protocolNameLabel = builder.protocolNameLabel;
    this.protocolVersionLabel = builder.protocolVersionLabel;
    this.schemeLabel = builder.schemeLabel;
    this.constLabels = Collections.unmodifiableSortedMap(new TreeMap<>(builder.constLabels));
    this.excludedRoutes = Collections.unmodifiableSet(new LinkedHashSet<>(builder.excludedRoutes));
    this.excludedRoutePatterns = List.copyOf(builder.excludedRoutePatterns);
    this.excludedStatuses = Set.copyOf(builder.excludedStatuses);
    this.abnormalTerminationStatus = builder.abnormalTerminationStatus;
  }

  /**
   * Creates a builder initialised with defaults.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the default configuration.
   *
   * @return shared default instance
   */
  public static HttpMetricsConfig defaults() {
    return DEFAULTS;
  }

  /**
   * Checks whether observations for a finished request are suppressed.
   *
   * <p>Matches the label against exact exclusions and exclusion patterns, and the status against
   * excluded status codes. Exclusion patterns are searched, not anchored: {@code /wp-} matches
   * {@code /blog/wp-login.php}. The active-requests gauge is never suppressed.
   *
   * @param routeLabel route label before unmatched-route masking (raw path for unmatched requests)
   * @param status response status
   * @return {@code true} if the request must not be observed
   */
  public boolean isExcluded(final String routeLabel, final int status) {
    if (excludedStatuses.contains(status) || excludedRoutes.contains(routeLabel)) {
      return true;
    }
    for (final Pattern pattern : excludedRoutePatterns) {
      if (pattern.matcher(routeLabel).find()) {
        return true;
      }
    }
    return false;
  }

  private static String qualify(final String namespace, final String name) {
    return namespace == null ? name : namespace + "." + name;
  }

  @Override
  public String toString() {
    return String.format(
        "HttpMetricsConfig[duration=%s, requestSize=%s, responseSize=%s, active=%s, unmatched=%s,"
            + " constLabels=%s, excludedRoutes=%s, excludedPatterns=%d, excludedStatuses=%s]",
        requestDurationName,
        requestBodySizeName,
        responseBodySizeName,
        activeRequestsName,
        unmatchedRoutePolicy,
        constLabels,
        excludedRoutes,
        excludedRoutePatterns.size(),
        excludedStatuses);
  }

  /**
   * Builder for {@link HttpMetricsConfig}.
   *
   * <p>Not thread-safe. Every setter may be called any number of times, the last value wins.
   * Exclusion and constant-label setters accumulate.
   */
  public static final class Builder {

    private String requestDurationName = HttpMetricNames.REQUEST_DURATION;
    private String requestBodySizeName = HttpMetricNames.REQUEST_BODY_SIZE;
    private String responseBodySizeName = HttpMetricNames.RESPONSE_BODY_SIZE;
    private String activeRequestsName = HttpMetricNames.ACTIVE_REQUESTS;
    private String namespace;
    private UnmatchedRoutePolicy unmatchedRoutePolicy = UnmatchedRoutePolicy.maskUnknown();

    private String routeLabel = HttpMetricNames.LABEL_ROUTE;
    private String methodLabel = HttpMetricNames.LABEL_METHOD;
    private String statusLabel = HttpMetricNames.LABEL_STATUS;
    private String protocolNameLabel = HttpMetricNames.LABEL_PROTOCOL_NAME;
    private String protocolVersionLabel = HttpMetricNames.LABEL_PROTOCOL_VERSION;
    private String schemeLabel = HttpMetricNames.LABEL_SCHEME;

    private final Map<String, String> constLabels = new TreeMap<>();
    private final Set<String> excludedRoutes = new LinkedHashSet<>();
    private final List<String> excludedRouteRegexes = new ArrayList<>();
    private final List<Pattern> excludedRoutePatterns = new ArrayList<>();
    private final Set<Integer> excludedStatuses = new HashSet<>();

    private int abnormalTerminationStatus = 500;

    private Builder() {}

    public Builder requestDurationName(@NonNull final String name) {
      this.requestDurationName = name;
      return this;
    }

    public Builder requestBodySizeName(@NonNull final String name) {
      this.requestBodySizeName = name;
      return this;
    }

    public Builder responseBodySizeName(@NonNull final String name) {
      this.responseBodySizeName = name;
      return this;
    }

    public Builder activeRequestsName(@NonNull final String name) {
      this.activeRequestsName = name;
      return this;
    }

    /**
     * Prefixes every metric name ({@code namespace + "." + name}).
     *
     * @param namespace prefix, {@code null} or blank to clear
     * @return this builder
     */
    public Builder namespace(final String namespace) {
      this.namespace = namespace == null || namespace.isBlank() ? null : namespace;
      return this;
    }

    public Builder unmatchedRoutePolicy(@NonNull final UnmatchedRoutePolicy policy) {
      this.unmatchedRoutePolicy = policy;
      return this;
    }

    /**
     * Shortcut for {@code unmatchedRoutePolicy(UnmatchedRoutePolicy.mask(label))}.
     *
     * @param label mask label
     * @return this builder
     */
    public Builder maskUnmatchedRoutes(final String label) {
      return unmatchedRoutePolicy(UnmatchedRoutePolicy.mask(label));
    }

    /**
     * Shortcut for {@code unmatchedRoutePolicy(UnmatchedRoutePolicy.disabled())}.
     *
     * <p><strong>WARNING:</strong> unbounded cardinality for unmatched requests.
     *
     * @return this builder
     */
    public Builder disableUnmatchedRouteMasking() {
      return unmatchedRoutePolicy(UnmatchedRoutePolicy.disabled());
    }

    public Builder routeLabel(@NonNull final String key) {
      this.routeLabel = key;
      return this;
    }

    public Builder methodLabel(@NonNull final String key) {
      this.methodLabel = key;
      return this;
    }

    public Builder statusLabel(@NonNull final String key) {
      this.statusLabel = key;
      return this;
    }

    public Builder protocolNameLabel(@NonNull final String key) {
      this.protocolNameLabel = key;
      return this;
    }

    public Builder protocolVersionLabel(@NonNull final String key) {
      this.protocolVersionLabel = key;
      return this;
    }

    public Builder schemeLabel(@NonNull final String key) {
      this.schemeLabel = key;
      return this;
    }

    public Builder constLabel(@NonNull final String key, @NonNull final String value) {
      this.constLabels.put(key, value);
      return this;
    }

    public Builder constLabels(@NonNull final Map<String, String> labels) {
      labels.forEach(this::constLabel);
      return this;
    }

    /**
     * Suppresses observations for an exact route label (e.g. {@code /health}). For unmatched
     * requests the raw path is compared (e.g. {@code /favicon.ico}).
     *
     * @param routeLabel route label or raw path to exclude
     * @return this builder
     */
    public Builder excludeRoute(@NonNull final String routeLabel) {
      this.excludedRoutes.add(routeLabel);
      return this;
    }

    /**
     * Suppresses observations for route labels (raw paths for unmatched requests) containing a
     * match of a regular expression. Anchor with {@code ^...$} for a full match.
     *
     * @param regex regular expression (validated in {@link #build()})
     * @return this builder
     */
    public Builder excludeRoutePattern(@NonNull final String regex) {
      this.excludedRouteRegexes.add(regex);
      return this;
    }

    public Builder excludeStatus(final int status) {
      this.excludedStatuses.add(status);
      return this;
    }

    /**
     * Status recorded when the handler chain terminates abnormally and no error status is known.
     *
     * @param status status in range [400, 599]
     * @return this builder
     */
    public Builder abnormalTerminationStatus(final int status) {
      this.abnormalTerminationStatus = status;
      return this;
    }

    /**
     * Validates and builds the configuration.
     *
     * @return immutable configuration
     * @throws IllegalArgumentException on invalid or duplicate metric names, invalid or duplicate
     *     label keys, invalid exclusion patterns or an out-of-range abnormal termination status
     */
    public HttpMetricsConfig build() {
      if (namespace != null) {
        requireMetricName("namespace", namespace);
      }
      requireMetricName("requestDurationName", requestDurationName);
      requireMetricName("requestBodySizeName", requestBodySizeName);
      requireMetricName("responseBodySizeName", responseBodySizeName);
      requireMetricName("activeRequestsName", activeRequestsName);
      requireDistinct(
          "metric name",
          requestDurationName,
          requestBodySizeName,
          responseBodySizeName,
          activeRequestsName);

      final List<String> labelKeys = new ArrayList<>();
      labelKeys.add(routeLabel);
      labelKeys.add(methodLabel);
      labelKeys.add(statusLabel);
      labelKeys.add(protocolNameLabel);
      labelKeys.add(protocolVersionLabel);
      labelKeys.add(schemeLabel);
      labelKeys.addAll(constLabels.keySet());
      for (final String key : labelKeys) {
        if (key.isBlank()) {
          throw new IllegalArgumentException("label key must not be blank");
        }
      }
      requireDistinct("label key", labelKeys.toArray(new String[0]));

      if (abnormalTerminationStatus < 400 || abnormalTerminationStatus > 599) {
        throw new IllegalArgumentException(
            "abnormalTerminationStatus must be in [400, 599], got: " + abnormalTerminationStatus);
      }

      excludedRoutePatterns.clear();
      for (final String regex : excludedRouteRegexes) {
        try {
          excludedRoutePatterns.add(Pattern.compile(regex));
        } catch (final PatternSyntaxException e) {
          throw new IllegalArgumentException("Invalid route exclusion pattern: " + regex, e);
        }
      }

      return new HttpMetricsConfig(this);
    }

    private static void requireMetricName(final String field, final String name) {
      Objects.requireNonNull(name, field + " must not be null");
      if (!METRIC_NAME.matcher(name).matches()) {
        throw new IllegalArgumentException(
            field + " must match " + METRIC_NAME.pattern() + ", got: '" + name + "'");
      }
    }

    private static void requireDistinct(final String what, final String... values) {
      final Set<String> seen = new HashSet<>();
      for (final String value : values) {
        if (!seen.add(value)) {
          throw new IllegalArgumentException("Duplicate " + what + ": '" + value + "'");
        }
      }
    }
  }
}
