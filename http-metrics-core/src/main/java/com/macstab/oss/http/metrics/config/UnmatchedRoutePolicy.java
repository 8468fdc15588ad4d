/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.http.metrics.config;

import java.util.Objects;
import java.util.Optional;

import lombok.EqualsAndHashCode;

/**
 * What to record as route label when the router matched no registered route.
 *
 * <ul>
 *   <li>{@link #mask(String)} - every unmatched request shares one fixed label (default {@code
 *       UNKNOWN}). Bots probing {@code /wp-admin.php}, {@code /.env}, ... collapse into one series.
 *   <li>{@link #disabled()} - the raw request path becomes the label. <strong>WARNING:</strong>
 *       unbounded cardinality, every distinct path creates new series.
 * </ul>
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@EqualsAndHashCode
public final class UnmatchedRoutePolicy {

  private static final UnmatchedRoutePolicy DISABLED = new UnmatchedRoutePolicy(null);
  private static final UnmatchedRoutePolicy DEFAULT =
      new UnmatchedRoutePolicy(HttpMetricNames.UNKNOWN_ROUTE);

  /** Mask label, {@code null} when masking is disabled. */
  private final String mask;

  private UnmatchedRoutePolicy(final String mask) {
    this.mask = mask;
  }

  /**
   * Masks unmatched requests with {@code UNKNOWN}.
   *
   * @return default policy
   */
  public static UnmatchedRoutePolicy maskUnknown() {
    return DEFAULT;
  }

  /**
   * Masks unmatched requests with a custom label.
   *
   * @param label label recorded for every unmatched request
   * @return masking policy
   * @throws NullPointerException if label is null
   * @throws IllegalArgumentException if label is blank
   */
  public static UnmatchedRoutePolicy mask(final String label) {
    Objects.requireNonNull(label, "mask label must not be null");
    if (label.isBlank()) {
      throw new IllegalArgumentException("mask label must not be blank");
    }
    return new UnmatchedRoutePolicy(label);
  }

  /**
   * Passes the raw request path through as label.
   *
   * @return pass-through policy
   */
  public static UnmatchedRoutePolicy disabled() {
    return DISABLED;
  }

  public boolean isMasking() {
    return mask != null;
  }

  public Optional<String> getMask() {
    return Optional.ofNullable(mask);
  }

  /**
   * Label for an unmatched request.
   *
   * @param rawPath request path as received
   * @return mask label, or {@code rawPath} when masking is disabled
   */
  public String labelFor(final String rawPath) {
    return mask != null ? mask : rawPath;
  }

  @Override
  public String toString() {
    return mask != null ? "Mask[" + mask + "]" : "Disabled";
  }
}
