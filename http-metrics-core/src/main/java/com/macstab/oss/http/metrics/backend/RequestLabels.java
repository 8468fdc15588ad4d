/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.http.metrics.backend;

import static lombok.AccessLevel.PRIVATE;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import lombok.experimental.FieldDefaults;

/**
 * Label values of one finished request (route, method, status, protocol name and version).
 *
 * <p>Label keys are not part of this value, {@link MetricsEmitter} maps them from configuration.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@Getter
@ToString
@EqualsAndHashCode
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class RequestLabels {

  String route;
  String method;
  int status;
  String protocolName;
  String protocolVersion;

  public RequestLabels(
      @NonNull final String route,
      @NonNull final String method,
      final int status,
      @NonNull final String protocolName,
      @NonNull final String protocolVersion) {
    this.route = route;
    this.method = method;
    this.status = status;
    this.protocolName = protocolName;
    this.protocolVersion = protocolVersion;
  }
}
