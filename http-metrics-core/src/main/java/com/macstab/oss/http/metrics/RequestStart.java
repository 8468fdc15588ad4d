/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.http.metrics;

import static lombok.AccessLevel.PRIVATE;

import java.util.Objects;

import lombok.Getter;
import lombok.ToString;
import lombok.experimental.FieldDefaults;

/**
 * What the server knows about a request when it arrives (before routing).
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@Getter
@ToString
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class RequestStart {

  String method;
  String scheme;
  HttpProtocol protocol;
  String path;

  private RequestStart(
      final String method, final String scheme, final HttpProtocol protocol, final String path) {
    this.method = Objects.requireNonNull(method, "method must not be null");
    this.scheme = Objects.requireNonNull(scheme, "scheme must not be null");
    this.protocol = Objects.requireNonNull(protocol, "protocol must not be null");
    this.path = Objects.requireNonNull(path, "path must not be null");
  }

  /**
   * Creates a request start descriptor.
   *
   * @param method HTTP method token ({@code GET}, {@code POST}, ...)
   * @param scheme URI scheme ({@code http}, {@code https})
   * @param protocol protocol string ({@code HTTP/1.1}), parsed with {@link HttpProtocol#parse}
   * @param path raw request path (without query string)
   * @return descriptor
   */
  public static RequestStart of(
      final String method, final String scheme, final String protocol, final String path) {
    return new RequestStart(method, scheme, HttpProtocol.parse(protocol), path);
  }

  /**
   * Creates a request start descriptor.
   *
   * @param method HTTP method token
   * @param scheme URI scheme
   * @param protocol parsed protocol
   * @param path raw request path (without query string)
   * @return descriptor
   */
  public static RequestStart of(
      final String method, final String scheme, final HttpProtocol protocol, final String path) {
    return new RequestStart(method, scheme, protocol, path);
  }
}
