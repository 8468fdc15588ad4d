/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.http.metrics;

import static lombok.AccessLevel.PRIVATE;

import java.util.Locale;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.FieldDefaults;

/**
 * Negotiated protocol split into name and version label values.
 *
 * <p><strong>Mapping</strong> (servlet {@code getProtocol()} → labels):
 *
 * <pre>
 * HTTP/1.0 → http, 1.0
 * HTTP/1.1 → http, 1.1
 * HTTP/2.0 → http, 2
 * HTTP/3   → http, 3
 * (null)   → unknown, unknown
 * </pre>
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@Getter
@EqualsAndHashCode
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class HttpProtocol {

  static final String UNKNOWN = "unknown";

  public static final HttpProtocol HTTP_1_1 = new HttpProtocol("http", "1.1");

  String name;
  String version;

  private HttpProtocol(final String name, final String version) {
    this.name = name;
    this.version = version;
  }

  /**
   * Parses a protocol string such as {@code HTTP/1.1}.
   *
   * @param protocol protocol as reported by the server, may be {@code null}
   * @return parsed protocol, {@code unknown} parts for unparseable input
   */
  public static HttpProtocol parse(final String protocol) {
    if (protocol == null || protocol.isBlank()) {
      return new HttpProtocol(UNKNOWN, UNKNOWN);
    }
    final String trimmed = protocol.trim();
    final int slash = trimmed.indexOf('/');
    if (slash < 0) {
      return new HttpProtocol(trimmed.toLowerCase(Locale.ROOT), UNKNOWN);
    }
    final String name = trimmed.substring(0, slash).toLowerCase(Locale.ROOT);
    String version = trimmed.substring(slash + 1);
    if (version.isEmpty()) {
      version = UNKNOWN;
    } else if (version.endsWith(".0") && !version.startsWith("1.")) {
      version = version.substring(0, version.length() - 2); // HTTP/2.0 → 2
    }
    return new HttpProtocol(name.isEmpty() ? UNKNOWN : name, version);
  }

  @Override
  public String toString() {
    return name + "/" + version;
  }
}
