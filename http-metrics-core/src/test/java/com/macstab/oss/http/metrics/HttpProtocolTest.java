/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.http.metrics;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;

@DisplayName("HttpProtocol")
class HttpProtocolTest {

  @ParameterizedTest(name = "{0} → {1}/{2}")
  @CsvSource({
    "HTTP/1.1, http, 1.1",
    "HTTP/1.0, http, 1.0",
    "HTTP/2.0, http, 2",
    "HTTP/2, http, 2",
    "HTTP/3.0, http, 3",
    "HTTP, http, unknown",
    "HTTP/, http, unknown"
  })
  @DisplayName("parses protocol strings into name and version")
  void parse(final String protocol, final String name, final String version) {
    // Act
    final var parsed = HttpProtocol.parse(protocol);

    // Assert
    assertThat(parsed.getName()).isEqualTo(name);
    assertThat(parsed.getVersion()).isEqualTo(version);
  }

  @ParameterizedTest
  @NullAndEmptySource
  @DisplayName("missing protocol is unknown/unknown")
  void parse_Missing(final String protocol) {
    // Act
    final var parsed = HttpProtocol.parse(protocol);

    // Assert
    assertThat(parsed.toString()).isEqualTo("unknown/unknown");
  }
}
