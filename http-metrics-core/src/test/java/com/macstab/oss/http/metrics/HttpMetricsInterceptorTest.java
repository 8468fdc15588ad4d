/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.http.metrics;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import com.macstab.oss.http.metrics.backend.Instrument;
import com.macstab.oss.http.metrics.backend.Labels;
import com.macstab.oss.http.metrics.backend.MetricsBackend;
import com.macstab.oss.http.metrics.backend.MetricsEmitter;
import com.macstab.oss.http.metrics.backend.RecordingMetricsBackend;
import com.macstab.oss.http.metrics.config.HttpMetricsConfig;
import com.macstab.oss.http.metrics.route.CardinalityOverride;

import lombok.extern.slf4j.Slf4j;

/**
 * Tests for {@link HttpMetricsInterceptor} and {@link RequestObservation}.
 *
 * <p>Tests verify:
 *
 * <ul>
 *   <li>Active-request gauge pairing on every exit path
 *   <li>Exactly one observation triple per finished request
 *   <li>Abnormal termination (synthesized status, exception rethrown unchanged)
 *   <li>Route label resolution (matched, unmatched, override, 404/405)
 *   <li>Exclusions suppress observations but not gauge pairing
 *   <li>Backend failures never reach the caller
 *   <li>Exactly-once finalization under concurrent close
 * </ul>
 */
@Slf4j
@DisplayName("HttpMetricsInterceptor")
class HttpMetricsInterceptorTest {

  private static final String DURATION = "http.server.request.duration";
  private static final String REQUEST_SIZE = "http.server.request.body.size";
  private static final String RESPONSE_SIZE = "http.server.response.body.size";
  private static final String ACTIVE = "http.server.active_requests";

  private static final Labels GET_HTTP = Labels.of("method", "GET", "scheme", "http");

  private RecordingMetricsBackend backend;
  private AtomicLong clock;

  @BeforeEach
  void setUp() {
    backend = new RecordingMetricsBackend();
    clock = new AtomicLong(1_000_000_000L);
  }

  private HttpMetricsInterceptor interceptor(final HttpMetricsConfig config) {
    return new HttpMetricsInterceptor(new MetricsEmitter(config, backend), clock::get);
  }

  private static RequestStart get(final String path) {
    return RequestStart.of("GET", "http", "HTTP/1.1", path);
  }

  @Nested
  @DisplayName("Normal completion")
  class NormalCompletion {

    @Test
    @DisplayName("gauge is incremented on begin and decremented on close")
    void gauge_PairedAcrossLifecycle() {
      // Arrange
      final var interceptor = interceptor(HttpMetricsConfig.defaults());

      // Act
      final var observation = interceptor.begin(get("/users/42"));
      final long during = backend.gauge(ACTIVE, GET_HTTP);
      observation.complete(200, 5);
      observation.close();

      // Assert
      assertThat(during).isEqualTo(1);
      assertThat(backend.gauge(ACTIVE, GET_HTTP)).isZero();
      assertThat(observation.getPhase()).isEqualTo(RequestPhase.DONE);
    }

    @Test
    @DisplayName("one observation triple with the matched template and measured values")
    void observationTriple_Recorded() {
      // Arrange
      final var interceptor = interceptor(HttpMetricsConfig.defaults());

      // Act
      try (RequestObservation observation = interceptor.begin(get("/users/42"))) {
        observation.addRequestBodyBytes(100);
        observation.addRequestBodyBytes(28);
        observation.handlerStarted();
        observation.routeMatched("/users/{id}", Map.of("id", "42"));
        clock.addAndGet(250_000_000L);
        observation.complete(200, 512);
      }

      // Assert
      final var durations = backend.observationsOf(DURATION);
      assertThat(durations).hasSize(1);
      assertThat(durations.get(0).getValue()).isCloseTo(0.25, within(1e-9));
      assertThat(durations.get(0).getLabels())
          .isEqualTo(
              Labels.of(
                  "route", "/users/{id}",
                  "method", "GET",
                  "status", "200",
                  "protocol_name", "http",
                  "protocol_version", "1.1"));
      assertThat(backend.observationsOf(REQUEST_SIZE)).singleElement()
          .extracting(RecordingMetricsBackend.Observation::getValue)
          .isEqualTo(128.0);
      assertThat(backend.observationsOf(RESPONSE_SIZE)).singleElement()
          .extracting(RecordingMetricsBackend.Observation::getValue)
          .isEqualTo(512.0);
    }

    @Test
    @DisplayName("phases advance Started → AwaitingBody → HandlerRunning → Done")
    void phases_Advance() {
      // Arrange
      final var interceptor = interceptor(HttpMetricsConfig.defaults());

      // Act
      final var observation = interceptor.begin(get("/"));
      final var afterBegin = observation.getPhase();
      observation.handlerStarted();
      final var afterHandler = observation.getPhase();
      observation.complete(204, 0);
      observation.close();

      // Assert
      assertThat(afterBegin).isEqualTo(RequestPhase.AWAITING_BODY);
      assertThat(afterHandler).isEqualTo(RequestPhase.HANDLER_RUNNING);
      assertThat(observation.getPhase()).isEqualTo(RequestPhase.DONE);
    }

    @Test
    @DisplayName("first recorded outcome wins")
    void firstOutcome_Wins() {
      // Arrange
      final var interceptor = interceptor(HttpMetricsConfig.defaults());

      // Act
      try (RequestObservation observation = interceptor.begin(get("/"))) {
        observation.routeMatched("/", Map.of());
        observation.complete(201, 1);
        observation.complete(500, 2);
      }

      // Assert
      assertThat(backend.observationsOf(DURATION).get(0).label("status")).isEqualTo("201");
      assertThat(backend.observationsOf(RESPONSE_SIZE).get(0).getValue()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("intercept() records the handler's outcome")
    void intercept_RecordsOutcome() {
      // Arrange
      final var interceptor = interceptor(HttpMetricsConfig.defaults());

      // Act
      final ResponseOutcome outcome =
          interceptor.intercept(
              get("/orders/7"),
              observation -> {
                observation.routeMatched("/orders/{id}", Map.of("id", "7"));
                return ResponseOutcome.completed(202, 3);
              });

      // Assert
      assertThat(outcome.getStatus()).isEqualTo(202);
      assertThat(backend.observationsOf(DURATION).get(0).label("route"))
          .isEqualTo("/orders/{id}");
      assertThat(backend.gaugeTotal()).isZero();
    }
  }

  @Nested
  @DisplayName("Abnormal termination")
  class AbnormalTermination {

    @Test
    @DisplayName("close without outcome synthesizes status 500")
    void closeWithoutOutcome_Synthesizes500() {
      // Arrange
      final var interceptor = interceptor(HttpMetricsConfig.defaults());

      // Act
      final var observation = interceptor.begin(get("/users/42"));
      observation.routeMatched("/users/{id}", Map.of("id", "42"));
      observation.close();

      // Assert
      assertThat(backend.observationsOf(DURATION)).singleElement()
          .extracting(o -> o.label("status"))
          .isEqualTo("500");
      assertThat(backend.observationsOf(RESPONSE_SIZE).get(0).getValue()).isZero();
      assertThat(backend.gauge(ACTIVE, GET_HTTP)).isZero();
    }

    @Test
    @DisplayName("configured abnormal termination status is used")
    void configuredAbnormalStatus_Used() {
      // Arrange
      final var interceptor =
          interceptor(HttpMetricsConfig.builder().abnormalTerminationStatus(503).build());

      // Act
      interceptor.begin(get("/")).close();

      // Assert
      assertThat(backend.observationsOf(DURATION).get(0).label("status")).isEqualTo("503");
    }

    @Test
    @DisplayName("status hint >= 400 is used for synthesized outcome")
    void statusHint_Used() {
      // Arrange
      final var interceptor = interceptor(HttpMetricsConfig.defaults());

      // Act
      final var observation = interceptor.begin(get("/"));
      observation.statusHint(413);
      observation.close();

      // Assert
      assertThat(backend.observationsOf(DURATION).get(0).label("status")).isEqualTo("413");
    }

    @Test
    @DisplayName("fail() uses best-known status only when it is an error status")
    void fail_BestKnownStatus() {
      // Arrange
      final var interceptor = interceptor(HttpMetricsConfig.defaults());

      // Act
      try (RequestObservation first = interceptor.begin(get("/a"))) {
        first.fail(new IllegalStateException("boom"), 418);
      }
      try (RequestObservation second = interceptor.begin(get("/b"))) {
        second.fail(new IllegalStateException("boom"), 200);
      }

      // Assert
      final var durations = backend.observationsOf(DURATION);
      assertThat(durations).extracting(o -> o.label("status")).containsExactly("418", "500");
    }

    @Test
    @DisplayName("intercept() rethrows the handler exception unchanged after finalizing")
    void intercept_RethrowsUnchanged() {
      // Arrange
      final var interceptor = interceptor(HttpMetricsConfig.defaults());
      final var failure = new IOException("connection reset");

      // Act & Assert
      assertThatThrownBy(
              () ->
                  interceptor.intercept(
                      get("/upload"),
                      observation -> {
                        observation.routeMatched("/upload", Map.of());
                        throw failure;
                      }))
          .isSameAs(failure);
      assertThat(backend.observationsOf(DURATION)).singleElement()
          .extracting(o -> o.label("status"))
          .isEqualTo("500");
      assertThat(backend.gaugeTotal()).isZero();
    }

    @Test
    @DisplayName("intercept() finalizes on Error as well")
    void intercept_FinalizesOnError() {
      // Arrange
      final var interceptor = interceptor(HttpMetricsConfig.defaults());

      // Act & Assert
      assertThatThrownBy(
              () ->
                  interceptor.intercept(
                      get("/"),
                      observation -> {
                        throw new StackOverflowError();
                      }))
          .isInstanceOf(StackOverflowError.class);
      assertThat(backend.gaugeTotal()).isZero();
      assertThat(backend.observationsOf(DURATION)).hasSize(1);
    }
  }

  @Nested
  @DisplayName("Route labels")
  class RouteLabels {

    @Test
    @DisplayName("unmatched request is labelled UNKNOWN")
    void unmatched_Unknown() {
      // Arrange
      final var interceptor = interceptor(HttpMetricsConfig.defaults());

      // Act
      try (RequestObservation observation = interceptor.begin(get("/nope"))) {
        observation.complete(404, 0);
      }

      // Assert
      assertThat(backend.observationsOf(DURATION).get(0).label("route")).isEqualTo("UNKNOWN");
    }

    @Test
    @DisplayName("unmatched request keeps raw path when masking is disabled")
    void unmatched_RawPathWhenDisabled() {
      // Arrange
      final var interceptor =
          interceptor(HttpMetricsConfig.builder().disableUnmatchedRouteMasking().build());

      // Act
      try (RequestObservation observation = interceptor.begin(get("/nope"))) {
        observation.complete(404, 0);
      }

      // Assert
      assertThat(backend.observationsOf(DURATION).get(0).label("route")).isEqualTo("/nope");
    }

    @Test
    @DisplayName("cardinality override substitutes kept parameters")
    void override_Substitutes() {
      // Arrange
      final var interceptor = interceptor(HttpMetricsConfig.defaults());

      // Act
      try (RequestObservation observation = interceptor.begin(get("/posts/en/hello"))) {
        observation.routeMatched(
            "/posts/{language}/{slug}", Map.of("language", "en", "slug", "hello"));
        observation.keepCardinality(CardinalityOverride.keep("language"));
        observation.complete(200, 10);
      }

      // Assert
      assertThat(backend.observationsOf(DURATION).get(0).label("route"))
          .isEqualTo("/posts/en/{slug}");
    }

    @Test
    @DisplayName("override is ignored for 404 and 405")
    void override_IgnoredFor404And405() {
      // Arrange
      final var interceptor = interceptor(HttpMetricsConfig.defaults());

      // Act
      for (final int status : new int[] {404, 405}) {
        try (RequestObservation observation = interceptor.begin(get("/items/x"))) {
          observation.routeMatched("/items/{id}", Map.of("id", "x"));
          observation.keepCardinality(CardinalityOverride.keep("id"));
          observation.complete(status, 0);
        }
      }

      // Assert
      assertThat(backend.observationsOf(DURATION))
          .extracting(o -> o.label("route"))
          .containsExactly("/items/{id}", "/items/{id}");
    }

    @Test
    @DisplayName("overrides attached twice are merged")
    void overrides_Merged() {
      // Arrange
      final var interceptor = interceptor(HttpMetricsConfig.defaults());

      // Act
      try (RequestObservation observation = interceptor.begin(get("/a/1/b/2"))) {
        observation.routeMatched("/a/{x}/b/{y}", Map.of("x", "1", "y", "2"));
        observation.keepCardinality(CardinalityOverride.keep("x"));
        observation.keepCardinality(CardinalityOverride.keep("y"));
        observation.complete(200, 0);
      }

      // Assert
      assertThat(backend.observationsOf(DURATION).get(0).label("route")).isEqualTo("/a/1/b/2");
    }
  }

  @Nested
  @DisplayName("Exclusions")
  class Exclusions {

    @Test
    @DisplayName("excluded route emits no observations but still pairs the gauge")
    void excludedRoute_GaugePairedNoObservations() {
      // Arrange
      final var interceptor =
          interceptor(HttpMetricsConfig.builder().excludeRoute("/health").build());

      // Act
      final var observation = interceptor.begin(get("/health"));
      final long during = backend.gauge(ACTIVE, GET_HTTP);
      observation.routeMatched("/health", Map.of());
      observation.complete(200, 2);
      observation.close();

      // Assert
      assertThat(during).isEqualTo(1);
      assertThat(backend.gauge(ACTIVE, GET_HTTP)).isZero();
      assertThat(backend.getObservations()).isEmpty();
    }

    @Test
    @DisplayName("excluded status emits no observations")
    void excludedStatus_NoObservations() {
      // Arrange
      final var interceptor = interceptor(HttpMetricsConfig.builder().excludeStatus(404).build());

      // Act
      try (RequestObservation observation = interceptor.begin(get("/nope"))) {
        observation.complete(404, 0);
      }

      // Assert
      assertThat(backend.getObservations()).isEmpty();
      assertThat(backend.getGaugeAdjustments()).isEqualTo(2);
    }

    @Test
    @DisplayName("unmatched requests are excluded by raw path before masking")
    void unmatchedRequest_ExcludedByRawPath() {
      // Arrange
      final var interceptor =
          interceptor(
              HttpMetricsConfig.builder()
                  .excludeRoute("/favicon.ico")
                  .excludeRoutePattern("/wp-")
                  .build());

      // Act
      try (RequestObservation observation = interceptor.begin(get("/favicon.ico"))) {
        observation.complete(404, 0);
      }
      try (RequestObservation observation = interceptor.begin(get("/blog/wp-admin.php"))) {
        observation.complete(404, 0);
      }
      try (RequestObservation observation = interceptor.begin(get("/robots.txt"))) {
        observation.complete(404, 0);
      }

      // Assert
      assertThat(backend.observationsOf(DURATION))
          .singleElement()
          .satisfies(o -> assertThat(o.label("route")).isEqualTo("UNKNOWN"));
      assertThat(backend.gauge(ACTIVE, GET_HTTP)).isZero();
    }

    @Test
    @DisplayName("exclusion sees kept parameter values of a matched route")
    void matchedRoute_ExcludedAfterSubstitution() {
      // Arrange
      final var interceptor =
          interceptor(HttpMetricsConfig.builder().excludeRoute("/posts/draft/{slug}").build());

      // Act
      try (RequestObservation observation = interceptor.begin(get("/posts/draft/x"))) {
        observation.routeMatched("/posts/{state}/{slug}", Map.of("state", "draft", "slug", "x"));
        observation.keepCardinality(CardinalityOverride.keep("state"));
        observation.complete(200, 0);
      }
      try (RequestObservation observation = interceptor.begin(get("/posts/live/y"))) {
        observation.routeMatched("/posts/{state}/{slug}", Map.of("state", "live", "slug", "y"));
        observation.keepCardinality(CardinalityOverride.keep("state"));
        observation.complete(200, 0);
      }

      // Assert
      assertThat(backend.observationsOf(DURATION))
          .singleElement()
          .satisfies(o -> assertThat(o.label("route")).isEqualTo("/posts/live/{slug}"));
    }

    @Test
    @DisplayName("masked label can still be excluded as a whole")
    void maskedLabel_Excluded() {
      // Arrange
      final var interceptor =
          interceptor(HttpMetricsConfig.builder().excludeRoute("UNKNOWN").build());

      // Act
      try (RequestObservation observation = interceptor.begin(get("/anything"))) {
        observation.complete(404, 0);
      }

      // Assert
      assertThat(backend.getObservations()).isEmpty();
    }
  }

  @Nested
  @DisplayName("Finalization")
  class Finalization {

    @Test
    @DisplayName("close is idempotent")
    void close_Idempotent() {
      // Arrange
      final var interceptor = interceptor(HttpMetricsConfig.defaults());
      final var observation = interceptor.begin(get("/"));
      observation.complete(200, 0);

      // Act
      observation.close();
      observation.close();
      observation.close();

      // Assert
      assertThat(backend.observationsOf(DURATION)).hasSize(1);
      assertThat(backend.getGaugeAdjustments()).isEqualTo(2);
      assertThat(backend.gauge(ACTIVE, GET_HTTP)).isZero();
    }

    @Test
    @DisplayName("mutations after finalization are ignored")
    void mutationsAfterClose_Ignored() {
      // Arrange
      final var interceptor = interceptor(HttpMetricsConfig.defaults());
      final var observation = interceptor.begin(get("/"));
      observation.complete(200, 0);
      observation.close();

      // Act
      observation.addRequestBodyBytes(99);
      observation.routeMatched("/late", Map.of());
      observation.complete(500, 1);

      // Assert
      assertThat(observation.getRequestBodyBytes()).isZero();
      assertThat(observation.getRouteTemplate()).isNull();
      assertThat(backend.getObservations()).hasSize(3);
    }

    @Test
    @DisplayName("concurrent close from many threads finalizes exactly once")
    void concurrentClose_ExactlyOnce() throws Exception {
      // Arrange
      final var interceptor = interceptor(HttpMetricsConfig.defaults());
      final int requests = 200;
      final int closersPerRequest = 8;
      final ExecutorService executor = Executors.newFixedThreadPool(closersPerRequest);
      final List<Future<?>> futures = new ArrayList<>();

      try {
        // Act
        for (int r = 0; r < requests; r++) {
          final var observation = interceptor.begin(get("/r"));
          observation.complete(200, 1);
          final var startGate = new CountDownLatch(1);
          for (int c = 0; c < closersPerRequest; c++) {
            futures.add(
                executor.submit(
                    () -> {
                      startGate.await();
                      observation.close();
                      return null;
                    }));
          }
          startGate.countDown();
        }
        for (final Future<?> future : futures) {
          future.get(10, SECONDS);
        }

        // Assert
        await()
            .atMost(5, SECONDS)
            .untilAsserted(
                () -> assertThat(backend.observationsOf(DURATION)).hasSize(requests));
        assertThat(backend.observationsOf(REQUEST_SIZE)).hasSize(requests);
        assertThat(backend.observationsOf(RESPONSE_SIZE)).hasSize(requests);
        assertThat(backend.gauge(ACTIVE, GET_HTTP)).isZero();
        assertThat(backend.getGaugeAdjustments()).isEqualTo(2L * requests);
      } finally {
        executor.shutdownNow();
      }
    }

    @Test
    @DisplayName("concurrent requests keep the gauge balanced")
    void concurrentRequests_GaugeBalanced() throws Exception {
      // Arrange
      final var interceptor = interceptor(HttpMetricsConfig.defaults());
      final ExecutorService executor = Executors.newFixedThreadPool(16);
      final int requests = 1_000;
      final var done = new CountDownLatch(requests);

      try {
        // Act
        for (int i = 0; i < requests; i++) {
          final int status = i % 5 == 0 ? 500 : 200;
          executor.execute(
              () -> {
                try (RequestObservation observation = interceptor.begin(get("/c"))) {
                  observation.routeMatched("/c", Map.of());
                  observation.addRequestBodyBytes(1);
                  if (status == 200) {
                    observation.complete(status, 1);
                  }
                } finally {
                  done.countDown();
                }
              });
        }

        // Assert
        assertThat(done.await(10, SECONDS)).isTrue();
        assertThat(backend.gauge(ACTIVE, GET_HTTP)).isZero();
        assertThat(backend.observationsOf(DURATION)).hasSize(requests);
        assertThat(backend.observationsOf(DURATION))
            .filteredOn(o -> "500".equals(o.label("status")))
            .hasSize(requests / 5);
      } finally {
        executor.shutdownNow();
      }
    }
  }

  @Nested
  @DisplayName("Backend contract")
  class BackendContract {

    @Test
    @DisplayName("increment happens before the observations, which happen before the decrement")
    void callOrder_IncrementObserveDecrement() {
      // Arrange
      final MetricsBackend mock = mock(MetricsBackend.class);
      final var interceptor =
          new HttpMetricsInterceptor(
              new MetricsEmitter(HttpMetricsConfig.defaults(), mock), clock::get);

      // Act
      try (RequestObservation observation = interceptor.begin(get("/"))) {
        observation.complete(200, 0);
      }

      // Assert
      final InOrder order = inOrder(mock);
      order.verify(mock).adjustGauge(any(), any(), eq(1L));
      order.verify(mock, times(3)).record(any(), any(), anyDouble());
      order.verify(mock).adjustGauge(any(), any(), eq(-1L));
      order.verifyNoMoreInteractions();
    }

    @Test
    @DisplayName("renaming the gauge changes only the instrument name")
    void renamedGauge_SameLabels() {
      // Arrange
      final var interceptor =
          interceptor(HttpMetricsConfig.builder().activeRequestsName("my_active").build());

      // Act
      final var observation = interceptor.begin(get("/"));
      final long renamed = backend.gauge("my_active", GET_HTTP);
      final long original = backend.gauge(ACTIVE, GET_HTTP);
      observation.close();

      // Assert
      assertThat(renamed).isEqualTo(1);
      assertThat(original).isZero();
      assertThat(backend.observationsOf(DURATION).get(0).getLabels().size()).isEqualTo(5);
    }
  }

  @Nested
  @DisplayName("Backend failures")
  class BackendFailures {

    @Test
    @DisplayName("throwing backend never reaches the caller")
    void throwingBackend_Isolated() {
      // Arrange
      final MetricsBackend failing =
          new MetricsBackend() {
            @Override
            public void adjustGauge(
                final Instrument instrument, final Labels labels, final long d) {
              throw new IllegalStateException("registry unavailable");
            }

            @Override
            public void record(final Instrument instrument, final Labels labels, final double v) {
              throw new IllegalStateException("registry unavailable");
            }
          };
      final var emitter = new MetricsEmitter(HttpMetricsConfig.defaults(), failing);
      final var interceptor = new HttpMetricsInterceptor(emitter, clock::get);

      // Act & Assert
      assertThatCode(
              () -> {
                final ResponseOutcome outcome =
                    interceptor.intercept(
                        get("/"), observation -> ResponseOutcome.completed(200, 0));
                assertThat(outcome.getStatus()).isEqualTo(200);
              })
          .doesNotThrowAnyException();
      assertThat(emitter.getEmissionFailures()).isEqualTo(5);
    }
  }
}
