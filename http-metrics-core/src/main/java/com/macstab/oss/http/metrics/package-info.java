/* (C)2026 Macstab GmbH */

/**
 * Framework-agnostic HTTP server metrics core (NO Spring, NO Micrometer dependencies).
 *
 * <h2>Purpose</h2>
 *
 * <p>Records four instruments for every HTTP request a server handles:
 *
 * <ul>
 *   <li><strong>Active requests</strong> (gauge, labels {@code method, scheme})
 *   <li><strong>Request duration</strong> (timer, seconds)
 *   <li><strong>Request body size</strong> (summary, bytes)
 *   <li><strong>Response body size</strong> (summary, bytes)
 * </ul>
 *
 * <p>The three observations carry {@code route, method, status, protocol_name, protocol_version}.
 *
 * <h2>Route Cardinality</h2>
 *
 * <p>The {@code route} label is the matched route template ({@code /users/{id}}), never the raw
 * path, so a label series exists per route and not per URL. Requests that match no route are
 * collapsed into one mask label ({@code UNKNOWN} by default). A handler may opt single path
 * parameters back in with a {@link com.macstab.oss.http.metrics.route.CardinalityOverride}:
 *
 * <pre>{@code
 * route template:  /posts/{language}/{slug}
 * request:         /posts/en/hello-world
 * override:        keep("language")
 * label:           /posts/en/{slug}
 * }</pre>
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * ┌──────────────────────────────────────────────────────┐
 * │ Server adapter (servlet filter, ...)                 │
 * └────────────────┬─────────────────────────────────────┘
 *                  ↓ begin / close
 * ┌──────────────────────────────────────────────────────┐
 * │ HttpMetricsInterceptor + RequestObservation          │
 * │ (lifecycle, exactly-once finalization)               │
 * └────────────────┬─────────────────────────────────────┘
 *                  ↓ route label
 * ┌──────────────────────────────────────────────────────┐
 * │ RouteLabelResolver (template, override, masking)     │
 * └────────────────┬─────────────────────────────────────┘
 *                  ↓ gauge deltas, observations
 * ┌──────────────────────────────────────────────────────┐
 * │ MetricsEmitter → MetricsBackend SPI                  │
 * └──────────────────────────────────────────────────────┘
 * </pre>
 *
 * <h2>Guarantees</h2>
 *
 * <ul>
 *   <li>Every gauge increment is paired with exactly one decrement, on every exit path.
 *   <li>Every finished, non-excluded request emits exactly one observation triple.
 *   <li>Backend failures are logged and never change the HTTP response.
 *   <li>Handler exceptions are rethrown unchanged after finalization.
 * </ul>
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
package com.macstab.oss.http.metrics;
