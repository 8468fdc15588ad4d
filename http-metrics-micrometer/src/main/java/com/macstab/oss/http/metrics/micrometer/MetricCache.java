/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.http.metrics.micrometer;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Thread-safe cache for Micrometer meter instances.
 *
 * <p><strong>Problem:</strong> Micrometer registry lookup with tag matching is expensive
 * (~100-200ns per call). Recording methods are called on the hot path (3 observations and 2 gauge
 * adjustments per HTTP request).
 *
 * <p><strong>Solution:</strong> Cache {@code Timer}, {@code DistributionSummary} and gauge value
 * ({@code AtomicInteger}) instances in {@code ConcurrentHashMap}. First access registers the meter,
 * subsequent accesses use the cached instance.
 *
 * <p><strong>Graceful Degradation:</strong> When the cache exceeds {@code maxCacheSize}, timers
 * and summaries fall back to the registry directly (Micrometer returns the already registered
 * meter for an existing id, slower but correct). A warning is logged once.
 *
 * <p><strong>Gauges:</strong> gauge values are always cached. A gauge registered with an uncached
 * value would be bound to an {@code AtomicInteger} nobody updates. Gauge series are bounded by
 * {@code method × scheme}, so they never dominate the cache.
 *
 * <p><strong>Shared registries:</strong> Micrometer keeps the first gauge registered under an id.
 * When another cache (a second backend on the same registry) already registered the gauge, this
 * cache's value is not the one exported. A warning is logged and the foreign gauge is left in
 * place by {@link #removeGauges()}. Give each backend its own namespace to keep them apart.
 *
 * <p><strong>Key Format:</strong> {@code metric.name:tag1=value1:tag2=value2} (tags in label
 * order, which is fixed per instrument).
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
final class MetricCache {

  private final MeterRegistry registry;
  private final int maxCacheSize;

  private final ConcurrentHashMap<String, Timer> timers;
  private final ConcurrentHashMap<String, DistributionSummary> summaries;
  private final ConcurrentHashMap<String, AtomicInteger> gaugeValues;
  private final ConcurrentHashMap<String, Meter.Id> gaugeIds;
  private final AtomicInteger cacheSize;
  private final AtomicBoolean fullWarningLogged = new AtomicBoolean();

  /**
   * Creates metric cache.
   *
   * @param registry Micrometer meter registry
   * @param maxCacheSize maximum cached meters (default: 1000)
   * @throws NullPointerException if registry is null
   * @throws IllegalArgumentException if maxCacheSize &lt;= 0
   */
  MetricCache(@NonNull final MeterRegistry registry, final int maxCacheSize) {
    this.registry = registry;

    if (maxCacheSize <= 0) {
      throw new IllegalArgumentException("maxCacheSize must be > 0, got: " + maxCacheSize);
    }

    this.maxCacheSize = maxCacheSize;
    this.timers = new ConcurrentHashMap<>(64);
    this.summaries = new ConcurrentHashMap<>(128);
    this.gaugeValues = new ConcurrentHashMap<>(16);
    this.gaugeIds = new ConcurrentHashMap<>(16);
    this.cacheSize = new AtomicInteger(0);
  }

  /**
   * Gets or creates a timer with tags.
   *
   * @param name metric name (e.g. {@code http.server.request.duration})
   * @param description metric description
   * @param tagPairs tag key-value pairs [key1, value1, key2, value2, ...]
   * @return timer instance (cached or direct)
   * @throws IllegalArgumentException if tagPairs length is odd
   */
  Timer getOrCreateTimer(final String name, final String description, final String... tagPairs) {
    validateTagPairs(tagPairs);

    final var key = buildKey(name, tagPairs);
    final var cached = timers.get(key);

    if (cached != null) {
      return cached;
    }

    if (cacheSize.get() < maxCacheSize) {
      return timers.computeIfAbsent(
          key,
          k -> {
            final var timer = createTimer(name, description, tagPairs);
            cacheSize.incrementAndGet();
            return timer;
          });
    }
    warnCacheFull(key);
    return createTimer(name, description, tagPairs);
  }

  /**
   * Gets or creates a distribution summary with tags.
   *
   * @param name metric name (e.g. {@code http.server.request.body.size})
   * @param description metric description
   * @param baseUnit base unit ({@code bytes}), may be {@code null}
   * @param tagPairs tag key-value pairs [key1, value1, key2, value2, ...]
   * @return summary instance (cached or direct)
   * @throws IllegalArgumentException if tagPairs length is odd
   */
  DistributionSummary getOrCreateSummary(
      final String name,
      final String description,
      final String baseUnit,
      final String... tagPairs) {
    validateTagPairs(tagPairs);

    final var key = buildKey(name, tagPairs);
    final var cached = summaries.get(key);

    if (cached != null) {
      return cached;
    }

    if (cacheSize.get() < maxCacheSize) {
      return summaries.computeIfAbsent(
          key,
          k -> {
            final var summary = createSummary(name, description, baseUnit, tagPairs);
            cacheSize.incrementAndGet();
            return summary;
          });
    }
    warnCacheFull(key);
    return createSummary(name, description, baseUnit, tagPairs);
  }

  /**
   * Gets or creates a gauge value (AtomicInteger) with tags.
   *
   * <p><strong>Lifecycle:</strong> Gauge registered in Micrometer on first access, tracked in
   * {@code gaugeValues} for subsequent updates. Removed by {@link #removeGauges()}.
   *
   * @param name metric name (e.g. {@code http.server.active_requests})
   * @param description metric description
   * @param tagPairs tag key-value pairs [key1, value1, key2, value2, ...]
   * @return AtomicInteger holding gauge value
   * @throws IllegalArgumentException if tagPairs length is odd
   */
  AtomicInteger getOrCreateGaugeValue(
      final String name, final String description, final String... tagPairs) {
    validateTagPairs(tagPairs);

    final var key = buildKey(name, tagPairs);
    final var cached = gaugeValues.get(key);

    if (cached != null) {
      return cached;
    }

    return gaugeValues.computeIfAbsent(
        key,
        k -> {
          final var gaugeValue = new AtomicInteger(0);
          cacheSize.incrementAndGet();

          if (registry.find(name).tags(tagPairs).gauge() != null) {
            log.warn(
                "Gauge {} is already registered on this registry by another owner. Updates from "
                    + "this backend will not be exported; use a distinct namespace per backend",
                k);
            return gaugeValue;
          }

          final Gauge gauge =
              Gauge.builder(name, gaugeValue, AtomicInteger::get)
                  .description(description)
                  .tags(tagPairs)
                  .strongReference(true)
                  .register(registry);
          gaugeIds.put(k, gauge.getId());

          return gaugeValue;
        });
  }

  /**
   * Removes all gauges registered through this cache from the registry and drops all cached gauge
   * values.
   *
   * <p><strong>When called:</strong> {@code MicrometerMetricsBackend.close()}
   */
  void removeGauges() {
    gaugeIds
        .entrySet()
        .removeIf(
            entry -> {
              try {
                registry.remove(entry.getValue());
                gaugeValues.remove(entry.getKey());
                cacheSize.decrementAndGet();
                log.debug("Removed gauge {}", entry.getKey());
              } catch (final RuntimeException e) {
                log.warn("Failed to remove gauge {}: {}", entry.getKey(), e.getMessage());
              }
              return true;
            });
    cacheSize.addAndGet(-gaugeValues.size());
    gaugeValues.clear();
  }

  private void warnCacheFull(final String key) {
    if (fullWarningLogged.compareAndSet(false, true)) {
      log.warn(
          "Metric cache full at {} entries. Direct registry used from now on (first: {}). "
              + "Check route cardinality or raise management.metrics.http-server.max-cache-size",
          maxCacheSize,
          key);
    } else {
      log.debug("Metric cache full, direct registry used for: {}", key);
    }
  }

  /**
   * Builds cache key from metric name and tag pairs.
   *
   * <p><strong>Format:</strong> {@code metric.name:tag1=value1:tag2=value2}
   *
   * @param name metric name
   * @param tagPairs tag key-value pairs [key1, value1, key2, value2, ...]
   * @return cache key
   */
  private String buildKey(final String name, final String... tagPairs) {
    final int capacity = 32 + (tagPairs.length / 2 * 25);
    final var key = new StringBuilder(capacity);

    key.append(name);

    for (int i = 0; i < tagPairs.length; i += 2) {
      key.append(':').append(tagPairs[i]).append('=').append(tagPairs[i + 1]);
    }

    return key.toString();
  }

  private Timer createTimer(
      final String name, final String description, final String... tagPairs) {
    return Timer.builder(name).description(description).tags(tagPairs).register(registry);
  }

  private DistributionSummary createSummary(
      final String name,
      final String description,
      final String baseUnit,
      final String... tagPairs) {
    return DistributionSummary.builder(name)
        .description(description)
        .baseUnit(baseUnit)
        .tags(tagPairs)
        .register(registry);
  }

  /**
   * Validates tag pairs array (must be even length).
   *
   * @param tagPairs tag key-value pairs
   * @throws IllegalArgumentException if length is odd
   */
  private void validateTagPairs(final String... tagPairs) {
    if (tagPairs.length % 2 != 0) {
      throw new IllegalArgumentException(
          "Tag pairs must have even length (key-value pairs), got: " + tagPairs.length);
    }
  }

  /**
   * Gets current cache size (for testing/monitoring).
   *
   * @return number of cached meters
   */
  int getCacheSize() {
    return cacheSize.get();
  }

  int getMaxCacheSize() {
    return maxCacheSize;
  }
}
