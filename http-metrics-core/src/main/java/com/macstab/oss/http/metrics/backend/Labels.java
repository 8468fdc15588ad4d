/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.http.metrics.backend;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, ordered label set ({@code key=value} pairs).
 *
 * <p>Stored as a flat array {@code [key1, value1, key2, value2, ...]}, the same layout Micrometer's
 * {@code tags(String...)} accepts, so backends can pass {@link #toTagPairs()} straight through.
 *
 * <p>Keys are not deduplicated; {@code HttpMetricsConfig} guarantees distinct keys at build time.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
public final class Labels {

  private static final Labels EMPTY = new Labels(new String[0]);

  private final String[] pairs;

  private Labels(final String[] pairs) {
    this.pairs = pairs;
  }

  public static Labels empty() {
    return EMPTY;
  }

  /**
   * Creates labels from key-value pairs.
   *
   * @param pairs {@code [key1, value1, key2, value2, ...]}
   * @return labels
   * @throws IllegalArgumentException if pairs length is odd
   * @throws NullPointerException if any key or value is null
   */
  public static Labels of(final String... pairs) {
    if (pairs.length % 2 != 0) {
      throw new IllegalArgumentException(
          "Label pairs must have even length (key-value pairs), got: " + pairs.length);
    }
    for (int i = 0; i < pairs.length; i++) {
      Objects.requireNonNull(pairs[i], i % 2 == 0 ? "label key" : "label value");
    }
    return pairs.length == 0 ? EMPTY : new Labels(pairs.clone());
  }

  /**
   * Returns a copy with one more label appended.
   *
   * @param key label key
   * @param value label value
   * @return new labels
   */
  public Labels and(final String key, final String value) {
    final String[] extended = Arrays.copyOf(pairs, pairs.length + 2);
    extended[pairs.length] = Objects.requireNonNull(key, "label key");
    extended[pairs.length + 1] = Objects.requireNonNull(value, "label value");
    return new Labels(extended);
  }

  /**
   * Returns a copy with all entries of the map appended (map iteration order).
   *
   * @param labels labels to append
   * @return new labels
   */
  public Labels and(final Map<String, String> labels) {
    if (labels.isEmpty()) {
      return this;
    }
    final String[] extended = Arrays.copyOf(pairs, pairs.length + labels.size() * 2);
    int i = pairs.length;
    for (final Map.Entry<String, String> entry : labels.entrySet()) {
      extended[i++] = Objects.requireNonNull(entry.getKey(), "label key");
      extended[i++] = Objects.requireNonNull(entry.getValue(), "label value");
    }
    return new Labels(extended);
  }

  /**
   * Looks up a label value.
   *
   * @param key label key
   * @return value, or {@code null} if absent
   */
  public String get(final String key) {
    for (int i = 0; i < pairs.length; i += 2) {
      if (pairs[i].equals(key)) {
        return pairs[i + 1];
      }
    }
    return null;
  }

  public int size() {
    return pairs.length / 2;
  }

  /**
   * Flat key-value array, copied on each call.
   *
   * @return {@code [key1, value1, key2, value2, ...]}
   */
  public String[] toTagPairs() {
    return pairs.clone();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof Labels && Arrays.equals(pairs, ((Labels) o).pairs);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(pairs);
  }

  @Override
  public String toString() {
    final var sb = new StringBuilder("{");
    for (int i = 0; i < pairs.length; i += 2) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(pairs[i]).append('=').append(pairs[i + 1]);
    }
    return sb.append('}').toString();
  }
}
