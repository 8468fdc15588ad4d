/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.http.metrics.route;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import lombok.EqualsAndHashCode;

/**
 * Per-request opt-in to higher route label cardinality.
 *
 * <p>By default every path parameter of a matched route stays a literal placeholder, e.g. {@code
 * /posts/{language}/{slug}}. Attaching an override with {@code keepParams = {"language"}} to one
 * request turns its label into {@code /posts/en/{slug}}, so metrics can be split by language (a
 * small, bounded set) while the slug (unbounded) stays masked.
 *
 * <p><strong>Scope:</strong> one request. Application code attaches it to the request context
 * before the request finishes; it is discarded with the request. Never shared across requests.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@EqualsAndHashCode
public final class CardinalityOverride {

  /** Request attribute name under which servlet integrations look up the override. */
  public static final String ATTRIBUTE = CardinalityOverride.class.getName();

  private static final CardinalityOverride NONE = new CardinalityOverride(Set.of());

  private final Set<String> keepParams;

  private CardinalityOverride(final Set<String> keepParams) {
    this.keepParams = keepParams;
  }

  /**
   * Creates an override keeping the given path parameters.
   *
   * @param keepParams path parameter names whose matched values are substituted
   * @return override
   * @throws NullPointerException if any name is null
   */
  public static CardinalityOverride keep(final String... keepParams) {
    return keep(Arrays.asList(keepParams));
  }

  /**
   * Creates an override keeping the given path parameters.
   *
   * @param keepParams path parameter names whose matched values are substituted
   * @return override
   * @throws NullPointerException if the collection or any name is null
   */
  public static CardinalityOverride keep(final Collection<String> keepParams) {
    Objects.requireNonNull(keepParams, "keepParams must not be null");
    if (keepParams.isEmpty()) {
      return NONE;
    }
    final var names = new LinkedHashSet<String>();
    for (final String name : keepParams) {
      names.add(Objects.requireNonNull(name, "keepParams must not contain null"));
    }
    return new CardinalityOverride(Collections.unmodifiableSet(names));
  }

  /**
   * Merges two overrides (union of kept parameters).
   *
   * @param other override to merge, may be {@code null}
   * @return merged override
   */
  public CardinalityOverride and(final CardinalityOverride other) {
    if (other == null || other.keepParams.isEmpty()) {
      return this;
    }
    final var names = new LinkedHashSet<>(keepParams);
    names.addAll(other.keepParams);
    return new CardinalityOverride(Collections.unmodifiableSet(names));
  }

  public Set<String> getKeepParams() {
    return keepParams;
  }

  public boolean keeps(final String paramName) {
    return keepParams.contains(paramName);
  }

  public boolean isEmpty() {
    return keepParams.isEmpty();
  }

  @Override
  public String toString() {
    return "CardinalityOverride" + keepParams;
  }
}
