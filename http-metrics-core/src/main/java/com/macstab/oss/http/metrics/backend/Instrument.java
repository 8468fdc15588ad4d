/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.http.metrics.backend;

import static lombok.AccessLevel.PRIVATE;

import java.util.Objects;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.FieldDefaults;

/**
 * Named instrument descriptor passed to {@link MetricsBackend} on every call.
 *
 * <p>Created once per configured metric (4 per emitter), never per request.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@Getter
@EqualsAndHashCode
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class Instrument {

  String name;
  InstrumentType type;
  String description;

  /** Base unit ({@code seconds}, {@code bytes}), {@code null} for unitless instruments. */
  String baseUnit;

  public Instrument(
      final String name,
      final InstrumentType type,
      final String description,
      final String baseUnit) {
    this.name = Objects.requireNonNull(name, "name must not be null");
    this.type = Objects.requireNonNull(type, "type must not be null");
    this.description = description;
    this.baseUnit = baseUnit;
  }

  @Override
  public String toString() {
    return type + "[" + name + "]";
  }
}
