/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.http.metrics;

/**
 * Lifecycle phase of a {@link RequestObservation}.
 *
 * <pre>
 * STARTED → AWAITING_BODY → HANDLER_RUNNING → FINALIZING → DONE
 * </pre>
 *
 * <p>Transitions only move forward. {@code FINALIZING} is entered exactly once, from any earlier
 * phase (a request may fail before its handler ever ran).
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
public enum RequestPhase {

  /** Start time captured, active-requests gauge being incremented. */
  STARTED,

  /** Inbound body may be streaming, handler not yet invoked. */
  AWAITING_BODY,

  /** Handler chain executing (body consumption may still be in progress). */
  HANDLER_RUNNING,

  /** Labels resolved, observations and gauge decrement being emitted. */
  FINALIZING,

  /** Terminal. Further mutations are ignored. */
  DONE;

  boolean isOpen() {
    return this.ordinal() < FINALIZING.ordinal();
  }
}
