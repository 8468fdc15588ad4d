/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.http.metrics;

import static lombok.AccessLevel.PRIVATE;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.FieldDefaults;

/**
 * How a request ended: final status, response body bytes, and whether the handler chain produced
 * the response normally.
 *
 * <p>Exactly one outcome is paired with every {@link RequestObservation}. When the handler chain
 * terminates abnormally (exception, dropped connection) the outcome is synthesized with the
 * best-known error status.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@Getter
@ToString
@EqualsAndHashCode
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class ResponseOutcome {

  int status;
  long responseBodyBytes;
  boolean completedNormally;

  private ResponseOutcome(
      final int status, final long responseBodyBytes, final boolean completedNormally) {
    if (status < 100 || status > 999) {
      throw new IllegalArgumentException("status must be in [100, 999], got: " + status);
    }
    if (responseBodyBytes < 0) {
      throw new IllegalArgumentException(
          "responseBodyBytes must be >= 0, got: " + responseBodyBytes);
    }
    this.status = status;
    this.responseBodyBytes = responseBodyBytes;
    this.completedNormally = completedNormally;
  }

  /**
   * Outcome of a response produced by the handler chain.
   *
   * @param status response status
   * @param responseBodyBytes bytes written to the response body
   * @return normal outcome
   */
  public static ResponseOutcome completed(final int status, final long responseBodyBytes) {
    return new ResponseOutcome(status, responseBodyBytes, true);
  }

  /**
   * Synthesized outcome of an abnormal termination.
   *
   * @param status best-known or default error status
   * @param responseBodyBytes bytes written before termination
   * @return abnormal outcome
   */
  public static ResponseOutcome abnormal(final int status, final long responseBodyBytes) {
    return new ResponseOutcome(status, responseBodyBytes, false);
  }
}
