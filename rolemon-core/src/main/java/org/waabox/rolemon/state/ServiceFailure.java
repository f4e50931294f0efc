package org.waabox.rolemon.state;

import java.time.Instant;
import java.util.Objects;

/**
 * Consecutive failed attempts to bring one service to its desired state.
 *
 * <p>The record is bound to a direction: once the desired state of the
 * service flips, the failure history no longer applies and is dropped.
 *
 * @param desiredRunning whether the failed attempts tried to start the
 *                       service ({@code true}) or stop it
 * @param attempts       the number of consecutive failed attempts, at
 *                       least 1
 * @param lastAttemptAt  when the last attempt failed, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ServiceFailure(boolean desiredRunning, int attempts,
    Instant lastAttemptAt) {

  /**
   * Validates the record.
   *
   * @param desiredRunning the direction of the attempts
   * @param attempts       the number of failed attempts, at least 1
   * @param lastAttemptAt  the last failure time, never null
   */
  public ServiceFailure {
    if (attempts < 1) {
      throw new IllegalArgumentException(
          "attempts must be at least 1, got: " + attempts);
    }
    Objects.requireNonNull(lastAttemptAt, "lastAttemptAt must not be null");
  }

  /**
   * Records the first failure in the given direction.
   *
   * @param desiredRunning the direction of the attempt
   * @param at             when the attempt failed, never null
   *
   * @return a new failure record with one attempt, never null
   */
  public static ServiceFailure first(final boolean desiredRunning,
      final Instant at) {
    return new ServiceFailure(desiredRunning, 1, at);
  }

  /**
   * Records one more failure in the same direction.
   *
   * @param at when the attempt failed, never null
   *
   * @return a new failure record with one more attempt, never null
   */
  public ServiceFailure next(final Instant at) {
    return new ServiceFailure(desiredRunning, attempts + 1, at);
  }
}
