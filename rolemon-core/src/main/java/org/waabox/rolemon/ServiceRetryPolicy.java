package org.waabox.rolemon;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

import org.waabox.rolemon.state.ServiceFailure;

/**
 * Decides when a service that failed to reach its desired state is tried
 * again.
 *
 * <p>A failed service is retried on every cycle until it has failed
 * {@code maxAttempts} times in a row; from then on it is retried at most
 * once per {@code cooldown}, so a broken unit does not hammer the service
 * manager every poll interval.
 *
 * <p>The default policy uses 3 attempts and a 10 minute cooldown. This
 * class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ServiceRetryPolicy {

  /** The default number of attempts before cooling down. */
  private static final int DEFAULT_MAX_ATTEMPTS = 3;

  /** The default cooldown. */
  private static final Duration DEFAULT_COOLDOWN = Duration.ofMinutes(10);

  /** The number of consecutive attempts made on every cycle. */
  private final int maxAttempts;

  /** The spacing of attempts once maxAttempts is reached. */
  private final Duration cooldown;

  private ServiceRetryPolicy(final int theMaxAttempts,
      final Duration theCooldown) {
    maxAttempts = theMaxAttempts;
    cooldown = theCooldown;
  }

  /**
   * Creates a retry policy with the given parameters.
   *
   * @param maxAttempts the attempts made on consecutive cycles, must be
   *                    greater than zero
   * @param cooldown    the spacing of later attempts, never null nor
   *                    negative
   *
   * @return a new retry policy, never null
   *
   * @throws IllegalArgumentException if a parameter is out of range
   * @throws NullPointerException if cooldown is null
   */
  public static ServiceRetryPolicy of(final int maxAttempts,
      final Duration cooldown) {
    if (maxAttempts <= 0) {
      throw new IllegalArgumentException(
          "maxAttempts must be greater than 0, got: " + maxAttempts);
    }
    Objects.requireNonNull(cooldown, "cooldown must not be null");
    if (cooldown.isNegative()) {
      throw new IllegalArgumentException(
          "cooldown must not be negative, got: " + cooldown);
    }
    return new ServiceRetryPolicy(maxAttempts, cooldown);
  }

  /**
   * Creates a retry policy with the defaults: 3 attempts, then one attempt
   * every 10 minutes.
   *
   * @return the default retry policy, never null
   */
  public static ServiceRetryPolicy defaultPolicy() {
    return new ServiceRetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_COOLDOWN);
  }

  /**
   * Whether a service with the given failure history should be tried now.
   *
   * @param failure the failure history, never null
   * @param now     the current time, never null
   *
   * @return true if the service should be tried in this cycle
   */
  public boolean shouldAttempt(final ServiceFailure failure,
      final Instant now) {
    if (failure.attempts() < maxAttempts) {
      return true;
    }
    return !now.isBefore(failure.lastAttemptAt().plus(cooldown));
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  public Duration cooldown() {
    return cooldown;
  }
}
