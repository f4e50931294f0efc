package org.waabox.rolemon;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * Capped exponential backoff with jitter, used between failed role fetches.
 *
 * <p>The delay of attempt {@code n} (0-based) is
 * {@code min(max, initial * 2^n) + uniform(0, jitter)}. The jitter keeps
 * the nodes of a cluster from retrying in lockstep after they all lost the
 * cluster manager at once.
 *
 * <p>Instances are created through static factory methods. The default
 * policy starts at 5 seconds, caps at 5 minutes and adds up to 5 seconds of
 * jitter.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class BackoffPolicy {

  /** The default first delay. */
  private static final Duration DEFAULT_INITIAL = Duration.ofSeconds(5);

  /** The default delay cap. */
  private static final Duration DEFAULT_MAX = Duration.ofMinutes(5);

  /** The default jitter bound. */
  private static final Duration DEFAULT_JITTER = Duration.ofSeconds(5);

  /** Keeps {@code 2^n} from overflowing. */
  private static final int MAX_EXPONENT = 20;

  /** The delay of the first retry, without jitter. */
  private final Duration initial;

  /** The delay cap, without jitter. */
  private final Duration max;

  /** The upper bound of the random delay added to each retry. */
  private final Duration jitter;

  /** The jitter source. */
  private final Random random;

  private BackoffPolicy(final Duration theInitial, final Duration theMax,
      final Duration theJitter, final Random theRandom) {
    initial = theInitial;
    max = theMax;
    jitter = theJitter;
    random = theRandom;
  }

  /**
   * Creates a backoff policy.
   *
   * @param initial the first delay, must be positive
   * @param max     the delay cap, must not be lower than initial
   * @param jitter  the jitter bound, must not be negative
   *
   * @return a new policy, never null
   *
   * @throws IllegalArgumentException if a duration is out of range
   * @throws NullPointerException if a duration is null
   */
  public static BackoffPolicy of(final Duration initial, final Duration max,
      final Duration jitter) {
    return of(initial, max, jitter, new Random());
  }

  /**
   * Creates a backoff policy drawing its jitter from the given source.
   *
   * @param initial the first delay, must be positive
   * @param max     the delay cap, must not be lower than initial
   * @param jitter  the jitter bound, must not be negative
   * @param random  the jitter source, never null
   *
   * @return a new policy, never null
   */
  public static BackoffPolicy of(final Duration initial, final Duration max,
      final Duration jitter, final Random random) {
    Objects.requireNonNull(initial, "initial must not be null");
    Objects.requireNonNull(max, "max must not be null");
    Objects.requireNonNull(jitter, "jitter must not be null");
    Objects.requireNonNull(random, "random must not be null");
    if (initial.isNegative() || initial.isZero()) {
      throw new IllegalArgumentException(
          "initial must be positive, got: " + initial);
    }
    if (max.compareTo(initial) < 0) {
      throw new IllegalArgumentException(
          "max must not be lower than initial, got: " + max);
    }
    if (jitter.isNegative()) {
      throw new IllegalArgumentException(
          "jitter must not be negative, got: " + jitter);
    }
    return new BackoffPolicy(initial, max, jitter, random);
  }

  /**
   * Creates a backoff policy with the defaults: 5 seconds initial,
   * 5 minutes cap, 5 seconds jitter.
   *
   * @return the default policy, never null
   */
  public static BackoffPolicy defaultPolicy() {
    return of(DEFAULT_INITIAL, DEFAULT_MAX, DEFAULT_JITTER);
  }

  /**
   * Computes the delay before the given retry.
   *
   * @param attempt the 0-based number of failures so far minus one
   *
   * @return the delay, never null
   */
  public Duration delay(final int attempt) {
    final int exponent = Math.min(Math.max(attempt, 0), MAX_EXPONENT);
    final long expMs = initial.toMillis() * (1L << exponent);
    final long cappedMs = Math.min(expMs, max.toMillis());
    final long jitterMs = jitter.isZero()
        ? 0L
        : (long) (random.nextDouble() * (jitter.toMillis() + 1));
    return Duration.ofMillis(cappedMs + jitterMs);
  }

  public Duration initial() {
    return initial;
  }

  public Duration max() {
    return max;
  }

  public Duration jitter() {
    return jitter;
  }
}
