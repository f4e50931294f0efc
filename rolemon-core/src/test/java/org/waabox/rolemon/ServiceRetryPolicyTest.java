package org.waabox.rolemon;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.Test;
import org.waabox.rolemon.state.ServiceFailure;

/**
 * Tests for {@link ServiceRetryPolicy}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ServiceRetryPolicyTest {

  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

  private final ServiceRetryPolicy policy = ServiceRetryPolicy.of(2,
      Duration.ofMinutes(10));

  @Test
  void whenChecking_givenFewerFailuresThanMax_shouldAttempt() {
    assertTrue(policy.shouldAttempt(ServiceFailure.first(true, T0), T0));
  }

  @Test
  void whenChecking_givenMaxFailuresWithinCooldown_shouldNotAttempt() {
    final ServiceFailure failure = ServiceFailure.first(true, T0).next(T0);

    assertFalse(policy.shouldAttempt(failure,
        T0.plus(Duration.ofMinutes(9))));
  }

  @Test
  void whenChecking_givenMaxFailuresAfterCooldown_shouldAttempt() {
    final ServiceFailure failure = ServiceFailure.first(true, T0).next(T0);

    assertTrue(policy.shouldAttempt(failure,
        T0.plus(Duration.ofMinutes(10))));
  }

  @Test
  void whenUsingDefault_shouldHaveReasonableValues() {
    final ServiceRetryPolicy defaults = ServiceRetryPolicy.defaultPolicy();

    assertEquals(3, defaults.maxAttempts());
    assertEquals(Duration.ofMinutes(10), defaults.cooldown());
  }

  @Test
  void whenCreating_givenZeroAttempts_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        ServiceRetryPolicy.of(0, Duration.ofMinutes(1)));
  }
}
