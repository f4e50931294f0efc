package org.waabox.rolemon.state;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link AppliedState}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class AppliedStateTest {

  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

  private static AppliedState sample() {
    return new AppliedState("abc", Set.of("node_exporter"), Set.of(),
        "node01", "fp", Set.of(), Map.of(), T0, T0);
  }

  @Test
  void whenComparing_givenOnlyTimestampDiffers_shouldHaveSameContent() {
    final AppliedState state = sample();

    assertTrue(state.sameContentAs(state.stamped(T0.plusSeconds(60))));
  }

  @Test
  void whenComparing_givenDifferentServices_shouldDiffer() {
    final AppliedState other = new AppliedState("abc", Set.of(), Set.of(),
        "node01", "fp", Set.of(), Map.of(), T0, T0);

    assertFalse(sample().sameContentAs(other));
  }

  @Test
  void whenCheckingEmpty_givenEmptyState_shouldBeEmpty() {
    assertTrue(AppliedState.empty().isEmpty());
    assertFalse(sample().isEmpty());
  }

  @Test
  void whenModifyingServices_shouldThrow() {
    assertThrows(UnsupportedOperationException.class, () ->
        sample().servicesStarted().add("x"));
  }

  @Test
  void whenCountingFailures_shouldIncrementAttempts() {
    final ServiceFailure failure = ServiceFailure.first(true, T0)
        .next(T0.plusSeconds(30));

    assertEquals(2, failure.attempts());
    assertTrue(failure.desiredRunning());
    assertEquals(T0.plusSeconds(30), failure.lastAttemptAt());
  }
}
