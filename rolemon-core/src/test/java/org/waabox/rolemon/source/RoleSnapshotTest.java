package org.waabox.rolemon.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link RoleSnapshot}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class RoleSnapshotTest {

  @Test
  void whenCreating_givenMixedCaseRoles_shouldNormalize() {
    final Set<String> raw = new HashSet<>(List.of("SlurmClient", " gpu ",
        "", "slurmclient"));

    final RoleSnapshot snapshot = new RoleSnapshot(raw, "node01",
        Instant.EPOCH);

    assertEquals(Set.of("slurmclient", "gpu"), snapshot.roles());
  }

  @Test
  void whenCreating_givenNullRoles_shouldThrow() {
    assertThrows(NullPointerException.class, () ->
        new RoleSnapshot(null, "node01", Instant.EPOCH));
  }
}
