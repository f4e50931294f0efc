package org.waabox.rolemon.discovery;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link TargetSpec}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class TargetSpecTest {

  @Test
  void whenSorting_shouldOrderByJobThenEndpoint() {
    final TargetSpec node = new TargetSpec("n1", 9100, "node_exporter",
        Map.of());
    final TargetSpec dcgmB = new TargetSpec("n2", 9400, "dcgm_exporter",
        Map.of());
    final TargetSpec dcgmA = new TargetSpec("n1", 9400, "dcgm_exporter",
        Map.of());

    assertEquals(List.of(dcgmA, dcgmB, node),
        List.copyOf(new TreeSet<>(List.of(node, dcgmB, dcgmA))));
  }

  @Test
  void whenCreating_givenJobLabel_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        new TargetSpec("n1", 9100, "node", Map.of("job", "other")));
  }

  @Test
  void whenCreating_givenPortZero_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        new TargetSpec("n1", 0, "node", Map.of()));
  }

  @Test
  void whenFormattingEndpoint_shouldJoinAddressAndPort() {
    assertEquals("gpu01:9400",
        new TargetSpec("gpu01", 9400, "dcgm", Map.of()).endpoint());
  }
}
