package org.waabox.rolemon;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link RoleMapping}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class RoleMappingTest {

  @Test
  void whenUsingDefaults_shouldMapComputeClientToFourExporters() {
    final RoleMapping mapping = RoleMapping.defaults();

    assertEquals(Set.of(RoleMapping.COMPUTE_CLIENT_ROLE), mapping.roles());
    assertEquals(Set.of("node_exporter", "cgroup_exporter",
        "nvidia_gpu_exporter", "dcgm-exporter"),
        mapping.managedServices().keySet());
    assertEquals(9445, mapping.managedServices().get("nvidia_gpu_exporter")
        .port().getAsInt());
  }

  @Test
  void whenLookingUp_givenUnknownRole_shouldReturnNoServices() {
    assertTrue(RoleMapping.defaults().servicesFor("storage").isEmpty());
  }

  @Test
  void whenBuilding_givenSameRoleTwice_shouldThrow() {
    final RoleMapping.Builder builder = RoleMapping.builder()
        .role("compute", ManagedService.unit("a"));

    assertThrows(IllegalArgumentException.class, () ->
        builder.role("COMPUTE", ManagedService.unit("b")));
  }

  @Test
  void whenBuilding_givenConflictingServiceDefinitions_shouldThrow() {
    final RoleMapping.Builder builder = RoleMapping.builder()
        .role("a", ManagedService.exporter("node_exporter", 9100, "node"))
        .role("b", ManagedService.exporter("node_exporter", 9101, "node"));

    assertThrows(IllegalArgumentException.class, builder::build);
  }

  @Test
  void whenBuilding_givenSharedService_shouldListItOnce() {
    final ManagedService node = ManagedService.exporter("node_exporter",
        9100, "node");
    final RoleMapping mapping = RoleMapping.builder()
        .role("a", List.of(node))
        .role("b", List.of(node))
        .build();

    assertEquals(1, mapping.managedServices().size());
  }

  @Test
  void whenCreatingExporter_givenJobLabel_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        ManagedService.exporter("x", 9100, "x", Map.of("job", "y")));
  }

  @Test
  void whenCreatingExporter_givenPortOutOfRange_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        ManagedService.exporter("x", 70000, "x"));
  }
}
