package org.waabox.rolemon.state.fs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.waabox.rolemon.state.AppliedState;
import org.waabox.rolemon.state.ServiceFailure;

/**
 * Tests for {@link AppliedStateCodec}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class AppliedStateCodecTest {

  @Test
  void whenSerializing_givenFullState_shouldReadBackSameState() {
    final Instant at = Instant.parse("2026-03-01T10:15:30Z");
    final AppliedState state = new AppliedState("abc",
        Set.of("node_exporter", "dcgm-exporter"), Set.of("cgroup_exporter"),
        "gpu01", "def", Set.of("gpu01-old"),
        Map.of("nvidia_gpu_exporter", new ServiceFailure(true, 2, at)),
        at, at.plusSeconds(5));

    final AppliedState read = AppliedStateCodec.deserialize(
        AppliedStateCodec.serialize(state));

    assertEquals(state, read);
  }

  @Test
  void whenSerializing_givenEmptyState_shouldReadBackEmptyState() {
    final AppliedState read = AppliedStateCodec.deserialize(
        AppliedStateCodec.serialize(AppliedState.empty()));

    assertTrue(read.isEmpty());
    assertNull(read.targetFileHash());
    assertNull(read.updatedAt());
  }

  @Test
  void whenDeserializing_givenMissingCollections_shouldReadThemAsEmpty() {
    final AppliedState read = AppliedStateCodec.deserialize(
        "{\"version\":1,\"rolesHash\":\"abc\"}");

    assertEquals("abc", read.rolesHash());
    assertTrue(read.servicesStarted().isEmpty());
    assertTrue(read.serviceFailures().isEmpty());
  }

  @Test
  void whenDeserializing_givenTruncatedJson_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        AppliedStateCodec.deserialize("{\"version\":1,\"rolesHash\":"));
  }

  @Test
  void whenDeserializing_givenOtherVersion_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        AppliedStateCodec.deserialize("{\"version\":7}"));
  }

  @Test
  void whenDeserializing_givenInvalidFailureCount_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        AppliedStateCodec.deserialize("{\"version\":1,\"serviceFailures\":"
            + "{\"x\":{\"desiredRunning\":true,\"attempts\":0,"
            + "\"lastAttemptAt\":\"2026-03-01T10:15:30Z\"}}}"));
  }
}
