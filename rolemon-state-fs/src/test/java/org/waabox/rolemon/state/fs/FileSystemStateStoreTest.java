package org.waabox.rolemon.state.fs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.waabox.rolemon.state.AppliedState;
import org.waabox.rolemon.state.StateWriteException;

/**
 * Tests for {@link FileSystemStateStore}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class FileSystemStateStoreTest {

  private static AppliedState sample() {
    return new AppliedState("abc", Set.of("node_exporter"),
        Set.of("dcgm-exporter"), "gpu01", "def", Set.of(), Map.of(),
        Instant.parse("2026-01-15T10:00:00Z"),
        Instant.parse("2026-01-15T10:30:00Z"));
  }

  @Test
  void whenSavingAndLoading_givenState_shouldReturnEqualState(
      @TempDir final Path tempDir) {
    final FileSystemStateStore store =
        new FileSystemStateStore(tempDir.resolve("state.json"));

    store.save(sample());

    assertEquals(sample(), store.load());
  }

  @Test
  void whenSaving_givenExistingState_shouldOverwriteAndLeaveNoTempFile(
      @TempDir final Path tempDir) throws Exception {
    final FileSystemStateStore store =
        new FileSystemStateStore(tempDir.resolve("state.json"));
    store.save(AppliedState.empty());

    store.save(sample());

    assertEquals(sample(), store.load());
    assertFalse(Files.exists(tempDir.resolve("state.json.tmp")));
  }

  @Test
  void whenLoading_givenNoFile_shouldReturnEmptyState(
      @TempDir final Path tempDir) {
    final FileSystemStateStore store =
        new FileSystemStateStore(tempDir.resolve("state.json"));

    assertTrue(store.load().isEmpty());
  }

  @Test
  void whenLoading_givenCorruptFile_shouldReturnEmptyState(
      @TempDir final Path tempDir) throws Exception {
    final Path file = tempDir.resolve("state.json");
    Files.writeString(file, "{\"version\":1,\"servicesStarted\":[\"node_");
    final FileSystemStateStore store = new FileSystemStateStore(file);

    assertTrue(store.load().isEmpty());
  }

  @Test
  void whenLoading_givenDeletedFile_shouldReturnEmptyState(
      @TempDir final Path tempDir) throws Exception {
    final FileSystemStateStore store =
        new FileSystemStateStore(tempDir.resolve("state.json"));
    store.save(sample());

    Files.delete(store.file());

    assertTrue(store.load().isEmpty());
  }

  @Test
  void whenCreating_givenMissingParent_shouldCreateIt(
      @TempDir final Path tempDir) {
    final Path file = tempDir.resolve("var").resolve("lib")
        .resolve("state.json");

    new FileSystemStateStore(file).save(sample());

    assertTrue(Files.exists(file));
  }

  @Test
  void whenCreating_givenParentIsAFile_shouldThrow(
      @TempDir final Path tempDir) throws Exception {
    final Path blocker = Files.createFile(tempDir.resolve("blocker"));

    assertThrows(UncheckedIOException.class,
        () -> new FileSystemStateStore(blocker.resolve("state.json")));
  }

  @Test
  void whenSaving_givenFileIsADirectory_shouldThrow(
      @TempDir final Path tempDir) throws Exception {
    final Path file = Files.createDirectory(tempDir.resolve("state.json"));
    Files.createFile(file.resolve("keep"));
    final FileSystemStateStore store = new FileSystemStateStore(file);

    assertThrows(StateWriteException.class, () -> store.save(sample()));
  }
}
