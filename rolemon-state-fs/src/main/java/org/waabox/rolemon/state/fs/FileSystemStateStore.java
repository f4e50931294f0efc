package org.waabox.rolemon.state.fs;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.rolemon.state.AppliedState;
import org.waabox.rolemon.state.StateStore;
import org.waabox.rolemon.state.StateWriteException;

/**
 * A {@link StateStore} keeping the applied state in one JSON file on
 * node-local storage.
 *
 * <p>Writes use an atomic pattern: the state is first written to a
 * temporary file next to the target, then atomically moved over it, so a
 * crash leaves either the previous state or the new one.
 *
 * <p>Deleting the file is the supported way to force a full resync.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FileSystemStateStore implements StateStore {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(FileSystemStateStore.class);

  /** The state file. */
  private final Path file;

  /**
   * Creates a new store using the given file.
   *
   * <p>The parent directory is created if it does not exist.
   *
   * @param theFile the state file, never null
   *
   * @throws UncheckedIOException if the parent directory cannot be created
   */
  public FileSystemStateStore(final Path theFile) {
    Objects.requireNonNull(theFile, "file must not be null");
    file = theFile.toAbsolutePath();
    try {
      Files.createDirectories(file.getParent());
    } catch (final IOException e) {
      throw new UncheckedIOException(
          "Failed to create state directory: " + file.getParent(), e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public AppliedState load() {
    final String json;
    try {
      json = Files.readString(file, StandardCharsets.UTF_8);
    } catch (final NoSuchFileException e) {
      log.info("No state file at {}, starting from an empty state", file);
      return AppliedState.empty();
    } catch (final IOException e) {
      log.warn("Cannot read state file {}, starting from an empty state: {}",
          file, e.toString());
      return AppliedState.empty();
    }

    try {
      return AppliedStateCodec.deserialize(json);
    } catch (final IllegalArgumentException e) {
      log.warn("State file {} is corrupt, starting from an empty state: {}",
          file, e.getMessage());
      return AppliedState.empty();
    }
  }

  /** {@inheritDoc} */
  @Override
  public void save(final AppliedState state) {
    Objects.requireNonNull(state, "state must not be null");

    final Path temp = file.resolveSibling(file.getFileName() + ".tmp");
    try {
      Files.writeString(temp, AppliedStateCodec.serialize(state),
          StandardCharsets.UTF_8);
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING,
          StandardCopyOption.ATOMIC_MOVE);
      log.debug("Saved state to {}", file);
    } catch (final IOException e) {
      deleteTemp(temp);
      throw new StateWriteException("Failed to save state to " + file, e);
    }
  }

  /**
   * Returns the state file.
   *
   * @return the absolute path of the state file, never null
   */
  public Path file() {
    return file;
  }

  private static void deleteTemp(final Path temp) {
    try {
      Files.deleteIfExists(temp);
    } catch (final IOException e) {
      log.warn("Cannot delete temporary state file {}: {}", temp,
          e.toString());
    }
  }
}
