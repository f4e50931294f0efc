package org.waabox.rolemon.discovery.fs;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.rolemon.Hashes;
import org.waabox.rolemon.discovery.DiscoveryPublisher;
import org.waabox.rolemon.discovery.DiscoveryWriteException;
import org.waabox.rolemon.discovery.TargetSpec;

/**
 * A {@link DiscoveryPublisher} writing one descriptor per node into a
 * directory shared by every node.
 *
 * <p>Each node only ever writes {@code {dir}/{hostname}.json}, so nodes
 * never write the same file and no locking is needed.
 *
 * <p>Writes use an atomic pattern: the descriptor is written to a hidden
 * temporary file in the same directory, then renamed over the final name.
 * A scraper listing the directory sees either the previous descriptor or
 * the new one, never a partial file, and ignores the hidden temporary file.
 *
 * <p>Storage layout:
 * <pre>
 * {dir}/
 *   gpu01.json
 *   gpu02.json
 * </pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FileSystemDiscoveryPublisher implements DiscoveryPublisher {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(FileSystemDiscoveryPublisher.class);

  /** The descriptor file extension. */
  private static final String EXTENSION = ".json";

  /** Host names usable as a single file name. */
  private static final Pattern SAFE_HOSTNAME = Pattern.compile(
      "[A-Za-z0-9][A-Za-z0-9_.-]{0,252}");

  /** Descriptors are readable by the scraper. */
  private static final Set<PosixFilePermission> DESCRIPTOR_PERMISSIONS =
      PosixFilePermissions.fromString("rw-r--r--");

  /** The shared directory. */
  private final Path dir;

  /**
   * Creates a new publisher writing into the given directory.
   *
   * <p>The directory is created if missing. Failing to create it is only
   * logged: shared storage may be mounted later, and every write reports
   * its own failure.
   *
   * @param theDir the shared directory, never null
   */
  public FileSystemDiscoveryPublisher(final Path theDir) {
    dir = Objects.requireNonNull(theDir, "dir must not be null");
    try {
      Files.createDirectories(dir);
    } catch (final IOException e) {
      log.warn("Cannot create discovery directory {}: {}", dir,
          e.toString());
    }
  }

  /**
   * Returns the descriptor file of the given node.
   *
   * @param hostname the node hostname, never null
   *
   * @return the descriptor path, never null
   *
   * @throws DiscoveryWriteException if the hostname is not a safe file name
   */
  public Path fileOf(final String hostname) {
    Objects.requireNonNull(hostname, "hostname must not be null");
    if (!SAFE_HOSTNAME.matcher(hostname).matches()
        || hostname.contains("..")) {
      throw new DiscoveryWriteException("Hostname '" + hostname
          + "' cannot be used as a descriptor file name");
    }
    return dir.resolve(hostname + EXTENSION);
  }

  /** {@inheritDoc} */
  @Override
  public void publish(final String hostname, final Set<TargetSpec> targets) {
    Objects.requireNonNull(targets, "targets must not be null");
    final Path file = fileOf(hostname);
    final byte[] content = TargetFileCodec.encode(targets);

    Path temp = null;
    try {
      Files.createDirectories(dir);
      temp = Files.createTempFile(dir, "." + hostname + ".", ".tmp");
      Files.write(temp, content);
      makeReadable(temp);
      Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE,
          StandardCopyOption.REPLACE_EXISTING);
      temp = null;
      log.debug("Wrote {} targets to {}", targets.size(), file);
    } catch (final AtomicMoveNotSupportedException e) {
      throw new DiscoveryWriteException("Directory " + dir
          + " does not support atomic renames", e);
    } catch (final IOException e) {
      throw new DiscoveryWriteException("Failed to write descriptor " + file,
          e);
    } finally {
      if (temp != null) {
        deleteQuietly(temp);
      }
    }
  }

  /** {@inheritDoc} */
  @Override
  public void retract(final String hostname) {
    final Path file = fileOf(hostname);
    try {
      if (Files.deleteIfExists(file)) {
        log.debug("Deleted descriptor {}", file);
      }
    } catch (final IOException e) {
      throw new DiscoveryWriteException("Failed to delete descriptor " + file,
          e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public String fingerprint(final Set<TargetSpec> targets) {
    return Hashes.sha256(TargetFileCodec.encode(targets));
  }

  /** {@inheritDoc} */
  @Override
  public Optional<String> currentFingerprint(final String hostname) {
    final Path file;
    try {
      file = fileOf(hostname);
    } catch (final DiscoveryWriteException e) {
      log.warn("No descriptor can exist for {}: {}", hostname,
          e.getMessage());
      return Optional.empty();
    }
    try {
      return Optional.of(Hashes.sha256(Files.readAllBytes(file)));
    } catch (final NoSuchFileException e) {
      return Optional.empty();
    } catch (final IOException e) {
      log.warn("Cannot read descriptor {}, treating it as missing: {}", file,
          e.toString());
      return Optional.empty();
    }
  }

  private static void makeReadable(final Path file) throws IOException {
    try {
      Files.setPosixFilePermissions(file, DESCRIPTOR_PERMISSIONS);
    } catch (final UnsupportedOperationException e) {
      log.debug("{} does not support POSIX permissions", file);
    }
  }

  private static void deleteQuietly(final Path temp) {
    try {
      Files.deleteIfExists(temp);
    } catch (final IOException e) {
      log.warn("Cannot delete temporary descriptor {}: {}", temp,
          e.toString());
    }
  }
}
