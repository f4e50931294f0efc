package org.waabox.rolemon;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the short hostname of the local node.
 *
 * <p>The cluster manager lists devices by short hostname, and the
 * discovery descriptor is named after it, so the domain part is dropped.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class LocalHostname {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      LocalHostname.class);

  /** Where the kernel exposes the node name. */
  private static final Path KERNEL_HOSTNAME = Paths.get(
      "/proc/sys/kernel/hostname");

  private LocalHostname() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Returns the short hostname of this node.
   *
   * <p>Reads the kernel node name first, which needs no name resolution.
   * Falls back to the resolved local host name, then to the
   * {@code HOSTNAME} environment variable.
   *
   * @return the short hostname, never null
   *
   * @throws IllegalStateException if no hostname can be determined
   */
  public static String shortName() {
    return shortName(KERNEL_HOSTNAME);
  }

  /**
   * Returns the short hostname of this node, reading the kernel node name
   * from the given file.
   *
   * @param kernelHostname the file holding the kernel node name, never null
   *
   * @return the short hostname, never null
   *
   * @throws IllegalStateException if no hostname can be determined
   */
  static String shortName(final Path kernelHostname) {
    try {
      final String name = Files.readString(kernelHostname,
          StandardCharsets.UTF_8).trim();
      if (!name.isEmpty()) {
        return shorten(name);
      }
    } catch (final IOException e) {
      log.debug("Cannot read {}: {}", kernelHostname, e.getMessage());
    }
    String name;
    try {
      name = InetAddress.getLocalHost().getHostName();
    } catch (final UnknownHostException e) {
      name = System.getenv("HOSTNAME");
      if (name == null || name.isBlank()) {
        throw new IllegalStateException("Cannot determine local hostname", e);
      }
    }
    return shorten(name);
  }

  /**
   * Drops the domain part of a host name.
   *
   * @param hostname the host name, never null
   *
   * @return the first label of the host name, never null
   */
  public static String shorten(final String hostname) {
    final String trimmed = hostname.trim();
    final int dot = trimmed.indexOf('.');
    return dot < 0 ? trimmed : trimmed.substring(0, dot);
  }
}
