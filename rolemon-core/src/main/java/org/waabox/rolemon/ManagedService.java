package org.waabox.rolemon;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * A local service the role monitor starts and stops.
 *
 * <p>A service with a port is also advertised as a scrape target under its
 * job label; a service without one is only started and stopped.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ManagedService {

  /** The service unit name, never null. */
  private final String name;

  /** The exporter port, or 0 when the service is not a scrape target. */
  private final int port;

  /** The job label for the scrape target, never null. */
  private final String job;

  /** Extra labels added to the scrape target, never null. */
  private final Map<String, String> labels;

  private ManagedService(final String theName, final int thePort,
      final String theJob, final Map<String, String> theLabels) {
    name = theName;
    port = thePort;
    job = theJob;
    labels = theLabels;
  }

  /**
   * Creates a service that is also a scrape target.
   *
   * @param name the unit name, never null nor blank
   * @param port the exporter port, between 1 and 65535
   * @param job  the job label, never null nor blank
   *
   * @return a new managed service, never null
   */
  public static ManagedService exporter(final String name, final int port,
      final String job) {
    return exporter(name, port, job, Map.of());
  }

  /**
   * Creates a service that is also a scrape target, with extra labels.
   *
   * @param name   the unit name, never null nor blank
   * @param port   the exporter port, between 1 and 65535
   * @param job    the job label, never null nor blank
   * @param labels extra target labels, never null
   *
   * @return a new managed service, never null
   *
   * @throws IllegalArgumentException if a field is invalid
   */
  public static ManagedService exporter(final String name, final int port,
      final String job, final Map<String, String> labels) {
    requireText(name, "name");
    requireText(job, "job");
    Objects.requireNonNull(labels, "labels must not be null");
    if (labels.containsKey("job")) {
      throw new IllegalArgumentException(
          "service '" + name + "' sets the job label through its labels");
    }
    if (port < 1 || port > 65535) {
      throw new IllegalArgumentException(
          "port of service '" + name + "' out of range: " + port);
    }
    return new ManagedService(name, port, job,
        Collections.unmodifiableMap(new TreeMap<>(labels)));
  }

  /**
   * Creates a service that is only started and stopped.
   *
   * @param name the unit name, never null nor blank
   *
   * @return a new managed service, never null
   */
  public static ManagedService unit(final String name) {
    requireText(name, "name");
    return new ManagedService(name, 0, name, Map.of());
  }

  public String name() {
    return name;
  }

  /**
   * Returns the exporter port.
   *
   * @return the port, or empty when the service is not a scrape target
   */
  public OptionalInt port() {
    return port == 0 ? OptionalInt.empty() : OptionalInt.of(port);
  }

  public String job() {
    return job;
  }

  public Map<String, String> labels() {
    return labels;
  }

  private static void requireText(final String value, final String field) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(field + " must not be blank");
    }
  }

  @Override
  public boolean equals(final Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof ManagedService)) {
      return false;
    }
    final ManagedService that = (ManagedService) other;
    return port == that.port && name.equals(that.name)
        && job.equals(that.job) && labels.equals(that.labels);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, port, job, labels);
  }

  @Override
  public String toString() {
    return port == 0 ? name : name + ":" + port + " (" + job + ")";
  }
}
