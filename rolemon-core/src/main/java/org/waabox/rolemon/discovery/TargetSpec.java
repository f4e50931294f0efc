package org.waabox.rolemon.discovery;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * One scrape target advertised in the discovery descriptor.
 *
 * <p>Rendered as {@code {"targets": ["address:port"], "labels": {"job":
 * job, ...labels}}}. Auxiliary labels are kept sorted so that equal
 * targets always render to identical bytes.
 *
 * @param address the host name scrapers connect to, never null
 * @param port    the exporter port, between 1 and 65535
 * @param job     the job label, never null
 * @param labels  the auxiliary labels, never null; must not contain
 *                {@code job}
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record TargetSpec(String address, int port, String job,
    Map<String, String> labels) implements Comparable<TargetSpec> {

  /**
   * Creates a new target, validating its fields.
   *
   * @param address the host name scrapers connect to, never null
   * @param port    the exporter port, between 1 and 65535
   * @param job     the job label, never null
   * @param labels  the auxiliary labels, never null
   */
  public TargetSpec {
    Objects.requireNonNull(address, "address must not be null");
    Objects.requireNonNull(job, "job must not be null");
    Objects.requireNonNull(labels, "labels must not be null");
    if (port < 1 || port > 65535) {
      throw new IllegalArgumentException("port out of range: " + port);
    }
    if (labels.containsKey("job")) {
      throw new IllegalArgumentException(
          "the job label is set through the job field, not the labels");
    }
    labels = Collections.unmodifiableMap(new TreeMap<>(labels));
  }

  /**
   * Returns the {@code address:port} form used in the descriptor.
   *
   * @return the target endpoint, never null
   */
  public String endpoint() {
    return address + ":" + port;
  }

  /** Orders targets by job, then endpoint. */
  @Override
  public int compareTo(final TargetSpec other) {
    final int byJob = job.compareTo(other.job);
    if (byJob != 0) {
      return byJob;
    }
    return endpoint().compareTo(other.endpoint());
  }
}
