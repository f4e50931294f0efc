package org.waabox.rolemon.discovery;

import java.util.Optional;
import java.util.Set;

/**
 * Publishes the scrape targets of a node into a store shared by all nodes.
 *
 * <p>Each node owns exactly one descriptor, named after its hostname.
 * Safety across nodes relies on every node writing only its own descriptor
 * and on each write becoming visible atomically; there is no cross-node
 * locking.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface DiscoveryPublisher {

  /**
   * Writes the descriptor of the given host, replacing any previous one.
   *
   * <p>Readers observe either the previous descriptor or the new one, never
   * a partial write.
   *
   * @param hostname the owner of the descriptor, never null
   * @param targets  the targets to advertise, never null nor empty
   *
   * @throws DiscoveryWriteException if the descriptor could not be written
   */
  void publish(String hostname, Set<TargetSpec> targets);

  /**
   * Removes the descriptor of the given host.
   *
   * <p>Removing a descriptor that does not exist succeeds.
   *
   * @param hostname the owner of the descriptor, never null
   *
   * @throws DiscoveryWriteException if the descriptor could not be removed
   */
  void retract(String hostname);

  /**
   * Computes the fingerprint of the descriptor these targets render to.
   *
   * @param targets the targets, never null
   *
   * @return a stable content hash, never null
   */
  String fingerprint(Set<TargetSpec> targets);

  /**
   * Returns the fingerprint of the descriptor currently published for the
   * given host, without modifying it.
   *
   * @param hostname the owner of the descriptor, never null
   *
   * @return the fingerprint, or empty when no readable descriptor exists
   */
  Optional<String> currentFingerprint(String hostname);
}
