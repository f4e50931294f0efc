package org.waabox.rolemon.state;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * What the role monitor confirmed as applied on this node.
 *
 * <p>The state only ever reflects observed outcomes, never intentions: a
 * service is listed as started only after the service manager confirmed it
 * runs, and a descriptor fingerprint is only recorded after the descriptor
 * was written. It is the baseline every cycle diffs the desired state
 * against.
 *
 * <p>{@link #empty()} means "nothing applied yet" and forces a full resync.
 *
 * @param rolesHash          the hash of the roles last reconciled, or null
 * @param servicesStarted    services confirmed running, never null
 * @param servicesStopped    services confirmed stopped, never null
 * @param publishedHostname  the hostname the descriptor was last published
 *                           under, or null when none is published
 * @param targetFileHash     the fingerprint of the published descriptor,
 *                           {@link #NO_TARGETS} when its absence is
 *                           confirmed, or null when unknown
 * @param pendingRetractions stale hostnames whose descriptor still has to
 *                           be removed, never null
 * @param serviceFailures    consecutive failures per service, never null
 * @param verifiedAt         when service states were last verified by
 *                           direct query, or null
 * @param updatedAt          when the state last changed, or null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record AppliedState(
    String rolesHash,
    Set<String> servicesStarted,
    Set<String> servicesStopped,
    String publishedHostname,
    String targetFileHash,
    Set<String> pendingRetractions,
    Map<String, ServiceFailure> serviceFailures,
    Instant verifiedAt,
    Instant updatedAt) {

  /** Fingerprint recorded once the absence of the descriptor is confirmed. */
  public static final String NO_TARGETS = "none";

  /** The state of a node where nothing was applied yet. */
  private static final AppliedState EMPTY = new AppliedState(null, Set.of(),
      Set.of(), null, null, Set.of(), Map.of(), null, null);

  /**
   * Creates a new state, copying the collections into sorted unmodifiable
   * views.
   */
  public AppliedState {
    servicesStarted = sortedCopy(servicesStarted);
    servicesStopped = sortedCopy(servicesStopped);
    pendingRetractions = sortedCopy(pendingRetractions);
    Objects.requireNonNull(serviceFailures,
        "serviceFailures must not be null");
    final SortedMap<String, ServiceFailure> failures =
        new TreeMap<>(serviceFailures);
    serviceFailures = Collections.unmodifiableSortedMap(failures);
  }

  /**
   * Returns the state of a node where nothing was applied yet.
   *
   * @return the empty state, never null
   */
  public static AppliedState empty() {
    return EMPTY;
  }

  /**
   * Whether this state carries nothing, as after a first start or after the
   * state file was deleted.
   *
   * @return true if nothing was applied yet
   */
  public boolean isEmpty() {
    return sameContentAs(EMPTY);
  }

  /**
   * Compares two states ignoring {@link #updatedAt()}.
   *
   * @param other the state to compare with, never null
   *
   * @return true if both states record the same applied outcome
   */
  public boolean sameContentAs(final AppliedState other) {
    return Objects.equals(rolesHash, other.rolesHash)
        && servicesStarted.equals(other.servicesStarted)
        && servicesStopped.equals(other.servicesStopped)
        && Objects.equals(publishedHostname, other.publishedHostname)
        && Objects.equals(targetFileHash, other.targetFileHash)
        && pendingRetractions.equals(other.pendingRetractions)
        && serviceFailures.equals(other.serviceFailures)
        && Objects.equals(verifiedAt, other.verifiedAt);
  }

  /**
   * Returns a copy of this state with a new update timestamp.
   *
   * @param at the update time, never null
   *
   * @return the stamped copy, never null
   */
  public AppliedState stamped(final Instant at) {
    return new AppliedState(rolesHash, servicesStarted, servicesStopped,
        publishedHostname, targetFileHash, pendingRetractions,
        serviceFailures, verifiedAt, at);
  }

  private static SortedSet<String> sortedCopy(final Set<String> source) {
    Objects.requireNonNull(source, "set must not be null");
    return Collections.unmodifiableSortedSet(new TreeSet<>(source));
  }
}
