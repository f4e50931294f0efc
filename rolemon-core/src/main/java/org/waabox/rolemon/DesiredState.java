package org.waabox.rolemon;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import org.waabox.rolemon.discovery.TargetSpec;

/**
 * The state the node should be in, derived from its current roles.
 *
 * @param services       the names of the services that should run, never
 *                       null
 * @param publishTargets the scrape targets that should be advertised,
 *                       never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record DesiredState(Set<String> services,
    Set<TargetSpec> publishTargets) {

  /** Nothing runs, nothing is advertised. */
  private static final DesiredState NONE = new DesiredState(Set.of(),
      Set.of());

  /** Copies both sets into sorted unmodifiable views. */
  public DesiredState {
    Objects.requireNonNull(services, "services must not be null");
    Objects.requireNonNull(publishTargets, "publishTargets must not be null");
    services = Collections.unmodifiableSortedSet(new TreeSet<>(services));
    publishTargets = Collections.unmodifiableSortedSet(
        new TreeSet<>(publishTargets));
  }

  /**
   * Returns the state with no service and no target.
   *
   * @return the empty desired state, never null
   */
  public static DesiredState none() {
    return NONE;
  }
}
