package org.waabox.rolemon;

import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

import org.waabox.rolemon.discovery.TargetSpec;

/**
 * Maps the roles of a node to the services and targets it should have.
 *
 * <p>The mapping is pure, deterministic and total. The services of every
 * role found in the {@link RoleMapping} are desired; roles missing from the
 * table add nothing, so a node with no known role gets
 * {@link DesiredState#none()}.
 *
 * <p>Each desired service that exposes a port is advertised as one target
 * on the node hostname, labelled with the cluster name and the hostname.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DesiredStateResolver {

  /** The role table, never null. */
  private final RoleMapping mapping;

  /** The value of the {@code cluster} label, never null. */
  private final String clusterName;

  /**
   * Creates a new resolver.
   *
   * @param theMapping     the role table, never null
   * @param theClusterName the cluster label value, never null
   */
  public DesiredStateResolver(final RoleMapping theMapping,
      final String theClusterName) {
    mapping = Objects.requireNonNull(theMapping, "mapping must not be null");
    clusterName = Objects.requireNonNull(theClusterName,
        "clusterName must not be null");
  }

  /**
   * Computes the desired state for the given roles.
   *
   * @param roles    the node roles, never null
   * @param hostname the node hostname used as target address, never null
   *
   * @return the desired state, never null
   */
  public DesiredState resolve(final Set<String> roles, final String hostname) {
    Objects.requireNonNull(roles, "roles must not be null");
    Objects.requireNonNull(hostname, "hostname must not be null");

    final Set<String> services = new HashSet<>();
    final Set<TargetSpec> targets = new HashSet<>();

    for (final String role : roles) {
      for (final ManagedService service : mapping.servicesFor(role)) {
        services.add(service.name());
        service.port().ifPresent(port ->
            targets.add(targetOf(service, port, hostname)));
      }
    }

    if (services.isEmpty()) {
      return DesiredState.none();
    }
    return new DesiredState(services, targets);
  }

  /**
   * Returns every service this resolver may ever desire.
   *
   * @return the managed service names, sorted, never null
   */
  public Set<String> managedServices() {
    return mapping.managedServices().keySet();
  }

  private TargetSpec targetOf(final ManagedService service, final int port,
      final String hostname) {
    final Map<String, String> labels = new TreeMap<>(service.labels());
    labels.put("cluster", clusterName);
    labels.put("hostname", hostname);
    return new TargetSpec(hostname, port, service.job(), labels);
  }
}
