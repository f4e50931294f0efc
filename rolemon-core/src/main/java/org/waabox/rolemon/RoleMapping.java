package org.waabox.rolemon;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The explicit table of which services each role requires.
 *
 * <p>Only the roles listed here have an effect. A node whose roles are all
 * missing from the table needs no service at all, which makes an unknown or
 * empty role set stop everything rather than start anything.
 *
 * <p>Role names are matched case-insensitively. Instances are immutable and
 * created through {@link #builder()}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RoleMapping {

  /** The cluster manager role of nodes that run compute jobs. */
  public static final String COMPUTE_CLIENT_ROLE = "slurmclient";

  /** The services per role, keyed by lower case role name. */
  private final Map<String, List<ManagedService>> servicesByRole;

  /** Every service named in the table, keyed by name. */
  private final Map<String, ManagedService> managed;

  private RoleMapping(final Map<String, List<ManagedService>> theTable) {
    servicesByRole = Collections.unmodifiableMap(theTable);
    final Map<String, ManagedService> all = new TreeMap<>();
    for (final List<ManagedService> services : theTable.values()) {
      for (final ManagedService service : services) {
        final ManagedService previous = all.putIfAbsent(service.name(),
            service);
        if (previous != null && !previous.equals(service)) {
          throw new IllegalArgumentException("Service '" + service.name()
              + "' is declared twice with different settings");
        }
      }
    }
    managed = Collections.unmodifiableMap(all);
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * The table used when none is configured: the compute client role runs
   * the node, cgroup, GPU and DCGM exporters.
   *
   * @return the default table, never null
   */
  public static RoleMapping defaults() {
    return builder()
        .role(COMPUTE_CLIENT_ROLE,
            ManagedService.exporter("node_exporter", 9100, "node_exporter"),
            ManagedService.exporter("cgroup_exporter", 9306,
                "cgroup_exporter"),
            ManagedService.exporter("nvidia_gpu_exporter", 9445,
                "gpu_exporter"),
            ManagedService.exporter("dcgm-exporter", 9400, "dcgm_exporter"))
        .build();
  }

  /**
   * Returns the services required by the given role.
   *
   * @param role the role name, never null
   *
   * @return the services, empty for a role missing from the table
   */
  public List<ManagedService> servicesFor(final String role) {
    return servicesByRole.getOrDefault(role.toLowerCase(Locale.ROOT),
        List.of());
  }

  /**
   * Returns the roles listed in the table.
   *
   * @return the lower case role names, never null
   */
  public Set<String> roles() {
    return Collections.unmodifiableSet(new TreeSet<>(servicesByRole.keySet()));
  }

  /**
   * Returns every service the role monitor manages, whatever the roles.
   *
   * @return the managed services keyed by name, sorted, never null
   */
  public Map<String, ManagedService> managedServices() {
    return managed;
  }

  /** Builds a {@link RoleMapping}. */
  public static final class Builder {

    /** The table under construction. */
    private final Map<String, List<ManagedService>> table =
        new LinkedHashMap<>();

    private Builder() {
    }

    /**
     * Declares the services a role requires.
     *
     * @param role     the role name, never null nor blank
     * @param services the services, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder role(final String role, final ManagedService... services) {
      return role(role, List.of(services));
    }

    /**
     * Declares the services a role requires.
     *
     * @param role     the role name, never null nor blank
     * @param services the services, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws IllegalArgumentException if the role is blank or declared
     *                                  twice
     */
    public Builder role(final String role,
        final List<ManagedService> services) {
      Objects.requireNonNull(role, "role must not be null");
      Objects.requireNonNull(services, "services must not be null");
      if (role.isBlank()) {
        throw new IllegalArgumentException("role must not be blank");
      }
      final String key = role.trim().toLowerCase(Locale.ROOT);
      if (table.putIfAbsent(key, List.copyOf(services)) != null) {
        throw new IllegalArgumentException(
            "Role '" + key + "' is declared twice");
      }
      return this;
    }

    /**
     * Builds the table.
     *
     * @return the mapping, never null
     */
    public RoleMapping build() {
      return new RoleMapping(new LinkedHashMap<>(table));
    }
  }
}
