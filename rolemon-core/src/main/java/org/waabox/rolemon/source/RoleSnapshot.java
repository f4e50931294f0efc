package org.waabox.rolemon.source;

import java.time.Instant;
import java.util.Collections;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * The roles assigned to a node at the moment they were fetched.
 *
 * <p>Role names are normalized to lower case since the cluster manager
 * matches them case-insensitively. The role set is sorted and unmodifiable.
 *
 * @param roles     the roles of the node, never null
 * @param hostname  the node the roles belong to, never null
 * @param fetchedAt when the roles were fetched, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record RoleSnapshot(Set<String> roles, String hostname,
    Instant fetchedAt) {

  /**
   * Creates a new snapshot, normalizing the role names.
   *
   * @param roles     the roles of the node, never null
   * @param hostname  the node the roles belong to, never null
   * @param fetchedAt when the roles were fetched, never null
   */
  public RoleSnapshot {
    Objects.requireNonNull(roles, "roles must not be null");
    Objects.requireNonNull(hostname, "hostname must not be null");
    Objects.requireNonNull(fetchedAt, "fetchedAt must not be null");
    roles = normalize(roles);
  }

  /**
   * Lower cases and sorts the given role names, dropping blank ones.
   *
   * @param roles the raw role names, never null
   *
   * @return the normalized, unmodifiable role set, never null
   */
  public static Set<String> normalize(final Set<String> roles) {
    final TreeSet<String> normalized = new TreeSet<>();
    for (final String role : roles) {
      if (role != null && !role.isBlank()) {
        normalized.add(role.trim().toLowerCase(Locale.ROOT));
      }
    }
    return Collections.unmodifiableSet(normalized);
  }
}
