package org.waabox.rolemon.daemon;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.waabox.rolemon.BackoffPolicy;
import org.waabox.rolemon.RoleMapping;
import org.waabox.rolemon.ServiceRetryPolicy;

/**
 * The daemon configuration, read once at startup.
 *
 * <p>Instances are created by {@link DaemonConfigLoader}, which fills in
 * the defaults, and never change afterwards.
 *
 * @param headnodes       the cluster manager head nodes, tried in order,
 *                        never empty
 * @param port            the cluster manager REST port
 * @param certPath        the PEM client certificate, never null
 * @param keyPath         the PEM client key, never null
 * @param caPath          the PEM CA bundle, or null to skip server
 *                        verification
 * @param connectTimeout  the connect timeout, never null
 * @param requestTimeout  the request timeout, never null
 * @param pollInterval    the delay between converged cycles, never null
 * @param targetsDir      the shared discovery directory, never null
 * @param stateFile       the local state file, never null
 * @param hostname        the hostname override, or null to use the short
 *                        local hostname
 * @param clusterName     the cluster label value, never null
 * @param roleMapping     the role to services table, never null
 * @param backoff         the fetch failure backoff, never null
 * @param serviceRetry    the per-service retry policy, never null
 * @param verifyInterval  the period of direct service verification, never
 *                        null; zero disables it
 * @param cycleBudget     the time after which a cycle is abandoned, never
 *                        null
 * @param startSettle     the delay before checking a started unit again,
 *                        never null
 * @param commandTimeout  the timeout of one systemctl call, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record DaemonConfig(
    List<String> headnodes,
    int port,
    Path certPath,
    Path keyPath,
    Path caPath,
    Duration connectTimeout,
    Duration requestTimeout,
    Duration pollInterval,
    Path targetsDir,
    Path stateFile,
    String hostname,
    String clusterName,
    RoleMapping roleMapping,
    BackoffPolicy backoff,
    ServiceRetryPolicy serviceRetry,
    Duration verifyInterval,
    Duration cycleBudget,
    Duration startSettle,
    Duration commandTimeout) {

  /** Validates and copies the configuration. */
  public DaemonConfig {
    headnodes = List.copyOf(headnodes);
    Objects.requireNonNull(certPath, "certPath must not be null");
    Objects.requireNonNull(keyPath, "keyPath must not be null");
    Objects.requireNonNull(targetsDir, "targetsDir must not be null");
    Objects.requireNonNull(stateFile, "stateFile must not be null");
    Objects.requireNonNull(clusterName, "clusterName must not be null");
    Objects.requireNonNull(roleMapping, "roleMapping must not be null");
    Objects.requireNonNull(backoff, "backoff must not be null");
    Objects.requireNonNull(serviceRetry, "serviceRetry must not be null");
  }

  /**
   * Returns the CA bundle, if one is configured.
   *
   * @return the CA bundle path, or empty
   */
  public Optional<Path> ca() {
    return Optional.ofNullable(caPath);
  }

  /**
   * Returns the hostname override, if one is configured.
   *
   * @return the hostname, or empty
   */
  public Optional<String> hostnameOverride() {
    return Optional.ofNullable(hostname);
  }

  /**
   * Returns a copy of this configuration with the command line overrides
   * applied.
   *
   * @param theTargetsDir the discovery directory, or null to keep the
   *                      configured one
   * @param theHostname   the hostname, or null to keep the configured one
   *
   * @return the resulting configuration, never null
   */
  public DaemonConfig withOverrides(final Path theTargetsDir,
      final String theHostname) {
    return new DaemonConfig(headnodes, port, certPath, keyPath, caPath,
        connectTimeout, requestTimeout, pollInterval,
        theTargetsDir == null ? targetsDir : theTargetsDir,
        stateFile,
        theHostname == null ? hostname : theHostname,
        clusterName, roleMapping, backoff, serviceRetry, verifyInterval,
        cycleBudget, startSettle, commandTimeout);
  }
}
