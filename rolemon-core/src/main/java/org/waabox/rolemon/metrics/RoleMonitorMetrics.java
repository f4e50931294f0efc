package org.waabox.rolemon.metrics;

import org.waabox.rolemon.CycleResult;
import org.waabox.rolemon.service.ServiceControlException;

/**
 * An abstraction for recording operational metrics of the role monitor.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer or a Prometheus text file. Use {@link NoopRoleMonitorMetrics}
 * when metrics collection is not required.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface RoleMonitorMetrics {

  /**
   * Records a finished reconciliation cycle.
   *
   * @param outcome    how the cycle ended, never null
   * @param durationMs how long the cycle took, in milliseconds
   */
  void cycleCompleted(CycleResult.Outcome outcome, long durationMs);

  /**
   * Records a failed role fetch.
   *
   * @param cause the failure, never null
   */
  void fetchFailed(Throwable cause);

  /**
   * Records a failed service operation.
   *
   * @param serviceName the service that failed, never null
   * @param reason      why it failed, never null
   */
  void serviceFailed(String serviceName,
      ServiceControlException.Reason reason);

  /**
   * Records a discovery descriptor write or removal.
   *
   * @param hostname  the owner of the descriptor, never null
   * @param published true for a write, false for a removal
   */
  void descriptorChanged(String hostname, boolean published);
}
