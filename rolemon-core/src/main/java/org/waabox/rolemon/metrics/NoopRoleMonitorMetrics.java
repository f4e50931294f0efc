package org.waabox.rolemon.metrics;

import org.waabox.rolemon.CycleResult;
import org.waabox.rolemon.service.ServiceControlException;

/**
 * A no-operation implementation of {@link RoleMonitorMetrics}.
 *
 * <p>All methods in this class are intentionally empty. Use this
 * implementation when metrics collection is not required or during
 * testing.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopRoleMonitorMetrics implements RoleMonitorMetrics {

  /** {@inheritDoc} */
  @Override
  public void cycleCompleted(final CycleResult.Outcome outcome,
      final long durationMs) {
  }

  /** {@inheritDoc} */
  @Override
  public void fetchFailed(final Throwable cause) {
  }

  /** {@inheritDoc} */
  @Override
  public void serviceFailed(final String serviceName,
      final ServiceControlException.Reason reason) {
  }

  /** {@inheritDoc} */
  @Override
  public void descriptorChanged(final String hostname,
      final boolean published) {
  }
}
