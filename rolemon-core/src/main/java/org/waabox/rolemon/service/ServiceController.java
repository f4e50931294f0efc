package org.waabox.rolemon.service;

/**
 * Starts and stops the local services managed by the role monitor.
 *
 * <p>Both operations are idempotent and must query the real state of the
 * service before acting: administrators and reboots change service state
 * out of band, so no cached knowledge is trusted here.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ServiceController {

  /**
   * Makes sure the service is running and enabled at boot.
   *
   * <p>Does nothing but query when the service already runs and is enabled.
   *
   * @param serviceName the unit name of the service, never null
   *
   * @throws ServiceControlException with reason
   *     {@link ServiceControlException.Reason#NOT_INSTALLED},
   *     {@link ServiceControlException.Reason#START_FAILED} or
   *     {@link ServiceControlException.Reason#PERMISSION_DENIED}
   */
  void ensureRunning(String serviceName) throws ServiceControlException;

  /**
   * Makes sure the service is stopped and disabled at boot.
   *
   * <p>A service that is not installed is considered stopped.
   *
   * @param serviceName the unit name of the service, never null
   *
   * @throws ServiceControlException with reason
   *     {@link ServiceControlException.Reason#STOP_FAILED}
   */
  void ensureStopped(String serviceName) throws ServiceControlException;
}
