package org.waabox.rolemon.service;

import java.util.Objects;

/**
 * Thrown when a managed service could not be brought to the requested state.
 *
 * <p>The failure is isolated to the service named in the exception: the
 * loop keeps reconciling the other services and retries this one on a later
 * cycle.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ServiceControlException extends Exception {

  private static final long serialVersionUID = 1L;

  /** Why a service operation failed. */
  public enum Reason {

    /** The service unit does not exist on this node. */
    NOT_INSTALLED,

    /** The service manager failed to start the unit, or it died. */
    START_FAILED,

    /** The service manager refused the operation. */
    PERMISSION_DENIED,

    /** The service manager failed to stop or disable the unit. */
    STOP_FAILED
  }

  /** The name of the service that failed, never null. */
  private final String serviceName;

  /** The failure reason, never null. */
  private final Reason reason;

  /**
   * Creates a new exception.
   *
   * @param theServiceName the failing service, never null
   * @param theReason      the failure reason, never null
   * @param message        the detail message, never null
   */
  public ServiceControlException(final String theServiceName,
      final Reason theReason, final String message) {
    super(message);
    serviceName = Objects.requireNonNull(theServiceName,
        "serviceName must not be null");
    reason = Objects.requireNonNull(theReason, "reason must not be null");
  }

  /**
   * Creates a new exception with an underlying cause.
   *
   * @param theServiceName the failing service, never null
   * @param theReason      the failure reason, never null
   * @param message        the detail message, never null
   * @param cause          the underlying cause, never null
   */
  public ServiceControlException(final String theServiceName,
      final Reason theReason, final String message, final Throwable cause) {
    super(message, cause);
    serviceName = Objects.requireNonNull(theServiceName,
        "serviceName must not be null");
    reason = Objects.requireNonNull(theReason, "reason must not be null");
  }

  /**
   * Returns the name of the service that failed.
   *
   * @return the service name, never null
   */
  public String serviceName() {
    return serviceName;
  }

  /**
   * Returns why the operation failed.
   *
   * @return the reason, never null
   */
  public Reason reason() {
    return reason;
  }
}
