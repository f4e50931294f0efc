package org.waabox.rolemon.source;

/**
 * Base class of every failure raised while fetching node roles.
 *
 * <p>All role source failures are retryable: the reconciliation loop logs
 * them, leaves the applied state untouched and tries again after a backoff.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public abstract class RoleSourceException extends Exception {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  protected RoleSourceException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  protected RoleSourceException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
