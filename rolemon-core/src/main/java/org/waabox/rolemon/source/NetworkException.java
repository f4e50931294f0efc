package org.waabox.rolemon.source;

/**
 * Thrown when the cluster manager cannot be reached, the call times out, or
 * it answers with an unexpected HTTP status.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class NetworkException extends RoleSourceException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public NetworkException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public NetworkException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
