package org.waabox.rolemon.source;

/**
 * Thrown when the client certificate or key cannot be loaded, the TLS
 * handshake fails, or the cluster manager rejects the credentials.
 *
 * <p>Messages never carry key material, only file paths and causes.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class AuthException extends RoleSourceException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public AuthException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public AuthException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
