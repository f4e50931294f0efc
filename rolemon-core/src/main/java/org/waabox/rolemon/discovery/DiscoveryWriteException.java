package org.waabox.rolemon.discovery;

/**
 * Thrown when a discovery descriptor cannot be written or removed.
 *
 * <p>Retryable: the reconciliation loop logs it and tries again next cycle.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DiscoveryWriteException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public DiscoveryWriteException(final String message,
      final Throwable cause) {
    super(message, cause);
  }

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public DiscoveryWriteException(final String message) {
    super(message);
  }
}
