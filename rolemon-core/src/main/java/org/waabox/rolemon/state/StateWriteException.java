package org.waabox.rolemon.state;

/**
 * Thrown when the applied state cannot be persisted.
 *
 * <p>Not fatal: the loop logs it and saves again on the next cycle.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class StateWriteException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public StateWriteException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
