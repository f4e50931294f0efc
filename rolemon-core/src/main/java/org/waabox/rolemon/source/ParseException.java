package org.waabox.rolemon.source;

/**
 * Thrown when the cluster manager answer is malformed or does not list the
 * requested node.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ParseException extends RoleSourceException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public ParseException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public ParseException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
