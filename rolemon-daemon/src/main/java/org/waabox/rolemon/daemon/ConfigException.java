package org.waabox.rolemon.daemon;

/**
 * Thrown when the daemon cannot start because its configuration is missing
 * or invalid.
 *
 * <p>The only fatal error of the daemon: it is raised before the first
 * cycle and ends the process with exit code 2.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ConfigException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public ConfigException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public ConfigException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
