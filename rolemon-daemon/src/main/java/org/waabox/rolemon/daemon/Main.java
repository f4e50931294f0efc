package org.waabox.rolemon.daemon;

import picocli.CommandLine;

/**
 * Entry point of the role monitor daemon.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Main {

  /** Private constructor to prevent instantiation. */
  private Main() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Runs the {@code rolemon} command and exits with its exit code.
   *
   * @param args the command line arguments
   */
  public static void main(final String[] args) {
    final int code = new CommandLine(new RoleMonitorCommand()).execute(args);
    System.exit(code);
  }
}
