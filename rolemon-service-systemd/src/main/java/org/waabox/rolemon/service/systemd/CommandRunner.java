package org.waabox.rolemon.service.systemd;

import java.io.IOException;
import java.util.List;

/**
 * Runs an external command and waits for it.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface CommandRunner {

  /**
   * Runs the command.
   *
   * @param command the program and its arguments, never null nor empty
   *
   * @return the exit code and output, never null
   *
   * @throws IOException if the command cannot be started, times out or the
   *                     wait is interrupted
   */
  CommandResult run(List<String> command) throws IOException;
}
