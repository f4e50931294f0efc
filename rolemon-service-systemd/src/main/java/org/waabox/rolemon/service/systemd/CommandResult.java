package org.waabox.rolemon.service.systemd;

import java.util.Locale;
import java.util.Objects;

/**
 * The outcome of an external command.
 *
 * @param exitCode the process exit code
 * @param output   the combined standard output and error, trimmed, never
 *                 null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record CommandResult(int exitCode, String output) {

  /**
   * Validates the result.
   *
   * @param exitCode the process exit code
   * @param output   the command output, never null
   */
  public CommandResult {
    Objects.requireNonNull(output, "output must not be null");
    output = output.strip();
  }

  /**
   * Whether the command exited with status zero.
   *
   * @return true on success
   */
  public boolean succeeded() {
    return exitCode == 0;
  }

  /**
   * Whether the output contains the given text, ignoring case.
   *
   * @param text the text to look for, never null
   *
   * @return true if found
   */
  public boolean outputContains(final String text) {
    return output.toLowerCase(Locale.ROOT)
        .contains(text.toLowerCase(Locale.ROOT));
  }
}
