package org.waabox.rolemon.service.systemd;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link CommandRunner} spawning a local process.
 *
 * <p>Standard error is merged into standard output. A process running
 * longer than the timeout is killed. The output kept is truncated.
 *
 * <p>The output is drained while the process runs, on reader threads owned
 * by the runner, so a chatty command never blocks on a full pipe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class ProcessCommandRunner implements CommandRunner {

  /** The default per-command timeout. */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  /** The output kept per command. */
  private static final int MAX_OUTPUT_CHARS = 2000;

  /** The per-command timeout. */
  private final Duration timeout;

  /** Drains the output of the running commands. */
  private final ExecutorService outputReaders;

  /** Creates a runner with the default timeout. */
  public ProcessCommandRunner() {
    this(DEFAULT_TIMEOUT);
  }

  /**
   * Creates a runner.
   *
   * @param theTimeout the per-command timeout, never null, positive
   */
  public ProcessCommandRunner(final Duration theTimeout) {
    this(theTimeout, Executors.newCachedThreadPool(r -> {
      final Thread thread = new Thread(r, "rolemon-command-output");
      thread.setDaemon(true);
      return thread;
    }));
  }

  /**
   * Creates a runner draining output on the given executor.
   *
   * @param theTimeout       the per-command timeout, never null, positive
   * @param theOutputReaders the executor reading command output, never null
   */
  ProcessCommandRunner(final Duration theTimeout,
      final ExecutorService theOutputReaders) {
    Objects.requireNonNull(theTimeout, "timeout must not be null");
    Objects.requireNonNull(theOutputReaders,
        "outputReaders must not be null");
    if (theTimeout.isZero() || theTimeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    timeout = theTimeout;
    outputReaders = theOutputReaders;
  }

  /** {@inheritDoc} */
  @Override
  public CommandResult run(final List<String> command) throws IOException {
    Objects.requireNonNull(command, "command must not be null");
    if (command.isEmpty()) {
      throw new IllegalArgumentException("command must not be empty");
    }

    final ProcessBuilder builder = new ProcessBuilder(command);
    builder.redirectErrorStream(true);
    final Process process = builder.start();
    process.getOutputStream().close();

    final CompletableFuture<String> output = CompletableFuture.supplyAsync(
        () -> readAll(process.getInputStream()), outputReaders);

    try {
      if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        process.destroyForcibly();
        process.waitFor(1, TimeUnit.SECONDS);
        throw new IOException("Command " + command.get(0)
            + " timed out after " + timeout);
      }
      return new CommandResult(process.exitValue(),
          truncate(output.get(timeout.toMillis(), TimeUnit.MILLISECONDS)));
    } catch (final InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("Interrupted running "
          + command.get(0));
    } catch (final ExecutionException | TimeoutException e) {
      throw new IOException("Cannot read output of " + command.get(0), e);
    }
  }

  private static String readAll(final InputStream in) {
    try (InputStream stream = in) {
      return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
    } catch (final IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private static String truncate(final String raw) {
    final String normalized = raw.replace("\r", "").strip();
    if (normalized.length() <= MAX_OUTPUT_CHARS) {
      return normalized;
    }
    return normalized.substring(0, MAX_OUTPUT_CHARS) + "...";
  }
}
