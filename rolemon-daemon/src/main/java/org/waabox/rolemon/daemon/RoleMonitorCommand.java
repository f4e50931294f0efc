package org.waabox.rolemon.daemon;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.function.Function;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.rolemon.CycleResult;
import org.waabox.rolemon.LocalHostname;
import org.waabox.rolemon.RoleMonitor;
import org.waabox.rolemon.discovery.fs.FileSystemDiscoveryPublisher;
import org.waabox.rolemon.service.systemd.ProcessCommandRunner;
import org.waabox.rolemon.service.systemd.SystemdServiceController;
import org.waabox.rolemon.source.http.HttpRoleSource;
import org.waabox.rolemon.source.http.HttpRoleSourceConfig;
import org.waabox.rolemon.state.fs.FileSystemStateStore;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * The {@code rolemon} command line.
 *
 * <p>Without {@code --once} the command runs the role monitor until the
 * process is stopped. With {@code --once} it runs a single cycle and exits
 * with {@link #EXIT_CONVERGED} when the node converged, or
 * {@link #EXIT_NOT_CONVERGED} otherwise. An invalid configuration always
 * exits with {@link #EXIT_CONFIG_ERROR}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@Command(
    name = "rolemon",
    mixinStandardHelpOptions = true,
    version = "rolemon 1.0.0",
    description = "Keeps the exporter services and the shared scrape target "
        + "file of this node in line with its cluster manager roles.")
public class RoleMonitorCommand implements Callable<Integer> {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(RoleMonitorCommand.class);

  /** Exit code of a single cycle that converged. */
  public static final int EXIT_CONVERGED = 0;

  /** Exit code of a single cycle that did not converge. */
  public static final int EXIT_NOT_CONVERGED = 1;

  /** Exit code of a startup configuration error. */
  public static final int EXIT_CONFIG_ERROR = 2;

  @Option(names = {"-c", "--config"},
      description = "Configuration file (default: ${DEFAULT-VALUE}).",
      defaultValue = "/etc/rolemon/config.json")
  private Path configFile;

  @Option(names = "--prometheus-targets-dir",
      description = "Overrides the shared scrape target directory.")
  private Path targetsDir;

  @Option(names = "--hostname",
      description = "Overrides the hostname this node is known by.")
  private String hostname;

  @Option(names = "--once",
      description = "Runs a single cycle and exits.")
  private boolean once;

  /** Builds the monitor from the configuration. */
  private final Function<DaemonConfig, RoleMonitor> monitorFactory;

  /** Creates a command wiring the production collaborators. */
  public RoleMonitorCommand() {
    this(RoleMonitorCommand::assemble);
  }

  /**
   * Creates a command building its monitor with the given factory.
   *
   * @param theMonitorFactory builds the monitor, never null
   */
  RoleMonitorCommand(final Function<DaemonConfig, RoleMonitor>
      theMonitorFactory) {
    monitorFactory = Objects.requireNonNull(theMonitorFactory,
        "monitorFactory must not be null");
  }

  /** {@inheritDoc} */
  @Override
  public Integer call() throws InterruptedException {
    final DaemonConfig config;
    final RoleMonitor monitor;
    try {
      config = DaemonConfigLoader.load(configFile)
          .withOverrides(targetsDir, blankToNull(hostname));
      monitor = monitorFactory.apply(config);
    } catch (final ConfigException e) {
      log.error("Invalid configuration: {}", e.getMessage());
      return EXIT_CONFIG_ERROR;
    } catch (final UncheckedIOException e) {
      log.error("Cannot prepare local storage: {}", e.getMessage());
      return EXIT_CONFIG_ERROR;
    }

    log.info("Role monitor for head nodes {}, targets in {}, state in {}",
        config.headnodes(), config.targetsDir(), config.stateFile());

    if (once) {
      final CycleResult result;
      try {
        result = monitor.runOnce();
      } catch (final IllegalStateException e) {
        log.error("Single cycle could not run: {}", e.getMessage());
        return EXIT_NOT_CONVERGED;
      }
      log.info("Single cycle finished: {}", result.outcome());
      return result.outcome() == CycleResult.Outcome.CONVERGED
          ? EXIT_CONVERGED : EXIT_NOT_CONVERGED;
    }

    final CountDownLatch stopped = new CountDownLatch(1);
    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      log.info("Shutting down the role monitor");
      monitor.stop();
      stopped.countDown();
    }, "rolemon-shutdown"));

    monitor.start();
    stopped.await();
    return EXIT_CONVERGED;
  }

  /**
   * Wires the production collaborators.
   *
   * @param config the configuration, never null
   *
   * @return the monitor, never null
   *
   * @throws UncheckedIOException if the state directory cannot be created
   */
  static RoleMonitor assemble(final DaemonConfig config) {
    final HttpRoleSourceConfig sourceConfig = HttpRoleSourceConfig.builder(
        config.headnodes(), config.certPath(), config.keyPath())
        .port(config.port())
        .caPath(config.caPath())
        .connectTimeout(config.connectTimeout())
        .requestTimeout(config.requestTimeout())
        .build();

    final Supplier<String> nodeName = config.hostnameOverride()
        .<Supplier<String>>map(name -> () -> name)
        .orElse(LocalHostname::shortName);

    return RoleMonitor.builder()
        .roleSource(new HttpRoleSource(sourceConfig))
        .serviceController(new SystemdServiceController(
            new ProcessCommandRunner(config.commandTimeout()),
            config.startSettle()))
        .discoveryPublisher(
            new FileSystemDiscoveryPublisher(config.targetsDir()))
        .stateStore(new FileSystemStateStore(config.stateFile()))
        .roleMapping(config.roleMapping())
        .clusterName(config.clusterName())
        .hostname(nodeName)
        .pollInterval(config.pollInterval())
        .backoffPolicy(config.backoff())
        .serviceRetryPolicy(config.serviceRetry())
        .verifyInterval(config.verifyInterval())
        .cycleBudget(config.cycleBudget())
        .build();
  }

  private static String blankToNull(final String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
