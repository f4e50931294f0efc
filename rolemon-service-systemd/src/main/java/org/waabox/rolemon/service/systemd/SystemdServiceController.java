package org.waabox.rolemon.service.systemd;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.rolemon.service.ServiceControlException;
import org.waabox.rolemon.service.ServiceControlException.Reason;
import org.waabox.rolemon.service.ServiceController;

/**
 * {@link ServiceController} driving systemd units through {@code systemctl}.
 *
 * <p>Both operations query the unit before acting, so calling them on a
 * unit already in the wanted state only runs read-only commands. A running
 * unit is also enabled, a stopped one disabled, so the state survives a
 * reboot.
 *
 * <p>A unit reported as started is checked again after a short settle
 * delay, since a unit that crashes on start up is briefly "active".
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class SystemdServiceController implements ServiceController {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(SystemdServiceController.class);

  /** The default delay before checking a started unit again. */
  public static final Duration DEFAULT_SETTLE_DELAY = Duration.ofSeconds(2);

  /** The systemd control program. */
  private static final String SYSTEMCTL = "systemctl";

  /** Unit names systemd accepts, without leading dash. */
  private static final Pattern UNIT_NAME = Pattern.compile(
      "[A-Za-z0-9:_.@\\\\][A-Za-z0-9:_.@\\\\-]*");

  /** Runs the commands. */
  private final CommandRunner runner;

  /** The delay before checking a started unit again. */
  private final Duration settleDelay;

  /**
   * Creates a controller with the default settle delay.
   *
   * @param theRunner the command runner, never null
   */
  public SystemdServiceController(final CommandRunner theRunner) {
    this(theRunner, DEFAULT_SETTLE_DELAY);
  }

  /**
   * Creates a controller.
   *
   * @param theRunner      the command runner, never null
   * @param theSettleDelay the delay before checking a started unit again,
   *                       never null; zero checks at once
   */
  public SystemdServiceController(final CommandRunner theRunner,
      final Duration theSettleDelay) {
    runner = Objects.requireNonNull(theRunner, "runner must not be null");
    settleDelay = Objects.requireNonNull(theSettleDelay,
        "settleDelay must not be null");
    if (theSettleDelay.isNegative()) {
      throw new IllegalArgumentException("settleDelay must not be negative");
    }
  }

  /** {@inheritDoc} */
  @Override
  public void ensureRunning(final String serviceName)
      throws ServiceControlException {
    final String unit = validUnit(serviceName, Reason.START_FAILED);

    final CommandResult load = systemctl(unit, Reason.START_FAILED,
        "show", "-p", "LoadState", "--value", unit);
    failOnPermission(unit, load, "query");
    if ("not-found".equals(load.output())) {
      throw new ServiceControlException(unit, Reason.NOT_INSTALLED,
          "Unit " + unit + " is not installed");
    }
    if ("masked".equals(load.output())) {
      throw new ServiceControlException(unit, Reason.START_FAILED,
          "Unit " + unit + " is masked");
    }

    if (!isActive(unit, Reason.START_FAILED)) {
      log.info("Starting unit {}", unit);
      final CommandResult start = systemctl(unit, Reason.START_FAILED,
          "start", unit);
      failOnPermission(unit, start, "start");
      if (!start.succeeded()) {
        throw new ServiceControlException(unit, Reason.START_FAILED,
            "systemctl start " + unit + " exited with " + start.exitCode()
                + ": " + start.output());
      }
      settle(unit);
      if (!isActive(unit, Reason.START_FAILED)) {
        throw new ServiceControlException(unit, Reason.START_FAILED,
            "Unit " + unit + " did not stay active after start");
      }
    }

    if (!isEnabled(unit, Reason.START_FAILED)) {
      log.info("Enabling unit {}", unit);
      final CommandResult enable = systemctl(unit, Reason.START_FAILED,
          "enable", unit);
      failOnPermission(unit, enable, "enable");
      if (!enable.succeeded()) {
        throw new ServiceControlException(unit, Reason.START_FAILED,
            "systemctl enable " + unit + " exited with "
                + enable.exitCode() + ": " + enable.output());
      }
    }
  }

  /** {@inheritDoc} */
  @Override
  public void ensureStopped(final String serviceName)
      throws ServiceControlException {
    final String unit = validUnit(serviceName, Reason.STOP_FAILED);

    final CommandResult load = systemctl(unit, Reason.STOP_FAILED,
        "show", "-p", "LoadState", "--value", unit);
    if (load.succeeded() && "not-found".equals(load.output())) {
      log.debug("Unit {} is not installed, nothing to stop", unit);
      return;
    }

    if (isActive(unit, Reason.STOP_FAILED)) {
      log.info("Stopping unit {}", unit);
      final CommandResult stop = systemctl(unit, Reason.STOP_FAILED,
          "stop", unit);
      if (!stop.succeeded()) {
        throw new ServiceControlException(unit, Reason.STOP_FAILED,
            "systemctl stop " + unit + " exited with " + stop.exitCode()
                + ": " + stop.output());
      }
    }

    if (isEnabled(unit, Reason.STOP_FAILED)) {
      log.info("Disabling unit {}", unit);
      final CommandResult disable = systemctl(unit, Reason.STOP_FAILED,
          "disable", unit);
      if (!disable.succeeded()) {
        throw new ServiceControlException(unit, Reason.STOP_FAILED,
            "systemctl disable " + unit + " exited with "
                + disable.exitCode() + ": " + disable.output());
      }
    }
  }

  private boolean isActive(final String unit, final Reason onFailure)
      throws ServiceControlException {
    return systemctl(unit, onFailure, "is-active", unit).succeeded();
  }

  /** Static units count as enabled since they cannot be enabled. */
  private boolean isEnabled(final String unit, final Reason onFailure)
      throws ServiceControlException {
    final CommandResult enabled = systemctl(unit, onFailure, "is-enabled",
        unit);
    return enabled.succeeded() || "static".equals(enabled.output());
  }

  private CommandResult systemctl(final String unit, final Reason onFailure,
      final String... arguments) throws ServiceControlException {
    final List<String> command = new ArrayList<>();
    command.add(SYSTEMCTL);
    command.addAll(List.of(arguments));
    try {
      final CommandResult result = runner.run(command);
      log.debug("{} exited with {}: {}", command, result.exitCode(),
          result.output());
      return result;
    } catch (final IOException e) {
      throw new ServiceControlException(unit, onFailure,
          "Cannot run " + String.join(" ", command) + ": " + e.getMessage(),
          e);
    }
  }

  private void settle(final String unit) throws ServiceControlException {
    if (settleDelay.isZero()) {
      return;
    }
    try {
      Thread.sleep(settleDelay.toMillis());
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ServiceControlException(unit, Reason.START_FAILED,
          "Interrupted while waiting for " + unit + " to settle", e);
    }
  }

  private static void failOnPermission(final String unit,
      final CommandResult result, final String action)
      throws ServiceControlException {
    if (result.succeeded()) {
      return;
    }
    if (result.outputContains("access denied")
        || result.outputContains("authentication required")
        || result.outputContains("authentication is required")) {
      throw new ServiceControlException(unit, Reason.PERMISSION_DENIED,
          "Not allowed to " + action + " unit " + unit + ": "
              + result.output());
    }
  }

  private static String validUnit(final String serviceName,
      final Reason onFailure) throws ServiceControlException {
    Objects.requireNonNull(serviceName, "serviceName must not be null");
    if (!UNIT_NAME.matcher(serviceName).matches()) {
      throw new ServiceControlException(serviceName, onFailure,
          "Invalid unit name '" + serviceName + "'");
    }
    return serviceName;
  }
}
