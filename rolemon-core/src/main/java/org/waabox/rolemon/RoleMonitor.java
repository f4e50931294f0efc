package org.waabox.rolemon;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.rolemon.discovery.DiscoveryPublisher;
import org.waabox.rolemon.metrics.NoopRoleMonitorMetrics;
import org.waabox.rolemon.metrics.RoleMonitorMetrics;
import org.waabox.rolemon.service.ServiceController;
import org.waabox.rolemon.source.RoleSource;
import org.waabox.rolemon.state.StateStore;

/**
 * The main entry point of the role monitor.
 *
 * <p>RoleMonitor drives a {@link Reconciler} forever: one cycle, then a
 * sleep, then the next cycle. After a cycle whose fetch failed the sleep
 * follows the {@link BackoffPolicy}; after any other cycle it is the poll
 * interval.
 *
 * <p>Cycles run on a dedicated thread and never overlap. A cycle that
 * exceeds its budget is reported and abandoned: the loop keeps ticking, and
 * skips every tick until the abandoned cycle returns. The result of the
 * abandoned cycle then counts as the result of that tick, so a late fetch
 * failure still backs off.
 *
 * <p>Usage example:
 * <pre>{@code
 * RoleMonitor monitor = RoleMonitor.builder()
 *     .roleSource(httpRoleSource)
 *     .serviceController(systemdController)
 *     .discoveryPublisher(fileSystemPublisher)
 *     .stateStore(fileSystemStateStore)
 *     .roleMapping(RoleMapping.defaults())
 *     .pollInterval(Duration.ofSeconds(30))
 *     .build();
 *
 * monitor.start();
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RoleMonitor {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(RoleMonitor.class);

  /** The cycle runner. */
  private final Reconciler reconciler;

  /** The sleep between successful cycles. */
  private final Duration pollInterval;

  /** The sleep policy after failed fetches. */
  private final BackoffPolicy backoffPolicy;

  /** How long a single cycle may run before being abandoned. */
  private final Duration cycleBudget;

  /** Whether this instance has been started. */
  private final AtomicBoolean started = new AtomicBoolean(false);

  /** Whether this instance has been stopped. */
  private final AtomicBoolean stopped = new AtomicBoolean(false);

  /** Schedules the ticks. */
  private ScheduledExecutorService scheduler;

  /** Runs the cycles. */
  private ExecutorService cycleExecutor;

  /** The cycle in flight, null before the first tick. */
  private Future<CycleResult> inFlight;

  /** Whether the cycle in flight exceeded its budget and was not read. */
  private boolean abandoned;

  /** Consecutive cycles whose fetch failed. */
  private int fetchFailures;

  /** The result of the last completed cycle. */
  private volatile CycleResult lastResult;

  /**
   * Creates a new RoleMonitor.
   *
   * @param theReconciler    the reconciler, never null
   * @param thePollInterval  the poll interval, never null
   * @param theBackoffPolicy the backoff policy, never null
   * @param theCycleBudget   the cycle budget, never null
   */
  private RoleMonitor(final Reconciler theReconciler,
      final Duration thePollInterval,
      final BackoffPolicy theBackoffPolicy,
      final Duration theCycleBudget) {
    reconciler = theReconciler;
    pollInterval = thePollInterval;
    backoffPolicy = theBackoffPolicy;
    cycleBudget = theCycleBudget;
  }

  /**
   * Creates a new builder for constructing a RoleMonitor instance.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the loop. The first cycle runs immediately.
   *
   * @throws IllegalStateException if the monitor was already started
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("RoleMonitor already started");
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(
        daemonThreads("rolemon-scheduler"));
    cycleExecutor = Executors.newSingleThreadExecutor(
        daemonThreads("rolemon-cycle"));

    log.info("Starting role monitor, poll interval {}, cycle budget {}",
        pollInterval, cycleBudget);
    scheduler.execute(this::tick);
  }

  /**
   * Stops the loop. A cycle in flight is interrupted. Calling stop more
   * than once has no effect.
   */
  public void stop() {
    if (!stopped.compareAndSet(false, true)) {
      return;
    }
    log.info("Stopping role monitor");
    if (scheduler != null) {
      scheduler.shutdownNow();
      scheduler = null;
    }
    if (cycleExecutor != null) {
      cycleExecutor.shutdownNow();
      cycleExecutor = null;
    }
  }

  /**
   * Runs a single cycle on the calling thread.
   *
   * <p>Used by the one-shot mode and by tests. Must not be called while the
   * loop is started.
   *
   * @return the result of the cycle, never null
   *
   * @throws IllegalStateException if the loop is started
   */
  public CycleResult runOnce() {
    if (started.get() && !stopped.get()) {
      throw new IllegalStateException(
          "Cannot run a single cycle while the loop is started");
    }
    final CycleResult result = reconciler.reconcile();
    lastResult = result;
    return result;
  }

  /**
   * Returns the result of the last completed cycle.
   *
   * @return the last result, empty before the first cycle completes
   */
  public Optional<CycleResult> lastResult() {
    return Optional.ofNullable(lastResult);
  }

  /**
   * Returns the current state of the loop.
   *
   * @return the loop state, never null
   */
  public LoopState state() {
    return reconciler.state();
  }

  /**
   * Runs or skips one cycle and schedules the next tick.
   *
   * <p>Runs on the scheduler thread.
   */
  private void tick() {
    if (stopped.get()) {
      return;
    }
    Duration delay = pollInterval;

    if (inFlight != null && !inFlight.isDone()) {
      log.warn("Previous cycle is still running, skipping this tick");
    } else if (abandoned) {
      abandoned = false;
      try {
        final CycleResult result = inFlight.get();
        log.info("Abandoned cycle finished late with {}", result.outcome());
        lastResult = result;
        delay = nextDelay(result);
      } catch (final ExecutionException e) {
        log.error("Abandoned cycle failed unexpectedly", e.getCause());
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      }
    } else {
      try {
        inFlight = cycleExecutor.submit(reconciler::reconcile);
        final CycleResult result = inFlight.get(cycleBudget.toMillis(),
            TimeUnit.MILLISECONDS);
        lastResult = result;
        delay = nextDelay(result);
      } catch (final TimeoutException e) {
        abandoned = true;
        log.error("Cycle exceeded its budget of {}, abandoning it",
            cycleBudget);
      } catch (final ExecutionException e) {
        log.error("Cycle failed unexpectedly", e.getCause());
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      }
    }

    schedule(delay);
  }

  private Duration nextDelay(final CycleResult result) {
    if (result.outcome() == CycleResult.Outcome.FETCH_FAILED) {
      final Duration delay = backoffPolicy.delay(fetchFailures);
      fetchFailures++;
      log.info("Fetch failed {} times in a row, next attempt in {}",
          fetchFailures, delay);
      return delay;
    }
    if (fetchFailures > 0) {
      log.info("Role source reachable again after {} failed fetches",
          fetchFailures);
    }
    fetchFailures = 0;
    return pollInterval;
  }

  private void schedule(final Duration delay) {
    final ScheduledExecutorService current = scheduler;
    if (stopped.get() || current == null) {
      return;
    }
    try {
      current.schedule(this::tick, delay.toMillis(), TimeUnit.MILLISECONDS);
    } catch (final RejectedExecutionException e) {
      log.debug("Role monitor stopped while scheduling the next cycle");
    }
  }

  private static ThreadFactory daemonThreads(final String name) {
    return r -> {
      final Thread thread = new Thread(r, name);
      thread.setDaemon(true);
      return thread;
    };
  }

  /**
   * Builder for constructing {@link RoleMonitor} instances.
   *
   * <p>The role source, the service controller, the discovery publisher and
   * the state store are required. Everything else has a default.
   */
  public static final class Builder {

    /** The default poll interval. */
    static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(30);

    /** The default service verification interval. */
    static final Duration DEFAULT_VERIFY_INTERVAL = Duration.ofMinutes(10);

    /** The default cycle budget. */
    static final Duration DEFAULT_CYCLE_BUDGET = Duration.ofMinutes(2);

    /** The default cluster label. */
    static final String DEFAULT_CLUSTER_NAME = "slurm";

    private RoleSource roleSource;

    private ServiceController serviceController;

    private DiscoveryPublisher discoveryPublisher;

    private StateStore stateStore;

    private RoleMapping roleMapping;

    private String clusterName;

    private Supplier<String> hostname;

    private Duration pollInterval;

    private BackoffPolicy backoffPolicy;

    private ServiceRetryPolicy serviceRetryPolicy;

    private Duration verifyInterval;

    private Duration cycleBudget;

    private RoleMonitorMetrics metrics;

    private Clock clock;

    /** Creates a new builder with default settings. */
    private Builder() {
    }

    /**
     * Sets the source of the node roles.
     *
     * @param theRoleSource the role source, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder roleSource(final RoleSource theRoleSource) {
      roleSource = Objects.requireNonNull(theRoleSource,
          "roleSource must not be null");
      return this;
    }

    /**
     * Sets the local service controller.
     *
     * @param theServiceController the service controller, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder serviceController(
        final ServiceController theServiceController) {
      serviceController = Objects.requireNonNull(theServiceController,
          "serviceController must not be null");
      return this;
    }

    /**
     * Sets the discovery publisher.
     *
     * @param theDiscoveryPublisher the discovery publisher, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder discoveryPublisher(
        final DiscoveryPublisher theDiscoveryPublisher) {
      discoveryPublisher = Objects.requireNonNull(theDiscoveryPublisher,
          "discoveryPublisher must not be null");
      return this;
    }

    /**
     * Sets the store of the applied state.
     *
     * @param theStateStore the state store, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder stateStore(final StateStore theStateStore) {
      stateStore = Objects.requireNonNull(theStateStore,
          "stateStore must not be null");
      return this;
    }

    /**
     * Sets the role to service mapping.
     *
     * <p>If not set, {@link RoleMapping#defaults()} is used.
     *
     * @param theRoleMapping the role mapping, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder roleMapping(final RoleMapping theRoleMapping) {
      roleMapping = Objects.requireNonNull(theRoleMapping,
          "roleMapping must not be null");
      return this;
    }

    /**
     * Sets the value of the cluster label of every published target.
     *
     * <p>If not set, "slurm" is used.
     *
     * @param theClusterName the cluster name, never null or empty
     *
     * @return this builder for chaining, never null
     */
    public Builder clusterName(final String theClusterName) {
      Objects.requireNonNull(theClusterName, "clusterName must not be null");
      if (theClusterName.isEmpty()) {
        throw new IllegalArgumentException("clusterName must not be empty");
      }
      clusterName = theClusterName;
      return this;
    }

    /**
     * Sets where the node hostname comes from. It is read on every cycle.
     *
     * <p>If not set, {@link LocalHostname#shortName()} is used.
     *
     * @param theHostname the hostname supplier, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder hostname(final Supplier<String> theHostname) {
      hostname = Objects.requireNonNull(theHostname,
          "hostname must not be null");
      return this;
    }

    /**
     * Sets the sleep between cycles.
     *
     * @param thePollInterval the poll interval, never null, positive
     *
     * @return this builder for chaining, never null
     */
    public Builder pollInterval(final Duration thePollInterval) {
      pollInterval = positive(thePollInterval, "pollInterval");
      return this;
    }

    /**
     * Sets the sleep policy after failed fetches.
     *
     * <p>If not set, {@link BackoffPolicy#defaultPolicy()} is used.
     *
     * @param theBackoffPolicy the backoff policy, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder backoffPolicy(final BackoffPolicy theBackoffPolicy) {
      backoffPolicy = Objects.requireNonNull(theBackoffPolicy,
          "backoffPolicy must not be null");
      return this;
    }

    /**
     * Sets the retry policy of failing services.
     *
     * <p>If not set, {@link ServiceRetryPolicy#defaultPolicy()} is used.
     *
     * @param theServiceRetryPolicy the retry policy, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder serviceRetryPolicy(
        final ServiceRetryPolicy theServiceRetryPolicy) {
      serviceRetryPolicy = Objects.requireNonNull(theServiceRetryPolicy,
          "serviceRetryPolicy must not be null");
      return this;
    }

    /**
     * Sets how often confirmed services are checked again.
     *
     * @param theVerifyInterval the interval, never null; zero disables the
     *                          verification
     *
     * @return this builder for chaining, never null
     */
    public Builder verifyInterval(final Duration theVerifyInterval) {
      Objects.requireNonNull(theVerifyInterval,
          "verifyInterval must not be null");
      if (theVerifyInterval.isNegative()) {
        throw new IllegalArgumentException(
            "verifyInterval must not be negative");
      }
      verifyInterval = theVerifyInterval;
      return this;
    }

    /**
     * Sets how long a cycle may run before being abandoned.
     *
     * @param theCycleBudget the budget, never null, positive
     *
     * @return this builder for chaining, never null
     */
    public Builder cycleBudget(final Duration theCycleBudget) {
      cycleBudget = positive(theCycleBudget, "cycleBudget");
      return this;
    }

    /**
     * Sets the metrics reporter.
     *
     * <p>If not set, {@link NoopRoleMonitorMetrics} is used.
     *
     * @param theMetrics the metrics reporter, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder metrics(final RoleMonitorMetrics theMetrics) {
      metrics = Objects.requireNonNull(theMetrics,
          "metrics must not be null");
      return this;
    }

    /**
     * Sets the time source.
     *
     * @param theClock the clock, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder clock(final Clock theClock) {
      clock = Objects.requireNonNull(theClock, "clock must not be null");
      return this;
    }

    /**
     * Builds the RoleMonitor. Loads the applied state from the store.
     *
     * @return a new RoleMonitor, never null
     *
     * @throws IllegalStateException if a required collaborator is missing
     */
    public RoleMonitor build() {
      require(roleSource, "roleSource");
      require(serviceController, "serviceController");
      require(discoveryPublisher, "discoveryPublisher");
      require(stateStore, "stateStore");

      final DesiredStateResolver resolver = new DesiredStateResolver(
          roleMapping != null ? roleMapping : RoleMapping.defaults(),
          clusterName != null ? clusterName : DEFAULT_CLUSTER_NAME);

      final Reconciler reconciler = new Reconciler(
          roleSource,
          resolver,
          serviceController,
          discoveryPublisher,
          stateStore,
          hostname != null ? hostname : LocalHostname::shortName,
          serviceRetryPolicy != null
              ? serviceRetryPolicy : ServiceRetryPolicy.defaultPolicy(),
          verifyInterval != null ? verifyInterval : DEFAULT_VERIFY_INTERVAL,
          metrics != null ? metrics : new NoopRoleMonitorMetrics(),
          clock != null ? clock : Clock.systemUTC());

      return new RoleMonitor(reconciler,
          pollInterval != null ? pollInterval : DEFAULT_POLL_INTERVAL,
          backoffPolicy != null ? backoffPolicy : BackoffPolicy.defaultPolicy(),
          cycleBudget != null ? cycleBudget : DEFAULT_CYCLE_BUDGET);
    }

    private static void require(final Object value, final String name) {
      if (value == null) {
        throw new IllegalStateException(name + " must be set");
      }
    }

    private static Duration positive(final Duration value,
        final String name) {
      Objects.requireNonNull(value, name + " must not be null");
      if (value.isZero() || value.isNegative()) {
        throw new IllegalArgumentException(name + " must be positive");
      }
      return value;
    }
  }
}
