package org.waabox.rolemon;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.rolemon.discovery.DiscoveryPublisher;
import org.waabox.rolemon.discovery.DiscoveryWriteException;
import org.waabox.rolemon.discovery.TargetSpec;
import org.waabox.rolemon.metrics.RoleMonitorMetrics;
import org.waabox.rolemon.service.ServiceControlException;
import org.waabox.rolemon.service.ServiceController;
import org.waabox.rolemon.source.RoleSnapshot;
import org.waabox.rolemon.source.RoleSource;
import org.waabox.rolemon.source.RoleSourceException;
import org.waabox.rolemon.state.AppliedState;
import org.waabox.rolemon.state.ServiceFailure;
import org.waabox.rolemon.state.StateStore;
import org.waabox.rolemon.state.StateWriteException;

/**
 * Runs one reconciliation cycle at a time: fetch the roles, resolve the
 * desired state, apply the difference with the applied state, persist what
 * was confirmed.
 *
 * <p>The applied state is loaded once, when the reconciler is created. The
 * first cycle after a start is an ordinary cycle: with an empty state it
 * re-checks every managed service and the descriptor, with a saved state
 * it only acts on what differs.
 *
 * <p>Applying is split per service and per descriptor. Every operation
 * that fails is logged and left for a later cycle; the saved state lists
 * only what succeeded. A failed fetch touches nothing.
 *
 * <p>Thread safety: {@link #reconcile()} must not be called concurrently.
 * {@link RoleMonitor} guarantees this by running every cycle on a single
 * thread. {@link #state()} and {@link #appliedState()} may be read from any
 * thread.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Reconciler {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(Reconciler.class);

  /** Where the roles come from. */
  private final RoleSource roleSource;

  /** Maps roles to the desired state. */
  private final DesiredStateResolver resolver;

  /** Starts and stops services. */
  private final ServiceController serviceController;

  /** Writes and removes the discovery descriptor. */
  private final DiscoveryPublisher discoveryPublisher;

  /** Persists the applied state. */
  private final StateStore stateStore;

  /** Returns the current short hostname of the node. */
  private final Supplier<String> hostname;

  /** Spaces the attempts on services that keep failing. */
  private final ServiceRetryPolicy retryPolicy;

  /** How often confirmed service states are verified again; zero never. */
  private final Duration verifyInterval;

  /** The metrics reporter. */
  private final RoleMonitorMetrics metrics;

  /** The time source. */
  private final Clock clock;

  /** The last applied state, as known in memory. */
  private volatile AppliedState applied;

  /** Whether the in-memory state still has to reach the store. */
  private boolean savePending;

  /** The current loop state. */
  private volatile LoopState state = LoopState.IDLE;

  /**
   * Creates a new reconciler and loads the applied state from the store.
   *
   * @param theRoleSource         the role source, never null
   * @param theResolver           the desired state resolver, never null
   * @param theServiceController  the service controller, never null
   * @param theDiscoveryPublisher the discovery publisher, never null
   * @param theStateStore         the state store, never null
   * @param theHostname           the hostname supplier, never null
   * @param theRetryPolicy        the service retry policy, never null
   * @param theVerifyInterval     the service verification interval, never
   *                              null; zero disables verification
   * @param theMetrics            the metrics reporter, never null
   * @param theClock              the time source, never null
   */
  public Reconciler(final RoleSource theRoleSource,
      final DesiredStateResolver theResolver,
      final ServiceController theServiceController,
      final DiscoveryPublisher theDiscoveryPublisher,
      final StateStore theStateStore,
      final Supplier<String> theHostname,
      final ServiceRetryPolicy theRetryPolicy,
      final Duration theVerifyInterval,
      final RoleMonitorMetrics theMetrics,
      final Clock theClock) {
    roleSource = Objects.requireNonNull(theRoleSource,
        "roleSource must not be null");
    resolver = Objects.requireNonNull(theResolver,
        "resolver must not be null");
    serviceController = Objects.requireNonNull(theServiceController,
        "serviceController must not be null");
    discoveryPublisher = Objects.requireNonNull(theDiscoveryPublisher,
        "discoveryPublisher must not be null");
    stateStore = Objects.requireNonNull(theStateStore,
        "stateStore must not be null");
    hostname = Objects.requireNonNull(theHostname,
        "hostname must not be null");
    retryPolicy = Objects.requireNonNull(theRetryPolicy,
        "retryPolicy must not be null");
    verifyInterval = Objects.requireNonNull(theVerifyInterval,
        "verifyInterval must not be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics must not be null");
    clock = Objects.requireNonNull(theClock, "clock must not be null");

    applied = stateStore.load();
    if (applied.isEmpty()) {
      log.info("No applied state found, the first cycle resyncs everything");
    }
  }

  /**
   * Runs one full cycle.
   *
   * @return the outcome of the cycle, never null
   */
  public CycleResult reconcile() {
    final long startNanos = System.nanoTime();
    final CycleResult result;
    try {
      result = runCycle();
    } finally {
      state = LoopState.SLEEPING;
    }
    metrics.cycleCompleted(result.outcome(),
        Duration.ofNanos(System.nanoTime() - startNanos).toMillis());
    return result;
  }

  /**
   * Returns the current state of the loop.
   *
   * @return the loop state, never null
   */
  public LoopState state() {
    return state;
  }

  /**
   * Returns the applied state as last confirmed.
   *
   * @return the applied state, never null
   */
  public AppliedState appliedState() {
    return applied;
  }

  private CycleResult runCycle() {
    state = LoopState.FETCHING;
    final String nodeHostname = hostname.get();

    final RoleSnapshot snapshot;
    try {
      snapshot = roleSource.fetch(nodeHostname);
    } catch (final RoleSourceException e) {
      log.warn("Could not fetch roles of node {}: {}", nodeHostname,
          e.getMessage());
      metrics.fetchFailed(e);
      return CycleResult.fetchFailed(e);
    }

    state = LoopState.RESOLVING;
    final DesiredState desired = resolver.resolve(snapshot.roles(),
        nodeHostname);
    final String rolesHash = Hashes.ofRoles(snapshot.roles());
    if (!rolesHash.equals(applied.rolesHash())) {
      log.info("Roles of node {} are now {}, desired services: {}",
          nodeHostname, snapshot.roles(), desired.services());
    }

    state = LoopState.APPLYING;
    final Instant now = clock.instant();
    final boolean verify = verificationDue(now);
    if (verify) {
      log.info("Verifying the state of every managed service");
    }

    final ServiceProgress services = applyServices(desired, now, verify);
    final DiscoveryProgress discovery = applyDiscovery(desired,
        nodeHostname);

    final AppliedState next = new AppliedState(
        rolesHash,
        services.started,
        services.stopped,
        discovery.publishedHostname,
        discovery.targetFileHash,
        discovery.pendingRetractions,
        services.failures,
        verify || applied.verifiedAt() == null ? now : applied.verifiedAt(),
        applied.updatedAt());

    final boolean saveFailed = !persist(next, now);

    if (services.failed.isEmpty() && !discovery.failed) {
      log.debug("Node {} converged", nodeHostname);
    }
    return CycleResult.applied(snapshot, services.failed, discovery.failed,
        saveFailed);
  }

  private boolean verificationDue(final Instant now) {
    if (verifyInterval.isZero() || applied.verifiedAt() == null) {
      return false;
    }
    return !now.isBefore(applied.verifiedAt().plus(verifyInterval));
  }

  /**
   * Brings every managed service to its desired state.
   *
   * <p>Services already confirmed in their desired state are skipped
   * without calling the service manager, unless this cycle verifies.
   */
  private ServiceProgress applyServices(final DesiredState desired,
      final Instant now, final boolean verify) {
    final Set<String> managed = resolver.managedServices();
    final ServiceProgress progress = new ServiceProgress();

    if (!verify) {
      progress.started.addAll(applied.servicesStarted());
      progress.stopped.addAll(applied.servicesStopped());
    }
    progress.started.retainAll(managed);
    progress.stopped.retainAll(managed);
    progress.failures.putAll(applied.serviceFailures());
    progress.failures.keySet().retainAll(managed);

    for (final String service : managed) {
      final boolean wantRunning = desired.services().contains(service);

      ServiceFailure failure = progress.failures.get(service);
      if (failure != null && failure.desiredRunning() != wantRunning) {
        log.info("Desired state of service {} changed, dropping its {} "
            + "failed attempts", service, failure.attempts());
        progress.failures.remove(service);
        failure = null;
      }

      final boolean confirmed = wantRunning
          ? progress.started.contains(service)
          : progress.stopped.contains(service);
      if (confirmed) {
        continue;
      }

      if (failure != null && !retryPolicy.shouldAttempt(failure, now)) {
        log.debug("Service {} is cooling down after {} failed attempts",
            service, failure.attempts());
        progress.failed.add(service);
        continue;
      }

      try {
        if (wantRunning) {
          serviceController.ensureRunning(service);
          progress.started.add(service);
          progress.stopped.remove(service);
          log.info("Service {} is running", service);
        } else {
          serviceController.ensureStopped(service);
          progress.stopped.add(service);
          progress.started.remove(service);
          log.info("Service {} is stopped", service);
        }
        progress.failures.remove(service);
      } catch (final ServiceControlException e) {
        final ServiceFailure next = failure == null
            ? ServiceFailure.first(wantRunning, now)
            : failure.next(now);
        progress.failures.put(service, next);
        progress.failed.add(service);
        metrics.serviceFailed(service, e.reason());

        if (next.attempts() >= retryPolicy.maxAttempts()) {
          log.error("Service {} failed to {} ({}) {} times in a row, next "
              + "attempt in {}: {}", service, wantRunning ? "start" : "stop",
              e.reason(), next.attempts(), retryPolicy.cooldown(),
              e.getMessage());
        } else {
          log.warn("Service {} failed to {} ({}), attempt {}/{}: {}",
              service, wantRunning ? "start" : "stop", e.reason(),
              next.attempts(), retryPolicy.maxAttempts(), e.getMessage());
        }
      }
    }
    return progress;
  }

  /**
   * Publishes or retracts the descriptor of this node, then removes the
   * descriptors left behind under previous hostnames.
   *
   * <p>A stale descriptor stays in place until this node's own descriptor is
   * on disk, so a failed publish never leaves the node without one.
   */
  private DiscoveryProgress applyDiscovery(final DesiredState desired,
      final String nodeHostname) {
    final DiscoveryProgress progress = new DiscoveryProgress();
    progress.publishedHostname = applied.publishedHostname();
    progress.targetFileHash = applied.targetFileHash();
    progress.pendingRetractions.addAll(applied.pendingRetractions());

    if (progress.publishedHostname != null
        && !progress.publishedHostname.equals(nodeHostname)) {
      log.info("Hostname changed from {} to {}, moving the descriptor",
          progress.publishedHostname, nodeHostname);
      progress.pendingRetractions.add(progress.publishedHostname);
      progress.publishedHostname = null;
      progress.targetFileHash = null;
    }
    progress.pendingRetractions.remove(nodeHostname);

    final Set<TargetSpec> targets = desired.publishTargets();
    final Optional<String> onDisk = discoveryPublisher.currentFingerprint(
        nodeHostname);

    if (targets.isEmpty()) {
      if (!AppliedState.NO_TARGETS.equals(progress.targetFileHash)
          || onDisk.isPresent()) {
        try {
          discoveryPublisher.retract(nodeHostname);
          progress.publishedHostname = null;
          progress.targetFileHash = AppliedState.NO_TARGETS;
          if (onDisk.isPresent()) {
            metrics.descriptorChanged(nodeHostname, false);
            log.info("Removed descriptor of {}", nodeHostname);
          }
        } catch (final DiscoveryWriteException e) {
          progress.failed = true;
          log.warn("Could not remove descriptor of {}: {}", nodeHostname,
              e.getMessage());
        }
      }
      retractStale(progress);
      return progress;
    }

    final String wanted = discoveryPublisher.fingerprint(targets);
    final boolean upToDate = nodeHostname.equals(progress.publishedHostname)
        && wanted.equals(progress.targetFileHash)
        && onDisk.filter(wanted::equals).isPresent();
    if (!upToDate) {
      if (onDisk.isEmpty() && wanted.equals(progress.targetFileHash)) {
        log.warn("Descriptor of {} disappeared, publishing it again",
            nodeHostname);
      }
      try {
        discoveryPublisher.publish(nodeHostname, targets);
        progress.publishedHostname = nodeHostname;
        progress.targetFileHash = wanted;
        metrics.descriptorChanged(nodeHostname, true);
        log.info("Published {} targets for {}", targets.size(),
            nodeHostname);
      } catch (final DiscoveryWriteException e) {
        progress.failed = true;
        log.warn("Could not publish descriptor of {}, keeping {} stale "
            + "descriptor(s) until it is: {}", nodeHostname,
            progress.pendingRetractions.size(), e.getMessage());
        return progress;
      }
    }
    retractStale(progress);
    return progress;
  }

  /** Removes the descriptors published under previous hostnames. */
  private void retractStale(final DiscoveryProgress progress) {
    for (final String stale : List.copyOf(progress.pendingRetractions)) {
      try {
        discoveryPublisher.retract(stale);
        progress.pendingRetractions.remove(stale);
        metrics.descriptorChanged(stale, false);
        log.info("Removed stale descriptor of {}", stale);
      } catch (final DiscoveryWriteException e) {
        progress.failed = true;
        log.warn("Could not remove stale descriptor of {}: {}", stale,
            e.getMessage());
      }
    }
  }

  /**
   * Saves the next state when it differs from the last one, or when a
   * previous save failed.
   *
   * @return false if the save failed
   */
  private boolean persist(final AppliedState next, final Instant now) {
    if (next.sameContentAs(applied) && !savePending) {
      return true;
    }
    final AppliedState stamped = next.sameContentAs(applied)
        ? next
        : next.stamped(now);
    applied = stamped;
    try {
      stateStore.save(stamped);
      savePending = false;
      return true;
    } catch (final StateWriteException e) {
      savePending = true;
      log.warn("Could not save applied state, retrying next cycle: {}",
          e.getMessage());
      return false;
    }
  }

  /** Services confirmed and failed during the current cycle. */
  private static final class ServiceProgress {

    private final Set<String> started = new TreeSet<>();

    private final Set<String> stopped = new TreeSet<>();

    private final Map<String, ServiceFailure> failures = new TreeMap<>();

    private final List<String> failed = new ArrayList<>();
  }

  /** Descriptor outcome of the current cycle. */
  private static final class DiscoveryProgress {

    private String publishedHostname;

    private String targetFileHash;

    private final Set<String> pendingRetractions = new TreeSet<>();

    private boolean failed;
  }
}
