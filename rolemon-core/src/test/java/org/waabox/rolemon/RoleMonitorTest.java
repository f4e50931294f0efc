package org.waabox.rolemon;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import org.junit.jupiter.api.Test;
import org.waabox.rolemon.source.NetworkException;
import org.waabox.rolemon.source.RoleSnapshot;
import org.waabox.rolemon.source.RoleSource;

/**
 * Tests for {@link RoleMonitor}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class RoleMonitorTest {

  private static RoleMonitor.Builder builderWith(final RoleSource source) {
    return RoleMonitor.builder()
        .roleSource(source)
        .serviceController(new FakeServiceController())
        .discoveryPublisher(new InMemoryDiscoveryPublisher())
        .stateStore(new InMemoryStateStore())
        .hostname(() -> "node01");
  }

  private static void awaitUntil(final BooleanSupplier condition)
      throws InterruptedException {
    final long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (!condition.getAsBoolean() && System.nanoTime() < deadline) {
      Thread.sleep(10);
    }
  }

  @Test
  void whenRunningOnce_givenReachableSource_shouldConvergeAndKeepResult() {
    final FakeRoleSource source = new FakeRoleSource();
    source.roles(RoleMapping.COMPUTE_CLIENT_ROLE);
    final FakeServiceController controller = new FakeServiceController();

    final RoleMonitor monitor = builderWith(source)
        .serviceController(controller)
        .build();

    assertFalse(monitor.lastResult().isPresent());

    final CycleResult result = monitor.runOnce();

    assertEquals(CycleResult.Outcome.CONVERGED, result.outcome());
    assertEquals(Set.of("node_exporter", "cgroup_exporter",
        "nvidia_gpu_exporter", "dcgm-exporter"), controller.running());
    assertEquals(result, monitor.lastResult().orElseThrow());
    assertEquals(LoopState.SLEEPING, monitor.state());
  }

  @Test
  void whenBuilding_givenNoRoleSource_shouldThrow() {
    final RoleMonitor.Builder builder = RoleMonitor.builder()
        .serviceController(new FakeServiceController())
        .discoveryPublisher(new InMemoryDiscoveryPublisher())
        .stateStore(new InMemoryStateStore());

    assertThrows(IllegalStateException.class, builder::build);
  }

  @Test
  void whenBuilding_givenZeroPollInterval_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        RoleMonitor.builder().pollInterval(Duration.ZERO));
  }

  @Test
  void whenBuilding_givenBlankClusterName_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        RoleMonitor.builder().clusterName(""));
  }

  @Test
  void whenStarting_givenUnreachableSource_shouldRetryWithBackoff()
      throws Exception {
    final FakeRoleSource source = new FakeRoleSource();
    source.unreachable();

    final RoleMonitor monitor = builderWith(source)
        .pollInterval(Duration.ofHours(1))
        .backoffPolicy(BackoffPolicy.of(Duration.ofMillis(10),
            Duration.ofMillis(20), Duration.ZERO))
        .build();

    try {
      monitor.start();
      awaitUntil(() -> source.fetches() >= 3);
    } finally {
      monitor.stop();
    }

    assertTrue(source.fetches() >= 3);
    assertEquals(CycleResult.Outcome.FETCH_FAILED,
        monitor.lastResult().orElseThrow().outcome());
  }

  @Test
  void whenStarting_givenReachableSource_shouldWaitThePollInterval()
      throws Exception {
    final FakeRoleSource source = new FakeRoleSource();
    source.roles("compute");

    final RoleMonitor monitor = builderWith(source)
        .pollInterval(Duration.ofHours(1))
        .backoffPolicy(BackoffPolicy.of(Duration.ofMillis(10),
            Duration.ofMillis(20), Duration.ZERO))
        .build();

    try {
      monitor.start();
      awaitUntil(() -> monitor.lastResult().isPresent());
      Thread.sleep(200);
    } finally {
      monitor.stop();
    }

    assertEquals(1, source.fetches());
  }

  @Test
  void whenCycleExceedsBudget_shouldNeverStartASecondCycle()
      throws Exception {
    final CountDownLatch release = new CountDownLatch(1);
    final AtomicInteger fetches = new AtomicInteger();
    final RoleSource stuck = nodeId -> {
      fetches.incrementAndGet();
      try {
        release.await();
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      return new RoleSnapshot(Set.of(), nodeId, Instant.EPOCH);
    };

    final RoleMonitor monitor = builderWith(stuck)
        .pollInterval(Duration.ofMillis(20))
        .cycleBudget(Duration.ofMillis(50))
        .build();

    try {
      monitor.start();
      Thread.sleep(400);
      assertEquals(1, fetches.get());
      assertFalse(monitor.lastResult().isPresent());

      release.countDown();
      awaitUntil(() -> fetches.get() >= 2);
      assertTrue(fetches.get() >= 2);
    } finally {
      release.countDown();
      monitor.stop();
    }
  }

  @Test
  void whenCycleExceedsBudget_givenLateFetchFailure_shouldBackOff()
      throws Exception {
    final CountDownLatch release = new CountDownLatch(1);
    final AtomicInteger fetches = new AtomicInteger();
    final RoleSource hanging = nodeId -> {
      fetches.incrementAndGet();
      try {
        release.await();
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      throw new NetworkException("head node timed out");
    };

    final RoleMonitor monitor = builderWith(hanging)
        .pollInterval(Duration.ofMillis(20))
        .cycleBudget(Duration.ofMillis(50))
        .backoffPolicy(BackoffPolicy.of(Duration.ofHours(1),
            Duration.ofHours(1), Duration.ZERO))
        .build();

    try {
      monitor.start();
      awaitUntil(() -> fetches.get() == 1);
      Thread.sleep(100);
      assertFalse(monitor.lastResult().isPresent());

      release.countDown();
      awaitUntil(() -> monitor.lastResult().isPresent());
      Thread.sleep(200);
    } finally {
      release.countDown();
      monitor.stop();
    }

    assertEquals(CycleResult.Outcome.FETCH_FAILED,
        monitor.lastResult().orElseThrow().outcome());
    assertEquals(1, fetches.get());
  }

  @Test
  void whenStarting_givenAlreadyStarted_shouldThrow() {
    final FakeRoleSource source = new FakeRoleSource();
    final RoleMonitor monitor = builderWith(source)
        .pollInterval(Duration.ofHours(1))
        .build();
    try {
      monitor.start();
      assertThrows(IllegalStateException.class, monitor::start);
      assertThrows(IllegalStateException.class, monitor::runOnce);
    } finally {
      monitor.stop();
    }
  }
}
