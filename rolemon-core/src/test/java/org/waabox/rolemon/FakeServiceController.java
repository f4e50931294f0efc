package org.waabox.rolemon;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.waabox.rolemon.service.ServiceControlException;
import org.waabox.rolemon.service.ServiceControlException.Reason;
import org.waabox.rolemon.service.ServiceController;

/**
 * Service controller keeping the running services in memory.
 *
 * <p>Every call is recorded as "start:name" or "stop:name".
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class FakeServiceController implements ServiceController {

  private final Set<String> running = new TreeSet<>();

  private final Map<String, Reason> failing = new HashMap<>();

  private final List<String> calls = new ArrayList<>();

  void fail(final String service, final Reason reason) {
    failing.put(service, reason);
  }

  void heal(final String service) {
    failing.remove(service);
  }

  /** Simulates an administrator stopping a service by hand. */
  void stopOutOfBand(final String service) {
    running.remove(service);
  }

  Set<String> running() {
    return running;
  }

  List<String> calls() {
    return calls;
  }

  long callsFor(final String service) {
    return calls.stream().filter(c -> c.endsWith(":" + service)).count();
  }

  void clearCalls() {
    calls.clear();
  }

  /** {@inheritDoc} */
  @Override
  public void ensureRunning(final String serviceName)
      throws ServiceControlException {
    calls.add("start:" + serviceName);
    final Reason reason = failing.get(serviceName);
    if (reason != null) {
      throw new ServiceControlException(serviceName, reason,
          "unit " + serviceName + " refused to start");
    }
    running.add(serviceName);
  }

  /** {@inheritDoc} */
  @Override
  public void ensureStopped(final String serviceName)
      throws ServiceControlException {
    calls.add("stop:" + serviceName);
    if (failing.containsKey(serviceName)) {
      throw new ServiceControlException(serviceName, Reason.STOP_FAILED,
          "unit " + serviceName + " refused to stop");
    }
    running.remove(serviceName);
  }
}
