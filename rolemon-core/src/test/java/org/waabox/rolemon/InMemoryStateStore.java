package org.waabox.rolemon;

import org.waabox.rolemon.state.AppliedState;
import org.waabox.rolemon.state.StateStore;
import org.waabox.rolemon.state.StateWriteException;

/**
 * State store keeping the last saved state in memory.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class InMemoryStateStore implements StateStore {

  private AppliedState saved;

  private int saves;

  private int failingSaves;

  void failNextSaves(final int count) {
    failingSaves = count;
  }

  /** Simulates the operator deleting the state file. */
  void delete() {
    saved = null;
  }

  AppliedState saved() {
    return saved;
  }

  int saves() {
    return saves;
  }

  /** {@inheritDoc} */
  @Override
  public AppliedState load() {
    return saved == null ? AppliedState.empty() : saved;
  }

  /** {@inheritDoc} */
  @Override
  public void save(final AppliedState state) {
    if (failingSaves > 0) {
      failingSaves--;
      throw new StateWriteException("no space left on device", null);
    }
    saves++;
    saved = state;
  }
}
