package org.waabox.rolemon.state;

/**
 * Persists the last state the role monitor confirmed as applied on this
 * node.
 *
 * <p>The store lives on node-local storage. Its documented invalidation
 * path is deleting it, which is treated exactly like a missing store and
 * forces a full resync on the next cycle.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface StateStore {

  /**
   * Loads the last saved state.
   *
   * <p>Never fails: a missing or unreadable store yields
   * {@link AppliedState#empty()}.
   *
   * @return the last applied state, never null
   */
  AppliedState load();

  /**
   * Saves the given state, replacing the previous one.
   *
   * @param state the state to persist, never null
   *
   * @throws StateWriteException if the state could not be written
   */
  void save(AppliedState state);
}
