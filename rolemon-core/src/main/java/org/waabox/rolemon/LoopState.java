package org.waabox.rolemon;

/**
 * The states of the reconciliation loop.
 *
 * <p>A cycle goes {@code FETCHING -> RESOLVING -> APPLYING -> SLEEPING};
 * a failed fetch goes from {@code FETCHING} straight to {@code SLEEPING},
 * where the loop waits for the backoff delay instead of the poll interval.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum LoopState {

  /** No cycle ran yet. */
  IDLE,

  /** Fetching the node roles from the cluster manager. */
  FETCHING,

  /** Computing the desired state from the roles. */
  RESOLVING,

  /** Starting and stopping services, publishing the descriptor. */
  APPLYING,

  /** Waiting for the next cycle. */
  SLEEPING
}
