package org.waabox.rolemon;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.waabox.rolemon.source.RoleSnapshot;
import org.waabox.rolemon.source.RoleSourceException;

/**
 * The outcome of one reconciliation cycle.
 *
 * @param outcome          how the cycle ended, never null
 * @param snapshot         the roles fetched, or null if the fetch failed
 * @param failedServices   services that did not reach their desired state,
 *                         never null
 * @param discoveryFailed  whether a descriptor write or removal failed
 * @param stateSaveFailed  whether the applied state could not be saved
 * @param fetchFailure     the fetch failure, or null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record CycleResult(
    Outcome outcome,
    RoleSnapshot snapshot,
    List<String> failedServices,
    boolean discoveryFailed,
    boolean stateSaveFailed,
    RoleSourceException fetchFailure) {

  /** How a cycle ended. */
  public enum Outcome {

    /** Everything desired was confirmed applied. */
    CONVERGED,

    /** Some service or descriptor operation failed; retried next cycle. */
    PARTIAL,

    /** The roles could not be fetched; nothing was touched. */
    FETCH_FAILED
  }

  /** Validates and copies the result. */
  public CycleResult {
    Objects.requireNonNull(outcome, "outcome must not be null");
    failedServices = List.copyOf(failedServices);
  }

  /**
   * Creates the result of a cycle whose fetch failed.
   *
   * @param cause the fetch failure, never null
   *
   * @return the result, never null
   */
  public static CycleResult fetchFailed(final RoleSourceException cause) {
    return new CycleResult(Outcome.FETCH_FAILED, null, List.of(), false,
        false, Objects.requireNonNull(cause, "cause must not be null"));
  }

  /**
   * Creates the result of a cycle that reached the apply step.
   *
   * @param snapshot        the roles fetched, never null
   * @param failedServices  services that failed, never null
   * @param discoveryFailed whether a descriptor operation failed
   * @param stateSaveFailed whether the state could not be saved
   *
   * @return the result, never null
   */
  public static CycleResult applied(final RoleSnapshot snapshot,
      final List<String> failedServices, final boolean discoveryFailed,
      final boolean stateSaveFailed) {
    final boolean converged = failedServices.isEmpty() && !discoveryFailed;
    return new CycleResult(converged ? Outcome.CONVERGED : Outcome.PARTIAL,
        Objects.requireNonNull(snapshot, "snapshot must not be null"),
        failedServices, discoveryFailed, stateSaveFailed, null);
  }

  /**
   * Returns the fetch failure, if any.
   *
   * @return the failure, or empty
   */
  public Optional<RoleSourceException> fetchFailureCause() {
    return Optional.ofNullable(fetchFailure);
  }
}
