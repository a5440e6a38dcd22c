package io.b2mash.b2b.artifactvault.lifecycle;

import io.b2mash.b2b.artifactvault.artifact.ArtifactIdentifier;
import io.b2mash.b2b.artifactvault.storage.Tier;

/**
 * One step of the lifecycle state machine for one artifact.
 *
 * @param to destination tier; null for a purge from the terminal tier
 * @param ageDays artifact age at scan time, two decimals
 * @param error failure message when {@code state} is {@link State#SKIPPED}, otherwise null
 */
public record LifecycleTransition(
    ArtifactIdentifier identifier,
    Tier from,
    Tier to,
    State state,
    double ageDays,
    String error) {

  public enum State {
    /** Past its tier window; reported by dry runs without acting. */
    ELIGIBLE,
    PROMOTED,
    PURGED,
    /** Eligible, but acting on it failed. */
    SKIPPED
  }

  public boolean isPurge() {
    return to == null;
  }
}
