package io.b2mash.b2b.artifactvault.storage;

import io.b2mash.b2b.artifactvault.artifact.ArtifactIdentifier;

/**
 * Outcome of irreversibly deleting one artifact and its sidecar.
 *
 * @param sidecar metadata of the purged artifact; null when nothing was left to purge
 */
public record PurgeResult(
    ArtifactIdentifier identifier, Tier tier, Outcome outcome, SidecarMetadata sidecar) {

  public enum Outcome {
    PURGED,
    WOULD_PURGE,
    ALREADY_COMPLETE
  }
}
