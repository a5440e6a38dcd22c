package io.b2mash.b2b.artifactvault.storage;

import io.b2mash.b2b.artifactvault.artifact.ArtifactIdentifier;

/**
 * Outcome of moving one artifact between adjacent tiers.
 *
 * @param sidecar metadata of the moved artifact; null when the move had already completed
 */
public record PromotionResult(
    ArtifactIdentifier identifier, Tier from, Tier to, Outcome outcome, SidecarMetadata sidecar) {

  public enum Outcome {
    PROMOTED,
    WOULD_PROMOTE,
    /** Source absent, or destination already present from an earlier interrupted run. */
    ALREADY_COMPLETE
  }
}
