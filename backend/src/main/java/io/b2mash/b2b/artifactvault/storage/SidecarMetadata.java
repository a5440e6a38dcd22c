package io.b2mash.b2b.artifactvault.storage;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.b2b.artifactvault.artifact.ArtifactIdentifier;
import io.b2mash.b2b.artifactvault.classification.ClassificationLabel;
import java.time.Duration;
import java.time.Instant;

/**
 * Per-artifact metadata document stored beside the payload. Written after the payload, so its
 * presence marks the artifact as committed. Immutable apart from {@link #withLabel}.
 *
 * @param label classification label; null only in documents written before labeling existed
 * @param keyId keyring entry that encrypted the payload; null when {@code encrypted} is false
 * @param size plaintext length in bytes
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SidecarMetadata(
    @JsonProperty("label") ClassificationLabel label,
    @JsonProperty("tenant_id") String tenantId,
    @JsonProperty("workflow_id") String workflowId,
    @JsonProperty("artifact_id") String artifactId,
    @JsonProperty("key_id") String keyId,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("size") long size,
    @JsonProperty("encrypted") boolean encrypted) {

  public SidecarMetadata withLabel(ClassificationLabel newLabel) {
    return new SidecarMetadata(
        newLabel, tenantId, workflowId, artifactId, keyId, createdAt, size, encrypted);
  }

  public ArtifactIdentifier identifier() {
    return ArtifactIdentifier.of(tenantId, workflowId, artifactId);
  }

  public Duration age(Instant now) {
    return Duration.between(createdAt, now);
  }

  /** Age in fractional days, rounded to two decimals, as reported in audit events. */
  public double ageDays(Instant now) {
    return Math.round(age(now).toMinutes() / 14.4) / 100.0;
  }
}
