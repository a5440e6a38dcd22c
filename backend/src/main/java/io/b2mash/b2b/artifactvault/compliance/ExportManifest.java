package io.b2mash.b2b.artifactvault.compliance;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.b2b.artifactvault.classification.ExportPolicy;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Written as {@code manifest.json} at the root of a tenant export.
 *
 * @param artifacts tier to number of artifacts exported with content
 * @param redacted artifacts exported as metadata only
 * @param denied artifacts left out entirely
 * @param failed artifacts that could not be read
 * @param logs auxiliary log kind to number of tenant records exported
 * @param excluded identifiers of denied and redacted artifacts
 */
public record ExportManifest(
    @JsonProperty("tenant_id") String tenantId,
    @JsonProperty("exported_at") Instant exportedAt,
    @JsonProperty("actor_id") String actorId,
    @JsonProperty("export_policy") ExportPolicy exportPolicy,
    @JsonProperty("artifacts") Map<String, Integer> artifacts,
    @JsonProperty("redacted") int redacted,
    @JsonProperty("denied") int denied,
    @JsonProperty("failed") int failed,
    @JsonProperty("logs") Map<String, Integer> logs,
    @JsonProperty("excluded") List<String> excluded) {

  public int totalArtifacts() {
    return artifacts.values().stream().mapToInt(Integer::intValue).sum();
  }

  public int totalLogRecords() {
    return logs.values().stream().mapToInt(Integer::intValue).sum();
  }
}
