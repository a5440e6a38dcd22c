package io.b2mash.b2b.artifactvault.compliance;

import java.time.Instant;
import java.util.Map;

/**
 * Scope of a tenant deletion. A dry run and the live run that follows it on unchanged state report
 * identical counts.
 *
 * @param artifacts tier to number of artifacts removed, or that would be removed
 * @param logRecords auxiliary log kind to number of tenant records removed, or that would be
 *     removed
 */
public record DeletionSummary(
    String tenantId,
    boolean dryRun,
    Instant performedAt,
    Map<String, Integer> artifacts,
    Map<String, Integer> logRecords) {

  public int totalArtifacts() {
    return artifacts.values().stream().mapToInt(Integer::intValue).sum();
  }

  public int totalLogRecords() {
    return logRecords.values().stream().mapToInt(Integer::intValue).sum();
  }
}
