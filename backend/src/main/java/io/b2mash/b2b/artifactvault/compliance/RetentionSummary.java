package io.b2mash.b2b.artifactvault.compliance;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class RetentionSummary {

  private final Instant checkedAt;
  private final boolean dryRun;
  private final Map<String, KindResult> results = new LinkedHashMap<>();
  private final Map<String, String> failures = new LinkedHashMap<>();

  public RetentionSummary(Instant checkedAt, boolean dryRun) {
    this.checkedAt = checkedAt;
    this.dryRun = dryRun;
  }

  void addResult(String kind, int windowDays, int scanned, int kept, int removed) {
    results.put(kind, new KindResult(kind, windowDays, scanned, kept, removed));
  }

  void addFailure(String kind, String message) {
    failures.put(kind, message);
  }

  public Instant getCheckedAt() {
    return checkedAt;
  }

  public boolean isDryRun() {
    return dryRun;
  }

  public Map<String, KindResult> getResults() {
    return Collections.unmodifiableMap(results);
  }

  /** Log kind to failure message, for kinds whose pruning failed and left the log untouched. */
  public Map<String, String> getFailures() {
    return Collections.unmodifiableMap(failures);
  }

  public int getTotalRemoved() {
    return results.values().stream().mapToInt(KindResult::removed).sum();
  }

  public record KindResult(String kind, int windowDays, int scanned, int kept, int removed) {}
}
