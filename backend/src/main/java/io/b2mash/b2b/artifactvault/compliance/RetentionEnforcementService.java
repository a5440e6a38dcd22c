package io.b2mash.b2b.artifactvault.compliance;

import io.b2mash.b2b.artifactvault.audit.AuditEventBuilder;
import io.b2mash.b2b.artifactvault.audit.AuditService;
import io.b2mash.b2b.artifactvault.audit.AuditSubsystem;
import io.b2mash.b2b.artifactvault.eventlog.EventLogStore;
import io.b2mash.b2b.artifactvault.exception.VaultException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Prunes auxiliary event logs to their retention windows. Each log is rewritten through a filtered
 * temp copy and an atomic rename, so an interrupted prune leaves the original log intact. Records
 * without a readable timestamp are never removed.
 */
@Service
public class RetentionEnforcementService {

  private static final Logger log = LoggerFactory.getLogger(RetentionEnforcementService.class);

  private final EventLogStore eventLogStore;
  private final AuditService auditService;
  private final Clock clock;

  public RetentionEnforcementService(
      EventLogStore eventLogStore, AuditService auditService, Clock clock) {
    this.eventLogStore = eventLogStore;
    this.auditService = auditService;
    this.clock = clock;
  }

  /**
   * Removes records older than their kind's window. A failure on one log is recorded in the
   * summary and the remaining logs are still pruned.
   *
   * @param windowsByKind log kind to retention window in days
   */
  public RetentionSummary enforceRetention(Map<String, Integer> windowsByKind, boolean dryRun) {
    Instant now = clock.instant();
    var summary = new RetentionSummary(now, dryRun);

    for (var entry : new TreeMap<>(windowsByKind).entrySet()) {
      String kind = entry.getKey();
      Integer windowDays = entry.getValue();
      if (windowDays == null || windowDays < 0) {
        log.warn("Retention: ignoring {} log, invalid window {}", kind, windowDays);
        summary.addFailure(kind, "invalid retention window: " + windowDays);
        continue;
      }
      Instant cutoff = now.minus(Duration.ofDays(windowDays));
      try {
        var result =
            eventLogStore.rewrite(
                kind,
                record -> record.timestamp().map(t -> !t.isBefore(cutoff)).orElse(true),
                dryRun);
        summary.addResult(kind, windowDays, result.scanned(), result.kept(), result.removed());
      } catch (VaultException e) {
        log.error("Retention: failed to prune {} log: {}", kind, e.getMessage(), e);
        summary.addFailure(kind, e.getMessage());
      }
    }

    log.info(
        "Retention enforcement completed (dryRun={}): {} log(s) checked, {} record(s) removed,"
            + " {} failure(s)",
        dryRun,
        summary.getResults().size(),
        summary.getTotalRemoved(),
        summary.getFailures().size());

    if (!dryRun && (summary.getTotalRemoved() > 0 || !summary.getFailures().isEmpty())) {
      var removedByKind = new LinkedHashMap<String, Object>();
      summary.getResults().forEach((kind, result) -> removedByKind.put(kind, result.removed()));
      var details = new LinkedHashMap<String, Object>();
      details.put("removed", removedByKind);
      details.put("failures", summary.getFailures().size());
      auditService.log(
          AuditEventBuilder.builder()
              .subsystem(AuditSubsystem.COMPLIANCE)
              .eventType("retention_enforced")
              .details(details)
              .build());
    }
    return summary;
  }
}
