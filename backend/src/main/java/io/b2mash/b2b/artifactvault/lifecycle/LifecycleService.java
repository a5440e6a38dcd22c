package io.b2mash.b2b.artifactvault.lifecycle;

import io.b2mash.b2b.artifactvault.artifact.ArtifactIdentifier;
import io.b2mash.b2b.artifactvault.audit.AuditEventBuilder;
import io.b2mash.b2b.artifactvault.audit.AuditService;
import io.b2mash.b2b.artifactvault.audit.AuditSubsystem;
import io.b2mash.b2b.artifactvault.config.VaultProperties;
import io.b2mash.b2b.artifactvault.lifecycle.LifecycleTransition.State;
import io.b2mash.b2b.artifactvault.storage.PromotionResult;
import io.b2mash.b2b.artifactvault.storage.PurgeResult;
import io.b2mash.b2b.artifactvault.storage.SidecarMetadata;
import io.b2mash.b2b.artifactvault.storage.Tier;
import io.b2mash.b2b.artifactvault.storage.TieredArtifactStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Age-driven migration of artifacts through the tiers. Each run scans hot, warm and cold in that
 * order and moves every artifact as far as its age allows, so a run leaves nothing eligible behind
 * and an immediate second run finds no transitions.
 *
 * <p>Transitions go through {@link TieredArtifactStore#promote} and {@link
 * TieredArtifactStore#purge}, which audit each one. A move already completed by a concurrent or
 * interrupted run is counted, not failed. A failure on one artifact is recorded and the scan moves
 * on.
 */
@Service
public class LifecycleService {

  private static final Logger log = LoggerFactory.getLogger(LifecycleService.class);

  private final TieredArtifactStore store;
  private final AuditService auditService;
  private final Clock clock;
  private final VaultProperties.Tiers tiers;

  public LifecycleService(
      TieredArtifactStore store,
      AuditService auditService,
      Clock clock,
      VaultProperties properties) {
    this.store = store;
    this.auditService = auditService;
    this.clock = clock;
    this.tiers = properties.tiers();
  }

  /**
   * Runs one lifecycle pass.
   *
   * @param dryRun report what is due without moving, deleting or auditing anything
   */
  public LifecycleRunSummary run(boolean dryRun) {
    Instant now = clock.instant();
    var summary = new LifecycleRunSummary(now, dryRun);
    Set<ArtifactIdentifier> visited = new HashSet<>();

    for (Tier tier : Tier.values()) {
      List<String> tenants;
      try {
        tenants = store.listTenants(tier);
      } catch (RuntimeException e) {
        log.warn("Lifecycle: cannot list tenants of {}: {}", tier.getValue(), e.getMessage());
        summary.recordListingError();
        continue;
      }
      for (String tenantId : tenants) {
        List<ArtifactIdentifier> ids;
        try {
          ids = store.listByTenant(tier, tenantId);
        } catch (RuntimeException e) {
          log.warn(
              "Lifecycle: cannot list tenant {} in {}: {}",
              tenantId,
              tier.getValue(),
              e.getMessage());
          summary.recordListingError();
          continue;
        }
        for (ArtifactIdentifier id : ids) {
          if (!visited.add(id)) {
            continue;
          }
          summary.recordScanned();
          process(id, tier, now, dryRun, summary);
        }
      }
    }

    log.info(
        "Lifecycle run completed (dryRun={}): scanned={}, eligible={}, promoted={}, purged={},"
            + " alreadyComplete={}, errors={}",
        dryRun,
        summary.getScanned(),
        summary.getEligible(),
        summary.getPromoted(),
        summary.getPurged(),
        summary.getAlreadyComplete(),
        summary.getErrors());

    if (!dryRun) {
      var details = new LinkedHashMap<String, Object>();
      details.put("scanned", summary.getScanned());
      details.put("promoted", summary.getPromoted());
      details.put("purged", summary.getPurged());
      details.put("already_complete", summary.getAlreadyComplete());
      details.put("errors", summary.getErrors());
      auditService.log(
          AuditEventBuilder.builder()
              .subsystem(AuditSubsystem.LIFECYCLE)
              .eventType("lifecycle_run_completed")
              .details(details)
              .build());
    }
    return summary;
  }

  private void process(
      ArtifactIdentifier id, Tier tier, Instant now, boolean dryRun, LifecycleRunSummary summary) {
    Optional<SidecarMetadata> sidecar;
    try {
      sidecar = store.readSidecar(tier, id);
    } catch (RuntimeException e) {
      log.warn(
          "Lifecycle: cannot read sidecar of {} in {}: {}", id, tier.getValue(), e.getMessage());
      summary.record(new LifecycleTransition(id, tier, null, State.SKIPPED, 0, e.getMessage()));
      return;
    }
    if (sidecar.isEmpty()) {
      // moved or purged between listing and reading
      summary.recordAlreadyComplete();
      return;
    }

    Duration age = sidecar.get().age(now);
    double ageDays = sidecar.get().ageDays(now);
    Tier current = tier;
    while (isExpired(age, current)) {
      Tier target = current.isTerminal() ? null : current.next();
      if (dryRun) {
        summary.record(new LifecycleTransition(id, current, target, State.ELIGIBLE, ageDays, null));
        if (target == null) {
          return;
        }
        current = target;
        continue;
      }
      try {
        if (target == null) {
          PurgeResult result = store.purge(current, id, false);
          if (result.outcome() == PurgeResult.Outcome.ALREADY_COMPLETE) {
            summary.recordAlreadyComplete();
          } else {
            summary.record(
                new LifecycleTransition(id, current, null, State.PURGED, ageDays, null));
          }
          return;
        }
        PromotionResult result = store.promote(id, current, target, false);
        if (result.outcome() == PromotionResult.Outcome.ALREADY_COMPLETE) {
          // the copy in the next tier carries on from there
          summary.recordAlreadyComplete();
        } else {
          summary.record(
              new LifecycleTransition(id, current, target, State.PROMOTED, ageDays, null));
        }
        current = target;
      } catch (RuntimeException e) {
        log.warn(
            "Lifecycle: failed to move {} out of {}: {}", id, current.getValue(), e.getMessage());
        summary.record(
            new LifecycleTransition(id, current, target, State.SKIPPED, ageDays, e.getMessage()));
        return;
      }
    }
  }

  private boolean isExpired(Duration age, Tier tier) {
    return age.compareTo(Duration.ofDays(tiers.retentionDays(tier))) > 0;
  }
}
