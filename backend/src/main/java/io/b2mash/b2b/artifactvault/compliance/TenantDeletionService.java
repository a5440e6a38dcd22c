package io.b2mash.b2b.artifactvault.compliance;

import io.b2mash.b2b.artifactvault.artifact.ArtifactIdentifier;
import io.b2mash.b2b.artifactvault.artifact.PathValidator;
import io.b2mash.b2b.artifactvault.audit.AuditEventBuilder;
import io.b2mash.b2b.artifactvault.audit.AuditService;
import io.b2mash.b2b.artifactvault.audit.AuditSubsystem;
import io.b2mash.b2b.artifactvault.config.VaultProperties;
import io.b2mash.b2b.artifactvault.eventlog.EventLogStore;
import io.b2mash.b2b.artifactvault.exception.LegalHoldActiveException;
import io.b2mash.b2b.artifactvault.security.Actor;
import io.b2mash.b2b.artifactvault.security.Capability;
import io.b2mash.b2b.artifactvault.security.CapabilityChecker;
import io.b2mash.b2b.artifactvault.storage.PurgeResult;
import io.b2mash.b2b.artifactvault.storage.Tier;
import io.b2mash.b2b.artifactvault.storage.TieredArtifactStore;
import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Irreversible removal of everything the vault holds for a tenant: artifacts in every tier and the
 * tenant's records in every auxiliary log. Dry runs walk the same enumeration through the same
 * calls with the dry-run flag set, so their counts are the live run's scope.
 */
@Service
public class TenantDeletionService {

  private static final Logger log = LoggerFactory.getLogger(TenantDeletionService.class);

  private final TieredArtifactStore store;
  private final EventLogStore eventLogStore;
  private final LegalHoldRegistry legalHoldRegistry;
  private final CapabilityChecker capabilityChecker;
  private final AuditService auditService;
  private final Clock clock;
  private final boolean legalHoldBlocksDelete;

  public TenantDeletionService(
      TieredArtifactStore store,
      EventLogStore eventLogStore,
      LegalHoldRegistry legalHoldRegistry,
      CapabilityChecker capabilityChecker,
      AuditService auditService,
      Clock clock,
      VaultProperties properties) {
    this.store = store;
    this.eventLogStore = eventLogStore;
    this.legalHoldRegistry = legalHoldRegistry;
    this.capabilityChecker = capabilityChecker;
    this.auditService = auditService;
    this.clock = clock;
    this.legalHoldBlocksDelete = properties.compliance().legalHoldBlocksDelete();
  }

  /**
   * Deletes a tenant, or previews the deletion.
   *
   * @throws LegalHoldActiveException if the tenant is held and holds block deletion; nothing is
   *     touched, not even in dry-run mode
   */
  public DeletionSummary delete(Actor actor, String tenantId, boolean dryRun) {
    capabilityChecker.require(actor, Capability.DELETE);
    PathValidator.validate(tenantId);
    var hold = legalHoldRegistry.activeHold(tenantId);
    if (hold.isPresent()) {
      if (legalHoldBlocksDelete) {
        log.warn("Deletion of tenant {} by {} refused: legal hold active", tenantId, actor.id());
        throw new LegalHoldActiveException(tenantId, hold.get().reason());
      }
      log.warn("Tenant {} is under legal hold, but holds do not block deletion", tenantId);
    }

    var artifacts = new LinkedHashMap<String, Integer>();
    for (Tier tier : Tier.values()) {
      int count = 0;
      for (ArtifactIdentifier id : store.listByTenant(tier, tenantId)) {
        PurgeResult result = store.purge(tier, id, dryRun);
        if (result.outcome() != PurgeResult.Outcome.ALREADY_COMPLETE) {
          count++;
        }
      }
      artifacts.put(tier.getValue(), count);
    }

    var logRecords = new LinkedHashMap<String, Integer>();
    for (String kind : eventLogStore.kinds()) {
      var result = eventLogStore.rewrite(kind, entry -> !entry.belongsTo(tenantId), dryRun);
      if (result.removed() > 0) {
        logRecords.put(kind, result.removed());
      }
    }

    if (!dryRun) {
      // artifacts committed after the listing above are purged and counted here
      store
          .removeTenant(tenantId)
          .forEach((tier, late) -> artifacts.merge(tier.getValue(), late, Integer::sum));
    }

    var summary =
        new DeletionSummary(
            tenantId,
            dryRun,
            clock.instant(),
            Collections.unmodifiableMap(artifacts),
            Collections.unmodifiableMap(logRecords));
    if (dryRun) {
      log.info(
          "Dry-run deletion of tenant {}: {} artifact(s), {} log record(s) in scope",
          tenantId,
          summary.totalArtifacts(),
          summary.totalLogRecords());
      return summary;
    }

    var details = new LinkedHashMap<String, Object>();
    details.put("artifacts", summary.totalArtifacts());
    details.put("log_records", summary.totalLogRecords());
    details.put("artifacts_by_tier", artifacts);
    auditService.log(
        AuditEventBuilder.builder()
            .subsystem(AuditSubsystem.COMPLIANCE)
            .eventType("tenant_deleted")
            .tenantId(tenantId)
            .actor(actor)
            .details(details)
            .build());
    log.info(
        "Tenant {} deleted by {}: {} artifact(s), {} log record(s) removed",
        tenantId,
        actor.id(),
        summary.totalArtifacts(),
        summary.totalLogRecords());
    return summary;
  }
}
