package io.b2mash.b2b.artifactvault.compliance;

import io.b2mash.b2b.artifactvault.artifact.PathValidator;
import io.b2mash.b2b.artifactvault.audit.AuditEventBuilder;
import io.b2mash.b2b.artifactvault.audit.AuditService;
import io.b2mash.b2b.artifactvault.audit.AuditSubsystem;
import io.b2mash.b2b.artifactvault.security.Actor;
import io.b2mash.b2b.artifactvault.security.Capability;
import io.b2mash.b2b.artifactvault.security.CapabilityChecker;
import io.b2mash.b2b.artifactvault.storage.AppendOnlyLog;
import io.b2mash.b2b.artifactvault.storage.StorageLayout;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

/**
 * Per-tenant legal holds, persisted as an append-only log. Applying and releasing are idempotent;
 * only an actual state change is written and audited.
 */
@Component
public class LegalHoldRegistry {

  private static final Logger log = LoggerFactory.getLogger(LegalHoldRegistry.class);

  private final AppendOnlyLog<LegalHold> holdLog;
  private final CapabilityChecker capabilityChecker;
  private final AuditService auditService;
  private final Clock clock;
  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, LegalHold> latest = new ConcurrentHashMap<>();

  public LegalHoldRegistry(
      StorageLayout layout,
      ObjectMapper objectMapper,
      CapabilityChecker capabilityChecker,
      AuditService auditService,
      Clock clock) {
    this.holdLog = new AppendOnlyLog<>(layout.legalHoldLog(), objectMapper, LegalHold.class);
    this.capabilityChecker = capabilityChecker;
    this.auditService = auditService;
    this.clock = clock;
    for (LegalHold hold : holdLog.replay()) {
      latest.put(hold.tenantId(), hold);
    }
  }

  /**
   * Places a tenant under legal hold. A tenant already held keeps its existing hold and reason.
   *
   * @return the active hold
   */
  public LegalHold applyHold(Actor actor, String tenantId, String reason) {
    capabilityChecker.require(actor, Capability.LEGAL_HOLD);
    PathValidator.validate(tenantId);
    lock.lock();
    try {
      LegalHold current = latest.get(tenantId);
      if (current != null && current.isActive()) {
        log.debug("Tenant {} is already under legal hold", tenantId);
        return current;
      }
      var hold = new LegalHold(tenantId, reason, clock.instant(), null, actor.id());
      holdLog.append(hold);
      latest.put(tenantId, hold);
      auditService.log(
          AuditEventBuilder.builder()
              .subsystem(AuditSubsystem.COMPLIANCE)
              .eventType("legal_hold_applied")
              .tenantId(tenantId)
              .actor(actor)
              .details(Map.of("reason", reason != null ? reason : ""))
              .build());
      log.info("Legal hold applied to tenant {} by {}", tenantId, actor.id());
      return hold;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Lifts a tenant's legal hold.
   *
   * @return the release record, or empty when the tenant was not held
   */
  public Optional<LegalHold> releaseHold(Actor actor, String tenantId) {
    capabilityChecker.require(actor, Capability.LEGAL_HOLD);
    PathValidator.validate(tenantId);
    lock.lock();
    try {
      LegalHold current = latest.get(tenantId);
      if (current == null || !current.isActive()) {
        log.debug("Tenant {} is not under legal hold, nothing to release", tenantId);
        return Optional.empty();
      }
      LegalHold released = current.release(clock.instant(), actor.id());
      holdLog.append(released);
      latest.put(tenantId, released);
      auditService.log(
          AuditEventBuilder.builder()
              .subsystem(AuditSubsystem.COMPLIANCE)
              .eventType("legal_hold_released")
              .tenantId(tenantId)
              .actor(actor)
              .build());
      log.info("Legal hold released for tenant {} by {}", tenantId, actor.id());
      return Optional.of(released);
    } finally {
      lock.unlock();
    }
  }

  public boolean isHeld(String tenantId) {
    return activeHold(tenantId).isPresent();
  }

  public Optional<LegalHold> activeHold(String tenantId) {
    return Optional.ofNullable(latest.get(tenantId)).filter(LegalHold::isActive);
  }

  /** Every hold record ever written, oldest first. */
  public List<LegalHold> holds() {
    lock.lock();
    try {
      return holdLog.replay();
    } finally {
      lock.unlock();
    }
  }
}
