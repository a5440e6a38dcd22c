package io.b2mash.b2b.artifactvault.crypto;

import io.b2mash.b2b.artifactvault.audit.AuditEventBuilder;
import io.b2mash.b2b.artifactvault.audit.AuditService;
import io.b2mash.b2b.artifactvault.audit.AuditSubsystem;
import io.b2mash.b2b.artifactvault.security.Actor;
import io.b2mash.b2b.artifactvault.security.Capability;
import io.b2mash.b2b.artifactvault.security.CapabilityChecker;
import java.util.LinkedHashMap;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Capability-gated, audited access to the keyring for operators. */
@Service
public class KeyManagementService {

  private static final Logger log = LoggerFactory.getLogger(KeyManagementService.class);

  private final Keyring keyring;
  private final CapabilityChecker capabilityChecker;
  private final AuditService auditService;

  public KeyManagementService(
      Keyring keyring, CapabilityChecker capabilityChecker, AuditService auditService) {
    this.keyring = keyring;
    this.capabilityChecker = capabilityChecker;
    this.auditService = auditService;
  }

  /**
   * Retires the active key and makes a fresh key active. Artifacts encrypted under the retired key
   * stay readable; new writes use the new key.
   *
   * @return the new active key
   */
  public KeyRecord rotate(Actor actor) {
    capabilityChecker.require(actor, Capability.ROTATE_KEY);
    String previousKeyId =
        keyring.keys().stream()
            .filter(KeyRecord::isActive)
            .map(KeyRecord::keyId)
            .findFirst()
            .orElse(null);
    KeyRecord created = keyring.rotate();

    var details = new LinkedHashMap<String, Object>();
    if (previousKeyId != null) {
      details.put("previous_key_id", previousKeyId);
    }
    details.put("key_id", created.keyId());
    auditService.log(
        AuditEventBuilder.builder()
            .subsystem(AuditSubsystem.CRYPTO)
            .eventType("key_rotated")
            .actor(actor)
            .details(details)
            .build());
    log.info("Key rotated by {}: {} -> {}", actor.id(), previousKeyId, created.keyId());
    return created;
  }

  /** Effective state of every key, without key material in their string form. */
  public List<KeyRecord> keys() {
    return keyring.keys();
  }
}
