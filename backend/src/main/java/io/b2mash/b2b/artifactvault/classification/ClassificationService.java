package io.b2mash.b2b.artifactvault.classification;

import io.b2mash.b2b.artifactvault.artifact.ArtifactIdentifier;
import io.b2mash.b2b.artifactvault.audit.AuditEventBuilder;
import io.b2mash.b2b.artifactvault.audit.AuditService;
import io.b2mash.b2b.artifactvault.audit.AuditSubsystem;
import io.b2mash.b2b.artifactvault.config.VaultProperties;
import io.b2mash.b2b.artifactvault.exception.ResourceNotFoundException;
import io.b2mash.b2b.artifactvault.security.Actor;
import io.b2mash.b2b.artifactvault.security.Capability;
import io.b2mash.b2b.artifactvault.security.CapabilityChecker;
import io.b2mash.b2b.artifactvault.storage.SidecarMetadata;
import io.b2mash.b2b.artifactvault.storage.Tier;
import io.b2mash.b2b.artifactvault.storage.TieredArtifactStore;
import java.util.LinkedHashMap;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Reads and changes the classification label of stored artifacts. The label lives in the sidecar
 * of whichever tier currently holds the artifact.
 */
@Service
public class ClassificationService {

  private static final Logger log = LoggerFactory.getLogger(ClassificationService.class);

  private final TieredArtifactStore store;
  private final LabelOrdering labelOrdering;
  private final CapabilityChecker capabilityChecker;
  private final AuditService auditService;
  private final ClassificationLabel defaultLabel;

  public ClassificationService(
      TieredArtifactStore store,
      LabelOrdering labelOrdering,
      CapabilityChecker capabilityChecker,
      AuditService auditService,
      VaultProperties properties) {
    this.store = store;
    this.labelOrdering = labelOrdering;
    this.capabilityChecker = capabilityChecker;
    this.auditService = auditService;
    this.defaultLabel = properties.classification().defaultLabel();
  }

  /**
   * Relabels an artifact.
   *
   * @throws NullPointerException if {@code label} is null; the sidecar is left unchanged
   * @throws ResourceNotFoundException if no tier holds the artifact
   */
  public SidecarMetadata setLabel(Actor actor, ArtifactIdentifier id, ClassificationLabel label) {
    Objects.requireNonNull(label, "label");
    capabilityChecker.require(actor, Capability.RELABEL);
    ClassificationLabel previous = getLabel(id);
    SidecarMetadata updated = store.updateLabel(id, label);

    var details = new LinkedHashMap<String, Object>();
    details.put("previous_label", previous.getValue());
    details.put("label", label.getValue());
    auditService.log(
        AuditEventBuilder.builder()
            .subsystem(AuditSubsystem.CLASSIFICATION)
            .eventType("label_changed")
            .artifact(id)
            .actor(actor)
            .details(details)
            .build());
    log.info("Artifact {} relabeled {} -> {} by {}", id, previous, label, actor.id());
    return updated;
  }

  /** Current label of an artifact, or the configured default when none is recorded. */
  public ClassificationLabel getLabel(ArtifactIdentifier id) {
    Optional<Tier> tier = store.locate(id);
    if (tier.isEmpty()) {
      return defaultLabel;
    }
    return store
        .readSidecar(tier.get(), id)
        .map(SidecarMetadata::label)
        .orElse(defaultLabel);
  }

  public boolean checkAccess(ClassificationLabel label, ClassificationLabel clearance) {
    return labelOrdering.checkAccess(label, clearance);
  }
}
