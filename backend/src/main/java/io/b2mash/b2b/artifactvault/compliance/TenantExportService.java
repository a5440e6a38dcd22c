package io.b2mash.b2b.artifactvault.compliance;

import io.b2mash.b2b.artifactvault.artifact.ArtifactIdentifier;
import io.b2mash.b2b.artifactvault.artifact.PathValidator;
import io.b2mash.b2b.artifactvault.audit.AuditEventBuilder;
import io.b2mash.b2b.artifactvault.audit.AuditService;
import io.b2mash.b2b.artifactvault.audit.AuditSubsystem;
import io.b2mash.b2b.artifactvault.classification.ClassificationLabel;
import io.b2mash.b2b.artifactvault.classification.ExportPolicy;
import io.b2mash.b2b.artifactvault.classification.LabelOrdering;
import io.b2mash.b2b.artifactvault.config.VaultProperties;
import io.b2mash.b2b.artifactvault.eventlog.EventLogEntry;
import io.b2mash.b2b.artifactvault.eventlog.EventLogStore;
import io.b2mash.b2b.artifactvault.exception.ResourceConflictException;
import io.b2mash.b2b.artifactvault.exception.StorageException;
import io.b2mash.b2b.artifactvault.exception.VaultException;
import io.b2mash.b2b.artifactvault.security.Actor;
import io.b2mash.b2b.artifactvault.security.Capability;
import io.b2mash.b2b.artifactvault.security.CapabilityChecker;
import io.b2mash.b2b.artifactvault.storage.AtomicFiles;
import io.b2mash.b2b.artifactvault.storage.SidecarMetadata;
import io.b2mash.b2b.artifactvault.storage.StorageLayout;
import io.b2mash.b2b.artifactvault.storage.Tier;
import io.b2mash.b2b.artifactvault.storage.TieredArtifactStore;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import tools.jackson.databind.ObjectMapper;

/**
 * Copies everything the vault holds for one tenant into a directory outside the storage root.
 * Classification gating is applied per artifact against the exporting actor's clearance. Storage is
 * only read, never changed.
 *
 * <p>Layout of the destination:
 *
 * <pre>
 * artifacts/&lt;tier&gt;/&lt;workflow&gt;/&lt;artifact&gt;       plaintext
 * redacted/&lt;tier&gt;/&lt;workflow&gt;/&lt;artifact&gt;.json   metadata only
 * logs/&lt;kind&gt;.jsonl                              tenant log records
 * manifest.json
 * </pre>
 */
@Service
public class TenantExportService {

  private static final Logger log = LoggerFactory.getLogger(TenantExportService.class);

  static final String MANIFEST_FILE = "manifest.json";

  private final TieredArtifactStore store;
  private final EventLogStore eventLogStore;
  private final LabelOrdering labelOrdering;
  private final CapabilityChecker capabilityChecker;
  private final AuditService auditService;
  private final StorageLayout layout;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final ExportPolicy exportPolicy;
  private final ClassificationLabel defaultLabel;

  public TenantExportService(
      TieredArtifactStore store,
      EventLogStore eventLogStore,
      LabelOrdering labelOrdering,
      CapabilityChecker capabilityChecker,
      AuditService auditService,
      StorageLayout layout,
      ObjectMapper objectMapper,
      Clock clock,
      VaultProperties properties) {
    this.store = store;
    this.eventLogStore = eventLogStore;
    this.labelOrdering = labelOrdering;
    this.capabilityChecker = capabilityChecker;
    this.auditService = auditService;
    this.layout = layout;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.exportPolicy = properties.compliance().exportPolicy();
    this.defaultLabel = properties.classification().defaultLabel();
  }

  /**
   * Exports a tenant.
   *
   * @param destination directory to write into; created when missing
   * @throws ResourceConflictException if {@code destination} lies inside the storage root
   */
  public ExportManifest export(Actor actor, String tenantId, Path destination) {
    capabilityChecker.require(actor, Capability.EXPORT);
    PathValidator.validate(tenantId);
    Path target = destination.toAbsolutePath().normalize();
    if (layout.contains(target)) {
      throw new ResourceConflictException(
          "Invalid export destination",
          "Export destination " + target + " lies inside the storage root");
    }

    Instant exportedAt = clock.instant();
    var exported = new LinkedHashMap<String, Integer>();
    var excluded = new ArrayList<String>();
    int redacted = 0;
    int denied = 0;
    int failed = 0;

    for (Tier tier : Tier.values()) {
      int count = 0;
      for (ArtifactIdentifier id : store.listByTenant(tier, tenantId)) {
        if (store.locate(id).filter(tier::equals).isEmpty()) {
          // stale copy of an interrupted promotion; the later tier is exported
          continue;
        }
        SidecarMetadata sidecar;
        ClassificationLabel label;
        byte[] content = null;
        try {
          Optional<SidecarMetadata> found = store.readSidecar(tier, id);
          if (found.isEmpty()) {
            continue;
          }
          sidecar = found.get();
          label = sidecar.label() != null ? sidecar.label() : defaultLabel;
          if (labelOrdering.checkAccess(label, actor.clearance())) {
            content = store.readPlaintext(tier, id);
          }
        } catch (VaultException e) {
          log.warn("Export of {} from {} failed: {}", id, tier.getValue(), e.getMessage());
          failed++;
          continue;
        }

        if (content != null) {
          writeFile(artifactPath(target.resolve("artifacts"), tier, id, ""), content);
          count++;
          continue;
        }
        excluded.add(id.toString());
        recordDenial(actor, id, label);
        if (exportPolicy == ExportPolicy.REDACT) {
          writeFile(
              artifactPath(target.resolve("redacted"), tier, id, StorageLayout.SIDECAR_SUFFIX),
              objectMapper.writeValueAsBytes(redactedMetadata(tier, sidecar, label)));
          redacted++;
        } else {
          denied++;
        }
      }
      exported.put(tier.getValue(), count);
    }

    var logCounts = new LinkedHashMap<String, Integer>();
    for (String kind : eventLogStore.kinds()) {
      List<EventLogEntry> entries = eventLogStore.readTenant(kind, tenantId);
      if (entries.isEmpty()) {
        continue;
      }
      var content = new StringBuilder();
      entries.forEach(entry -> content.append(entry.rawLine()).append('\n'));
      writeFile(
          target.resolve("logs").resolve(kind + StorageLayout.LOG_SUFFIX),
          content.toString().getBytes(StandardCharsets.UTF_8));
      logCounts.put(kind, entries.size());
    }

    var manifest =
        new ExportManifest(
            tenantId,
            exportedAt,
            actor.id(),
            exportPolicy,
            exported,
            redacted,
            denied,
            failed,
            logCounts,
            List.copyOf(excluded));
    writeFile(target.resolve(MANIFEST_FILE), objectMapper.writeValueAsBytes(manifest));

    var details = new LinkedHashMap<String, Object>();
    details.put("artifacts", manifest.totalArtifacts());
    details.put("redacted", redacted);
    details.put("denied", denied);
    details.put("failed", failed);
    details.put("log_records", manifest.totalLogRecords());
    auditService.log(
        AuditEventBuilder.builder()
            .subsystem(AuditSubsystem.COMPLIANCE)
            .eventType("tenant_exported")
            .tenantId(tenantId)
            .actor(actor)
            .details(details)
            .build());
    log.info(
        "Tenant {} exported by {} to {}: {} artifact(s), {} redacted, {} denied, {} failed,"
            + " {} log record(s)",
        tenantId,
        actor.id(),
        target,
        manifest.totalArtifacts(),
        redacted,
        denied,
        failed,
        manifest.totalLogRecords());
    return manifest;
  }

  private void recordDenial(Actor actor, ArtifactIdentifier id, ClassificationLabel label) {
    var details = new LinkedHashMap<String, Object>();
    details.put("label", label.getValue());
    details.put("clearance", actor.clearance().getValue());
    details.put("policy", exportPolicy.name().toLowerCase(Locale.ROOT));
    auditService.log(
        AuditEventBuilder.builder()
            .subsystem(AuditSubsystem.COMPLIANCE)
            .eventType("export_denied")
            .artifact(id)
            .actor(actor)
            .details(details)
            .build());
  }

  private Map<String, Object> redactedMetadata(
      Tier tier, SidecarMetadata sidecar, ClassificationLabel label) {
    var metadata = new LinkedHashMap<String, Object>();
    metadata.put("tenant_id", sidecar.tenantId());
    metadata.put("workflow_id", sidecar.workflowId());
    metadata.put("artifact_id", sidecar.artifactId());
    metadata.put("tier", tier.getValue());
    metadata.put("label", label.getValue());
    metadata.put("created_at", sidecar.createdAt().toString());
    metadata.put("size", sidecar.size());
    metadata.put("redacted", true);
    return metadata;
  }

  private static Path artifactPath(Path base, Tier tier, ArtifactIdentifier id, String suffix) {
    return base.resolve(tier.getValue()).resolve(id.workflowId()).resolve(id.artifactId() + suffix);
  }

  private static void writeFile(Path path, byte[] content) {
    try {
      AtomicFiles.writeAtomically(path, content);
    } catch (IOException e) {
      throw new StorageException("Failed to write export file " + path, e);
    }
  }
}
