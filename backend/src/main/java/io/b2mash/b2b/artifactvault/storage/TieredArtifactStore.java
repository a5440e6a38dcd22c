package io.b2mash.b2b.artifactvault.storage;

import io.b2mash.b2b.artifactvault.artifact.ArtifactIdentifier;
import io.b2mash.b2b.artifactvault.artifact.PathValidator;
import io.b2mash.b2b.artifactvault.audit.AuditEventBuilder;
import io.b2mash.b2b.artifactvault.audit.AuditService;
import io.b2mash.b2b.artifactvault.audit.AuditSubsystem;
import io.b2mash.b2b.artifactvault.classification.ClassificationLabel;
import io.b2mash.b2b.artifactvault.classification.LabelOrdering;
import io.b2mash.b2b.artifactvault.config.VaultProperties;
import io.b2mash.b2b.artifactvault.crypto.Envelope;
import io.b2mash.b2b.artifactvault.crypto.EnvelopeCipher;
import io.b2mash.b2b.artifactvault.crypto.KeyRecord;
import io.b2mash.b2b.artifactvault.crypto.Keyring;
import io.b2mash.b2b.artifactvault.exception.EnvelopeAuthenticationException;
import io.b2mash.b2b.artifactvault.exception.InvalidIdentifierException;
import io.b2mash.b2b.artifactvault.exception.PermissionDeniedException;
import io.b2mash.b2b.artifactvault.exception.ResourceConflictException;
import io.b2mash.b2b.artifactvault.exception.ResourceNotFoundException;
import io.b2mash.b2b.artifactvault.exception.StorageException;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Physical placement of artifacts in the hot, warm and cold tiers. The only component that
 * creates, moves or destroys artifact files.
 *
 * <p>Ordering rules that keep every crash recoverable:
 *
 * <ul>
 *   <li>write: old sidecar removed, payload written, sidecar written last as the commit marker
 *   <li>promote: destination payload and sidecar written and flushed, then source sidecar and
 *       payload removed; a destination that already exists means an earlier run got that far
 *   <li>purge: sidecar removed first, so a half-purged artifact is already invisible
 * </ul>
 *
 * <p>Mutations of one identifier are serialized through a striped lock. A missing source on
 * promote or purge is an already-completed move, not an error.
 */
@Component
public class TieredArtifactStore {

  private static final Logger log = LoggerFactory.getLogger(TieredArtifactStore.class);

  private static final int LOCK_STRIPES = 64;

  private final StorageLayout layout;
  private final ObjectMapper objectMapper;
  private final Keyring keyring;
  private final EnvelopeCipher cipher;
  private final LabelOrdering labelOrdering;
  private final AuditService auditService;
  private final Clock clock;
  private final boolean encryptionEnabled;
  private final ClassificationLabel defaultLabel;
  private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

  public TieredArtifactStore(
      StorageLayout layout,
      ObjectMapper objectMapper,
      Keyring keyring,
      EnvelopeCipher cipher,
      LabelOrdering labelOrdering,
      AuditService auditService,
      Clock clock,
      VaultProperties properties) {
    this.layout = layout;
    this.objectMapper = objectMapper;
    this.keyring = keyring;
    this.cipher = cipher;
    this.labelOrdering = labelOrdering;
    this.auditService = auditService;
    this.clock = clock;
    this.encryptionEnabled = properties.encryptionEnabled();
    this.defaultLabel = properties.classification().defaultLabel();
    for (int i = 0; i < LOCK_STRIPES; i++) {
      locks[i] = new ReentrantLock();
    }
    if (!encryptionEnabled) {
      log.warn("Artifact encryption is disabled; new artifacts are stored in plaintext");
    }
  }

  /**
   * Writes a new artifact to the hot tier, replacing any hot artifact with the same identifier.
   *
   * @param label classification label; the configured default when null
   * @return the committed sidecar
   * @throws ResourceConflictException if the identifier is already held by the warm or cold tier
   */
  public SidecarMetadata write(ArtifactIdentifier id, byte[] content, ClassificationLabel label) {
    ClassificationLabel resolvedLabel = label != null ? label : defaultLabel;
    ReentrantLock lock = lockFor(id);
    lock.lock();
    try {
      for (Tier tier : List.of(Tier.WARM, Tier.COLD)) {
        if (Files.exists(layout.sidecarPath(tier, id))) {
          throw new ResourceConflictException(
              "Artifact already archived",
              "Artifact " + id + " is held by the " + tier.getValue() + " tier");
        }
      }

      byte[] payload;
      String keyId = null;
      if (encryptionEnabled) {
        KeyRecord key = keyring.activeKey();
        Envelope envelope = cipher.encrypt(content, key);
        payload = objectMapper.writeValueAsBytes(envelope);
        keyId = key.keyId();
      } else {
        payload = content;
      }

      var sidecar =
          new SidecarMetadata(
              resolvedLabel,
              id.tenantId(),
              id.workflowId(),
              id.artifactId(),
              keyId,
              clock.instant(),
              content.length,
              encryptionEnabled);

      Path sidecarPath = layout.sidecarPath(Tier.HOT, id);
      Files.deleteIfExists(sidecarPath);
      AtomicFiles.writeAtomically(layout.payloadPath(Tier.HOT, id), payload);
      AtomicFiles.writeAtomically(sidecarPath, objectMapper.writeValueAsBytes(sidecar));

      auditService.log(
          AuditEventBuilder.builder()
              .subsystem(AuditSubsystem.STORAGE)
              .eventType("artifact_written")
              .artifact(id)
              .details(
                  detailsOf(
                      "tier", Tier.HOT.getValue(),
                      "size_bytes", content.length,
                      "label", resolvedLabel.getValue(),
                      "encrypted", encryptionEnabled,
                      "key_id", keyId))
              .build());
      log.debug("Wrote artifact {} ({} bytes, label={})", id, content.length, resolvedLabel);
      return sidecar;
    } catch (IOException e) {
      throw new StorageException("Failed to write artifact " + id, e);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Reads and, when encrypted, decrypts an artifact for an actor with the given clearance.
   *
   * @throws ResourceNotFoundException if the tier does not hold the artifact
   * @throws PermissionDeniedException if the clearance ranks below the artifact's label
   * @throws EnvelopeAuthenticationException if the ciphertext fails verification
   */
  public byte[] read(Tier tier, ArtifactIdentifier id, ClassificationLabel clearance) {
    SidecarMetadata sidecar = requireSidecar(tier, id);
    ClassificationLabel label = sidecar.label() != null ? sidecar.label() : defaultLabel;
    if (!labelOrdering.checkAccess(label, clearance)) {
      throw new PermissionDeniedException(
          "Insufficient clearance",
          "Clearance "
              + clearance.getValue()
              + " does not permit reading "
              + label.getValue()
              + " artifact "
              + id);
    }
    return decode(tier, id, sidecar);
  }

  /**
   * Reads an artifact's plaintext without a clearance check. For callers that have already applied
   * classification gating themselves, such as tenant export.
   */
  public byte[] readPlaintext(Tier tier, ArtifactIdentifier id) {
    return decode(tier, id, requireSidecar(tier, id));
  }

  /**
   * Moves an artifact from {@code from} to the adjacent tier {@code to}.
   *
   * @throws IllegalArgumentException if {@code to} is not the tier following {@code from}
   */
  public PromotionResult promote(ArtifactIdentifier id, Tier from, Tier to, boolean dryRun) {
    if (from.isTerminal() || from.next() != to) {
      throw new IllegalArgumentException(
          "Cannot promote from " + from.getValue() + " to " + to.getValue());
    }
    ReentrantLock lock = lockFor(id);
    lock.lock();
    try {
      Path sourceSidecar = layout.sidecarPath(from, id);
      Path sourcePayload = layout.payloadPath(from, id);
      Optional<SidecarMetadata> sidecar = readSidecar(from, id);

      if (sidecar.isEmpty()) {
        if (!dryRun && Files.deleteIfExists(sourcePayload)) {
          log.info("Removed orphaned {} payload of {}", from.getValue(), id);
        }
        return new PromotionResult(id, from, to, PromotionResult.Outcome.ALREADY_COMPLETE, null);
      }
      if (Files.exists(layout.sidecarPath(to, id))) {
        if (!dryRun) {
          Files.deleteIfExists(sourceSidecar);
          Files.deleteIfExists(sourcePayload);
          log.info(
              "Promotion of {} to {} had already completed, removed stale {} copy",
              id,
              to.getValue(),
              from.getValue());
        }
        return new PromotionResult(id, from, to, PromotionResult.Outcome.ALREADY_COMPLETE, null);
      }
      if (dryRun) {
        return new PromotionResult(
            id, from, to, PromotionResult.Outcome.WOULD_PROMOTE, sidecar.get());
      }

      byte[] payload = Files.readAllBytes(sourcePayload);
      AtomicFiles.writeAtomically(layout.payloadPath(to, id), payload);
      AtomicFiles.writeAtomically(
          layout.sidecarPath(to, id), objectMapper.writeValueAsBytes(sidecar.get()));
      Files.deleteIfExists(sourceSidecar);
      Files.deleteIfExists(sourcePayload);

      Instant now = clock.instant();
      auditService.log(
          AuditEventBuilder.builder()
              .subsystem(AuditSubsystem.STORAGE)
              .eventType("promoted_to_" + to.getValue())
              .artifact(id)
              .details(
                  detailsOf(
                      "from_tier", from.getValue(),
                      "to_tier", to.getValue(),
                      "age_days", sidecar.get().ageDays(now),
                      "size_bytes", sidecar.get().size()))
              .build());
      log.debug("Promoted {} from {} to {}", id, from.getValue(), to.getValue());
      return new PromotionResult(id, from, to, PromotionResult.Outcome.PROMOTED, sidecar.get());
    } catch (IOException e) {
      throw new StorageException(
          "Failed to promote " + id + " from " + from.getValue() + " to " + to.getValue(), e);
    } finally {
      lock.unlock();
    }
  }

  /** Irreversibly deletes an artifact and its sidecar from a tier. */
  public PurgeResult purge(Tier tier, ArtifactIdentifier id, boolean dryRun) {
    ReentrantLock lock = lockFor(id);
    lock.lock();
    try {
      Path payload = layout.payloadPath(tier, id);
      Optional<SidecarMetadata> sidecar = readSidecar(tier, id);
      if (sidecar.isEmpty()) {
        if (!dryRun && Files.deleteIfExists(payload)) {
          log.info("Removed orphaned {} payload of {}", tier.getValue(), id);
        }
        return new PurgeResult(id, tier, PurgeResult.Outcome.ALREADY_COMPLETE, null);
      }
      if (dryRun) {
        return new PurgeResult(id, tier, PurgeResult.Outcome.WOULD_PURGE, sidecar.get());
      }

      Files.deleteIfExists(layout.sidecarPath(tier, id));
      Files.deleteIfExists(payload);

      auditService.log(
          AuditEventBuilder.builder()
              .subsystem(AuditSubsystem.STORAGE)
              .eventType("artifact_purged")
              .artifact(id)
              .details(
                  detailsOf(
                      "tier", tier.getValue(),
                      "age_days", sidecar.get().ageDays(clock.instant()),
                      "size_bytes", sidecar.get().size()))
              .build());
      log.debug("Purged {} from {}", id, tier.getValue());
      return new PurgeResult(id, tier, PurgeResult.Outcome.PURGED, sidecar.get());
    } catch (IOException e) {
      throw new StorageException("Failed to purge " + id + " from " + tier.getValue(), e);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Rewrites the sidecar of an artifact with a new label, in whichever tier holds it. The payload
   * is untouched.
   *
   * @return the updated sidecar
   * @throws ResourceNotFoundException if no tier holds the artifact
   */
  public SidecarMetadata updateLabel(ArtifactIdentifier id, ClassificationLabel label) {
    Objects.requireNonNull(label, "label");
    ReentrantLock lock = lockFor(id);
    lock.lock();
    try {
      Tier tier =
          locate(id).orElseThrow(() -> new ResourceNotFoundException("Artifact", id.toString()));
      SidecarMetadata updated = requireSidecar(tier, id).withLabel(label);
      AtomicFiles.writeAtomically(
          layout.sidecarPath(tier, id), objectMapper.writeValueAsBytes(updated));
      return updated;
    } catch (IOException e) {
      throw new StorageException("Failed to relabel " + id, e);
    } finally {
      lock.unlock();
    }
  }

  public Optional<SidecarMetadata> readSidecar(Tier tier, ArtifactIdentifier id) {
    Path path = layout.sidecarPath(tier, id);
    byte[] bytes;
    try {
      bytes = Files.readAllBytes(path);
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException e) {
      throw new StorageException("Failed to read sidecar " + path, e);
    }
    SidecarMetadata sidecar = objectMapper.readValue(bytes, SidecarMetadata.class);
    if (!id.tenantId().equals(sidecar.tenantId())) {
      log.warn("Sidecar {} names tenant {}, ignoring it", path, sidecar.tenantId());
      return Optional.empty();
    }
    return Optional.of(sidecar);
  }

  /**
   * The tier currently holding an artifact. When an interrupted promotion left copies in two tiers,
   * the later tier wins.
   */
  public Optional<Tier> locate(ArtifactIdentifier id) {
    for (Tier tier : List.of(Tier.COLD, Tier.WARM, Tier.HOT)) {
      if (Files.exists(layout.sidecarPath(tier, id))) {
        return Optional.of(tier);
      }
    }
    return Optional.empty();
  }

  /** Committed artifacts of one tenant in one tier, sorted by workflow then artifact id. */
  public List<ArtifactIdentifier> listByTenant(Tier tier, String tenantId) {
    PathValidator.validate(tenantId);
    Path tenantDir = layout.tenantMetaDir(tier, tenantId);
    var identifiers = new ArrayList<ArtifactIdentifier>();
    for (String workflowId : childDirectories(tenantDir)) {
      try (DirectoryStream<Path> files =
          Files.newDirectoryStream(
              tenantDir.resolve(workflowId), "*" + StorageLayout.SIDECAR_SUFFIX)) {
        for (Path file : files) {
          String name = file.getFileName().toString();
          String artifactId =
              name.substring(0, name.length() - StorageLayout.SIDECAR_SUFFIX.length());
          if (Files.isRegularFile(file) && PathValidator.isValid(artifactId)) {
            identifiers.add(ArtifactIdentifier.of(tenantId, workflowId, artifactId));
          }
        }
      } catch (NoSuchFileException e) {
        log.debug("Workflow directory {} vanished during listing", workflowId);
      } catch (IOException e) {
        throw new StorageException("Failed to list " + tenantDir.resolve(workflowId), e);
      }
    }
    identifiers.sort(
        Comparator.comparing(ArtifactIdentifier::workflowId)
            .thenComparing(ArtifactIdentifier::artifactId));
    return identifiers;
  }

  /** Tenants with at least a directory in the tier, sorted. */
  public List<String> listTenants(Tier tier) {
    return childDirectories(layout.metaDir(tier));
  }

  /** Artifact count and plaintext bytes per tier, summed from sidecars. */
  public Map<Tier, TierStats> storageStats() {
    var stats = new EnumMap<Tier, TierStats>(Tier.class);
    for (Tier tier : Tier.values()) {
      long artifacts = 0;
      long bytes = 0;
      for (String tenantId : listTenants(tier)) {
        for (ArtifactIdentifier id : listByTenant(tier, tenantId)) {
          Optional<SidecarMetadata> sidecar = readSidecar(tier, id);
          if (sidecar.isPresent()) {
            artifacts++;
            bytes += sidecar.get().size();
          }
        }
      }
      stats.put(tier, new TierStats(artifacts, bytes));
    }
    return stats;
  }

  /**
   * Purges whatever a tenant still holds in any tier, then removes its directories with their
   * uncommitted payloads and temp files. Every identifier lock is held throughout, so a write
   * cannot commit between the final listing and the directory removal.
   *
   * @return artifacts purged by this call, per tier
   */
  public Map<Tier, Integer> removeTenant(String tenantId) {
    PathValidator.validate(tenantId);
    for (ReentrantLock lock : locks) {
      lock.lock();
    }
    try {
      var purged = new EnumMap<Tier, Integer>(Tier.class);
      for (Tier tier : Tier.values()) {
        int count = 0;
        for (ArtifactIdentifier id : listByTenant(tier, tenantId)) {
          if (purge(tier, id, false).outcome() == PurgeResult.Outcome.PURGED) {
            count++;
          }
        }
        purged.put(tier, count);
        if (count > 0) {
          log.info("Purged {} late {} artifact(s) of tenant {}", count, tier.getValue(), tenantId);
        }
      }
      for (Tier tier : Tier.values()) {
        removeTree(layout.metaDir(tier), layout.tenantMetaDir(tier, tenantId));
        removeTree(layout.dataDir(tier), layout.tenantDataDir(tier, tenantId));
      }
      return purged;
    } finally {
      for (int i = locks.length - 1; i >= 0; i--) {
        locks[i].unlock();
      }
    }
  }

  private SidecarMetadata requireSidecar(Tier tier, ArtifactIdentifier id) {
    return readSidecar(tier, id)
        .orElseThrow(
            () ->
                ResourceNotFoundException.withDetail(
                    "Artifact not found",
                    "No artifact " + id + " in the " + tier.getValue() + " tier"));
  }

  private byte[] decode(Tier tier, ArtifactIdentifier id, SidecarMetadata sidecar) {
    byte[] payload;
    try {
      payload = Files.readAllBytes(layout.payloadPath(tier, id));
    } catch (NoSuchFileException e) {
      throw ResourceNotFoundException.withDetail(
          "Artifact not found",
          "Payload of " + id + " is missing from the " + tier.getValue() + " tier");
    } catch (IOException e) {
      throw new StorageException("Failed to read artifact " + id, e);
    }
    if (!sidecar.encrypted()) {
      return payload;
    }
    Envelope envelope;
    try {
      envelope = objectMapper.readValue(payload, Envelope.class);
    } catch (JacksonException e) {
      throw new EnvelopeAuthenticationException(sidecar.keyId(), e);
    }
    return cipher.decrypt(envelope);
  }

  private List<String> childDirectories(Path dir) {
    if (!Files.isDirectory(dir)) {
      return List.of();
    }
    var names = new ArrayList<String>();
    try (DirectoryStream<Path> children = Files.newDirectoryStream(dir, Files::isDirectory)) {
      for (Path child : children) {
        String name = child.getFileName().toString();
        if (PathValidator.isValid(name)) {
          names.add(name);
        }
      }
    } catch (NoSuchFileException e) {
      return List.of();
    } catch (IOException e) {
      throw new StorageException("Failed to list " + dir, e);
    }
    names.sort(Comparator.naturalOrder());
    return names;
  }

  private void removeTree(Path parent, Path dir) {
    Path normalized = dir.toAbsolutePath().normalize();
    if (!parent.toAbsolutePath().normalize().equals(normalized.getParent())) {
      throw new InvalidIdentifierException(
          String.valueOf(dir.getFileName()), "does not resolve to a directory under " + parent);
    }
    if (!Files.isDirectory(normalized)) {
      return;
    }
    List<Path> paths;
    try (Stream<Path> walk = Files.walk(normalized)) {
      paths = walk.sorted(Comparator.reverseOrder()).toList();
    } catch (IOException e) {
      throw new StorageException("Failed to walk " + dir, e);
    }
    int leftovers = 0;
    for (Path path : paths) {
      try {
        if (Files.isRegularFile(path)) {
          leftovers++;
        }
        Files.deleteIfExists(path);
      } catch (IOException e) {
        throw new StorageException("Failed to remove " + path, e);
      }
    }
    if (leftovers > 0) {
      log.info("Removed {} uncommitted file(s) under {}", leftovers, dir);
    }
  }

  private ReentrantLock lockFor(ArtifactIdentifier id) {
    return locks[Math.floorMod(id.hashCode(), LOCK_STRIPES)];
  }

  /** Ordered detail map that tolerates null values, unlike {@code Map.of}. */
  private static Map<String, Object> detailsOf(Object... keyValues) {
    var details = new LinkedHashMap<String, Object>();
    for (int i = 0; i < keyValues.length; i += 2) {
      if (keyValues[i + 1] != null) {
        details.put((String) keyValues[i], keyValues[i + 1]);
      }
    }
    return details;
  }
}
