package io.b2mash.b2b.artifactvault.storage;

import io.b2mash.b2b.artifactvault.artifact.ArtifactIdentifier;
import io.b2mash.b2b.artifactvault.artifact.PathValidator;
import java.nio.file.Path;

/**
 * Physical layout of everything persisted under the storage root. Payloads and sidecars live in
 * separate trees per tier so no artifact name can collide with a sidecar name.
 *
 * <pre>
 * tiers/&lt;tier&gt;/data/&lt;tenant&gt;/&lt;workflow&gt;/&lt;artifact&gt;
 * tiers/&lt;tier&gt;/meta/&lt;tenant&gt;/&lt;workflow&gt;/&lt;artifact&gt;.json
 * keyring.jsonl
 * legal_holds.jsonl
 * audit/&lt;subsystem&gt;.jsonl
 * logs/&lt;kind&gt;.jsonl
 * </pre>
 */
public class StorageLayout {

  public static final String SIDECAR_SUFFIX = ".json";
  public static final String LOG_SUFFIX = ".jsonl";

  private final Path root;

  public StorageLayout(Path root) {
    this.root = root.toAbsolutePath().normalize();
  }

  public Path root() {
    return root;
  }

  public Path dataDir(Tier tier) {
    return root.resolve("tiers").resolve(tier.getValue()).resolve("data");
  }

  public Path metaDir(Tier tier) {
    return root.resolve("tiers").resolve(tier.getValue()).resolve("meta");
  }

  public Path tenantDataDir(Tier tier, String tenantId) {
    PathValidator.validate(tenantId);
    return dataDir(tier).resolve(tenantId);
  }

  public Path tenantMetaDir(Tier tier, String tenantId) {
    PathValidator.validate(tenantId);
    return metaDir(tier).resolve(tenantId);
  }

  public Path payloadPath(Tier tier, ArtifactIdentifier id) {
    return dataDir(tier).resolve(id.tenantId()).resolve(id.workflowId()).resolve(id.artifactId());
  }

  public Path sidecarPath(Tier tier, ArtifactIdentifier id) {
    return metaDir(tier)
        .resolve(id.tenantId())
        .resolve(id.workflowId())
        .resolve(id.artifactId() + SIDECAR_SUFFIX);
  }

  public Path keyringLog() {
    return root.resolve("keyring" + LOG_SUFFIX);
  }

  public Path legalHoldLog() {
    return root.resolve("legal_holds" + LOG_SUFFIX);
  }

  public Path auditDir() {
    return root.resolve("audit");
  }

  public Path logsDir() {
    return root.resolve("logs");
  }

  /** Whether {@code path} resolves to a location inside the storage root. */
  public boolean contains(Path path) {
    return path.toAbsolutePath().normalize().startsWith(root);
  }
}
