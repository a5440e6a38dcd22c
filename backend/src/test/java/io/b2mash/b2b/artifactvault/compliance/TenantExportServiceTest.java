package io.b2mash.b2b.artifactvault.compliance;

import static io.b2mash.b2b.artifactvault.classification.ClassificationLabel.CONFIDENTIAL;
import static io.b2mash.b2b.artifactvault.classification.ClassificationLabel.INTERNAL;
import static io.b2mash.b2b.artifactvault.classification.ClassificationLabel.PUBLIC;
import static io.b2mash.b2b.artifactvault.classification.ClassificationLabel.RESTRICTED;
import static io.b2mash.b2b.artifactvault.testutil.VaultTestFixture.ANALYST;
import static io.b2mash.b2b.artifactvault.testutil.VaultTestFixture.OFFICER;
import static io.b2mash.b2b.artifactvault.testutil.VaultTestFixture.VIEWER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.artifactvault.artifact.ArtifactIdentifier;
import io.b2mash.b2b.artifactvault.audit.AuditSubsystem;
import io.b2mash.b2b.artifactvault.classification.ExportPolicy;
import io.b2mash.b2b.artifactvault.exception.CapabilityDeniedException;
import io.b2mash.b2b.artifactvault.exception.ResourceConflictException;
import io.b2mash.b2b.artifactvault.storage.Tier;
import io.b2mash.b2b.artifactvault.testutil.VaultTestFixture;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TenantExportServiceTest {

  private static final String TENANT = "tenant-a";

  private static final ArtifactIdentifier BRIEF = ArtifactIdentifier.of(TENANT, "wf-1", "brief.md");
  private static final ArtifactIdentifier NOTES = ArtifactIdentifier.of(TENANT, "wf-1", "notes.md");
  private static final ArtifactIdentifier CONTRACT =
      ArtifactIdentifier.of(TENANT, "wf-2", "contract.pdf");
  private static final ArtifactIdentifier KEYS = ArtifactIdentifier.of(TENANT, "wf-2", "keys.txt");

  @TempDir Path temp;

  @Test
  void denyPolicyExportsOnlyWhatTheActorIsClearedFor() throws Exception {
    var fixture = seededFixture(Map.of());
    Path destination = temp.resolve("export");

    ExportManifest manifest = fixture.exportService().export(ANALYST, TENANT, destination);

    assertThat(manifest.exportPolicy()).isEqualTo(ExportPolicy.DENY);
    assertThat(manifest.artifacts()).containsEntry("hot", 1).containsEntry("warm", 1);
    assertThat(manifest.totalArtifacts()).isEqualTo(2);
    assertThat(manifest.denied()).isEqualTo(2);
    assertThat(manifest.redacted()).isZero();
    assertThat(manifest.excluded())
        .containsExactlyInAnyOrder(CONTRACT.toString(), KEYS.toString());

    assertThat(destination.resolve("artifacts/hot/wf-1/notes.md")).hasContent("internal notes");
    assertThat(destination.resolve("artifacts/warm/wf-1/brief.md")).hasContent("public brief");
    assertThat(destination.resolve("artifacts/hot/wf-2/contract.pdf")).doesNotExist();
    assertThat(destination.resolve("redacted")).doesNotExist();

    var denials = fixture.auditEvents(AuditSubsystem.COMPLIANCE, "export_denied");
    assertThat(denials).hasSize(2);
    assertThat(denials)
        .allSatisfy(
            event -> {
              assertThat(event.actorId()).isEqualTo(ANALYST.id());
              assertThat(event.details())
                  .containsEntry("clearance", "Internal")
                  .containsEntry("policy", "deny");
            });
  }

  @Test
  void redactPolicyWritesMetadataWithoutContent() throws Exception {
    var fixture = seededFixture(Map.of("vault.compliance.export-policy", "REDACT"));
    Path destination = temp.resolve("export");

    ExportManifest manifest = fixture.exportService().export(ANALYST, TENANT, destination);

    assertThat(manifest.redacted()).isEqualTo(2);
    assertThat(manifest.denied()).isZero();
    Path redacted = destination.resolve("redacted/hot/wf-2/contract.pdf.json");
    assertThat(redacted).exists();
    String metadata = Files.readString(redacted);
    assertThat(metadata).doesNotContain("signed terms");
    Map<?, ?> fields = fixture.objectMapper().readValue(metadata, Map.class);
    assertThat(fields.get("label")).isEqualTo("Confidential");
    assertThat(fields.get("redacted")).isEqualTo(true);
    assertThat(destination.resolve("artifacts/hot/wf-2/contract.pdf")).doesNotExist();
  }

  @Test
  void clearedActorExportsEverythingAndTenantLogRecordsOnly() throws Exception {
    var fixture = seededFixture(Map.of());
    Path destination = temp.resolve("export");

    ExportManifest manifest = fixture.exportService().export(OFFICER, TENANT, destination);

    assertThat(manifest.totalArtifacts()).isEqualTo(4);
    assertThat(manifest.excluded()).isEmpty();
    assertThat(manifest.logs()).containsEntry("orchestrator_events", 2);
    assertThat(destination.resolve("artifacts/hot/wf-2/keys.txt")).hasContent("secret keys");

    var exportedLog = Files.readAllLines(destination.resolve("logs/orchestrator_events.jsonl"));
    assertThat(exportedLog).hasSize(2).allMatch(line -> line.contains("\"tenant_id\":\"" + TENANT));

    ExportManifest written =
        fixture
            .objectMapper()
            .readValue(
                Files.readAllBytes(destination.resolve(TenantExportService.MANIFEST_FILE)),
                ExportManifest.class);
    assertThat(written.tenantId()).isEqualTo(TENANT);
    assertThat(written.actorId()).isEqualTo(OFFICER.id());
    assertThat(written.artifacts()).containsEntry("hot", 3);

    var exported = fixture.auditEvents(AuditSubsystem.COMPLIANCE, "tenant_exported");
    assertThat(exported).hasSize(1);
    assertThat(exported.get(0).details()).containsEntry("artifacts", 4);
  }

  @Test
  void exportDoesNotChangeStorage() {
    var fixture = seededFixture(Map.of());
    var before = fixture.store().storageStats();

    fixture.exportService().export(OFFICER, TENANT, temp.resolve("export"));

    assertThat(fixture.store().storageStats()).isEqualTo(before);
    assertThat(fixture.store().locate(BRIEF)).contains(Tier.WARM);
  }

  @Test
  void destinationInsideStorageRootIsRejected() {
    var fixture = seededFixture(Map.of());
    Path inside = fixture.layout().root().resolve("exports");

    assertThatThrownBy(() -> fixture.exportService().export(OFFICER, TENANT, inside))
        .isInstanceOf(ResourceConflictException.class);
    assertThat(inside).doesNotExist();
  }

  @Test
  void actorWithoutExportCapabilityIsRefused() {
    var fixture = seededFixture(Map.of());
    Path destination = temp.resolve("export");

    assertThatThrownBy(() -> fixture.exportService().export(VIEWER, TENANT, destination))
        .isInstanceOf(CapabilityDeniedException.class);
    assertThat(destination).doesNotExist();
  }

  private VaultTestFixture seededFixture(Map<String, String> overrides) {
    var fixture = VaultTestFixture.create(temp.resolve("vault"), overrides);
    var store = fixture.store();
    store.write(BRIEF, bytes("public brief"), PUBLIC);
    fixture.clock().advance(Duration.ofDays(8));
    store.promote(BRIEF, Tier.HOT, Tier.WARM, false);
    store.write(NOTES, bytes("internal notes"), INTERNAL);
    store.write(CONTRACT, bytes("signed terms"), CONFIDENTIAL);
    store.write(KEYS, bytes("secret keys"), RESTRICTED);
    store.write(ArtifactIdentifier.of("tenant-b", "wf-1", "brief.md"), bytes("other"), PUBLIC);

    var logs = fixture.eventLogStore();
    logs.append("orchestrator_events", TENANT, Map.of("event", "workflow_started"));
    logs.append("orchestrator_events", "tenant-b", Map.of("event", "workflow_started"));
    logs.append("orchestrator_events", TENANT, Map.of("event", "workflow_finished"));
    return fixture;
  }

  private static byte[] bytes(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }
}
