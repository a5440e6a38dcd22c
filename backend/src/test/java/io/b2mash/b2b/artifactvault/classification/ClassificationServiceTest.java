package io.b2mash.b2b.artifactvault.classification;

import static io.b2mash.b2b.artifactvault.classification.ClassificationLabel.CONFIDENTIAL;
import static io.b2mash.b2b.artifactvault.classification.ClassificationLabel.INTERNAL;
import static io.b2mash.b2b.artifactvault.classification.ClassificationLabel.PUBLIC;
import static io.b2mash.b2b.artifactvault.classification.ClassificationLabel.RESTRICTED;
import static io.b2mash.b2b.artifactvault.testutil.VaultTestFixture.OFFICER;
import static io.b2mash.b2b.artifactvault.testutil.VaultTestFixture.VIEWER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.artifactvault.artifact.ArtifactIdentifier;
import io.b2mash.b2b.artifactvault.audit.AuditSubsystem;
import io.b2mash.b2b.artifactvault.exception.CapabilityDeniedException;
import io.b2mash.b2b.artifactvault.exception.PermissionDeniedException;
import io.b2mash.b2b.artifactvault.exception.ResourceNotFoundException;
import io.b2mash.b2b.artifactvault.storage.Tier;
import io.b2mash.b2b.artifactvault.testutil.VaultTestFixture;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ClassificationServiceTest {

  private static final ArtifactIdentifier MEMO = ArtifactIdentifier.of("tenant-a", "wf-3", "memo");
  private static final byte[] CONTENT = "board memo".getBytes(StandardCharsets.UTF_8);

  @TempDir Path root;

  private VaultTestFixture fixture;
  private ClassificationService classificationService;

  @BeforeEach
  void setUp() {
    fixture = VaultTestFixture.create(root);
    classificationService = fixture.classificationService();
  }

  @Test
  void raisingTheLabelTightensReadAccess() {
    fixture.store().write(MEMO, CONTENT, PUBLIC);

    classificationService.setLabel(OFFICER, MEMO, RESTRICTED);

    assertThat(classificationService.getLabel(MEMO)).isEqualTo(RESTRICTED);
    assertThatThrownBy(() -> fixture.store().read(Tier.HOT, MEMO, CONFIDENTIAL))
        .isInstanceOf(PermissionDeniedException.class);
    assertThat(fixture.store().read(Tier.HOT, MEMO, RESTRICTED)).isEqualTo(CONTENT);
  }

  @Test
  void relabelIsAuditedWithPreviousAndNewLabel() {
    fixture.store().write(MEMO, CONTENT, INTERNAL);

    classificationService.setLabel(OFFICER, MEMO, CONFIDENTIAL);

    assertThat(fixture.auditEvents(AuditSubsystem.CLASSIFICATION, "label_changed"))
        .singleElement()
        .satisfies(
            event -> {
              assertThat(event.actorId()).isEqualTo(OFFICER.id());
              assertThat(event.artifactId()).isEqualTo("memo");
              assertThat(event.details())
                  .containsEntry("previous_label", "Internal")
                  .containsEntry("label", "Confidential");
            });
  }

  @Test
  void relabelFollowsTheArtifactIntoLaterTiers() {
    fixture.store().write(MEMO, CONTENT, PUBLIC);
    fixture.clock().advance(Duration.ofDays(8));
    fixture.store().promote(MEMO, Tier.HOT, Tier.WARM, false);

    classificationService.setLabel(OFFICER, MEMO, CONFIDENTIAL);

    assertThat(fixture.store().readSidecar(Tier.WARM, MEMO).orElseThrow().label())
        .isEqualTo(CONFIDENTIAL);
  }

  @Test
  void relabelRequiresCapability() {
    fixture.store().write(MEMO, CONTENT, PUBLIC);

    assertThatThrownBy(() -> classificationService.setLabel(VIEWER, MEMO, RESTRICTED))
        .isInstanceOf(CapabilityDeniedException.class);
    assertThat(classificationService.getLabel(MEMO)).isEqualTo(PUBLIC);
    assertThat(fixture.auditEvents(AuditSubsystem.CLASSIFICATION)).isEmpty();
  }

  @Test
  void nullLabelIsRejectedAndLeavesTheSidecarUnchanged() {
    fixture.store().write(MEMO, CONTENT, RESTRICTED);

    assertThatThrownBy(() -> classificationService.setLabel(OFFICER, MEMO, null))
        .isInstanceOf(NullPointerException.class);
    assertThatThrownBy(() -> fixture.store().updateLabel(MEMO, null))
        .isInstanceOf(NullPointerException.class);

    assertThat(fixture.store().readSidecar(Tier.HOT, MEMO).orElseThrow().label())
        .isEqualTo(RESTRICTED);
    assertThatThrownBy(() -> fixture.store().read(Tier.HOT, MEMO, INTERNAL))
        .isInstanceOf(PermissionDeniedException.class);
    assertThat(fixture.auditEvents(AuditSubsystem.CLASSIFICATION)).isEmpty();
  }

  @Test
  void relabelOfUnknownArtifactIsNotFound() {
    assertThatThrownBy(() -> classificationService.setLabel(OFFICER, MEMO, RESTRICTED))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void unknownArtifactReportsDefaultLabel() {
    assertThat(classificationService.getLabel(MEMO)).isEqualTo(INTERNAL);
  }

  @Test
  void checkAccessUsesConfiguredOrdering() {
    var custom =
        VaultTestFixture.create(
            root.resolve("custom"),
            Map.of(
                "vault.classification.ordering", "PUBLIC,CONFIDENTIAL,INTERNAL,RESTRICTED"));
    var service = custom.classificationService();

    assertThat(service.checkAccess(INTERNAL, CONFIDENTIAL)).isFalse();
    assertThat(service.checkAccess(CONFIDENTIAL, INTERNAL)).isTrue();
  }
}
