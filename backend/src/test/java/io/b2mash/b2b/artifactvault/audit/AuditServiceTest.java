package io.b2mash.b2b.artifactvault.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import io.b2mash.b2b.artifactvault.artifact.ArtifactIdentifier;
import io.b2mash.b2b.artifactvault.classification.ClassificationLabel;
import io.b2mash.b2b.artifactvault.security.Actor;
import io.b2mash.b2b.artifactvault.storage.StorageLayout;
import io.b2mash.b2b.artifactvault.testutil.MutableClock;
import io.b2mash.b2b.artifactvault.testutil.VaultTestFixture;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tools.jackson.databind.json.JsonMapper;

@ExtendWith(MockitoExtension.class)
class AuditServiceTest {

  @Mock private AuditSink sink;

  @TempDir Path root;

  private final MutableClock clock = new MutableClock(VaultTestFixture.START);

  @Test
  void stampsEventTimeFromClockWhenMissing() {
    var service = new AuditService(sink, clock);

    service.log(
        AuditEventBuilder.builder()
            .subsystem(AuditSubsystem.CRYPTO)
            .eventType("key_rotated")
            .actorId("key-admin")
            .build());

    var captor = ArgumentCaptor.forClass(AuditEventRecord.class);
    verify(sink).record(captor.capture());
    assertThat(captor.getValue().occurredAt()).isEqualTo(VaultTestFixture.START);
    assertThat(captor.getValue().subsystem()).isEqualTo("crypto");
  }

  @Test
  void keepsExplicitEventTime() {
    var service = new AuditService(sink, clock);
    var at = Instant.parse("2025-12-31T23:59:59Z");

    service.log(
        AuditEventBuilder.builder()
            .occurredAt(at)
            .subsystem(AuditSubsystem.STORAGE)
            .eventType("artifact_written")
            .build());

    var captor = ArgumentCaptor.forClass(AuditEventRecord.class);
    verify(sink).record(captor.capture());
    assertThat(captor.getValue().occurredAt()).isEqualTo(at);
  }

  @Test
  void sinkFailureDoesNotReachTheCaller() {
    doThrow(new IllegalStateException("audit volume full")).when(sink).record(any());
    var service = new AuditService(sink, clock);

    assertThatCode(
            () ->
                service.log(
                    AuditEventBuilder.builder()
                        .subsystem(AuditSubsystem.LIFECYCLE)
                        .eventType("lifecycle_run_completed")
                        .build()))
        .doesNotThrowAnyException();
  }

  @Test
  void jsonlSinkWritesOneLogPerSubsystem() {
    var auditSink = new JsonlAuditSink(new StorageLayout(root), JsonMapper.builder().build());
    var service = new AuditService(auditSink, clock);
    var id = ArtifactIdentifier.of("tenant-a", "wf-1", "report.md");

    service.log(
        AuditEventBuilder.builder()
            .subsystem(AuditSubsystem.STORAGE)
            .eventType("artifact_written")
            .artifact(id)
            .details(Map.of("size_bytes", 12))
            .build());
    service.log(
        AuditEventBuilder.builder()
            .subsystem(AuditSubsystem.CLASSIFICATION)
            .eventType("label_changed")
            .artifact(id)
            .actor(new Actor("records-manager", ClassificationLabel.CONFIDENTIAL))
            .build());

    assertThat(root.resolve("audit/storage.jsonl")).exists();
    assertThat(root.resolve("audit/classification.jsonl")).exists();
    assertThat(auditSink.read(AuditSubsystem.STORAGE))
        .singleElement()
        .satisfies(
            event -> {
              assertThat(event.tenantId()).isEqualTo("tenant-a");
              assertThat(event.workflowId()).isEqualTo("wf-1");
              assertThat(event.artifactId()).isEqualTo("report.md");
              assertThat(event.actorId()).isEqualTo(Actor.SYSTEM_ID);
              assertThat(event.details()).containsEntry("size_bytes", 12);
            });
    assertThat(auditSink.read(AuditSubsystem.CLASSIFICATION).get(0).actorId())
        .isEqualTo("records-manager");
    assertThat(auditSink.read(AuditSubsystem.CRYPTO)).isEmpty();
  }
}
