package io.b2mash.b2b.artifactvault.audit;

import io.b2mash.b2b.artifactvault.artifact.ArtifactIdentifier;
import io.b2mash.b2b.artifactvault.security.Actor;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Builder that constructs an {@link AuditEventRecord}.
 *
 * <p>Required fields: {@code subsystem} and {@code eventType}. The actor defaults to {@link
 * Actor#SYSTEM_ID} when not set.
 *
 * <p>Usage:
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .subsystem(AuditSubsystem.STORAGE)
 *     .eventType("artifact_written")
 *     .artifact(identifier)
 *     .details(Map.of("size_bytes", content.length))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private Instant occurredAt;
  private AuditSubsystem subsystem;
  private String eventType;
  private String tenantId;
  private String workflowId;
  private String artifactId;
  private String actorId;
  private Map<String, Object> details;

  private AuditEventBuilder() {}

  /** Creates a new builder instance. */
  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder occurredAt(Instant occurredAt) {
    this.occurredAt = occurredAt;
    return this;
  }

  public AuditEventBuilder subsystem(AuditSubsystem subsystem) {
    this.subsystem = subsystem;
    return this;
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditEventBuilder tenantId(String tenantId) {
    this.tenantId = tenantId;
    return this;
  }

  /** Sets tenant, workflow and artifact ids from one identifier. */
  public AuditEventBuilder artifact(ArtifactIdentifier identifier) {
    this.tenantId = identifier.tenantId();
    this.workflowId = identifier.workflowId();
    this.artifactId = identifier.artifactId();
    return this;
  }

  public AuditEventBuilder actor(Actor actor) {
    this.actorId = actor.id();
    return this;
  }

  public AuditEventBuilder actorId(String actorId) {
    this.actorId = actorId;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  public AuditEventRecord build() {
    Objects.requireNonNull(subsystem, "subsystem is required");
    Objects.requireNonNull(eventType, "eventType is required");
    return new AuditEventRecord(
        occurredAt,
        subsystem.value(),
        eventType,
        tenantId,
        workflowId,
        artifactId,
        actorId != null ? actorId : Actor.SYSTEM_ID,
        details != null ? new LinkedHashMap<>(details) : Map.of());
  }
}
