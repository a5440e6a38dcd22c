package io.b2mash.b2b.artifactvault.audit;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Map;

/**
 * One line of an audit log. Constructed by {@link AuditEventBuilder}.
 *
 * @param occurredAt when the state change happened; filled from the clock by {@link AuditService}
 *     when the builder leaves it empty
 * @param subsystem log the event belongs to ({@code storage}, {@code lifecycle}, ...)
 * @param eventType snake_case event name, e.g. {@code promoted_to_warm}
 * @param tenantId affected tenant; null for tenant-independent events such as key rotation
 * @param workflowId affected workflow; null unless the event concerns a single artifact
 * @param artifactId affected artifact; null unless the event concerns a single artifact
 * @param actorId acting principal, {@code system} for scheduled jobs
 * @param details operation-specific fields ({@code age_days}, {@code size_bytes}, ...)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AuditEventRecord(
    @JsonProperty("occurred_at") Instant occurredAt,
    @JsonProperty("subsystem") String subsystem,
    @JsonProperty("event_type") String eventType,
    @JsonProperty("tenant_id") String tenantId,
    @JsonProperty("workflow_id") String workflowId,
    @JsonProperty("artifact_id") String artifactId,
    @JsonProperty("actor_id") String actorId,
    @JsonProperty("details") Map<String, Object> details) {

  public AuditEventRecord withOccurredAt(Instant instant) {
    return new AuditEventRecord(
        instant, subsystem, eventType, tenantId, workflowId, artifactId, actorId, details);
  }
}
