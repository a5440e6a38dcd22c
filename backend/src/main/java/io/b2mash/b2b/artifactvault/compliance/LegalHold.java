package io.b2mash.b2b.artifactvault.compliance;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * One record of the legal hold log. The latest record per tenant decides whether the tenant is
 * held.
 *
 * @param releasedAt null while the hold is active
 * @param actorId actor who applied or, for a release record, released the hold
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LegalHold(
    @JsonProperty("tenant_id") String tenantId,
    @JsonProperty("reason") String reason,
    @JsonProperty("applied_at") Instant appliedAt,
    @JsonProperty("released_at") Instant releasedAt,
    @JsonProperty("actor_id") String actorId) {

  @JsonIgnore
  public boolean isActive() {
    return releasedAt == null;
  }

  public LegalHold release(Instant at, String releasedBy) {
    return new LegalHold(tenantId, reason, appliedAt, at, releasedBy);
  }
}
