package io.b2mash.b2b.artifactvault.crypto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Base64;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

/**
 * One entry of the append-only keyring log. The effective state of a key id is its most recent
 * record.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record KeyRecord(
    @JsonProperty("key_id") String keyId,
    @JsonProperty("algorithm") String algorithm,
    @JsonProperty("status") KeyStatus status,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("key_material_base64") String keyMaterialBase64) {

  /** Same key, marked retired. */
  public KeyRecord retire() {
    return new KeyRecord(keyId, algorithm, KeyStatus.RETIRED, createdAt, keyMaterialBase64);
  }

  @JsonIgnore
  public boolean isActive() {
    return status == KeyStatus.ACTIVE;
  }

  @JsonIgnore
  public SecretKey secretKey() {
    return new SecretKeySpec(Base64.getDecoder().decode(keyMaterialBase64), "AES");
  }

  @Override
  public String toString() {
    // key material stays out of logs
    return "KeyRecord[keyId=%s, algorithm=%s, status=%s, createdAt=%s]"
        .formatted(keyId, algorithm, status, createdAt);
  }
}
