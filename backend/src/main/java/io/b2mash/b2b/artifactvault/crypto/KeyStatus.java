package io.b2mash.b2b.artifactvault.crypto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Exactly one key is {@link #ACTIVE}; retired keys stay available for decryption. */
public enum KeyStatus {
  @JsonProperty("active")
  ACTIVE,

  @JsonProperty("retired")
  RETIRED
}
