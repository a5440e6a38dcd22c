package io.b2mash.b2b.artifactvault.crypto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Arrays;
import java.util.Objects;

/**
 * Ciphertext plus everything needed to decrypt it except key material. Byte fields serialize as
 * base64.
 *
 * @param keyId keyring entry used for encryption
 * @param nonce 96-bit GCM nonce, fresh per encryption
 * @param ciphertext ciphertext without the tag
 * @param tag 128-bit GCM authentication tag
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Envelope(
    @JsonProperty("key_id") String keyId,
    @JsonProperty("nonce") byte[] nonce,
    @JsonProperty("ciphertext") byte[] ciphertext,
    @JsonProperty("tag") byte[] tag) {

  /** Compares byte components by content. */
  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Envelope other)) {
      return false;
    }
    return Objects.equals(keyId, other.keyId)
        && Arrays.equals(nonce, other.nonce)
        && Arrays.equals(ciphertext, other.ciphertext)
        && Arrays.equals(tag, other.tag);
  }

  @Override
  public int hashCode() {
    int result = Objects.hashCode(keyId);
    result = 31 * result + Arrays.hashCode(nonce);
    result = 31 * result + Arrays.hashCode(ciphertext);
    result = 31 * result + Arrays.hashCode(tag);
    return result;
  }

  @Override
  public String toString() {
    int length = ciphertext == null ? 0 : ciphertext.length;
    return "Envelope[keyId=" + keyId + ", ciphertextBytes=" + length + "]";
  }
}
