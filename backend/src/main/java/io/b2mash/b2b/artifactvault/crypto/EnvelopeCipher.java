package io.b2mash.b2b.artifactvault.crypto;

import io.b2mash.b2b.artifactvault.exception.EnvelopeAuthenticationException;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * AES-256-GCM envelope encryption. Each call draws a fresh random 96-bit nonce; the 128-bit tag is
 * split out of the ciphertext so the envelope records it explicitly. Decryption resolves the key
 * through the {@link Keyring}, so retired keys keep working after rotation.
 */
@Component
public class EnvelopeCipher {

  private static final Logger log = LoggerFactory.getLogger(EnvelopeCipher.class);

  private static final String TRANSFORMATION = "AES/GCM/NoPadding";
  private static final int GCM_TAG_LENGTH = 128; // bits
  private static final int TAG_BYTES = GCM_TAG_LENGTH / 8;
  private static final int NONCE_LENGTH = 12; // bytes (96 bits)

  private final Keyring keyring;
  private final SecureRandom secureRandom = new SecureRandom();

  public EnvelopeCipher(Keyring keyring) {
    this.keyring = keyring;
  }

  public Envelope encrypt(byte[] plaintext, KeyRecord key) {
    byte[] nonce = new byte[NONCE_LENGTH];
    secureRandom.nextBytes(nonce);
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(
          Cipher.ENCRYPT_MODE, key.secretKey(), new GCMParameterSpec(GCM_TAG_LENGTH, nonce));
      byte[] sealed = cipher.doFinal(plaintext);
      int ciphertextLength = sealed.length - TAG_BYTES;
      return new Envelope(
          key.keyId(),
          nonce,
          Arrays.copyOfRange(sealed, 0, ciphertextLength),
          Arrays.copyOfRange(sealed, ciphertextLength, sealed.length));
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Encryption failed", e);
    }
  }

  /**
   * Decrypts an envelope with the key it names.
   *
   * @throws EnvelopeAuthenticationException if the tag does not verify or the envelope is malformed
   */
  public byte[] decrypt(Envelope envelope) {
    if (envelope.nonce() == null
        || envelope.nonce().length != NONCE_LENGTH
        || envelope.tag() == null
        || envelope.tag().length != TAG_BYTES
        || envelope.ciphertext() == null) {
      throw new EnvelopeAuthenticationException(
          envelope.keyId(), new IllegalArgumentException("Malformed envelope"));
    }
    KeyRecord key = keyring.get(envelope.keyId());
    byte[] sealed =
        ByteBuffer.allocate(envelope.ciphertext().length + envelope.tag().length)
            .put(envelope.ciphertext())
            .put(envelope.tag())
            .array();
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(
          Cipher.DECRYPT_MODE,
          key.secretKey(),
          new GCMParameterSpec(GCM_TAG_LENGTH, envelope.nonce()));
      return cipher.doFinal(sealed);
    } catch (AEADBadTagException e) {
      log.warn("Authentication tag mismatch for envelope under key {}", envelope.keyId());
      throw new EnvelopeAuthenticationException(envelope.keyId(), e);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Decryption failed", e);
    }
  }
}
