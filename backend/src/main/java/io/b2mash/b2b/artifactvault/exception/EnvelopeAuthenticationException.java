package io.b2mash.b2b.artifactvault.exception;

/**
 * AEAD tag verification failed. Signals tampering or keyring corruption; no plaintext is ever
 * returned alongside this failure.
 */
public class EnvelopeAuthenticationException extends VaultException {

  public EnvelopeAuthenticationException(String keyId, Throwable cause) {
    super(
        "Envelope authentication failed",
        "Ciphertext under key " + keyId + " failed verification",
        cause);
  }
}
