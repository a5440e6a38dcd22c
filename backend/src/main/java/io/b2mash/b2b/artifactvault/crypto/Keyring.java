package io.b2mash.b2b.artifactvault.crypto;

import io.b2mash.b2b.artifactvault.exception.ResourceNotFoundException;
import java.util.List;

/**
 * Append-only record of symmetric keys with exactly one active key. Rotation never removes a key,
 * so ciphertext under a retired key stays decryptable.
 */
public interface Keyring {

  /** The current active key; an empty keyring bootstraps its first key on this call. */
  KeyRecord activeKey();

  /** Retires the active key and appends a new active key in one atomic append. */
  KeyRecord rotate();

  /**
   * Effective record of a key id.
   *
   * @throws ResourceNotFoundException if the key id was never recorded
   */
  KeyRecord get(String keyId);

  /** Effective records of every key, oldest first. */
  List<KeyRecord> keys();
}
