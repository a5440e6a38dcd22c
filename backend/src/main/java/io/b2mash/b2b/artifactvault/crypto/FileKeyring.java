package io.b2mash.b2b.artifactvault.crypto;

import io.b2mash.b2b.artifactvault.exception.ResourceNotFoundException;
import io.b2mash.b2b.artifactvault.storage.AppendOnlyLog;
import io.b2mash.b2b.artifactvault.storage.StorageLayout;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

/**
 * {@link Keyring} persisted as a JSON-lines log under the storage root. The in-memory index is an
 * immutable snapshot rebuilt on load and swapped after every append, so readers never observe a
 * half-applied rotation.
 */
@Component
public class FileKeyring implements Keyring {

  private static final Logger log = LoggerFactory.getLogger(FileKeyring.class);

  static final String ALGORITHM = "AES-256-GCM";
  private static final int KEY_BYTES = 32;

  private final AppendOnlyLog<KeyRecord> keyLog;
  private final Clock clock;
  private final SecureRandom secureRandom = new SecureRandom();
  private final ReentrantLock appendLock = new ReentrantLock();
  private final AtomicReference<Index> index;

  public FileKeyring(StorageLayout storageLayout, ObjectMapper objectMapper, Clock clock) {
    this.keyLog = new AppendOnlyLog<>(storageLayout.keyringLog(), objectMapper, KeyRecord.class);
    this.clock = clock;
    this.index = new AtomicReference<>(load());
  }

  @Override
  public KeyRecord activeKey() {
    Index snapshot = index.get();
    if (snapshot.activeKeyId() != null) {
      return snapshot.keys().get(snapshot.activeKeyId());
    }
    appendLock.lock();
    try {
      snapshot = index.get();
      if (snapshot.activeKeyId() != null) {
        return snapshot.keys().get(snapshot.activeKeyId());
      }
      KeyRecord created = generate(snapshot);
      append(snapshot, List.of(created));
      log.info("Keyring has no active key, created {}", created.keyId());
      return created;
    } finally {
      appendLock.unlock();
    }
  }

  @Override
  public KeyRecord rotate() {
    appendLock.lock();
    try {
      Index snapshot = index.get();
      KeyRecord created = generate(snapshot);
      if (snapshot.activeKeyId() == null) {
        append(snapshot, List.of(created));
        log.info("Keyring rotated: no previous active key, {} is now active", created.keyId());
      } else {
        KeyRecord retired = snapshot.keys().get(snapshot.activeKeyId()).retire();
        append(snapshot, List.of(retired, created));
        log.info("Keyring rotated: {} retired, {} is now active", retired.keyId(), created.keyId());
      }
      return created;
    } finally {
      appendLock.unlock();
    }
  }

  @Override
  public KeyRecord get(String keyId) {
    KeyRecord record = index.get().keys().get(keyId);
    if (record == null) {
      throw new ResourceNotFoundException("Key", keyId);
    }
    return record;
  }

  @Override
  public List<KeyRecord> keys() {
    return List.copyOf(index.get().keys().values());
  }

  private KeyRecord generate(Index snapshot) {
    byte[] material = new byte[KEY_BYTES];
    secureRandom.nextBytes(material);
    String keyId = "key-%03d".formatted(snapshot.keys().size() + 1);
    return new KeyRecord(
        keyId,
        ALGORITHM,
        KeyStatus.ACTIVE,
        clock.instant(),
        Base64.getEncoder().encodeToString(material));
  }

  /** Writes all records as one append, then publishes the new index. Caller holds the lock. */
  private void append(Index snapshot, List<KeyRecord> records) {
    keyLog.append(records);
    Index next = snapshot;
    for (KeyRecord record : records) {
      next = next.apply(record);
    }
    index.set(next);
  }

  private Index load() {
    Index loaded = Index.EMPTY;
    for (KeyRecord record : keyLog.replay()) {
      loaded = loaded.apply(record);
    }
    if (!loaded.keys().isEmpty()) {
      log.info(
          "Loaded keyring with {} key(s), active key {}",
          loaded.keys().size(),
          loaded.activeKeyId());
    }
    return loaded;
  }

  /** Latest record per key id plus the id of the single active key, if any. */
  private record Index(Map<String, KeyRecord> keys, String activeKeyId) {

    static final Index EMPTY = new Index(Map.of(), null);

    Index apply(KeyRecord record) {
      var updated = new LinkedHashMap<>(keys);
      updated.put(record.keyId(), record);
      String active = activeKeyId;
      if (record.isActive()) {
        if (active != null && !active.equals(record.keyId())) {
          log.warn("Keyring lists {} as active while {} is still active", record.keyId(), active);
          updated.put(active, updated.get(active).retire());
        }
        active = record.keyId();
      } else if (record.keyId().equals(active)) {
        active = null;
      }
      return new Index(Collections.unmodifiableMap(updated), active);
    }
  }
}
