package io.b2mash.b2b.artifactvault.eventlog;

import io.b2mash.b2b.artifactvault.artifact.PathValidator;
import io.b2mash.b2b.artifactvault.exception.StorageException;
import io.b2mash.b2b.artifactvault.storage.AtomicFiles;
import io.b2mash.b2b.artifactvault.storage.StorageLayout;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Auxiliary tenant-scoped event logs ({@code logs/<kind>.jsonl}) written by the surrounding
 * system, e.g. orchestrator events or checkpoints. Appends and rewrites of one kind are serialized.
 *
 * <p>A rewrite streams the kept lines into a flushed temp sibling and renames it over the log, so
 * a crash leaves either the old or the new log. Temp files left by an earlier crash are removed at
 * the start of the next rewrite of that log.
 */
@Component
public class EventLogStore {

  private static final Logger log = LoggerFactory.getLogger(EventLogStore.class);

  private static final TypeReference<Map<String, Object>> FIELDS_TYPE = new TypeReference<>() {};

  private final StorageLayout layout;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

  public EventLogStore(StorageLayout layout, ObjectMapper objectMapper, Clock clock) {
    this.layout = layout;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /** Appends one record stamped with the current time and the owning tenant. */
  public void append(String kind, String tenantId, Map<String, Object> fields) {
    PathValidator.validate(tenantId);
    var record = new LinkedHashMap<String, Object>();
    record.put(EventLogEntry.TIMESTAMP_FIELD, clock.instant().toString());
    record.put(EventLogEntry.TENANT_FIELD, tenantId);
    fields.forEach(record::putIfAbsent);
    byte[] line =
        (objectMapper.writeValueAsString(record) + "\n").getBytes(StandardCharsets.UTF_8);
    ReentrantLock lock = lockFor(kind);
    lock.lock();
    try {
      AtomicFiles.append(logPath(kind), line);
    } catch (IOException e) {
      throw new StorageException("Failed to append to " + kind + " log", e);
    } finally {
      lock.unlock();
    }
  }

  /** Kinds of every log present under the logs directory, sorted. */
  public List<String> kinds() {
    Path dir = layout.logsDir();
    if (!Files.isDirectory(dir)) {
      return List.of();
    }
    var kinds = new ArrayList<String>();
    try (DirectoryStream<Path> files =
        Files.newDirectoryStream(dir, "*" + StorageLayout.LOG_SUFFIX)) {
      for (Path file : files) {
        String name = file.getFileName().toString();
        String kind = name.substring(0, name.length() - StorageLayout.LOG_SUFFIX.length());
        if (Files.isRegularFile(file) && PathValidator.isValid(kind)) {
          kinds.add(kind);
        }
      }
    } catch (IOException e) {
      throw new StorageException("Failed to list " + dir, e);
    }
    kinds.sort(String::compareTo);
    return kinds;
  }

  public List<EventLogEntry> read(String kind) {
    return collect(kind, entry -> true);
  }

  /** Records of one tenant in a log, in file order. */
  public List<EventLogEntry> readTenant(String kind, String tenantId) {
    return collect(kind, entry -> entry.belongsTo(tenantId));
  }

  /**
   * Keeps only the records matching {@code keep}. A dry run counts without touching the file.
   *
   * @return how many records were scanned, kept and removed
   */
  public RewriteResult rewrite(String kind, Predicate<EventLogEntry> keep, boolean dryRun) {
    Path target = logPath(kind);
    ReentrantLock lock = lockFor(kind);
    lock.lock();
    try {
      if (!dryRun) {
        AtomicFiles.removeStaleTemps(target);
      }
      if (!Files.exists(target)) {
        return new RewriteResult(kind, 0, 0, 0);
      }
      if (dryRun) {
        return count(kind, target, keep);
      }

      Path temp = AtomicFiles.tempSibling(target);
      try {
        int scanned = 0;
        int kept = 0;
        try (BufferedReader reader = Files.newBufferedReader(target, StandardCharsets.UTF_8);
            FileChannel channel =
                FileChannel.open(temp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
          Writer writer = Channels.newWriter(channel, StandardCharsets.UTF_8);
          String line;
          while ((line = reader.readLine()) != null) {
            if (line.isBlank()) {
              continue;
            }
            scanned++;
            if (keep.test(parse(line))) {
              writer.write(line);
              writer.write('\n');
              kept++;
            }
          }
          writer.flush();
          channel.force(true);
        }
        if (kept == scanned) {
          return new RewriteResult(kind, scanned, kept, 0);
        }
        swap(temp, target);
        log.debug("Rewrote {} log: kept {} of {} record(s)", kind, kept, scanned);
        return new RewriteResult(kind, scanned, kept, scanned - kept);
      } finally {
        Files.deleteIfExists(temp);
      }
    } catch (IOException e) {
      throw new StorageException("Failed to rewrite " + kind + " log", e);
    } finally {
      lock.unlock();
    }
  }

  public Path logPath(String kind) {
    PathValidator.validate(kind);
    return layout.logsDir().resolve(kind + StorageLayout.LOG_SUFFIX);
  }

  /** Replaces the log with its filtered copy. The last step of a rewrite. */
  protected void swap(Path temp, Path target) throws IOException {
    AtomicFiles.commit(temp, target);
  }

  private RewriteResult count(String kind, Path target, Predicate<EventLogEntry> keep)
      throws IOException {
    int scanned = 0;
    int kept = 0;
    try (BufferedReader reader = Files.newBufferedReader(target, StandardCharsets.UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        if (line.isBlank()) {
          continue;
        }
        scanned++;
        if (keep.test(parse(line))) {
          kept++;
        }
      }
    }
    return new RewriteResult(kind, scanned, kept, scanned - kept);
  }

  private List<EventLogEntry> collect(String kind, Predicate<EventLogEntry> filter) {
    Path path = logPath(kind);
    ReentrantLock lock = lockFor(kind);
    lock.lock();
    try {
      if (!Files.exists(path)) {
        return List.of();
      }
      var entries = new ArrayList<EventLogEntry>();
      try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
        String line;
        while ((line = reader.readLine()) != null) {
          if (line.isBlank()) {
            continue;
          }
          EventLogEntry entry = parse(line);
          if (filter.test(entry)) {
            entries.add(entry);
          }
        }
      }
      return entries;
    } catch (IOException e) {
      throw new StorageException("Failed to read " + kind + " log", e);
    } finally {
      lock.unlock();
    }
  }

  private EventLogEntry parse(String line) {
    try {
      return new EventLogEntry(line, objectMapper.readValue(line, FIELDS_TYPE));
    } catch (JacksonException e) {
      log.debug("Unparseable event log line kept verbatim: {}", e.getMessage());
      return new EventLogEntry(line, Map.of());
    }
  }

  private ReentrantLock lockFor(String kind) {
    return locks.computeIfAbsent(kind, k -> new ReentrantLock());
  }

  /** Counts from one log rewrite. */
  public record RewriteResult(String kind, int scanned, int kept, int removed) {}
}
