package io.b2mash.b2b.artifactvault.storage;

import io.b2mash.b2b.artifactvault.exception.StorageException;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * JSON-lines file that only ever grows. Each {@link #append} is a single fsynced write, so a batch
 * of records lands together or, after a crash, as a torn final line that {@link #replay} cuts off.
 *
 * @param <T> record type of each line
 */
public class AppendOnlyLog<T> {

  private static final Logger log = LoggerFactory.getLogger(AppendOnlyLog.class);

  private final Path path;
  private final ObjectMapper objectMapper;
  private final Class<T> type;

  public AppendOnlyLog(Path path, ObjectMapper objectMapper, Class<T> type) {
    this.path = path;
    this.objectMapper = objectMapper;
    this.type = type;
  }

  public Path path() {
    return path;
  }

  /**
   * Reads every record in order. A torn final line is truncated away; an unreadable line anywhere
   * else means the log is corrupt.
   *
   * @throws IllegalStateException if a line other than the last cannot be parsed
   */
  public List<T> replay() {
    if (!Files.exists(path)) {
      return List.of();
    }
    byte[] content;
    try {
      content = Files.readAllBytes(path);
    } catch (IOException e) {
      throw new StorageException("Failed to read " + path, e);
    }
    var records = new ArrayList<T>();
    int lineStart = 0;
    int lineNumber = 0;
    while (lineStart < content.length) {
      int lineEnd = indexOf(content, (byte) '\n', lineStart);
      boolean terminated = lineEnd >= 0;
      int end = terminated ? lineEnd : content.length;
      lineNumber++;
      String line = new String(content, lineStart, end - lineStart, StandardCharsets.UTF_8);
      if (!line.isBlank()) {
        try {
          records.add(objectMapper.readValue(line, type));
        } catch (JacksonException e) {
          if (terminated) {
            throw new IllegalStateException(path + " is corrupt at line " + lineNumber, e);
          }
          log.warn("Truncating torn trailing record at line {} of {}", lineNumber, path);
          truncate(lineStart);
          return records;
        }
      }
      if (!terminated) {
        appendRaw("\n");
        return records;
      }
      lineStart = lineEnd + 1;
    }
    return records;
  }

  public void append(T record) {
    append(List.of(record));
  }

  /** Appends all records in one write. */
  public void append(List<T> records) {
    var buffer = new StringBuilder();
    for (T record : records) {
      buffer.append(objectMapper.writeValueAsString(record)).append('\n');
    }
    appendRaw(buffer.toString());
  }

  private void appendRaw(String text) {
    try {
      AtomicFiles.append(path, text.getBytes(StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new StorageException("Failed to append to " + path, e);
    }
  }

  private void truncate(long size) {
    try (FileChannel channel = FileChannel.open(path, StandardOpenOption.WRITE)) {
      channel.truncate(size);
      channel.force(true);
    } catch (IOException e) {
      throw new StorageException("Failed to truncate " + path, e);
    }
  }

  private static int indexOf(byte[] content, byte target, int from) {
    for (int i = from; i < content.length; i++) {
      if (content[i] == target) {
        return i;
      }
    }
    return -1;
  }
}
