package io.b2mash.b2b.artifactvault.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * File primitives shared by every persisted structure: durable temp-then-rename replacement and
 * durable appends. A file replaced through here is either the old content or the new content,
 * never a truncated mix.
 */
public final class AtomicFiles {

  private static final Logger log = LoggerFactory.getLogger(AtomicFiles.class);

  private static final String TEMP_SUFFIX = ".tmp";

  private AtomicFiles() {}

  /** Writes {@code content} to a flushed temp sibling of {@code target}, then renames it over. */
  public static void writeAtomically(Path target, byte[] content) throws IOException {
    Path temp = tempSibling(target);
    try {
      write(temp, content);
      commit(temp, target);
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  /** Creates a fresh temp sibling path for {@code target}; the file itself is not created. */
  public static Path tempSibling(Path target) throws IOException {
    Path parent = target.getParent();
    Files.createDirectories(parent);
    return parent.resolve(
        "." + target.getFileName() + "." + UUID.randomUUID() + TEMP_SUFFIX);
  }

  /** Writes and fsyncs a new file. Fails if the file already exists. */
  public static void write(Path path, byte[] content) throws IOException {
    try (FileChannel channel =
        FileChannel.open(path, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
      writeFully(channel, content);
      channel.force(true);
    }
  }

  /** Renames {@code temp} over {@code target}, atomically where the filesystem supports it. */
  public static void commit(Path temp, Path target) throws IOException {
    try {
      Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      log.debug("Atomic move not supported for {}, falling back to replace", target);
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  /** Appends {@code content} in a single write and fsyncs before returning. */
  public static void append(Path target, byte[] content) throws IOException {
    Files.createDirectories(target.getParent());
    try (FileChannel channel =
        FileChannel.open(
            target,
            StandardOpenOption.CREATE,
            StandardOpenOption.WRITE,
            StandardOpenOption.APPEND)) {
      writeFully(channel, content);
      channel.force(true);
    }
  }

  /** Removes temp siblings of {@code target} left behind by an interrupted replacement. */
  public static int removeStaleTemps(Path target) throws IOException {
    Path parent = target.getParent();
    if (!Files.isDirectory(parent)) {
      return 0;
    }
    int removed = 0;
    String glob = "." + target.getFileName() + ".*" + TEMP_SUFFIX;
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(parent, glob)) {
      for (Path stale : stream) {
        Files.deleteIfExists(stale);
        removed++;
      }
    }
    if (removed > 0) {
      log.warn("Removed {} stale temp file(s) next to {}", removed, target);
    }
    return removed;
  }

  private static void writeFully(FileChannel channel, byte[] content) throws IOException {
    ByteBuffer buffer = ByteBuffer.wrap(content);
    while (buffer.hasRemaining()) {
      channel.write(buffer);
    }
  }
}
