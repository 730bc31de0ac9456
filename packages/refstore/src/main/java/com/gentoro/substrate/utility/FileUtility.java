package com.gentoro.substrate.utility;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.UUID;

public class FileUtility {
  private static final org.slf4j.Logger log =
      com.gentoro.substrate.logging.LoggingService.getLogger(FileUtility.class);

  /** Suffix of in-flight temporary files. Never matches a record extension. */
  public static final String TEMP_SUFFIX = ".tmp";

  private static final int DIRECTORY_RACE_ATTEMPTS = 5;

  private FileUtility() {}

  /**
   * Durably replace {@code target} with {@code bytes}. The data is written to a sibling temporary
   * file, forced to disk, then renamed over the target, so a reader sees either the old or the new
   * file. On failure the temporary file is removed and the target is untouched.
   *
   * <p>Missing parent directories are created. A concurrent prune of an empty parent between the
   * mkdir and the write is retried.
   */
  public static void writeAtomically(Path target, byte[] bytes) throws IOException {
    Path parent = target.toAbsolutePath().getParent();
    for (int attempt = 1; ; attempt++) {
      Files.createDirectories(parent);
      Path tmp = parent.resolve("." + target.getFileName() + "." + UUID.randomUUID() + TEMP_SUFFIX);
      try {
        try (FileChannel out =
            FileChannel.open(tmp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
          ByteBuffer buf = ByteBuffer.wrap(bytes);
          while (buf.hasRemaining()) {
            out.write(buf);
          }
          out.force(true);
        }
        move(tmp, target);
        return;
      } catch (NoSuchFileException e) {
        Files.deleteIfExists(tmp);
        if (attempt >= DIRECTORY_RACE_ATTEMPTS) throw e;
        log.debug("Parent directory of {} vanished during write, retrying", target);
      } catch (IOException | RuntimeException e) {
        try {
          Files.deleteIfExists(tmp);
        } catch (IOException suppressed) {
          e.addSuppressed(suppressed);
        }
        throw e;
      }
    }
  }

  private static void move(Path source, Path target) throws IOException {
    try {
      Files.move(
          source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      log.warn("Atomic rename not supported for {}; falling back to plain replace", target);
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  /**
   * Remove empty directories from {@code dir} upwards, stopping at (and never removing) {@code
   * stop}. A directory that gained an entry concurrently ends the walk.
   */
  public static void pruneEmptyParents(Path dir, Path stop) throws IOException {
    Path current = dir;
    while (current != null && !current.equals(stop) && current.startsWith(stop)) {
      try (DirectoryStream<Path> entries = Files.newDirectoryStream(current)) {
        if (entries.iterator().hasNext()) {
          break;
        }
      } catch (NoSuchFileException e) {
        current = current.getParent();
        continue;
      }
      try {
        Files.delete(current);
      } catch (DirectoryNotEmptyException | NoSuchFileException e) {
        log.trace("Stopped pruning at {}: {}", current, e.getClass().getSimpleName());
        break;
      }
      current = current.getParent();
    }
  }
}
