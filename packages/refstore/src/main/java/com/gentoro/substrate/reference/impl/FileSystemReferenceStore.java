package com.gentoro.substrate.reference.impl;

import com.gentoro.substrate.exception.FormatException;
import com.gentoro.substrate.exception.InvalidReferenceNameException;
import com.gentoro.substrate.exception.ReferenceNotFoundException;
import com.gentoro.substrate.exception.StorageIoException;
import com.gentoro.substrate.exception.SubstrateException;
import com.gentoro.substrate.reference.CleanupResult;
import com.gentoro.substrate.reference.DeleteResult;
import com.gentoro.substrate.reference.Reference;
import com.gentoro.substrate.reference.ReferenceStore;
import com.gentoro.substrate.reference.WriteResult;
import com.gentoro.substrate.utility.FileUtility;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * {@link ReferenceStore} keeping one YAML file per reference below {@code <storageRoot>/refs}.
 *
 * <p>Writes go to a temporary sibling that is renamed over the record, so readers never observe a
 * partial record and a failed write leaves the previous one intact. Mutations of one name are
 * serialized through a per-name lock; the version read-increment-write happens under that lock.
 * Records are not cached; every read goes to disk.
 *
 * <p>Legacy JSON records ({@code .json}) are readable. The first write to such a name produces the
 * YAML record and removes the JSON one.
 */
public class FileSystemReferenceStore implements ReferenceStore {
  private static final org.slf4j.Logger log =
      com.gentoro.substrate.logging.LoggingService.getLogger(FileSystemReferenceStore.class);

  private final ReferencePathResolver resolver;
  private final ReferenceCodec codec = new ReferenceCodec();
  private final NameLockTable locks = new NameLockTable();
  private final Clock clock;

  public FileSystemReferenceStore(Path storageRoot) {
    this(storageRoot, Clock.systemUTC());
  }

  public FileSystemReferenceStore(Path storageRoot, Clock clock) {
    this.resolver = new ReferencePathResolver(storageRoot);
    this.clock = Objects.requireNonNull(clock, "clock");
    try {
      Files.createDirectories(resolver.refsRoot());
    } catch (IOException e) {
      throw new StorageIoException(
          "Failed to initialize reference storage at " + resolver.refsRoot(), e);
    }
    log.info("Reference store initialized at {}", resolver.refsRoot());
  }

  public ReferencePathResolver resolver() {
    return resolver;
  }

  @Override
  public WriteResult createOrUpdate(String name, String content, Map<String, String> metadata) {
    String ref = resolver.canonicalize(name, "create");
    try (NameLockTable.Handle ignored = locks.acquire(ref)) {
      return write(ref, content, metadata, false, "create");
    }
  }

  @Override
  public WriteResult update(String name, String content) {
    String ref = resolver.canonicalize(name, "update");
    try (NameLockTable.Handle ignored = locks.acquire(ref)) {
      return write(ref, content, null, true, "update");
    }
  }

  @Override
  public Reference read(String name) {
    String ref = resolver.canonicalize(name, "read");
    Reference reference =
        load(ref, "read").orElseThrow(() -> new ReferenceNotFoundException(ref, "read"));
    log.trace("Read reference {} (v{})", ref, reference.version());
    return reference;
  }

  @Override
  public boolean exists(String name) {
    String ref = resolver.canonicalize(name, "exists");
    return Files.isRegularFile(resolver.resolve(ref, RecordFormat.CURRENT))
        || Files.isRegularFile(resolver.resolve(ref, RecordFormat.LEGACY));
  }

  @Override
  public DeleteResult delete(String name) {
    String ref = resolver.canonicalize(name, "delete");
    try (NameLockTable.Handle ignored = locks.acquire(ref)) {
      if (!removeFiles(ref, "delete")) {
        throw new ReferenceNotFoundException(ref, "delete");
      }
    }
    log.debug("Deleted reference {}", ref);
    return new DeleteResult(ref, true);
  }

  @Override
  public List<String> list(String prefix) {
    String canonicalPrefix = resolver.canonicalizePrefix(prefix, "list");
    Path start = resolver.scanRoot(canonicalPrefix);
    TreeSet<String> names = new TreeSet<>();
    if (!Files.isDirectory(start)) {
      return List.of();
    }
    try {
      Files.walkFileTree(
          start,
          new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
              if (!attrs.isRegularFile() || resolver.formatOf(file).isEmpty()) {
                return FileVisitResult.CONTINUE;
              }
              String name;
              try {
                name = resolver.unresolve(file);
              } catch (InvalidReferenceNameException e) {
                log.debug("Ignoring stray file {}: {}", file, e.getMessage());
                return FileVisitResult.CONTINUE;
              }
              if (ReferencePathResolver.matchesPrefix(name, canonicalPrefix)) {
                names.add(name);
              }
              return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
              // removed by a concurrent delete or cleanup
              if (exc instanceof NoSuchFileException) return FileVisitResult.CONTINUE;
              throw exc;
            }
          });
    } catch (IOException e) {
      throw new StorageIoException(canonicalPrefix, "list", start, e);
    }
    log.trace("Listed {} references under '{}'", names.size(), canonicalPrefix);
    return List.copyOf(names);
  }

  @Override
  public CleanupResult cleanup(String prefix, Duration maxAge) {
    Objects.requireNonNull(maxAge, "maxAge");
    if (maxAge.isNegative()) {
      throw new IllegalArgumentException("maxAge must not be negative: " + maxAge);
    }
    String canonicalPrefix = resolver.canonicalizePrefix(prefix, "cleanup");
    if (canonicalPrefix.isEmpty()) {
      throw new InvalidReferenceNameException(prefix, "cleanup", "cleanup requires a prefix");
    }
    Instant cutoff = clock.instant().minus(maxAge);

    int removed = 0;
    for (String ref : list(canonicalPrefix)) {
      try (NameLockTable.Handle ignored = locks.acquire(ref)) {
        Optional<Reference> current = load(ref, "cleanup");
        if (current.isEmpty()) {
          continue;
        }
        if (current.get().updatedAt().isBefore(cutoff) && removeFiles(ref, "cleanup")) {
          removed++;
          log.debug("Cleaned up reference {} (updated {})", ref, current.get().updatedAt());
        }
      } catch (FormatException e) {
        log.warn("Skipping unreadable reference {} during cleanup: {}", ref, e.getMessage());
      } catch (SubstrateException e) {
        log.warn("Failed to clean up reference {}: {}", ref, e.getMessage(), e);
      }
    }

    if (removed > 0) {
      log.info("Cleaned {} references older than {} under '{}'", removed, maxAge, canonicalPrefix);
    }
    return new CleanupResult(canonicalPrefix, removed);
  }

  // Caller holds the lock for ref.
  private WriteResult write(
      String ref,
      String content,
      Map<String, String> metadata,
      boolean requireExisting,
      String operation) {
    Optional<Reference> existing = load(ref, operation);
    if (requireExisting && existing.isEmpty()) {
      throw new ReferenceNotFoundException(ref, operation);
    }

    Instant now = clock.instant();
    long version = existing.map(r -> r.version() + 1).orElse(1L);
    Instant created = existing.map(Reference::createdAt).orElse(now);
    Map<String, String> effectiveMetadata =
        metadata != null ? metadata : existing.map(Reference::metadata).orElse(Map.of());
    Reference record = new Reference(ref, content, effectiveMetadata, version, created, now);

    Path target = resolver.resolve(ref, RecordFormat.CURRENT);
    try {
      FileUtility.writeAtomically(target, codec.encode(record));
    } catch (IOException e) {
      throw new StorageIoException(ref, operation, target, e);
    }
    supersedeLegacy(ref);

    log.debug("{} reference {} (v{})", existing.isEmpty() ? "Created" : "Updated", ref, version);
    return new WriteResult(ref, version, existing.isEmpty());
  }

  private void supersedeLegacy(String ref) {
    Path legacy = resolver.resolve(ref, RecordFormat.LEGACY);
    try {
      if (Files.deleteIfExists(legacy)) {
        log.info("Migrated legacy record of reference {} to {}", ref, RecordFormat.CURRENT);
      }
    } catch (IOException e) {
      // the current record is authoritative from now on; the stale file is only clutter
      log.warn("Could not remove superseded legacy record {}", legacy, e);
    }
  }

  /**
   * Current record first, then legacy. When both are missing the current file is checked once more:
   * a concurrent migration writes the current record before removing the legacy one.
   */
  private Optional<Reference> load(String ref, String operation) {
    Optional<Reference> found = loadFormat(ref, operation, RecordFormat.CURRENT);
    if (found.isEmpty()) found = loadFormat(ref, operation, RecordFormat.LEGACY);
    if (found.isEmpty()) found = loadFormat(ref, operation, RecordFormat.CURRENT);
    return found;
  }

  private Optional<Reference> loadFormat(String ref, String operation, RecordFormat format) {
    Path path = resolver.resolve(ref, format);
    if (Files.isDirectory(path)) {
      log.debug("Ignoring directory {} in place of a record of {}", path, ref);
      return Optional.empty();
    }
    byte[] bytes;
    Instant modified;
    try {
      bytes = Files.readAllBytes(path);
      modified = Files.getLastModifiedTime(path).toInstant();
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException e) {
      throw new StorageIoException(ref, operation, path, e);
    }
    return Optional.of(codec.decode(ref, operation, path, format, bytes, modified));
  }

  // Caller holds the lock for ref.
  private boolean removeFiles(String ref, String operation) {
    boolean removed = false;
    for (RecordFormat format : RecordFormat.values()) {
      Path path = resolver.resolve(ref, format);
      try {
        removed |= Files.deleteIfExists(path);
      } catch (IOException e) {
        throw new StorageIoException(ref, operation, path, e);
      }
    }
    if (removed) {
      Path parent = resolver.resolve(ref, RecordFormat.CURRENT).getParent();
      try {
        FileUtility.pruneEmptyParents(parent, resolver.refsRoot());
      } catch (IOException e) {
        log.debug("Could not prune empty directories above {}: {}", parent, e.getMessage());
      }
    }
    return removed;
  }
}
