package com.gentoro.substrate.reference;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Operations every tool handler and feature module uses to work with references.
 *
 * <p>Names are slash-delimited and case-sensitive; leading and trailing slashes are ignored.
 * Mutations of the same name are serialized; mutations of different names run independently. All
 * operations may block on storage I/O.
 *
 * <p>Failures are reported as {@link com.gentoro.substrate.exception.InvalidReferenceNameException},
 * {@link com.gentoro.substrate.exception.ReferenceNotFoundException}, {@link
 * com.gentoro.substrate.exception.StorageIoException} or {@link
 * com.gentoro.substrate.exception.FormatException}.
 */
public interface ReferenceStore {

  /** Prefix swept by {@link #cleanup(String, Duration)} when a caller has no better choice. */
  String DEFAULT_CLEANUP_PREFIX = "pipeline/";

  Duration DEFAULT_CLEANUP_AGE = Duration.ofDays(7);

  /**
   * Create the reference, or overwrite it with the next version if it exists.
   *
   * @param metadata replaces the stored metadata; {@code null} keeps what is stored
   * @return the canonical name and the version this call persisted
   */
  WriteResult createOrUpdate(String name, String content, Map<String, String> metadata);

  default WriteResult createOrUpdate(String name, String content) {
    return createOrUpdate(name, content, null);
  }

  /** Full record for {@code name}, falling back to the legacy format. */
  Reference read(String name);

  /** Like {@link #createOrUpdate} but fails when {@code name} has no record. Metadata is kept. */
  WriteResult update(String name, String content);

  DeleteResult delete(String name);

  boolean exists(String name);

  /**
   * Sorted names of all live references matching {@code prefix}. A prefix ending in "/" matches
   * names starting with it; any other prefix matches the name itself and names below it.
   */
  List<String> list(String prefix);

  default List<String> list() {
    return list(null);
  }

  /**
   * Remove every reference under {@code prefix} whose last update is older than {@code maxAge}.
   * Individual failures are logged and skipped.
   */
  CleanupResult cleanup(String prefix, Duration maxAge);

  default CleanupResult cleanup(String prefix, long maxAgeSeconds) {
    return cleanup(prefix, Duration.ofSeconds(maxAgeSeconds));
  }
}
