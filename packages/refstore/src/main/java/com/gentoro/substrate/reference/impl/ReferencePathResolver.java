package com.gentoro.substrate.reference.impl;

import com.gentoro.substrate.exception.InvalidReferenceNameException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps reference names to record files below {@code <storageRoot>/refs} and back.
 *
 * <p>Name "sites/reddit" lives at {@code refs/sites/reddit.yaml} (legacy: {@code .json}). Leading
 * and trailing slashes are stripped; empty, "." and ".." segments, backslashes and control
 * characters are rejected, as are non-final segments ending in a record extension ("x.yaml/y" would
 * need a directory where "x" keeps its record). This keeps the mapping injective and confined to the
 * refs directory.
 */
public class ReferencePathResolver {
  public static final String REFS_DIRECTORY = "refs";

  private final Path refsRoot;

  public ReferencePathResolver(Path storageRoot) {
    Objects.requireNonNull(storageRoot, "storageRoot");
    this.refsRoot = storageRoot.toAbsolutePath().normalize().resolve(REFS_DIRECTORY);
  }

  public Path refsRoot() {
    return refsRoot;
  }

  /** Current-format location of {@code name}. */
  public Path resolve(String name) {
    return resolve(name, RecordFormat.CURRENT);
  }

  public Path resolve(String name, RecordFormat format) {
    String canonical = canonicalize(name, "resolve");
    Path p = refsRoot;
    for (String segment : canonical.split("/")) {
      p = p.resolve(segment);
    }
    return p.resolveSibling(p.getFileName() + format.extension());
  }

  /** Inverse of {@link #resolve(String, RecordFormat)} for either record format. */
  public String unresolve(Path location) {
    Path abs = location.toAbsolutePath().normalize();
    if (!abs.startsWith(refsRoot) || abs.equals(refsRoot)) {
      throw new InvalidReferenceNameException(
          location.toString(), "unresolve", "location is outside " + refsRoot);
    }
    RecordFormat format =
        RecordFormat.of(abs)
            .orElseThrow(
                () ->
                    new InvalidReferenceNameException(
                        location.toString(), "unresolve", "not a reference record file"));
    Path rel = refsRoot.relativize(abs);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < rel.getNameCount(); i++) {
      if (i > 0) sb.append('/');
      sb.append(rel.getName(i));
    }
    String name = sb.substring(0, sb.length() - format.extension().length());
    return canonicalize(name, "unresolve");
  }

  /**
   * Canonical form of {@code name}, used as the record key and lock key.
   *
   * @throws InvalidReferenceNameException when the name is not acceptable
   */
  public String canonicalize(String name, String operation) {
    if (name == null) {
      throw new InvalidReferenceNameException(null, operation, "name is required");
    }
    String stripped = strip(name);
    if (stripped.isEmpty()) {
      throw new InvalidReferenceNameException(name, operation, "name is empty");
    }
    validateSegments(name, stripped, operation, false);
    return stripped;
  }

  /**
   * Canonical form of a listing prefix. {@code null} and "" select everything. A trailing slash is
   * kept because it changes the match semantics.
   */
  public String canonicalizePrefix(String prefix, String operation) {
    if (prefix == null) return "";
    boolean trailing = prefix.endsWith("/");
    String stripped = strip(prefix);
    if (stripped.isEmpty()) return "";
    validateSegments(prefix, stripped, operation, true);
    return trailing ? stripped + "/" : stripped;
  }

  /** Deepest directory that can contain every name matching the canonical {@code prefix}. */
  public Path scanRoot(String canonicalPrefix) {
    if (canonicalPrefix.isEmpty()) return refsRoot;
    String dir;
    if (canonicalPrefix.endsWith("/")) {
      dir = canonicalPrefix.substring(0, canonicalPrefix.length() - 1);
    } else {
      int slash = canonicalPrefix.lastIndexOf('/');
      if (slash < 0) return refsRoot;
      dir = canonicalPrefix.substring(0, slash);
    }
    Path p = refsRoot;
    for (String segment : dir.split("/")) {
      p = p.resolve(segment);
    }
    return p;
  }

  /** Segment-aware prefix match: "a/b" matches "a/b" and "a/b/c" but not "a/bc". */
  public static boolean matchesPrefix(String name, String canonicalPrefix) {
    if (canonicalPrefix.isEmpty()) return true;
    if (canonicalPrefix.endsWith("/")) return name.startsWith(canonicalPrefix);
    return name.equals(canonicalPrefix) || name.startsWith(canonicalPrefix + "/");
  }

  /** Record format of {@code file}, if it looks like a record at all. */
  public Optional<RecordFormat> formatOf(Path file) {
    return RecordFormat.of(file);
  }

  private static String strip(String s) {
    int start = 0;
    int end = s.length();
    while (start < end && s.charAt(start) == '/') start++;
    while (end > start && s.charAt(end - 1) == '/') end--;
    return s.substring(start, end);
  }

  private static void validateSegments(
      String original, String stripped, String operation, boolean prefix) {
    for (int i = 0; i < stripped.length(); i++) {
      char c = stripped.charAt(i);
      if (Character.isISOControl(c)) {
        throw new InvalidReferenceNameException(
            original, operation, "control characters are not allowed");
      }
      if (c == '\\') {
        throw new InvalidReferenceNameException(original, operation, "backslash is not allowed");
      }
    }
    String[] segments = stripped.split("/", -1);
    for (int i = 0; i < segments.length; i++) {
      String segment = segments[i];
      if (segment.isEmpty()) {
        throw new InvalidReferenceNameException(original, operation, "empty path segment");
      }
      if (segment.equals(".") || segment.equals("..")) {
        throw new InvalidReferenceNameException(
            original, operation, (prefix ? "prefix" : "name") + " segment '" + segment + "'");
      }
      // a directory named like a record file would shadow that record
      if (!prefix && i < segments.length - 1 && RecordFormat.ofFileName(segment).isPresent()) {
        throw new InvalidReferenceNameException(
            original,
            operation,
            "segment '" + segment + "' ends with a record extension and cannot hold references");
      }
    }
  }
}
