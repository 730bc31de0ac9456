package com.gentoro.substrate.reference;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A named, versioned text record as returned by {@link ReferenceStore#read(String)}.
 *
 * @param name canonical reference name (e.g. "prompts/greeting")
 * @param content opaque text payload, never {@code null}
 * @param metadata auxiliary attributes stored alongside the content, sorted by key
 * @param version 1 on first creation, incremented by one on every write
 * @param createdAt time of the first write of this lineage
 * @param updatedAt time of the latest write
 */
public record Reference(
    String name,
    String content,
    Map<String, String> metadata,
    long version,
    Instant createdAt,
    Instant updatedAt) {

  public Reference {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(updatedAt, "updatedAt");
    content = content == null ? "" : content;
    metadata =
        metadata == null || metadata.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new TreeMap<>(metadata));
  }
}
