package com.gentoro.substrate.reference.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.substrate.exception.FormatException;
import com.gentoro.substrate.reference.Reference;
import com.gentoro.substrate.utility.JacksonUtility;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads and writes reference record documents.
 *
 * <p>A record is a mapping with keys {@code content}, {@code metadata}, {@code created}, {@code
 * updated} and {@code version}. Content must be a string; metadata values of other scalar types
 * (found in legacy JSON) are read as their text. Records from earlier releases may omit {@code version} (read as 1),
 * omit {@code updated} (read as {@code created}) and carry zone-less timestamps (read as UTC).
 */
class ReferenceCodec {
  static final String CONTENT = "content";
  static final String METADATA = "metadata";
  static final String CREATED = "created";
  static final String UPDATED = "updated";
  static final String VERSION = "version";

  byte[] encode(Reference reference) {
    ObjectMapper mapper =
        literalSafe(reference)
            ? JacksonUtility.getLiteralYamlMapper()
            : JacksonUtility.getYamlMapper();
    ObjectNode root = mapper.createObjectNode();
    root.put(CONTENT, reference.content());
    ObjectNode metadata = root.putObject(METADATA);
    reference.metadata().forEach(metadata::put);
    root.put(CREATED, reference.createdAt().toString());
    root.put(UPDATED, reference.updatedAt().toString());
    root.put(VERSION, reference.version());
    try {
      return mapper.writeValueAsBytes(root);
    } catch (JsonProcessingException e) {
      // only reachable through a broken mapper configuration
      throw new IllegalStateException("Failed to encode reference " + reference.name(), e);
    }
  }

  /** Whether every string of the record survives being written as a literal block. */
  static boolean literalSafe(Reference reference) {
    if (!literalSafe(reference.content())) return false;
    for (Map.Entry<String, String> e : reference.metadata().entrySet()) {
      if (!literalSafe(e.getKey()) || !literalSafe(e.getValue())) return false;
    }
    return true;
  }

  private static boolean literalSafe(String text) {
    return text.codePoints()
        .allMatch(
            cp ->
                cp == '\n'
                    || cp == '\t'
                    || (cp >= 0x20 && cp <= 0x7E)
                    || (cp >= 0xA0 && cp <= 0xD7FF && cp != 0x2028 && cp != 0x2029)
                    || (cp >= 0xE000 && cp <= 0xFFFD && cp != 0xFEFF)
                    || cp >= 0x10000);
  }

  /**
   * Parse a record file's bytes. The parser of the file's own format is tried first, then the other
   * one.
   *
   * @param fallbackTime used when the record carries no timestamps at all (file modification time)
   */
  Reference decode(
      String name,
      String operation,
      Path path,
      RecordFormat format,
      byte[] bytes,
      Instant fallbackTime) {
    JsonNode root = parse(name, operation, path, format, bytes);
    if (!root.isObject()) {
      throw new FormatException(name, operation, path, "record is not a mapping", null);
    }

    JsonNode contentNode = root.get(CONTENT);
    if (contentNode == null) {
      throw new FormatException(name, operation, path, "missing '" + CONTENT + "'", null);
    }
    String content = scalar(name, operation, path, CONTENT, contentNode);

    Map<String, String> metadata = new LinkedHashMap<>();
    JsonNode metaNode = root.get(METADATA);
    if (metaNode != null && !metaNode.isNull()) {
      if (!metaNode.isObject()) {
        throw new FormatException(name, operation, path, "'metadata' is not a mapping", null);
      }
      Iterator<Map.Entry<String, JsonNode>> fields = metaNode.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> f = fields.next();
        JsonNode v = f.getValue();
        metadata.put(f.getKey(), v.isValueNode() ? (v.isNull() ? "" : v.asText()) : v.toString());
      }
    }

    long version = 1;
    JsonNode versionNode = root.get(VERSION);
    if (versionNode != null && !versionNode.isNull()) {
      if (!versionNode.canConvertToLong() || !versionNode.isIntegralNumber()) {
        throw new FormatException(name, operation, path, "'version' is not an integer", null);
      }
      version = versionNode.asLong();
      if (version < 1) {
        throw new FormatException(name, operation, path, "'version' must be positive", null);
      }
    }

    Instant created = timestamp(name, operation, path, CREATED, root.get(CREATED));
    Instant updated = timestamp(name, operation, path, UPDATED, root.get(UPDATED));
    if (created == null) created = updated != null ? updated : fallbackTime;
    if (updated == null) updated = created;
    if (created == null) {
      throw new FormatException(name, operation, path, "record carries no timestamps", null);
    }

    return new Reference(name, content, metadata, version, created, updated);
  }

  private JsonNode parse(
      String name, String operation, Path path, RecordFormat format, byte[] bytes) {
    RecordFormat other = format == RecordFormat.CURRENT ? RecordFormat.LEGACY : RecordFormat.CURRENT;
    try {
      return readTree(format, bytes);
    } catch (IOException first) {
      try {
        return readTree(other, bytes);
      } catch (IOException second) {
        first.addSuppressed(second);
        throw new FormatException(
            name, operation, path, "not parseable as YAML or JSON", first);
      }
    }
  }

  private static JsonNode readTree(RecordFormat format, byte[] bytes) throws IOException {
    JsonNode node = format.mapper().readTree(new String(bytes, StandardCharsets.UTF_8));
    if (node == null || node.isMissingNode()) {
      throw new IOException("empty document");
    }
    return node;
  }

  private static String scalar(
      String name, String operation, Path path, String field, JsonNode node) {
    if (node.isNull()) return "";
    if (!node.isTextual()) {
      throw new FormatException(name, operation, path, "'" + field + "' is not text", null);
    }
    return node.textValue();
  }

  private static Instant timestamp(
      String name, String operation, Path path, String field, JsonNode node) {
    if (node == null || node.isNull()) return null;
    if (node.isNumber()) {
      double seconds = node.asDouble();
      return Instant.ofEpochMilli(Math.round(seconds * 1000));
    }
    String text = node.asText().trim();
    try {
      return Instant.parse(text);
    } catch (DateTimeParseException notInstant) {
      try {
        return OffsetDateTime.parse(text).toInstant();
      } catch (DateTimeParseException notOffset) {
        try {
          return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
          throw new FormatException(
              name, operation, path, "'" + field + "' is not an ISO-8601 timestamp", e);
        }
      }
    }
  }
}
