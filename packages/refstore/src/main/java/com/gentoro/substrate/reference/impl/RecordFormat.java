package com.gentoro.substrate.reference.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.substrate.utility.JacksonUtility;
import java.nio.file.Path;
import java.util.Optional;

/** On-disk serializations of a reference record, in lookup order. */
public enum RecordFormat {
  /** Human-readable YAML; the only format ever written. */
  CURRENT(".yaml"),
  /** JSON written by earlier releases; read-only. */
  LEGACY(".json");

  private final String extension;

  RecordFormat(String extension) {
    this.extension = extension;
  }

  public String extension() {
    return extension;
  }

  ObjectMapper mapper() {
    return this == CURRENT ? JacksonUtility.getYamlMapper() : JacksonUtility.getJsonMapper();
  }

  /** Format of a record file, judged by its extension. */
  public static Optional<RecordFormat> of(Path file) {
    Path fileName = file.getFileName();
    return fileName == null ? Optional.empty() : ofFileName(fileName.toString());
  }

  static Optional<RecordFormat> ofFileName(String s) {
    for (RecordFormat f : values()) {
      if (s.length() > f.extension.length() && s.endsWith(f.extension)) {
        return Optional.of(f);
      }
    }
    return Optional.empty();
  }
}
