package com.gentoro.substrate.reference.impl;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.substrate.exception.FormatException;
import com.gentoro.substrate.exception.SubstrateErrorCode;
import com.gentoro.substrate.reference.Reference;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ReferenceCodec")
class ReferenceCodecTest {

  private static final Path PATH = Path.of("refs/x.yaml");
  private static final Instant MTIME = Instant.parse("2026-02-02T02:02:02Z");

  private final ReferenceCodec codec = new ReferenceCodec();

  private Reference decode(RecordFormat format, String text) {
    return codec.decode("x", "read", PATH, format, text.getBytes(StandardCharsets.UTF_8), MTIME);
  }

  @Test
  void encodedRecordDecodesToTheSameReference() {
    Reference original =
        new Reference(
            "x",
            "multi\nline: content\n",
            Map.of("b", "2", "a", "yes"),
            7,
            Instant.parse("2026-01-01T00:00:00Z"),
            Instant.parse("2026-01-02T03:04:05.678Z"));

    byte[] bytes = codec.encode(original);
    Reference decoded = codec.decode("x", "read", PATH, RecordFormat.CURRENT, bytes, MTIME);
    assertEquals(original, decoded);
  }

  @Test
  void missingTimestampsFallBackToFileTime() {
    Reference r = decode(RecordFormat.LEGACY, "{\"content\": \"c\"}");
    assertEquals(MTIME, r.createdAt());
    assertEquals(MTIME, r.updatedAt());
    assertEquals(1, r.version());
  }

  @Test
  void missingUpdatedFallsBackToCreated() {
    Reference r = decode(RecordFormat.CURRENT, "content: c\ncreated: '2026-01-01T00:00:00+02:00'\n");
    assertEquals(Instant.parse("2025-12-31T22:00:00Z"), r.createdAt());
    assertEquals(r.createdAt(), r.updatedAt());
  }

  @Test
  void nonStringMetadataValuesAreRenderedAsText() {
    Reference r =
        decode(
            RecordFormat.LEGACY,
            "{\"content\": \"c\", \"metadata\": {\"n\": 1, \"flag\": true, \"tags\": [\"a\"], \"none\": null}}");
    assertEquals("1", r.metadata().get("n"));
    assertEquals("true", r.metadata().get("flag"));
    assertEquals("[\"a\"]", r.metadata().get("tags"));
    assertEquals("", r.metadata().get("none"));
  }

  @Test
  void rejectsDocumentsThatAreNotRecords() {
    assertFormatError(RecordFormat.CURRENT, "");
    assertFormatError(RecordFormat.CURRENT, "just a line of text");
    assertFormatError(RecordFormat.CURRENT, "metadata: {}\n");
    assertFormatError(RecordFormat.CURRENT, "content: x\nmetadata: [1, 2]\n");
    assertFormatError(RecordFormat.CURRENT, "content: x\nversion: two\n");
    assertFormatError(RecordFormat.CURRENT, "content: x\nversion: 0\n");
    assertFormatError(RecordFormat.CURRENT, "content: x\ncreated: yesterday\n");
    assertFormatError(RecordFormat.LEGACY, "{\"content\": {\"nested\": true}}");
  }

  @Test
  void contentMustBeText() {
    assertFormatError(RecordFormat.CURRENT, "content: 42\n");
    assertFormatError(RecordFormat.CURRENT, "content: true\n");
    assertFormatError(RecordFormat.LEGACY, "{\"content\": 1e3}");
    assertEquals("", decode(RecordFormat.CURRENT, "content: null\n").content());
    assertEquals("1e3", decode(RecordFormat.CURRENT, "content: '1e3'\n").content());
  }

  @Test
  void multiLineTextIsWrittenAsLiteralBlockOnlyWhenLineBreaksAreNewlines() {
    Instant t = Instant.parse("2026-01-01T00:00:00Z");
    Reference readable = new Reference("x", "one\ntwo\n", Map.of(), 1, t, t);
    Reference crlf = new Reference("x", "one\r\ntwo\n", Map.of(), 1, t, t);
    Reference nelInMetadata =
        new Reference("x", "one\ntwo\n", Map.of("k", "a\u0085b"), 1, t, t);

    assertTrue(ReferenceCodec.literalSafe(readable));
    assertFalse(ReferenceCodec.literalSafe(crlf));
    assertFalse(ReferenceCodec.literalSafe(nelInMetadata));

    String yaml = new String(codec.encode(readable), StandardCharsets.UTF_8);
    assertTrue(yaml.contains("content: |"), yaml);
    String escaped = new String(codec.encode(crlf), StandardCharsets.UTF_8);
    assertTrue(escaped.contains("\"one\\r\\ntwo\\n\""), escaped);

    for (Reference r : List.of(readable, crlf, nelInMetadata)) {
      assertEquals(
          r, codec.decode("x", "read", PATH, RecordFormat.CURRENT, codec.encode(r), MTIME));
    }
  }

  @Test
  void typedLookingTextIsQuoted() {
    Instant t = Instant.parse("2026-01-01T00:00:00Z");
    Reference r = new Reference("x", "1e3", Map.of("flag", "yes", "empty", "~"), 1, t, t);
    String yaml = new String(codec.encode(r), StandardCharsets.UTF_8);
    assertTrue(yaml.contains("content: \"1e3\""), yaml);
    assertTrue(yaml.contains("flag: \"yes\""), yaml);
    assertEquals(r, decode(RecordFormat.CURRENT, yaml));
  }

  @Test
  void formatErrorCarriesContext() {
    FormatException e =
        assertThrows(FormatException.class, () -> decode(RecordFormat.CURRENT, "- a\n- b\n"));
    assertEquals(SubstrateErrorCode.FORMAT_ERROR, e.getCode());
    assertEquals("x", e.getReferenceName());
    assertEquals("read", e.getOperation());
    assertEquals(PATH.toString(), e.getContext().get("path"));
  }

  private void assertFormatError(RecordFormat format, String text) {
    assertThrows(FormatException.class, () -> decode(format, text), text);
  }
}
