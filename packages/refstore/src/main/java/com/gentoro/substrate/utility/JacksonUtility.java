package com.gentoro.substrate.utility;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.util.StringQuotingChecker;
import org.yaml.snakeyaml.LoaderOptions;

/**
 * Shared mappers. The YAML mappers double-quote every string value, so text such as "1e3", "true"
 * or "~" keeps its type on re-read and non-printable characters are written as escapes. Document
 * size is bounded only by memory.
 */
public class JacksonUtility {
  private static final StreamReadConstraints UNBOUNDED_STRINGS =
      StreamReadConstraints.builder().maxStringLength(Integer.MAX_VALUE).build();

  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(yamlFactory(false));

  private static final ObjectMapper LITERAL_YAML_MAPPER = new ObjectMapper(yamlFactory(true));

  private static final ObjectMapper JSON_MAPPER =
      new ObjectMapper(JsonFactory.builder().streamReadConstraints(UNBOUNDED_STRINGS).build())
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
          .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
          .enable(SerializationFeature.INDENT_OUTPUT)
          .setSerializationInclusion(JsonInclude.Include.NON_NULL);

  private static YAMLFactory yamlFactory(boolean literalBlocks) {
    LoaderOptions loaderOptions = new LoaderOptions();
    loaderOptions.setCodePointLimit(Integer.MAX_VALUE);
    return YAMLFactory.builder()
        .loaderOptions(loaderOptions)
        .streamReadConstraints(UNBOUNDED_STRINGS)
        .stringQuotingChecker(new PrintableNameQuotingChecker())
        .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
        .disable(YAMLGenerator.Feature.SPLIT_LINES)
        .disable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
        .configure(YAMLGenerator.Feature.LITERAL_BLOCK_STYLE, literalBlocks)
        .build();
  }

  public static ObjectMapper getYamlMapper() {
    return YAML_MAPPER;
  }

  /**
   * Like {@link #getYamlMapper()} but writes multi-line strings as literal blocks. Only safe for
   * text whose line breaks are all "\n": a literal block folds "\r", NEL and the Unicode separators
   * into "\n" on re-read.
   */
  public static ObjectMapper getLiteralYamlMapper() {
    return LITERAL_YAML_MAPPER;
  }

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  /** Keys outside printable ASCII are quoted too, so they are escaped rather than folded. */
  private static final class PrintableNameQuotingChecker extends StringQuotingChecker.Default {
    @Override
    public boolean needToQuoteName(String name) {
      if (super.needToQuoteName(name)) return true;
      for (int i = 0; i < name.length(); i++) {
        char c = name.charAt(i);
        if (c < 0x20 || c > 0x7E) return true;
      }
      return false;
    }
  }
}
