package com.gentoro.substrate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.apache.commons.configuration2.interpol.Lookup;

/**
 * {@code env} lookup for configuration placeholders. A non-empty process environment variable wins;
 * otherwise the value comes from the first ".env.local" file found in the candidate locations.
 *
 * <p>The file holds {@code KEY=value} lines; blank lines and "#" comments are skipped, an optional
 * {@code export} keyword is accepted and matching outer quotes are removed.
 */
final class EnvFileLookup implements Lookup {
  private static final org.slf4j.Logger log =
      com.gentoro.substrate.logging.LoggingService.getLogger(EnvFileLookup.class);

  static final List<Path> DEFAULT_CANDIDATES =
      List.of(Path.of(".env.local"), Path.of("packages", "refstore", ".env.local"));

  private final Function<String, String> environment;
  private final List<Path> candidates;
  private volatile Map<String, String> fileValues;

  EnvFileLookup() {
    this(System::getenv, DEFAULT_CANDIDATES);
  }

  EnvFileLookup(Function<String, String> environment, List<Path> candidates) {
    this.environment = environment;
    this.candidates = List.copyOf(candidates);
  }

  @Override
  public Object lookup(String key) {
    String value = environment.apply(key);
    if (value != null && !value.isEmpty()) {
      return value;
    }
    return fileValues().get(key);
  }

  private Map<String, String> fileValues() {
    Map<String, String> values = fileValues;
    if (values == null) {
      synchronized (this) {
        values = fileValues;
        if (values == null) {
          values = load();
          fileValues = values;
        }
      }
    }
    return values;
  }

  private Map<String, String> load() {
    for (Path candidate : candidates) {
      if (!Files.isRegularFile(candidate)) {
        continue;
      }
      log.info("Reading environment fallback from {}", candidate.toAbsolutePath());
      try {
        return parse(Files.readAllLines(candidate, StandardCharsets.UTF_8));
      } catch (IOException e) {
        log.warn("Could not read {}; ignoring it", candidate.toAbsolutePath(), e);
        return Map.of();
      }
    }
    log.debug("No .env.local among {}", candidates);
    return Map.of();
  }

  static Map<String, String> parse(List<String> lines) {
    Map<String, String> result = new HashMap<>();
    for (String raw : lines) {
      String line = raw.strip();
      if (line.isEmpty() || line.startsWith("#")) continue;
      if (line.startsWith("export ")) line = line.substring("export ".length()).stripLeading();
      int eq = line.indexOf('=');
      if (eq <= 0) continue;
      result.put(line.substring(0, eq).strip(), unquote(line.substring(eq + 1).strip()));
    }
    return result;
  }

  private static String unquote(String value) {
    if (value.length() >= 2) {
      char first = value.charAt(0);
      if ((first == '"' || first == '\'') && value.charAt(value.length() - 1) == first) {
        return value.substring(1, value.length() - 1);
      }
    }
    return value;
  }
}
