package com.gentoro.substrate.exception;

import java.nio.file.Path;
import java.util.Map;

/**
 * A record exists but its bytes parse in neither the current nor the legacy format. Reported, never
 * repaired automatically.
 */
public class FormatException extends SubstrateException {
  public FormatException(String name, String operation, Path path, String reason, Throwable cause) {
    super(
        SubstrateErrorCode.FORMAT_ERROR,
        "Unreadable record for reference '" + name + "': " + reason,
        context(name, operation, path),
        cause);
  }

  private static Map<String, Object> context(String name, String operation, Path path) {
    Map<String, Object> m = referenceContext(name, operation);
    if (path != null) m.put(PATH, path.toString());
    return m;
  }
}
