package com.gentoro.substrate.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base runtime exception for Substrate with a stable {@link SubstrateErrorCode} and optional
 * context.
 *
 * <p>The context map is copied and unmodifiable. Store failures always carry the reference {@code
 * name} and the attempted {@code operation}, so callers can build a user-facing message without
 * parsing the exception text.
 */
public class SubstrateException extends RuntimeException {
  public static final String NAME = "name";
  public static final String OPERATION = "operation";
  public static final String PATH = "path";

  private final SubstrateErrorCode code;
  private final Map<String, Object> context;

  public SubstrateException(SubstrateErrorCode code, String message) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
    this.context = Collections.emptyMap();
  }

  public SubstrateException(SubstrateErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context = Collections.emptyMap();
  }

  public SubstrateException(SubstrateErrorCode code, String message, Map<String, ?> context) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
    this.context = copy(context);
  }

  public SubstrateException(
      SubstrateErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context = copy(context);
  }

  public SubstrateErrorCode getCode() {
    return code;
  }

  /** Additional key/value details that help diagnosing the error. */
  public Map<String, Object> getContext() {
    return context;
  }

  /** Reference name the failure refers to, or {@code null} when not reference-scoped. */
  public String getReferenceName() {
    Object v = context.get(NAME);
    return v == null ? null : v.toString();
  }

  /** Store operation that failed (e.g. "read", "delete"), or {@code null}. */
  public String getOperation() {
    Object v = context.get(OPERATION);
    return v == null ? null : v.toString();
  }

  /** Context map for a reference-scoped failure. */
  protected static Map<String, Object> referenceContext(String name, String operation) {
    Map<String, Object> m = new LinkedHashMap<>();
    if (name != null) m.put(NAME, name);
    if (operation != null) m.put(OPERATION, operation);
    return m;
  }

  private static Map<String, Object> copy(Map<String, ?> input) {
    if (input == null || input.isEmpty()) return Collections.emptyMap();
    Map<String, Object> m = new LinkedHashMap<>();
    input.forEach((k, v) -> m.put(k, v));
    return Collections.unmodifiableMap(m);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName()
        + "{"
        + "code="
        + code
        + ", message="
        + String.valueOf(getMessage())
        + (context.isEmpty() ? "" : ", context=" + context)
        + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
        + '}';
  }
}
