package com.gentoro.substrate.exception;

import java.time.Instant;
import java.util.Map;

/**
 * Structured failure for logs and tool responses. {@link #referenceName} and {@link #operation}
 * are lifted out of the context when the failure concerns a single reference, and are {@code null}
 * otherwise.
 */
public final class ErrorDetails {
  public final String type;
  public final String message;
  public final SubstrateErrorCode code;
  public final String referenceName;
  public final String operation;
  public final Map<String, Object> context;
  public final Instant timestamp;

  public ErrorDetails(
      String type,
      String message,
      SubstrateErrorCode code,
      Map<String, Object> context,
      Instant timestamp) {
    this.type = type;
    this.message = message;
    this.code = code;
    this.context = context == null ? Map.of() : context;
    this.referenceName = text(this.context.get(SubstrateException.NAME));
    this.operation = text(this.context.get(SubstrateException.OPERATION));
    this.timestamp = timestamp;
  }

  /** Whether the failure concerns a single named reference. */
  public boolean isReferenceScoped() {
    return referenceName != null;
  }

  private static String text(Object value) {
    return value == null ? null : value.toString();
  }
}
