package com.gentoro.substrate.exception;

import java.time.Instant;
import java.util.Map;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails} for logging or tool responses. If the
   * throwable is a {@link SubstrateException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof SubstrateException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        safeMessage(t.getMessage()),
        SubstrateErrorCode.UNKNOWN,
        Map.of(),
        Instant.now());
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }
}
