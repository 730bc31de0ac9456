package com.gentoro.substrate.exception;

import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Persistence failure while reading or writing the backing storage. The previous record, if any,
 * is left intact.
 */
public class StorageIoException extends SubstrateException {
  public StorageIoException(String name, String operation, Path path, Throwable cause) {
    super(
        SubstrateErrorCode.STORAGE_IO_ERROR,
        "Storage failure during " + operation + " of reference '" + name + "'",
        withPath(name, operation, path),
        cause);
  }

  public StorageIoException(String message, Throwable cause) {
    super(SubstrateErrorCode.STORAGE_IO_ERROR, message, cause);
  }

  /**
   * Whether a retry with backoff may succeed. Permission and disk-space failures are fatal; other
   * I/O failures are treated as transient.
   */
  public boolean isTransient() {
    Throwable c = getCause();
    while (c != null) {
      if (c instanceof AccessDeniedException) return false;
      if (c instanceof FileSystemException fse) {
        String reason = fse.getReason();
        if (reason != null && reason.toLowerCase().contains("no space left")) return false;
      }
      String msg = c.getMessage();
      if (msg != null && msg.toLowerCase().contains("no space left")) return false;
      c = c.getCause();
    }
    return true;
  }

  private static Map<String, Object> withPath(String name, String operation, Path path) {
    Map<String, Object> m = referenceContext(name, operation);
    if (path != null) m.put(PATH, path.toString());
    return m;
  }
}
