package com.gentoro.substrate.exception;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class StorageIoExceptionTest {

  private static final Path PATH = Path.of("refs/a.yaml");

  @Test
  void permissionAndSpaceFailuresAreFatal() {
    assertFalse(
        new StorageIoException("a", "create", PATH, new AccessDeniedException("refs/a.yaml"))
            .isTransient());
    assertFalse(
        new StorageIoException(
                "a",
                "create",
                PATH,
                new FileSystemException("refs/a.yaml", null, "No space left on device"))
            .isTransient());
  }

  @Test
  void otherFailuresAreTransient() {
    StorageIoException e =
        new StorageIoException("a", "read", PATH, new IOException("Input/output error"));
    assertTrue(e.isTransient());
    assertEquals(SubstrateErrorCode.STORAGE_IO_ERROR, e.getCode());
    assertEquals("refs/a.yaml", e.getContext().get("path"));
    assertTrue(e.toString().contains("cause=IOException"), e.toString());
  }

  @Test
  void contextIsImmutable() {
    StorageIoException e = new StorageIoException("a", "read", PATH, new IOException());
    assertThrows(UnsupportedOperationException.class, () -> e.getContext().put("x", "y"));
  }

  @Test
  void errorDetailsPreserveCodeAndContext() {
    ErrorDetails d = ExceptionUtil.toErrorDetails(new ReferenceNotFoundException("a", "delete"));
    assertEquals("ReferenceNotFoundException", d.type);
    assertEquals(SubstrateErrorCode.REFERENCE_NOT_FOUND, d.code);
    assertEquals("delete", d.context.get("operation"));
    assertEquals("a", d.referenceName);
    assertEquals("delete", d.operation);
    assertTrue(d.isReferenceScoped());
  }

  @Test
  void failuresOutsideTheStoreAreNotReferenceScoped() {
    ErrorDetails d = ExceptionUtil.toErrorDetails(new IllegalStateException("boom"));
    assertEquals(SubstrateErrorCode.UNKNOWN, d.code);
    assertNull(d.referenceName);
    assertNull(d.operation);
    assertFalse(d.isReferenceScoped());
    assertTrue(d.context.isEmpty());

    ErrorDetails config = ExceptionUtil.toErrorDetails(new ConfigException("bad root"));
    assertEquals(SubstrateErrorCode.CONFIGURATION_ERROR, config.code);
    assertFalse(config.isReferenceScoped());
  }
}
