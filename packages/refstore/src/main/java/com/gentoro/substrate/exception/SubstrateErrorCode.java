package com.gentoro.substrate.exception;

/**
 * Canonical error codes for Substrate. Codes are stable and suitable for downstream tool handlers
 * and logs. The four reference codes are the only ones the store itself raises; the remaining codes
 * belong to bootstrap and configuration.
 */
public enum SubstrateErrorCode {
  // Generic
  UNKNOWN,
  FAILED_PRECONDITION,

  // Reference store
  INVALID_REFERENCE_NAME,
  REFERENCE_NOT_FOUND,
  STORAGE_IO_ERROR,
  FORMAT_ERROR,

  // Bootstrap
  CONFIGURATION_ERROR,
  SERIALIZATION_ERROR,
}
