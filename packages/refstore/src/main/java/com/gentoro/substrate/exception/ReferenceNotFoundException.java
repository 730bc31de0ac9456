package com.gentoro.substrate.exception;

/** No record exists for the name, in either the current or the legacy format. */
public class ReferenceNotFoundException extends SubstrateException {
  public ReferenceNotFoundException(String name, String operation) {
    super(
        SubstrateErrorCode.REFERENCE_NOT_FOUND,
        "Reference '" + name + "' not found",
        referenceContext(name, operation));
  }
}
