package com.gentoro.substrate.exception;

/** JSON/YAML serialization or deserialization error outside of reference records. */
public class SerializationException extends SubstrateException {
  public SerializationException(String message) {
    super(SubstrateErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(SubstrateErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
