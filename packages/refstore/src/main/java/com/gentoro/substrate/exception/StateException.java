package com.gentoro.substrate.exception;

/** Component used before it was initialized. */
public class StateException extends SubstrateException {
  public StateException(String message) {
    super(SubstrateErrorCode.FAILED_PRECONDITION, message);
  }
}
