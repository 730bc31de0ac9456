package com.gentoro.substrate.exception;

/** Invalid or missing configuration. */
public class ConfigException extends SubstrateException {
  public ConfigException(String message) {
    super(SubstrateErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(SubstrateErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
