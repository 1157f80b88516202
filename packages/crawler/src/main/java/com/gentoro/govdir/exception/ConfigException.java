package com.gentoro.govdir.exception;

/** Configuration could not be loaded or holds an invalid value. */
public class ConfigException extends GovDirException {
  public ConfigException(String message) {
    super(GovDirErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(GovDirErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
