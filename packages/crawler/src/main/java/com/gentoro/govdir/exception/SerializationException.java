package com.gentoro.govdir.exception;

/** JSON, CSV or YAML (de)serialization failure. */
public class SerializationException extends GovDirException {
  public SerializationException(String message) {
    super(GovDirErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(GovDirErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
