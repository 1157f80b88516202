package com.gentoro.govdir.exception;

/** Input validation failure or illegal argument. */
public class ValidationException extends GovDirException {
  public ValidationException(String message) {
    super(GovDirErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(GovDirErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
