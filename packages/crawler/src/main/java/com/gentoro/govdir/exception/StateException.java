package com.gentoro.govdir.exception;

/** Illegal or unexpected state encountered. */
public class StateException extends GovDirException {
  public StateException(String message) {
    super(GovDirErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(GovDirErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
