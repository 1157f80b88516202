package com.gentoro.govdir.exception;

/** Filesystem read or write failure. */
public class IoException extends GovDirException {
  public IoException(String message) {
    super(GovDirErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(GovDirErrorCode.IO_ERROR, message, cause);
  }
}
