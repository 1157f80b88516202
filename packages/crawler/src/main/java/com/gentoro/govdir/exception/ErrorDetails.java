package com.gentoro.govdir.exception;

import java.time.Instant;
import java.util.Map;

/** Lightweight DTO exposing structured error information to logs, the failure log and reports. */
public final class ErrorDetails {
  public final String type;
  public final String message;
  public final GovDirErrorCode code;
  public final Map<String, Object> context;
  public final Instant timestamp;

  public ErrorDetails(
      String type,
      String message,
      GovDirErrorCode code,
      Map<String, Object> context,
      Instant timestamp) {
    this.type = type;
    this.message = message;
    this.code = code;
    this.context = context;
    this.timestamp = timestamp;
  }
}
