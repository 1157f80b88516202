package com.gentoro.govdir.exception;

import java.util.Map;

/**
 * The fetch governor reached its terminal state. No further requests are issued during this run;
 * the condition needs manual intervention before crawling again.
 */
public class FetchAbortedException extends GovDirException {
  public FetchAbortedException(String message, Map<String, ?> context) {
    super(GovDirErrorCode.FETCH_ABORTED, message, context);
  }

  public FetchAbortedException(String message, Map<String, ?> context, Throwable cause) {
    super(GovDirErrorCode.FETCH_ABORTED, message, context, cause);
  }
}
