package com.gentoro.govdir.exception;

import java.util.Map;

/** Page markup did not match the structure the extractor for its page type expects. */
public class ExtractionException extends GovDirException {
  public ExtractionException(String message) {
    super(GovDirErrorCode.EXTRACTION_ERROR, message);
  }

  public ExtractionException(String message, Map<String, ?> context) {
    super(GovDirErrorCode.EXTRACTION_ERROR, message, context);
  }

  public ExtractionException(String message, Map<String, ?> context, Throwable cause) {
    super(GovDirErrorCode.EXTRACTION_ERROR, message, context, cause);
  }
}
