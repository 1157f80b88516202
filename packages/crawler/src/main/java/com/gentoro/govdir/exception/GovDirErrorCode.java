package com.gentoro.govdir.exception;

/**
 * Canonical error codes for the crawler. Codes are stable and end up in the failure log and the
 * run report, so downstream tooling can group failures without parsing messages.
 */
public enum GovDirErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,

  // Crawl specific
  FETCH_FAILED,
  FETCH_ABORTED,
  EXTRACTION_ERROR,
  RESOLUTION_ERROR,
}
