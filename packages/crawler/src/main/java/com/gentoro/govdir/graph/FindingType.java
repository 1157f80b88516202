package com.gentoro.govdir.graph;

public enum FindingType {
  DUPLICATE_ID(Severity.FATAL),
  HASH_COLLISION(Severity.FATAL),
  ORPHAN_REFERENCE(Severity.FATAL),
  COUNT_DISCREPANCY(Severity.WARNING),
  UNPLACED_DIRECTORY_AGENCY(Severity.WARNING),
  EMPTY_NAME(Severity.WARNING);

  public enum Severity {
    FATAL,
    WARNING
  }

  private final Severity severity;

  FindingType(Severity severity) {
    this.severity = severity;
  }

  public Severity severity() {
    return severity;
  }

  public boolean isFatal() {
    return severity == Severity.FATAL;
  }
}
