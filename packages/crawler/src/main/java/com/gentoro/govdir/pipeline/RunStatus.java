package com.gentoro.govdir.pipeline;

/** Outcome of a crawl run and the matching process exit code. */
public enum RunStatus {
  /** Every artifact was available and processed; no invariant violations. */
  SUCCESS(0),
  /** Some keys could not be fetched or parsed; the graph covers the rest. */
  PARTIAL_FAILURE(1),
  /** The fetch governor aborted; the partial graph was still validated and written. */
  ABORTED(2),
  /** An invariant was violated or the run broke down; no graph was written. */
  FAILED(3);

  private final int exitCode;

  RunStatus(int exitCode) {
    this.exitCode = exitCode;
  }

  public int exitCode() {
    return exitCode;
  }
}
