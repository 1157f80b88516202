package com.gentoro.govdir.fetch;

public enum GovernorState {
  NORMAL,
  CAUTIOUS,
  BACKOFF,
  /** Terminal. */
  ABORTED
}
