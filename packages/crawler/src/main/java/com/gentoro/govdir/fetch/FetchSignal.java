package com.gentoro.govdir.fetch;

/** Distinguishable reasons a page could not be obtained. */
public enum FetchSignal {
  /** The attempt did not finish within its timeout. */
  TIMEOUT,
  /** HTTP 429. */
  RATE_LIMITED,
  /** HTTP 403 or 503, usually a blocked client. */
  BLOCKED,
  /** Any other non-2xx status. */
  HTTP_STATUS,
  /** The page loaded but the caller's ready condition was not satisfied. */
  EMPTY_CONTENT,
  /** The markup looks like an anti-automation challenge page. */
  BOT_CHALLENGE,
  /** Connection level I/O failure. */
  TRANSPORT,
  /** Network access is disabled for this run and the artifact was not cached. */
  OFFLINE,
  /** The governor is aborted and refused to issue the request. */
  ABORTED
}
