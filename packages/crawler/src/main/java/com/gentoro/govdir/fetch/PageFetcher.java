package com.gentoro.govdir.fetch;

import com.gentoro.govdir.exception.FetchException;
import java.time.Duration;

/**
 * Loads one page and returns its markup once the target's ready condition holds.
 *
 * <p>Implementations perform exactly one attempt per call. Retrying, pacing and anomaly tracking
 * belong to {@link FetchGovernor}.
 *
 * <p>Implementations must return or throw within {@code timeout} and stop on interrupt. The
 * governor stops waiting at the timeout and interrupts the attempt; an attempt that keeps running
 * after that is abandoned on its own thread and its result is discarded.
 */
public interface PageFetcher {

  /**
   * @param target page to load
   * @param timeout upper bound for this attempt
   * @return the page markup
   * @throws FetchException with a {@link FetchSignal} describing why the page is unusable
   */
  String fetch(FetchTarget target, Duration timeout);
}
