package com.gentoro.govdir.fetch;

import com.gentoro.govdir.exception.ExceptionUtil;
import com.gentoro.govdir.exception.FetchAbortedException;
import com.gentoro.govdir.exception.FetchException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The single owner of the network path. Wraps a {@link PageFetcher} with pacing, per-call retries
 * with a per-attempt timeout, and an anomaly state machine.
 *
 * <p>State machine:
 *
 * <ul>
 *   <li>{@link GovernorState#NORMAL}: normal pacing. An anomaly moves to {@code CAUTIOUS}.
 *   <li>{@link GovernorState#CAUTIOUS}: cautious pacing for the next {@code cautiousRequests}
 *       requests. That many anomaly-free requests return to {@code NORMAL}; another anomaly
 *       moves to {@code BACKOFF}.
 *   <li>{@link GovernorState#BACKOFF}: cautious pacing plus a pause before the next request. The
 *       pause starts at {@code backoffInitialPauseMs} and doubles on every further consecutive
 *       anomaly. There is no way back to {@code NORMAL}.
 *   <li>{@link GovernorState#ABORTED}: reached after {@code abortAfterAnomalies} consecutive
 *       anomalies from any state. Every later call fails with {@link FetchAbortedException} without
 *       touching the network.
 * </ul>
 *
 * <p>A call that exhausts its retry attempts is one anomaly; the page is reported failed through a
 * {@link FetchException}. A call that succeeds on any attempt is one anomaly-free request.
 *
 * <p>All public methods are synchronized: at most one request is in flight per governor.
 */
public class FetchGovernor implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.govdir.logging.LoggingService.getLogger(FetchGovernor.class);

  private final PageFetcher fetcher;
  private final PacingPolicy pacing;
  private final RetryPolicy retry;
  private final Sleeper sleeper;
  private final Random random;
  private final ExecutorService attemptExecutor;

  private GovernorState state = GovernorState.NORMAL;
  private int consecutiveAnomalies;
  private int cautiousRemaining;
  private long backoffPauseMs;
  private long pendingPauseMs;

  private long totalRequests;
  private long totalAttempts;
  private long succeededRequests;
  private long totalAnomalies;

  public FetchGovernor(
      PageFetcher fetcher, PacingPolicy pacing, RetryPolicy retry, Sleeper sleeper, Random random) {
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    this.pacing = Objects.requireNonNull(pacing, "pacing");
    this.retry = Objects.requireNonNull(retry, "retry");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.random = Objects.requireNonNull(random, "random");
    // Cached, not single-threaded: an attempt that ignores cancellation keeps its own thread and
    // the next attempt still runs on a fresh one.
    this.attemptExecutor =
        Executors.newCachedThreadPool(
            r -> {
              Thread t = new Thread(r, "govdir-fetch");
              t.setDaemon(true);
              return t;
            });
  }

  /**
   * Fetch a page, blocking through pacing, retries and backoff pauses.
   *
   * @throws FetchAbortedException if the governor is (or becomes, while waiting) aborted
   * @throws FetchException if every attempt failed
   */
  public synchronized String fetch(FetchTarget target) {
    Objects.requireNonNull(target, "target");
    if (state == GovernorState.ABORTED) {
      throw aborted(target);
    }
    totalRequests++;

    FetchException last = null;
    for (int attempt = 1; attempt <= retry.maxAttempts(); attempt++) {
      long retryDelay = retry.delayBeforeAttempt(attempt);
      if (retryDelay > 0) {
        log.debug(
            "Retry {} of {} for {} in {} ms",
            attempt,
            retry.maxAttempts(),
            target.label(),
            retryDelay);
        pause(retryDelay, target);
      }
      pace(target);
      totalAttempts++;
      try {
        String content = attempt(target);
        onSuccess(target);
        return content;
      } catch (FetchException e) {
        last = e;
        log.warn(
            "Attempt {}/{} for {} failed: {} ({})",
            attempt,
            retry.maxAttempts(),
            target.label(),
            e.getSignal(),
            e.getMessage());
      }
    }

    onAnomaly(target, last.getSignal());
    Map<String, Object> ctx = new LinkedHashMap<>();
    ctx.put("url", target.url());
    ctx.put("label", target.label());
    ctx.put("attempts", retry.maxAttempts());
    throw new FetchException(
        last.getSignal(),
        "Giving up on %s after %d attempts".formatted(target.label(), retry.maxAttempts()),
        ctx,
        last);
  }

  public synchronized GovernorState state() {
    return state;
  }

  public synchronized boolean isAborted() {
    return state == GovernorState.ABORTED;
  }

  public synchronized GovernorSnapshot snapshot() {
    return new GovernorSnapshot(
        state,
        consecutiveAnomalies,
        state == GovernorState.CAUTIOUS ? cautiousRemaining : 0,
        backoffPauseMs,
        totalRequests,
        totalAttempts,
        succeededRequests,
        totalAnomalies);
  }

  @Override
  public void close() {
    attemptExecutor.shutdownNow();
  }

  private String attempt(FetchTarget target) {
    Future<String> future =
        attemptExecutor.submit(() -> fetcher.fetch(target, retry.attemptTimeout()));
    try {
      String content = future.get(retry.attemptTimeoutMs(), TimeUnit.MILLISECONDS);
      if (content == null) {
        throw new FetchException(FetchSignal.EMPTY_CONTENT, "Fetcher returned no content");
      }
      return content;
    } catch (TimeoutException e) {
      future.cancel(true);
      log.warn(
          "Abandoned attempt for {} after {} ms; fetcher did not honour its timeout",
          target.label(),
          retry.attemptTimeoutMs());
      throw new FetchException(
          FetchSignal.TIMEOUT,
          "No response within %d ms".formatted(retry.attemptTimeoutMs()),
          e);
    } catch (ExecutionException e) {
      Throwable cause = ExceptionUtil.unwrap(e);
      if (cause instanceof FetchException fe) {
        throw fe;
      }
      throw new FetchException(FetchSignal.TRANSPORT, String.valueOf(cause.getMessage()), cause);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw interrupted(target, e);
    }
  }

  private void pace(FetchTarget target) {
    if (pendingPauseMs > 0) {
      log.info("Backing off for {} ms before {}", pendingPauseMs, target.label());
      long pauseMs = pendingPauseMs;
      pendingPauseMs = 0;
      pause(pauseMs, target);
    }
    long delay = pacing.delayFor(state, random);
    if (delay > 0) {
      log.debug("Pacing {} ms ({}) before {}", delay, state, target.label());
      pause(delay, target);
    }
  }

  private void pause(long millis, FetchTarget target) {
    try {
      sleeper.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw interrupted(target, e);
    }
  }

  private void onSuccess(FetchTarget target) {
    succeededRequests++;
    consecutiveAnomalies = 0;
    if (state == GovernorState.CAUTIOUS && --cautiousRemaining <= 0) {
      transition(GovernorState.NORMAL, "cautious window completed after " + target.label());
    }
  }

  private void onAnomaly(FetchTarget target, FetchSignal signal) {
    totalAnomalies++;
    consecutiveAnomalies++;
    if (consecutiveAnomalies >= pacing.abortAfterAnomalies()) {
      transition(
          GovernorState.ABORTED,
          "%d consecutive anomalies, last %s on %s"
              .formatted(consecutiveAnomalies, signal, target.label()));
      pendingPauseMs = 0;
      return;
    }
    switch (state) {
      case NORMAL -> {
        cautiousRemaining = pacing.cautiousRequests();
        transition(GovernorState.CAUTIOUS, signal + " on " + target.label());
      }
      case CAUTIOUS -> {
        backoffPauseMs = pacing.backoffInitialPauseMs();
        pendingPauseMs = backoffPauseMs;
        transition(GovernorState.BACKOFF, signal + " on " + target.label());
      }
      case BACKOFF -> {
        backoffPauseMs = backoffPauseMs > Long.MAX_VALUE / 2 ? Long.MAX_VALUE : backoffPauseMs * 2;
        pendingPauseMs = backoffPauseMs;
        log.warn(
            "Anomaly {} on {} while backing off; next pause {} ms",
            signal,
            target.label(),
            backoffPauseMs);
      }
      default -> {}
    }
  }

  private void transition(GovernorState next, String reason) {
    if (next == GovernorState.ABORTED) {
      log.error("Fetch governor {} -> {}: {}", state, next, reason);
    } else {
      log.info("Fetch governor {} -> {}: {}", state, next, reason);
    }
    state = next;
  }

  private FetchAbortedException aborted(FetchTarget target) {
    return new FetchAbortedException(
        "Fetch governor is aborted; refusing " + target.label(),
        Map.of("url", target.url(), "consecutiveAnomalies", consecutiveAnomalies));
  }

  private FetchAbortedException interrupted(FetchTarget target, InterruptedException e) {
    return new FetchAbortedException(
        "Interrupted while fetching " + target.label(), Map.of("url", target.url()), e);
  }
}
