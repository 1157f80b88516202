package com.gentoro.govdir.progress;

/**
 * Time and delta based limiter for progress events.
 *
 * <p>An event passes when {@code minIntervalMs} elapsed since the last accepted one, or when the
 * completed counter moved by at least {@code minDelta}.
 */
public class ProgressRateLimiter {
  private final long minIntervalMs;
  private final long minDelta;

  private long lastAcceptedAt;
  private long lastCompleted;

  public ProgressRateLimiter(long minIntervalMs, long minDelta) {
    this.minIntervalMs = Math.max(0, minIntervalMs);
    this.minDelta = Math.max(0, minDelta);
    reset();
  }

  public synchronized boolean tryAcquire(long nowMs, long completed) {
    boolean first = lastCompleted == Long.MIN_VALUE;
    boolean intervalOk = (nowMs - lastAcceptedAt) >= minIntervalMs;
    boolean deltaOk = first || Math.abs(completed - lastCompleted) >= minDelta;
    if (intervalOk || deltaOk) {
      lastAcceptedAt = nowMs;
      lastCompleted = completed;
      return true;
    }
    return false;
  }

  /** Forget history, so the next event passes. Called when a new stage begins. */
  public synchronized void reset() {
    lastAcceptedAt = 0L;
    lastCompleted = Long.MIN_VALUE;
  }
}
