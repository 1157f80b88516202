package com.gentoro.govdir.fetch;

import com.gentoro.govdir.exception.ConfigException;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

/** Per-call retry policy, independent from the governor's anomaly state machine. */
public record RetryPolicy(
    int maxAttempts, long attemptTimeoutMs, long initialBackoffMs, double multiplier) {

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new ConfigException("maxAttempts must be >= 1, got " + maxAttempts);
    }
    if (attemptTimeoutMs < 1) {
      throw new ConfigException("attemptTimeoutMs must be >= 1, got " + attemptTimeoutMs);
    }
    if (initialBackoffMs < 0 || multiplier < 1.0) {
      throw new ConfigException(
          "Invalid retry backoff: initial=%d ms, multiplier=%s"
              .formatted(initialBackoffMs, multiplier));
    }
  }

  public static RetryPolicy defaults() {
    return new RetryPolicy(3, 30_000, 2_000, 2.0);
  }

  public static RetryPolicy fromConfiguration(Configuration cfg) {
    RetryPolicy d = defaults();
    return new RetryPolicy(
        cfg.getInt("crawler.retry.maxAttempts", d.maxAttempts()),
        cfg.getLong("crawler.retry.attemptTimeoutMs", d.attemptTimeoutMs()),
        cfg.getLong("crawler.retry.initialBackoffMs", d.initialBackoffMs()),
        cfg.getDouble("crawler.retry.multiplier", d.multiplier()));
  }

  public Duration attemptTimeout() {
    return Duration.ofMillis(attemptTimeoutMs);
  }

  /**
   * Wait before {@code attempt} (1-based). The first attempt has none; retry {@code n} waits
   * {@code initialBackoffMs * multiplier^(n-1)}.
   */
  public long delayBeforeAttempt(int attempt) {
    if (attempt <= 1) return 0L;
    return Math.round(initialBackoffMs * Math.pow(multiplier, attempt - 2));
  }
}
