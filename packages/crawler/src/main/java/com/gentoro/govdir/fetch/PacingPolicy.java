package com.gentoro.govdir.fetch;

import com.gentoro.govdir.exception.ConfigException;
import java.util.Random;
import org.apache.commons.configuration2.Configuration;

/**
 * Delays between requests and the escalation thresholds of the {@link FetchGovernor}.
 *
 * @param normalMinDelayMs lower bound of the base delay in {@link GovernorState#NORMAL}
 * @param normalMaxDelayMs upper bound of the base delay in {@link GovernorState#NORMAL}
 * @param normalMaxJitterMs extra random delay added on top of the normal base delay
 * @param cautiousMinDelayMs lower bound of the delay while cautious or backing off
 * @param cautiousMaxDelayMs upper bound of the delay while cautious or backing off
 * @param cautiousRequests anomaly-free requests needed to return from cautious to normal
 * @param backoffInitialPauseMs first pause after entering backoff; doubled per further anomaly
 * @param abortAfterAnomalies consecutive anomalies that abort the governor
 */
public record PacingPolicy(
    long normalMinDelayMs,
    long normalMaxDelayMs,
    long normalMaxJitterMs,
    long cautiousMinDelayMs,
    long cautiousMaxDelayMs,
    int cautiousRequests,
    long backoffInitialPauseMs,
    int abortAfterAnomalies) {

  public PacingPolicy {
    requireRange("normal", normalMinDelayMs, normalMaxDelayMs);
    requireRange("cautious", cautiousMinDelayMs, cautiousMaxDelayMs);
    if (normalMaxJitterMs < 0) {
      throw new ConfigException("Pacing jitter must be >= 0, got " + normalMaxJitterMs);
    }
    if (cautiousRequests < 1) {
      throw new ConfigException("Cautious window must be >= 1 request, got " + cautiousRequests);
    }
    if (backoffInitialPauseMs < 0) {
      throw new ConfigException("Backoff pause must be >= 0, got " + backoffInitialPauseMs);
    }
    if (abortAfterAnomalies < 1) {
      throw new ConfigException("Abort threshold must be >= 1, got " + abortAfterAnomalies);
    }
  }

  public static PacingPolicy defaults() {
    return new PacingPolicy(2_000, 6_000, 4_000, 10_000, 20_000, 10, 180_000, 5);
  }

  /** No waiting at all; anomaly thresholds keep their default values. */
  public static PacingPolicy immediate() {
    return new PacingPolicy(0, 0, 0, 0, 0, 10, 0, 5);
  }

  public static PacingPolicy fromConfiguration(Configuration cfg) {
    PacingPolicy d = defaults();
    return new PacingPolicy(
        cfg.getLong("crawler.pacing.normal.minDelayMs", d.normalMinDelayMs()),
        cfg.getLong("crawler.pacing.normal.maxDelayMs", d.normalMaxDelayMs()),
        cfg.getLong("crawler.pacing.normal.maxJitterMs", d.normalMaxJitterMs()),
        cfg.getLong("crawler.pacing.cautious.minDelayMs", d.cautiousMinDelayMs()),
        cfg.getLong("crawler.pacing.cautious.maxDelayMs", d.cautiousMaxDelayMs()),
        cfg.getInt("crawler.pacing.cautious.requests", d.cautiousRequests()),
        cfg.getLong("crawler.pacing.backoff.initialPauseMs", d.backoffInitialPauseMs()),
        cfg.getInt("crawler.pacing.abortAfterAnomalies", d.abortAfterAnomalies()));
  }

  /** Delay before the next request in the given state. */
  long delayFor(GovernorState state, Random random) {
    if (state == GovernorState.NORMAL) {
      return uniform(random, normalMinDelayMs, normalMaxDelayMs)
          + uniform(random, 0, normalMaxJitterMs);
    }
    return uniform(random, cautiousMinDelayMs, cautiousMaxDelayMs);
  }

  private static long uniform(Random random, long min, long max) {
    if (max <= min) return min;
    return min + (long) (random.nextDouble() * (max - min + 1));
  }

  private static void requireRange(String name, long min, long max) {
    if (min < 0 || max < min) {
      throw new ConfigException(
          "Invalid %s pacing range [%d, %d] ms".formatted(name, min, max));
    }
  }
}
