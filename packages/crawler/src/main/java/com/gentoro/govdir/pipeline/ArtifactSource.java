package com.gentoro.govdir.pipeline;

import com.gentoro.govdir.exception.FetchAbortedException;
import com.gentoro.govdir.exception.FetchException;
import com.gentoro.govdir.fetch.FetchGovernor;
import com.gentoro.govdir.fetch.FetchSignal;
import com.gentoro.govdir.fetch.FetchTarget;
import com.gentoro.govdir.store.ArtifactKey;
import com.gentoro.govdir.store.ArtifactStore;
import com.gentoro.govdir.store.FailureRecord;
import java.time.Clock;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cache-or-fetch access to artifacts. A stored artifact is always returned without touching the
 * network. A missing one is fetched through the {@link FetchGovernor} and stored before it is
 * returned; a failed fetch is written to the failure log and the caller gets an empty result.
 *
 * <p>With the network disabled (offline runs) a missing artifact fails with {@link
 * FetchSignal#OFFLINE} and the governor is never called.
 */
public class ArtifactSource {
  private static final org.slf4j.Logger log =
      com.gentoro.govdir.logging.LoggingService.getLogger(ArtifactSource.class);

  private final ArtifactStore store;
  private final FetchGovernor governor;
  private final Clock clock;
  private final AtomicLong networkFetches = new AtomicLong();
  private final AtomicLong cacheHits = new AtomicLong();
  private final Map<String, FailureRecord> failedThisRun = new ConcurrentHashMap<>();

  /** @param governor null disables the network */
  public ArtifactSource(ArtifactStore store, FetchGovernor governor, Clock clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.governor = governor;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public static ArtifactSource offline(ArtifactStore store, Clock clock) {
    return new ArtifactSource(store, null, clock);
  }

  public boolean isOffline() {
    return governor == null;
  }

  public Optional<String> get(ArtifactKey key, FetchTarget target) {
    Optional<String> cached = store.get(key);
    if (cached.isPresent()) {
      cacheHits.incrementAndGet();
      log.debug("Cache hit {}", key);
      return cached;
    }
    if (governor == null) {
      fail(key, target, FetchSignal.OFFLINE, "Not stored and the network is disabled", 0);
      return Optional.empty();
    }
    try {
      String content = governor.fetch(target);
      store.put(key, content);
      store.clearFailure(key);
      networkFetches.incrementAndGet();
      return Optional.of(content);
    } catch (FetchAbortedException e) {
      fail(key, target, FetchSignal.ABORTED, e.getMessage(), 0);
      return Optional.empty();
    } catch (FetchException e) {
      Object attempts = e.getContext().getOrDefault("attempts", 1);
      fail(key, target, e.getSignal(), e.getMessage(), ((Number) attempts).intValue());
      return Optional.empty();
    }
  }

  public boolean governorAborted() {
    return governor != null && governor.isAborted();
  }

  public FetchStats stats() {
    return new FetchStats(
        networkFetches.get(),
        cacheHits.get(),
        failedThisRun.values().stream().sorted(Comparator.comparing(FailureRecord::key)).toList());
  }

  public int failedCount() {
    return failedThisRun.size();
  }

  private void fail(
      ArtifactKey key, FetchTarget target, FetchSignal signal, String message, int attempts) {
    FailureRecord record =
        new FailureRecord(key.value(), target.url(), signal, message, attempts, clock.instant());
    failedThisRun.put(key.value(), record);
    store.recordFailure(record);
    log.warn("{} not available ({}): {}", key, signal, message);
  }
}
