package com.gentoro.govdir.store;

import java.util.Map;
import java.util.Optional;

/**
 * Durable store of raw fetched content, per-phase checkpoints and the failure log.
 *
 * <p>{@link #get} on a key that was never {@link #put} returns an empty optional: a cache miss, not
 * an error. Implementations synchronize per key; there is no store-wide lock on artifacts.
 */
public interface ArtifactStore {

  void put(ArtifactKey key, String content);

  Optional<String> get(ArtifactKey key);

  boolean contains(ArtifactKey key);

  CheckpointState loadCheckpoints();

  void saveCheckpoints(CheckpointState state);

  /** Failure log keyed by {@link ArtifactKey#value()}, sorted by key. */
  Map<String, FailureRecord> failures();

  void recordFailure(FailureRecord failure);

  /** Drop the failure log entry for a key that has now been fetched. No-op when absent. */
  void clearFailure(ArtifactKey key);
}
