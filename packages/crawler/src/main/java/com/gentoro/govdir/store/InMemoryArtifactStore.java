package com.gentoro.govdir.store;

import com.gentoro.govdir.utility.JacksonUtility;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/** Heap-backed {@link ArtifactStore}; nothing survives the process. */
public class InMemoryArtifactStore implements ArtifactStore {
  private final Map<ArtifactKey, String> artifacts = new ConcurrentHashMap<>();
  private final SortedMap<String, FailureRecord> failures = new TreeMap<>();
  private String checkpointsJson;

  @Override
  public void put(ArtifactKey key, String content) {
    artifacts.put(key, content);
  }

  @Override
  public Optional<String> get(ArtifactKey key) {
    return Optional.ofNullable(artifacts.get(key));
  }

  @Override
  public boolean contains(ArtifactKey key) {
    return artifacts.containsKey(key);
  }

  public int size() {
    return artifacts.size();
  }

  @Override
  public synchronized CheckpointState loadCheckpoints() {
    if (checkpointsJson == null) return new CheckpointState();
    return JacksonUtility.fromJson(checkpointsJson, CheckpointState.class);
  }

  @Override
  public synchronized void saveCheckpoints(CheckpointState state) {
    // Serialized so later mutations of the live object do not leak into the saved copy
    checkpointsJson = JacksonUtility.toJson(state);
  }

  @Override
  public synchronized Map<String, FailureRecord> failures() {
    return Collections.unmodifiableMap(new TreeMap<>(failures));
  }

  @Override
  public synchronized void recordFailure(FailureRecord failure) {
    failures.put(failure.key(), failure);
  }

  @Override
  public synchronized void clearFailure(ArtifactKey key) {
    failures.remove(key.value());
  }
}
