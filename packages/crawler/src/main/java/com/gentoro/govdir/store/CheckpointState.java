package com.gentoro.govdir.store;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Which phases completed and which artifact keys each phase processed downstream. Persisted after
 * every phase; safe for concurrent updates from worker threads.
 */
public class CheckpointState {

  public static class PhaseCheckpoint {
    @JsonProperty("completed")
    private boolean completed;

    @JsonProperty("completed_at")
    private Instant completedAt;

    @JsonProperty("processed_keys")
    private Set<String> processedKeys = new TreeSet<>();

    public boolean isCompleted() {
      return completed;
    }

    public void setCompleted(boolean completed) {
      this.completed = completed;
    }

    public Instant getCompletedAt() {
      return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
      this.completedAt = completedAt;
    }

    public Set<String> getProcessedKeys() {
      return processedKeys;
    }

    public void setProcessedKeys(Set<String> processedKeys) {
      this.processedKeys = processedKeys == null ? new TreeSet<>() : new TreeSet<>(processedKeys);
    }
  }

  @JsonProperty("phases")
  private Map<String, PhaseCheckpoint> phases = new TreeMap<>();

  public synchronized Map<String, PhaseCheckpoint> getPhases() {
    return phases;
  }

  public synchronized void setPhases(Map<String, PhaseCheckpoint> phases) {
    this.phases = phases == null ? new TreeMap<>() : new TreeMap<>(phases);
  }

  /** Start a fresh record for a phase that is about to run. */
  public synchronized void begin(String phase) {
    phases.put(phase, new PhaseCheckpoint());
  }

  public synchronized void markProcessed(String phase, ArtifactKey key) {
    phases.computeIfAbsent(phase, p -> new PhaseCheckpoint()).getProcessedKeys().add(key.value());
  }

  public synchronized void markCompleted(String phase, Instant at) {
    PhaseCheckpoint cp = phases.computeIfAbsent(phase, p -> new PhaseCheckpoint());
    cp.setCompleted(true);
    cp.setCompletedAt(at);
  }

  @JsonIgnore
  public synchronized boolean isCompleted(String phase) {
    PhaseCheckpoint cp = phases.get(phase);
    return cp != null && cp.isCompleted();
  }

  @JsonIgnore
  public synchronized int processedCount(String phase) {
    PhaseCheckpoint cp = phases.get(phase);
    return cp == null ? 0 : cp.getProcessedKeys().size();
  }
}
