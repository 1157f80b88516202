package com.gentoro.govdir.store;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.govdir.fetch.FetchSignal;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class InMemoryArtifactStoreTest {

  @Test
  void savedCheckpointsAreACopy() {
    InMemoryArtifactStore store = new InMemoryArtifactStore();
    CheckpointState state = new CheckpointState();
    state.markCompleted("faq", Instant.EPOCH);
    store.saveCheckpoints(state);

    state.markCompleted("agency_directory", Instant.EPOCH);

    CheckpointState loaded = store.loadCheckpoints();
    assertTrue(loaded.isCompleted("faq"));
    assertFalse(loaded.isCompleted("agency_directory"));
  }

  @Test
  void behavesLikeACache() {
    InMemoryArtifactStore store = new InMemoryArtifactStore();
    ArtifactKey key = ArtifactKey.of("faq");
    assertTrue(store.get(key).isEmpty());

    store.put(key, "<html/>");
    store.recordFailure(
        new FailureRecord("faq", "https://x/faq", FetchSignal.TIMEOUT, "slow", 3, Instant.EPOCH));
    store.clearFailure(key);

    assertEquals("<html/>", store.get(key).orElseThrow());
    assertEquals(1, store.size());
    assertTrue(store.failures().isEmpty());
  }
}
