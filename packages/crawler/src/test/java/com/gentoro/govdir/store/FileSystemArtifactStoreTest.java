package com.gentoro.govdir.store;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.govdir.fetch.FetchSignal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemArtifactStoreTest {

  private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

  @TempDir Path root;

  @Test
  void missingKeyIsACacheMiss() {
    FileSystemArtifactStore store = new FileSystemArtifactStore(root);

    assertTrue(store.get(ArtifactKey.of("faq")).isEmpty());
    assertFalse(store.contains(ArtifactKey.of("faq")));
  }

  @Test
  void storedContentSurvivesReopening() {
    ArtifactKey key = ArtifactKey.of("ministries", "abc123def456");
    new FileSystemArtifactStore(root).put(key, "<html>ministry</html>");

    FileSystemArtifactStore reopened = new FileSystemArtifactStore(root);

    assertEquals("<html>ministry</html>", reopened.get(key).orElseThrow());
    assertTrue(Files.isRegularFile(root.resolve("raw/ministries/abc123def456.html")));
  }

  @Test
  void overwriteReplacesContent() {
    FileSystemArtifactStore store = new FileSystemArtifactStore(root);
    ArtifactKey key = ArtifactKey.of("agencies");
    store.put(key, "first");
    store.put(key, "second");

    assertEquals("second", store.get(key).orElseThrow());
  }

  @Test
  void checkpointsRoundTripThroughDisk() {
    FileSystemArtifactStore store = new FileSystemArtifactStore(root);
    assertTrue(store.loadCheckpoints().getPhases().isEmpty());

    CheckpointState state = new CheckpointState();
    state.begin("faq");
    state.markProcessed("faq", ArtifactKey.of("faq"));
    state.markCompleted("faq", NOW);
    state.begin("ministries");
    state.markProcessed("ministries", ArtifactKey.of("ministries", "m1"));
    store.saveCheckpoints(state);

    CheckpointState loaded = new FileSystemArtifactStore(root).loadCheckpoints();
    assertTrue(loaded.isCompleted("faq"));
    assertFalse(loaded.isCompleted("ministries"));
    assertEquals(NOW, loaded.getPhases().get("faq").getCompletedAt());
    assertEquals(1, loaded.processedCount("ministries"));
    assertTrue(Files.isRegularFile(root.resolve("state/checkpoints.json")));
  }

  @Test
  void failureLogPersistsUntilCleared() {
    ArtifactKey key = ArtifactKey.of("ministries", "m1");
    FileSystemArtifactStore store = new FileSystemArtifactStore(root);
    store.recordFailure(
        new FailureRecord(key.value(), "https://x/m1", FetchSignal.BLOCKED, "HTTP 403", 3, NOW));

    FileSystemArtifactStore reopened = new FileSystemArtifactStore(root);
    FailureRecord failure = reopened.failures().get(key.value());
    assertNotNull(failure);
    assertEquals(FetchSignal.BLOCKED, failure.signal());
    assertEquals(3, failure.attempts());
    assertEquals(NOW, failure.timestamp());

    reopened.clearFailure(key);
    reopened.clearFailure(ArtifactKey.of("never", "failed"));

    assertTrue(new FileSystemArtifactStore(root).failures().isEmpty());
  }

  @Test
  void concurrentWritesToDistinctKeysAllLand() throws Exception {
    FileSystemArtifactStore store = new FileSystemArtifactStore(root);
    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < 64; i++) {
        ArtifactKey key = ArtifactKey.of("ministries", "m" + i);
        String content = "page " + i;
        futures.add(pool.submit(() -> store.put(key, content)));
      }
      for (Future<?> f : futures) f.get();
    } finally {
      pool.shutdown();
    }

    for (int i = 0; i < 64; i++) {
      assertEquals("page " + i, store.get(ArtifactKey.of("ministries", "m" + i)).orElseThrow());
    }
  }
}
