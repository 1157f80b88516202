package com.gentoro.govdir.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.gentoro.govdir.utility.FileUtility;
import com.gentoro.govdir.utility.JacksonUtility;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ArtifactStore} on the local filesystem.
 *
 * <pre>
 * &lt;root&gt;/raw/&lt;key&gt;.html          raw page content
 * &lt;root&gt;/state/checkpoints.json    per-phase checkpoints
 * &lt;root&gt;/state/failures.json       failure log
 * </pre>
 *
 * Artifacts are written through a temp file and a move, so a crash never leaves a truncated
 * artifact that a later run would mistake for a cache hit.
 */
public class FileSystemArtifactStore implements ArtifactStore {
  private static final org.slf4j.Logger log =
      com.gentoro.govdir.logging.LoggingService.getLogger(FileSystemArtifactStore.class);

  private static final String RAW_DIR = "raw";
  private static final String STATE_DIR = "state";
  private static final String CHECKPOINTS_FILE = "checkpoints.json";
  private static final String FAILURES_FILE = "failures.json";

  private final Path root;
  private final Map<String, Object> keyLocks = new ConcurrentHashMap<>();
  private final Object stateLock = new Object();
  private final SortedMap<String, FailureRecord> failures;

  public FileSystemArtifactStore(Path root) {
    this.root = Objects.requireNonNull(root, "root").toAbsolutePath();
    FileUtility.createDirectories(this.root.resolve(RAW_DIR));
    FileUtility.createDirectories(this.root.resolve(STATE_DIR));
    this.failures = new TreeMap<>(readFailures());
    log.info(
        "Artifact store at {} ({} failed keys from earlier runs)", this.root, failures.size());
  }

  public Path root() {
    return root;
  }

  Path pathFor(ArtifactKey key) {
    Path p = root.resolve(RAW_DIR);
    for (int i = 0; i < key.segments().size() - 1; i++) {
      p = p.resolve(key.segments().get(i));
    }
    return p.resolve(key.segments().get(key.segments().size() - 1) + ".html");
  }

  @Override
  public void put(ArtifactKey key, String content) {
    Objects.requireNonNull(content, "content");
    synchronized (lockFor(key)) {
      FileUtility.writeAtomically(pathFor(key), content);
    }
    log.debug("Stored {} ({} chars)", key, content.length());
  }

  @Override
  public Optional<String> get(ArtifactKey key) {
    synchronized (lockFor(key)) {
      Path path = pathFor(key);
      if (!Files.isRegularFile(path)) return Optional.empty();
      return Optional.of(FileUtility.readString(path));
    }
  }

  @Override
  public boolean contains(ArtifactKey key) {
    synchronized (lockFor(key)) {
      return Files.isRegularFile(pathFor(key));
    }
  }

  @Override
  public CheckpointState loadCheckpoints() {
    synchronized (stateLock) {
      Path path = statePath(CHECKPOINTS_FILE);
      if (!Files.isRegularFile(path)) return new CheckpointState();
      return JacksonUtility.fromJson(FileUtility.readString(path), CheckpointState.class);
    }
  }

  @Override
  public void saveCheckpoints(CheckpointState state) {
    synchronized (stateLock) {
      FileUtility.writeAtomically(statePath(CHECKPOINTS_FILE), JacksonUtility.toJson(state));
    }
  }

  @Override
  public Map<String, FailureRecord> failures() {
    synchronized (stateLock) {
      return Collections.unmodifiableMap(new TreeMap<>(failures));
    }
  }

  @Override
  public void recordFailure(FailureRecord failure) {
    synchronized (stateLock) {
      failures.put(failure.key(), failure);
      writeFailures();
    }
  }

  @Override
  public void clearFailure(ArtifactKey key) {
    synchronized (stateLock) {
      if (failures.remove(key.value()) != null) {
        log.info("{} fetched after an earlier failure; removed from failure log", key);
        writeFailures();
      }
    }
  }

  private Object lockFor(ArtifactKey key) {
    return keyLocks.computeIfAbsent(key.value(), k -> new Object());
  }

  private Path statePath(String file) {
    return root.resolve(STATE_DIR).resolve(file);
  }

  private Map<String, FailureRecord> readFailures() {
    Path path = statePath(FAILURES_FILE);
    if (!Files.isRegularFile(path)) return Map.of();
    return JacksonUtility.fromJson(
        FileUtility.readString(path), new TypeReference<Map<String, FailureRecord>>() {});
  }

  private void writeFailures() {
    FileUtility.writeAtomically(statePath(FAILURES_FILE), JacksonUtility.toJson(failures));
  }
}
