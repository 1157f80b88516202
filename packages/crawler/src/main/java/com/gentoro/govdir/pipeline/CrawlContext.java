package com.gentoro.govdir.pipeline;

import com.gentoro.govdir.progress.ProgressSink;
import com.gentoro.govdir.resolve.PageResolver;
import com.gentoro.govdir.resolve.WorkerPool;
import com.gentoro.govdir.store.CheckpointState;
import java.util.Objects;

/**
 * Components one run's phases share. Built once per run by {@link CrawlRunner} and discarded
 * with it.
 */
public final class CrawlContext {
  private final CrawlSettings settings;
  private final ArtifactSource source;
  private final PageResolver resolver;
  private final WorkerPool pool;
  private final CheckpointState checkpoints;
  private final ProgressSink progress;

  public CrawlContext(
      CrawlSettings settings,
      ArtifactSource source,
      PageResolver resolver,
      WorkerPool pool,
      CheckpointState checkpoints,
      ProgressSink progress) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.source = Objects.requireNonNull(source, "source");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.pool = Objects.requireNonNull(pool, "pool");
    this.checkpoints = Objects.requireNonNull(checkpoints, "checkpoints");
    this.progress = Objects.requireNonNull(progress, "progress");
  }

  public CrawlSettings settings() {
    return settings;
  }

  public ArtifactSource source() {
    return source;
  }

  public PageResolver resolver() {
    return resolver;
  }

  public WorkerPool pool() {
    return pool;
  }

  public CheckpointState checkpoints() {
    return checkpoints;
  }

  public ProgressSink progress() {
    return progress;
  }
}
