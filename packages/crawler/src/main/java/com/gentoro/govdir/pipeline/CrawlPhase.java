package com.gentoro.govdir.pipeline;

/**
 * One stage of the crawl. A phase fetches its pages sequentially through the context's {@link
 * ArtifactSource} and hands parsing to the worker pool. The coordinator drains the pool before the
 * next phase starts.
 */
public interface CrawlPhase {

  /** Stable id used for checkpoints and progress, e.g. {@code faq}. */
  String id();

  String label();

  void run(CrawlContext context);
}
