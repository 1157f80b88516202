package com.gentoro.govdir.pipeline;

import com.gentoro.govdir.exception.ExceptionUtil;
import com.gentoro.govdir.resolve.WorkerPool.TaskFailure;
import com.gentoro.govdir.store.ArtifactStore;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs the crawl phases in order, each one a hard barrier: a phase starts only after the previous
 * phase's worker tasks have all finished.
 *
 * <p>After each phase the checkpoints are saved. A phase is marked completed when none of its
 * artifacts failed to fetch or parse; otherwise it stays open so the failure is visible in the
 * persisted state.
 */
public class PhaseCoordinator {
  private static final org.slf4j.Logger log =
      com.gentoro.govdir.logging.LoggingService.getLogger(PhaseCoordinator.class);

  /** Phases that completed cleanly and the worker tasks that failed, across all phases. */
  public record Outcome(List<String> completedPhases, List<TaskFailure> taskFailures) {}

  private final List<CrawlPhase> phases;
  private final ArtifactStore store;
  private final Clock clock;

  public PhaseCoordinator(List<CrawlPhase> phases, ArtifactStore store, Clock clock) {
    this.phases = List.copyOf(phases);
    this.store = Objects.requireNonNull(store, "store");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /** The three crawl phases in their required order. */
  public static List<CrawlPhase> standardPhases() {
    return List.of(new FaqPhase(), new AgencyDirectoryPhase(), new MinistryTraversalPhase());
  }

  public Outcome run(CrawlContext ctx) {
    List<String> completed = new ArrayList<>();
    List<TaskFailure> taskFailures = new ArrayList<>();
    for (CrawlPhase phase : phases) {
      log.info("Phase {} ({}) starting", phase.id(), phase.label());
      ctx.checkpoints().begin(phase.id());
      int fetchFailuresBefore = ctx.source().failedCount();
      int extractionFailuresBefore = ctx.resolver().failures().size();

      List<TaskFailure> failures;
      try {
        phase.run(ctx);
      } finally {
        failures = ctx.pool().drain();
        taskFailures.addAll(failures);
      }

      int fetchFailures = ctx.source().failedCount() - fetchFailuresBefore;
      int extractionFailures = ctx.resolver().failures().size() - extractionFailuresBefore;
      Map<String, Object> attrs =
          Map.of(
              "processedKeys", ctx.checkpoints().processedCount(phase.id()),
              "failedKeys", fetchFailures,
              "extractionFailures", extractionFailures,
              "taskFailures", failures.size());
      if (fetchFailures == 0 && extractionFailures == 0 && failures.isEmpty()) {
        ctx.checkpoints().markCompleted(phase.id(), clock.instant());
        completed.add(phase.id());
        ctx.progress().endStageOk(phase.id(), attrs);
        log.info("Phase {} completed: {}", phase.id(), attrs);
      } else {
        String summary =
            failures.isEmpty()
                ? "%d keys failed to fetch, %d to parse"
                    .formatted(fetchFailures, extractionFailures)
                : ExceptionUtil.toErrorDetails(failures.get(0).error()).message;
        ctx.progress().endStageError(phase.id(), summary, attrs);
        log.warn("Phase {} finished with failures: {}", phase.id(), attrs);
      }
      store.saveCheckpoints(ctx.checkpoints());
      if (ctx.source().governorAborted()) {
        log.error(
            "Fetch governor aborted during phase {}; remaining phases use stored artifacts only",
            phase.id());
      }
    }
    return new Outcome(List.copyOf(completed), List.copyOf(taskFailures));
  }
}
