package com.gentoro.govdir.pipeline;

import com.gentoro.govdir.exception.ErrorDetails;
import com.gentoro.govdir.exception.ExceptionUtil;
import com.gentoro.govdir.exception.GovDirException;
import com.gentoro.govdir.extract.FieldExtractors;
import com.gentoro.govdir.fetch.FetchGovernor;
import com.gentoro.govdir.fetch.GovernorSnapshot;
import com.gentoro.govdir.graph.DataQualityReport;
import com.gentoro.govdir.graph.EntityGraph;
import com.gentoro.govdir.graph.Finding;
import com.gentoro.govdir.graph.GraphAssembler;
import com.gentoro.govdir.graph.GraphValidator;
import com.gentoro.govdir.graph.ValidationReport;
import com.gentoro.govdir.output.DatasetWriter;
import com.gentoro.govdir.output.RunReportWriter;
import com.gentoro.govdir.pipeline.RunReport.DirectoryIndexStats;
import com.gentoro.govdir.pipeline.RunReport.WorkerFailure;
import com.gentoro.govdir.progress.ProgressSink;
import com.gentoro.govdir.resolve.AgencyIndex;
import com.gentoro.govdir.resolve.ExtractionFailure;
import com.gentoro.govdir.resolve.PageResolver;
import com.gentoro.govdir.resolve.WorkerPool;
import com.gentoro.govdir.store.ArtifactStore;
import com.gentoro.govdir.store.CheckpointState;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Executes one complete run: all phases in order, then materialization, validation and output.
 *
 * <p>The join index, assembler, resolver and worker pool are created per call to {@link #run()},
 * so one runner (or several) can be used for independent runs in the same process. Non-fatal
 * problems accumulate in the {@link RunReport}; a fatal problem prevents the graph from being
 * written but never touches stored artifacts.
 */
public class CrawlRunner {
  private static final org.slf4j.Logger log =
      com.gentoro.govdir.logging.LoggingService.getLogger(CrawlRunner.class);

  private final CrawlSettings settings;
  private final ArtifactStore store;
  private final FetchGovernor governor;
  private final FieldExtractors extractors;
  private final List<DatasetWriter> writers;
  private final RunReportWriter reportWriter;
  private final ProgressSink progress;
  private final Clock clock;
  private final List<CrawlPhase> phases;

  /** @param governor null for an offline run */
  public CrawlRunner(
      CrawlSettings settings,
      ArtifactStore store,
      FetchGovernor governor,
      FieldExtractors extractors,
      List<DatasetWriter> writers,
      RunReportWriter reportWriter,
      ProgressSink progress,
      Clock clock) {
    this(
        settings,
        store,
        governor,
        extractors,
        writers,
        reportWriter,
        progress,
        clock,
        PhaseCoordinator.standardPhases());
  }

  CrawlRunner(
      CrawlSettings settings,
      ArtifactStore store,
      FetchGovernor governor,
      FieldExtractors extractors,
      List<DatasetWriter> writers,
      RunReportWriter reportWriter,
      ProgressSink progress,
      Clock clock,
      List<CrawlPhase> phases) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.store = Objects.requireNonNull(store, "store");
    this.governor = governor;
    this.extractors = Objects.requireNonNull(extractors, "extractors");
    this.writers = List.copyOf(writers);
    this.reportWriter = Objects.requireNonNull(reportWriter, "reportWriter");
    this.progress = Objects.requireNonNull(progress, "progress");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.phases = List.copyOf(phases);
  }

  public RunReport run() {
    Instant startedAt = clock.instant();
    String mode = governor == null ? "offline" : "crawl";
    CheckpointState checkpoints = store.loadCheckpoints();
    int previouslyFailed = store.failures().size();
    log.info(
        "Starting {} run; phases completed previously: {}; {} keys failed previously",
        mode,
        checkpoints.getPhases().keySet().stream().filter(checkpoints::isCompleted).toList(),
        previouslyFailed);

    GraphAssembler assembler = new GraphAssembler();
    AgencyIndex agencyIndex = new AgencyIndex();
    PageResolver resolver = new PageResolver(extractors, assembler, agencyIndex);
    ArtifactSource source =
        governor == null
            ? ArtifactSource.offline(store, clock)
            : new ArtifactSource(store, governor, clock);

    List<String> completed = List.of();
    List<WorkerFailure> workerFailures = new ArrayList<>();
    ErrorDetails fatal = null;
    try (WorkerPool pool = new WorkerPool(settings.workers())) {
      CrawlContext ctx =
          new CrawlContext(settings, source, resolver, pool, checkpoints, progress);
      PhaseCoordinator.Outcome outcome = new PhaseCoordinator(phases, store, clock).run(ctx);
      completed = outcome.completedPhases();
      outcome
          .taskFailures()
          .forEach(
              f ->
                  workerFailures.add(
                      new WorkerFailure(f.label(), ExceptionUtil.toErrorDetails(f.error()))));
    } catch (GovDirException e) {
      log.error("Run stopped: {}", e.getMessage(), e);
      fatal = ExceptionUtil.toErrorDetails(e);
    }

    EntityGraph graph = assembler.materialize();
    List<Finding> upstream = new ArrayList<>(assembler.collisions());
    upstream.addAll(agencyIndex.unplacedFindings());
    ValidationReport validation =
        new GraphValidator(settings.discrepancyTolerance()).validate(graph, upstream);

    DataQualityReport dataQuality = DataQualityReport.of(graph);
    logDataQuality(dataQuality);

    FetchStats fetchStats = source.stats();
    List<ExtractionFailure> extractionFailures = resolver.failures();
    RunStatus status =
        status(fatal, validation, source, fetchStats, extractionFailures, workerFailures);

    boolean written = false;
    if (status != RunStatus.FAILED) {
      for (DatasetWriter writer : writers) {
        writer.write(graph, settings.outputDirectory());
      }
      written = true;
    } else {
      log.error("Graph not written: run status {}", status);
    }

    GovernorSnapshot snapshot = governor == null ? GovernorSnapshot.idle() : governor.snapshot();
    RunReport report =
        new RunReport(
            status,
            mode,
            startedAt,
            clock.instant(),
            completed,
            written,
            snapshot,
            fetchStats,
            extractionFailures,
            workerFailures,
            new DirectoryIndexStats(agencyIndex.size(), agencyIndex.duplicates()),
            validation,
            dataQuality,
            fatal);
    reportWriter.write(report, settings.outputDirectory());
    log.info(
        "Run finished with status {}: {} network fetches, {} cache hits, {} failed keys, "
            + "{} extraction failures, {} violations, {} warnings",
        status,
        fetchStats.networkFetches(),
        fetchStats.cacheHits(),
        fetchStats.failedKeys().size(),
        extractionFailures.size(),
        validation.violations().size(),
        validation.warnings().size());
    return report;
  }

  private static void logDataQuality(DataQualityReport report) {
    report
        .collections()
        .forEach(
            (collection, quality) ->
                quality
                    .missing()
                    .forEach(
                        (field, missing) ->
                            log.info(
                                "{}: {} of {} records have no {}",
                                collection,
                                missing.count(),
                                quality.records(),
                                field)));
  }

  private static RunStatus status(
      ErrorDetails fatal,
      ValidationReport validation,
      ArtifactSource source,
      FetchStats fetchStats,
      List<ExtractionFailure> extractionFailures,
      List<WorkerFailure> workerFailures) {
    if (fatal != null || validation.hasFatal()) return RunStatus.FAILED;
    if (source.governorAborted()) return RunStatus.ABORTED;
    if (!fetchStats.failedKeys().isEmpty()
        || !extractionFailures.isEmpty()
        || !workerFailures.isEmpty()) {
      return RunStatus.PARTIAL_FAILURE;
    }
    return RunStatus.SUCCESS;
  }
}
