package com.gentoro.govdir.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.gentoro.govdir.exception.ErrorDetails;
import com.gentoro.govdir.fetch.GovernorSnapshot;
import com.gentoro.govdir.graph.DataQualityReport;
import com.gentoro.govdir.graph.ValidationReport;
import com.gentoro.govdir.resolve.ExtractionFailure;
import java.time.Instant;
import java.util.List;

/**
 * Everything a run reports: status, fetch and extraction outcomes, the validation report and the
 * per-collection data quality of the assembled graph.
 */
@JsonPropertyOrder({
  "status",
  "mode",
  "started_at",
  "finished_at",
  "phases_completed",
  "graph_written",
  "governor",
  "fetch",
  "extraction_failures",
  "worker_failures",
  "directory_index",
  "validation",
  "data_quality",
  "error"
})
public record RunReport(
    @JsonProperty("status") RunStatus status,
    @JsonProperty("mode") String mode,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("finished_at") Instant finishedAt,
    @JsonProperty("phases_completed") List<String> phasesCompleted,
    @JsonProperty("graph_written") boolean graphWritten,
    @JsonProperty("governor") GovernorSnapshot governor,
    @JsonProperty("fetch") FetchStats fetch,
    @JsonProperty("extraction_failures") List<ExtractionFailure> extractionFailures,
    @JsonProperty("worker_failures") List<WorkerFailure> workerFailures,
    @JsonProperty("directory_index") DirectoryIndexStats directoryIndex,
    @JsonProperty("validation") ValidationReport validation,
    @JsonProperty("data_quality") DataQualityReport dataQuality,
    @JsonInclude(JsonInclude.Include.NON_NULL) @JsonProperty("error") ErrorDetails error) {

  /** A worker task that failed with something other than an extraction failure. */
  public record WorkerFailure(
      @JsonProperty("task") String task, @JsonProperty("error") ErrorDetails error) {}

  public record DirectoryIndexStats(
      @JsonProperty("entries") int entries, @JsonProperty("duplicates") int duplicates) {}
}
