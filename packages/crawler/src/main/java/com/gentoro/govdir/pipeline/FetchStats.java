package com.gentoro.govdir.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.gentoro.govdir.store.FailureRecord;
import java.util.List;

/** Where each artifact of a run came from. */
@JsonPropertyOrder({"network_fetches", "cache_hits", "failed_keys"})
public record FetchStats(
    @JsonProperty("network_fetches") long networkFetches,
    @JsonProperty("cache_hits") long cacheHits,
    @JsonProperty("failed_keys") List<FailureRecord> failedKeys) {

  public FetchStats {
    failedKeys = List.copyOf(failedKeys);
  }
}
