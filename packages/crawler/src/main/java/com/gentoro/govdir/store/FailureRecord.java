package com.gentoro.govdir.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.gentoro.govdir.fetch.FetchSignal;
import java.time.Instant;

/** A key whose fetch failed in some run; retried on the next run. */
@JsonPropertyOrder({"key", "url", "signal", "message", "attempts", "timestamp"})
public record FailureRecord(
    @JsonProperty("key") String key,
    @JsonProperty("url") String url,
    @JsonProperty("signal") FetchSignal signal,
    @JsonProperty("message") String message,
    @JsonProperty("attempts") int attempts,
    @JsonProperty("timestamp") Instant timestamp) {}
