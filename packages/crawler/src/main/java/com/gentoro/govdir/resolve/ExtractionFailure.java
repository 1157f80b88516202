package com.gentoro.govdir.resolve;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.gentoro.govdir.extract.PageType;

/** A stored artifact whose markup did not yield the expected fields; its entities are skipped. */
@JsonPropertyOrder({"key", "page_type", "message"})
public record ExtractionFailure(
    @JsonProperty("key") String key,
    @JsonProperty("page_type") PageType pageType,
    @JsonProperty("message") String message) {}
