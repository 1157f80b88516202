package com.gentoro.govdir.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One structured validation result. The metric fields are only set for {@link
 * FindingType#COUNT_DISCREPANCY}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({
  "type",
  "severity",
  "entity_type",
  "entity_id",
  "message",
  "metric",
  "reported",
  "observed",
  "magnitude"
})
public record Finding(
    @JsonProperty("type") FindingType type,
    @JsonProperty("entity_type") EntityType entityType,
    @JsonProperty("entity_id") String entityId,
    @JsonProperty("message") String message,
    @JsonProperty("metric") String metric,
    @JsonProperty("reported") Integer reported,
    @JsonProperty("observed") Integer observed,
    @JsonProperty("magnitude") Integer magnitude) {

  public static Finding of(
      FindingType type, EntityType entityType, String entityId, String message) {
    return new Finding(type, entityType, entityId, message, null, null, null, null);
  }

  public static Finding discrepancy(
      EntityType entityType, String entityId, String metric, int reported, int observed) {
    int magnitude = Math.abs(reported - observed);
    return new Finding(
        FindingType.COUNT_DISCREPANCY,
        entityType,
        entityId,
        "%s reported %d, observed %d".formatted(metric, reported, observed),
        metric,
        reported,
        observed,
        magnitude);
  }

  @JsonProperty("severity")
  public FindingType.Severity severity() {
    return type.severity();
  }

  @JsonIgnore
  public boolean isFatal() {
    return type.isFatal();
  }
}
