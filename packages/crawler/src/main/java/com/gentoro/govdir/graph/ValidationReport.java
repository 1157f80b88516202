package com.gentoro.govdir.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** Record counts per collection, fatal invariant violations and non-fatal warnings. */
@JsonPropertyOrder({"record_counts", "violations", "warnings"})
public record ValidationReport(
    @JsonProperty("record_counts") Map<String, Integer> recordCounts,
    @JsonProperty("violations") List<Finding> violations,
    @JsonProperty("warnings") List<Finding> warnings) {

  public ValidationReport {
    recordCounts = Collections.unmodifiableMap(new TreeMap<>(recordCounts));
    violations = List.copyOf(violations);
    warnings = List.copyOf(warnings);
  }

  public boolean hasFatal() {
    return !violations.isEmpty();
  }

  @JsonIgnore
  public List<Finding> discrepancies() {
    return warnings.stream().filter(f -> f.type() == FindingType.COUNT_DISCREPANCY).toList();
  }

  @JsonIgnore
  public List<Finding> findings(FindingType type) {
    List<Finding> source = type.isFatal() ? violations : warnings;
    return source.stream().filter(f -> f.type() == type).toList();
  }
}
