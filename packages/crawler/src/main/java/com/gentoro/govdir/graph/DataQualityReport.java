package com.gentoro.govdir.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.govdir.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Data quality of the materialized collections, column by column as they are written: how many
 * records each collection holds, whether identifiers repeat, and which records leave which fields
 * null. Id lists are capped at {@code maxIdsPerField}.
 *
 * <p>Reserved service columns are always null and are left out of the missing-data figures.
 */
@JsonPropertyOrder({"max_ids_per_field", "collections"})
public record DataQualityReport(
    @JsonProperty("max_ids_per_field") int maxIdsPerField,
    @JsonProperty("collections") Map<String, CollectionQuality> collections) {

  public static final int DEFAULT_MAX_IDS = 100;

  private static final Map<EntityType, Set<String>> IGNORED =
      Map.of(EntityType.SERVICE, Set.of("service_description", "service_requirements"));

  private static final TypeReference<LinkedHashMap<String, Object>> ROW = new TypeReference<>() {};

  public DataQualityReport {
    collections = Collections.unmodifiableMap(new LinkedHashMap<>(collections));
  }

  @JsonPropertyOrder({
    "records",
    "unique_ids",
    "duplicate_id_records",
    "missing_cells",
    "total_cells",
    "ignored_fields",
    "missing"
  })
  public record CollectionQuality(
      @JsonProperty("records") int records,
      @JsonProperty("unique_ids") int uniqueIds,
      @JsonProperty("duplicate_id_records") int duplicateIdRecords,
      @JsonProperty("missing_cells") int missingCells,
      @JsonProperty("total_cells") int totalCells,
      @JsonProperty("ignored_fields") List<String> ignoredFields,
      @JsonProperty("missing") Map<String, MissingField> missing) {

    /** Missing-data entry for {@code field}; an empty entry when the field is never null. */
    @JsonIgnore
    public MissingField missingFor(String field) {
      return missing.getOrDefault(field, new MissingField(0, List.of(), false));
    }
  }

  /** Null occurrences of one field: the total and the first ids that have it null. */
  @JsonPropertyOrder({"count", "ids", "truncated"})
  public record MissingField(
      @JsonProperty("count") int count,
      @JsonProperty("ids") List<String> ids,
      @JsonProperty("truncated") boolean truncated) {}

  public static DataQualityReport of(EntityGraph graph) {
    return of(graph, DEFAULT_MAX_IDS);
  }

  public static DataQualityReport of(EntityGraph graph, int maxIdsPerField) {
    Map<String, CollectionQuality> collections = new LinkedHashMap<>();
    put(collections, EntityType.MINISTRY, graph.ministries(), maxIdsPerField);
    put(collections, EntityType.DEPARTMENT, graph.departments(), maxIdsPerField);
    put(collections, EntityType.AGENCY, graph.agencies(), maxIdsPerField);
    put(collections, EntityType.SERVICE, graph.services(), maxIdsPerField);
    put(collections, EntityType.FAQ, graph.faqs(), maxIdsPerField);
    return new DataQualityReport(maxIdsPerField, collections);
  }

  @JsonIgnore
  public CollectionQuality collection(EntityType type) {
    return collections.get(type.collection());
  }

  private static void put(
      Map<String, CollectionQuality> target, EntityType type, List<?> records, int maxIds) {
    target.put(type.collection(), analyze(type, records, maxIds));
  }

  private static CollectionQuality analyze(EntityType type, List<?> records, int maxIds) {
    ObjectMapper mapper = JacksonUtility.getJsonMapper();
    Set<String> ignored = IGNORED.getOrDefault(type, Set.of());
    Map<String, Integer> idOccurrences = new HashMap<>();
    Map<String, List<String>> nullIds = new LinkedHashMap<>();
    int missingCells = 0;
    int totalCells = 0;

    for (Object record : records) {
      Map<String, Object> row = mapper.convertValue(record, ROW);
      String id = String.valueOf(row.get(type.idColumn()));
      idOccurrences.merge(id, 1, Integer::sum);
      for (Map.Entry<String, Object> cell : row.entrySet()) {
        if (ignored.contains(cell.getKey())) continue;
        totalCells++;
        if (cell.getValue() == null) {
          missingCells++;
          nullIds.computeIfAbsent(cell.getKey(), k -> new ArrayList<>()).add(id);
        }
      }
    }

    Map<String, MissingField> missing = new LinkedHashMap<>();
    nullIds.forEach(
        (field, ids) ->
            missing.put(
                field,
                new MissingField(
                    ids.size(),
                    List.copyOf(ids.subList(0, Math.min(ids.size(), maxIds))),
                    ids.size() > maxIds)));
    int duplicateRecords =
        idOccurrences.values().stream().filter(n -> n > 1).mapToInt(Integer::intValue).sum();
    return new CollectionQuality(
        records.size(),
        idOccurrences.size(),
        duplicateRecords,
        missingCells,
        totalCells,
        ignored.stream().sorted().toList(),
        Collections.unmodifiableMap(missing));
  }
}
