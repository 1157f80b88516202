package com.gentoro.govdir.graph;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Immutable, materialized entity collections, each sorted by identifier. */
public record EntityGraph(
    List<Ministry> ministries,
    List<Department> departments,
    List<Agency> agencies,
    List<Service> services,
    List<Faq> faqs) {

  public EntityGraph {
    ministries = List.copyOf(ministries);
    departments = List.copyOf(departments);
    agencies = List.copyOf(agencies);
    services = List.copyOf(services);
    faqs = List.copyOf(faqs);
  }

  public static EntityGraph empty() {
    return new EntityGraph(List.of(), List.of(), List.of(), List.of(), List.of());
  }

  public Map<EntityType, Integer> recordCounts() {
    Map<EntityType, Integer> counts = new EnumMap<>(EntityType.class);
    counts.put(EntityType.MINISTRY, ministries.size());
    counts.put(EntityType.DEPARTMENT, departments.size());
    counts.put(EntityType.AGENCY, agencies.size());
    counts.put(EntityType.SERVICE, services.size());
    counts.put(EntityType.FAQ, faqs.size());
    return counts;
  }
}
