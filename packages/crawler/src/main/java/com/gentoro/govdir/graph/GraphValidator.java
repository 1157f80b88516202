package com.gentoro.govdir.graph;

import com.gentoro.govdir.identity.IdentifierEngine;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Checks an {@link EntityGraph} and produces structured findings.
 *
 * <p>Fatal: duplicate identifiers within a collection, foreign identifiers that do not resolve,
 * and any hash collision reported upstream. Warnings: reported vs observed count discrepancies
 * above the tolerance, names that normalize to nothing, and whatever the caller passes in (for
 * example unplaced directory agencies).
 */
public class GraphValidator {
  private static final org.slf4j.Logger log =
      com.gentoro.govdir.logging.LoggingService.getLogger(GraphValidator.class);

  public static final String AGENCY_COUNT = "agency_count";
  public static final String SERVICE_COUNT = "service_count";

  private final int discrepancyTolerance;

  public GraphValidator(int discrepancyTolerance) {
    if (discrepancyTolerance < 0) {
      throw new IllegalArgumentException("discrepancyTolerance must be >= 0");
    }
    this.discrepancyTolerance = discrepancyTolerance;
  }

  public ValidationReport validate(EntityGraph graph) {
    return validate(graph, List.of());
  }

  /**
   * @param upstream findings produced before materialization (collisions, unjoined index entries)
   */
  public ValidationReport validate(EntityGraph graph, List<Finding> upstream) {
    List<Finding> violations = new ArrayList<>();
    List<Finding> warnings = new ArrayList<>();
    for (Finding f : upstream) {
      (f.isFatal() ? violations : warnings).add(f);
    }

    checkUnique(EntityType.MINISTRY, graph.ministries(), Ministry::ministryId, violations);
    checkUnique(EntityType.DEPARTMENT, graph.departments(), Department::departmentId, violations);
    checkUnique(EntityType.AGENCY, graph.agencies(), Agency::agencyId, violations);
    checkUnique(EntityType.SERVICE, graph.services(), Service::serviceId, violations);
    checkUnique(EntityType.FAQ, graph.faqs(), Faq::faqId, violations);

    checkReferences(graph, violations);
    checkDiscrepancies(graph, warnings);
    checkNames(graph, warnings);

    Map<String, Integer> counts = new LinkedHashMap<>();
    graph.recordCounts().forEach((type, n) -> counts.put(type.collection(), n));
    ValidationReport report = new ValidationReport(counts, violations, warnings);

    if (report.hasFatal()) {
      log.error("Graph validation found {} invariant violations", violations.size());
      violations.forEach(
          v ->
              log.error("  {} {} {}: {}", v.type(), v.entityType(), v.entityId(), v.message()));
    }
    report
        .discrepancies()
        .forEach(
            d ->
                log.warn(
                    "Count discrepancy for {} {}: {}", d.entityType(), d.entityId(), d.message()));
    log.info(
        "Validation complete: {} records, {} violations, {} warnings",
        counts,
        violations.size(),
        warnings.size());
    return report;
  }

  private static <T> void checkUnique(
      EntityType type, List<T> records, Function<T, String> id, List<Finding> out) {
    Set<String> seen = new HashSet<>();
    Set<String> reported = new HashSet<>();
    for (T record : records) {
      String value = id.apply(record);
      if (!seen.add(value) && reported.add(value)) {
        out.add(
            Finding.of(
                FindingType.DUPLICATE_ID,
                type,
                value,
                "More than one %s record has this id".formatted(type.collection())));
      }
    }
  }

  private static void checkReferences(EntityGraph graph, List<Finding> out) {
    Set<String> ministries = ids(graph.ministries(), Ministry::ministryId);
    Set<String> departments = ids(graph.departments(), Department::departmentId);
    Set<String> agencies = ids(graph.agencies(), Agency::agencyId);

    for (Department d : graph.departments()) {
      requireRef(
          out, EntityType.DEPARTMENT, d.departmentId(), "ministry_id", d.ministryId(), ministries);
    }
    for (Agency a : graph.agencies()) {
      requireRef(out, EntityType.AGENCY, a.agencyId(), "ministry_id", a.ministryId(), ministries);
      requireRef(
          out, EntityType.AGENCY, a.agencyId(), "department_id", a.departmentId(), departments);
    }
    for (Service s : graph.services()) {
      requireRef(out, EntityType.SERVICE, s.serviceId(), "ministry_id", s.ministryId(), ministries);
      requireRef(
          out, EntityType.SERVICE, s.serviceId(), "department_id", s.departmentId(), departments);
      requireRef(out, EntityType.SERVICE, s.serviceId(), "agency_id", s.agencyId(), agencies);
    }
  }

  private static void requireRef(
      List<Finding> out,
      EntityType type,
      String id,
      String field,
      String reference,
      Set<String> targets) {
    if (reference == null || !targets.contains(reference)) {
      out.add(
          Finding.of(
              FindingType.ORPHAN_REFERENCE,
              type,
              id,
              "%s '%s' does not resolve".formatted(field, reference)));
    }
  }

  private void checkDiscrepancies(EntityGraph graph, List<Finding> out) {
    for (Ministry m : graph.ministries()) {
      compare(out, m.ministryId(), AGENCY_COUNT, m.reportedAgencyCount(), m.observedAgencyCount());
      compare(
          out, m.ministryId(), SERVICE_COUNT, m.reportedServiceCount(), m.observedServiceCount());
    }
  }

  private void compare(
      List<Finding> out, String ministryId, String metric, Integer reported, Integer observed) {
    if (reported == null) return;
    int actual = observed == null ? 0 : observed;
    if (Math.abs(reported - actual) > discrepancyTolerance) {
      out.add(Finding.discrepancy(EntityType.MINISTRY, ministryId, metric, reported, actual));
    }
  }

  private static void checkNames(EntityGraph graph, List<Finding> out) {
    graph.ministries().forEach(m -> emptyName(out, EntityType.MINISTRY, m.ministryId(), m.name()));
    graph
        .departments()
        .forEach(d -> emptyName(out, EntityType.DEPARTMENT, d.departmentId(), d.name()));
    graph.agencies().forEach(a -> emptyName(out, EntityType.AGENCY, a.agencyId(), a.name()));
    graph.services().forEach(s -> emptyName(out, EntityType.SERVICE, s.serviceId(), s.name()));
    graph.faqs().forEach(f -> emptyName(out, EntityType.FAQ, f.faqId(), f.question()));
  }

  private static void emptyName(List<Finding> out, EntityType type, String id, String name) {
    if (IdentifierEngine.normalize(name).isEmpty()) {
      out.add(
          Finding.of(
              FindingType.EMPTY_NAME,
              type,
              id,
              "Name '%s' normalizes to an empty identity".formatted(name)));
    }
  }

  private static <T> Set<String> ids(List<T> records, Function<T, String> id) {
    Set<String> out = new HashSet<>();
    for (T record : records) out.add(id.apply(record));
    return out;
  }
}
