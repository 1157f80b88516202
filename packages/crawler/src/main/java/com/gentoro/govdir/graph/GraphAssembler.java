package com.gentoro.govdir.graph;

import com.gentoro.govdir.exception.ResolutionException;
import com.gentoro.govdir.identity.IdentifierEngine;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Accumulates entity records from every phase and worker, then materializes the final graph.
 *
 * <p>Append-only and thread-safe. Each record is added with the identity parts its identifier was
 * hashed from:
 *
 * <ul>
 *   <li>same identifier, same identity: a repeated discovery; the first record is kept
 *   <li>same identifier, different identity: a {@link FindingType#HASH_COLLISION}; the first record
 *       is kept and the collision is reported as a fatal finding
 * </ul>
 *
 * Observed counts are never accumulated while adding; {@link #materialize()} derives them from the
 * child records present at that moment.
 */
public class GraphAssembler {
  private static final org.slf4j.Logger log =
      com.gentoro.govdir.logging.LoggingService.getLogger(GraphAssembler.class);

  private static final class Slot<T> {
    final String identityKey;
    volatile T record;

    Slot(String identityKey, T record) {
      this.identityKey = identityKey;
      this.record = record;
    }
  }

  private final Map<EntityType, Map<String, Slot<Object>>> collections =
      new ConcurrentHashMap<>();
  private final List<Finding> collisions = new CopyOnWriteArrayList<>();

  public GraphAssembler() {
    for (EntityType type : EntityType.values()) {
      collections.put(type, new ConcurrentHashMap<>());
    }
  }

  /** @return true if the record was added, false if the identifier was already present */
  public boolean addMinistry(Ministry ministry, List<String> identityParts) {
    return add(EntityType.MINISTRY, ministry.ministryId(), identityParts, ministry);
  }

  public boolean addDepartment(Department department, List<String> identityParts) {
    return add(EntityType.DEPARTMENT, department.departmentId(), identityParts, department);
  }

  public boolean addAgency(Agency agency, List<String> identityParts) {
    return add(EntityType.AGENCY, agency.agencyId(), identityParts, agency);
  }

  public boolean addService(Service service, List<String> identityParts) {
    return add(EntityType.SERVICE, service.serviceId(), identityParts, service);
  }

  public boolean addFaq(Faq faq, List<String> identityParts) {
    return add(EntityType.FAQ, faq.faqId(), identityParts, faq);
  }

  /**
   * Merge the ministry page overview into a seeded ministry.
   *
   * @throws ResolutionException if no ministry with that identifier was added
   */
  public void enrichMinistry(
      String ministryId, String description, Integer reportedAgencies, Integer reportedServices) {
    Slot<Object> slot = collections.get(EntityType.MINISTRY).get(ministryId);
    if (slot == null) {
      throw new ResolutionException(
          "Ministry overview for an unknown ministry", Map.of("ministryId", ministryId));
    }
    synchronized (slot) {
      slot.record =
          ((Ministry) slot.record).withOverview(description, reportedAgencies, reportedServices);
    }
  }

  public boolean contains(EntityType type, String id) {
    return collections.get(type).containsKey(id);
  }

  public int size(EntityType type) {
    return collections.get(type).size();
  }

  /** Collisions detected so far, in detection order. */
  public List<Finding> collisions() {
    return Collections.unmodifiableList(new ArrayList<>(collisions));
  }

  /**
   * Build the immutable graph: every collection sorted by identifier, observed counts derived from
   * the materialized children.
   */
  public EntityGraph materialize() {
    List<Ministry> ministries = sorted(EntityType.MINISTRY, Ministry.class, Ministry::ministryId);
    List<Department> departments =
        sorted(EntityType.DEPARTMENT, Department.class, Department::departmentId);
    List<Agency> agencies = sorted(EntityType.AGENCY, Agency.class, Agency::agencyId);
    List<Service> services = sorted(EntityType.SERVICE, Service.class, Service::serviceId);
    List<Faq> faqs = sorted(EntityType.FAQ, Faq.class, Faq::faqId);

    Map<String, Long> servicesByAgency = countBy(services, Service::agencyId);
    Map<String, Long> servicesByDepartment = countBy(services, Service::departmentId);
    Map<String, Long> servicesByMinistry = countBy(services, Service::ministryId);
    Map<String, Long> agenciesByDepartment = countBy(agencies, Agency::departmentId);
    Map<String, Long> agenciesByMinistry = countBy(agencies, Agency::ministryId);
    Map<String, Long> departmentsByMinistry = countBy(departments, Department::ministryId);

    List<Agency> countedAgencies =
        agencies.stream()
            .map(a -> a.withObserved(count(servicesByAgency, a.agencyId())))
            .toList();
    List<Department> countedDepartments =
        departments.stream()
            .map(
                d ->
                    d.withObserved(
                        count(agenciesByDepartment, d.departmentId()),
                        count(servicesByDepartment, d.departmentId())))
            .toList();
    List<Ministry> countedMinistries =
        ministries.stream()
            .map(
                m ->
                    m.withObserved(
                        count(departmentsByMinistry, m.ministryId()),
                        count(agenciesByMinistry, m.ministryId()),
                        count(servicesByMinistry, m.ministryId())))
            .toList();

    EntityGraph graph =
        new EntityGraph(countedMinistries, countedDepartments, countedAgencies, services, faqs);
    log.info("Materialized graph {}", graph.recordCounts());
    return graph;
  }

  private boolean add(EntityType type, String id, List<String> identityParts, Object record) {
    String identityKey = IdentifierEngine.identityKey(identityParts);
    Slot<Object> candidate = new Slot<>(identityKey, record);
    Slot<Object> existing = collections.get(type).putIfAbsent(id, candidate);
    if (existing == null) {
      return true;
    }
    if (!existing.identityKey.equals(identityKey)) {
      Finding collision =
          Finding.of(
              FindingType.HASH_COLLISION,
              type,
              id,
              "Identity '%s' hashes to the same id as '%s'"
                  .formatted(identityKey, existing.identityKey));
      collisions.add(collision);
      log.error("Hash collision in {} for id {}: {}", type.collection(), id, collision.message());
    } else {
      log.debug("{} {} already present; keeping the first record", type, id);
    }
    return false;
  }

  private <T> List<T> sorted(EntityType type, Class<T> cls, Function<T, String> id) {
    return collections.get(type).values().stream()
        .map(slot -> cls.cast(slot.record))
        .sorted(Comparator.comparing(id))
        .toList();
  }

  private static <T> Map<String, Long> countBy(List<T> records, Function<T, String> key) {
    return records.stream()
        .filter(r -> key.apply(r) != null)
        .collect(Collectors.groupingBy(key, Collectors.counting()));
  }

  private static int count(Map<String, Long> counts, String id) {
    return counts.getOrDefault(id, 0L).intValue();
  }
}
