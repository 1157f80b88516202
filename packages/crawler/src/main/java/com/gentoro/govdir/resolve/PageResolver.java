package com.gentoro.govdir.resolve;

import com.gentoro.govdir.exception.ExtractionException;
import com.gentoro.govdir.extract.DirectoryAgencyCandidate;
import com.gentoro.govdir.extract.FaqCandidate;
import com.gentoro.govdir.extract.FieldExtractors;
import com.gentoro.govdir.extract.MinistryLinkCandidate;
import com.gentoro.govdir.extract.MinistryPageCandidate;
import com.gentoro.govdir.extract.MinistryPageCandidate.DepartmentCandidate;
import com.gentoro.govdir.extract.MinistryPageCandidate.PlacementCandidate;
import com.gentoro.govdir.extract.PageType;
import com.gentoro.govdir.extract.ServiceCandidate;
import com.gentoro.govdir.graph.Agency;
import com.gentoro.govdir.graph.Department;
import com.gentoro.govdir.graph.Faq;
import com.gentoro.govdir.graph.GraphAssembler;
import com.gentoro.govdir.graph.Ministry;
import com.gentoro.govdir.graph.Service;
import com.gentoro.govdir.identity.EntityIds;
import com.gentoro.govdir.store.ArtifactKey;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Supplier;

/**
 * Parse-and-resolve step for each page type: runs the extractor on stored markup, computes scoped
 * identifiers and hands the records to the {@link GraphAssembler}.
 *
 * <p>Stateless apart from the shared assembler, join index and failure queue, all of which are
 * thread-safe; any number of pages can be resolved concurrently. An {@link ExtractionException}
 * skips the page's entities and is recorded, it never propagates.
 */
public class PageResolver {
  private static final org.slf4j.Logger log =
      com.gentoro.govdir.logging.LoggingService.getLogger(PageResolver.class);

  private final FieldExtractors extractors;
  private final GraphAssembler assembler;
  private final AgencyIndex agencyIndex;
  private final Queue<ExtractionFailure> failures = new ConcurrentLinkedQueue<>();

  public PageResolver(
      FieldExtractors extractors, GraphAssembler assembler, AgencyIndex agencyIndex) {
    this.extractors = Objects.requireNonNull(extractors, "extractors");
    this.assembler = Objects.requireNonNull(assembler, "assembler");
    this.agencyIndex = Objects.requireNonNull(agencyIndex, "agencyIndex");
  }

  /** @return number of FAQ records resolved from the page */
  public int resolveFaqPage(ArtifactKey key, String pageUrl, String html) {
    List<FaqCandidate> candidates =
        extract(key, PageType.FAQ, () -> extractors.faq().extract(html, pageUrl))
            .orElse(List.of());
    for (FaqCandidate c : candidates) {
      String answer = nullToEmpty(c.answer());
      assembler.addFaq(
          new Faq(EntityIds.faqId(c.question(), answer), c.question(), c.answer()),
          EntityIds.faqParts(c.question(), answer));
    }
    log.debug("{}: {} FAQ candidates", key, candidates.size());
    return candidates.size();
  }

  /** Seeds the join index. @return number of directory entries read from the page */
  public int resolveAgencyDirectory(ArtifactKey key, String pageUrl, String html) {
    List<DirectoryAgencyCandidate> candidates =
        extract(
                key,
                PageType.AGENCY_DIRECTORY,
                () -> extractors.agencyDirectory().extract(html, pageUrl))
            .orElse(List.of());
    for (DirectoryAgencyCandidate c : candidates) {
      agencyIndex.register(
          new AgencyDirectoryEntry(
              EntityIds.agencyNameHash(c.name()),
              c.name(),
              c.description(),
              c.logoUrl(),
              c.agencyUrl()));
    }
    log.debug("{}: {} directory candidates", key, candidates.size());
    return candidates.size();
  }

  /**
   * Seeds ministries from the ministry list.
   *
   * @return distinct ministries in identifier order, for the traversal to visit
   */
  public List<MinistryRef> resolveMinistryList(ArtifactKey key, String pageUrl, String html) {
    List<MinistryLinkCandidate> candidates =
        extract(
                key, PageType.MINISTRY_LIST, () -> extractors.ministryList().extract(html, pageUrl))
            .orElse(List.of());
    List<MinistryRef> refs = new ArrayList<>();
    for (MinistryLinkCandidate c : candidates) {
      String ministryId = EntityIds.ministryId(c.name());
      if (assembler.addMinistry(
          Ministry.seed(ministryId, c.name(), c.url()), EntityIds.ministryParts(c.name()))) {
        refs.add(new MinistryRef(ministryId, c.name(), c.url()));
      }
    }
    refs.sort(Comparator.comparing(MinistryRef::ministryId));
    return refs;
  }

  /**
   * Overview, departments and agency placements of one ministry. Placements are backfilled from
   * the directory index; a placement without a directory entry keeps null metadata.
   *
   * @return placements in page order, for their services pages to be fetched
   */
  public List<PlacementRef> resolveMinistryPage(
      ArtifactKey key, MinistryRef ministry, String html) {
    Optional<MinistryPageCandidate> page =
        extract(
            key,
            PageType.MINISTRY_PAGE,
            () -> extractors.ministryPage().extract(html, ministry.url()));
    if (page.isEmpty()) return List.of();
    MinistryPageCandidate candidate = page.get();
    String ministryId = ministry.ministryId();
    assembler.enrichMinistry(
        ministryId,
        candidate.description(),
        candidate.reportedAgencyCount(),
        candidate.reportedServiceCount());

    List<PlacementRef> placements = new ArrayList<>();
    for (DepartmentCandidate dept : candidate.departments()) {
      String departmentId = EntityIds.departmentId(ministryId, dept.name());
      assembler.addDepartment(
          Department.of(departmentId, ministryId, dept.name(), dept.url()),
          EntityIds.departmentParts(ministryId, dept.name()));

      for (PlacementCandidate p : dept.placements()) {
        String agencyId = EntityIds.agencyId(ministryId, departmentId, p.name());
        String nameHash = EntityIds.agencyNameHash(p.name());
        Optional<AgencyDirectoryEntry> meta = agencyIndex.join(nameHash);
        Agency agency =
            new Agency(
                agencyId,
                nameHash,
                ministryId,
                departmentId,
                p.name(),
                meta.map(AgencyDirectoryEntry::description).orElse(null),
                meta.map(AgencyDirectoryEntry::logoUrl).orElse(null),
                meta.map(AgencyDirectoryEntry::agencyUrl).orElse(null),
                null,
                p.url());
        if (meta.isEmpty()) {
          log.debug("Placement '{}' under {} has no directory entry", p.name(), ministry.name());
        }
        if (assembler.addAgency(agency, EntityIds.agencyParts(ministryId, departmentId, p.name()))
            && p.url() != null) {
          placements.add(new PlacementRef(ministryId, departmentId, agencyId, p.name(), p.url()));
        }
      }
    }
    log.debug(
        "{}: {} departments, {} placements",
        key,
        candidate.departments().size(),
        placements.size());
    return placements;
  }

  /** @return number of service links on the page */
  public int resolveServicesPage(ArtifactKey key, PlacementRef placement, String html) {
    List<ServiceCandidate> candidates =
        extract(
                key,
                PageType.AGENCY_SERVICES,
                () -> extractors.agencyServices().extract(html, placement.servicesUrl()))
            .orElse(List.of());
    for (ServiceCandidate c : candidates) {
      String serviceId =
          EntityIds.serviceId(
              placement.ministryId(), placement.departmentId(), placement.agencyId(), c.name());
      assembler.addService(
          Service.of(
              serviceId,
              placement.ministryId(),
              placement.departmentId(),
              placement.agencyId(),
              c.name(),
              c.url()),
          EntityIds.serviceParts(
              placement.ministryId(), placement.departmentId(), placement.agencyId(), c.name()));
    }
    return candidates.size();
  }

  /** Extraction failures so far, sorted by key. */
  public List<ExtractionFailure> failures() {
    List<ExtractionFailure> out = new ArrayList<>(failures);
    out.sort(Comparator.comparing(ExtractionFailure::key));
    return Collections.unmodifiableList(out);
  }

  private <T> Optional<T> extract(ArtifactKey key, PageType type, Supplier<T> extraction) {
    try {
      return Optional.of(extraction.get());
    } catch (ExtractionException e) {
      log.warn("Extraction failed for {} ({}): {}", key, type, e.getMessage());
      failures.add(new ExtractionFailure(key.value(), type, e.getMessage()));
      return Optional.empty();
    }
  }

  private static String nullToEmpty(String s) {
    return s == null ? "" : s;
  }
}
