package com.gentoro.govdir.extract;

import java.util.List;
import java.util.Objects;

/** The extractor used for each page type during a run. */
public record FieldExtractors(
    PageExtractor<List<FaqCandidate>> faq,
    PageExtractor<List<DirectoryAgencyCandidate>> agencyDirectory,
    PageExtractor<List<MinistryLinkCandidate>> ministryList,
    PageExtractor<MinistryPageCandidate> ministryPage,
    PageExtractor<List<ServiceCandidate>> agencyServices) {

  public FieldExtractors {
    Objects.requireNonNull(faq, "faq");
    Objects.requireNonNull(agencyDirectory, "agencyDirectory");
    Objects.requireNonNull(ministryList, "ministryList");
    Objects.requireNonNull(ministryPage, "ministryPage");
    Objects.requireNonNull(agencyServices, "agencyServices");
  }

  public static FieldExtractors jsoup() {
    return new FieldExtractors(
        new FaqExtractor(),
        new AgencyDirectoryExtractor(),
        new MinistryListExtractor(),
        new MinistryPageExtractor(),
        new AgencyServicesExtractor());
  }
}
