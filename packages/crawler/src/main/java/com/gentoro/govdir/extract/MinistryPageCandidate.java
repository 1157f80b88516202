package com.gentoro.govdir.extract;

import java.util.List;

/**
 * Fields of a ministry page: the reported aggregates, the description and the department blocks
 * with their agency placements.
 */
public record MinistryPageCandidate(
    String description,
    Integer reportedAgencyCount,
    Integer reportedServiceCount,
    List<DepartmentCandidate> departments) {

  public MinistryPageCandidate {
    departments = departments == null ? List.of() : List.copyOf(departments);
  }

  /** @param url ministry URL scoped to this department */
  public record DepartmentCandidate(String name, String url, List<PlacementCandidate> placements) {
    public DepartmentCandidate {
      placements = placements == null ? List.of() : List.copyOf(placements);
    }
  }

  /** @param url link to the agency's services listing */
  public record PlacementCandidate(String name, String url) {}
}
