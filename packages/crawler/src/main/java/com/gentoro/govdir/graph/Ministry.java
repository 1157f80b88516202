package com.gentoro.govdir.graph;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A ministry. Reported counts are as declared by the source page; observed counts are filled in by
 * {@link GraphAssembler#materialize()} and are null before that.
 */
@JsonPropertyOrder({
  "ministry_id",
  "ministry_name",
  "ministry_description",
  "reported_agency_count",
  "reported_service_count",
  "observed_department_count",
  "observed_agency_count",
  "observed_service_count",
  "ministry_url"
})
public record Ministry(
    @JsonProperty("ministry_id") String ministryId,
    @JsonProperty("ministry_name") String name,
    @JsonProperty("ministry_description") String description,
    @JsonProperty("reported_agency_count") Integer reportedAgencyCount,
    @JsonProperty("reported_service_count") Integer reportedServiceCount,
    @JsonProperty("observed_department_count") Integer observedDepartmentCount,
    @JsonProperty("observed_agency_count") Integer observedAgencyCount,
    @JsonProperty("observed_service_count") Integer observedServiceCount,
    @JsonProperty("ministry_url") String url) {

  /** A ministry as first seen on the ministry list: name and URL only. */
  public static Ministry seed(String ministryId, String name, String url) {
    return new Ministry(ministryId, name, null, null, null, null, null, null, url);
  }

  /** Copy with the overview fields of the ministry page; null arguments keep current values. */
  public Ministry withOverview(
      String description, Integer reportedAgencyCount, Integer reportedServiceCount) {
    return new Ministry(
        ministryId,
        name,
        description != null ? description : this.description,
        reportedAgencyCount != null ? reportedAgencyCount : this.reportedAgencyCount,
        reportedServiceCount != null ? reportedServiceCount : this.reportedServiceCount,
        observedDepartmentCount,
        observedAgencyCount,
        observedServiceCount,
        url);
  }

  Ministry withObserved(int departments, int agencies, int services) {
    return new Ministry(
        ministryId,
        name,
        description,
        reportedAgencyCount,
        reportedServiceCount,
        departments,
        agencies,
        services,
        url);
  }
}
