package com.gentoro.govdir.graph;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({
  "department_id",
  "ministry_id",
  "department_name",
  "observed_agency_count",
  "observed_service_count",
  "department_url"
})
public record Department(
    @JsonProperty("department_id") String departmentId,
    @JsonProperty("ministry_id") String ministryId,
    @JsonProperty("department_name") String name,
    @JsonProperty("observed_agency_count") Integer observedAgencyCount,
    @JsonProperty("observed_service_count") Integer observedServiceCount,
    @JsonProperty("department_url") String url) {

  public static Department of(String departmentId, String ministryId, String name, String url) {
    return new Department(departmentId, ministryId, name, null, null, url);
  }

  Department withObserved(int agencies, int services) {
    return new Department(departmentId, ministryId, name, agencies, services, url);
  }
}
