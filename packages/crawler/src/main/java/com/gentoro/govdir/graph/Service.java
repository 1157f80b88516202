package com.gentoro.govdir.graph;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** A service listed under an agency placement. Description and requirements are always null. */
@JsonPropertyOrder({
  "service_id",
  "ministry_id",
  "department_id",
  "agency_id",
  "service_name",
  "service_url",
  "service_description",
  "service_requirements"
})
public record Service(
    @JsonProperty("service_id") String serviceId,
    @JsonProperty("ministry_id") String ministryId,
    @JsonProperty("department_id") String departmentId,
    @JsonProperty("agency_id") String agencyId,
    @JsonProperty("service_name") String name,
    @JsonProperty("service_url") String url,
    @JsonProperty("service_description") String description,
    @JsonProperty("service_requirements") String requirements) {

  public static Service of(
      String serviceId,
      String ministryId,
      String departmentId,
      String agencyId,
      String name,
      String url) {
    return new Service(serviceId, ministryId, departmentId, agencyId, name, url, null, null);
  }
}
