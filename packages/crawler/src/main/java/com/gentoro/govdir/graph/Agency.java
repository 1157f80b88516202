package com.gentoro.govdir.graph;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * An agency placement: the agency as it appears under one ministry and department.
 *
 * <p>{@code agencyId} is scoped to the placement; {@code agencyNameHash} depends on the name only
 * and is the key used to join directory metadata (description, logo, agency URL). Metadata stays
 * null when the directory had no matching entry.
 */
@JsonPropertyOrder({
  "agency_id",
  "agency_name_hash",
  "ministry_id",
  "department_id",
  "agency_name",
  "agency_description",
  "logo_url",
  "agency_url",
  "observed_service_count",
  "agency_services_url"
})
public record Agency(
    @JsonProperty("agency_id") String agencyId,
    @JsonProperty("agency_name_hash") String agencyNameHash,
    @JsonProperty("ministry_id") String ministryId,
    @JsonProperty("department_id") String departmentId,
    @JsonProperty("agency_name") String name,
    @JsonProperty("agency_description") String description,
    @JsonProperty("logo_url") String logoUrl,
    @JsonProperty("agency_url") String agencyUrl,
    @JsonProperty("observed_service_count") Integer observedServiceCount,
    @JsonProperty("agency_services_url") String servicesUrl) {

  Agency withObserved(int services) {
    return new Agency(
        agencyId,
        agencyNameHash,
        ministryId,
        departmentId,
        name,
        description,
        logoUrl,
        agencyUrl,
        services,
        servicesUrl);
  }
}
