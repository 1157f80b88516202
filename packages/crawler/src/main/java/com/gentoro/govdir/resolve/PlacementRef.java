package com.gentoro.govdir.resolve;

/** An agency placement whose services page is still to be fetched. */
public record PlacementRef(
    String ministryId,
    String departmentId,
    String agencyId,
    String agencyName,
    String servicesUrl) {}
