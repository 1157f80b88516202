package com.gentoro.govdir.resolve;

/** Metadata of one agency from the global directory, keyed by its name hash. */
public record AgencyDirectoryEntry(
    String agencyNameHash, String name, String description, String logoUrl, String agencyUrl) {}
