package com.gentoro.govdir.extract;

/** One card of the global agency directory. Every field but the name may be null. */
public record DirectoryAgencyCandidate(
    String name, String description, String logoUrl, String agencyUrl) {}
