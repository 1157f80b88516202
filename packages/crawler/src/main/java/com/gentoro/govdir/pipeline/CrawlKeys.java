package com.gentoro.govdir.pipeline;

import com.gentoro.govdir.resolve.MinistryRef;
import com.gentoro.govdir.resolve.PlacementRef;
import com.gentoro.govdir.store.ArtifactKey;

/** Artifact keys for every page the crawler stores, mirroring the directory hierarchy. */
public final class CrawlKeys {
  private CrawlKeys() {}

  public static ArtifactKey faq() {
    return ArtifactKey.of("faq");
  }

  public static ArtifactKey agencyDirectory() {
    return ArtifactKey.of("agencies");
  }

  public static ArtifactKey ministryList() {
    return ArtifactKey.of("ministries");
  }

  public static ArtifactKey ministryPage(MinistryRef ministry) {
    return ArtifactKey.of("ministries", ministry.ministryId());
  }

  public static ArtifactKey services(PlacementRef placement) {
    return ArtifactKey.of(
        "ministries",
        placement.ministryId(),
        placement.departmentId(),
        placement.agencyId(),
        "services");
  }
}
