package com.gentoro.govdir.pipeline;

import com.gentoro.govdir.extract.PageType;
import com.gentoro.govdir.fetch.FetchTarget;
import com.gentoro.govdir.store.ArtifactKey;
import java.util.Map;

/** Phase 2: the global agency directory, which seeds the agency join index. */
public class AgencyDirectoryPhase implements CrawlPhase {
  public static final String ID = "agency_directory";

  @Override
  public String id() {
    return ID;
  }

  @Override
  public String label() {
    return "Agency directory";
  }

  @Override
  public void run(CrawlContext ctx) {
    String url = ctx.settings().agencyDirectorySeedUrl();
    ArtifactKey key = CrawlKeys.agencyDirectory();
    ctx.progress().beginStage(ID, label(), 1);
    FetchTarget target =
        new FetchTarget(url, PageType.AGENCY_DIRECTORY.readyCondition(), "agency directory");
    ctx.source()
        .get(key, target)
        .ifPresent(
            html ->
                ctx.pool()
                    .submit(
                        key.value(),
                        () -> {
                          int n = ctx.resolver().resolveAgencyDirectory(key, url, html);
                          ctx.checkpoints().markProcessed(ID, key);
                          ctx.progress().step(ID, 1, key.value(), Map.of("agencies", n));
                        }));
  }
}
