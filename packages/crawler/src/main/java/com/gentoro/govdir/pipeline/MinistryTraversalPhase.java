package com.gentoro.govdir.pipeline;

import com.gentoro.govdir.extract.PageType;
import com.gentoro.govdir.fetch.FetchTarget;
import com.gentoro.govdir.resolve.MinistryRef;
import com.gentoro.govdir.resolve.PlacementRef;
import com.gentoro.govdir.store.ArtifactKey;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Phase 3: ministry list, then every ministry page, then every placement's services page.
 *
 * <p>Fetches happen on the calling thread in a fixed order: the list, all ministry pages, then for
 * each ministry in turn its services pages. Parsing runs on the worker pool while the next page is
 * fetched. A ministry's services pages are only requested after that ministry's page has been
 * resolved, since the placements come from it.
 */
public class MinistryTraversalPhase implements CrawlPhase {
  private static final org.slf4j.Logger log =
      com.gentoro.govdir.logging.LoggingService.getLogger(MinistryTraversalPhase.class);

  public static final String ID = "ministries";

  @Override
  public String id() {
    return ID;
  }

  @Override
  public String label() {
    return "Ministry traversal";
  }

  @Override
  public void run(CrawlContext ctx) {
    String listUrl = ctx.settings().ministryListSeedUrl();
    ArtifactKey listKey = CrawlKeys.ministryList();
    Optional<String> listHtml =
        ctx.source()
            .get(
                listKey,
                new FetchTarget(listUrl, PageType.MINISTRY_LIST.readyCondition(), "ministry list"));
    if (listHtml.isEmpty()) {
      ctx.progress().beginStage(ID, label(), 0);
      return;
    }

    List<MinistryRef> ministries =
        awaitOrEmpty(
            ctx.pool()
                .submit(
                    listKey.value(),
                    () -> {
                      List<MinistryRef> refs =
                          ctx.resolver().resolveMinistryList(listKey, listUrl, listHtml.get());
                      ctx.checkpoints().markProcessed(ID, listKey);
                      return refs;
                    }));
    log.info("Traversing {} ministries", ministries.size());
    ctx.progress().beginStage(ID, label(), ministries.size());

    List<CompletableFuture<List<PlacementRef>>> placementsByMinistry = new ArrayList<>();
    for (MinistryRef ministry : ministries) {
      placementsByMinistry.add(fetchMinistryPage(ctx, ministry));
    }

    AtomicLong done = new AtomicLong();
    for (int i = 0; i < ministries.size(); i++) {
      MinistryRef ministry = ministries.get(i);
      List<PlacementRef> placements = awaitOrEmpty(placementsByMinistry.get(i));
      for (PlacementRef placement : placements) {
        fetchServicesPage(ctx, placement);
      }
      ctx.progress()
          .step(
              ID,
              done.incrementAndGet(),
              ministry.name(),
              Map.of("ministryId", ministry.ministryId(), "placements", placements.size()));
    }
  }

  private CompletableFuture<List<PlacementRef>> fetchMinistryPage(
      CrawlContext ctx, MinistryRef ministry) {
    ArtifactKey key = CrawlKeys.ministryPage(ministry);
    FetchTarget target =
        new FetchTarget(ministry.url(), PageType.MINISTRY_PAGE.readyCondition(), ministry.name());
    Optional<String> html = ctx.source().get(key, target);
    if (html.isEmpty()) {
      return CompletableFuture.completedFuture(List.of());
    }
    return ctx.pool()
        .submit(
            key.value(),
            () -> {
              List<PlacementRef> refs =
                  ctx.resolver().resolveMinistryPage(key, ministry, html.get());
              ctx.checkpoints().markProcessed(ID, key);
              return refs;
            });
  }

  private void fetchServicesPage(CrawlContext ctx, PlacementRef placement) {
    ArtifactKey key = CrawlKeys.services(placement);
    FetchTarget target =
        new FetchTarget(
            placement.servicesUrl(),
            PageType.AGENCY_SERVICES.readyCondition(),
            placement.agencyName() + " services");
    ctx.source()
        .get(key, target)
        .ifPresent(
            html ->
                ctx.pool()
                    .submit(
                        key.value(),
                        () -> {
                          ctx.resolver().resolveServicesPage(key, placement, html);
                          ctx.checkpoints().markProcessed(ID, key);
                        }));
  }

  /** Failed tasks are reported by the pool when it drains; here they contribute nothing. */
  private static <T> List<T> awaitOrEmpty(CompletableFuture<List<T>> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      return List.of();
    }
  }
}
