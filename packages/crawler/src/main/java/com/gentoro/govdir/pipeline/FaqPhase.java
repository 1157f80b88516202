package com.gentoro.govdir.pipeline;

import com.gentoro.govdir.extract.PageType;
import com.gentoro.govdir.fetch.FetchTarget;
import com.gentoro.govdir.store.ArtifactKey;
import java.util.Map;

/** Phase 1: the standalone FAQ page. No dependencies on other phases. */
public class FaqPhase implements CrawlPhase {
  public static final String ID = "faq";

  @Override
  public String id() {
    return ID;
  }

  @Override
  public String label() {
    return "FAQs";
  }

  @Override
  public void run(CrawlContext ctx) {
    String url = ctx.settings().faqSeedUrl();
    ArtifactKey key = CrawlKeys.faq();
    ctx.progress().beginStage(ID, label(), 1);
    ctx.source()
        .get(key, new FetchTarget(url, PageType.FAQ.readyCondition(), "faq page"))
        .ifPresent(
            html ->
                ctx.pool()
                    .submit(
                        key.value(),
                        () -> {
                          int n = ctx.resolver().resolveFaqPage(key, url, html);
                          ctx.checkpoints().markProcessed(ID, key);
                          ctx.progress().step(ID, 1, key.value(), Map.of("faqs", n));
                        }));
  }
}
