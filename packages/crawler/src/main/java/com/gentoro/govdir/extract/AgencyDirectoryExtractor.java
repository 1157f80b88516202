package com.gentoro.govdir.extract;

import com.gentoro.govdir.exception.ExtractionException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Directory cards are links with an {@code h4} name, an optional {@code p} description and an
 * optional logo {@code img}. The link target is the agency's own URL.
 */
public class AgencyDirectoryExtractor implements PageExtractor<List<DirectoryAgencyCandidate>> {

  @Override
  public PageType pageType() {
    return PageType.AGENCY_DIRECTORY;
  }

  @Override
  public List<DirectoryAgencyCandidate> extract(String html, String pageUrl) {
    Document doc = Jsoup.parse(html, pageUrl);
    List<DirectoryAgencyCandidate> agencies = new ArrayList<>();
    for (Element card : doc.select("a:has(h4)")) {
      String name = Markup.text(card.selectFirst("h4"));
      if (name == null) continue;
      agencies.add(
          new DirectoryAgencyCandidate(
              name,
              Markup.text(card.selectFirst("p")),
              Markup.url(card.selectFirst("img[src]"), "src"),
              Markup.url(card, "href")));
    }
    if (agencies.isEmpty()) {
      throw new ExtractionException(
          "No agency cards found", Map.of("pageType", pageType(), "url", pageUrl));
    }
    return agencies;
  }
}
