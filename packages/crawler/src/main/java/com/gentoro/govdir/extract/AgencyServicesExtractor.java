package com.gentoro.govdir.extract;

import java.util.ArrayList;
import java.util.List;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Service links of a placement's services page. Links are read from the first services container,
 * or from the whole page when the container is missing. Zero links is a valid result.
 */
public class AgencyServicesExtractor implements PageExtractor<List<ServiceCandidate>> {
  static final String CONTAINER = "div.space-y-3";

  @Override
  public PageType pageType() {
    return PageType.AGENCY_SERVICES;
  }

  @Override
  public List<ServiceCandidate> extract(String html, String pageUrl) {
    Document doc = Jsoup.parse(html, pageUrl);
    Element container = doc.selectFirst(CONTAINER);
    Element scope = container == null ? doc.body() : container;
    List<ServiceCandidate> services = new ArrayList<>();
    for (Element link : scope.select("a")) {
      String name = Markup.text(link);
      if (name == null) continue;
      services.add(new ServiceCandidate(name, Markup.url(link, "href")));
    }
    return services;
  }
}
