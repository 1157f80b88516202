package com.gentoro.govdir.extract;

import com.gentoro.govdir.exception.ExtractionException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

public class MinistryListExtractor implements PageExtractor<List<MinistryLinkCandidate>> {
  static final String MINISTRY_LINK = "a[href*=/ministries/]";

  @Override
  public PageType pageType() {
    return PageType.MINISTRY_LIST;
  }

  @Override
  public List<MinistryLinkCandidate> extract(String html, String pageUrl) {
    Document doc = Jsoup.parse(html, pageUrl);
    List<MinistryLinkCandidate> ministries = new ArrayList<>();
    for (Element link : doc.select(MINISTRY_LINK)) {
      String name = Markup.text(link);
      String url = Markup.url(link, "href");
      if (name == null || url == null) continue;
      ministries.add(new MinistryLinkCandidate(name, url));
    }
    if (ministries.isEmpty()) {
      throw new ExtractionException(
          "No ministry links found", Map.of("pageType", pageType(), "url", pageUrl));
    }
    return ministries;
  }
}
