package com.gentoro.govdir.extract;

import com.gentoro.govdir.exception.ExtractionException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

/**
 * FAQ items are {@code li} elements with an id starting with {@code faq_}. The question is the
 * item's button text; the answer is the {@code div} right after the button, or the first {@code
 * div} of the item when the button has no such sibling.
 */
public class FaqExtractor implements PageExtractor<List<FaqCandidate>> {

  @Override
  public PageType pageType() {
    return PageType.FAQ;
  }

  @Override
  public List<FaqCandidate> extract(String html, String pageUrl) {
    Document doc = Jsoup.parse(html, pageUrl);
    Elements items = doc.select("li[id^=faq_]");
    List<FaqCandidate> faqs = new ArrayList<>();
    for (Element item : items) {
      Element button = item.selectFirst("button");
      String question = Markup.text(button);
      if (question == null) continue;

      Element answer = button.nextElementSibling();
      while (answer != null && !answer.tagName().equals("div")) {
        answer = answer.nextElementSibling();
      }
      if (answer == null) answer = item.selectFirst("div");
      faqs.add(new FaqCandidate(question, Markup.text(answer)));
    }
    if (faqs.isEmpty()) {
      throw new ExtractionException(
          "No question/answer pairs found",
          Map.of("pageType", pageType(), "url", pageUrl, "items", items.size()));
    }
    return faqs;
  }
}
