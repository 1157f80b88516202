package com.gentoro.govdir.extract;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.govdir.Fixtures;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

class MarkupTest {

  private static Element link(String href) {
    String html = "<a href=\"" + href + "\">x</a>";
    return Jsoup.parse(html, Fixtures.BASE + "/agencies/").selectFirst("a");
  }

  @Test
  void urlsAreResolvedAndLoseTheirFragment() {
    assertEquals(Fixtures.BASE + "/ministries", Markup.url(link("/ministries#top"), "href"));
    assertEquals(
        Fixtures.BASE + "/agencies/nrb?tab=services",
        Markup.url(link("nrb?tab=services#list"), "href"));
    assertEquals(
        Markup.url(link("https://kra.example/agency"), "href"),
        Markup.url(link("https://kra.example/agency#top"), "href"));
  }

  @Test
  void schemeAndHostAreLowercased() {
    assertEquals("http://example.com/Path", Markup.url(link("HTTP://EXAMPLE.COM/Path"), "href"));
  }

  @Test
  void nonHttpLinksAreKeptVerbatim() {
    assertEquals("mailto:help@example.com", Markup.url(link("mailto:help@example.com"), "href"));
    assertNull(Markup.url(null, "href"));
  }

  @Test
  void countsAcceptPlainDigitsOnly() {
    assertEquals(12, Markup.count(" 12 "));
    assertNull(Markup.count("12+"));
    assertNull(Markup.count(""));
  }
}
