package com.gentoro.govdir.extract;

import java.util.regex.Pattern;
import okhttp3.HttpUrl;
import org.jsoup.nodes.Element;

/** Text and link helpers shared by the extractors. */
final class Markup {
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern DIGITS = Pattern.compile("[0-9]+");

  private Markup() {}

  /** Whitespace collapsed and trimmed; blank becomes {@code null}. */
  static String clean(String raw) {
    if (raw == null) return null;
    String collapsed = WHITESPACE.matcher(raw).replaceAll(" ").trim();
    return collapsed.isEmpty() ? null : collapsed;
  }

  static String text(Element element) {
    return element == null ? null : clean(element.text());
  }

  /**
   * Absolute form of a link attribute, resolved against the document base URI. HTTP(S) links get a
   * lowercase scheme and host and lose their {@code #fragment}. Falls back to the trimmed raw value
   * when it cannot be resolved; blank becomes {@code null}.
   */
  static String url(Element element, String attribute) {
    if (element == null || !element.hasAttr(attribute)) return null;
    String absolute = element.absUrl(attribute);
    if (absolute.isBlank()) absolute = element.attr(attribute);
    String value = clean(absolute);
    if (value == null) return null;
    HttpUrl parsed = HttpUrl.parse(value);
    return parsed == null ? value : parsed.newBuilder().fragment(null).build().toString();
  }

  /** Plain digit strings only; anything else is absent. */
  static Integer count(String raw) {
    String value = clean(raw);
    if (value == null || !DIGITS.matcher(value).matches() || value.length() > 9) return null;
    return Integer.valueOf(value);
  }
}
