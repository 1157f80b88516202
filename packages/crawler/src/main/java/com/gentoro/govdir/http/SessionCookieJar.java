package com.gentoro.govdir.http;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import okhttp3.Cookie;
import okhttp3.CookieJar;
import okhttp3.HttpUrl;
import org.jetbrains.annotations.NotNull;

/** In-memory cookie store for the lifetime of one crawl run. */
public class SessionCookieJar implements CookieJar {
  private final Map<String, Cookie> cookies = new LinkedHashMap<>();

  @Override
  public synchronized void saveFromResponse(@NotNull HttpUrl url, @NotNull List<Cookie> received) {
    for (Cookie cookie : received) {
      cookies.put(cookie.domain() + "|" + cookie.path() + "|" + cookie.name(), cookie);
    }
  }

  @NotNull
  @Override
  public synchronized List<Cookie> loadForRequest(@NotNull HttpUrl url) {
    long now = System.currentTimeMillis();
    cookies.values().removeIf(c -> c.expiresAt() < now);
    List<Cookie> matching = new ArrayList<>();
    for (Cookie cookie : cookies.values()) {
      if (cookie.matches(url)) matching.add(cookie);
    }
    return matching;
  }
}
