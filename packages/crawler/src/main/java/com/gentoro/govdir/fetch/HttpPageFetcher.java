package com.gentoro.govdir.fetch;

import com.gentoro.govdir.exception.FetchException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

/**
 * {@link PageFetcher} over plain HTTP. The response body is parsed with jsoup to evaluate the
 * target's {@link ReadyCondition}; content rendered by client-side scripts is not visible here.
 */
public class HttpPageFetcher implements PageFetcher {
  private static final org.slf4j.Logger log =
      com.gentoro.govdir.logging.LoggingService.getLogger(HttpPageFetcher.class);

  /** Elements found on common anti-automation interstitials. */
  static final String CHALLENGE_SELECTOR =
      "#challenge-form, #challenge-running, #cf-challenge-running, .g-recaptcha, .h-captcha";

  private final OkHttpClient client;

  public HttpPageFetcher(OkHttpClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public String fetch(FetchTarget target, Duration timeout) {
    OkHttpClient call = client.newBuilder().callTimeout(timeout).readTimeout(timeout).build();
    Request request = new Request.Builder().url(target.url()).get().build();
    try (Response response = call.newCall(request).execute()) {
      int status = response.code();
      if (status == 429) {
        throw failure(FetchSignal.RATE_LIMITED, target, status, "Rate limited");
      }
      if (status == 403 || status == 503) {
        throw failure(FetchSignal.BLOCKED, target, status, "Blocked");
      }
      if (!response.isSuccessful()) {
        throw failure(FetchSignal.HTTP_STATUS, target, status, "Unexpected status");
      }
      ResponseBody body = response.body();
      String html = body == null ? "" : body.string();
      verifyReady(target, html);
      return html;
    } catch (SocketTimeoutException e) {
      throw new FetchException(
          FetchSignal.TIMEOUT, "Timed out loading " + target.url(), Map.of("url", target.url()), e);
    } catch (InterruptedIOException e) {
      // OkHttp reports an expired call timeout as a plain InterruptedIOException
      throw new FetchException(
          FetchSignal.TIMEOUT, "Call timeout for " + target.url(), Map.of("url", target.url()), e);
    } catch (IOException e) {
      throw new FetchException(
          FetchSignal.TRANSPORT,
          "I/O failure loading " + target.url() + ": " + e.getMessage(),
          Map.of("url", target.url()),
          e);
    }
  }

  private static void verifyReady(FetchTarget target, String html) {
    if (html.isBlank()) {
      throw new FetchException(
          FetchSignal.EMPTY_CONTENT,
          "Empty body from " + target.url(),
          Map.of("url", target.url()));
    }
    Document doc = Jsoup.parse(html, target.url());
    if (!doc.select(CHALLENGE_SELECTOR).isEmpty() || doc.title().startsWith("Just a moment")) {
      throw new FetchException(
          FetchSignal.BOT_CHALLENGE,
          "Challenge page served for " + target.url(),
          Map.of("url", target.url()));
    }
    ReadyCondition ready = target.readyCondition();
    int matches = doc.select(ready.selector()).size();
    if (matches < ready.minMatches()) {
      throw new FetchException(
          FetchSignal.EMPTY_CONTENT,
          "Ready condition '%s' not met for %s (found %d)".formatted(ready, target.url(), matches),
          Map.of("url", target.url(), "readyCondition", ready.toString()));
    }
    log.debug("{} ready ({} matches for {})", target.label(), matches, ready.selector());
  }

  private static FetchException failure(
      FetchSignal signal, FetchTarget target, int status, String message) {
    return new FetchException(
        signal,
        "%s: HTTP %d from %s".formatted(message, status, target.url()),
        Map.of("url", target.url(), "status", status));
  }
}
