package com.gentoro.govdir.fetch;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.govdir.exception.FetchException;
import com.gentoro.govdir.http.OkHttpFactory;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpPageFetcherTest {

  private static final ReadyCondition FAQ_READY = ReadyCondition.atLeastOne("li[id^=faq_]");
  private static final Duration TIMEOUT = Duration.ofSeconds(5);

  private MockWebServer server;
  private HttpPageFetcher fetcher;

  @BeforeEach
  void setUp() throws IOException {
    server = new MockWebServer();
    server.start();
    fetcher = new HttpPageFetcher(OkHttpFactory.create("govdir-test/1.0", 5));
  }

  @AfterEach
  void tearDown() throws IOException {
    server.shutdown();
  }

  private FetchTarget target(ReadyCondition ready) {
    return new FetchTarget(server.url("/faq").toString(), ready, "faq");
  }

  private FetchSignal failureSignal(MockResponse response, ReadyCondition ready) {
    server.enqueue(response);
    FetchException ex =
        assertThrows(FetchException.class, () -> fetcher.fetch(target(ready), TIMEOUT));
    return ex.getSignal();
  }

  @Test
  void returnsMarkupOnceReadyConditionHolds() throws InterruptedException {
    String html = "<html><body><ul><li id=\"faq_1\">Q</li></ul></body></html>";
    server.enqueue(new MockResponse().setBody(html));

    assertEquals(html, fetcher.fetch(target(FAQ_READY), TIMEOUT));

    RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
    assertNotNull(request);
    assertEquals("govdir-test/1.0", request.getHeader("User-Agent"));
  }

  @Test
  void classifiesHttpStatuses() {
    assertEquals(
        FetchSignal.RATE_LIMITED,
        failureSignal(new MockResponse().setResponseCode(429), ReadyCondition.any()));
    assertEquals(
        FetchSignal.BLOCKED,
        failureSignal(new MockResponse().setResponseCode(403), ReadyCondition.any()));
    assertEquals(
        FetchSignal.BLOCKED,
        failureSignal(new MockResponse().setResponseCode(503), ReadyCondition.any()));
    assertEquals(
        FetchSignal.HTTP_STATUS,
        failureSignal(new MockResponse().setResponseCode(404), ReadyCondition.any()));
  }

  @Test
  void blankBodyIsEmptyContent() {
    assertEquals(
        FetchSignal.EMPTY_CONTENT,
        failureSignal(new MockResponse().setBody("   "), ReadyCondition.any()));
  }

  @Test
  void unmetReadyConditionIsEmptyContent() {
    assertEquals(
        FetchSignal.EMPTY_CONTENT,
        failureSignal(new MockResponse().setBody("<html><body>loading</body></html>"), FAQ_READY));
  }

  @Test
  void challengeInterstitialIsDetected() {
    String challenge =
        "<html><head><title>Just a moment...</title></head><body>checking</body></html>";
    assertEquals(
        FetchSignal.BOT_CHALLENGE,
        failureSignal(new MockResponse().setBody(challenge), ReadyCondition.any()));
    assertEquals(
        FetchSignal.BOT_CHALLENGE,
        failureSignal(
            new MockResponse().setBody("<html><body><div class=\"g-recaptcha\"></div></body>"),
            ReadyCondition.any()));
  }

  @Test
  void slowResponseIsTimeout() {
    server.enqueue(
        new MockResponse().setBody("<html>late</html>").setHeadersDelay(2, TimeUnit.SECONDS));

    FetchException ex =
        assertThrows(
            FetchException.class,
            () -> fetcher.fetch(target(ReadyCondition.any()), Duration.ofMillis(200)));
    assertEquals(FetchSignal.TIMEOUT, ex.getSignal());
  }
}
