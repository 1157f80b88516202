package com.gentoro.govdir.pipeline;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.gentoro.govdir.exception.FetchAbortedException;
import com.gentoro.govdir.exception.FetchException;
import com.gentoro.govdir.fetch.FetchGovernor;
import com.gentoro.govdir.fetch.FetchSignal;
import com.gentoro.govdir.fetch.FetchTarget;
import com.gentoro.govdir.fetch.ReadyCondition;
import com.gentoro.govdir.store.ArtifactKey;
import com.gentoro.govdir.store.FailureRecord;
import com.gentoro.govdir.store.InMemoryArtifactStore;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ArtifactSourceTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2026-02-01T00:00:00Z"), ZoneOffset.UTC);
  private static final ArtifactKey KEY = ArtifactKey.of("faq");
  private static final FetchTarget TARGET =
      new FetchTarget("https://directory.example/help", ReadyCondition.any(), "faq page");

  @Test
  void storedArtifactNeverTouchesTheNetwork() {
    InMemoryArtifactStore store = new InMemoryArtifactStore();
    store.put(KEY, "<html>cached</html>");
    FetchGovernor governor = mock(FetchGovernor.class);
    ArtifactSource source = new ArtifactSource(store, governor, CLOCK);

    assertEquals("<html>cached</html>", source.get(KEY, TARGET).orElseThrow());

    verify(governor, never()).fetch(any());
    assertEquals(1, source.stats().cacheHits());
    assertEquals(0, source.stats().networkFetches());
  }

  @Test
  void fetchedArtifactIsStoredAndClearsEarlierFailure() {
    InMemoryArtifactStore store = new InMemoryArtifactStore();
    store.recordFailure(
        new FailureRecord(
            KEY.value(), TARGET.url(), FetchSignal.TIMEOUT, "slow", 3, CLOCK.instant()));
    FetchGovernor governor = mock(FetchGovernor.class);
    when(governor.fetch(TARGET)).thenReturn("<html>fresh</html>");
    ArtifactSource source = new ArtifactSource(store, governor, CLOCK);

    assertEquals("<html>fresh</html>", source.get(KEY, TARGET).orElseThrow());

    assertEquals("<html>fresh</html>", store.get(KEY).orElseThrow());
    assertTrue(store.failures().isEmpty());
    assertEquals(1, source.stats().networkFetches());
  }

  @Test
  void failedFetchIsLoggedWithItsSignalAndAttempts() {
    InMemoryArtifactStore store = new InMemoryArtifactStore();
    FetchGovernor governor = mock(FetchGovernor.class);
    when(governor.fetch(TARGET))
        .thenThrow(
            new FetchException(FetchSignal.RATE_LIMITED, "giving up", Map.of("attempts", 3)));
    ArtifactSource source = new ArtifactSource(store, governor, CLOCK);

    assertTrue(source.get(KEY, TARGET).isEmpty());

    FailureRecord failure = store.failures().get("faq");
    assertEquals(FetchSignal.RATE_LIMITED, failure.signal());
    assertEquals(3, failure.attempts());
    assertEquals(CLOCK.instant(), failure.timestamp());
    assertFalse(store.contains(KEY));
    assertEquals(1, source.failedCount());
  }

  @Test
  void abortedGovernorIsRecordedAsAborted() {
    InMemoryArtifactStore store = new InMemoryArtifactStore();
    FetchGovernor governor = mock(FetchGovernor.class);
    when(governor.fetch(TARGET)).thenThrow(new FetchAbortedException("aborted", Map.of()));
    ArtifactSource source = new ArtifactSource(store, governor, CLOCK);

    assertTrue(source.get(KEY, TARGET).isEmpty());

    assertEquals(FetchSignal.ABORTED, store.failures().get("faq").signal());
  }

  @Test
  void offlineMissIsRecordedWithoutFetching() {
    InMemoryArtifactStore store = new InMemoryArtifactStore();
    ArtifactSource source = ArtifactSource.offline(store, CLOCK);

    assertTrue(source.isOffline());
    assertTrue(source.get(KEY, TARGET).isEmpty());
    assertEquals(FetchSignal.OFFLINE, source.stats().failedKeys().get(0).signal());
    assertFalse(source.governorAborted());
  }
}
