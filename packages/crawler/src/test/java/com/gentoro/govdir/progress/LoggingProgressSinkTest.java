package com.gentoro.govdir.progress;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.Logger;

class LoggingProgressSinkTest {

  @Test
  void writesRateLimitedJsonLines() {
    Logger logger = mock(Logger.class);
    long[] now = {5_000};
    LoggingProgressSink sink = new LoggingProgressSink(logger, 1_000, 5, () -> now[0]);

    sink.beginStage("ministries", "Ministry traversal", 10);
    sink.step("ministries", 1, "ministries/aaa", Map.of());
    sink.step("ministries", 2, "ministries/bbb", Map.of()); // below delta, same instant
    sink.step("ministries", 6, "ministries/ccc", Map.of("placements", 4));
    sink.endStageOk("ministries", Map.of("processedKeys", 6));

    ArgumentCaptor<Object> lines = ArgumentCaptor.forClass(Object.class);
    verify(logger, times(4)).info(eq("[crawl.progress] {}"), lines.capture());
    List<Object> json = lines.getAllValues();

    assertTrue(json.get(0).toString().contains("\"status\":\"running\""));
    assertTrue(json.get(0).toString().contains("\"label\":\"Ministry traversal\""));
    assertTrue(json.get(2).toString().contains("\"percent\":60"));
    assertTrue(json.get(2).toString().contains("\"placements\":4"));
    assertTrue(json.get(3).toString().contains("\"status\":\"ok\""));
  }

  @Test
  void errorSummaryIsAddedToAttributes() {
    Logger logger = mock(Logger.class);
    LoggingProgressSink sink = new LoggingProgressSink(logger, 0, 0, () -> 0L);

    sink.beginStage("faq", "FAQs", 1);
    sink.endStageError("faq", "1 keys failed to fetch, 0 to parse", Map.of("failedKeys", 1));

    ArgumentCaptor<Object> lines = ArgumentCaptor.forClass(Object.class);
    verify(logger, times(2)).info(eq("[crawl.progress] {}"), lines.capture());
    String last = lines.getAllValues().get(1).toString();
    assertTrue(last.contains("\"status\":\"error\""));
    assertTrue(last.contains("\"error\":\"1 keys failed to fetch, 0 to parse\""));
    assertTrue(last.contains("\"failedKeys\":1"));
  }
}
