package com.gentoro.govdir.progress;

import com.gentoro.govdir.utility.JacksonUtility;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Writes progress as one JSON line per event to the log, under the {@code [crawl.progress]}
 * prefix:
 *
 * <pre>
 * {"stageId":"ministries","label":"Ministry traversal","completed":12,"total":21,"percent":57,
 *  "message":"ministries/3f2a9c01b7de","attrs":{},"status":"running"}
 * </pre>
 *
 * Steps go through a {@link ProgressRateLimiter}; stage begin and end are always written.
 */
public class LoggingProgressSink implements ProgressSink {
  private final org.slf4j.Logger log;
  private final ProgressRateLimiter limiter;
  private final LongSupplier clock;

  private final Map<String, Long> totals = new ConcurrentHashMap<>();
  private final Map<String, Long> completions = new ConcurrentHashMap<>();
  private final Map<String, String> labels = new ConcurrentHashMap<>();

  public LoggingProgressSink(org.slf4j.Logger logger, long minIntervalMs, long minDelta) {
    this(logger, minIntervalMs, minDelta, System::currentTimeMillis);
  }

  LoggingProgressSink(
      org.slf4j.Logger logger, long minIntervalMs, long minDelta, LongSupplier clock) {
    this.log = Objects.requireNonNull(logger, "logger");
    this.limiter = new ProgressRateLimiter(minIntervalMs, minDelta);
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public void beginStage(String id, String label, long totalWork) {
    totals.put(id, Math.max(0, totalWork));
    completions.put(id, 0L);
    labels.put(id, label);
    limiter.reset();
    emit(id, 0L, "begin", Map.of(), "running");
  }

  @Override
  public void step(String id, long completed, String message, Map<String, Object> attrs) {
    completions.put(id, completed);
    if (limiter.tryAcquire(clock.getAsLong(), completed)) {
      emit(id, completed, message, attrs, "running");
    }
  }

  @Override
  public void endStageOk(String id, Map<String, Object> attrs) {
    emit(id, completions.getOrDefault(id, 0L), "end", attrs, "ok");
  }

  @Override
  public void endStageError(String id, String errorSummary, Map<String, Object> attrs) {
    Map<String, Object> merged = new LinkedHashMap<>();
    if (attrs != null) merged.putAll(attrs);
    if (errorSummary != null) merged.put("error", errorSummary);
    emit(id, completions.getOrDefault(id, 0L), "error", merged, "error");
  }

  /** Payload written for one event. */
  protected Map<String, Object> createPayload(
      String id, long completed, String message, Map<String, Object> attrs, String status) {
    long total = totals.getOrDefault(id, 0L);
    long done = Math.max(0, total > 0 ? Math.min(completed, total) : completed);
    int percent = total > 0 ? (int) Math.min(100, Math.round(done * 100.0 / total)) : 0;
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("stageId", id);
    payload.put("label", labels.getOrDefault(id, id));
    payload.put("completed", done);
    payload.put("total", total);
    payload.put("percent", percent);
    payload.put("message", message);
    payload.put("attrs", attrs == null ? Map.of() : attrs);
    payload.put("status", status);
    return payload;
  }

  void emit(String id, long completed, String message, Map<String, Object> attrs, String status) {
    String json =
        JacksonUtility.toCompactJson(createPayload(id, completed, message, attrs, status));
    log.info("[crawl.progress] {}", json);
  }
}
