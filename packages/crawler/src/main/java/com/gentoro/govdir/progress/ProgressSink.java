package com.gentoro.govdir.progress;

import java.util.Map;

/**
 * Receives crawl progress events. Each crawl phase is one stage.
 *
 * <p>Implementations must be cheap and non-blocking and apply their own rate limiting; the
 * pipeline reports every step.
 */
public interface ProgressSink {

  /**
   * @param id stable stage identifier, e.g. "faq", "agency_directory", "ministries"
   * @param label human-readable label
   * @param totalWork expected work units, or 0 when not known up front
   */
  void beginStage(String id, String label, long totalWork);

  /**
   * @param completed work units done so far
   * @param message what just happened, e.g. the artifact key that was processed
   * @param attrs optional structured attributes
   */
  void step(String id, long completed, String message, Map<String, Object> attrs);

  void endStageOk(String id, Map<String, Object> attrs);

  void endStageError(String id, String errorSummary, Map<String, Object> attrs);
}
