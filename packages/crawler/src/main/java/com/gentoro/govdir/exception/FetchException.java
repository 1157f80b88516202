package com.gentoro.govdir.exception;

import com.gentoro.govdir.fetch.FetchSignal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A page could not be fetched. The {@link FetchSignal} tells the governor whether the failure
 * looks like rate limiting or bot detection.
 */
public class FetchException extends GovDirException {
  private final FetchSignal signal;

  public FetchException(FetchSignal signal, String message) {
    super(GovDirErrorCode.FETCH_FAILED, message, Map.of("signal", signal));
    this.signal = Objects.requireNonNull(signal, "signal");
  }

  public FetchException(FetchSignal signal, String message, Throwable cause) {
    super(GovDirErrorCode.FETCH_FAILED, message, Map.of("signal", signal), cause);
    this.signal = Objects.requireNonNull(signal, "signal");
  }

  public FetchException(FetchSignal signal, String message, Map<String, ?> context) {
    super(GovDirErrorCode.FETCH_FAILED, message, withSignal(context, signal));
    this.signal = Objects.requireNonNull(signal, "signal");
  }

  public FetchException(
      FetchSignal signal, String message, Map<String, ?> context, Throwable cause) {
    super(GovDirErrorCode.FETCH_FAILED, message, withSignal(context, signal), cause);
    this.signal = Objects.requireNonNull(signal, "signal");
  }

  public FetchSignal getSignal() {
    return signal;
  }

  private static Map<String, Object> withSignal(Map<String, ?> context, FetchSignal signal) {
    Map<String, Object> m = new LinkedHashMap<>();
    if (context != null) m.putAll(context);
    m.put("signal", signal);
    return m;
  }
}
