package com.gentoro.govdir.fetch;

import java.util.Objects;

/**
 * A navigation target: the URL to load, the condition that tells when it is loaded, and a short
 * label used in logs and the failure log.
 */
public record FetchTarget(String url, ReadyCondition readyCondition, String label) {
  public FetchTarget {
    Objects.requireNonNull(url, "url");
    Objects.requireNonNull(readyCondition, "readyCondition");
    if (url.isBlank()) {
      throw new IllegalArgumentException("Fetch target URL must not be blank");
    }
    label = label == null || label.isBlank() ? url : label;
  }

  public static FetchTarget of(String url, ReadyCondition readyCondition) {
    return new FetchTarget(url, readyCondition, url);
  }
}
