package com.gentoro.govdir.fetch;

import java.util.Objects;

/**
 * Structural predicate on the loaded markup: at least {@code minMatches} elements must match the
 * CSS {@code selector} before the page counts as loaded.
 */
public record ReadyCondition(String selector, int minMatches) {
  public ReadyCondition {
    Objects.requireNonNull(selector, "selector");
    if (selector.isBlank()) {
      throw new IllegalArgumentException("Ready selector must not be blank");
    }
    if (minMatches < 0) {
      throw new IllegalArgumentException("minMatches must be >= 0, got " + minMatches);
    }
  }

  public static ReadyCondition atLeastOne(String selector) {
    return new ReadyCondition(selector, 1);
  }

  /** Satisfied by any page, including one with an empty body. */
  public static ReadyCondition any() {
    return new ReadyCondition("html", 0);
  }

  @Override
  public String toString() {
    return selector + " >= " + minMatches;
  }
}
