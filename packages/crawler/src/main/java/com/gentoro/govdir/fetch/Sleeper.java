package com.gentoro.govdir.fetch;

/** Blocking wait used for pacing and backoff; replaced with a recorder in tests. */
@FunctionalInterface
public interface Sleeper {
  Sleeper SYSTEM = Thread::sleep;

  void sleep(long millis) throws InterruptedException;
}
