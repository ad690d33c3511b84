package com.codeheadsystems.netdash.client.manager;

import java.time.Duration;

/**
 * Blocks the calling thread between retry attempts.  Replaced in tests so backoff schedules can
 * be checked without waiting.
 */
@FunctionalInterface
public interface Sleeper {

  Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

  /**
   * Sleeps for the given duration.
   *
   * @param duration the duration
   * @throws InterruptedException if interrupted while sleeping
   */
  void sleep(Duration duration) throws InterruptedException;
}
