package org.waabox.datafeed.retry;

import java.time.Duration;

/**
 * Waits between two attempts.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface Sleeper {

  /** Sleeps the current thread. */
  Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

  /**
   * Waits for the given duration. Implementations may return early.
   *
   * @param duration the wait, never null
   *
   * @throws InterruptedException if the waiting thread is interrupted
   */
  void sleep(Duration duration) throws InterruptedException;
}
