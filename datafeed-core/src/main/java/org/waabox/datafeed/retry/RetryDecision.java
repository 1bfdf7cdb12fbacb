package org.waabox.datafeed.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * The outcome of consulting a {@link RetryPolicy} after a failed attempt.
 *
 * @param fault the classification of the failure, never null
 * @param retry whether another attempt should follow
 * @param delay how long to wait before the next attempt, {@link Duration#ZERO}
 *              when giving up, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record RetryDecision(Fault fault, boolean retry, Duration delay) {

  /** Validates the components. */
  public RetryDecision {
    Objects.requireNonNull(fault, "fault cannot be null");
    Objects.requireNonNull(delay, "delay cannot be null");
  }

  /**
   * Creates a decision to retry after the given delay.
   *
   * @param fault the fault that caused the retry, never null
   * @param delay the wait before the next attempt, never null
   *
   * @return the decision, never null
   */
  public static RetryDecision retryAfter(final Fault fault,
      final Duration delay) {
    return new RetryDecision(fault, true, delay);
  }

  /**
   * Creates a decision to stop retrying.
   *
   * @param fault the fault that ends the retry sequence, never null
   *
   * @return the decision, never null
   */
  public static RetryDecision giveUp(final Fault fault) {
    return new RetryDecision(fault, false, Duration.ZERO);
  }
}
