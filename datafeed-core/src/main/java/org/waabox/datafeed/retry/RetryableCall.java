package org.waabox.datafeed.retry;

/**
 * A single attempt of an operation run by a {@link Retrier}.
 *
 * <p>Each invocation is a fresh attempt: implementations fetch whatever
 * they need, auth tokens included, inside {@link #call()}.
 *
 * @param <T> the result type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface RetryableCall<T> {

  /**
   * Runs one attempt.
   *
   * @return the result of the attempt, may be null
   */
  T call();
}
