package org.waabox.datafeed.retry;

/**
 * The classification of a single failed attempt.
 *
 * <p>The fault tells the {@link Retrier} whether another attempt makes sense
 * and whether a recovery side effect must run before it.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum Fault {

  /** The server no longer considers the feed valid; recreate and retry. */
  STALE_FEED(true, true),

  /** The auth session expired; refresh it and retry. */
  UNAUTHORIZED(true, true),

  /** Network failures, timeouts, throttling and server errors. */
  TRANSIENT(true, false),

  /** A transport error with a non retryable status. */
  FATAL(false, false),

  /** Anything outside the transport error taxonomy, a defect. */
  UNEXPECTED(false, false);

  /** Whether the fault can be retried at all. */
  private final boolean retryable;

  /** Whether a recovery action must run before the next attempt. */
  private final boolean requiresRecovery;

  /** Creates a new fault.
   *
   * @param isRetryable whether the fault can be retried.
   * @param needsRecovery whether a recovery side effect is required.
   */
  Fault(final boolean isRetryable, final boolean needsRecovery) {
    retryable = isRetryable;
    requiresRecovery = needsRecovery;
  }

  /**
   * Returns whether another attempt may follow this fault.
   *
   * @return true for retryable faults
   */
  public boolean retryable() {
    return retryable;
  }

  /**
   * Returns whether a recovery side effect must run before the next attempt.
   *
   * @return true for {@link #STALE_FEED} and {@link #UNAUTHORIZED}
   */
  public boolean requiresRecovery() {
    return requiresRecovery;
  }
}
