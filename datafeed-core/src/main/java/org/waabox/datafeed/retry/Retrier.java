package org.waabox.datafeed.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.function.BooleanSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.datafeed.DatafeedException;

/**
 * Runs an operation under a {@link RetryPolicy}.
 *
 * <p>After each failed attempt the policy is consulted. Faults that require
 * recovery ({@link Fault#STALE_FEED}, {@link Fault#UNAUTHORIZED}) run their
 * {@link RecoveryHandler} side effect first, even when the attempt budget is
 * already spent, and that recovery counts as part of the failed attempt: it
 * never resets the attempt counter. Failures are rethrown unchanged once the
 * policy gives up, so callers see the original transport error.
 *
 * <p>Waits between attempts go through a {@link Sleeper}. An abort signal
 * is checked around every wait; once raised, the sequence ends with a
 * {@link RetryAbortedException}.
 *
 * <p>This class is thread-safe as long as its collaborators are.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Retrier {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(Retrier.class);

  /** The policy consulted after each failure. */
  private final RetryPolicy policy;

  /** The wait strategy between attempts. */
  private final Sleeper sleeper;

  /** Raised when pending retries must be abandoned. */
  private final BooleanSupplier abortSignal;

  /**
   * Creates a new retrier.
   *
   * @param thePolicy      the retry policy, never null
   * @param theSleeper     the wait strategy, never null
   * @param theAbortSignal tells whether pending retries must be abandoned,
   *                       never null
   */
  public Retrier(final RetryPolicy thePolicy, final Sleeper theSleeper,
      final BooleanSupplier theAbortSignal) {
    policy = Objects.requireNonNull(thePolicy, "policy cannot be null");
    sleeper = Objects.requireNonNull(theSleeper, "sleeper cannot be null");
    abortSignal = Objects.requireNonNull(theAbortSignal,
        "abortSignal cannot be null");
  }

  /**
   * Creates a retrier that sleeps the current thread and never aborts.
   *
   * @param thePolicy the retry policy, never null
   */
  public Retrier(final RetryPolicy thePolicy) {
    this(thePolicy, Sleeper.THREAD, () -> false);
  }

  /**
   * Runs the call without any recovery handler.
   *
   * @param operation the operation name used for logging, never null
   * @param call      the attempt to run, never null
   * @param <T>       the result type
   *
   * @return the result of the first successful attempt
   */
  public <T> T call(final String operation, final RetryableCall<T> call) {
    return call(operation, call, RecoveryHandler.NONE);
  }

  /**
   * Runs the call until it succeeds or the policy gives up.
   *
   * @param operation the operation name used for logging, never null
   * @param call      the attempt to run, never null
   * @param recovery  the side effects for recoverable faults, never null
   * @param <T>       the result type
   *
   * @return the result of the first successful attempt
   *
   * @throws RuntimeException the failure of the last attempt, unchanged
   * @throws RetryAbortedException if the abort signal was raised between
   *                               two attempts
   */
  public <T> T call(final String operation, final RetryableCall<T> call,
      final RecoveryHandler recovery) {
    Objects.requireNonNull(operation, "operation cannot be null");
    Objects.requireNonNull(call, "call cannot be null");
    Objects.requireNonNull(recovery, "recovery cannot be null");

    for (int attempt = 1; ; attempt++) {
      try {
        return call.call();
      } catch (final RuntimeException e) {
        final RetryDecision decision = policy.decide(attempt, e);
        final Fault fault = decision.fault();

        if (fault == Fault.UNEXPECTED) {
          throw e;
        }

        if (fault.requiresRecovery() && !recovery.recover(fault, e)) {
          log.warn("'{}': no recovery available for {} fault: {}",
              operation, fault, e.getMessage());
          throw e;
        }

        if (!decision.retry()) {
          log.error("'{}': giving up after attempt {}/{} with {} fault: {}",
              operation, attempt, limit(), fault, e.getMessage());
          throw e;
        }

        log.warn("'{}': attempt {}/{} failed with {} fault: {}."
            + " Retrying in {} ms", operation, attempt, limit(), fault,
            e.getMessage(), decision.delay().toMillis());

        waitBeforeRetry(operation, decision.delay(), e);
      }
    }
  }

  /**
   * Returns the policy this retrier consults.
   *
   * @return the retry policy, never null
   */
  public RetryPolicy policy() {
    return policy;
  }

  /**
   * Waits for the given delay unless the abort signal is raised.
   *
   * @param operation the operation name, never null
   * @param delay     the wait, never null
   * @param lastError the failure that triggered the wait, never null
   */
  private void waitBeforeRetry(final String operation, final Duration delay,
      final RuntimeException lastError) {
    if (abortSignal.getAsBoolean()) {
      throw new RetryAbortedException(operation, lastError);
    }
    try {
      sleeper.sleep(delay);
    } catch (final InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new DatafeedException(
          "Interrupted while waiting to retry '" + operation + "'", ie);
    }
    if (abortSignal.getAsBoolean()) {
      throw new RetryAbortedException(operation, lastError);
    }
  }

  /** Renders the attempt limit for log messages.
   *
   * @return the limit, never null.
   */
  private String limit() {
    return policy.unbounded() ? "unbounded"
        : String.valueOf(policy.maxAttempts());
  }
}
