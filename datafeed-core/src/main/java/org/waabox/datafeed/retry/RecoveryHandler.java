package org.waabox.datafeed.retry;

/**
 * Runs the side effect a {@link Fault} requires before the next attempt,
 * such as recreating a stale feed or refreshing the auth session.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface RecoveryHandler {

  /** A handler that recovers from nothing. */
  RecoveryHandler NONE = (fault, error) -> false;

  /**
   * Attempts to recover from the given fault.
   *
   * @param fault the fault, one that {@link Fault#requiresRecovery()},
   *              never null
   * @param error the failure that was classified, never null
   *
   * @return true if the fault was handled and retrying makes sense, false
   *         if this handler does not know how to recover from it
   */
  boolean recover(Fault fault, Throwable error);
}
