package org.waabox.datafeed.retry;

import org.waabox.datafeed.DatafeedException;

/**
 * Raised by the {@link Retrier} when its abort signal is raised between two
 * attempts, typically because the datafeed loop is being stopped.
 *
 * <p>The last failure of the abandoned sequence is kept as the cause.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RetryAbortedException extends DatafeedException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception.
   *
   * @param operation the name of the abandoned operation, cannot be null.
   * @param cause the last failure of the sequence, cannot be null.
   */
  public RetryAbortedException(final String operation,
      final Throwable cause) {
    super("Retries of '" + operation + "' aborted", cause);
  }
}
