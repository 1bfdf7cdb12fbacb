package org.waabox.datafeed.transport;

/**
 * A failure reported by a {@link DatafeedTransport} or an
 * {@link AuthSession}.
 *
 * <p>The status is the HTTP status of the failed call, or
 * {@link #NO_RESPONSE} when no response was received at all (connection
 * refused, timeout, reset). Retry decisions are driven by this status.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class TransportException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Status used when the call never got a response. */
  public static final int NO_RESPONSE = 0;

  /** The status of the failed call. */
  private final int status;

  /** Creates a new exception.
   *
   * @param theStatus the status of the failed call.
   * @param message the detail message, cannot be null.
   */
  public TransportException(final int theStatus, final String message) {
    super(message);
    status = theStatus;
  }

  /** Creates a new exception.
   *
   * @param theStatus the status of the failed call.
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public TransportException(final int theStatus, final String message,
      final Throwable cause) {
    super(message, cause);
    status = theStatus;
  }

  /**
   * Returns the status of the failed call.
   *
   * @return the HTTP status, or {@link #NO_RESPONSE}
   */
  public int status() {
    return status;
  }

  /** {@inheritDoc} */
  @Override
  public String getMessage() {
    return "[" + status + "] " + super.getMessage();
  }
}
