package org.waabox.datafeed;

/**
 * Base exception for datafeed library failures that are not transport
 * errors, such as an interrupted wait.
 *
 * <p>This is an unchecked exception intended to wrap infrastructure and
 * lifecycle failures that cannot be meaningfully recovered from at the call
 * site.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class DatafeedException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public DatafeedException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public DatafeedException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
