package org.waabox.datafeed.retry;

import org.waabox.datafeed.transport.TransportException;

/**
 * The default {@link FaultClassifier}, driven by the status carried by a
 * {@link TransportException}.
 *
 * <ul>
 *   <li>400: {@link Fault#STALE_FEED}</li>
 *   <li>401: {@link Fault#UNAUTHORIZED}</li>
 *   <li>0 (no response), 429 and 5xx: {@link Fault#TRANSIENT}</li>
 *   <li>any other status: {@link Fault#FATAL}</li>
 *   <li>anything that is not a transport error: {@link Fault#UNEXPECTED}</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DefaultFaultClassifier implements FaultClassifier {

  /** The shared instance, the classifier holds no state. */
  public static final DefaultFaultClassifier INSTANCE =
      new DefaultFaultClassifier();

  /** Status reported by the server for a stale or unknown feed. */
  private static final int BAD_REQUEST = 400;

  /** Status reported when the session or key manager token expired. */
  private static final int UNAUTHORIZED = 401;

  /** Status reported when the caller is throttled. */
  private static final int TOO_MANY_REQUESTS = 429;

  /** Private constructor, use {@link #INSTANCE}. */
  private DefaultFaultClassifier() {
  }

  /** {@inheritDoc} */
  @Override
  public Fault classify(final Throwable error) {
    if (!(error instanceof TransportException)) {
      return Fault.UNEXPECTED;
    }
    final int status = ((TransportException) error).status();

    if (status == BAD_REQUEST) {
      return Fault.STALE_FEED;
    }
    if (status == UNAUTHORIZED) {
      return Fault.UNAUTHORIZED;
    }
    if (status == TransportException.NO_RESPONSE
        || status == TOO_MANY_REQUESTS
        || (status >= 500 && status < 600)) {
      return Fault.TRANSIENT;
    }
    return Fault.FATAL;
  }
}
