package org.waabox.datafeed.metrics;

/**
 * A no-operation implementation of {@link DatafeedMetrics}.
 *
 * <p>All methods in this class are intentionally empty. Use this
 * implementation when metrics collection is not required or during
 * testing.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopDatafeedMetrics implements DatafeedMetrics {

  /** {@inheritDoc} */
  @Override
  public void feedAcquired(final String feedId) {
  }

  /** {@inheritDoc} */
  @Override
  public void feedRecreated(final String previousFeedId,
      final String newFeedId) {
  }

  /** {@inheritDoc} */
  @Override
  public void batchRead(final String feedId, final int eventCount) {
  }

  /** {@inheritDoc} */
  @Override
  public void listenerFailed(final String eventType, final Throwable cause) {
  }

  /** {@inheritDoc} */
  @Override
  public void loopFailed(final Throwable cause) {
  }
}
