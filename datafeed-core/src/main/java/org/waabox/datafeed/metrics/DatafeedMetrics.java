package org.waabox.datafeed.metrics;

/**
 * An abstraction for recording operational metrics of the datafeed loop.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer, Prometheus, or Datadog. Use {@link NoopDatafeedMetrics}
 * when metrics collection is not required.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface DatafeedMetrics {

  /**
   * Records that the loop adopted or created its feed at startup.
   *
   * @param feedId the feed identifier, never null
   */
  void feedAcquired(String feedId);

  /**
   * Records that a feed was replaced by a new one.
   *
   * @param previousFeedId the discarded feed, never null
   * @param newFeedId      the new feed, never null
   */
  void feedRecreated(String previousFeedId, String newFeedId);

  /**
   * Records a successful read.
   *
   * @param feedId     the feed that was read, never null
   * @param eventCount the number of events in the batch, may be zero
   */
  void batchRead(String feedId, int eventCount);

  /**
   * Records a listener that failed while handling an event.
   *
   * @param eventType the type of the event being handled, never null
   * @param cause     the failure, never null
   */
  void listenerFailed(String eventType, Throwable cause);

  /**
   * Records that the loop terminated because of an error.
   *
   * @param cause the error that ended the loop, never null
   */
  void loopFailed(Throwable cause);
}
