package org.waabox.datafeed.transport;

import java.util.List;

import org.waabox.datafeed.FeedHandle;

/**
 * The four remote feed operations the consumer depends on.
 *
 * <p>Implementations own the wire details (HTTP client, TLS, proxies,
 * payload serialization). Every failure is reported as a
 * {@link TransportException} carrying the status of the failed call.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface DatafeedTransport {

  /**
   * Lists the feeds visible to the authenticated identity, in the order
   * the backing service returns them.
   *
   * @param tokens the auth material, never null
   *
   * @return the feeds, never null, may be empty
   */
  List<FeedHandle> listFeeds(AuthTokens tokens);

  /**
   * Creates a new feed.
   *
   * @param tokens the auth material, never null
   *
   * @return the created feed, never null
   */
  FeedHandle createFeed(AuthTokens tokens);

  /**
   * Deletes a feed.
   *
   * @param tokens the auth material, never null
   * @param feedId the feed to delete, never null
   */
  void deleteFeed(AuthTokens tokens, String feedId);

  /**
   * Reads the next batch of events, long-polling until events are
   * available or the server answers with an empty batch.
   *
   * @param tokens the auth material, never null
   * @param feedId the feed to read, never null
   * @param cursor the ack id of the last acknowledged batch, empty on the
   *               first read, never null
   *
   * @return the batch with the next cursor, never null
   */
  EventBatch readFeed(AuthTokens tokens, String feedId, String cursor);
}
