package org.waabox.datafeed;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.datafeed.retry.Fault;
import org.waabox.datafeed.retry.Retrier;
import org.waabox.datafeed.transport.AuthSession;
import org.waabox.datafeed.transport.DatafeedTransport;
import org.waabox.datafeed.transport.TransportException;

/**
 * Creates, looks up and discards the server-side feed of a bot.
 *
 * <p>A bot listens to a single feed. On startup the first feed returned by
 * the backing service is adopted; a new one is created only when none
 * exists. Every remote call runs under the {@link Retrier} and fetches the
 * auth tokens inside each attempt. An unauthorized response refreshes the
 * auth session before the next attempt.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FeedManager {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(FeedManager.class);

  /** The remote feed operations. */
  private final DatafeedTransport transport;

  /** The source of auth tokens. */
  private final AuthSession authSession;

  /** Runs every remote call. */
  private final Retrier retrier;

  /**
   * Creates a new feed manager.
   *
   * @param theTransport   the remote feed operations, never null
   * @param theAuthSession the source of auth tokens, never null
   * @param theRetrier     runs every remote call, never null
   */
  public FeedManager(final DatafeedTransport theTransport,
      final AuthSession theAuthSession, final Retrier theRetrier) {
    transport = Objects.requireNonNull(theTransport,
        "transport cannot be null");
    authSession = Objects.requireNonNull(theAuthSession,
        "authSession cannot be null");
    retrier = Objects.requireNonNull(theRetrier, "retrier cannot be null");
  }

  /**
   * Returns the feed the bot should listen to.
   *
   * <p>Adopts the first existing feed, positioned at an empty cursor
   * whatever position the server remembers, or creates a new feed if there
   * is none.
   *
   * @return the feed with an empty cursor, never null
   *
   * @throws TransportException if the remote calls exhaust the retry policy
   */
  public FeedHandle acquire() {
    final List<FeedHandle> feeds = retrier.call("listDatafeeds",
        () -> transport.listFeeds(authSession.tokens()),
        this::recoverAuth);

    if (feeds != null && !feeds.isEmpty()) {
      final FeedHandle adopted = FeedHandle.fresh(feeds.get(0).id());
      log.info("Adopting existing datafeed '{}' ({} visible)",
          adopted.id(), feeds.size());
      return adopted;
    }

    final FeedHandle created = create();
    log.info("No datafeed found, created datafeed '{}'", created.id());
    return created;
  }

  /**
   * Replaces a feed with a new one.
   *
   * <p>Deleting the old feed is best effort: once its retries are
   * exhausted the transport failure is logged and the new feed is created
   * anyway.
   *
   * @param old the feed to discard, never null
   *
   * @return the new feed with an empty cursor, never null
   *
   * @throws TransportException if creating the new feed exhausts the retry
   *                            policy
   */
  public FeedHandle recreate(final FeedHandle old) {
    Objects.requireNonNull(old, "old feed cannot be null");

    try {
      delete(old);
    } catch (final TransportException e) {
      log.warn("Could not delete datafeed '{}', creating a new one anyway:"
          + " {}", old.id(), e.getMessage());
    }

    final FeedHandle created = create();
    log.info("Datafeed '{}' recreated as '{}'", old.id(), created.id());
    return created;
  }

  /**
   * Deletes a feed.
   *
   * @param feed the feed to delete, never null
   *
   * @throws TransportException if the deletion exhausts the retry policy
   */
  public void delete(final FeedHandle feed) {
    Objects.requireNonNull(feed, "feed cannot be null");
    retrier.call("deleteDatafeed", () -> {
      transport.deleteFeed(authSession.tokens(), feed.id());
      return null;
    }, this::recoverAuth);
    log.debug("Deleted datafeed '{}'", feed.id());
  }

  /**
   * Creates a new feed.
   *
   * @return the new feed with an empty cursor, never null
   */
  private FeedHandle create() {
    final FeedHandle created = retrier.call("createDatafeed",
        () -> transport.createFeed(authSession.tokens()),
        this::recoverAuth);
    return FeedHandle.fresh(created.id());
  }

  /**
   * Refreshes the auth session on unauthorized responses.
   *
   * @param fault the fault, never null
   * @param error the failure, never null
   *
   * @return true if the fault was an unauthorized response
   */
  private boolean recoverAuth(final Fault fault, final Throwable error) {
    if (fault != Fault.UNAUTHORIZED) {
      return false;
    }
    log.warn("Auth session rejected: {}. Refreshing it",
        error.getMessage());
    authSession.refresh();
    return true;
  }
}
