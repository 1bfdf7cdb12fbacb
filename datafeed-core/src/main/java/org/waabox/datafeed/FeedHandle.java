package org.waabox.datafeed;

import java.util.Objects;

/**
 * A server-side feed and the position of the consumer within it.
 *
 * <p>The cursor is the opaque ack id issued by the server with each batch;
 * it is empty until the first successful read. Handles are immutable: a
 * read produces a copy with the new cursor and a recovery produces a brand
 * new handle.
 *
 * @param id     the feed identifier, never null
 * @param cursor the ack id of the last read batch, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record FeedHandle(String id, String cursor) {

  /** The cursor of a feed that was never read. */
  public static final String INITIAL_CURSOR = "";

  /** Validates the components. */
  public FeedHandle {
    Objects.requireNonNull(id, "id cannot be null");
    Objects.requireNonNull(cursor, "cursor cannot be null");
  }

  /**
   * Creates a handle positioned at the start of the given feed.
   *
   * @param id the feed identifier, never null
   *
   * @return a handle with an empty cursor, never null
   */
  public static FeedHandle fresh(final String id) {
    return new FeedHandle(id, INITIAL_CURSOR);
  }

  /**
   * Returns a copy of this handle at the given position.
   *
   * @param newCursor the ack id returned by the last read, never null
   *
   * @return the advanced handle, never null
   */
  public FeedHandle withCursor(final String newCursor) {
    return new FeedHandle(id, newCursor);
  }
}
