package org.waabox.datafeed;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;

import org.waabox.datafeed.event.DatafeedEvent;
import org.waabox.datafeed.transport.AuthTokens;
import org.waabox.datafeed.transport.DatafeedTransport;
import org.waabox.datafeed.transport.EventBatch;
import org.waabox.datafeed.transport.TransportException;

/**
 * A {@link DatafeedTransport} that answers reads from a script.
 *
 * <p>Created feeds are named {@code feed-1}, {@code feed-2}... Reads are
 * recorded as {@code feedId@cursor}. Once the script is exhausted the
 * transport runs the exhaustion hook, typically a loop stop, and answers
 * empty batches.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class ScriptedTransport implements DatafeedTransport {

  /** One scripted read. */
  @FunctionalInterface
  interface Step {

    /** Answers a read.
     *
     * @param feedId the feed being read.
     * @param cursor the cursor sent.
     * @return the batch.
     */
    EventBatch read(String feedId, String cursor);
  }

  /** The feeds returned by listFeeds. */
  private final List<FeedHandle> existing;

  /** The pending reads. */
  private final Deque<Step> steps = new ConcurrentLinkedDeque<>();

  /** Every read, as feedId@cursor. */
  final List<String> reads = Collections.synchronizedList(new ArrayList<>());

  /** Ids of the created feeds. */
  final List<String> created = Collections.synchronizedList(new ArrayList<>());

  /** Ids of the deleted feeds. */
  final List<String> deleted = Collections.synchronizedList(new ArrayList<>());

  /** Number of listFeeds calls. */
  final AtomicInteger listCalls = new AtomicInteger();

  /** Reads currently running. */
  private final AtomicInteger inFlight = new AtomicInteger();

  /** The highest number of reads seen running at once. */
  final AtomicInteger maxInFlight = new AtomicInteger();

  /** Runs when a read finds the script empty. */
  private volatile Runnable onExhausted = () -> { };

  ScriptedTransport(final FeedHandle... theExisting) {
    existing = List.of(theExisting);
  }

  ScriptedTransport then(final Step step) {
    steps.add(step);
    return this;
  }

  ScriptedTransport thenBatch(final String cursor,
      final DatafeedEvent... events) {
    return then((feedId, sent) -> new EventBatch(cursor, List.of(events)));
  }

  ScriptedTransport thenFail(final int status) {
    return then((feedId, sent) -> {
      throw new TransportException(status, "scripted failure");
    });
  }

  ScriptedTransport thenThrow(final RuntimeException error) {
    return then((feedId, sent) -> {
      throw error;
    });
  }

  void whenExhausted(final Runnable hook) {
    onExhausted = hook;
  }

  @Override
  public List<FeedHandle> listFeeds(final AuthTokens tokens) {
    listCalls.incrementAndGet();
    return existing;
  }

  @Override
  public FeedHandle createFeed(final AuthTokens tokens) {
    final String id = "feed-" + (created.size() + 1);
    created.add(id);
    return FeedHandle.fresh(id);
  }

  @Override
  public void deleteFeed(final AuthTokens tokens, final String feedId) {
    deleted.add(feedId);
  }

  @Override
  public EventBatch readFeed(final AuthTokens tokens, final String feedId,
      final String cursor) {
    maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
    try {
      reads.add(feedId + "@" + cursor);
      final Step step = steps.poll();
      if (step == null) {
        onExhausted.run();
        return new EventBatch(cursor, List.of());
      }
      return step.read(feedId, cursor);
    } finally {
      inFlight.decrementAndGet();
    }
  }
}
