package org.waabox.datafeed;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.datafeed.event.DatafeedListener;
import org.waabox.datafeed.event.ListenerRegistry;
import org.waabox.datafeed.metrics.DatafeedMetrics;
import org.waabox.datafeed.metrics.NoopDatafeedMetrics;
import org.waabox.datafeed.retry.Fault;
import org.waabox.datafeed.retry.Retrier;
import org.waabox.datafeed.retry.RetryAbortedException;
import org.waabox.datafeed.retry.RetryPolicy;
import org.waabox.datafeed.retry.Sleeper;
import org.waabox.datafeed.transport.AuthSession;
import org.waabox.datafeed.transport.DatafeedTransport;
import org.waabox.datafeed.transport.EventBatch;

/**
 * The datafeed consumption engine.
 *
 * <p>On the very first run the loop retrieves the feeds the bot can see.
 * Since a bot listens to a single feed, the first one is adopted; if there
 * is none, a new feed is created. The loop then long-polls that feed,
 * sending the ack id of the previous batch on every read, and hands each
 * non-empty batch to the subscribed {@link DatafeedListener listeners}
 * before issuing the next read.
 *
 * <p>Reads run under the {@link RetryPolicy}. A stale feed is recreated and
 * an expired auth session refreshed before the next attempt; both consume
 * an attempt of the same budget. Transient failures are retried with
 * backoff. Once the budget is exhausted, or on a non retryable failure,
 * {@link #start()} rethrows the error after deregistering every listener.
 *
 * <p>{@link #stop()} never interrupts a read in flight: it waits until the
 * current read and its dispatch complete. Waits between retry attempts, on
 * the other hand, end as soon as a stop is requested.
 *
 * <p>Usage example:
 * <pre>{@code
 * DatafeedLoop loop = DatafeedLoop.builder()
 *     .transport(datafeedTransport)
 *     .authSession(authSession)
 *     .retryPolicy(RetryPolicy.defaultPolicy())
 *     .botUsername("my-bot")
 *     .build();
 *
 * loop.subscribe(new DatafeedListener() {
 *   public void onMessageSent(Initiator initiator, JsonNode payload) {
 *     // ...
 *   }
 * });
 * loop.start(); // blocks until stopped
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DatafeedLoop {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(DatafeedLoop.class);

  /** The remote feed operations. */
  private final DatafeedTransport transport;

  /** The source of auth tokens. */
  private final AuthSession authSession;

  /** Acquires and replaces the feed. */
  private final FeedManager feedManager;

  /** The subscribed listeners. */
  private final ListenerRegistry registry;

  /** Runs every read. */
  private final Retrier retrier;

  /** The metrics reporter. */
  private final DatafeedMetrics metrics;

  /** The lifecycle state. */
  private final AtomicReference<LoopState> state =
      new AtomicReference<>(LoopState.IDLE);

  /**
   * Held for a whole read and dispatch, and while recreating the feed.
   * Fair, so a waiting {@link #recreateFeed()} runs before the next read.
   */
  private final ReentrantLock cycleLock = new ReentrantLock(true);

  /** Released once a stop is requested. */
  private final CountDownLatch stopSignal = new CountDownLatch(1);

  /** Released once the loop has terminated. */
  private final CountDownLatch terminated = new CountDownLatch(1);

  /** The current feed, only written by the loop. */
  private volatile FeedHandle feed;

  /** The thread running {@link #start()}. */
  private volatile Thread loopThread;

  /**
   * Creates a new loop, see {@link Builder}.
   *
   * @param theTransport   the remote feed operations, never null
   * @param theAuthSession the source of auth tokens, never null
   * @param theRetryPolicy the retry policy, never null
   * @param theMetrics     the metrics reporter, never null
   * @param botUsername    the bot username, may be null
   * @param theSleeper     the wait between attempts, null to wait on the
   *                       stop signal
   */
  private DatafeedLoop(final DatafeedTransport theTransport,
      final AuthSession theAuthSession,
      final RetryPolicy theRetryPolicy,
      final DatafeedMetrics theMetrics,
      final String botUsername,
      final Sleeper theSleeper) {
    transport = theTransport;
    authSession = theAuthSession;
    metrics = theMetrics;
    registry = new ListenerRegistry(theMetrics, botUsername);

    final Sleeper sleeper = theSleeper != null
        ? theSleeper
        : duration -> stopSignal.await(duration.toMillis(),
            TimeUnit.MILLISECONDS);
    retrier = new Retrier(theRetryPolicy, sleeper, this::isStopRequested);
    feedManager = new FeedManager(theTransport, theAuthSession, retrier);
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Runs the loop on the calling thread until it is stopped or fails.
   *
   * <p>Acquires the feed, then reads and dispatches batches until a stop
   * is observed. A stop requested before this method is called makes it
   * return without touching the feed.
   *
   * @throws IllegalStateException if the loop was already started
   * @throws RuntimeException      the error that terminated the loop,
   *                               unchanged, typically a
   *                               {@link org.waabox.datafeed.transport.TransportException}.
   *                               An {@link Error} is rethrown unchanged
   *                               too, after the same cleanup
   */
  public void start() {
    if (!state.compareAndSet(LoopState.IDLE, LoopState.STARTING)) {
      throw new IllegalStateException(
          "DatafeedLoop has already been started");
    }
    loopThread = Thread.currentThread();

    try {
      if (isStopRequested()) {
        log.info("Datafeed loop stopped before acquiring a feed");
        return;
      }

      final FeedHandle acquired = feedManager.acquire();
      cycleLock.lock();
      try {
        feed = acquired;
        state.set(LoopState.RUNNING);
      } finally {
        cycleLock.unlock();
      }
      metrics.feedAcquired(acquired.id());
      log.info("Datafeed loop started on datafeed '{}'", acquired.id());

      while (!isStopRequested()) {
        readAndDispatch();
      }
      state.set(LoopState.STOPPING);
      log.info("Datafeed loop observed stop request");

    } catch (final RetryAbortedException e) {
      log.info("Datafeed loop stopped while waiting to retry: {}",
          e.getCause().getMessage());

    } catch (final RuntimeException | Error e) {
      log.error("Datafeed loop terminated by {}: {}",
          e.getClass().getSimpleName(), e.getMessage(), e);
      registry.close();
      metrics.loopFailed(e);
      throw e;

    } finally {
      terminate();
    }
  }

  /**
   * Stops the loop and waits until it has terminated.
   *
   * <p>A read in flight is never interrupted: this method returns once
   * that read and the dispatch of its batch are complete, and no other read
   * is issued. Calling it from a listener, on the loop thread, only
   * requests the stop: the loop halts once the current batch is fully
   * dispatched.
   *
   * <p>This method is idempotent and may be called before {@link #start()}.
   */
  public void stop() {
    stopSignal.countDown();

    final LoopState current = state.get();
    if (current == LoopState.IDLE || current == LoopState.STOPPED) {
      return;
    }

    if (Thread.currentThread() == loopThread) {
      log.debug("Stop requested from the loop thread, stopping after the"
          + " current batch");
      return;
    }

    try {
      terminated.await();
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for the datafeed loop to stop");
    }
  }

  /**
   * Deletes the current feed and listens to a new one from an empty
   * cursor.
   *
   * <p>Meant for callers that monitor the feed health themselves. Runs
   * between two read cycles, so it may wait for the read in flight.
   *
   * @throws IllegalStateException if the loop is not running
   * @throws org.waabox.datafeed.transport.TransportException if the new feed
   *         cannot be created
   */
  public void recreateFeed() {
    requireRunning();
    cycleLock.lock();
    try {
      requireRunning();
      replaceFeed();
    } finally {
      cycleLock.unlock();
    }
  }

  /**
   * Subscribes a listener. Takes effect from the next batch.
   *
   * @param listener the listener, never null
   */
  public void subscribe(final DatafeedListener listener) {
    registry.subscribe(listener);
  }

  /**
   * Unsubscribes a listener. Takes effect from the next batch.
   *
   * @param listener the listener, never null
   *
   * @return true if the listener was subscribed
   */
  public boolean unsubscribe(final DatafeedListener listener) {
    return registry.unsubscribe(listener);
  }

  /**
   * Returns the lifecycle state.
   *
   * @return the state, never null
   */
  public LoopState state() {
    return state.get();
  }

  /**
   * Returns the feed currently listened to.
   *
   * @return the feed, empty unless the loop is running or stopping
   */
  public Optional<FeedHandle> currentFeed() {
    if (!state.get().holdsFeed()) {
      return Optional.empty();
    }
    return Optional.ofNullable(feed);
  }

  /**
   * Returns the number of subscribed listeners.
   *
   * @return the listener count
   */
  public int listenerCount() {
    return registry.size();
  }

  /** Runs one read and dispatches its batch. */
  private void readAndDispatch() {
    cycleLock.lock();
    try {
      final EventBatch batch = retrier.call("readDatafeed", this::read,
          this::recover);
      if (!batch.isEmpty()) {
        registry.dispatch(batch.events());
      }
    } finally {
      cycleLock.unlock();
    }
  }

  /**
   * Reads the next batch and stores its cursor before anything is
   * dispatched, so a failing listener never causes a redelivery.
   *
   * @return the batch, never null
   */
  private EventBatch read() {
    final FeedHandle current = feed;
    final EventBatch batch = transport.readFeed(authSession.tokens(),
        current.id(), current.cursor());
    feed = current.withCursor(batch.cursor());
    metrics.batchRead(current.id(), batch.events().size());
    log.debug("Read {} event(s) from datafeed '{}'", batch.events().size(),
        current.id());
    return batch;
  }

  /**
   * Runs the side effect of a recoverable read fault.
   *
   * @param fault the fault, never null
   * @param error the failure, never null
   *
   * @return true if the fault was handled
   */
  private boolean recover(final Fault fault, final Throwable error) {
    if (fault == Fault.STALE_FEED) {
      log.warn("Datafeed '{}' is stale: {}. Recreating it", feed.id(),
          error.getMessage());
      replaceFeed();
      return true;
    }
    if (fault == Fault.UNAUTHORIZED) {
      log.warn("Auth session rejected: {}. Refreshing it",
          error.getMessage());
      authSession.refresh();
      return true;
    }
    return false;
  }

  /** Swaps the current feed for a new one with an empty cursor. */
  private void replaceFeed() {
    final FeedHandle previous = feed;
    final FeedHandle next = feedManager.recreate(previous);
    feed = next;
    metrics.feedRecreated(previous.id(), next.id());
  }

  /** Moves the loop to its terminal state and releases stop waiters. */
  private void terminate() {
    cycleLock.lock();
    try {
      state.set(LoopState.STOPPED);
      feed = null;
    } finally {
      cycleLock.unlock();
      loopThread = null;
      terminated.countDown();
    }
    log.info("Datafeed loop stopped");
  }

  /**
   * Checks whether a stop was requested.
   *
   * @return true once {@link #stop()} has been called
   */
  private boolean isStopRequested() {
    return stopSignal.getCount() == 0;
  }

  /** Fails unless the loop is running. */
  private void requireRunning() {
    final LoopState current = state.get();
    if (current != LoopState.RUNNING) {
      throw new IllegalStateException(
          "Cannot recreate the datafeed of a loop in state " + current);
    }
  }

  /**
   * A fluent builder for {@link DatafeedLoop} instances.
   *
   * <p>The transport and the auth session are required. Defaults:
   * <ul>
   *   <li>retryPolicy: {@link RetryPolicy#defaultPolicy()}</li>
   *   <li>metrics: {@link NoopDatafeedMetrics}</li>
   *   <li>botUsername: none, every event is delivered</li>
   *   <li>sleeper: waits that end early on stop</li>
   * </ul>
   */
  public static final class Builder {

    /** The remote feed operations. */
    private DatafeedTransport transport;

    /** The source of auth tokens. */
    private AuthSession authSession;

    /** The optional retry policy. */
    private RetryPolicy retryPolicy;

    /** The optional metrics reporter. */
    private DatafeedMetrics metrics;

    /** The optional bot username. */
    private String botUsername;

    /** The optional wait strategy. */
    private Sleeper sleeper;

    /** Creates a new builder with default settings. */
    private Builder() {
    }

    /**
     * Sets the remote feed operations.
     *
     * @param theTransport the transport, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder transport(final DatafeedTransport theTransport) {
      transport = Objects.requireNonNull(theTransport,
          "transport must not be null");
      return this;
    }

    /**
     * Sets the source of auth tokens.
     *
     * @param theAuthSession the auth session, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder authSession(final AuthSession theAuthSession) {
      authSession = Objects.requireNonNull(theAuthSession,
          "authSession must not be null");
      return this;
    }

    /**
     * Sets the retry policy applied to every remote call.
     *
     * @param theRetryPolicy the retry policy, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder retryPolicy(final RetryPolicy theRetryPolicy) {
      retryPolicy = Objects.requireNonNull(theRetryPolicy,
          "retryPolicy must not be null");
      return this;
    }

    /**
     * Sets the metrics reporter.
     *
     * @param theMetrics the metrics reporter, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder metrics(final DatafeedMetrics theMetrics) {
      metrics = Objects.requireNonNull(theMetrics,
          "metrics must not be null");
      return this;
    }

    /**
     * Sets the username of the bot, so that listeners can ignore the
     * events the bot itself initiated.
     *
     * @param theBotUsername the username, never null or blank
     *
     * @return this builder for chaining, never null
     */
    public Builder botUsername(final String theBotUsername) {
      Objects.requireNonNull(theBotUsername, "botUsername must not be null");
      if (theBotUsername.isBlank()) {
        throw new IllegalArgumentException("botUsername must not be blank");
      }
      botUsername = theBotUsername;
      return this;
    }

    /**
     * Sets the wait strategy between retry attempts.
     *
     * @param theSleeper the sleeper, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder sleeper(final Sleeper theSleeper) {
      sleeper = Objects.requireNonNull(theSleeper,
          "sleeper must not be null");
      return this;
    }

    /**
     * Builds the loop.
     *
     * @return a new idle loop, never null
     *
     * @throws NullPointerException if the transport or the auth session is
     *                              missing
     */
    public DatafeedLoop build() {
      Objects.requireNonNull(transport, "transport must be set");
      Objects.requireNonNull(authSession, "authSession must be set");

      final RetryPolicy resolvedRetry = retryPolicy != null
          ? retryPolicy : RetryPolicy.defaultPolicy();
      final DatafeedMetrics resolvedMetrics = metrics != null
          ? metrics : new NoopDatafeedMetrics();

      return new DatafeedLoop(transport, authSession, resolvedRetry,
          resolvedMetrics, botUsername, sleeper);
    }
  }
}
