package org.waabox.datafeed.event;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.datafeed.metrics.DatafeedMetrics;

/**
 * Holds the subscribed {@link DatafeedListener listeners} and delivers event
 * batches to them.
 *
 * <p>Delivery walks the batch in order and, for each event, the listeners
 * in subscription order. The listener list is snapshotted when a batch
 * starts, so subscribing or unsubscribing while a batch is being delivered
 * takes effect from the next batch.
 *
 * <p>Listener failures are isolated: they are logged and reported to the
 * metrics, and delivery continues with the next listener and event.
 *
 * <p>Thread safety: this class is thread-safe. The listener list uses
 * {@link CopyOnWriteArrayList}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ListenerRegistry {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(ListenerRegistry.class);

  /** Registered listeners, in subscription order. */
  private final List<DatafeedListener> listeners =
      new CopyOnWriteArrayList<>();

  /** The metrics reporter, never null. */
  private final DatafeedMetrics metrics;

  /** The username of the bot, used to filter its own events. */
  private final String botUsername;

  /**
   * Creates a new registry.
   *
   * @param theMetrics     the metrics reporter, never null
   * @param theBotUsername the username of the bot, may be null to accept
   *                       every event
   */
  public ListenerRegistry(final DatafeedMetrics theMetrics,
      final String theBotUsername) {
    metrics = Objects.requireNonNull(theMetrics, "metrics cannot be null");
    botUsername = theBotUsername;
  }

  /**
   * Adds a listener at the end of the delivery order.
   *
   * @param listener the listener to add, never null
   */
  public void subscribe(final DatafeedListener listener) {
    Objects.requireNonNull(listener, "listener cannot be null");
    listeners.add(listener);
  }

  /**
   * Removes a listener.
   *
   * @param listener the listener to remove, never null
   *
   * @return true if the listener was subscribed
   */
  public boolean unsubscribe(final DatafeedListener listener) {
    Objects.requireNonNull(listener, "listener cannot be null");
    return listeners.remove(listener);
  }

  /**
   * Delivers a batch of events to the subscribed listeners.
   *
   * @param events the events in server order, never null
   */
  public void dispatch(final List<DatafeedEvent> events) {
    Objects.requireNonNull(events, "events cannot be null");

    final List<DatafeedListener> snapshot = List.copyOf(listeners);

    for (final DatafeedEvent event : events) {
      final Optional<EventType> type = event.eventType();
      if (type.isEmpty()) {
        log.debug("Skipping event '{}' of unsupported type '{}'",
            event.id(), event.type());
        continue;
      }
      for (final DatafeedListener listener : snapshot) {
        deliver(listener, type.get(), event);
      }
    }
  }

  /**
   * Removes every listener.
   *
   * <p>Used when the loop dies, so that no listener stays registered
   * against a loop that will not deliver anything else.
   */
  public void close() {
    final int count = listeners.size();
    listeners.clear();
    log.info("Deregistered {} datafeed listener(s)", count);
  }

  /**
   * Returns the number of subscribed listeners.
   *
   * @return the listener count
   */
  public int size() {
    return listeners.size();
  }

  /**
   * Hands an event to a single listener, containing its exceptions. Errors
   * propagate to the loop.
   *
   * @param listener the listener, never null
   * @param type     the resolved event type, never null
   * @param event    the event, never null
   */
  private void deliver(final DatafeedListener listener, final EventType type,
      final DatafeedEvent event) {
    try {
      if (!listener.isAcceptingEvent(event, botUsername)) {
        return;
      }
      type.dispatch(listener, event);
    } catch (final Exception e) {
      log.error("Listener {} threw exception for {} event '{}': {}",
          listener.getClass().getName(), type, event.id(), e.getMessage(), e);
      metrics.listenerFailed(type.name(), e);
    }
  }
}
