package org.waabox.datafeed.transport;

import java.util.List;
import java.util.Objects;

import org.waabox.datafeed.event.DatafeedEvent;

/**
 * The result of one datafeed read.
 *
 * @param cursor the ack id to send on the next read, never null
 * @param events the decoded events in server order, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record EventBatch(String cursor, List<DatafeedEvent> events) {

  /** Validates the components and copies the event list. */
  public EventBatch {
    Objects.requireNonNull(cursor, "cursor cannot be null");
    events = events == null ? List.of() : List.copyOf(events);
  }

  /**
   * Returns whether the batch carries no event.
   *
   * @return true if there is nothing to dispatch
   */
  public boolean isEmpty() {
    return events.isEmpty();
  }
}
