package org.waabox.datafeed.event;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * A decoded real-time event, as returned by a datafeed read.
 *
 * <p>The payload is kept as an opaque Jackson tree; binding it to concrete
 * types is left to the listeners.
 *
 * @param id        the event identifier, may be null
 * @param type      the wire name of the event type, never null
 * @param timestamp when the event happened, may be null
 * @param initiator who caused the event, may be null
 * @param payload   the event payload, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record DatafeedEvent(
    String id,
    String type,
    Instant timestamp,
    Initiator initiator,
    JsonNode payload
) {

  /** Validates the components. A missing payload becomes a missing node. */
  public DatafeedEvent {
    Objects.requireNonNull(type, "type cannot be null");
    if (payload == null) {
      payload = MissingNode.getInstance();
    }
  }

  /**
   * Resolves the type of this event.
   *
   * @return the event type, empty if the wire name is not a known type
   */
  public Optional<EventType> eventType() {
    return EventType.fromName(type);
  }

  /**
   * Returns the username of the initiator.
   *
   * @return the username, empty when the event carries no initiator or the
   *         initiator has no username
   */
  public Optional<String> initiatorUsername() {
    return initiator == null ? Optional.empty()
        : Optional.ofNullable(initiator.username());
  }
}
