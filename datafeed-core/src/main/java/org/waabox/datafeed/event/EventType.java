package org.waabox.datafeed.event;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The real-time event types a datafeed delivers.
 *
 * <p>Each type knows the payload field that carries its data and the
 * {@link DatafeedListener} method that handles it.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum EventType {

  MESSAGESENT("messageSent", DatafeedListener::onMessageSent),
  SHAREDPOST("sharedPost", DatafeedListener::onSharedPost),
  INSTANTMESSAGECREATED("instantMessageCreated",
      DatafeedListener::onInstantMessageCreated),
  ROOMCREATED("roomCreated", DatafeedListener::onRoomCreated),
  ROOMUPDATED("roomUpdated", DatafeedListener::onRoomUpdated),
  ROOMDEACTIVATED("roomDeactivated", DatafeedListener::onRoomDeactivated),
  ROOMREACTIVATED("roomReactivated", DatafeedListener::onRoomReactivated),
  USERREQUESTEDTOJOINROOM("userRequestedToJoinRoom",
      DatafeedListener::onUserRequestedToJoinRoom),
  USERJOINEDROOM("userJoinedRoom", DatafeedListener::onUserJoinedRoom),
  USERLEFTROOM("userLeftRoom", DatafeedListener::onUserLeftRoom),
  ROOMMEMBERPROMOTEDTOOWNER("roomMemberPromotedToOwner",
      DatafeedListener::onRoomMemberPromotedToOwner),
  ROOMMEMBERDEMOTEDFROMOWNER("roomMemberDemotedFromOwner",
      DatafeedListener::onRoomMemberDemotedFromOwner),
  CONNECTIONREQUESTED("connectionRequested",
      DatafeedListener::onConnectionRequested),
  CONNECTIONACCEPTED("connectionAccepted",
      DatafeedListener::onConnectionAccepted),
  MESSAGESUPPRESSED("messageSuppressed",
      DatafeedListener::onMessageSuppressed),
  SYMPHONYELEMENTSACTION("symphonyElementsAction",
      DatafeedListener::onSymphonyElementsAction);

  /** Lookup by upper-case wire name. */
  private static final Map<String, EventType> BY_NAME = Stream.of(values())
      .collect(Collectors.toUnmodifiableMap(Enum::name, Function.identity()));

  /** The payload field holding the data of this type. */
  private final String payloadField;

  /** Routes an event of this type to its listener method. */
  private final Handler handler;

  /** Creates a new event type.
   *
   * @param thePayloadField the payload field of this type.
   * @param theHandler the listener method of this type.
   */
  EventType(final String thePayloadField, final Handler theHandler) {
    payloadField = thePayloadField;
    handler = theHandler;
  }

  /**
   * Resolves a wire name, ignoring case.
   *
   * @param name the wire name, may be null
   *
   * @return the type, empty if unknown
   */
  public static Optional<EventType> fromName(final String name) {
    if (name == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(BY_NAME.get(name.toUpperCase(Locale.ROOT)));
  }

  /**
   * Returns the payload field that carries the data of this type.
   *
   * @return the field name, never null
   */
  public String payloadField() {
    return payloadField;
  }

  /**
   * Invokes the listener method matching this type.
   *
   * <p>The listener receives the initiator and the type specific part of
   * the payload; a missing part is passed as a missing node.
   *
   * @param listener the listener, never null
   * @param event    the event, of this type, never null
   */
  public void dispatch(final DatafeedListener listener,
      final DatafeedEvent event) {
    handler.handle(listener, event.initiator(),
        event.payload().path(payloadField));
  }

  /** A listener method reference. */
  @FunctionalInterface
  private interface Handler {

    /** Calls the listener method.
     *
     * @param listener the listener.
     * @param initiator the initiator, may be null.
     * @param payload the type specific payload.
     */
    void handle(DatafeedListener listener, Initiator initiator,
        JsonNode payload);
  }
}
