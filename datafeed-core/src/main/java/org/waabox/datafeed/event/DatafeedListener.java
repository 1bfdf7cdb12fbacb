package org.waabox.datafeed.event;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Receives the real-time events read from the datafeed.
 *
 * <p>Every handler has an empty default implementation: a listener
 * overrides only the event types it is interested in. Handlers run on the
 * datafeed loop thread, one at a time, in event order. A handler that
 * throws an {@link Exception} does not affect other listeners nor other
 * events: the failure is logged and the batch goes on.
 *
 * <p>An {@link Error} thrown by a handler is not contained. It aborts the
 * batch and terminates the loop, which deregisters every listener and
 * rethrows the error from {@code DatafeedLoop#start()}.
 *
 * <p>To halt the loop from a handler, call {@code DatafeedLoop#stop()}: the
 * loop finishes dispatching the current batch and then stops.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface DatafeedListener {

  /**
   * Tells whether this listener wants the given event.
   *
   * <p>By default events initiated by the bot itself are rejected.
   *
   * @param event       the event, never null
   * @param botUsername the username of the bot, may be null if unknown
   *
   * @return true if the event should be handed to this listener
   */
  default boolean isAcceptingEvent(final DatafeedEvent event,
      final String botUsername) {
    if (botUsername == null) {
      return true;
    }
    return !event.initiatorUsername()
        .map(botUsername::equals)
        .orElse(false);
  }

  /**
   * A message was sent in a conversation the bot is part of.
   *
   * @param initiator the sender, may be null
   * @param payload   the {@code messageSent} payload, never null
   */
  default void onMessageSent(final Initiator initiator,
      final JsonNode payload) {
  }

  /**
   * A wall post was shared.
   *
   * @param initiator who shared it, may be null
   * @param payload   the {@code sharedPost} payload, never null
   */
  default void onSharedPost(final Initiator initiator,
      final JsonNode payload) {
  }

  /**
   * An instant message conversation was created.
   *
   * @param initiator the creator, may be null
   * @param payload   the {@code instantMessageCreated} payload, never null
   */
  default void onInstantMessageCreated(final Initiator initiator,
      final JsonNode payload) {
  }

  /**
   * A room was created.
   *
   * @param initiator the creator, may be null
   * @param payload   the {@code roomCreated} payload, never null
   */
  default void onRoomCreated(final Initiator initiator,
      final JsonNode payload) {
  }

  /**
   * A room was updated.
   *
   * @param initiator who updated it, may be null
   * @param payload   the {@code roomUpdated} payload, never null
   */
  default void onRoomUpdated(final Initiator initiator,
      final JsonNode payload) {
  }

  /**
   * A room was deactivated.
   *
   * @param initiator who deactivated it, may be null
   * @param payload   the {@code roomDeactivated} payload, never null
   */
  default void onRoomDeactivated(final Initiator initiator,
      final JsonNode payload) {
  }

  /**
   * A room was reactivated.
   *
   * @param initiator who reactivated it, may be null
   * @param payload   the {@code roomReactivated} payload, never null
   */
  default void onRoomReactivated(final Initiator initiator,
      final JsonNode payload) {
  }

  /**
   * A user asked to join a room.
   *
   * @param initiator the requesting user, may be null
   * @param payload   the {@code userRequestedToJoinRoom} payload, never null
   */
  default void onUserRequestedToJoinRoom(final Initiator initiator,
      final JsonNode payload) {
  }

  /**
   * A user joined a room.
   *
   * @param initiator who added the user, may be null
   * @param payload   the {@code userJoinedRoom} payload, never null
   */
  default void onUserJoinedRoom(final Initiator initiator,
      final JsonNode payload) {
  }

  /**
   * A user left a room.
   *
   * @param initiator who removed the user, may be null
   * @param payload   the {@code userLeftRoom} payload, never null
   */
  default void onUserLeftRoom(final Initiator initiator,
      final JsonNode payload) {
  }

  /**
   * A room member was promoted to owner.
   *
   * @param initiator who promoted the member, may be null
   * @param payload   the {@code roomMemberPromotedToOwner} payload
   */
  default void onRoomMemberPromotedToOwner(final Initiator initiator,
      final JsonNode payload) {
  }

  /**
   * A room owner was demoted to member.
   *
   * @param initiator who demoted the owner, may be null
   * @param payload   the {@code roomMemberDemotedFromOwner} payload
   */
  default void onRoomMemberDemotedFromOwner(final Initiator initiator,
      final JsonNode payload) {
  }

  /**
   * A connection request was received.
   *
   * @param initiator the requesting user, may be null
   * @param payload   the {@code connectionRequested} payload, never null
   */
  default void onConnectionRequested(final Initiator initiator,
      final JsonNode payload) {
  }

  /**
   * A connection request was accepted.
   *
   * @param initiator the accepting user, may be null
   * @param payload   the {@code connectionAccepted} payload, never null
   */
  default void onConnectionAccepted(final Initiator initiator,
      final JsonNode payload) {
  }

  /**
   * A message was suppressed.
   *
   * @param initiator who suppressed it, may be null
   * @param payload   the {@code messageSuppressed} payload, never null
   */
  default void onMessageSuppressed(final Initiator initiator,
      final JsonNode payload) {
  }

  /**
   * A user submitted a form.
   *
   * @param initiator the submitting user, may be null
   * @param payload   the {@code symphonyElementsAction} payload, never null
   */
  default void onSymphonyElementsAction(final Initiator initiator,
      final JsonNode payload) {
  }
}
