package org.waabox.datafeed.event;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.atomic.AtomicReference;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link EventType}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class EventTypeTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  @Test
  void whenResolving_givenWireNameInAnyCase_shouldFindType() {
    assertEquals(EventType.MESSAGESENT,
        EventType.fromName("MESSAGESENT").orElseThrow());
    assertEquals(EventType.USERJOINEDROOM,
        EventType.fromName("userJoinedRoom").orElseThrow());
  }

  @Test
  void whenResolving_givenUnknownOrNullName_shouldReturnEmpty() {
    assertTrue(EventType.fromName("NOPE").isEmpty());
    assertTrue(EventType.fromName(null).isEmpty());
  }

  @Test
  void whenDispatching_givenRoomCreated_shouldCallMatchingMethodWithPayloadPart() {
    final ObjectNode payload = MAPPER.createObjectNode();
    payload.putObject("roomCreated").put("roomName", "general");
    final Initiator initiator = new Initiator(7L, "jane");
    final DatafeedEvent event = new DatafeedEvent("e1", "ROOMCREATED", null,
        initiator, payload);

    final AtomicReference<JsonNode> received = new AtomicReference<>();
    final AtomicReference<Initiator> who = new AtomicReference<>();

    EventType.ROOMCREATED.dispatch(new DatafeedListener() {
      @Override
      public void onRoomCreated(final Initiator theInitiator,
          final JsonNode thePayload) {
        who.set(theInitiator);
        received.set(thePayload);
      }

      @Override
      public void onMessageSent(final Initiator theInitiator,
          final JsonNode thePayload) {
        throw new AssertionError("wrong handler");
      }
    }, event);

    assertEquals(initiator, who.get());
    assertEquals("general", received.get().path("roomName").asText());
  }

  @Test
  void whenDispatching_givenMissingPayloadPart_shouldPassMissingNode() {
    final DatafeedEvent event = new DatafeedEvent("e1", "MESSAGESENT", null,
        null, null);
    final AtomicReference<JsonNode> received = new AtomicReference<>();

    EventType.MESSAGESENT.dispatch(new DatafeedListener() {
      @Override
      public void onMessageSent(final Initiator initiator,
          final JsonNode payload) {
        received.set(payload);
      }
    }, event);

    assertTrue(received.get().isMissingNode());
  }

  @Test
  void whenFilteringByDefault_givenBotUsername_shouldRejectOnlyBotEvents() {
    final DatafeedListener listener = new DatafeedListener() { };
    final DatafeedEvent fromBot = new DatafeedEvent("1", "MESSAGESENT", null,
        new Initiator(1L, "bot"), null);
    final DatafeedEvent fromUser = new DatafeedEvent("2", "MESSAGESENT", null,
        new Initiator(2L, "jane"), null);
    final DatafeedEvent anonymous = new DatafeedEvent("3", "MESSAGESENT",
        null, null, null);

    assertFalse(listener.isAcceptingEvent(fromBot, "bot"));
    assertTrue(listener.isAcceptingEvent(fromUser, "bot"));
    assertTrue(listener.isAcceptingEvent(anonymous, "bot"));
    assertTrue(listener.isAcceptingEvent(fromBot, null));
  }
}
