package org.waabox.datafeed.transport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;

import org.junit.jupiter.api.Test;
import org.waabox.datafeed.event.DatafeedEvent;
import org.waabox.datafeed.event.EventType;

/**
 * Tests for {@link EventBatchCodec}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class EventBatchCodecTest {

  @Test
  void whenDecoding_givenFullBody_shouldDecodeEveryEvent() {
    final String json = """
        {
          "ackId": "ack-2",
          "events": [
            {
              "id": "e1",
              "type": "MESSAGESENT",
              "timestamp": 1700000000000,
              "initiator": {"user": {"userId": 42, "username": "jane"}},
              "payload": {"messageSent": {"message": {"text": "hi"}}}
            },
            {
              "id": "e2",
              "type": "ROOMCREATED"
            }
          ]
        }
        """;

    final EventBatch batch = EventBatchCodec.decode(json);

    assertEquals("ack-2", batch.cursor());
    assertEquals(2, batch.events().size());

    final DatafeedEvent first = batch.events().get(0);
    assertEquals("e1", first.id());
    assertEquals(EventType.MESSAGESENT, first.eventType().orElseThrow());
    assertEquals(Instant.ofEpochMilli(1700000000000L), first.timestamp());
    assertEquals(42L, first.initiator().userId());
    assertEquals("jane", first.initiator().username());
    assertEquals("hi", first.payload()
        .path("messageSent").path("message").path("text").asText());

    final DatafeedEvent second = batch.events().get(1);
    assertNull(second.initiator());
    assertNull(second.timestamp());
    assertTrue(second.payload().isMissingNode());
  }

  @Test
  void whenDecoding_givenNoEvents_shouldReturnEmptyBatch() {
    final EventBatch batch = EventBatchCodec.decode("{\"ackId\":\"ack-1\"}");

    assertEquals("ack-1", batch.cursor());
    assertTrue(batch.isEmpty());
  }

  @Test
  void whenDecoding_givenMissingAckId_shouldThrow() {
    assertThrows(IllegalArgumentException.class,
        () -> EventBatchCodec.decode("{\"events\":[]}"));
  }

  @Test
  void whenDecoding_givenEventWithoutType_shouldThrow() {
    assertThrows(IllegalArgumentException.class,
        () -> EventBatchCodec.decode(
            "{\"ackId\":\"a\",\"events\":[{\"id\":\"e1\"}]}"));
  }

  @Test
  void whenDecoding_givenMalformedJson_shouldThrow() {
    assertThrows(IllegalArgumentException.class,
        () -> EventBatchCodec.decode("{not json"));
  }

  @Test
  void whenDecoding_givenNonArrayEvents_shouldThrow() {
    assertThrows(IllegalArgumentException.class,
        () -> EventBatchCodec.decode("{\"ackId\":\"a\",\"events\":{}}"));
  }
}
