package org.waabox.datafeed.transport;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.waabox.datafeed.event.DatafeedEvent;
import org.waabox.datafeed.event.Initiator;

/**
 * Static utility class for decoding the body of a datafeed read into an
 * {@link EventBatch}.
 *
 * <p>Meant for {@link DatafeedTransport} implementations: the loop itself
 * never parses JSON, it only consumes the {@link EventBatch} returned by
 * {@link DatafeedTransport#readFeed}. A transport that receives the read
 * response as text hands the body to {@link #decode(String)}.
 *
 * <p>The expected body is:
 * <pre>{@code
 * {
 *   "ackId": "...",
 *   "events": [
 *     {
 *       "id": "...",
 *       "type": "MESSAGESENT",
 *       "timestamp": 1700000000000,
 *       "initiator": {"user": {"userId": 123, "username": "jane"}},
 *       "payload": {"messageSent": {...}}
 *     }
 *   ]
 * }
 * }</pre>
 *
 * <p>Only {@code ackId} and each event {@code type} are required. The
 * timestamp is in epoch milliseconds. Payloads are kept as Jackson trees.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class EventBatchCodec {

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Private constructor to prevent instantiation. */
  private EventBatchCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Decodes a read response body.
   *
   * @param json the response body, never null.
   * @return the decoded batch, never null.
   * @throws IllegalArgumentException if the JSON is malformed or missing
   *     required fields.
   */
  public static EventBatch decode(final String json) {
    Objects.requireNonNull(json, "json cannot be null");

    try {
      final JsonNode node = MAPPER.readTree(json);
      if (node == null || !node.isObject()) {
        throw new IllegalArgumentException(
            "Expected a JSON object but got: " + json);
      }
      return decode(node);
    } catch (final IllegalArgumentException e) {
      throw e;
    } catch (final Exception e) {
      throw new IllegalArgumentException(
          "Failed to decode EventBatch from JSON: " + json, e);
    }
  }

  /**
   * Decodes an already parsed read response body.
   *
   * @param node the response body, never null.
   * @return the decoded batch, never null.
   * @throws IllegalArgumentException if required fields are missing.
   */
  public static EventBatch decode(final JsonNode node) {
    Objects.requireNonNull(node, "node cannot be null");

    final String ackId = requireField(node, "ackId").asText();

    final JsonNode eventsNode = node.path("events");
    if (eventsNode.isMissingNode() || eventsNode.isNull()) {
      return new EventBatch(ackId, List.of());
    }
    if (!eventsNode.isArray()) {
      throw new IllegalArgumentException(
          "Field events is not an array in JSON: " + node);
    }

    final List<DatafeedEvent> events = new ArrayList<>(eventsNode.size());
    for (final JsonNode eventNode : eventsNode) {
      events.add(decodeEvent(eventNode));
    }
    return new EventBatch(ackId, events);
  }

  /** Decodes a single event.
   *
   * @param node the event node.
   * @return the event, never null.
   */
  private static DatafeedEvent decodeEvent(final JsonNode node) {
    final String type = requireField(node, "type").asText();

    final JsonNode idNode = node.get("id");
    final String id = idNode == null || idNode.isNull()
        ? null : idNode.asText();

    final JsonNode timestampNode = node.get("timestamp");
    final Instant timestamp = timestampNode == null || timestampNode.isNull()
        ? null : Instant.ofEpochMilli(timestampNode.asLong());

    return new DatafeedEvent(id, type, timestamp, decodeInitiator(node),
        node.get("payload"));
  }

  /** Decodes the initiator of an event.
   *
   * @param event the event node.
   * @return the initiator, null if the event has none.
   */
  private static Initiator decodeInitiator(final JsonNode event) {
    final JsonNode user = event.path("initiator").path("user");
    if (!user.isObject()) {
      return null;
    }
    final JsonNode username = user.get("username");
    return new Initiator(user.path("userId").asLong(),
        username == null || username.isNull() ? null : username.asText());
  }

  /** Returns the field node for the given key or throws if missing.
   *
   * @param node the parent JSON node.
   * @param field the field name to look up.
   * @return the field node, never null.
   * @throws IllegalArgumentException if the field is missing.
   */
  private static JsonNode requireField(final JsonNode node,
      final String field) {
    final JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      throw new IllegalArgumentException(
          "Missing field: " + field + " in JSON: " + node);
    }
    return value;
  }
}
