package org.waabox.datafeed.event;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.junit.jupiter.api.Test;
import org.waabox.datafeed.metrics.DatafeedMetrics;
import org.waabox.datafeed.metrics.NoopDatafeedMetrics;

/**
 * Tests for {@link ListenerRegistry}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ListenerRegistryTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Shared delivery trace, in call order. */
  private final List<String> trace = new ArrayList<>();

  @Test
  void whenDispatching_givenSeveralListeners_shouldDeliverInEventThenSubscriptionOrder() {
    final ListenerRegistry registry = registry();
    registry.subscribe(new Recording("a"));
    registry.subscribe(new Recording("b"));

    registry.dispatch(List.of(message("m1", "jane"), message("m2", "jane")));

    assertEquals(List.of("a:m1", "b:m1", "a:m2", "b:m2"), trace);
  }

  @Test
  void whenDispatching_givenFailingListener_shouldIsolateFailureAndReportIt() {
    final DatafeedMetrics metrics = createMock(DatafeedMetrics.class);
    metrics.listenerFailed(eq("MESSAGESENT"), anyObject(Throwable.class));
    replay(metrics);

    final ListenerRegistry registry = new ListenerRegistry(metrics, null);
    registry.subscribe(new DatafeedListener() {
      @Override
      public void onMessageSent(final Initiator initiator,
          final JsonNode payload) {
        throw new IllegalStateException("listener bug");
      }
    });
    registry.subscribe(new Recording("ok"));

    registry.dispatch(List.of(message("m1", "jane")));

    assertEquals(List.of("ok:m1"), trace);
    verify(metrics);
  }

  @Test
  void whenDispatching_givenEventFromBot_shouldSkipIt() {
    final ListenerRegistry registry =
        new ListenerRegistry(new NoopDatafeedMetrics(), "my-bot");
    registry.subscribe(new Recording("a"));

    registry.dispatch(List.of(message("m1", "my-bot"), message("m2", "jane")));

    assertEquals(List.of("a:m2"), trace);
  }

  @Test
  void whenDispatching_givenListenerAcceptingOwnEvents_shouldDeliverThem() {
    final ListenerRegistry registry =
        new ListenerRegistry(new NoopDatafeedMetrics(), "my-bot");
    registry.subscribe(new Recording("a") {
      @Override
      public boolean isAcceptingEvent(final DatafeedEvent event,
          final String botUsername) {
        return true;
      }
    });

    registry.dispatch(List.of(message("m1", "my-bot")));

    assertEquals(List.of("a:m1"), trace);
  }

  @Test
  void whenDispatching_givenUnknownEventType_shouldSkipIt() {
    final ListenerRegistry registry = registry();
    registry.subscribe(new Recording("a"));

    registry.dispatch(List.of(
        new DatafeedEvent("x", "SOMETHINGNEW", null, null, null),
        message("m1", "jane")));

    assertEquals(List.of("a:m1"), trace);
  }

  @Test
  void whenSubscribingDuringDispatch_givenNewListener_shouldApplyFromNextBatch() {
    final ListenerRegistry registry = registry();
    final Recording late = new Recording("late");
    registry.subscribe(new Recording("a") {
      @Override
      public void onMessageSent(final Initiator initiator,
          final JsonNode payload) {
        super.onMessageSent(initiator, payload);
        if (trace.size() == 1) {
          registry.subscribe(late);
        }
      }
    });

    registry.dispatch(List.of(message("m1", "jane"), message("m2", "jane")));
    registry.dispatch(List.of(message("m3", "jane")));

    assertEquals(List.of("a:m1", "a:m2", "a:m3", "late:m3"), trace);
  }

  @Test
  void whenUnsubscribingDuringDispatch_givenListener_shouldApplyFromNextBatch() {
    final ListenerRegistry registry = registry();
    final Recording b = new Recording("b");
    registry.subscribe(new Recording("a") {
      @Override
      public void onMessageSent(final Initiator initiator,
          final JsonNode payload) {
        super.onMessageSent(initiator, payload);
        registry.unsubscribe(b);
      }
    });
    registry.subscribe(b);

    registry.dispatch(List.of(message("m1", "jane")));
    registry.dispatch(List.of(message("m2", "jane")));

    assertEquals(List.of("a:m1", "b:m1", "a:m2"), trace);
  }

  @Test
  void whenUnsubscribing_givenUnknownListener_shouldReturnFalse() {
    final ListenerRegistry registry = registry();
    final Recording a = new Recording("a");
    registry.subscribe(a);

    assertTrue(registry.unsubscribe(a));
    assertFalse(registry.unsubscribe(a));
  }

  @Test
  void whenClosing_givenListeners_shouldRemoveThemAll() {
    final ListenerRegistry registry = registry();
    registry.subscribe(new Recording("a"));
    registry.subscribe(new Recording("b"));

    registry.close();

    assertEquals(0, registry.size());
    registry.dispatch(List.of(message("m1", "jane")));
    assertTrue(trace.isEmpty());
  }

  @Test
  void whenSubscribing_givenNullListener_shouldThrowNpe() {
    final ListenerRegistry registry = registry();

    assertThrows(NullPointerException.class,
        () -> registry.subscribe(null));
  }

  private ListenerRegistry registry() {
    return new ListenerRegistry(new NoopDatafeedMetrics(), null);
  }

  private static DatafeedEvent message(final String id,
      final String username) {
    final ObjectNode payload = MAPPER.createObjectNode();
    payload.putObject("messageSent").put("messageId", id);
    return new DatafeedEvent(id, "MESSAGESENT", null,
        new Initiator(1L, username), payload);
  }

  /** Appends {@code name:messageId} to the trace for every message. */
  private class Recording implements DatafeedListener {

    private final String name;

    Recording(final String theName) {
      name = theName;
    }

    @Override
    public void onMessageSent(final Initiator initiator,
        final JsonNode payload) {
      trace.add(name + ":" + payload.path("messageId").asText());
    }
  }
}
