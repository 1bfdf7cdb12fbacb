package org.waabox.datafeed.retry;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;
import org.waabox.datafeed.transport.TransportException;

/**
 * Tests for {@link DefaultFaultClassifier}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class DefaultFaultClassifierTest {

  private final DefaultFaultClassifier classifier =
      DefaultFaultClassifier.INSTANCE;

  @Test
  void whenClassifying_givenBadRequest_shouldReturnStaleFeed() {
    assertEquals(Fault.STALE_FEED, classify(400));
  }

  @Test
  void whenClassifying_givenUnauthorized_shouldReturnUnauthorized() {
    assertEquals(Fault.UNAUTHORIZED, classify(401));
  }

  @Test
  void whenClassifying_givenNoResponseThrottlingOrServerError_shouldReturnTransient() {
    assertEquals(Fault.TRANSIENT, classify(TransportException.NO_RESPONSE));
    assertEquals(Fault.TRANSIENT, classify(429));
    assertEquals(Fault.TRANSIENT, classify(500));
    assertEquals(Fault.TRANSIENT, classify(503));
    assertEquals(Fault.TRANSIENT, classify(599));
  }

  @Test
  void whenClassifying_givenOtherClientError_shouldReturnFatal() {
    assertEquals(Fault.FATAL, classify(403));
    assertEquals(Fault.FATAL, classify(404));
    assertEquals(Fault.FATAL, classify(302));
  }

  @Test
  void whenClassifying_givenNonTransportError_shouldReturnUnexpected() {
    assertEquals(Fault.UNEXPECTED,
        classifier.classify(new NullPointerException("npe")));
    assertEquals(Fault.UNEXPECTED,
        classifier.classify(new RuntimeException("boom")));
  }

  private Fault classify(final int status) {
    return classifier.classify(new TransportException(status, "failure"));
  }
}
