package org.waabox.datafeed;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link LoopState}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class LoopStateTest {

  @Test
  void whenCheckingFeed_givenRunningOrStopping_shouldHoldIt() {
    assertTrue(LoopState.RUNNING.holdsFeed());
    assertTrue(LoopState.STOPPING.holdsFeed());
  }

  @Test
  void whenCheckingFeed_givenIdleStartingOrStopped_shouldNotHoldIt() {
    assertFalse(LoopState.IDLE.holdsFeed());
    assertFalse(LoopState.STARTING.holdsFeed());
    assertFalse(LoopState.STOPPED.holdsFeed());
  }
}
