package org.waabox.datafeed.retry;

/**
 * Maps a failure to its {@link Fault}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface FaultClassifier {

  /**
   * Classifies the given failure.
   *
   * @param error the failure raised by an attempt, never null
   *
   * @return the fault, never null
   */
  Fault classify(Throwable error);
}
