package org.waabox.datafeed;

/**
 * The lifecycle of a {@link DatafeedLoop}.
 *
 * <pre>
 * IDLE --start()--&gt; STARTING --feed acquired--&gt; RUNNING
 * RUNNING --stop observed--&gt; STOPPING --&gt; STOPPED
 * any state --failure--&gt; STOPPED
 * </pre>
 *
 * <p>The loop holds a feed handle only while {@link #RUNNING} or
 * {@link #STOPPING}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum LoopState {

  /** Built, not started yet. */
  IDLE,

  /** Acquiring the feed. */
  STARTING,

  /** Reading and dispatching. */
  RUNNING,

  /** Stop observed, releasing the feed handle. */
  STOPPING,

  /** Terminated, either normally or because of a failure. */
  STOPPED;

  /**
   * Returns whether a feed handle exists in this state.
   *
   * @return true for {@link #RUNNING} and {@link #STOPPING}
   */
  public boolean holdsFeed() {
    return this == RUNNING || this == STOPPING;
  }
}
