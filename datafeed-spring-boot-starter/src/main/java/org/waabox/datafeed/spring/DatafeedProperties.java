package org.waabox.datafeed.spring;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the datafeed loop, mapped from the
 * {@code datafeed.*} prefix in application.yml or application.properties.
 *
 * <p>Supported keys:
 * <ul>
 *   <li>{@code datafeed.bot-username} - the bot username. Events initiated
 *       by the bot are not delivered to listeners. Optional.</li>
 *   <li>{@code datafeed.auto-start} - whether the loop starts with the
 *       application context. Defaults to true.</li>
 *   <li>{@code datafeed.retry.*} - the retry policy of every datafeed call,
 *       ignored when a {@code RetryPolicy} bean exists.</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "datafeed")
public class DatafeedProperties {

  /** The bot username, null to deliver every event. */
  private String botUsername;

  /** Whether the loop starts with the application context. */
  private boolean autoStart = true;

  /** The retry settings. */
  private final Retry retry = new Retry();

  /**
   * Returns the bot username.
   *
   * @return the username, or null if not configured
   */
  public String getBotUsername() {
    return botUsername;
  }

  /**
   * Sets the bot username.
   *
   * @param botUsername the username, may be null
   */
  public void setBotUsername(final String botUsername) {
    this.botUsername = botUsername;
  }

  /**
   * Returns whether the loop starts with the application context.
   *
   * @return true to start automatically
   */
  public boolean isAutoStart() {
    return autoStart;
  }

  /**
   * Sets whether the loop starts with the application context.
   *
   * @param autoStart true to start automatically
   */
  public void setAutoStart(final boolean autoStart) {
    this.autoStart = autoStart;
  }

  /**
   * Returns the retry settings.
   *
   * @return the retry settings, never null
   */
  public Retry getRetry() {
    return retry;
  }

  /** The {@code datafeed.retry.*} settings. */
  public static class Retry {

    /** The attempt limit, -1 for unbounded. */
    private int maxAttempts = -1;

    /** The wait before the second attempt. */
    private Duration initialInterval = Duration.ofMillis(500);

    /** The wait growth factor. */
    private double multiplier = 2.0;

    /** The wait cap. */
    private Duration maxInterval = Duration.ofMinutes(5);

    /** The wait spread ratio. */
    private double jitter = 0;

    /**
     * Returns the attempt limit.
     *
     * @return the limit, -1 for unbounded
     */
    public int getMaxAttempts() {
      return maxAttempts;
    }

    /**
     * Sets the attempt limit.
     *
     * @param maxAttempts the limit, -1 for unbounded
     */
    public void setMaxAttempts(final int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    /**
     * Returns the wait before the second attempt.
     *
     * @return the initial interval
     */
    public Duration getInitialInterval() {
      return initialInterval;
    }

    /**
     * Sets the wait before the second attempt.
     *
     * @param initialInterval the initial interval
     */
    public void setInitialInterval(final Duration initialInterval) {
      this.initialInterval = initialInterval;
    }

    /**
     * Returns the wait growth factor.
     *
     * @return the multiplier
     */
    public double getMultiplier() {
      return multiplier;
    }

    /**
     * Sets the wait growth factor.
     *
     * @param multiplier the multiplier, at least 1
     */
    public void setMultiplier(final double multiplier) {
      this.multiplier = multiplier;
    }

    /**
     * Returns the wait cap.
     *
     * @return the max interval
     */
    public Duration getMaxInterval() {
      return maxInterval;
    }

    /**
     * Sets the wait cap.
     *
     * @param maxInterval the max interval
     */
    public void setMaxInterval(final Duration maxInterval) {
      this.maxInterval = maxInterval;
    }

    /**
     * Returns the wait spread ratio.
     *
     * @return the jitter
     */
    public double getJitter() {
      return jitter;
    }

    /**
     * Sets the wait spread ratio.
     *
     * @param jitter the jitter, between 0 and 1
     */
    public void setJitter(final double jitter) {
      this.jitter = jitter;
    }
  }
}
