package org.waabox.datafeed.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Defines the retry behavior for datafeed operations such as listing,
 * creating, deleting and reading feeds.
 *
 * <p>A policy is a pure decision function: given the attempt number and the
 * failure it answers whether to retry and how long to wait. It keeps no
 * state of its own, so a single instance is shared by every retrying
 * operation.
 *
 * <p>The backoff for attempt {@code n} (1-based) is
 * {@code min(maxInterval, initialInterval * multiplier^(n-1))}, optionally
 * spread by a random jitter ratio. A multiplier of 1 gives a fixed backoff.
 *
 * <p>The default policy never gives up on retryable faults, starts at
 * 500 ms, doubles on each attempt and caps at 5 minutes.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RetryPolicy {

  /** Marker for a policy without an attempt limit. */
  public static final int UNBOUNDED = Integer.MAX_VALUE;

  /** The default initial backoff. */
  private static final Duration DEFAULT_INITIAL_INTERVAL =
      Duration.ofMillis(500);

  /** The default backoff multiplier. */
  private static final double DEFAULT_MULTIPLIER = 2.0;

  /** The default backoff cap. */
  private static final Duration DEFAULT_MAX_INTERVAL = Duration.ofMinutes(5);

  /** The maximum number of attempts, including the first one. */
  private final int maxAttempts;

  /** The wait before the second attempt. */
  private final Duration initialInterval;

  /** The growth factor applied to the wait on each attempt. */
  private final double multiplier;

  /** The upper bound of any wait. */
  private final Duration maxInterval;

  /** The random spread ratio applied to each wait, from 0 to 1. */
  private final double jitter;

  /** Maps failures to faults. */
  private final FaultClassifier classifier;

  /**
   * Creates a new retry policy, see {@link Builder}.
   *
   * @param builder the validated builder, never null
   */
  private RetryPolicy(final Builder builder) {
    maxAttempts = builder.maxAttempts;
    initialInterval = builder.initialInterval;
    multiplier = builder.multiplier;
    maxInterval = builder.maxInterval;
    jitter = builder.jitter;
    classifier = builder.classifier;
  }

  /**
   * Creates a fixed-backoff policy with the given attempt limit.
   *
   * @param maxAttempts the maximum number of attempts, must be greater than
   *                    zero
   * @param backoff     the wait between attempts, never null
   *
   * @return a new retry policy, never null
   *
   * @throws IllegalArgumentException if maxAttempts is not positive or the
   *                                  backoff is negative
   * @throws NullPointerException if backoff is null
   */
  public static RetryPolicy of(final int maxAttempts, final Duration backoff) {
    return builder()
        .maxAttempts(maxAttempts)
        .initialInterval(backoff)
        .maxInterval(backoff)
        .multiplier(1.0)
        .build();
  }

  /**
   * Creates a policy with the defaults: unbounded attempts, exponential
   * backoff from 500 ms doubling up to 5 minutes, no jitter.
   *
   * @return the default retry policy, never null
   */
  public static RetryPolicy defaultPolicy() {
    return builder().build();
  }

  /**
   * Creates a new builder initialized with the default values.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Decides what to do after the given attempt failed.
   *
   * <p>Gives up on non retryable faults and once {@code attempt} reached
   * the attempt limit. Otherwise retries after {@link #backoff(int)}.
   *
   * @param attempt the 1-based number of the attempt that failed
   * @param error   the failure raised by that attempt, never null
   *
   * @return the decision, never null
   */
  public RetryDecision decide(final int attempt, final Throwable error) {
    Objects.requireNonNull(error, "error cannot be null");
    final Fault fault = classifier.classify(error);
    if (!fault.retryable() || attempt >= maxAttempts) {
      return RetryDecision.giveUp(fault);
    }
    return RetryDecision.retryAfter(fault, backoff(attempt));
  }

  /**
   * Classifies the given failure with this policy's classifier.
   *
   * @param error the failure, never null
   *
   * @return the fault, never null
   */
  public Fault classify(final Throwable error) {
    return classifier.classify(error);
  }

  /**
   * Computes the wait that follows the given failed attempt.
   *
   * @param attempt the 1-based number of the attempt that failed, must be
   *                greater than zero
   *
   * @return the wait, never null and never above the max interval
   */
  public Duration backoff(final int attempt) {
    if (attempt <= 0) {
      throw new IllegalArgumentException(
          "attempt must be greater than 0, got: " + attempt);
    }
    final double base = initialInterval.toMillis()
        * Math.pow(multiplier, attempt - 1);
    double millis = Math.min(base, maxInterval.toMillis());
    if (jitter > 0) {
      final double spread = millis * jitter;
      millis = millis - spread
          + ThreadLocalRandom.current().nextDouble() * spread * 2;
      millis = Math.min(millis, maxInterval.toMillis());
    }
    return Duration.ofMillis(Math.max(0L, Math.round(millis)));
  }

  /**
   * Returns the maximum number of attempts.
   *
   * @return the attempt limit, {@link #UNBOUNDED} when there is none
   */
  public int maxAttempts() {
    return maxAttempts;
  }

  /**
   * Returns whether this policy retries forever.
   *
   * @return true when the attempt limit is {@link #UNBOUNDED}
   */
  public boolean unbounded() {
    return maxAttempts == UNBOUNDED;
  }

  /**
   * Returns the wait before the second attempt.
   *
   * @return the initial interval, never null
   */
  public Duration initialInterval() {
    return initialInterval;
  }

  /**
   * Returns the growth factor of the wait.
   *
   * @return the multiplier, at least 1
   */
  public double multiplier() {
    return multiplier;
  }

  /**
   * Returns the upper bound of any wait.
   *
   * @return the max interval, never null
   */
  public Duration maxInterval() {
    return maxInterval;
  }

  /**
   * Returns the random spread ratio.
   *
   * @return the jitter, between 0 and 1
   */
  public double jitter() {
    return jitter;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return "RetryPolicy{maxAttempts="
        + (unbounded() ? "unbounded" : String.valueOf(maxAttempts))
        + ", initialInterval=" + initialInterval
        + ", multiplier=" + multiplier
        + ", maxInterval=" + maxInterval
        + ", jitter=" + jitter + "}";
  }

  /**
   * A fluent builder for {@link RetryPolicy} instances.
   *
   * <p>Defaults:
   * <ul>
   *   <li>maxAttempts: {@link RetryPolicy#UNBOUNDED}</li>
   *   <li>initialInterval: 500 ms</li>
   *   <li>multiplier: 2</li>
   *   <li>maxInterval: 5 minutes</li>
   *   <li>jitter: 0</li>
   *   <li>classifier: {@link DefaultFaultClassifier}</li>
   * </ul>
   */
  public static final class Builder {

    /** The attempt limit. */
    private int maxAttempts = UNBOUNDED;

    /** The first wait. */
    private Duration initialInterval = DEFAULT_INITIAL_INTERVAL;

    /** The wait growth factor. */
    private double multiplier = DEFAULT_MULTIPLIER;

    /** The wait cap. */
    private Duration maxInterval = DEFAULT_MAX_INTERVAL;

    /** The wait spread ratio. */
    private double jitter = 0;

    /** The failure classifier. */
    private FaultClassifier classifier = DefaultFaultClassifier.INSTANCE;

    /** Private constructor, use {@link RetryPolicy#builder()}. */
    private Builder() {
    }

    /**
     * Sets the maximum number of attempts, including the first one.
     *
     * @param theMaxAttempts the limit, greater than zero, or
     *                       {@link RetryPolicy#UNBOUNDED}
     *
     * @return this builder, never null
     */
    public Builder maxAttempts(final int theMaxAttempts) {
      if (theMaxAttempts <= 0) {
        throw new IllegalArgumentException(
            "maxAttempts must be greater than 0, got: " + theMaxAttempts);
      }
      maxAttempts = theMaxAttempts;
      return this;
    }

    /**
     * Sets the wait before the second attempt.
     *
     * @param theInitialInterval the wait, never null nor negative
     *
     * @return this builder, never null
     */
    public Builder initialInterval(final Duration theInitialInterval) {
      initialInterval = requireNotNegative(theInitialInterval,
          "initialInterval");
      return this;
    }

    /**
     * Sets the growth factor applied to the wait after each attempt.
     *
     * @param theMultiplier the factor, at least 1
     *
     * @return this builder, never null
     */
    public Builder multiplier(final double theMultiplier) {
      if (theMultiplier < 1.0) {
        throw new IllegalArgumentException(
            "multiplier must be at least 1, got: " + theMultiplier);
      }
      multiplier = theMultiplier;
      return this;
    }

    /**
     * Sets the cap of any wait.
     *
     * @param theMaxInterval the cap, never null nor negative
     *
     * @return this builder, never null
     */
    public Builder maxInterval(final Duration theMaxInterval) {
      maxInterval = requireNotNegative(theMaxInterval, "maxInterval");
      return this;
    }

    /**
     * Sets the random spread ratio of each wait.
     *
     * @param theJitter the ratio, between 0 and 1
     *
     * @return this builder, never null
     */
    public Builder jitter(final double theJitter) {
      if (theJitter < 0 || theJitter > 1) {
        throw new IllegalArgumentException(
            "jitter must be between 0 and 1, got: " + theJitter);
      }
      jitter = theJitter;
      return this;
    }

    /**
     * Sets the classifier that maps failures to faults.
     *
     * @param theClassifier the classifier, never null
     *
     * @return this builder, never null
     */
    public Builder classifier(final FaultClassifier theClassifier) {
      classifier = Objects.requireNonNull(theClassifier,
          "classifier cannot be null");
      return this;
    }

    /**
     * Builds the policy.
     *
     * @return the new policy, never null
     *
     * @throws IllegalArgumentException if the initial interval exceeds the
     *                                  max interval
     */
    public RetryPolicy build() {
      if (initialInterval.compareTo(maxInterval) > 0) {
        throw new IllegalArgumentException("initialInterval " + initialInterval
            + " must not exceed maxInterval " + maxInterval);
      }
      return new RetryPolicy(this);
    }

    /** Checks that a duration is present and not negative.
     *
     * @param value the duration to check.
     * @param name the name used in error messages.
     * @return the same duration.
     */
    private static Duration requireNotNegative(final Duration value,
        final String name) {
      Objects.requireNonNull(value, name + " cannot be null");
      if (value.isNegative()) {
        throw new IllegalArgumentException(
            name + " must not be negative, got: " + value);
      }
      return value;
    }
  }
}
