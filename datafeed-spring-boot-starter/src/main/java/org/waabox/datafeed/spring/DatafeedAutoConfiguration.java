package org.waabox.datafeed.spring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.waabox.datafeed.DatafeedLoop;
import org.waabox.datafeed.event.DatafeedListener;
import org.waabox.datafeed.metrics.DatafeedMetrics;
import org.waabox.datafeed.retry.RetryPolicy;
import org.waabox.datafeed.transport.AuthSession;
import org.waabox.datafeed.transport.DatafeedTransport;

/**
 * Spring Boot auto-configuration for the datafeed loop.
 *
 * <p>Creates a {@link DatafeedLoop} once the application provides a
 * {@link DatafeedTransport} and an {@link AuthSession}. Optional
 * {@link RetryPolicy} and {@link DatafeedMetrics} beans are used when
 * present; otherwise the policy is built from {@link DatafeedProperties}.
 * Every {@link DatafeedListener} bean is subscribed.
 *
 * <p>{@link DatafeedLoop#start()} blocks, so the {@link SmartLifecycle}
 * bean runs it on a dedicated daemon thread named {@code datafeed-loop}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@AutoConfiguration
@EnableConfigurationProperties(DatafeedProperties.class)
public class DatafeedAutoConfiguration {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      DatafeedAutoConfiguration.class);

  /** The name of the thread running the loop. */
  static final String LOOP_THREAD_NAME = "datafeed-loop";

  /**
   * Creates the {@link DatafeedLoop} bean.
   *
   * @param properties          the configuration properties, never null
   * @param transport           the remote feed operations, never null
   * @param authSession         the source of auth tokens, never null
   * @param retryPolicyProvider provider for an optional RetryPolicy bean
   * @param metricsProvider     provider for an optional DatafeedMetrics bean
   * @param listenerProvider    provider for the DatafeedListener beans
   *
   * @return the configured loop, never null
   */
  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnBean({ DatafeedTransport.class, AuthSession.class })
  public DatafeedLoop datafeedLoop(
      final DatafeedProperties properties,
      final DatafeedTransport transport,
      final AuthSession authSession,
      final ObjectProvider<RetryPolicy> retryPolicyProvider,
      final ObjectProvider<DatafeedMetrics> metricsProvider,
      final ObjectProvider<DatafeedListener> listenerProvider) {

    final DatafeedLoop.Builder builder = DatafeedLoop.builder()
        .transport(transport)
        .authSession(authSession);

    final RetryPolicy policy = retryPolicyProvider.getIfAvailable(
        () -> retryPolicy(properties.getRetry()));
    builder.retryPolicy(policy);
    log.info("Datafeed using {}", policy);

    final String botUsername = properties.getBotUsername();
    if (botUsername != null && !botUsername.isBlank()) {
      builder.botUsername(botUsername);
      log.info("Datafeed ignoring events initiated by bot '{}'", botUsername);
    }

    metricsProvider.ifAvailable(metrics -> {
      builder.metrics(metrics);
      log.info("Datafeed using custom DatafeedMetrics: {}",
          metrics.getClass().getSimpleName());
    });

    final DatafeedLoop loop = builder.build();

    listenerProvider.orderedStream().forEach(listener -> {
      loop.subscribe(listener);
      log.debug("Subscribed DatafeedListener: {}",
          listener.getClass().getSimpleName());
    });

    log.info("Datafeed loop created with {} listener(s)",
        loop.listenerCount());

    return loop;
  }

  /**
   * Creates a {@link SmartLifecycle} bean that runs the loop in the
   * background and stops it with the application context.
   *
   * <p>The lifecycle starts late (phase {@code Integer.MAX_VALUE - 1}) so
   * that listeners and their dependencies are ready before the first
   * event, and stops early for the same reason. It reports itself as not
   * running once the loop thread ends, whether the loop was stopped or
   * failed.
   *
   * @param loop       the loop to manage, never null
   * @param properties the configuration properties, never null
   *
   * @return the lifecycle bean, never null
   */
  @Bean
  @ConditionalOnBean({ DatafeedTransport.class, AuthSession.class })
  public SmartLifecycle datafeedLoopLifecycle(final DatafeedLoop loop,
      final DatafeedProperties properties) {
    return new SmartLifecycle() {

      /** The thread running the loop, null when not running. */
      private volatile Thread worker;

      @Override
      public void start() {
        log.info("Starting datafeed loop...");
        final Thread thread = new Thread(() -> {
          try {
            loop.start();
          } catch (final RuntimeException e) {
            log.error("Datafeed loop terminated with an error: {}",
                e.getMessage(), e);
          } finally {
            clearWorker(Thread.currentThread());
          }
        }, LOOP_THREAD_NAME);
        thread.setDaemon(true);
        worker = thread;
        thread.start();
      }

      @Override
      public void stop() {
        log.info("Stopping datafeed loop...");
        loop.stop();
        worker = null;
        log.info("Datafeed loop stopped.");
      }

      /** Forgets the worker unless a newer one replaced it.
       *
       * @param thread the worker that finished.
       */
      private void clearWorker(final Thread thread) {
        if (worker == thread) {
          worker = null;
        }
      }

      @Override
      public boolean isRunning() {
        return worker != null;
      }

      @Override
      public boolean isAutoStartup() {
        return properties.isAutoStart();
      }

      @Override
      public int getPhase() {
        return Integer.MAX_VALUE - 1;
      }
    };
  }

  /**
   * Builds the retry policy from the {@code datafeed.retry.*} properties.
   *
   * @param retry the retry properties, never null
   *
   * @return the retry policy, never null
   *
   * @throws IllegalArgumentException if the properties are out of range
   */
  static RetryPolicy retryPolicy(final DatafeedProperties.Retry retry) {
    final int maxAttempts = retry.getMaxAttempts() < 0
        ? RetryPolicy.UNBOUNDED : retry.getMaxAttempts();
    return RetryPolicy.builder()
        .maxAttempts(maxAttempts)
        .initialInterval(retry.getInitialInterval())
        .multiplier(retry.getMultiplier())
        .maxInterval(retry.getMaxInterval())
        .jitter(retry.getJitter())
        .build();
  }
}
