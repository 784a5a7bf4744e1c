package org.metricwatch.anomaly.notification.service;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.typesafe.config.Config;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.metricwatch.anomaly.datamodel.AlertPayload;
import org.metricwatch.anomaly.datamodel.DeliveryResult;
import org.metricwatch.anomaly.notification.service.channel.NotificationChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands alert payloads to channels on a small bounded pool. A full queue rejects the new delivery,
 * which is recorded as a failure; callers are never blocked.
 */
public class NotificationDispatcher {
  private static final Logger LOGGER = LoggerFactory.getLogger(NotificationDispatcher.class);

  private static final String QUEUE_CAPACITY_CONFIG = "queueCapacity";
  private static final String DISPATCH_THREADS_CONFIG = "dispatchThreads";
  private static final int DEFAULT_QUEUE_CAPACITY = 1000;
  private static final int DEFAULT_DISPATCH_THREADS = 4;
  static final String DELIVERY_COUNTER = "metricwatch.anomaly.notification.delivery";
  static final String OUTCOME_DELIVERED = "delivered";
  static final String OUTCOME_FAILED = "failed";
  static final String OUTCOME_DROPPED = "dropped";

  private final Map<String, NotificationChannel> channels = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> deliveryCounters = new ConcurrentHashMap<>();
  private final MeterRegistry meterRegistry;
  private final ThreadPoolExecutor executor;

  public NotificationDispatcher(Config notificationConfig, MeterRegistry meterRegistry) {
    this(
        notificationConfig.hasPath(DISPATCH_THREADS_CONFIG)
            ? notificationConfig.getInt(DISPATCH_THREADS_CONFIG)
            : DEFAULT_DISPATCH_THREADS,
        notificationConfig.hasPath(QUEUE_CAPACITY_CONFIG)
            ? notificationConfig.getInt(QUEUE_CAPACITY_CONFIG)
            : DEFAULT_QUEUE_CAPACITY,
        meterRegistry);
  }

  public NotificationDispatcher(int threads, int queueCapacity, MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.executor =
        new ThreadPoolExecutor(
            threads,
            threads,
            0L,
            TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(queueCapacity),
            new ThreadFactoryBuilder()
                .setNameFormat("notification-dispatch-%d")
                .setDaemon(true)
                .build(),
            new ThreadPoolExecutor.AbortPolicy());
  }

  public void register(NotificationChannel channel) {
    NotificationChannel previous = channels.put(channel.getChannelId(), channel);
    if (previous != null) {
      LOGGER.warn("Replaced notification channel {}", channel.getChannelId());
    }
  }

  public void registerAll(Collection<? extends NotificationChannel> toRegister) {
    toRegister.forEach(this::register);
  }

  public Optional<NotificationChannel> getChannel(String channelId) {
    return Optional.ofNullable(channels.get(channelId));
  }

  /**
   * Schedules one delivery per channel and returns immediately. The futures complete with each
   * channel's outcome and never complete exceptionally.
   */
  public List<CompletableFuture<DeliveryResult>> dispatch(
      Set<String> channelIds, AlertPayload payload) {
    List<CompletableFuture<DeliveryResult>> results = new ArrayList<>(channelIds.size());
    for (String channelId : channelIds) {
      NotificationChannel channel = channels.get(channelId);
      if (channel == null) {
        LOGGER.error(
            "Delivery failed for alert {}: unknown notification channel {}",
            payload.getAlertId(),
            channelId);
        results.add(
            CompletableFuture.completedFuture(
                record(
                    DeliveryResult.failure(
                        channelId, payload.getAlertId(), "unknown channel " + channelId),
                    OUTCOME_FAILED)));
        continue;
      }
      CompletableFuture<DeliveryResult> future = new CompletableFuture<>();
      try {
        executor.execute(() -> future.complete(deliver(channel, payload)));
      } catch (RejectedExecutionException e) {
        LOGGER.error(
            "Delivery failed for alert {} on channel {}: dispatch queue is full",
            payload.getAlertId(),
            channelId);
        future.complete(
            record(
                DeliveryResult.failure(channelId, payload.getAlertId(), "dispatch queue full"),
                OUTCOME_DROPPED));
      }
      results.add(future);
    }
    return results;
  }

  private DeliveryResult deliver(NotificationChannel channel, AlertPayload payload) {
    DeliveryResult result;
    try {
      result = channel.dispatch(payload);
    } catch (RuntimeException e) {
      LOGGER.error(
          "Channel {} threw while delivering alert {}",
          channel.getChannelId(),
          payload.getAlertId(),
          e);
      result =
          DeliveryResult.failure(channel.getChannelId(), payload.getAlertId(), e.getMessage());
    }
    if (result.isDelivered()) {
      LOGGER.info(
          "Delivered alert {} for metric {} to channel {}",
          payload.getAlertId(),
          payload.getMetricName(),
          channel.getChannelId());
      return record(result, OUTCOME_DELIVERED);
    }
    LOGGER.error(
        "Delivery failed for alert {} on channel {}: {}",
        payload.getAlertId(),
        channel.getChannelId(),
        result.getError());
    return record(result, OUTCOME_FAILED);
  }

  private DeliveryResult record(DeliveryResult result, String outcome) {
    deliveryCounters
        .computeIfAbsent(
            result.getChannelId() + "|" + outcome,
            k ->
                meterRegistry.counter(
                    DELIVERY_COUNTER,
                    Tags.of("channel", result.getChannelId(), "outcome", outcome)))
        .increment();
    return result;
  }

  /** Stops accepting deliveries and waits for queued ones up to the timeout. */
  public void shutdown(Duration timeout) {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        List<Runnable> abandoned = executor.shutdownNow();
        LOGGER.warn("Abandoned {} pending notification deliveries on shutdown", abandoned.size());
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
