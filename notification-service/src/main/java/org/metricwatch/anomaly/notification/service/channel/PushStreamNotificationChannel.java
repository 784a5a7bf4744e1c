package org.metricwatch.anomaly.notification.service.channel;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.metricwatch.anomaly.datamodel.AlertPayload;
import org.metricwatch.anomaly.datamodel.DeliveryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process fan-out to subscribed listeners, e.g. a live dashboard feed. A payload counts as
 * delivered only when every listener accepted it.
 */
public class PushStreamNotificationChannel implements NotificationChannel {
  private static final Logger LOGGER = LoggerFactory.getLogger(PushStreamNotificationChannel.class);

  private final String channelId;
  private final List<Consumer<AlertPayload>> subscribers = new CopyOnWriteArrayList<>();

  public PushStreamNotificationChannel(String channelId) {
    this.channelId = channelId;
  }

  @Override
  public String getChannelId() {
    return channelId;
  }

  /** Returns a handle that removes the subscription when run. */
  public Runnable subscribe(Consumer<AlertPayload> subscriber) {
    subscribers.add(subscriber);
    return () -> subscribers.remove(subscriber);
  }

  public int getSubscriberCount() {
    return subscribers.size();
  }

  @Override
  public DeliveryResult dispatch(AlertPayload payload) {
    int failures = 0;
    for (Consumer<AlertPayload> subscriber : subscribers) {
      try {
        subscriber.accept(payload);
      } catch (RuntimeException e) {
        failures++;
        LOGGER.warn(
            "Push stream subscriber on channel {} rejected alert {}",
            channelId,
            payload.getAlertId(),
            e);
      }
    }
    if (failures > 0) {
      return DeliveryResult.failure(
          channelId,
          payload.getAlertId(),
          String.format("%d of %d subscribers failed", failures, subscribers.size()));
    }
    return DeliveryResult.success(channelId, payload.getAlertId());
  }
}
