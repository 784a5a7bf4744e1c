package org.metricwatch.anomaly.notification.service.channel;

import lombok.Getter;
import org.metricwatch.anomaly.datamodel.AlertPayload;
import org.metricwatch.anomaly.datamodel.DeliveryResult;
import org.metricwatch.anomaly.notification.service.message.AlertSlackMessage;
import org.metricwatch.anomaly.notification.transport.webhook.WebhookSendResult;
import org.metricwatch.anomaly.notification.transport.webhook.WebhookSender;

/** Posts a block-kit formatted message to a chat incoming webhook. */
@Getter
public class SlackNotificationChannel implements NotificationChannel {
  private final String channelId;
  private final String url;
  private final WebhookSender webhookSender;

  public SlackNotificationChannel(String channelId, String url, WebhookSender webhookSender) {
    this.channelId = channelId;
    this.url = url;
    this.webhookSender = webhookSender;
  }

  @Override
  public DeliveryResult dispatch(AlertPayload payload) {
    WebhookSendResult result = webhookSender.send(url, AlertSlackMessage.from(payload));
    return result.isDelivered()
        ? DeliveryResult.success(channelId, payload.getAlertId())
        : DeliveryResult.failure(channelId, payload.getAlertId(), result.getError());
  }
}
