package org.metricwatch.anomaly.notification.service.channel;

import lombok.Getter;
import org.metricwatch.anomaly.datamodel.AlertPayload;
import org.metricwatch.anomaly.datamodel.DeliveryResult;
import org.metricwatch.anomaly.notification.service.message.AlertWebhookEvent;
import org.metricwatch.anomaly.notification.transport.webhook.WebhookSendResult;
import org.metricwatch.anomaly.notification.transport.webhook.WebhookSender;

/** Posts the alert as a flat JSON document to a generic webhook. */
@Getter
public class WebhookNotificationChannel implements NotificationChannel {
  private final String channelId;
  private final String url;
  private final WebhookSender webhookSender;

  public WebhookNotificationChannel(String channelId, String url, WebhookSender webhookSender) {
    this.channelId = channelId;
    this.url = url;
    this.webhookSender = webhookSender;
  }

  @Override
  public DeliveryResult dispatch(AlertPayload payload) {
    WebhookSendResult result = webhookSender.send(url, AlertWebhookEvent.from(payload));
    return result.isDelivered()
        ? DeliveryResult.success(channelId, payload.getAlertId())
        : DeliveryResult.failure(channelId, payload.getAlertId(), result.getError());
  }
}
