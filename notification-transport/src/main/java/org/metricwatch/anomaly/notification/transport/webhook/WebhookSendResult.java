package org.metricwatch.anomaly.notification.transport.webhook;

import lombok.Value;

@Value
public class WebhookSendResult {
  boolean delivered;
  String error;

  static WebhookSendResult delivered() {
    return new WebhookSendResult(true, null);
  }

  static WebhookSendResult failed(String error) {
    return new WebhookSendResult(false, error);
  }
}
