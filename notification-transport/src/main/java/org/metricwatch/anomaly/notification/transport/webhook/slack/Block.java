package org.metricwatch.anomaly.notification.transport.webhook.slack;

/** A Slack layout block. */
public interface Block {
  String getType();
}
