package org.metricwatch.anomaly.notification.transport.webhook.slack;

/** An interactive element placed in a block. */
public interface Element {
  String getType();
}
