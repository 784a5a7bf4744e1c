package org.metricwatch.anomaly.notification.service.channel;

import org.metricwatch.anomaly.datamodel.AlertPayload;
import org.metricwatch.anomaly.datamodel.DeliveryResult;

/**
 * A dispatch target for alert payloads. Implementations must not throw: every outcome, including
 * transport errors, is reported through the returned {@link DeliveryResult}.
 */
public interface NotificationChannel {

  String getChannelId();

  DeliveryResult dispatch(AlertPayload payload);
}
