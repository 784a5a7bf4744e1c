package org.metricwatch.anomaly.datamodel;

import java.time.Instant;
import lombok.Value;

@Value
public class DeliveryResult {
  String channelId;
  String alertId;
  boolean delivered;
  String error;
  Instant attemptedAt;

  public static DeliveryResult success(String channelId, String alertId) {
    return new DeliveryResult(channelId, alertId, true, null, Instant.now());
  }

  public static DeliveryResult failure(String channelId, String alertId, String error) {
    return new DeliveryResult(channelId, alertId, false, error, Instant.now());
  }
}
