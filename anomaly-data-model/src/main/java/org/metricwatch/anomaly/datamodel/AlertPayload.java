package org.metricwatch.anomaly.datamodel;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** What a notification channel receives for one alert. */
@Value
@Builder
public class AlertPayload {
  String alertId;
  String metricName;
  double observedValue;
  double deviationPercent;
  Severity severity;
  AnomalyType anomalyType;
  Instant timestamp;
  String description;
  String reference;
}
