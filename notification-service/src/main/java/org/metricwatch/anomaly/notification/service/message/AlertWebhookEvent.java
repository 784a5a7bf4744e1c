package org.metricwatch.anomaly.notification.service.message;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;
import org.metricwatch.anomaly.datamodel.AlertPayload;

@Builder
@Getter
public class AlertWebhookEvent {
  public static final String EVENT_TYPE = "MetricAnomalyDetected";

  private final String eventType;
  private final String alertId;
  private final String metricName;
  private final double observedValue;
  private final double deviationPercent;
  private final String severity;
  private final String anomalyType;
  private final String description;
  private final String reference;
  private final Instant violationTimestamp;
  private final Instant eventTimestamp;

  public static AlertWebhookEvent from(AlertPayload payload) {
    return AlertWebhookEvent.builder()
        .eventType(EVENT_TYPE)
        .alertId(payload.getAlertId())
        .metricName(payload.getMetricName())
        .observedValue(payload.getObservedValue())
        .deviationPercent(payload.getDeviationPercent())
        .severity(payload.getSeverity().getWireName())
        .anomalyType(payload.getAnomalyType().getWireName())
        .description(payload.getDescription())
        .reference(payload.getReference())
        .violationTimestamp(payload.getTimestamp())
        .eventTimestamp(Instant.now())
        .build();
  }
}
