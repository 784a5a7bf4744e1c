package org.metricwatch.anomaly.datamodel.exception;

import lombok.Getter;

@Getter
public class AlertNotFoundException extends AnomalyEngineException {
  private final String alertId;

  public AlertNotFoundException(String alertId) {
    super(String.format("Alert %s not found", alertId));
    this.alertId = alertId;
  }
}
