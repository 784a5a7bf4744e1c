package org.metricwatch.anomaly.datamodel.exception;

import lombok.Getter;

@Getter
public class MetricStoreUnavailableException extends AnomalyEngineException {
  private final String metricName;

  public MetricStoreUnavailableException(String metricName, String message) {
    super(message);
    this.metricName = metricName;
  }

  public MetricStoreUnavailableException(String metricName, String message, Throwable cause) {
    super(message, cause);
    this.metricName = metricName;
  }
}
