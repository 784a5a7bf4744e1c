package org.metricwatch.anomaly.datamodel.exception;

public class AlertStoreUnavailableException extends AnomalyEngineException {

  public AlertStoreUnavailableException(String message) {
    super(message);
  }

  public AlertStoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
