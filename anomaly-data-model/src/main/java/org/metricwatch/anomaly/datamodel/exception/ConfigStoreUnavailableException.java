package org.metricwatch.anomaly.datamodel.exception;

public class ConfigStoreUnavailableException extends AnomalyEngineException {

  public ConfigStoreUnavailableException(String message) {
    super(message);
  }

  public ConfigStoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
