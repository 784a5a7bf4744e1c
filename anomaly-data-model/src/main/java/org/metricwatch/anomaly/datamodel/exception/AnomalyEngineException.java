package org.metricwatch.anomaly.datamodel.exception;

/** Root of the typed failures raised by the detection and alerting engine. */
public class AnomalyEngineException extends RuntimeException {

  public AnomalyEngineException(String message) {
    super(message);
  }

  public AnomalyEngineException(String message, Throwable cause) {
    super(message, cause);
  }
}
