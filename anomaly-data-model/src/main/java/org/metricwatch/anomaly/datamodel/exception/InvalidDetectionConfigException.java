package org.metricwatch.anomaly.datamodel.exception;

import java.util.List;
import lombok.Getter;

@Getter
public class InvalidDetectionConfigException extends AnomalyEngineException {
  private final String metricName;
  private final List<String> violations;

  public InvalidDetectionConfigException(String metricName, List<String> violations) {
    super(String.format("Invalid detection config for metric %s: %s", metricName, violations));
    this.metricName = metricName;
    this.violations = List.copyOf(violations);
  }
}
