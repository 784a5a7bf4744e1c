package org.metricwatch.anomaly.datamodel;

import java.util.ArrayList;
import java.util.List;
import org.metricwatch.anomaly.datamodel.exception.InvalidDetectionConfigException;

public class DetectionConfigValidator {
  public static final int MIN_SENSITIVITY = 1;
  public static final int MAX_SENSITIVITY = 10;

  private DetectionConfigValidator() {}

  public static void validate(DetectionConfig config) {
    List<String> violations = new ArrayList<>();
    if (config.getMetricName() == null || config.getMetricName().isBlank()) {
      violations.add("metricName must not be blank");
    }
    if (config.getSensitivity() < MIN_SENSITIVITY || config.getSensitivity() > MAX_SENSITIVITY) {
      violations.add(
          String.format(
              "sensitivity must be within [%d, %d], got %d",
              MIN_SENSITIVITY, MAX_SENSITIVITY, config.getSensitivity()));
    }
    if (config.isEnabled() && config.getAlgorithms().isEmpty()) {
      violations.add("algorithms must not be empty when enabled");
    }
    if (config.getCooldownSeconds() < 0) {
      violations.add("cooldownSeconds must not be negative");
    }
    Thresholds thresholds = config.getThresholds();
    if (thresholds != null
        && thresholds.getMin() != null
        && thresholds.getMax() != null
        && thresholds.getMin() > thresholds.getMax()) {
      violations.add("thresholds.min must not exceed thresholds.max");
    }
    if (!violations.isEmpty()) {
      throw new InvalidDetectionConfigException(config.getMetricName(), violations);
    }
  }
}
