package org.metricwatch.anomaly.detector.evaluator;

import org.metricwatch.anomaly.datamodel.DetectionConfigValidator;

/** Maps the 1-10 sensitivity dial linearly onto a detector's threshold range. */
public class SensitivityScale {

  private SensitivityScale() {}

  public static double interpolate(int sensitivity, double atLowest, double atHighest) {
    int clamped =
        Math.max(
            DetectionConfigValidator.MIN_SENSITIVITY,
            Math.min(DetectionConfigValidator.MAX_SENSITIVITY, sensitivity));
    double position =
        (double) (clamped - DetectionConfigValidator.MIN_SENSITIVITY)
            / (DetectionConfigValidator.MAX_SENSITIVITY - DetectionConfigValidator.MIN_SENSITIVITY);
    return atLowest + position * (atHighest - atLowest);
  }
}
