package org.metricwatch.anomaly.detector.evaluator;

import org.metricwatch.anomaly.datamodel.Algorithm;
import org.metricwatch.anomaly.datamodel.Baseline;
import org.metricwatch.anomaly.datamodel.Thresholds;

/** Static bounds check. Ignores the baseline and the sensitivity. */
public class ThresholdBreachDetector implements Detector {
  private static final double EPSILON = 1e-9;

  private final Thresholds thresholds;

  public ThresholdBreachDetector(Thresholds thresholds) {
    this.thresholds = thresholds;
  }

  @Override
  public Algorithm getAlgorithm() {
    return Algorithm.THRESHOLD;
  }

  @Override
  public Verdict evaluate(double value, Baseline baseline, int sensitivity) {
    if (thresholds.isBelowMin(value)) {
      return breach(
          value,
          thresholds.getMin(),
          String.format("Value %s below minimum threshold %s", value, thresholds.getMin()));
    }
    if (thresholds.isAboveMax(value)) {
      return breach(
          value,
          thresholds.getMax(),
          String.format("Value %s above maximum threshold %s", value, thresholds.getMax()));
    }
    return Verdict.noFire(getAlgorithm(), value, "Within configured bounds");
  }

  private Verdict breach(double value, double bound, String description) {
    double distance = value - bound;
    return Verdict.builder()
        .algorithm(getAlgorithm())
        .fired(true)
        .score(distance)
        .normalizedDeviation(1 + Math.abs(distance) / Math.max(Math.abs(bound), EPSILON))
        .threshold(bound)
        .expectedValue(bound)
        .description(description)
        .build();
  }
}
