package org.metricwatch.anomaly.detector.evaluator;

import org.metricwatch.anomaly.datamodel.Algorithm;
import org.metricwatch.anomaly.datamodel.Baseline;

/** Modified z-score of Iglewicz and Hoaglin. */
public class MadDetector implements Detector {
  static final double CONSISTENCY_CONSTANT = 0.6745;
  static final double THRESHOLD_AT_LOWEST_SENSITIVITY = 3.5;
  static final double THRESHOLD_AT_HIGHEST_SENSITIVITY = 2.5;

  @Override
  public Algorithm getAlgorithm() {
    return Algorithm.MAD;
  }

  @Override
  public Verdict evaluate(double value, Baseline baseline, int sensitivity) {
    if (baseline.getMad() == 0) {
      return Verdict.noFire(getAlgorithm(), baseline.getMedian(), "No median absolute deviation");
    }
    double threshold =
        SensitivityScale.interpolate(
            sensitivity, THRESHOLD_AT_LOWEST_SENSITIVITY, THRESHOLD_AT_HIGHEST_SENSITIVITY);
    double modifiedZScore =
        CONSISTENCY_CONSTANT * (value - baseline.getMedian()) / baseline.getMad();
    return Verdict.builder()
        .algorithm(getAlgorithm())
        .fired(Math.abs(modifiedZScore) >= threshold)
        .score(modifiedZScore)
        .normalizedDeviation(Math.abs(modifiedZScore) / threshold)
        .threshold(threshold)
        .expectedValue(baseline.getMedian())
        .description(
            String.format("Modified Z-score: %.2f, threshold: %.2f", modifiedZScore, threshold))
        .build();
  }
}
