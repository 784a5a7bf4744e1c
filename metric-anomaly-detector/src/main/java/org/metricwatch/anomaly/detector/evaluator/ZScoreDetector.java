package org.metricwatch.anomaly.detector.evaluator;

import org.metricwatch.anomaly.datamodel.Algorithm;
import org.metricwatch.anomaly.datamodel.Baseline;

public class ZScoreDetector implements Detector {
  static final double THRESHOLD_AT_LOWEST_SENSITIVITY = 3.0;
  static final double THRESHOLD_AT_HIGHEST_SENSITIVITY = 1.5;

  @Override
  public Algorithm getAlgorithm() {
    return Algorithm.ZSCORE;
  }

  @Override
  public Verdict evaluate(double value, Baseline baseline, int sensitivity) {
    if (baseline.getStddev() == 0) {
      return Verdict.noFire(getAlgorithm(), baseline.getMean(), "No variance in baseline");
    }
    double threshold =
        SensitivityScale.interpolate(
            sensitivity, THRESHOLD_AT_LOWEST_SENSITIVITY, THRESHOLD_AT_HIGHEST_SENSITIVITY);
    double zScore = (value - baseline.getMean()) / baseline.getStddev();
    return Verdict.builder()
        .algorithm(getAlgorithm())
        .fired(Math.abs(zScore) >= threshold)
        .score(zScore)
        .normalizedDeviation(Math.abs(zScore) / threshold)
        .threshold(threshold)
        .expectedValue(baseline.getMean())
        .description(String.format("Z-score: %.2f, threshold: %.2f", zScore, threshold))
        .build();
  }
}
