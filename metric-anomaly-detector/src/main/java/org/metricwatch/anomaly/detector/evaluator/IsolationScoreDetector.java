package org.metricwatch.anomaly.detector.evaluator;

import org.metricwatch.anomaly.datamodel.Algorithm;
import org.metricwatch.anomaly.datamodel.Baseline;

/**
 * Distance from the mean in units of three standard deviations, capped at 1. A cheap stand-in
 * for an isolation forest over a single dimension.
 */
public class IsolationScoreDetector implements Detector {
  static final double THRESHOLD_AT_LOWEST_SENSITIVITY = 0.7;
  static final double THRESHOLD_AT_HIGHEST_SENSITIVITY = 0.4;
  private static final double MAX_SCORE = 1.0;

  @Override
  public Algorithm getAlgorithm() {
    return Algorithm.ISOLATION;
  }

  @Override
  public Verdict evaluate(double value, Baseline baseline, int sensitivity) {
    if (baseline.getStddev() == 0) {
      return Verdict.noFire(getAlgorithm(), baseline.getMean(), "No variance in baseline");
    }
    double threshold =
        SensitivityScale.interpolate(
            sensitivity, THRESHOLD_AT_LOWEST_SENSITIVITY, THRESHOLD_AT_HIGHEST_SENSITIVITY);
    double score =
        Math.min(MAX_SCORE, Math.abs(value - baseline.getMean()) / (3 * baseline.getStddev()));
    return Verdict.builder()
        .algorithm(getAlgorithm())
        .fired(score >= threshold)
        .score(score)
        .normalizedDeviation(score / threshold)
        .threshold(threshold)
        .expectedValue(baseline.getMean())
        .description(String.format("Isolation score: %.2f, threshold: %.2f", score, threshold))
        .build();
  }
}
