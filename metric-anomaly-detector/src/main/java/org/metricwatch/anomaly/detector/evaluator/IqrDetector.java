package org.metricwatch.anomaly.detector.evaluator;

import org.metricwatch.anomaly.datamodel.Algorithm;
import org.metricwatch.anomaly.datamodel.Baseline;

/** Tukey fences: fires outside {@code [q1 - k*iqr, q3 + k*iqr]}. */
public class IqrDetector implements Detector {
  static final double MULTIPLIER_AT_LOWEST_SENSITIVITY = 3.0;
  static final double MULTIPLIER_AT_HIGHEST_SENSITIVITY = 1.5;

  @Override
  public Algorithm getAlgorithm() {
    return Algorithm.IQR;
  }

  @Override
  public Verdict evaluate(double value, Baseline baseline, int sensitivity) {
    double iqr = baseline.getIqr();
    if (iqr == 0) {
      return Verdict.noFire(getAlgorithm(), baseline.getMedian(), "No interquartile range");
    }
    double multiplier =
        SensitivityScale.interpolate(
            sensitivity, MULTIPLIER_AT_LOWEST_SENSITIVITY, MULTIPLIER_AT_HIGHEST_SENSITIVITY);
    double lowerBound = baseline.getQ1() - multiplier * iqr;
    double upperBound = baseline.getQ3() + multiplier * iqr;

    // distance from the nearest quartile, in units of iqr
    double score;
    if (value > baseline.getQ3()) {
      score = (value - baseline.getQ3()) / iqr;
    } else if (value < baseline.getQ1()) {
      score = (value - baseline.getQ1()) / iqr;
    } else {
      score = 0;
    }

    return Verdict.builder()
        .algorithm(getAlgorithm())
        .fired(value < lowerBound || value > upperBound)
        .score(score)
        .normalizedDeviation(Math.abs(score) / multiplier)
        .threshold(multiplier)
        .expectedValue(baseline.getMedian())
        .description(String.format("IQR bounds: [%.2f, %.2f]", lowerBound, upperBound))
        .build();
  }
}
