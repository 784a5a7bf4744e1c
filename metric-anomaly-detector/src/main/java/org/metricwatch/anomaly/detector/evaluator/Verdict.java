package org.metricwatch.anomaly.detector.evaluator;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.metricwatch.anomaly.datamodel.Algorithm;

/**
 * Outcome of one detector. {@code score} is the detector's raw statistic and {@code
 * normalizedDeviation} is its magnitude relative to the firing threshold, so fired verdicts from
 * different detectors are comparable.
 */
@Builder
@Getter
@ToString
public class Verdict {
  private final Algorithm algorithm;
  private final boolean fired;
  private final double score;
  private final double normalizedDeviation;
  private final double threshold;
  private final double expectedValue;
  private final String description;

  static Verdict noFire(Algorithm algorithm, double expectedValue, String description) {
    return Verdict.builder()
        .algorithm(algorithm)
        .fired(false)
        .expectedValue(expectedValue)
        .description(description)
        .build();
  }
}
