package org.metricwatch.anomaly.detector.evaluator;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.metricwatch.anomaly.datamodel.Algorithm;
import org.metricwatch.anomaly.datamodel.AnomalyType;
import org.metricwatch.anomaly.datamodel.Baseline;
import org.metricwatch.anomaly.datamodel.Severity;

/** An anomaly the ensemble wants to raise, before the cooldown gate and persistence. */
@Builder
@Getter
@ToString
public class AnomalyCandidate {
  private final String metricName;
  private final Instant timestamp;
  private final double observedValue;
  private final double expectedValue;
  private final Baseline baseline;
  private final double deviationPercent;
  private final AnomalyType anomalyType;
  private final Severity severity;
  private final Set<Algorithm> firingAlgorithms;
  private final List<Verdict> verdicts;
  private final String description;
}
