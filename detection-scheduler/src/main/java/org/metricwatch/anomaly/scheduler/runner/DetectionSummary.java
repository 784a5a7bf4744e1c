package org.metricwatch.anomaly.scheduler.runner;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** Bookkeeping of one detection tick. */
@Value
@Builder
public class DetectionSummary {
  Instant startedAt;
  Instant finishedAt;
  int metricsConfigured;
  int metricsEvaluated;
  int metricsSkipped;
  int candidates;
  int alertsCreated;
  int suppressed;
  boolean halted;
  String haltReason;
}
