package org.metricwatch.anomaly.datamodel;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A persisted anomaly. Instances are immutable; lifecycle changes produce a copy with an
 * incremented {@code version}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AnomalyAlert {
  String id;
  String metricName;
  double observedValue;
  double expectedValue;
  Baseline baseline;
  double deviationPercent;
  AnomalyType anomalyType;
  Severity severity;
  @Singular Set<Algorithm> firingAlgorithms;
  String description;
  AlertStatus status;
  String acknowledgedBy;
  Instant acknowledgedAt;
  Instant resolvedAt;
  String resolutionNotes;
  Instant createdAt;
  Instant updatedAt;
  long version;
  @Singular List<StatusTransition> transitions;
}
