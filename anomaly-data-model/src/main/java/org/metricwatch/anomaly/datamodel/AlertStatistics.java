package org.metricwatch.anomaly.datamodel;

import java.util.Map;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AlertStatistics {
  long total;
  Map<Severity, Long> bySeverity;
  Map<AnomalyType, Long> byType;
  Map<String, Long> byMetric;
  long resolved;
  long unresolved;
  double averageResolutionMinutes;
}
