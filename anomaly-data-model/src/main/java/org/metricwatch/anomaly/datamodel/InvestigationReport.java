package org.metricwatch.anomaly.datamodel;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class InvestigationReport {
  AnomalyAlert alert;
  Instant windowStart;
  Instant windowEnd;
  List<MetricSample> historicalSeries;
  List<AnomalyAlert> similarPastAlerts;
  Map<String, Double> correlatedMetricsSnapshot;
  List<TimelineEntry> statusTimeline;
}
