package org.metricwatch.anomaly.datamodel;

import java.time.Instant;
import java.util.Set;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** Filters for alert lookups. Unset filters match everything. */
@Value
@Builder(toBuilder = true)
public class AlertQuery {
  public static final int DEFAULT_LIMIT = 100;

  String metricName;
  Severity severity;
  AnomalyType anomalyType;
  @Singular Set<AlertStatus> statuses;
  Instant createdFrom;
  Instant createdTo;
  @Builder.Default int offset = 0;
  @Builder.Default int limit = DEFAULT_LIMIT;

  public static AlertQuery all() {
    return AlertQuery.builder().limit(Integer.MAX_VALUE).build();
  }

  public boolean matches(AnomalyAlert alert) {
    if (metricName != null && !metricName.equals(alert.getMetricName())) {
      return false;
    }
    if (severity != null && severity != alert.getSeverity()) {
      return false;
    }
    if (anomalyType != null && anomalyType != alert.getAnomalyType()) {
      return false;
    }
    if (!statuses.isEmpty() && !statuses.contains(alert.getStatus())) {
      return false;
    }
    if (createdFrom != null && alert.getCreatedAt().isBefore(createdFrom)) {
      return false;
    }
    return createdTo == null || !alert.getCreatedAt().isAfter(createdTo);
  }
}
