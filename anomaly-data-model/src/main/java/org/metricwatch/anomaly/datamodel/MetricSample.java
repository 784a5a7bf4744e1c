package org.metricwatch.anomaly.datamodel;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class MetricSample {
  String metricName;
  Instant timestamp;
  double value;

  public static MetricSample of(String metricName, Instant timestamp, double value) {
    return new MetricSample(metricName, timestamp, value);
  }
}
