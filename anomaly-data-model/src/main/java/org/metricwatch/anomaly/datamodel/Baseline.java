package org.metricwatch.anomaly.datamodel;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class Baseline {
  String metricName;
  double mean;
  double stddev;
  double q1;
  double q3;
  double median;
  double mad;
  int sampleCount;
  Instant windowStart;
  Instant windowEnd;

  @JsonIgnore
  public double getIqr() {
    return q3 - q1;
  }
}
