package org.metricwatch.anomaly.datamodel;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Static bounds for a metric. Either side may be absent. */
@Value
@Builder
@Jacksonized
public class Thresholds {
  Double min;
  Double max;

  public boolean hasBounds() {
    return min != null || max != null;
  }

  public boolean isBelowMin(double value) {
    return min != null && value < min;
  }

  public boolean isAboveMax(double value) {
    return max != null && value > max;
  }
}
