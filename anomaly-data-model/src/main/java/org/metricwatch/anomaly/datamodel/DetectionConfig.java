package org.metricwatch.anomaly.datamodel;

import java.util.Set;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class DetectionConfig {
  public static final long DEFAULT_COOLDOWN_SECONDS = 900;

  String metricName;
  @Builder.Default boolean enabled = true;
  int sensitivity;
  @Singular Set<Algorithm> algorithms;
  Thresholds thresholds;
  @Singular Set<String> alertChannels;
  @Builder.Default long cooldownSeconds = DEFAULT_COOLDOWN_SECONDS;

  public boolean hasThresholds() {
    return thresholds != null && thresholds.hasBounds();
  }
}
