package org.metricwatch.anomaly.datamodel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

public enum AnomalyType {
  SPIKE("spike"),
  DROP("drop"),
  OUTLIER("outlier"),
  THRESHOLD_BREACH("threshold_breach"),
  // reserved for sequence-level detectors, not produced by the ensemble
  TREND_CHANGE("trend_change"),
  PATTERN_BREAK("pattern_break");

  private final String wireName;

  AnomalyType(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String getWireName() {
    return wireName;
  }

  @JsonCreator
  public static AnomalyType fromWireName(String name) {
    return Arrays.stream(values())
        .filter(type -> type.wireName.equalsIgnoreCase(name))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown anomaly type: " + name));
  }
}
