package org.metricwatch.anomaly.datamodel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/** Detection strategies that can be enabled per metric. */
public enum Algorithm {
  ZSCORE("zscore"),
  IQR("iqr"),
  MAD("mad"),
  ISOLATION("isolation"),
  THRESHOLD("threshold");

  private static final String ISOLATION_FOREST_ALIAS = "isolation_forest";

  private final String wireName;

  Algorithm(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String getWireName() {
    return wireName;
  }

  @JsonCreator
  public static Algorithm fromWireName(String name) {
    if (ISOLATION_FOREST_ALIAS.equalsIgnoreCase(name)) {
      return ISOLATION;
    }
    return Arrays.stream(values())
        .filter(algorithm -> algorithm.wireName.equalsIgnoreCase(name))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown algorithm: " + name));
  }
}
