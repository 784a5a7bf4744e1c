package org.metricwatch.anomaly.datamodel;

import com.fasterxml.jackson.annotation.JsonValue;

/** Alert lifecycle: active -> acknowledged -> resolved, or active -> resolved. */
public enum AlertStatus {
  ACTIVE("active"),
  ACKNOWLEDGED("acknowledged"),
  RESOLVED("resolved");

  private final String wireName;

  AlertStatus(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String getWireName() {
    return wireName;
  }

  public boolean canTransitionTo(AlertStatus target) {
    switch (this) {
      case ACTIVE:
        return target == ACKNOWLEDGED || target == RESOLVED;
      case ACKNOWLEDGED:
        return target == RESOLVED;
      case RESOLVED:
      default:
        return false;
    }
  }
}
